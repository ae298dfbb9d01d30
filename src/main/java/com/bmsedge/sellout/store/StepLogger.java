package com.bmsedge.sellout.store;

import java.util.Map;

/**
 * Optional per-stage telemetry. Implementations may throw; callers never let that abort a run.
 */
public interface StepLogger {

    StepLogger NO_OP = (uploadId, step, details) -> { };

    void logStep(String uploadId, String step, Map<String, Object> details);
}
