package com.bmsedge.sellout.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@ConditionalOnProperty(name = "sellout.ingestion.step-logging.enabled", havingValue = "true")
public class Slf4jStepLogger implements StepLogger {

    private static final Logger logger = LoggerFactory.getLogger("sellout.steps");

    @Override
    public void logStep(String uploadId, String step, Map<String, Object> details) {
        logger.info("[{}] {} {}", uploadId, step, details);
    }
}
