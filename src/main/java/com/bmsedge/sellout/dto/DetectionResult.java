package com.bmsedge.sellout.dto;

import com.bmsedge.sellout.profile.SourceProfile;
import lombok.Value;

@Value
public class DetectionResult {

    SourceProfile profile;

    /** True when no pattern matched and the fallback profile was chosen. */
    boolean lowConfidence;
}
