package com.trialguard.dto;

import com.trialguard.model.AiVerdict;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;
import lombok.*;

public class EligibilityDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EvaluateRequest {
        private PatientProfile profile;
        private TrialRecord trial;
        private AiVerdict verdict;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NormalizeRequest {
        private PatientProfile profile;
        private String rawText;
    }
}
