package com.trialguard.dto;

import com.trialguard.model.AiVerdict;
import com.trialguard.model.GuardrailVerdict;
import com.trialguard.model.OverrideStatus;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;
import com.trialguard.model.ValidationOutcome;
import lombok.*;

import java.util.List;

public class MatchDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MatchRequest {
        private String patientText;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private boolean success;
        private PatientProfile profile;
        private ValidationOutcome profileValidation;
        private ValidationOutcome trialValidation;
        private List<TrialMatch> matches;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrialMatch {
        private TrialRecord trial;
        private AiVerdict assessment;
        private GuardrailVerdict guardrail;
        private int finalScore;
        private OverrideStatus finalStatus;
        private int rank;
    }
}
