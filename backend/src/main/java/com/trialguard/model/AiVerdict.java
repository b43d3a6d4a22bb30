package com.trialguard.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Eligibility assessment returned by the language model for one trial.
 * Treated as untrusted advisory text.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AiVerdict {

    int matchScore;

    @Builder.Default
    ConfidenceLevel confidenceLevel = ConfidenceLevel.LOW;

    List<String> inclusionMatches;
    List<String> exclusionFlags;
    List<String> uncertainFactors;
    String explanation;
    List<String> questionsToAsk;

    /**
     * Verdict used when the assessment collaborator fails or answers garbage.
     */
    public static AiVerdict assessmentFailed() {
        return AiVerdict.builder()
            .matchScore(0)
            .confidenceLevel(ConfidenceLevel.LOW)
            .inclusionMatches(List.of())
            .exclusionFlags(List.of("Unable to assess criteria due to processing error"))
            .uncertainFactors(List.of("All criteria require manual review"))
            .explanation("Assessment failed. Please review trial criteria manually.")
            .questionsToAsk(List.of("Verify all eligibility criteria with trial coordinator"))
            .build();
    }

    public String getExplanation() {
        return explanation == null ? "" : explanation;
    }

    public List<String> getInclusionMatches() {
        return inclusionMatches == null ? List.of() : inclusionMatches;
    }

    public List<String> getExclusionFlags() {
        return exclusionFlags == null ? List.of() : exclusionFlags;
    }

    public List<String> getUncertainFactors() {
        return uncertainFactors == null ? List.of() : uncertainFactors;
    }

    public List<String> getQuestionsToAsk() {
        return questionsToAsk == null ? List.of() : questionsToAsk;
    }
}
