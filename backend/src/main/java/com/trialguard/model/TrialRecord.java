package com.trialguard.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A clinical trial as supplied by the trial-catalog collaborator.
 *
 * Phase and cancer type stay as received so malformed values can be
 * reported by {@link com.trialguard.validation.TrialRecordValidator}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrialRecord {

    String nctId;
    String title;
    String phase;
    String briefSummary;
    List<String> inclusionCriteria;
    List<String> exclusionCriteria;
    String cancerType;
    MatchType matchType;
    int matchScore;

    public List<String> getInclusionCriteria() {
        return inclusionCriteria == null ? List.of() : inclusionCriteria;
    }

    public List<String> getExclusionCriteria() {
        return exclusionCriteria == null ? List.of() : exclusionCriteria;
    }
}
