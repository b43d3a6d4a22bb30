package com.trialguard.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Errors block trusting a record, warnings only degrade confidence.
 */
@Value
public class ValidationOutcome {

    List<String> errors;
    List<String> warnings;

    public ValidationOutcome(List<String> errors, List<String> warnings) {
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    @JsonProperty("isValid")
    public boolean isValid() {
        return errors.isEmpty();
    }
}
