package com.trialguard.validation;

import com.trialguard.model.CancerType;
import com.trialguard.model.TrialPhase;
import com.trialguard.model.TrialRecord;
import com.trialguard.model.ValidationOutcome;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks over a trial catalog. Messages carry the 1-based position of the record.
 */
@Component
public class TrialRecordValidator {

    private static final Pattern NCT_ID = Pattern.compile("^NCT\\d{8}$");

    public ValidationOutcome validateTrials(List<TrialRecord> trials) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (trials == null) {
            return new ValidationOutcome(errors, warnings);
        }

        for (int i = 0; i < trials.size(); i++) {
            String prefix = "Trial " + (i + 1) + ": ";
            TrialRecord trial = trials.get(i);
            if (trial == null) {
                errors.add(prefix + "Record is missing");
                continue;
            }

            if (trial.getNctId() == null || !NCT_ID.matcher(trial.getNctId()).matches()) {
                errors.add(prefix + "Invalid NCT ID format \"" + trial.getNctId() + "\". Must be NCT + 8 digits");
            }
            if (trial.getTitle() == null || trial.getTitle().length() < 10) {
                errors.add(prefix + "Title missing or too short");
            }
            if (TrialPhase.fromLabel(trial.getPhase()).isEmpty()) {
                errors.add(prefix + "Invalid phase \"" + trial.getPhase() + "\". Must be Phase 1, 2, or 3");
            }
            if (trial.getBriefSummary() == null || trial.getBriefSummary().length() < 20) {
                errors.add(prefix + "Brief summary missing or too short");
            }
            if (trial.getInclusionCriteria().size() < 3) {
                errors.add(prefix + "Must have at least 3 inclusion criteria");
            }
            if (trial.getExclusionCriteria().size() < 2) {
                errors.add(prefix + "Must have at least 2 exclusion criteria");
            }
            if (CancerType.fromCode(trial.getCancerType()).isEmpty()) {
                warnings.add(prefix + "Invalid or missing cancerType \"" + trial.getCancerType() + "\"");
            }
        }

        return new ValidationOutcome(errors, warnings);
    }
}
