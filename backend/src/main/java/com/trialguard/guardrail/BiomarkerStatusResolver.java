package com.trialguard.guardrail;

import com.trialguard.model.BiomarkerStatus;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Derives a positive/negative/unknown status for a biomarker from free-form values
 * such as "positive", "3+", "HER2-neg" or "IHC 0".
 */
@Component
public class BiomarkerStatusResolver {

    /**
     * Finds the first biomarker whose key contains {@code marker} (case-insensitive)
     * and classifies its value.
     */
    public BiomarkerStatus resolve(Map<String, String> biomarkers, String marker) {
        if (biomarkers == null || marker == null) {
            return BiomarkerStatus.UNKNOWN;
        }
        String needle = marker.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : biomarkers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).contains(needle)) {
                return classify(entry.getValue());
            }
        }
        return BiomarkerStatus.UNKNOWN;
    }

    /**
     * Positive wins over negative when a value carries both markers.
     */
    public BiomarkerStatus classify(String value) {
        if (value == null) {
            return BiomarkerStatus.UNKNOWN;
        }
        String v = value.toLowerCase(Locale.ROOT).trim();
        if (v.contains("positive") || v.contains("+") || v.equals("3+") || v.equals("2+")) {
            return BiomarkerStatus.POSITIVE;
        }
        if (v.contains("negative") || v.contains("-") || v.equals("0") || v.equals("1+")) {
            return BiomarkerStatus.NEGATIVE;
        }
        return BiomarkerStatus.UNKNOWN;
    }
}
