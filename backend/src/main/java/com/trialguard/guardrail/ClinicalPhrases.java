package com.trialguard.guardrail;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword lists the guardrails scan for. All phrases are lower-case and are
 * matched as substrings of a lower-cased corpus.
 */
public final class ClinicalPhrases {

    public static final List<String> HER2_POSITIVE = List.of("her2+", "her2-positive", "her2 positive");
    public static final List<String> HER2_NEGATIVE = List.of("her2-negative", "her2 negative", "triple negative", "tnbc");
    public static final String HER2_LOW = "her2-low";

    static final Pattern HER2_POSITIVE_WORDS = Pattern.compile("\\bher2\\s*positive\\b");
    static final Pattern HER2_NEGATIVE_WORDS = Pattern.compile("\\bher2\\s*negative\\b");

    public static final List<String> TNBC = List.of("triple negative", "tnbc");

    public static final List<String> METASTATIC_TRIAL = List.of("metastatic", "stage iv", "advanced");
    public static final List<String> EARLY_STAGE_TRIAL = List.of("early", "adjuvant", "neoadjuvant");

    public static final List<String> REQUIRES_PRIOR_TRASTUZUMAB = List.of("prior trastuzumab", "previous trastuzumab");
    public static final List<String> REQUIRES_PRIOR_TAXANE = List.of("prior taxane", "previous taxane");
    public static final List<String> EXCLUDES_PRIOR_TDM1 = List.of("t-dm1", "trastuzumab emtansine");

    public static final List<String> TRASTUZUMAB = List.of("trastuzumab", "herceptin");
    public static final List<String> TAXANE = List.of("taxane", "paclitaxel", "docetaxel");
    public static final List<String> TDM1 = List.of("t-dm1", "kadcyla", "trastuzumab emtansine");

    public static final List<String> ECOG_0_TO_1 = List.of("ecog 0-1", "ecog performance status 0-1");

    public static final List<String> EXCLUDES_BRAIN_METS = List.of("brain metastases", "cns metastases");
    public static final List<String> BRAIN_METS_CONDITION = List.of("brain met", "cns met", "cranial");
    public static final List<String> BRAIN_TREATMENT = List.of("brain", "cranial");

    public static final Pattern ECOG_SCORE = Pattern.compile("ECOG\\s*(\\d)", Pattern.CASE_INSENSITIVE);

    private ClinicalPhrases() {
    }

    public static boolean containsAny(String text, List<String> phrases) {
        if (text == null) {
            return false;
        }
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public static boolean mentionsHer2Positive(String text) {
        return containsAny(text, HER2_POSITIVE) || (text != null && HER2_POSITIVE_WORDS.matcher(text).find());
    }

    public static boolean mentionsHer2Negative(String text) {
        return containsAny(text, HER2_NEGATIVE) || (text != null && HER2_NEGATIVE_WORDS.matcher(text).find());
    }

    /**
     * Space-joined, lower-cased concatenation; null entries are skipped.
     */
    public static String corpus(Collection<String> parts) {
        return parts.stream()
            .filter(Objects::nonNull)
            .map(p -> p.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" "));
    }

    public static boolean anyContains(Collection<String> values, List<String> phrases) {
        return values.stream()
            .filter(Objects::nonNull)
            .map(v -> v.toLowerCase(Locale.ROOT))
            .anyMatch(v -> containsAny(v, phrases));
    }
}
