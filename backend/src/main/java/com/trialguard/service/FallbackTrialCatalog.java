package com.trialguard.service;

import com.trialguard.model.MatchType;
import com.trialguard.model.TrialRecord;

import java.util.List;

/**
 * Built-in HER2+ breast cancer trials served when trial generation is unavailable.
 */
final class FallbackTrialCatalog {

    private static final List<TrialRecord> TRIALS = List.of(
        TrialRecord.builder()
            .nctId("NCT05123456")
            .title("Study of Trastuzumab Deruxtecan in HER2+ Breast Cancer After Prior Therapy")
            .phase("Phase 3")
            .briefSummary("Evaluates trastuzumab deruxtecan in patients with HER2-positive breast cancer who "
                + "progressed on prior anti-HER2 therapy. Primary endpoint is progression-free survival.")
            .inclusionCriteria(List.of(
                "Age 18 years or older",
                "HER2-positive breast cancer (IHC 3+ or FISH+)",
                "Stage III or IV disease",
                "Prior trastuzumab allowed and progression documented",
                "ECOG performance status 0-2"))
            .exclusionCriteria(List.of(
                "Active brain metastases requiring immediate treatment",
                "LVEF <50%",
                "Uncontrolled intercurrent illness"))
            .cancerType("breast")
            .matchType(MatchType.PERFECT)
            .matchScore(92)
            .build(),
        TrialRecord.builder()
            .nctId("NCT05234567")
            .title("First-Line Tucatinib Plus Trastuzumab in Treatment-Naive HER2+ Breast Cancer")
            .phase("Phase 2")
            .briefSummary("Investigates tucatinib combination therapy in treatment-naive HER2-positive breast "
                + "cancer patients. Requires no prior systemic anti-HER2 therapy.")
            .inclusionCriteria(List.of(
                "Age 18-75 years",
                "HER2-positive breast cancer",
                "Stage II-IV disease",
                "No prior systemic therapy for breast cancer",
                "ECOG performance status 0-1"))
            .exclusionCriteria(List.of(
                "Prior anti-HER2 therapy (trastuzumab, pertuzumab, etc.)",
                "Prior chemotherapy for breast cancer",
                "Cardiac dysfunction"))
            .cancerType("breast")
            .matchType(MatchType.EXCLUDED)
            .matchScore(20)
            .build(),
        TrialRecord.builder()
            .nctId("NCT05345678")
            .title("Neratinib Maintenance Therapy in High-Risk HER2+ Breast Cancer")
            .phase("Phase 3")
            .briefSummary("Studies neratinib as maintenance therapy after standard treatment in high-risk "
                + "HER2-positive breast cancer. Requires excellent performance status.")
            .inclusionCriteria(List.of(
                "Age 18-70 years",
                "HER2-positive breast cancer",
                "Stage III disease",
                "Completed prior trastuzumab-based therapy",
                "ECOG performance status 0 (fully active)"))
            .exclusionCriteria(List.of(
                "Metastatic disease",
                "Severe diarrhea or GI disorders",
                "Inadequate organ function"))
            .cancerType("breast")
            .matchType(MatchType.UNCERTAIN)
            .matchScore(62)
            .build()
    );

    private FallbackTrialCatalog() {
    }

    static List<TrialRecord> trials() {
        return TRIALS;
    }
}
