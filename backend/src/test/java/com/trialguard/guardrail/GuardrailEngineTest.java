package com.trialguard.guardrail;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.trialguard.guardrail.rules.EcogRequirementRule;
import com.trialguard.model.AiVerdict;
import com.trialguard.model.GuardrailVerdict;
import com.trialguard.model.OverrideStatus;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;

/**
 * Unit tests for GuardrailEngine
 *
 * Each rule is exercised on its own, then the interaction between rules
 * under both override policies.
 */
@DisplayName("GuardrailEngine Tests")
class GuardrailEngineTest {

    private GuardrailEngine engine;
    private AiVerdict aiVerdict;

    @BeforeEach
    void setUp() {
        engine = new GuardrailEngine(new BiomarkerStatusResolver(), OverridePolicy.LAST_TRIGGERED);
        aiVerdict = AiVerdict.builder()
                .matchScore(85)
                .explanation("Patient appears to meet the key criteria.")
                .build();
    }

    private PatientProfile.PatientProfileBuilder patient() {
        return PatientProfile.builder()
                .age(52)
                .conditions(List.of("breast cancer"))
                .biomarkers(Map.of("HER2", "positive"))
                .stage("Stage II")
                .performanceStatus("ECOG 0");
    }

    private TrialRecord.TrialRecordBuilder trial() {
        return TrialRecord.builder()
                .nctId("NCT05000001")
                .title("Combination Study in HER2+ Breast Cancer")
                .phase("Phase 2")
                .briefSummary("Evaluates a new combination for patients with HER2-positive disease.")
                .inclusionCriteria(List.of("Age 18 or older", "HER2-positive breast cancer", "Measurable disease"))
                .exclusionCriteria(List.of("Pregnancy", "Uncontrolled infection"))
                .cancerType("breast");
    }

    @Nested
    @DisplayName("No override")
    class NoOverrideTests {

        @Test
        @DisplayName("Should not override when the patient meets every criterion")
        void shouldNotOverrideWhenPatientFullyMatches() {
            TrialRecord trial = trial()
                    .inclusionCriteria(List.of("HER2-positive breast cancer", "Age 18 or older", "ECOG performance status 0-1"))
                    .exclusionCriteria(List.of("Brain metastases", "Pregnancy"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().build(), trial,
                    aiVerdict.toBuilder().explanation("Patient meets the HER2-positive requirement.").build());

            assertFalse(result.isShouldOverride());
            assertNull(result.getOverrideScore());
            assertNull(result.getOverrideStatus());
            assertTrue(result.getFlags().isEmpty());
            assertEquals(GuardrailVerdict.NO_OVERRIDE_REASONING, result.getReasoning());
        }

        @Test
        @DisplayName("Should not throw on missing inputs")
        void shouldNotThrowOnMissingInputs() {
            GuardrailVerdict result = assertDoesNotThrow(() -> engine.applyGuardrails(null, null, null));

            assertFalse(result.isShouldOverride());
            assertEquals(GuardrailVerdict.NO_OVERRIDE_REASONING, result.getReasoning());
        }

        @Test
        @DisplayName("Should not treat HER2-low trials as requiring HER2-negative")
        void shouldIgnoreHer2LowTrials() {
            TrialRecord trial = trial()
                    .title("Antibody Drug Conjugate in HER2-low Breast Cancer")
                    .briefSummary("Studies patients with HER2-low or HER2-negative tumours.")
                    .inclusionCriteria(List.of("HER2-low disease", "Age 18 or older", "Measurable disease"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().biomarkers(Map.of()).build(), trial, aiVerdict);

            assertFalse(result.isShouldOverride());
        }
    }

    @Nested
    @DisplayName("Rule 1 - HER2 requirement")
    class Her2RequirementTests {

        @Test
        @DisplayName("Should exclude HER2-negative patient from HER2-positive trial")
        void shouldExcludeHer2NegativePatientFromHer2PositiveTrial() {
            PatientProfile patient = patient().biomarkers(Map.of("HER2", "negative")).build();

            GuardrailVerdict result = engine.applyGuardrails(patient, trial().build(), aiVerdict);

            assertTrue(result.isShouldOverride());
            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertEquals(15, result.getOverrideScore());
            assertTrue(result.getFlags().contains("HER2 status mismatch: Trial requires HER2+, patient is HER2-"));
        }

        @Test
        @DisplayName("Should mark uncertain when HER2 status is undocumented")
        void shouldMarkUncertainWhenHer2Unknown() {
            PatientProfile patient = patient().biomarkers(Map.of()).build();

            GuardrailVerdict result = engine.applyGuardrails(patient, trial().build(), aiVerdict);

            assertEquals(OverrideStatus.UNCERTAIN, result.getOverrideStatus());
            assertEquals(45, result.getOverrideScore());
            assertTrue(result.getReasoning().startsWith("Uncertain match"));
        }

        @Test
        @DisplayName("Should exclude HER2-positive patient from HER2-negative trial")
        void shouldExcludeHer2PositivePatientFromHer2NegativeTrial() {
            TrialRecord trial = trial()
                    .title("Endocrine Therapy in HER2-Negative Breast Cancer")
                    .briefSummary("Evaluates an oral agent in patients with HER2-negative tumours.")
                    .inclusionCriteria(List.of("HER2-negative breast cancer", "Age 18 or older", "Measurable disease"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().build(), trial, aiVerdict);

            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertEquals(15, result.getOverrideScore());
            assertTrue(result.getFlags().contains("HER2 status mismatch: Trial requires HER2-, patient is HER2+"));
        }

        @Test
        @DisplayName("Should mark uncertain when HER2 status is undocumented for a HER2-negative trial")
        void shouldMarkUncertainWhenHer2UnknownForHer2NegativeTrial() {
            PatientProfile patient = patient().biomarkers(Map.of()).build();
            TrialRecord trial = trial()
                    .title("Endocrine Therapy in HER2-Negative Breast Cancer")
                    .briefSummary("Evaluates an oral agent in patients with HER2-negative tumours.")
                    .inclusionCriteria(List.of("HER2-negative breast cancer", "Age 18 or older", "Measurable disease"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient, trial, aiVerdict);

            assertEquals(OverrideStatus.UNCERTAIN, result.getOverrideStatus());
            assertEquals(45, result.getOverrideScore());
            assertEquals(List.of("HER2 status unknown: Trial requires HER2-, patient status not documented"),
                    result.getFlags());
            assertTrue(result.getReasoning().endsWith("for this HER2-negative trial."));
        }
    }

    @Nested
    @DisplayName("Rules 2 to 6 - clinical exclusions")
    class ClinicalExclusionTests {

        @Test
        @DisplayName("Should exclude early-stage patient from metastatic trial")
        void shouldExcludeEarlyStagePatientFromMetastaticTrial() {
            TrialRecord trial = trial().title("Combination Study in Metastatic HER2+ Breast Cancer").build();

            GuardrailVerdict result = engine.applyGuardrails(patient().build(), trial, aiVerdict);

            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertEquals(20, result.getOverrideScore());
            assertTrue(result.getFlags().contains("Stage mismatch: Trial for metastatic disease, patient has early-stage cancer"));
        }

        @Test
        @DisplayName("Should exclude metastatic patient from adjuvant trial")
        void shouldExcludeMetastaticPatientFromAdjuvantTrial() {
            PatientProfile patient = patient()
                    .stage(null)
                    .conditions(List.of("metastatic breast cancer"))
                    .build();
            TrialRecord trial = trial().title("Adjuvant Combination Study in HER2+ Breast Cancer").build();

            GuardrailVerdict result = engine.applyGuardrails(patient, trial, aiVerdict);

            assertEquals(20, result.getOverrideScore());
            assertTrue(result.getFlags().contains("Stage mismatch: Trial for early-stage disease, patient has metastatic cancer"));
        }

        @Test
        @DisplayName("Should exclude patient without required prior trastuzumab")
        void shouldExcludeWithoutRequiredPriorTrastuzumab() {
            TrialRecord trial = trial()
                    .inclusionCriteria(List.of("HER2-positive breast cancer", "Prior trastuzumab therapy", "Age 18 or older"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().priorTreatments(List.of("Paclitaxel")).build(), trial, aiVerdict);

            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertEquals(25, result.getOverrideScore());
        }

        @Test
        @DisplayName("Should accept Herceptin as prior trastuzumab")
        void shouldAcceptHerceptinAsPriorTrastuzumab() {
            TrialRecord trial = trial()
                    .inclusionCriteria(List.of("HER2-positive breast cancer", "Prior trastuzumab therapy", "Age 18 or older"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().priorTreatments(List.of("Herceptin x 12 months")).build(), trial, aiVerdict);

            assertFalse(result.isShouldOverride());
        }

        @Test
        @DisplayName("Should exclude patient with prior T-DM1 when trial forbids it")
        void shouldExcludePriorTdm1() {
            TrialRecord trial = trial()
                    .exclusionCriteria(List.of("Prior T-DM1 (trastuzumab emtansine)", "Pregnancy"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().priorTreatments(List.of("Kadcyla")).build(), trial, aiVerdict);

            assertEquals(15, result.getOverrideScore());
            assertTrue(result.getFlags().contains("Prior treatment exclusion: Trial excludes prior T-DM1, patient has received it"));
        }

        @Test
        @DisplayName("Should exclude ECOG 2 patient from ECOG 0-1 trial")
        void shouldExcludeEcogTwoFromEcogZeroToOneTrial() {
            TrialRecord trial = trial()
                    .inclusionCriteria(List.of("HER2-positive breast cancer", "ECOG performance status 0-1", "Age 18 or older"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().performanceStatus("ECOG 2").build(), trial, aiVerdict);

            assertTrue(result.isShouldOverride());
            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertEquals(30, result.getOverrideScore());
            assertTrue(result.getFlags().contains("ECOG performance status: Trial requires ECOG 0-1, patient is ECOG 2"));
        }

        @Test
        @DisplayName("Should exclude HER2-positive patient from TNBC trial")
        void shouldExcludeHer2PositiveFromTnbcTrial() {
            TrialRecord trial = trial()
                    .title("Sacituzumab in TNBC")
                    .briefSummary("Evaluates sacituzumab in patients with triple negative disease.")
                    .inclusionCriteria(List.of("Triple negative breast cancer", "Age 18 or older", "Measurable disease"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().build(), trial, aiVerdict);

            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertEquals(15, result.getOverrideScore());
            assertTrue(result.getFlags().contains("Subtype mismatch: Trial for TNBC, patient is HER2+"));
        }

        @Test
        @DisplayName("Should exclude patient with brain metastases when trial forbids them")
        void shouldExcludeBrainMetastases() {
            TrialRecord trial = trial()
                    .exclusionCriteria(List.of("Untreated brain metastases", "Pregnancy"))
                    .build();
            PatientProfile patient = patient().conditions(List.of("breast cancer", "brain metastases")).build();

            GuardrailVerdict result = engine.applyGuardrails(patient, trial, aiVerdict);

            assertEquals(20, result.getOverrideScore());
            assertTrue(result.getFlags().contains("Brain metastases: Trial excludes brain/CNS metastases, patient has them"));
        }

        @Test
        @DisplayName("Should treat prior cranial radiation as documented CNS involvement")
        void shouldTreatCranialRadiationAsBrainMetastases() {
            TrialRecord trial = trial()
                    .exclusionCriteria(List.of("Active CNS metastases", "Pregnancy"))
                    .build();
            PatientProfile patient = patient().priorTreatments(List.of("Whole-brain radiation")).build();

            GuardrailVerdict result = engine.applyGuardrails(patient, trial, aiVerdict);

            assertEquals(20, result.getOverrideScore());
        }
    }

    @Nested
    @DisplayName("Rule 7 - AI consistency")
    class ConsistencyTests {

        @Test
        @DisplayName("Should flag explanation contradicting HER2 status without overriding")
        void shouldFlagContradictionWithoutOverride() {
            AiVerdict contradicting = aiVerdict.toBuilder()
                    .explanation("The patient is HER2-negative and appears eligible.")
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().build(), trial().build(), contradicting);

            assertFalse(result.isShouldOverride());
            assertEquals(List.of("AI consistency error: Assessment mentions HER2-negative but patient is HER2-positive"),
                    result.getFlags());
            assertEquals(GuardrailVerdict.NO_OVERRIDE_REASONING, result.getReasoning());
        }

        @Test
        @DisplayName("Should flag early-stage wording for metastatic patient")
        void shouldFlagEarlyStageWordingForMetastaticPatient() {
            AiVerdict contradicting = aiVerdict.toBuilder()
                    .explanation("Good fit for this early-stage population.")
                    .build();
            PatientProfile patient = patient().stage("Stage IV").build();

            GuardrailVerdict result = engine.applyGuardrails(patient, trial().build(), contradicting);

            assertTrue(result.getFlags().contains(
                    "AI consistency error: Assessment mentions early-stage but patient has metastatic disease"));
        }
    }

    @Nested
    @DisplayName("Rule ordering and override policy")
    class OrderingTests {

        private final TrialRecord metastaticTnbcTrial = TrialRecord.builder()
                .nctId("NCT05000002")
                .title("Sacituzumab in Metastatic Triple Negative Breast Cancer")
                .phase("Phase 3")
                .briefSummary("Evaluates sacituzumab after at least one prior line of therapy.")
                .inclusionCriteria(List.of("Confirmed TNBC", "Age 18 or older", "Measurable disease"))
                .exclusionCriteria(List.of("Pregnancy", "Uncontrolled infection"))
                .cancerType("breast")
                .build();

        @Test
        @DisplayName("Should keep the override of the later rule while collecting flags from both")
        void shouldKeepLaterRuleOverride() {
            GuardrailVerdict result = engine.applyGuardrails(patient().build(), metastaticTnbcTrial, aiVerdict);

            assertTrue(result.isShouldOverride());
            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertEquals(15, result.getOverrideScore());
            assertEquals("Hard exclusion: Trial is for triple-negative breast cancer, but patient is HER2-positive.",
                    result.getReasoning());
            assertTrue(result.getFlags().contains("Stage mismatch: Trial for metastatic disease, patient has early-stage cancer"));
            assertTrue(result.getFlags().contains("Subtype mismatch: Trial for TNBC, patient is HER2+"));
            assertTrue(result.getFlags().indexOf("Stage mismatch: Trial for metastatic disease, patient has early-stage cancer")
                    < result.getFlags().indexOf("Subtype mismatch: Trial for TNBC, patient is HER2+"));
        }

        @Test
        @DisplayName("Should let a later weaker exclusion replace an earlier one under LAST_TRIGGERED")
        void shouldLetLaterWeakerExclusionWin() {
            TrialRecord trial = trial()
                    .title("Combination Study in Advanced HER2+ Breast Cancer")
                    .inclusionCriteria(List.of("HER2-positive breast cancer", "Prior taxane therapy", "Age 18 or older"))
                    .build();

            GuardrailVerdict result = engine.applyGuardrails(patient().build(), trial, aiVerdict);

            assertEquals(25, result.getOverrideScore());
            assertTrue(result.getReasoning().contains("taxane"));
            assertEquals(2, result.getFlags().size());
        }

        @Test
        @DisplayName("Should keep the most severe override under STRICTEST")
        void shouldKeepMostSevereOverrideUnderStrictest() {
            GuardrailEngine strictest = new GuardrailEngine(new BiomarkerStatusResolver(), OverridePolicy.STRICTEST);
            TrialRecord trial = trial()
                    .title("Combination Study in Advanced HER2+ Breast Cancer")
                    .inclusionCriteria(List.of("HER2-positive breast cancer", "Prior taxane therapy", "Age 18 or older"))
                    .build();

            GuardrailVerdict result = strictest.applyGuardrails(patient().build(), trial, aiVerdict);

            assertEquals(20, result.getOverrideScore());
            assertEquals(OverrideStatus.EXCLUDE, result.getOverrideStatus());
            assertTrue(result.getReasoning().contains("metastatic/advanced"));
            assertEquals(2, result.getFlags().size());
        }

        @Test
        @DisplayName("Should run every rule even when one fails")
        void shouldContinueWhenRuleFails() {
            GuardrailRule failing = new GuardrailRule() {
                @Override
                public String name() {
                    return "failing";
                }

                @Override
                public RuleOutcome evaluate(GuardrailContext context) {
                    throw new IllegalStateException("boom");
                }
            };
            GuardrailEngine withFailingRule = new GuardrailEngine(new BiomarkerStatusResolver(),
                    OverridePolicy.LAST_TRIGGERED, List.of(failing, new EcogRequirementRule()));

            GuardrailVerdict result = assertDoesNotThrow(() -> withFailingRule.applyGuardrails(
                    patient().performanceStatus("ECOG 3").build(),
                    trial().inclusionCriteria(List.of("ECOG 0-1", "Age 18 or older", "Measurable disease")).build(),
                    aiVerdict));

            assertEquals(30, result.getOverrideScore());
            assertTrue(result.getFlags().get(0).contains("failing"));
        }
    }

    @Test
    @DisplayName("Should run the seven rules in declared order")
    void shouldDeclareRulesInOrder() {
        List<String> names = engine.getRules().stream().map(GuardrailRule::name).collect(Collectors.toList());

        assertEquals(List.of("her2-requirement", "stage-mismatch", "prior-treatment", "ecog-requirement",
                "tnbc-subtype", "brain-metastases", "assessment-consistency"), names);
    }
}
