package com.trialguard.service;

import com.trialguard.dto.MatchDTO;
import com.trialguard.guardrail.GuardrailEngine;
import com.trialguard.model.AiVerdict;
import com.trialguard.model.GuardrailVerdict;
import com.trialguard.model.OverrideStatus;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;
import com.trialguard.model.ValidationOutcome;
import com.trialguard.validation.ProfileNormalizer;
import com.trialguard.validation.ProfileValidator;
import com.trialguard.validation.TrialRecordValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Orchestrates a match request: extract and clean the profile, generate and
 * check candidate trials, assess each trial and apply the guardrails, then rank.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchService {

    private final AiPipelineService aiPipelineService;
    private final ProfileNormalizer profileNormalizer;
    private final ProfileValidator profileValidator;
    private final TrialRecordValidator trialRecordValidator;
    private final GuardrailEngine guardrailEngine;

    @Value("${trialguard.match.match-threshold:70}")
    private int matchThreshold = 70;

    @Value("${trialguard.match.uncertain-threshold:40}")
    private int uncertainThreshold = 40;

    @Value("${trialguard.match.max-concurrency:4}")
    private int maxConcurrency = 4;

    @Value("${trialguard.match.timeout:60s}")
    private Duration matchTimeout = Duration.ofSeconds(60);

    public MatchDTO.Response match(String patientText) {
        log.info("Matching patient: {}", patientText.length() > 50 ? patientText.substring(0, 50) : patientText);

        Mono<PatientProfile> profile = aiPipelineService.extractPatientProfile(patientText)
            .map(extracted -> profileNormalizer.normalizeAndInfer(extracted, patientText));
        Mono<List<TrialRecord>> trials = aiPipelineService.generateTrials(patientText);

        return Mono.zip(profile, trials)
            .flatMap(t -> evaluate(t.getT1(), t.getT2()))
            .block(matchTimeout);
    }

    private Mono<MatchDTO.Response> evaluate(PatientProfile profile, List<TrialRecord> trials) {
        ValidationOutcome profileValidation = profileValidator.validateProfile(profile);
        if (!profileValidation.isValid()) {
            log.warn("Patient profile failed validation: {}", profileValidation.getErrors());
        }
        ValidationOutcome trialValidation = trialRecordValidator.validateTrials(trials);
        if (!trialValidation.isValid()) {
            log.warn("Trial catalog failed validation: {}", trialValidation.getErrors());
        }

        // Missing records are already reported by the catalog validation
        List<TrialRecord> assessable = trials.stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toList());

        return Flux.fromIterable(assessable)
            .flatMapSequential(trial -> aiPipelineService.assessTrial(profile, trial)
                .map(verdict -> toTrialMatch(profile, trial, verdict)), maxConcurrency)
            .collectList()
            .map(matches -> MatchDTO.Response.builder()
                .success(true)
                .profile(profile)
                .profileValidation(profileValidation)
                .trialValidation(trialValidation)
                .matches(rank(matches))
                .build());
    }

    private MatchDTO.TrialMatch toTrialMatch(PatientProfile profile, TrialRecord trial, AiVerdict verdict) {
        GuardrailVerdict guardrail = guardrailEngine.applyGuardrails(profile, trial, verdict);
        if (!guardrail.getFlags().isEmpty()) {
            log.info("Guardrail flags for trial {}: {}", trial.getNctId(), guardrail.getFlags());
        }

        int finalScore = guardrail.isShouldOverride() ? guardrail.getOverrideScore() : verdict.getMatchScore();
        OverrideStatus finalStatus = guardrail.isShouldOverride()
            ? guardrail.getOverrideStatus()
            : statusForScore(verdict.getMatchScore());

        return MatchDTO.TrialMatch.builder()
            .trial(trial)
            .assessment(verdict)
            .guardrail(guardrail)
            .finalScore(finalScore)
            .finalStatus(finalStatus)
            .build();
    }

    OverrideStatus statusForScore(int score) {
        if (score >= matchThreshold) {
            return OverrideStatus.MATCH;
        }
        if (score >= uncertainThreshold) {
            return OverrideStatus.UNCERTAIN;
        }
        return OverrideStatus.EXCLUDE;
    }

    private List<MatchDTO.TrialMatch> rank(List<MatchDTO.TrialMatch> matches) {
        List<MatchDTO.TrialMatch> ranked = new ArrayList<>(matches);
        ranked.sort(Comparator.comparingInt(MatchDTO.TrialMatch::getFinalScore).reversed());
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setRank(i + 1);
        }
        return ranked;
    }
}
