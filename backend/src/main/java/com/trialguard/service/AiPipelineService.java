package com.trialguard.service;

import com.trialguard.model.AiVerdict;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the language-model service that extracts profiles, generates
 * candidate trials and assesses patient/trial fit.
 *
 * Every call degrades to a safe fallback instead of failing the match request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AiPipelineService {

    private static final ParameterizedTypeReference<List<TrialRecord>> TRIAL_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient.Builder webClientBuilder;

    @Value("${trialguard.ai-service.url}")
    private String aiServiceUrl;

    @Value("${trialguard.ai-service.timeout:10s}")
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Extract structured patient profile from free-text clinical notes
     */
    public Mono<PatientProfile> extractPatientProfile(String patientText) {
        return client().post()
            .uri("/v1/patients/extract")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("text", patientText))
            .retrieve()
            .bodyToMono(PatientProfile.class)
            .retryWhen(retryOnUndecodableBody())
            .timeout(timeout)
            .doOnSuccess(p -> log.info("Patient profile extracted"))
            .onErrorResume(e -> {
                log.error("Failed to extract patient profile, using empty profile: {}", e.getMessage());
                return Mono.just(PatientProfile.empty());
            })
            .defaultIfEmpty(PatientProfile.empty());
    }

    /**
     * Generate candidate trials tailored to the patient description
     */
    public Mono<List<TrialRecord>> generateTrials(String patientText) {
        return client().post()
            .uri("/v1/trials/generate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("text", patientText))
            .retrieve()
            .bodyToMono(TRIAL_LIST)
            .retryWhen(retryOnUndecodableBody())
            .timeout(timeout)
            .filter(trials -> !trials.isEmpty())
            .doOnSuccess(trials -> {
                if (trials != null) {
                    log.info("Generated {} candidate trials", trials.size());
                }
            })
            .onErrorResume(e -> {
                log.error("Failed to generate trials, using fallback catalog: {}", e.getMessage());
                return Mono.just(FallbackTrialCatalog.trials());
            })
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("Trial generation returned no trials, using fallback catalog");
                return FallbackTrialCatalog.trials();
            }));
    }

    /**
     * Assess how well the patient fits one trial's eligibility criteria
     */
    public Mono<AiVerdict> assessTrial(PatientProfile profile, TrialRecord trial) {
        Map<String, Object> request = Map.of(
            "patient", profile,
            "criteria", Map.of(
                "inclusion", trial.getInclusionCriteria(),
                "exclusion", trial.getExclusionCriteria()
            )
        );

        return client().post()
            .uri("/v1/trials/assess")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(AiVerdict.class)
            .retryWhen(retryOnUndecodableBody())
            .timeout(timeout)
            .doOnSuccess(v -> log.debug("Assessment received for trial: {}", trial.getNctId()))
            .onErrorResume(e -> {
                log.error("Failed to assess trial {}: {}", trial.getNctId(), e.getMessage());
                return Mono.just(AiVerdict.assessmentFailed());
            })
            .defaultIfEmpty(AiVerdict.assessmentFailed());
    }

    private WebClient client() {
        return webClientBuilder.baseUrl(aiServiceUrl).build();
    }

    // Model output that is not valid JSON usually parses on a second attempt
    private static Retry retryOnUndecodableBody() {
        return Retry.max(1).filter(AiPipelineService::isDecodingFailure);
    }

    private static boolean isDecodingFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof DecodingException) {
                return true;
            }
        }
        return false;
    }
}
