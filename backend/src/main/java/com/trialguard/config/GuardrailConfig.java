package com.trialguard.config;

import com.trialguard.guardrail.BiomarkerStatusResolver;
import com.trialguard.guardrail.GuardrailEngine;
import com.trialguard.guardrail.OverridePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Guardrail engine configuration
 *
 * trialguard.guardrail.override-policy:
 * - LAST_TRIGGERED: last tripped rule decides the override (default)
 * - STRICTEST: most severe override wins
 */
@Configuration
@Slf4j
public class GuardrailConfig {

    @Value("${trialguard.guardrail.override-policy:LAST_TRIGGERED}")
    private String overridePolicy;

    @Bean
    public GuardrailEngine guardrailEngine(BiomarkerStatusResolver biomarkerStatusResolver) {
        OverridePolicy policy;
        try {
            policy = OverridePolicy.valueOf(overridePolicy.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown guardrail override policy '{}', falling back to LAST_TRIGGERED", overridePolicy);
            policy = OverridePolicy.LAST_TRIGGERED;
        }
        log.info("Guardrail engine using override policy {}", policy);
        return new GuardrailEngine(biomarkerStatusResolver, policy);
    }
}
