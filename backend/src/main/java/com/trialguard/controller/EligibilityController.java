package com.trialguard.controller;

import com.trialguard.dto.EligibilityDTO;
import com.trialguard.guardrail.GuardrailEngine;
import com.trialguard.model.GuardrailVerdict;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;
import com.trialguard.model.ValidationOutcome;
import com.trialguard.validation.ProfileNormalizer;
import com.trialguard.validation.ProfileValidator;
import com.trialguard.validation.TrialRecordValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Direct access to the deterministic eligibility checks, for callers that
 * already hold structured profiles, trials and AI assessments.
 */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
@Tag(name = "Eligibility", description = "Profile cleanup, validation and guardrails")
public class EligibilityController {

    private final ProfileNormalizer profileNormalizer;
    private final ProfileValidator profileValidator;
    private final TrialRecordValidator trialRecordValidator;
    private final GuardrailEngine guardrailEngine;

    @PostMapping("/profiles/normalize")
    @Operation(summary = "Normalize a patient profile and infer missing biomarkers")
    public ResponseEntity<PatientProfile> normalize(@RequestBody EligibilityDTO.NormalizeRequest request) {
        return ResponseEntity.ok(profileNormalizer.normalizeAndInfer(request.getProfile(), request.getRawText()));
    }

    @PostMapping("/profiles/validate")
    @Operation(summary = "Validate a patient profile")
    public ResponseEntity<ValidationOutcome> validateProfile(@RequestBody PatientProfile profile) {
        return ResponseEntity.ok(profileValidator.validateProfile(profile));
    }

    @PostMapping("/trials/validate")
    @Operation(summary = "Validate a trial catalog")
    public ResponseEntity<ValidationOutcome> validateTrials(@RequestBody List<TrialRecord> trials) {
        return ResponseEntity.ok(trialRecordValidator.validateTrials(trials));
    }

    @PostMapping("/guardrails/evaluate")
    @Operation(summary = "Apply clinical guardrails to an AI trial assessment")
    public ResponseEntity<GuardrailVerdict> evaluate(@RequestBody EligibilityDTO.EvaluateRequest request) {
        if (request.getTrial() == null || request.getVerdict() == null) {
            throw new IllegalArgumentException("trial and verdict are required");
        }
        return ResponseEntity.ok(guardrailEngine.applyGuardrails(
            request.getProfile(), request.getTrial(), request.getVerdict()));
    }
}
