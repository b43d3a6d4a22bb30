package com.trialguard.controller;

import com.trialguard.dto.MatchDTO;
import com.trialguard.service.MatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/match")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
@Tag(name = "Matching", description = "Patient to clinical trial matching")
public class MatchController {

    private final MatchService matchService;

    @PostMapping
    @Operation(summary = "Match a free-text patient description against candidate trials")
    public ResponseEntity<MatchDTO.Response> match(@RequestBody MatchDTO.MatchRequest request) {
        if (request.getPatientText() == null || request.getPatientText().isBlank()) {
            throw new IllegalArgumentException("patientText is required");
        }
        return ResponseEntity.ok(matchService.match(request.getPatientText()));
    }
}
