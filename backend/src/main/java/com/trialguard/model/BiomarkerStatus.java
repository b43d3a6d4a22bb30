package com.trialguard.model;

/**
 * Tri-state result of resolving a named biomarker against a patient profile.
 */
public enum BiomarkerStatus {
    POSITIVE,
    NEGATIVE,
    UNKNOWN
}
