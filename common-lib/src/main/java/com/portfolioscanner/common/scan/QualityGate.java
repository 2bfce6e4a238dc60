package com.portfolioscanner.common.scan;

import com.portfolioscanner.common.model.ConfidenceTier;
import com.portfolioscanner.common.model.SymbolCandidate;

/**
 * Decides which extracted candidates are worth a sentiment pass:
 * a known company, any HIGH candidate, or a MEDIUM candidate of at least 4 characters.
 */
public final class QualityGate {

    static final int MIN_MEDIUM_LENGTH = 4;

    private QualityGate() {}

    public static boolean accepts(SymbolCandidate candidate) {
        if (candidate.hasKnownCompany()) return true;
        if (candidate.confidence() == ConfidenceTier.HIGH) return true;
        return candidate.confidence() == ConfidenceTier.MEDIUM
                && candidate.symbol().length() >= MIN_MEDIUM_LENGTH;
    }
}
