package io.mersel.services.roundtrip.application.models;

import java.util.List;

/**
 * Yalnızca CRITICAL taşıyıcılar için hayatta kalma özeti.
 */
public record CriticalCarrierSurvival(
        int detectedCount,
        int missingCount,
        double survivalRate,
        List<TokenSummary> detectedTokens,
        List<TokenSummary> missingTokens
) {
}
