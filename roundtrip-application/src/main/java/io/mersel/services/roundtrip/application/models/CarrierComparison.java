package io.mersel.services.roundtrip.application.models;

/**
 * Orijinal ve dönüştürülmüş belgenin taşıyıcı karşılaştırması.
 */
public record CarrierComparison(
        CarrierAnalysisResult originalAnalysis,
        CarrierAnalysisResult convertedAnalysis,
        CarrierPreservationMetrics preservationMetrics,
        TokenChanges tokenChanges
) {
}
