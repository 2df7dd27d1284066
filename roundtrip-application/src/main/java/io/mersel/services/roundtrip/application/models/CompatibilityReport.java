package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.RiskLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Platformlar ve taşıyıcı türleri genelinde uyumluluk raporu.
 * Rapor oluşturucular (JSON, CSV, HTML) bu yapıyı tüketir.
 *
 * @param reportId          Rapor kimliği
 * @param generatedAt       Oluşturulma zamanı
 * @param testConfiguration Test yapılandırması (olduğu gibi taşınır)
 * @param platformResults   Platform istatistikleri
 * @param carrierResults    Taşıyıcı türü istatistikleri (her tür mevcut)
 * @param overallMetrics    Genel metrikler
 * @param riskAssessment    Taşıyıcı türü başına risk
 * @param summary           Özet metni
 * @param recommendations   Öneriler
 */
public record CompatibilityReport(
        String reportId,
        Instant generatedAt,
        Map<String, String> testConfiguration,
        List<PlatformCompatibility> platformResults,
        Map<CarrierKind, CarrierCompatibility> carrierResults,
        Map<String, Double> overallMetrics,
        Map<CarrierKind, RiskLevel> riskAssessment,
        String summary,
        List<String> recommendations
) {
}
