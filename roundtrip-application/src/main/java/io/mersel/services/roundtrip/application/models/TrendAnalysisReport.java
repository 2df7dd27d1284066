package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.RiskLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Birden fazla uyumluluk raporu üzerinden eğilim analizi.
 *
 * @param reportId       Analiz kimliği
 * @param generatedAt    Oluşturulma zamanı
 * @param periodStart    Analiz edilen ilk raporun zamanı
 * @param periodEnd      Analiz edilen son raporun zamanı
 * @param totalTestRuns  Analize giren rapor sayısı
 * @param platformTrends Platform anahtarı ({@code LIBREOFFICE_WORD}) → eğilimler
 * @param carrierTrends  Taşıyıcı türü → eğilimler
 * @param overallMetrics Genel metrik adı → eğilim
 * @param regressions    Düşüş eğilimindeki platform ve taşıyıcı anahtarları
 * @param insights       Gözlemler
 * @param recommendations Öneriler (en fazla 8)
 * @param riskAssessment Platform anahtarı veya {@code carrier_<TÜR>} → risk
 */
public record TrendAnalysisReport(
        String reportId,
        Instant generatedAt,
        Instant periodStart,
        Instant periodEnd,
        int totalTestRuns,
        Map<String, PlatformTrend> platformTrends,
        Map<CarrierKind, CarrierTrend> carrierTrends,
        Map<String, TrendMetric> overallMetrics,
        List<String> regressions,
        List<String> insights,
        List<String> recommendations,
        Map<String, RiskLevel> riskAssessment
) {
}
