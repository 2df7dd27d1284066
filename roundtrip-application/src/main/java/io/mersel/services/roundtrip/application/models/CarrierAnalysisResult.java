package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierSignificance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tek bir belge için taşıyıcı analizi sonucu.
 *
 * @param detectedCarriers  Bulunan taşıyıcılar (katalog sırası, ardından belge sırası)
 * @param missingCarriers   Hiç eşleşmeyen uygulanabilir katalog girdileri
 * @param survivalRate      Bulunan girdilerin uygulanabilir girdilere oranı, [0,100]
 * @param criticalFailures  Eksik CRITICAL girdilerin açıklamaları
 * @param categoryBreakdown Önem seviyesi başına sayılar (her seviye mevcut)
 */
public record CarrierAnalysisResult(
        List<DetectedCarrier> detectedCarriers,
        List<CarrierMapping> missingCarriers,
        double survivalRate,
        List<String> criticalFailures,
        Map<CarrierSignificance, SignificanceStats> categoryBreakdown
) {

    /**
     * Ayrıştırılamayan girdi için sıfır sonuç.
     */
    public static CarrierAnalysisResult empty() {
        var breakdown = new EnumMap<CarrierSignificance, SignificanceStats>(CarrierSignificance.class);
        for (CarrierSignificance significance : CarrierSignificance.values()) {
            breakdown.put(significance, SignificanceStats.of(0, 0));
        }
        return new CarrierAnalysisResult(List.of(), List.of(), 0.0, List.of(),
                Collections.unmodifiableMap(breakdown));
    }
}
