package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierKind;

/**
 * Bir taşıyıcı türü için eğilimler.
 *
 * @param carrierKind                Taşıyıcı türü
 * @param successRate                Başarı oranı
 * @param crossPlatformCompatibility Geçen platformların yüzdesi
 * @param failureFrequency           Başarısız test sayısı
 */
public record CarrierTrend(
        CarrierKind carrierKind,
        TrendMetric successRate,
        TrendMetric crossPlatformCompatibility,
        TrendMetric failureFrequency
) {
}
