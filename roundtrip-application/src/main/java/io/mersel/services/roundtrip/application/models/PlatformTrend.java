package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.PlatformType;

/**
 * Bir platform ve belge türü çifti için eğilimler.
 *
 * @param platform           Platform
 * @param documentType       Belge türü, raporda yoksa {@code null}
 * @param survivalRate       Taşıyıcı hayatta kalma oranı
 * @param criticalFailures   Kritik hata sayısı
 * @param carrierSuccessRate Platformu içeren taşıyıcı türlerinin ortalama başarısı
 * @param testCount          Test edilen taşıyıcı sayısı
 */
public record PlatformTrend(
        PlatformType platform,
        DocumentType documentType,
        TrendMetric survivalRate,
        TrendMetric criticalFailures,
        TrendMetric carrierSuccessRate,
        TrendMetric testCount
) {
}
