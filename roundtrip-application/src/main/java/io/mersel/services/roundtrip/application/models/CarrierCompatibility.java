package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.PlatformType;

import java.util.List;
import java.util.Map;

/**
 * Taşıyıcı türü bazında platformlar arası istatistikler.
 *
 * @param carrierKind     Taşıyıcı türü
 * @param category        Türün önem kategorisi
 * @param totalTests      Test edilen token sayısı
 * @param successfulTests Korunan veya yalnızca değişen token sayısı
 * @param successRate     Başarı yüzdesi, test yoksa 0
 * @param platformResults Platform başına geçti/kaldı
 * @param commonFailures  Tekrarlanmayan hata açıklamaları
 */
public record CarrierCompatibility(
        CarrierKind carrierKind,
        CarrierSignificance category,
        int totalTests,
        int successfulTests,
        double successRate,
        Map<PlatformType, Boolean> platformResults,
        List<String> commonFailures
) {
}
