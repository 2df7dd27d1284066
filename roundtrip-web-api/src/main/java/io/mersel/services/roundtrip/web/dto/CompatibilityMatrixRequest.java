package io.mersel.services.roundtrip.web.dto;

import io.mersel.services.roundtrip.application.models.CarrierTestResult;
import io.mersel.services.roundtrip.application.models.PlatformTestResult;

import java.util.List;
import java.util.Map;

/**
 * Uyumluluk matrisi isteği. Tüm alanlar opsiyoneldir; eksik girdiler kısmi rapor üretir.
 */
public record CompatibilityMatrixRequest(
        List<PlatformTestResult> platformResults,
        List<CarrierTestResult> carrierResults,
        Map<String, String> configuration
) {
}
