package io.mersel.services.roundtrip.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Tolerans sınırı ayarlama isteği. Verilmeyen sınırlar korunur.
 */
public record AdjustToleranceRequest(
        @Schema(description = "Yeni yüzde sınırı (0-100)", example = "10.0", nullable = true)
        Double maxPercentage,

        @Schema(description = "Yeni mutlak sınır", example = "5", nullable = true)
        Integer maxAbsolute
) {
}
