package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.PlatformType;
import io.mersel.services.roundtrip.application.enums.TokenOutcome;

/**
 * Tek bir token'ın bir platformdaki akıbeti.
 *
 * @param platform    Platform
 * @param tokenPath   Token yolu
 * @param carrierKind Taşıyıcı türü; {@code null} ise token yolundan çıkarılır
 * @param outcome     Token'ın durumu
 */
public record CarrierTestResult(
        PlatformType platform,
        String tokenPath,
        CarrierKind carrierKind,
        TokenOutcome outcome
) {
}
