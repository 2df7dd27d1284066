package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;

/**
 * Tolerans değerlendirmesine giren ham değişiklik kaydı.
 *
 * @param type     Değişiklik türü
 * @param location Değişikliğin konumu
 * @param severity Önem seviyesi
 */
public record ChangeRecord(ChangeType type, String location, DiffSeverity severity) {
}
