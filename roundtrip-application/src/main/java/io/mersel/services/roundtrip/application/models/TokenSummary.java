package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierKind;

/**
 * Raporlama için taşıyıcı özeti.
 *
 * @param type        Taşıyıcı türü
 * @param tokenPath   Token yolu
 * @param value       Bulunan değer (eksik taşıyıcılar için {@code null})
 * @param description Katalog açıklaması
 */
public record TokenSummary(CarrierKind type, String tokenPath, String value, String description) {
}
