package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;

/**
 * Orijinal ve dönüştürülmüş belge arasında tespit edilen tek bir anlamsal fark.
 *
 * @param location    Namespace'e göre normalize edilmiş konum (örn: "/w:document[1]/w:body[1]/w:p[1]/@w:rsidR")
 * @param category    Fark kategorisi
 * @param severity    Önem seviyesi
 * @param description Okunabilir açıklama; iki değer de varsa her ikisini içerir
 * @param oldValue    Orijinal değer (yoksa {@code null})
 * @param newValue    Dönüştürülmüş değer (yoksa {@code null})
 * @param context     Etki bayrakları
 */
public record SemanticDifference(
        String location,
        DiffCategory category,
        DiffSeverity severity,
        String description,
        String oldValue,
        String newValue,
        DiffContext context
) {
}
