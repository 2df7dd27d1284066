package io.mersel.services.roundtrip.application.enums;

/**
 * Tolerans değerlendirmesinde kullanılan değişiklik türleri.
 */
public enum ChangeType {
    CONTENT_LOSS,
    FORMATTING_LOSS,
    COLOR_SHIFT,
    SPACING_CHANGE,
    FONT_SUBSTITUTION,
    METADATA_CHANGE,
    /** İçerik taşımayan öğelerin eklenmesi veya kaldırılması. */
    STRUCTURE_CHANGE
}
