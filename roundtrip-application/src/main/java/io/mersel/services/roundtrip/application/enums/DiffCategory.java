package io.mersel.services.roundtrip.application.enums;

/**
 * Bir farkın yönü: yalnızca dönüştürülmüş belgede, yalnızca orijinalde veya her ikisinde farklı.
 */
public enum DiffCategory {
    ADDED,
    DROPPED,
    MODIFIED
}
