package io.mersel.services.roundtrip.application.enums;

/**
 * Bir tasarım token'ının dönüşüm sonrası durumu.
 */
public enum TokenOutcome {
    PRESERVED,
    MODIFIED,
    LOST,
    GAINED
}
