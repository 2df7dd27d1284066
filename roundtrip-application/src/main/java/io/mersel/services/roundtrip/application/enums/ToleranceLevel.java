package io.mersel.services.roundtrip.application.enums;

/**
 * Tolerans profillerinin katılık seviyesi.
 */
public enum ToleranceLevel {
    STRICT,
    NORMAL,
    LENIENT,
    PERMISSIVE
}
