package io.mersel.services.roundtrip.application.enums;

/**
 * Bir metriğin çalıştırmalar boyunca eğilimi.
 */
public enum TrendDirection {
    IMPROVING,
    STABLE,
    DECLINING,
    VOLATILE
}
