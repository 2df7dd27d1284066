package io.mersel.services.roundtrip.application.enums;

/**
 * Taşıyıcının tasarım açısından önemi.
 * <p>
 * CRITICAL taşıyıcıların kaybı, kurumsal kimliğin bozulması anlamına gelir
 * (tema renkleri, tema yazı tipleri, slayt yerleşimi).
 */
public enum CarrierSignificance {
    CRITICAL,
    IMPORTANT,
    MODERATE,
    COSMETIC
}
