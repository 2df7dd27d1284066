package io.mersel.services.roundtrip.application.models;

/**
 * Fark bağlam bayraklarına göre bölümlenmiş korunma oranları.
 * <p>
 * Oranlar [0,1] aralığındadır; {@code changeRatio} sınırlandırılmaz.
 */
public record PreservationMetrics(
        double overallPreservation,
        double contentPreservation,
        double stylePreservation,
        double structurePreservation,
        double changeRatio
) {
}
