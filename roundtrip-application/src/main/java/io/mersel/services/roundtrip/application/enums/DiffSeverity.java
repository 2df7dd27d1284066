package io.mersel.services.roundtrip.application.enums;

/**
 * Fark önem seviyeleri.
 * <p>
 * Sıralama: {@code CRITICAL > MAJOR > MINOR > IGNORABLE}.
 * Filtreleme {@link #isAtLeast(DiffSeverity)} ile yapılır.
 */
public enum DiffSeverity {

    CRITICAL(3),
    MAJOR(2),
    MINOR(1),
    IGNORABLE(0);

    private final int rank;

    DiffSeverity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Bu seviye verilen eşik seviyesine eşit veya daha önemli mi?
     */
    public boolean isAtLeast(DiffSeverity threshold) {
        return rank >= threshold.rank;
    }
}
