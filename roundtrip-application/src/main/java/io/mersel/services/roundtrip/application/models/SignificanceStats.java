package io.mersel.services.roundtrip.application.models;

/**
 * Tek bir önem seviyesi için taşıyıcı sayıları.
 */
public record SignificanceStats(int detected, int missing, int total, double survivalRate) {

    public static SignificanceStats of(int detected, int missing) {
        int total = detected + missing;
        double rate = total == 0 ? 0.0 : 100.0 * detected / total;
        return new SignificanceStats(detected, missing, total, rate);
    }
}
