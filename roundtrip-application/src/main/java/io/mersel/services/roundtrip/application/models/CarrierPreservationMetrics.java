package io.mersel.services.roundtrip.application.models;

/**
 * İki versiyon arasındaki token korunma istatistikleri.
 *
 * @param totalOriginalTokens Orijinalde bulunan farklı token sayısı
 * @param preservedTokens     Değeri aynı kalan token sayısı
 * @param modifiedTokens      Değeri değişen token sayısı
 * @param lostTokens          Yalnızca orijinalde bulunan token sayısı
 * @param gainedTokens        Yalnızca dönüştürülmüşte bulunan token sayısı
 * @param preservationRate    100 × korunan / (korunan + değişen + kaybolan)
 * @param modificationRate    100 × değişen / (korunan + değişen + kaybolan)
 * @param lossRate            100 × kaybolan / (korunan + değişen + kaybolan)
 * @param changeRatio         (değişen + kaybolan + kazanılan) / max(1, görülen farklı token)
 */
public record CarrierPreservationMetrics(
        int totalOriginalTokens,
        int preservedTokens,
        int modifiedTokens,
        int lostTokens,
        int gainedTokens,
        double preservationRate,
        double modificationRate,
        double lossRate,
        double changeRatio
) {
}
