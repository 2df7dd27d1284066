package io.mersel.services.roundtrip.application.models;

/**
 * Belgede bulunan bir taşıyıcı.
 *
 * @param mapping         Eşleşen katalog girdisi
 * @param matchedLocation Eşleşen düğüm veya özniteliğin normalize konumu
 * @param extractedValue  Çıkarılan değer, yoksa {@code null}
 */
public record DetectedCarrier(CarrierMapping mapping, String matchedLocation, String extractedValue) {
}
