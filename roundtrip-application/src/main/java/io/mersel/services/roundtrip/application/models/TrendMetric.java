package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.TrendDirection;

import java.time.Instant;
import java.util.List;

/**
 * Zaman içinde izlenen tek bir metrik.
 *
 * @param name         Metrik adı
 * @param values       Eski raporlardan yeniye değerler
 * @param timestamps   Değerlerin ait olduğu rapor zamanları
 * @param currentValue Son değer, değer yoksa {@code null}
 * @param direction    Eğilim yönü
 * @param changeRate   İlk ve son değer arasındaki yüzde değişim; ilk değer 0 ve son değer pozitifse {@code null}
 */
public record TrendMetric(
        String name,
        List<Double> values,
        List<Instant> timestamps,
        Double currentValue,
        TrendDirection direction,
        Double changeRate
) {

    public TrendMetric {
        values = List.copyOf(values);
        timestamps = List.copyOf(timestamps);
    }
}
