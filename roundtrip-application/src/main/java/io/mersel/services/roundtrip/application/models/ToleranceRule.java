package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.interfaces.ToleranceConfigurationException;

import java.util.Locale;
import java.util.Objects;

/**
 * Bir değişiklik türü için izin verilen üst sınırlar.
 * <p>
 * İki sınır da verilmişse ikisi birlikte sağlanmalıdır.
 *
 * @param changeType      Kuralın uygulandığı değişiklik türü
 * @param maxAbsolute     En fazla değişiklik sayısı, sınırsız ise {@code null}
 * @param maxPercentage   En fazla değişiklik yüzdesi (0–100), sınırsız ise {@code null}
 * @param locationPattern Kuralı belirli konumlara daraltan desen, yoksa {@code null}
 * @param description     Açıklama
 */
public record ToleranceRule(
        ChangeType changeType,
        Integer maxAbsolute,
        Double maxPercentage,
        String locationPattern,
        String description
) {

    public ToleranceRule {
        Objects.requireNonNull(changeType, "changeType");
        if (maxAbsolute != null && maxAbsolute < 0) {
            throw new ToleranceConfigurationException(
                    "max_absolute negatif olamaz: " + maxAbsolute + " (" + changeType + ")");
        }
        if (maxPercentage != null && (maxPercentage.isNaN() || maxPercentage < 0.0 || maxPercentage > 100.0)) {
            throw new ToleranceConfigurationException(
                    "max_percentage 0-100 aralığında olmalı: " + maxPercentage + " (" + changeType + ")");
        }
        if (locationPattern != null && locationPattern.isBlank()) {
            locationPattern = null;
        }
        description = description == null ? "" : description;
    }

    /**
     * Verilen sayı sınırlar içinde mi?
     *
     * @param count Kurala giren değişiklik sayısı
     * @param total Yüzde paydası; sıfırsa yüzde 0 kabul edilir
     */
    public boolean isWithinTolerance(int count, int total) {
        if (maxAbsolute != null && count > maxAbsolute) {
            return false;
        }
        return maxPercentage == null || percentage(count, total) <= maxPercentage;
    }

    /**
     * Verilmeyen sınırları koruyarak yeni sınırlarla bir kopya üretir.
     */
    public ToleranceRule withLimits(Double newPercentage, Integer newAbsolute) {
        return new ToleranceRule(
                changeType,
                newAbsolute != null ? newAbsolute : maxAbsolute,
                newPercentage != null ? newPercentage : maxPercentage,
                locationPattern,
                description);
    }

    /**
     * Sınırların okunabilir gösterimi (örn: "max 10, max %5.0").
     */
    public String describeLimits() {
        if (maxAbsolute == null && maxPercentage == null) {
            return "no limit";
        }
        var sb = new StringBuilder();
        if (maxAbsolute != null) {
            sb.append("max ").append(maxAbsolute);
        }
        if (maxPercentage != null) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(String.format(Locale.ROOT, "max %.1f%%", maxPercentage));
        }
        return sb.toString();
    }

    public static double percentage(int count, int total) {
        return total > 0 ? 100.0 * count / total : 0.0;
    }
}
