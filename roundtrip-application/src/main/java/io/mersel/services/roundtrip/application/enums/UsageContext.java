package io.mersel.services.roundtrip.application.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Şablonun kullanım bağlamı. Önerilen tolerans profilini belirlemede kullanılır.
 */
public enum UsageContext {

    PRODUCTION,
    DRAFT,
    TEST,
    ANALYSIS;

    public static Optional<UsageContext> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
