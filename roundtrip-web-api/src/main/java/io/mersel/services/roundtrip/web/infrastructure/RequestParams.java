package io.mersel.services.roundtrip.web.infrastructure;

import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.UsageContext;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * İstek parametrelerini enum'lara çeviren yardımcı metotlar.
 * <p>
 * Boş parametre {@code null} döner; tanınmayan değer {@link IllegalArgumentException}
 * ile 400 Bad Request'e çevrilir.
 */
public final class RequestParams {

    private RequestParams() {
    }

    public static DocumentType documentType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return DocumentType.parse(value).orElseThrow(() -> new IllegalArgumentException(
                "Geçersiz belge türü: '" + value + "'. Geçerli değerler: word, powerpoint, excel (docx, pptx, xlsx)"));
    }

    public static UsageContext usageContext(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return UsageContext.parse(value).orElseThrow(() -> new IllegalArgumentException(
                "Geçersiz kullanım bağlamı: '" + value + "'. Geçerli değerler: production, draft, test, analysis"));
    }

    public static DiffSeverity severity(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return DiffSeverity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Geçersiz önem seviyesi: '" + value + "'. Geçerli değerler: CRITICAL, MAJOR, MINOR, IGNORABLE", e);
        }
    }

    /**
     * Virgülle ayrılmış kategori listesi. Boşsa {@code null} (tüm kategoriler).
     */
    public static Set<DiffCategory> categories(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        var result = EnumSet.noneOf(DiffCategory.class);
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                result.add(DiffCategory.valueOf(trimmed.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Geçersiz kategori: '" + trimmed + "'. Geçerli değerler: ADDED, DROPPED, MODIFIED", e);
            }
        }
        return result.isEmpty() ? null : result;
    }
}
