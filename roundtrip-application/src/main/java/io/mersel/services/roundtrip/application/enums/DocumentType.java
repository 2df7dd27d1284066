package io.mersel.services.roundtrip.application.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Desteklenen OOXML belge türleri.
 * <p>
 * Taşıyıcı kataloğu girdileri, önem kuralları ve önerilen tolerans profili
 * bu türe göre seçilir.
 */
public enum DocumentType {

    WORD,
    PRESENTATION,
    SPREADSHEET;

    /**
     * Kullanıcı girdisindeki belge türü adını çözümler.
     * <p>
     * Enum adlarının yanında uygulama adları ({@code word}, {@code powerpoint}, {@code excel})
     * ve dosya uzantıları ({@code docx}, {@code pptx}, {@code xlsx}) da kabul edilir.
     *
     * @param value belge türü adı (büyük/küçük harf duyarsız)
     * @return tanınan tür, boş veya tanınmayan girdi için boş Optional
     */
    public static Optional<DocumentType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "word", "docx", "document" -> Optional.of(WORD);
            case "powerpoint", "presentation", "pptx" -> Optional.of(PRESENTATION);
            case "excel", "spreadsheet", "xlsx", "workbook" -> Optional.of(SPREADSHEET);
            default -> Optional.empty();
        };
    }
}
