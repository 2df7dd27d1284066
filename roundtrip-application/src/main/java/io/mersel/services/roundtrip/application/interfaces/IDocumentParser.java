package io.mersel.services.roundtrip.application.interfaces;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.ParsedDocument;

/**
 * Ham belge içeriğini namespace'i normalize edilmiş ağaca dönüştüren ayrıştırıcı.
 * <p>
 * Girdi tek bir XML parçası veya ZIP ile paketlenmiş bir OOXML dosyası olabilir.
 * Prefix'ler ayrıştırma sırasında namespace URI'lerine çözümlenir.
 */
public interface IDocumentParser {

    /**
     * Belge içeriğini ayrıştırır.
     *
     * @param content      Belge byte dizisi
     * @param sourceName   Hata mesajlarında kullanılacak kaynak adı (örn: dosya adı)
     * @param documentType Belge türü, bilinmiyorsa {@code null}
     * @return Değişmez belge ağacı
     * @throws DocumentParseException içerik geçersizse; kısmi ağaç asla döndürülmez
     */
    ParsedDocument parse(byte[] content, String sourceName, DocumentType documentType)
            throws DocumentParseException;
}
