package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DocumentType;

/**
 * Bir belge versiyonunun ayrıştırılmış, değişmez ağacı.
 * <p>
 * OOXML paketleri tek bir ağaç olarak temsil edilir: sentetik paket kökü altında
 * her XML parçası, parça adını taşıyan bir sarmalayıcı öğe içinde yer alır.
 *
 * @param documentType Belge türü, bilinmiyorsa {@code null}
 * @param sourceName   Kaynak adı (dosya adı veya parça yolu), loglama için
 * @param root         Kök düğüm
 */
public record ParsedDocument(DocumentType documentType, String sourceName, XmlNode root) {

    public int comparableItems() {
        return root.countItems();
    }
}
