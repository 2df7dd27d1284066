package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.CarrierKind;
import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DocumentType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Taşıyıcı kataloğundaki tek bir girdi: bir işaretleme konumunu tasarım token'ına eşler.
 *
 * @param locationPattern         Konum deseni (örn: "//a:clrScheme//a:srgbClr/@val")
 * @param carrierKind             Taşıyıcı türü
 * @param significance            Tasarım açısından önem
 * @param designTokenPath         Noktalı token yolu (örn: "tokens.color.primary")
 * @param description             Açıklama
 * @param applicableDocumentTypes Girdinin değerlendirildiği belge türleri
 * @param namespaceIdentities     Desende kullanılan namespace URI'leri
 */
public record CarrierMapping(
        String locationPattern,
        CarrierKind carrierKind,
        CarrierSignificance significance,
        String designTokenPath,
        String description,
        Set<DocumentType> applicableDocumentTypes,
        Set<String> namespaceIdentities
) {

    public CarrierMapping {
        applicableDocumentTypes = applicableDocumentTypes == null || applicableDocumentTypes.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(DocumentType.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(applicableDocumentTypes));
        namespaceIdentities = namespaceIdentities == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(namespaceIdentities));
    }

    public boolean appliesTo(DocumentType documentType) {
        return applicableDocumentTypes.contains(documentType);
    }
}
