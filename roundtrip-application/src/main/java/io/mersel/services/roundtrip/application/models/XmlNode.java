package io.mersel.services.roundtrip.application.models;

import java.util.List;
import java.util.Optional;

/**
 * Ayrıştırılmış belge ağacının değişmez düğümü.
 *
 * @param name       Nitelikli öğe adı
 * @param attributes Kaynaktaki sırasıyla öznitelikler (namespace bildirimleri hariç)
 * @param text       Doğrudan metin içeriği (alt öğelerin metni dahil değil), yoksa boş string
 * @param children   Alt öğeler
 */
public record XmlNode(
        QualifiedName name,
        List<XmlAttribute> attributes,
        String text,
        List<XmlNode> children
) {

    public XmlNode {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        children = children == null ? List.of() : List.copyOf(children);
        text = text == null ? "" : text;
    }

    public Optional<XmlAttribute> attribute(QualifiedName attributeName) {
        return attributes.stream()
                .filter(a -> a.name().equals(attributeName))
                .findFirst();
    }

    public boolean hasText() {
        return !text.isBlank();
    }

    /**
     * Düğümün veya herhangi bir alt düğümün görünür metin taşıyıp taşımadığı.
     */
    public boolean hasDescendantText() {
        if (hasText()) {
            return true;
        }
        for (XmlNode child : children) {
            if (child.hasDescendantText()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Alt ağaçtaki karşılaştırılabilir öğe ve öznitelik sayısı.
     */
    public int countItems() {
        int count = 1 + attributes.size();
        for (XmlNode child : children) {
            count += child.countItems();
        }
        return count;
    }
}
