package io.mersel.services.roundtrip.application.models;

import java.util.Objects;

/**
 * Namespace URI ve yerel addan oluşan nitelikli ad.
 * <p>
 * Kaynakta kullanılan prefix bilgisi tutulmaz; aynı URI ve yerel ada sahip
 * iki öğe, prefix'leri farklı olsa bile aynı addır.
 *
 * @param namespaceUri Namespace URI, namespace yoksa {@code null}
 * @param localName    Yerel ad (örn: "color", "srgbClr")
 */
public record QualifiedName(String namespaceUri, String localName) {

    public QualifiedName {
        Objects.requireNonNull(localName, "localName");
        if (namespaceUri != null && namespaceUri.isEmpty()) {
            namespaceUri = null;
        }
    }

    public static QualifiedName of(String namespaceUri, String localName) {
        return new QualifiedName(namespaceUri, localName);
    }

    public static QualifiedName local(String localName) {
        return new QualifiedName(null, localName);
    }

    public boolean hasNamespace() {
        return namespaceUri != null;
    }

    /**
     * Clark gösterimi: {@code {uri}local} veya namespace yoksa yalnızca yerel ad.
     */
    @Override
    public String toString() {
        return hasNamespace() ? "{" + namespaceUri + "}" + localName : localName;
    }
}
