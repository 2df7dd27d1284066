package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.models.QualifiedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * OOXML namespace URI'leri ve kanonik prefix tablosu.
 * <p>
 * Konum dizeleri kaynaktaki prefix yerine bu tablodaki kanonik prefix ile üretilir;
 * böylece aynı URI farklı prefix'lerle yazılsa da konum değişmez.
 * Tabloda olmayan URI'ler Clark gösterimi ({@code {uri}local}) ile yazılır.
 */
public final class OoxmlNamespaces {

    // ── Ana işaretleme dilleri ──
    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String P = "http://schemas.openxmlformats.org/presentationml/2006/main";
    public static final String X = "http://schemas.openxmlformats.org/spreadsheetml/2006/main";
    public static final String R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    // ── DrawingML türevleri ──
    public static final String WP = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    public static final String PIC = "http://schemas.openxmlformats.org/drawingml/2006/picture";
    public static final String C = "http://schemas.openxmlformats.org/drawingml/2006/chart";
    public static final String XDR = "http://schemas.openxmlformats.org/drawingml/2006/spreadsheetDrawing";

    // ── Uyumluluk ve sürüm uzantıları ──
    public static final String MC = "http://schemas.openxmlformats.org/markup-compatibility/2006";
    public static final String W14 = "http://schemas.microsoft.com/office/word/2010/wordml";

    // ── Belge özellikleri ──
    public static final String CP = "http://schemas.openxmlformats.org/package/2006/metadata/core-properties";
    public static final String DC = "http://purl.org/dc/elements/1.1/";
    public static final String DCTERMS = "http://purl.org/dc/terms/";
    public static final String EP = "http://schemas.openxmlformats.org/officeDocument/2006/extended-properties";
    public static final String VT = "http://schemas.openxmlformats.org/officeDocument/2006/docPropsVTypes";

    /** Paket ağacının sentetik kök ve parça öğeleri için namespace. */
    public static final String PKG = "urn:mersel:roundtrip:package";

    public static final QualifiedName PACKAGE_ROOT = QualifiedName.of(PKG, "package");
    public static final QualifiedName PACKAGE_PART = QualifiedName.of(PKG, "part");
    public static final QualifiedName PART_NAME = QualifiedName.local("name");

    private static final Map<String, String> PREFIX_TO_URI;
    private static final Map<String, String> URI_TO_PREFIX;

    static {
        var prefixes = new LinkedHashMap<String, String>();
        prefixes.put("w", W);
        prefixes.put("a", A);
        prefixes.put("p", P);
        prefixes.put("x", X);
        prefixes.put("r", R);
        prefixes.put("wp", WP);
        prefixes.put("pic", PIC);
        prefixes.put("c", C);
        prefixes.put("xdr", XDR);
        prefixes.put("mc", MC);
        prefixes.put("w14", W14);
        prefixes.put("cp", CP);
        prefixes.put("dc", DC);
        prefixes.put("dcterms", DCTERMS);
        prefixes.put("ep", EP);
        prefixes.put("vt", VT);
        prefixes.put("pkg", PKG);
        PREFIX_TO_URI = Collections.unmodifiableMap(prefixes);

        var uris = new LinkedHashMap<String, String>();
        prefixes.forEach((prefix, uri) -> uris.put(uri, prefix));
        URI_TO_PREFIX = Collections.unmodifiableMap(uris);
    }

    /** Belge özelliklerini (core/app properties) taşıyan namespace'ler. */
    public static final Set<String> METADATA_NAMESPACES = Set.of(CP, DC, DCTERMS, EP, VT);

    private OoxmlNamespaces() {
    }

    public static Optional<String> uriFor(String prefix) {
        return Optional.ofNullable(PREFIX_TO_URI.get(prefix));
    }

    public static Optional<String> prefixFor(String uri) {
        return Optional.ofNullable(uri == null ? null : URI_TO_PREFIX.get(uri));
    }

    public static Map<String, String> prefixes() {
        return PREFIX_TO_URI;
    }

    /**
     * Nitelikli adı kanonik prefix ile yazar: {@code w:color}, {@code val} veya {@code {urn:x}name}.
     */
    public static String render(QualifiedName name) {
        if (!name.hasNamespace()) {
            return name.localName();
        }
        return prefixFor(name.namespaceUri())
                .map(prefix -> prefix + ":" + name.localName())
                .orElseGet(name::toString);
    }
}
