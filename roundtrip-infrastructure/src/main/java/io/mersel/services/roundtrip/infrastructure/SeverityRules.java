package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.CarrierSignificance;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.models.DiffContext;
import io.mersel.services.roundtrip.application.models.QualifiedName;
import io.mersel.services.roundtrip.application.models.XmlAttribute;
import io.mersel.services.roundtrip.application.models.XmlNode;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fark önem seviyesi kuralları.
 * <p>
 * Kurallar nitelikli ada ve belge türüne göre uygulanır; tasarım açısından önemli
 * stil öznitelikleri taşıyıcı kataloğundan okunur. Belge türü verilmemişse
 * tüm türlerin kuralları birlikte uygulanır.
 */
final class SeverityRules {

    /**
     * Bir öğe ekleme/kaldırma farkının önem seviyesi ve bağlamı.
     */
    record Assessment(DiffSeverity severity, DiffContext context) {
    }

    // ── Yok sayılabilir işaretleme ──
    private static final Set<String> IGNORABLE_ATTRIBUTES = Set.of("paraId", "textId");
    private static final String REVISION_ID_PREFIX = "rsid";
    private static final Set<String> IGNORABLE_ELEMENTS = Set.of(
            "proofErr", "lastRenderedPageBreak", "bookmarkStart", "bookmarkEnd");
    private static final Set<String> IGNORABLE_PROPERTIES = Set.of(
            "lastPrinted", "modified", "lastModifiedBy", "revision");

    // ── Stil kapsayıcıları ve stil öğeleri ──
    private static final Set<String> STYLING_ELEMENTS = Set.of(
            "rPr", "pPr", "tblPr", "tcPr", "trPr", "sectPr", "spPr", "defRPr", "bodyPr",
            "rPrDefault", "pPrDefault", "style", "color", "sz", "szCs", "rFonts", "b", "i", "u",
            "strike", "highlight", "spacing", "ind", "jc", "shd", "srgbClr", "schemeClr", "sysClr",
            "solidFill", "latin", "ea", "cs", "ln", "fill", "patternFill", "fgColor", "bgColor",
            "xf", "font", "numFmt", "clrScheme", "fontScheme", "fmtScheme", "cellStyle");

    // ── İçerik taşıyan öğeler (belge türüne göre) ──
    private static final Map<DocumentType, Set<String>> CONTENT_ELEMENTS = new EnumMap<>(Map.of(
            DocumentType.WORD, Set.of("p", "r", "t", "tbl", "tr", "tc", "drawing", "pic", "hyperlink"),
            DocumentType.PRESENTATION, Set.of("sp", "pic", "graphicFrame", "grpSp", "txBody", "p", "r", "t", "sld"),
            DocumentType.SPREADSHEET, Set.of("row", "c", "v", "f", "is", "si", "t", "sheetData")));

    private static final Set<String> ALL_CONTENT_ELEMENTS;

    static {
        var union = new HashSet<String>();
        CONTENT_ELEMENTS.values().forEach(union::addAll);
        ALL_CONTENT_ELEMENTS = Set.copyOf(union);
    }

    private final CarrierCatalog catalog;

    SeverityRules(CarrierCatalog catalog) {
        this.catalog = catalog;
    }

    // ── Yok sayılabilirlik ──────────────────────────────────────────

    static boolean isIgnorableAttribute(QualifiedName name) {
        String local = name.localName();
        if (local.startsWith(REVISION_ID_PREFIX) || IGNORABLE_ATTRIBUTES.contains(local)) {
            return true;
        }
        return OoxmlNamespaces.MC.equals(name.namespaceUri()) && "Ignorable".equals(local);
    }

    static boolean isIgnorableElement(QualifiedName name) {
        if (IGNORABLE_ELEMENTS.contains(name.localName())) {
            return true;
        }
        String uri = name.namespaceUri();
        return (OoxmlNamespaces.CP.equals(uri) || OoxmlNamespaces.DCTERMS.equals(uri))
                && IGNORABLE_PROPERTIES.contains(name.localName());
    }

    /**
     * Yoldaki herhangi bir öğe yok sayılabilir mi? (yer imi içindeki öznitelikler de yok sayılır)
     */
    static boolean insideIgnorable(List<PathStep> path) {
        for (PathStep step : path) {
            if (!step.attribute() && isIgnorableElement(step.name())) {
                return true;
            }
        }
        return false;
    }

    static boolean isStylingPath(List<PathStep> path) {
        for (PathStep step : path) {
            if (!step.attribute() && STYLING_ELEMENTS.contains(step.name().localName())) {
                return true;
            }
        }
        return false;
    }

    static boolean isMetadata(QualifiedName name) {
        return name.hasNamespace() && OoxmlNamespaces.METADATA_NAMESPACES.contains(name.namespaceUri());
    }

    boolean isContentElement(QualifiedName name, DocumentType documentType) {
        Set<String> names = documentType == null ? ALL_CONTENT_ELEMENTS : CONTENT_ELEMENTS.get(documentType);
        return names.contains(name.localName()) && !isMetadata(name);
    }

    // ── Önem seviyeleri ─────────────────────────────────────────────

    /**
     * Metin değişikliği: görünür metin CRITICAL, belge özellikleri MINOR.
     *
     * @param ownerPath Metni taşıyan öğeye kadar olan yol
     */
    DiffSeverity textSeverity(List<PathStep> ownerPath) {
        if (insideIgnorable(ownerPath)) {
            return DiffSeverity.IGNORABLE;
        }
        QualifiedName owner = ownerPath.get(ownerPath.size() - 1).name();
        return isMetadata(owner) ? DiffSeverity.MINOR : DiffSeverity.CRITICAL;
    }

    /**
     * Öznitelik değişikliği.
     *
     * @param ownerPath     Özniteliğin sahibi öğeye kadar olan yol
     * @param attributeName Öznitelik adı
     */
    DiffSeverity attributeSeverity(List<PathStep> ownerPath, QualifiedName attributeName, DocumentType documentType) {
        if (isIgnorableAttribute(attributeName) || insideIgnorable(ownerPath)) {
            return DiffSeverity.IGNORABLE;
        }
        if (!isStylingPath(ownerPath)) {
            return DiffSeverity.MINOR;
        }
        var attributePath = XmlTreeWalker.child(ownerPath, PathStep.attribute(attributeName));
        Optional<CarrierSignificance> significance = catalog.significanceOf(documentType, attributePath)
                .or(() -> catalog.significanceOf(documentType, ownerPath));
        return significance.map(SeverityRules::fromSignificance).orElse(DiffSeverity.MINOR);
    }

    DiffContext attributeContext(List<PathStep> ownerPath) {
        return isStylingPath(ownerPath) ? DiffContext.styling() : DiffContext.NONE;
    }

    /**
     * Öğe ekleme veya kaldırma.
     *
     * @param node Eklenen veya kaldırılan öğe
     * @param path Öğenin kendisi dahil yol
     */
    Assessment elementAssessment(XmlNode node, List<PathStep> path, DocumentType documentType) {
        if (insideIgnorable(path)) {
            return new Assessment(DiffSeverity.IGNORABLE, DiffContext.NONE);
        }
        if (isContentElement(node.name(), documentType)) {
            boolean carriesText = node.hasDescendantText();
            return new Assessment(
                    carriesText ? DiffSeverity.CRITICAL : DiffSeverity.MAJOR,
                    new DiffContext(carriesText, false, true));
        }
        Optional<CarrierSignificance> significance = highestInSubtree(node, path, documentType);
        if (significance.isPresent()) {
            return new Assessment(fromSignificance(significance.get()), new DiffContext(false, true, false));
        }
        if (isStylingPath(path)) {
            return new Assessment(DiffSeverity.MINOR, DiffContext.styling());
        }
        if (isMetadata(node.name())) {
            return new Assessment(DiffSeverity.MINOR, DiffContext.NONE);
        }
        return new Assessment(DiffSeverity.MAJOR, new DiffContext(node.hasDescendantText(), false, true));
    }

    private Optional<CarrierSignificance> highestInSubtree(XmlNode node, List<PathStep> path, DocumentType documentType) {
        CarrierSignificance best = null;
        var candidates = new ArrayList<List<PathStep>>();
        collectPaths(node, new ArrayList<>(path), candidates);
        for (List<PathStep> candidate : candidates) {
            var found = catalog.significanceOf(documentType, candidate);
            if (found.isPresent() && (best == null || found.get().ordinal() < best.ordinal())) {
                best = found.get();
                if (best == CarrierSignificance.CRITICAL) {
                    break;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private static void collectPaths(XmlNode node, List<PathStep> path, List<List<PathStep>> sink) {
        sink.add(List.copyOf(path));
        for (XmlAttribute attribute : node.attributes()) {
            sink.add(XmlTreeWalker.child(path, PathStep.attribute(attribute.name())));
        }
        for (XmlNode child : node.children()) {
            path.add(PathStep.element(child.name()));
            collectPaths(child, path, sink);
            path.remove(path.size() - 1);
        }
    }

    private static DiffSeverity fromSignificance(CarrierSignificance significance) {
        return switch (significance) {
            case CRITICAL, IMPORTANT -> DiffSeverity.CRITICAL;
            case MODERATE, COSMETIC -> DiffSeverity.MAJOR;
        };
    }
}
