package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.interfaces.ISemanticDiffEngine;
import io.mersel.services.roundtrip.application.models.DiffContext;
import io.mersel.services.roundtrip.application.models.DiffResult;
import io.mersel.services.roundtrip.application.models.DiffSummary;
import io.mersel.services.roundtrip.application.models.ParsedDocument;
import io.mersel.services.roundtrip.application.models.PreservationMetrics;
import io.mersel.services.roundtrip.application.models.QualifiedName;
import io.mersel.services.roundtrip.application.models.SemanticDifference;
import io.mersel.services.roundtrip.application.models.XmlAttribute;
import io.mersel.services.roundtrip.application.models.XmlNode;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Namespace'e duyarlı yapısal fark motoru.
 * <p>
 * Hizalama iki geçişlidir:
 * <ol>
 *   <li>Kimlik anahtarı: nitelikli ad + kimlik özniteliği ({@code styleId}, {@code numId},
 *       {@code abstractNumId}, {@code sheetId}, {@code id}; SpreadsheetML'de hücre/satır
 *       referansı {@code r}; paket parçalarında parça adı)</li>
 *   <li>Kalan kardeşler arasında aynı nitelikli ada sahip öğelerin sırası</li>
 * </ol>
 * Eşleşmeyen öğeler DROPPED (yalnızca orijinalde) veya ADDED (yalnızca dönüştürülmüşte) olur.
 * Önem seviyeleri {@link SeverityRules} tarafından atanır.
 */
@Service
public class SemanticDiffEngine implements ISemanticDiffEngine {

    private static final Logger log = LoggerFactory.getLogger(SemanticDiffEngine.class);

    private static final List<String> IDENTITY_ATTRIBUTES = List.of("styleId", "numId", "abstractNumId", "sheetId", "id");
    private static final Set<String> NON_IDENTITY_NAMESPACES = Set.of(OoxmlNamespaces.R, OoxmlNamespaces.W14);
    private static final QualifiedName CELL_REFERENCE = QualifiedName.local("r");

    private final SeverityRules rules;

    public SemanticDiffEngine(CarrierCatalog catalog) {
        this.rules = new SeverityRules(catalog);
    }

    // ── Analiz ──────────────────────────────────────────────────────

    @Override
    public DiffResult analyzeDifferences(ParsedDocument original, ParsedDocument converted, DocumentType documentType) {
        var run = new DiffRun(documentType);
        XmlNode left = original.root();
        XmlNode right = converted.root();
        var path = new ArrayList<PathStep>();
        path.add(PathStep.element(left.name()));
        String leftLocation = "/" + XmlTreeWalker.label(left.name(), 1);

        if (left.name().equals(right.name())) {
            run.compare(left, right, path, leftLocation);
        } else {
            run.dropped(left, path, leftLocation);
            run.added(right, List.of(PathStep.element(right.name())), "/" + XmlTreeWalker.label(right.name(), 1));
        }

        int comparable = original.comparableItems();
        double preservationRate = comparable == 0
                ? 100.0
                : 100.0 * (comparable - Math.min(run.affected, comparable)) / comparable;
        List<SemanticDifference> differences = List.copyOf(run.differences);
        DiffSummary summary = DiffSummary.of(differences, preservationRate);

        log.debug("Fark analizi: {} ↔ {} ({}) → {} fark, {} kritik, korunma %{}",
                original.sourceName(), converted.sourceName(), documentType,
                summary.totalDifferences(), summary.criticalChanges().size(),
                String.format(Locale.ROOT, "%.1f", summary.preservationRate()));

        return new DiffResult(differences, summary, comparable);
    }

    @Override
    public List<SemanticDifference> filterDifferences(List<SemanticDifference> differences,
                                                      DiffSeverity minSeverity,
                                                      Set<DiffCategory> categories) {
        DiffSeverity threshold = minSeverity != null ? minSeverity : DiffSeverity.IGNORABLE;
        return differences.stream()
                .filter(d -> d.severity().isAtLeast(threshold))
                .filter(d -> categories == null || categories.isEmpty() || categories.contains(d.category()))
                .toList();
    }

    @Override
    public PreservationMetrics getPreservationMetrics(List<SemanticDifference> differences, int totalElements) {
        if (differences.isEmpty()) {
            return new PreservationMetrics(1.0, 1.0, 1.0, 1.0, 0.0);
        }
        int denominator = Math.max(totalElements, 1);
        return new PreservationMetrics(
                preserved(differences, d -> d.severity() != DiffSeverity.IGNORABLE, denominator),
                preserved(differences, d -> d.context().affectsContent(), denominator),
                preserved(differences, d -> d.context().affectsStyling(), denominator),
                preserved(differences, d -> d.context().affectsStructure(), denominator),
                (double) differences.size() / denominator);
    }

    private static double preserved(List<SemanticDifference> differences,
                                    Predicate<SemanticDifference> affected, int denominator) {
        long count = differences.stream().filter(affected).count();
        return Math.max(0.0, Math.min(1.0, 1.0 - (double) count / denominator));
    }

    // ── Hizalama ────────────────────────────────────────────────────

    /**
     * Kimlik anahtarı: nitelikli ad ve kimlik özniteliğinin değeri. Kimliği olmayan öğeler için boş.
     */
    static Optional<String> identityKey(XmlNode node) {
        if (node.name().equals(OoxmlNamespaces.PACKAGE_PART)) {
            return node.attribute(OoxmlNamespaces.PART_NAME).map(a -> node.name() + "#" + a.value());
        }
        for (String candidate : IDENTITY_ATTRIBUTES) {
            for (XmlAttribute attribute : node.attributes()) {
                QualifiedName name = attribute.name();
                if (name.localName().equals(candidate)
                        && (!name.hasNamespace() || !NON_IDENTITY_NAMESPACES.contains(name.namespaceUri()))) {
                    return Optional.of(node.name() + "#" + candidate + "=" + attribute.value());
                }
            }
        }
        if (OoxmlNamespaces.X.equals(node.name().namespaceUri())) {
            return node.attribute(CELL_REFERENCE).map(a -> node.name() + "#r=" + a.value());
        }
        return Optional.empty();
    }

    /**
     * Sol çocuk indeksi → sağ çocuk indeksi eşleşmesi; eşleşmeyenler -1.
     */
    static int[] alignChildren(List<XmlNode> left, List<XmlNode> right) {
        int[] match = new int[left.size()];
        Arrays.fill(match, -1);
        boolean[] taken = new boolean[right.size()];

        // 1. geçiş: kimlik anahtarı
        var byKey = new HashMap<String, ArrayDeque<Integer>>();
        for (int j = 0; j < right.size(); j++) {
            int index = j;
            identityKey(right.get(j)).ifPresent(key ->
                    byKey.computeIfAbsent(key, k -> new ArrayDeque<>()).add(index));
        }
        for (int i = 0; i < left.size(); i++) {
            Optional<String> key = identityKey(left.get(i));
            if (key.isEmpty()) {
                continue;
            }
            ArrayDeque<Integer> candidates = byKey.get(key.get());
            if (candidates != null && !candidates.isEmpty()) {
                int j = candidates.poll();
                match[i] = j;
                taken[j] = true;
            }
        }

        // 2. geçiş: kalan aynı adlı kardeşler arasında sıra
        var remaining = new HashMap<QualifiedName, ArrayDeque<Integer>>();
        for (int j = 0; j < right.size(); j++) {
            if (!taken[j]) {
                remaining.computeIfAbsent(right.get(j).name(), k -> new ArrayDeque<>()).add(j);
            }
        }
        for (int i = 0; i < left.size(); i++) {
            if (match[i] >= 0) {
                continue;
            }
            ArrayDeque<Integer> candidates = remaining.get(left.get(i).name());
            if (candidates != null && !candidates.isEmpty()) {
                match[i] = candidates.poll();
            }
        }
        return match;
    }

    // ── Tek bir karşılaştırmanın durumu ─────────────────────────────

    private final class DiffRun {

        private final DocumentType documentType;
        private final List<SemanticDifference> differences = new ArrayList<>();
        private int affected;

        DiffRun(DocumentType documentType) {
            this.documentType = documentType;
        }

        void compare(XmlNode left, XmlNode right, List<PathStep> path, String location) {
            compareText(left, right, path, location);
            compareAttributes(left, right, path, location);
            compareChildren(left, right, path, location);
        }

        private void compareText(XmlNode left, XmlNode right, List<PathStep> path, String location) {
            String before = left.text().strip();
            String after = right.text().strip();
            if (before.equals(after)) {
                return;
            }
            DiffSeverity severity = rules.textSeverity(path);
            DiffContext context = severity == DiffSeverity.CRITICAL ? DiffContext.content() : DiffContext.NONE;
            String textLocation = location + "/text()";
            if (before.isEmpty()) {
                record(textLocation, DiffCategory.ADDED, severity,
                        "Text added: '" + after + "'", null, after, context);
                return;
            }
            if (after.isEmpty()) {
                record(textLocation, DiffCategory.DROPPED, severity,
                        "Text removed: '" + before + "'", before, null, context);
            } else {
                record(textLocation, DiffCategory.MODIFIED, severity,
                        "Text changed from '" + before + "' to '" + after + "'", before, after, context);
            }
            if (severity != DiffSeverity.IGNORABLE) {
                affected++;
            }
        }

        private void compareAttributes(XmlNode left, XmlNode right, List<PathStep> path, String location) {
            DiffContext context = rules.attributeContext(path);
            for (XmlAttribute attribute : left.attributes()) {
                QualifiedName name = attribute.name();
                String rendered = OoxmlNamespaces.render(name);
                String attributeLocation = XmlTreeWalker.attributeLocation(location, name);
                DiffSeverity severity = rules.attributeSeverity(path, name, documentType);
                Optional<XmlAttribute> counterpart = right.attribute(name);
                if (counterpart.isEmpty()) {
                    record(attributeLocation, DiffCategory.DROPPED, severity,
                            "Attribute " + rendered + " removed (was '" + attribute.value() + "')",
                            attribute.value(), null, context);
                } else if (!counterpart.get().value().equals(attribute.value())) {
                    String after = counterpart.get().value();
                    record(attributeLocation, DiffCategory.MODIFIED, severity,
                            "Attribute " + rendered + " changed from '" + attribute.value() + "' to '" + after + "'",
                            attribute.value(), after, context);
                } else {
                    continue;
                }
                if (severity != DiffSeverity.IGNORABLE) {
                    affected++;
                }
            }
            for (XmlAttribute attribute : right.attributes()) {
                QualifiedName name = attribute.name();
                if (left.attribute(name).isEmpty()) {
                    record(XmlTreeWalker.attributeLocation(location, name), DiffCategory.ADDED,
                            rules.attributeSeverity(path, name, documentType),
                            "Attribute " + OoxmlNamespaces.render(name) + " added with value '" + attribute.value() + "'",
                            null, attribute.value(), context);
                }
            }
        }

        private void compareChildren(XmlNode left, XmlNode right, List<PathStep> path, String location) {
            List<XmlNode> leftChildren = left.children();
            List<XmlNode> rightChildren = right.children();
            if (leftChildren.isEmpty() && rightChildren.isEmpty()) {
                return;
            }
            int[] match = alignChildren(leftChildren, rightChildren);
            boolean[] matchedRight = new boolean[rightChildren.size()];

            var leftOrdinals = new HashMap<QualifiedName, Integer>();
            for (int i = 0; i < leftChildren.size(); i++) {
                XmlNode child = leftChildren.get(i);
                int ordinal = leftOrdinals.merge(child.name(), 1, Integer::sum);
                String childLocation = location + "/" + XmlTreeWalker.label(child.name(), ordinal);
                path.add(PathStep.element(child.name()));
                if (match[i] >= 0) {
                    matchedRight[match[i]] = true;
                    compare(child, rightChildren.get(match[i]), path, childLocation);
                } else {
                    dropped(child, path, childLocation);
                }
                path.remove(path.size() - 1);
            }

            var rightOrdinals = new HashMap<QualifiedName, Integer>();
            for (int j = 0; j < rightChildren.size(); j++) {
                XmlNode child = rightChildren.get(j);
                int ordinal = rightOrdinals.merge(child.name(), 1, Integer::sum);
                if (!matchedRight[j]) {
                    added(child, XmlTreeWalker.child(path, PathStep.element(child.name())),
                            location + "/" + XmlTreeWalker.label(child.name(), ordinal));
                }
            }
        }

        void dropped(XmlNode node, List<PathStep> path, String location) {
            SeverityRules.Assessment assessment = rules.elementAssessment(node, path, documentType);
            record(location, DiffCategory.DROPPED, assessment.severity(),
                    "Element " + OoxmlNamespaces.render(node.name()) + " removed" + textHint(node),
                    null, null, assessment.context());
            if (assessment.severity() != DiffSeverity.IGNORABLE) {
                affected += node.countItems();
            }
        }

        void added(XmlNode node, List<PathStep> path, String location) {
            SeverityRules.Assessment assessment = rules.elementAssessment(node, path, documentType);
            record(location, DiffCategory.ADDED, assessment.severity(),
                    "Element " + OoxmlNamespaces.render(node.name()) + " added" + textHint(node),
                    null, null, assessment.context());
        }

        private void record(String location, DiffCategory category, DiffSeverity severity, String description,
                            String oldValue, String newValue, DiffContext context) {
            differences.add(new SemanticDifference(location, category, severity, description,
                    oldValue, newValue, context));
        }
    }

    private static String textHint(XmlNode node) {
        String text = node.text().strip();
        if (text.isEmpty()) {
            return "";
        }
        return text.length() > 40 ? " ('" + text.substring(0, 40) + "…')" : " ('" + text + "')";
    }
}
