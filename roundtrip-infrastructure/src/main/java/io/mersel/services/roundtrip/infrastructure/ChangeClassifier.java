package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.enums.DiffCategory;
import io.mersel.services.roundtrip.application.enums.DiffSeverity;
import io.mersel.services.roundtrip.application.models.ChangeRecord;
import io.mersel.services.roundtrip.application.models.SemanticDifference;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Fark motorunun çıktısını tolerans değerlendirmesine giren değişiklik kayıtlarına çevirir.
 * <p>
 * Değişiklik türü konumun son öğesinden ve (varsa) öznitelik adından çıkarılır.
 */
@Component
public class ChangeClassifier {

    private static final Set<String> COLOR_NAMES = Set.of(
            "color", "srgbClr", "schemeClr", "sysClr", "shd", "highlight", "fgColor", "bgColor", "fill");
    private static final Set<String> FONT_NAMES = Set.of(
            "rFonts", "latin", "ea", "cs", "sym", "typeface");
    private static final Set<String> SPACING_NAMES = Set.of(
            "spacing", "ind", "before", "after", "line", "marL", "marR", "indent", "spcBef", "spcAft");

    public List<ChangeRecord> classify(List<SemanticDifference> differences) {
        return differences.stream().map(this::classify).toList();
    }

    public ChangeRecord classify(SemanticDifference difference) {
        return new ChangeRecord(changeTypeOf(difference), difference.location(), difference.severity());
    }

    ChangeType changeTypeOf(SemanticDifference difference) {
        List<PathStep> steps = LocationPattern.parseLocation(difference.location());
        if (difference.severity() == DiffSeverity.IGNORABLE || touchesMetadata(steps)) {
            return ChangeType.METADATA_CHANGE;
        }
        if (difference.location().endsWith("/text()") || difference.context().affectsContent()) {
            return ChangeType.CONTENT_LOSS;
        }

        String element = lastElement(steps);
        String attribute = !steps.isEmpty() && steps.get(steps.size() - 1).attribute()
                ? steps.get(steps.size() - 1).name().localName()
                : "";

        if (COLOR_NAMES.contains(element)) {
            return ChangeType.COLOR_SHIFT;
        }
        if (FONT_NAMES.contains(element) || FONT_NAMES.contains(attribute)) {
            return ChangeType.FONT_SUBSTITUTION;
        }
        if (SPACING_NAMES.contains(element) || SPACING_NAMES.contains(attribute)) {
            return ChangeType.SPACING_CHANGE;
        }
        if (difference.context().affectsStyling()) {
            return ChangeType.FORMATTING_LOSS;
        }
        if (attribute.isEmpty() && difference.category() != DiffCategory.MODIFIED) {
            return ChangeType.STRUCTURE_CHANGE;
        }
        return ChangeType.FORMATTING_LOSS;
    }

    private static boolean touchesMetadata(List<PathStep> steps) {
        return steps.stream().anyMatch(step -> SeverityRules.isMetadata(step.name()));
    }

    private static String lastElement(List<PathStep> steps) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (!steps.get(i).attribute()) {
                return steps.get(i).name().localName();
            }
        }
        return "";
    }
}
