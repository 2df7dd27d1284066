package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.models.QualifiedName;
import io.mersel.services.roundtrip.application.models.XmlNode;
import io.mersel.services.roundtrip.infrastructure.LocationPattern.PathStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 * Ağacı belge sırasıyla dolaşır ve her öğe için adım listesini ve normalize konumu üretir.
 * <p>
 * Konum biçimi: {@code /w:document[1]/w:body[1]/w:p[2]}; sıra numarası aynı adlı
 * kardeşler arasındaki konumdur.
 */
final class XmlTreeWalker {

    @FunctionalInterface
    interface Visitor {
        /**
         * @param path     Kökten bu öğeye kadar adımlar; yalnızca çağrı süresince geçerli
         * @param location Öğenin normalize konumu
         */
        void visit(XmlNode node, List<PathStep> path, String location);
    }

    private XmlTreeWalker() {
    }

    static void walk(XmlNode root, Visitor visitor) {
        walk(root, new ArrayList<>(), "/" + label(root.name(), 1), visitor);
    }

    private static void walk(XmlNode node, List<PathStep> path, String location, Visitor visitor) {
        path.add(PathStep.element(node.name()));
        visitor.visit(node, Collections.unmodifiableList(path), location);
        var ordinals = new HashMap<QualifiedName, Integer>();
        for (XmlNode child : node.children()) {
            int ordinal = ordinals.merge(child.name(), 1, Integer::sum);
            walk(child, path, location + "/" + label(child.name(), ordinal), visitor);
        }
        path.remove(path.size() - 1);
    }

    static String label(QualifiedName name, int ordinal) {
        return OoxmlNamespaces.render(name) + "[" + ordinal + "]";
    }

    static String attributeLocation(String elementLocation, QualifiedName attributeName) {
        return elementLocation + "/@" + OoxmlNamespaces.render(attributeName);
    }

    static List<PathStep> child(List<PathStep> path, PathStep step) {
        var extended = new ArrayList<PathStep>(path.size() + 1);
        extended.addAll(path);
        extended.add(step);
        return extended;
    }
}
