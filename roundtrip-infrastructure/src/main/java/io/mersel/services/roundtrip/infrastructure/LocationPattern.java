package io.mersel.services.roundtrip.infrastructure;

import io.mersel.services.roundtrip.application.models.QualifiedName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derlenmiş konum deseni.
 * <p>
 * XPath benzeri bir desen ({@code //a:clrScheme//a:srgbClr/@val}) bir kez derlenir:
 * her adımdaki prefix, kanonik prefix tablosu üzerinden namespace URI'sine çözülür.
 * Eşleştirme iki kademelidir:
 * <ul>
 *   <li>{@link MatchMode#QUALIFIED}: namespace URI + yerel ad</li>
 *   <li>{@link MatchMode#LOCAL_NAME}: yalnızca yerel ad (prefix bağlamı farklı belgeler için geri dönüş)</li>
 * </ul>
 * Prefix'siz desen adımları her iki kademede de yalnızca yerel ada göre eşleşir.
 * Adım sonundaki {@code *} önek eşleşmesi yapar ({@code @w:rsid*} → {@code @w:rsidR}).
 */
public final class LocationPattern {

    public enum MatchMode { QUALIFIED, LOCAL_NAME }

    enum Axis { CHILD, DESCENDANT }

    /**
     * Konumun tek bir adımı: öğe veya öznitelik adı.
     */
    public record PathStep(QualifiedName name, boolean attribute) {

        public static PathStep element(QualifiedName name) {
            return new PathStep(name, false);
        }

        public static PathStep attribute(QualifiedName name) {
            return new PathStep(name, true);
        }
    }

    record Step(Axis axis, String namespaceUri, String localName, boolean attribute, boolean prefixWildcard) {

        boolean matches(PathStep candidate, MatchMode mode) {
            if (candidate.attribute() != attribute) {
                return false;
            }
            String candidateLocal = candidate.name().localName();
            if (prefixWildcard) {
                if (!candidateLocal.startsWith(localName)) {
                    return false;
                }
            } else if (!"*".equals(localName) && !candidateLocal.equals(localName)) {
                return false;
            }
            if (namespaceUri == null || mode == MatchMode.LOCAL_NAME) {
                return true;
            }
            return namespaceUri.equals(candidate.name().namespaceUri());
        }
    }

    private final String source;
    private final List<Step> steps;
    private final List<String> unresolvedPrefixes;

    private LocationPattern(String source, List<Step> steps, List<String> unresolvedPrefixes) {
        this.source = source;
        this.steps = List.copyOf(steps);
        this.unresolvedPrefixes = List.copyOf(unresolvedPrefixes);
    }

    /**
     * Deseni derler.
     * <p>
     * Baştaki {@code //} veya eğik çizgisiz başlangıç herhangi bir derinlikte eşleşir;
     * tek {@code /} kökten başlar. Tabloda olmayan prefix'ler yalnızca yerel ad adımına düşer
     * ve {@link #unresolvedPrefixes()} ile raporlanır.
     *
     * @throws IllegalArgumentException desen boşsa veya adım içermiyorsa
     */
    public static LocationPattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Konum deseni boş olamaz");
        }
        String trimmed = pattern.trim();
        var steps = new ArrayList<Step>();
        var unresolved = new ArrayList<String>();

        boolean absolute = trimmed.startsWith("/");
        // Boş token, "//" içindeki ikinci eğik çizgidir
        int emptyTokens = 0;
        for (String token : tokenize(trimmed)) {
            if (token.isEmpty()) {
                emptyTokens++;
                continue;
            }
            Axis axis = emptyTokens > 0 || (steps.isEmpty() && !absolute) ? Axis.DESCENDANT : Axis.CHILD;
            emptyTokens = 0;
            String name = stripPredicate(token);
            if (name.equals("text()") || name.equals("node()")) {
                continue;
            }
            boolean attribute = name.startsWith("@");
            if (attribute) {
                name = name.substring(1);
            }
            boolean wildcard = name.length() > 1 && name.endsWith("*");
            if (wildcard) {
                name = name.substring(0, name.length() - 1);
            }
            QualifiedName resolved = resolveName(name, unresolved);
            steps.add(new Step(axis, resolved.namespaceUri(), resolved.localName(), attribute, wildcard));
        }
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("Konum deseni adım içermiyor: " + pattern);
        }
        return new LocationPattern(trimmed, steps, unresolved);
    }

    /**
     * Bir konum dizesini adımlara ayırır.
     * <p>
     * Konum sırası göstergeleri ({@code [2]}) ve {@code text()} adımı atılır.
     * Kanonik prefix'ler URI'ye, Clark gösterimi doğrudan nitelikli ada çözülür;
     * tanınmayan prefix'li adlar namespace'siz kabul edilir.
     */
    public static List<PathStep> parseLocation(String location) {
        var result = new ArrayList<PathStep>();
        if (location == null) {
            return result;
        }
        for (String token : tokenize(location.trim())) {
            if (token.isEmpty()) {
                continue;
            }
            String name = stripPredicate(token);
            if (name.equals("text()") || name.equals("node()")) {
                continue;
            }
            boolean attribute = name.startsWith("@");
            if (attribute) {
                name = name.substring(1);
            }
            QualifiedName resolved = resolveName(name, new ArrayList<>());
            result.add(new PathStep(resolved, attribute));
        }
        return result;
    }

    /**
     * Desen, konumun kendisiyle eşleşiyor mu? (taşıyıcı tarama)
     */
    public boolean matches(List<PathStep> path, MatchMode mode) {
        if (path.isEmpty() || !steps.get(steps.size() - 1).matches(path.get(path.size() - 1), mode)) {
            return false;
        }
        return match(0, 0, path, mode, false);
    }

    /**
     * Desen konumla veya konumun herhangi bir atasıyla eşleşiyor mu? (tolerans yolları)
     * <p>
     * {@code //w:tbl} deseni bir tablo içindeki tüm değişiklikleri kapsar.
     */
    public boolean covers(List<PathStep> path, MatchMode mode) {
        return match(0, 0, path, mode, true);
    }

    public boolean covers(String location, MatchMode mode) {
        return covers(parseLocation(location), mode);
    }

    private boolean match(int stepIndex, int pathIndex, List<PathStep> path, MatchMode mode, boolean allowTrailing) {
        if (stepIndex == steps.size()) {
            return allowTrailing || pathIndex == path.size();
        }
        Step step = steps.get(stepIndex);
        if (step.axis() == Axis.CHILD) {
            return pathIndex < path.size()
                    && step.matches(path.get(pathIndex), mode)
                    && match(stepIndex + 1, pathIndex + 1, path, mode, allowTrailing);
        }
        for (int i = pathIndex; i < path.size(); i++) {
            if (step.matches(path.get(i), mode) && match(stepIndex + 1, i + 1, path, mode, allowTrailing)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Desen bir özniteliği mi hedefliyor?
     */
    public boolean targetsAttribute() {
        return steps.get(steps.size() - 1).attribute();
    }

    /**
     * Desende kullanılan namespace URI'leri.
     */
    public List<String> namespaceUris() {
        return steps.stream()
                .map(Step::namespaceUri)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    public List<String> unresolvedPrefixes() {
        return unresolvedPrefixes;
    }

    public String source() {
        return source;
    }

    List<Step> steps() {
        return steps;
    }

    @Override
    public String toString() {
        return source;
    }

    // ── Ayrıştırma yardımcıları ─────────────────────────────────────────

    /**
     * '/' karakterinden böler; süslü parantez (Clark URI) ve köşeli parantez (predicate)
     * içindeki eğik çizgiler bölme noktası sayılmaz. Ardışık eğik çizgiler boş token üretir.
     */
    private static List<String> tokenize(String value) {
        var tokens = new ArrayList<String>();
        var current = new StringBuilder();
        int braces = 0;
        int brackets = 0;
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '{') {
                braces++;
            } else if (ch == '}') {
                braces = Math.max(0, braces - 1);
            } else if (ch == '[') {
                brackets++;
            } else if (ch == ']') {
                brackets = Math.max(0, brackets - 1);
            }
            if (ch == '/' && braces == 0 && brackets == 0) {
                tokens.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        tokens.add(current.toString());
        // Baştaki boş token, kökten gelen eğik çizgiyi temsil eder; adım değildir
        if (!tokens.isEmpty() && tokens.get(0).isEmpty()) {
            tokens.remove(0);
        }
        return tokens;
    }

    private static String stripPredicate(String token) {
        int closingBrace = token.lastIndexOf('}');
        int bracket = token.indexOf('[', Math.max(0, closingBrace));
        return bracket >= 0 ? token.substring(0, bracket).trim() : token.trim();
    }

    private static QualifiedName resolveName(String name, List<String> unresolved) {
        if (name.startsWith("{")) {
            int end = name.indexOf('}');
            if (end > 0) {
                return QualifiedName.of(name.substring(1, end), name.substring(end + 1));
            }
        }
        int colon = name.indexOf(':');
        if (colon <= 0) {
            return QualifiedName.local(name);
        }
        String prefix = name.substring(0, colon);
        String local = name.substring(colon + 1);
        var uri = OoxmlNamespaces.uriFor(prefix);
        if (uri.isEmpty()) {
            unresolved.add(prefix);
            return QualifiedName.local(local);
        }
        return QualifiedName.of(uri.get(), local);
    }
}
