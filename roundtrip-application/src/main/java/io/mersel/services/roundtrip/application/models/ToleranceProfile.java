package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.ChangeType;
import io.mersel.services.roundtrip.application.enums.ToleranceLevel;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Adlandırılmış tolerans profili.
 * <p>
 * Değişmezdir; ayarlama ve türetme işlemleri yeni bir profil üretir.
 *
 * @param name           Profil adı
 * @param level          Katılık seviyesi
 * @param rules          Sıralı kurallar
 * @param criticalPaths  Hiçbir koşulda gerilememesi gereken konum desenleri
 * @param ignorablePaths Tüm sayımlardan hariç tutulan konum desenleri
 */
public record ToleranceProfile(
        String name,
        ToleranceLevel level,
        List<ToleranceRule> rules,
        Set<String> criticalPaths,
        Set<String> ignorablePaths
) {

    public ToleranceProfile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(level, "level");
        rules = rules == null ? List.of() : List.copyOf(rules);
        criticalPaths = criticalPaths == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(criticalPaths));
        ignorablePaths = ignorablePaths == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(ignorablePaths));
    }

    public List<ToleranceRule> rulesFor(ChangeType changeType) {
        return rules.stream().filter(r -> r.changeType() == changeType).toList();
    }

    public ToleranceProfile withName(String newName) {
        return new ToleranceProfile(newName, level, rules, criticalPaths, ignorablePaths);
    }

    public ToleranceProfile withRules(List<ToleranceRule> newRules) {
        return new ToleranceProfile(name, level, newRules, criticalPaths, ignorablePaths);
    }
}
