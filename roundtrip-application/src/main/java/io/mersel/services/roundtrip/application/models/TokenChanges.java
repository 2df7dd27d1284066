package io.mersel.services.roundtrip.application.models;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Token yolu bazında sınıflandırılmış değişiklikler.
 * <p>
 * Değerler {@code null} olabilir (değer taşımayan, yalnızca varlığı önemli taşıyıcılar).
 */
public record TokenChanges(
        Map<String, String> preserved,
        Map<String, TokenValueChange> modified,
        Map<String, String> lost,
        Map<String, String> gained
) {

    public TokenChanges {
        preserved = Collections.unmodifiableMap(new TreeMap<>(preserved));
        modified = Collections.unmodifiableMap(new TreeMap<>(modified));
        lost = Collections.unmodifiableMap(new TreeMap<>(lost));
        gained = Collections.unmodifiableMap(new TreeMap<>(gained));
    }
}
