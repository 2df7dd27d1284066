package io.mersel.services.roundtrip.application.models;

/**
 * Bir farkın neyi etkilediğini belirten bayraklar.
 */
public record DiffContext(boolean affectsContent, boolean affectsStyling, boolean affectsStructure) {

    public static final DiffContext NONE = new DiffContext(false, false, false);

    public static DiffContext content() {
        return new DiffContext(true, false, false);
    }

    public static DiffContext styling() {
        return new DiffContext(false, true, false);
    }
}
