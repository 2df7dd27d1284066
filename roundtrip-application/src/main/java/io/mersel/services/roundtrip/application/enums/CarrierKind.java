package io.mersel.services.roundtrip.application.enums;

/**
 * Tasarım token'ı taşıyan işaretleme konumlarının türleri.
 */
public enum CarrierKind {

    // ── Tema ──
    COLOR_SCHEME,
    FONT_SCHEME,
    THEME_VARIANT,

    // ── Stil ──
    PARAGRAPH_STYLE,
    CHARACTER_STYLE,
    TABLE_STYLE,
    LIST_STYLE,

    // ── Uygulamaya özgü ──
    LAYOUT_MASTER,
    CELL_STYLE
}
