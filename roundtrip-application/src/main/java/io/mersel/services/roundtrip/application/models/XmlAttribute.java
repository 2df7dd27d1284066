package io.mersel.services.roundtrip.application.models;

/**
 * Ayrıştırılmış ağaçtaki tek bir öznitelik.
 *
 * @param name  Nitelikli öznitelik adı
 * @param value Öznitelik değeri
 */
public record XmlAttribute(QualifiedName name, String value) {
}
