package io.mersel.services.roundtrip.application.models;

/**
 * Her iki versiyonda bulunan ama değeri değişen token.
 */
public record TokenValueChange(String original, String converted) {
}
