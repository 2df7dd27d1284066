package io.mersel.services.roundtrip.application.interfaces;

/**
 * Belge içeriği ayrıştırılamadığında fırlatılan istisna.
 * <p>
 * Geçersiz XML, bozuk ZIP paketi veya XML parçası içermeyen paket
 * durumlarında kullanılır. Hatalı girdiyi tanımlamak için kaynak adını taşır.
 */
public class DocumentParseException extends Exception {

    private final String sourceName;

    public DocumentParseException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public DocumentParseException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
