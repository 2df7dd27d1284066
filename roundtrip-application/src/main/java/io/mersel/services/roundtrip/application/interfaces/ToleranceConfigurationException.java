package io.mersel.services.roundtrip.application.interfaces;

/**
 * Tolerans yapılandırması geçersiz olduğunda fırlatılan istisna.
 * <p>
 * Aralık dışı eşik değerleri, negatif sınırlar veya çakışan profil adları gibi
 * çağıranın düzeltmesi gereken durumlar için kullanılır.
 * Controller bu istisnayı {@code 400 Bad Request} olarak çevirir.
 */
public class ToleranceConfigurationException extends RuntimeException {

    public ToleranceConfigurationException(String message) {
        super(message);
    }

    public ToleranceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
