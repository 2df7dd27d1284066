package io.mersel.services.roundtrip.application.interfaces;

/**
 * İstenen tolerans profili kayıtlı değil.
 * Controller bu istisnayı {@code 404 Not Found} olarak çevirir.
 */
public class UnknownToleranceProfileException extends ToleranceConfigurationException {

    private final String profileName;

    public UnknownToleranceProfileException(String profileName) {
        super("Tolerans profili bulunamadı: " + profileName);
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}
