package io.mersel.services.roundtrip.application.enums;

/**
 * Dönüşüm testlerinin yapıldığı ofis platformları.
 */
public enum PlatformType {
    MICROSOFT_OFFICE,
    LIBREOFFICE,
    GOOGLE_WORKSPACE,
    APPLE_PAGES,
    WPS_OFFICE
}
