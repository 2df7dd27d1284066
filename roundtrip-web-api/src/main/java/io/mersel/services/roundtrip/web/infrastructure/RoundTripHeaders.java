package io.mersel.services.roundtrip.web.infrastructure;

/**
 * Round-trip test endpoint'inin özel HTTP response header sabitleri.
 *
 * <pre>
 * HTTP/1.1 200 OK
 * Content-Type: application/json
 * X-RoundTrip-Result: PASS
 * X-RoundTrip-Profile: normal
 * X-RoundTrip-Duration-Ms: 145
 * </pre>
 */
public final class RoundTripHeaders {

    private RoundTripHeaders() {
    }

    /** Test sonucu ({@code PASS} / {@code FAIL}). */
    public static final String RESULT = "X-RoundTrip-Result";

    /** Uygulanan tolerans profili. */
    public static final String PROFILE = "X-RoundTrip-Profile";

    /** İşlem süresi (milisaniye). */
    public static final String DURATION_MS = "X-RoundTrip-Duration-Ms";
}
