package io.mersel.services.roundtrip.application.models;

import io.mersel.services.roundtrip.application.enums.DocumentType;
import io.mersel.services.roundtrip.application.enums.PlatformType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PlatformTestResult")
class PlatformTestResultTest {

    @Test
    @DisplayName("criticalFailures verilmezse boş liste")
    void nullFailuresBecomeEmpty() {
        var result = new PlatformTestResult(PlatformType.LIBREOFFICE, DocumentType.WORD, "7.6", null, null);

        assertThat(result.criticalFailures()).isEmpty();
        assertThat(result.carrierMetrics()).isNull();
    }

    @Test
    @DisplayName("criticalFailures kopyalanır ve değiştirilemez")
    void failuresCopied() {
        var failures = new ArrayList<>(List.of("Primary brand color"));
        var result = new PlatformTestResult(PlatformType.MICROSOFT_OFFICE, DocumentType.PRESENTATION, "16",
                null, failures);

        failures.add("Heading font");

        assertThat(result.criticalFailures()).containsExactly("Primary brand color");
        assertThatThrownBy(() -> result.criticalFailures().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
