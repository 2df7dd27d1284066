package io.mersel.services.roundtrip.web.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * REST JSON serileştirme ayarları.
 * <p>
 * Alan adları snake_case yazılır ({@code survival_rate}, {@code critical_paths}),
 * zaman damgaları ISO-8601 metni olarak döner.
 */
@Configuration
public class JacksonConfig {

    /**
     * Uygulama ve standalone MockMvc testleri tarafından ortak kullanılan mapper.
     */
    public static ObjectMapper roundTripObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return roundTripObjectMapper();
    }
}
