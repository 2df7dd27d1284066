package io.mersel.services.roundtrip.web.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC yapılandırması.
 * <p>
 * CORS: Varsayılan olarak yalnızca aynı origin'e izin verir.
 * Production'da {@code ROUNDTRIP_CORS_ALLOWED_ORIGINS} ile belirli origin'ler tanımlanabilir.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${roundtrip.cors.allowed-origins:}")
    private String allowedOriginsConfig;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins;
        if (allowedOriginsConfig != null && !allowedOriginsConfig.isBlank()) {
            origins = allowedOriginsConfig.split(",");
        } else {
            // Yapılandırılmamışsa sadece same-origin
            origins = new String[0];
        }

        var mapping = registry.addMapping("/v1/**")
                .allowedMethods("GET", "POST", "PATCH", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);

        if (origins.length > 0) {
            mapping.allowedOrigins(origins);
        }
    }
}
