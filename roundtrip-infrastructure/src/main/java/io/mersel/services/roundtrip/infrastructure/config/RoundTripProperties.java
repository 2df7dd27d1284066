package io.mersel.services.roundtrip.infrastructure.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Round-trip analiz yapılandırma özellikleri.
 * <p>
 * {@code roundtrip} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code fail-threshold}: Varsayılan genel korunma eşiği, 0–100 (varsayılan: 70)</li>
 *   <li>{@code critical-threshold}: Varsayılan kritik taşıyıcı eşiği, 0–100 (varsayılan: 90)</li>
 *   <li>{@code default-profile}: İstekte profil verilmezse kullanılan tolerans profili (varsayılan: normal)</li>
 *   <li>{@code tolerance.profiles-dir}: Özel profillerin okunup yazıldığı dizin (boşsa kalıcılık kapalı)</li>
 *   <li>{@code trend.analysis-window-days}: Eğilim analizinin varsayılan penceresi, gün (varsayılan: 30)</li>
 *   <li>{@code trend.max-history}: Bellekte tutulan en fazla uyumluluk raporu (varsayılan: 200)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "roundtrip")
public class RoundTripProperties {

    private static final Logger log = LoggerFactory.getLogger(RoundTripProperties.class);

    static final double DEFAULT_FAIL_THRESHOLD = 70.0;
    static final double DEFAULT_CRITICAL_THRESHOLD = 90.0;
    static final String DEFAULT_PROFILE = "normal";

    private double failThreshold = DEFAULT_FAIL_THRESHOLD;
    private double criticalThreshold = DEFAULT_CRITICAL_THRESHOLD;
    private String defaultProfile = DEFAULT_PROFILE;
    private Tolerance tolerance = new Tolerance();
    private Trend trend = new Trend();

    @PostConstruct
    void validate() {
        if (!isPercentage(failThreshold)) {
            log.warn("fail-threshold değeri 0-100 aralığında olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    failThreshold, DEFAULT_FAIL_THRESHOLD);
            failThreshold = DEFAULT_FAIL_THRESHOLD;
        }
        if (!isPercentage(criticalThreshold)) {
            log.warn("critical-threshold değeri 0-100 aralığında olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    criticalThreshold, DEFAULT_CRITICAL_THRESHOLD);
            criticalThreshold = DEFAULT_CRITICAL_THRESHOLD;
        }
        if (defaultProfile == null || defaultProfile.isBlank()) {
            log.warn("default-profile boş, '{}' kullanılıyor", DEFAULT_PROFILE);
            defaultProfile = DEFAULT_PROFILE;
        }
        if (tolerance == null) {
            tolerance = new Tolerance();
        }
        if (trend == null) {
            trend = new Trend();
        }
        if (trend.getAnalysisWindowDays() < 1) {
            log.warn("trend.analysis-window-days en az 1 olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    trend.getAnalysisWindowDays(), Trend.DEFAULT_WINDOW_DAYS);
            trend.setAnalysisWindowDays(Trend.DEFAULT_WINDOW_DAYS);
        }
        if (trend.getMaxHistory() < 1) {
            log.warn("trend.max-history en az 1 olmalı (verilen: {}), varsayılan {} kullanılıyor",
                    trend.getMaxHistory(), Trend.DEFAULT_MAX_HISTORY);
            trend.setMaxHistory(Trend.DEFAULT_MAX_HISTORY);
        }
    }

    private static boolean isPercentage(double value) {
        return !Double.isNaN(value) && value >= 0.0 && value <= 100.0;
    }

    public double getFailThreshold() {
        return failThreshold;
    }

    public void setFailThreshold(double failThreshold) {
        this.failThreshold = failThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public String getDefaultProfile() {
        return defaultProfile;
    }

    public void setDefaultProfile(String defaultProfile) {
        this.defaultProfile = defaultProfile;
    }

    public Tolerance getTolerance() {
        return tolerance;
    }

    public void setTolerance(Tolerance tolerance) {
        this.tolerance = tolerance;
    }

    public Trend getTrend() {
        return trend;
    }

    public void setTrend(Trend trend) {
        this.trend = trend;
    }

    /**
     * Tolerans profili kalıcılık ayarları.
     */
    public static class Tolerance {

        private String profilesDir = "";

        public String getProfilesDir() {
            return profilesDir;
        }

        public void setProfilesDir(String profilesDir) {
            this.profilesDir = profilesDir;
        }

        public boolean hasProfilesDir() {
            return profilesDir != null && !profilesDir.isBlank();
        }
    }

    /**
     * Eğilim analizi ayarları.
     */
    public static class Trend {

        static final int DEFAULT_WINDOW_DAYS = 30;
        static final int DEFAULT_MAX_HISTORY = 200;

        private int analysisWindowDays = DEFAULT_WINDOW_DAYS;
        private int maxHistory = DEFAULT_MAX_HISTORY;

        public int getAnalysisWindowDays() {
            return analysisWindowDays;
        }

        public void setAnalysisWindowDays(int analysisWindowDays) {
            this.analysisWindowDays = analysisWindowDays;
        }

        public int getMaxHistory() {
            return maxHistory;
        }

        public void setMaxHistory(int maxHistory) {
            this.maxHistory = maxHistory;
        }
    }
}
