package com.dcruver.organizer.config;

import com.dcruver.organizer.domain.ScanOptions;
import com.dcruver.organizer.domain.TaxonomyRule;
import com.dcruver.organizer.domain.planning.UserPreferences;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under the {@code organizer} prefix in application.yml.
 * Turned into explicit option objects before they reach the pipeline.
 */
@Configuration
@ConfigurationProperties(prefix = "organizer")
@Data
public class OrganizerProperties {

    /**
     * Where manifests, plans, rollbacks and execution reports are written
     */
    private String artifactsDir = System.getProperty("user.home") + "/.file-organizer";

    private Scan scan = new Scan();
    private Ai ai = new Ai();
    private Naming naming = new Naming();
    private Thresholds thresholds = new Thresholds();

    // Category name -> folder name overrides
    private Map<String, String> defaultFolders = new LinkedHashMap<>();

    private List<TaxonomyRule> taxonomy = new ArrayList<>();

    public Path artifactsPath() {
        return Path.of(artifactsDir).toAbsolutePath().normalize();
    }

    public ScanOptions toScanOptions(String rootPath) {
        return ScanOptions.builder()
            .rootPath(rootPath)
            .ignorePaths(List.copyOf(scan.getIgnorePatterns()))
            .includeHidden(scan.isIncludeHidden())
            .maxDepth(scan.getMaxDepth())
            .useClassifier(ai.isEnabled())
            .extractDocumentMetadata(scan.isExtractDocumentMetadata())
            .detectDuplicates(scan.isDetectDuplicates())
            .reviewThreshold(thresholds.getRequireReview())
            .taxonomy(List.copyOf(taxonomy))
            .build();
    }

    public UserPreferences toUserPreferences() {
        return UserPreferences.builder()
            .naming(new UserPreferences.NamingPreference(naming.getStyle(), naming.isRemoveSpecialChars()))
            .confidenceThresholds(new UserPreferences.ConfidenceThresholds(
                thresholds.getAutoApprove(), thresholds.getRequireReview()))
            .defaultFolders(Map.copyOf(defaultFolders))
            .build();
    }

    @Data
    public static class Scan {
        private int maxDepth = 10;
        private boolean includeHidden = false;
        private boolean extractDocumentMetadata = true;
        private boolean detectDuplicates = false;
        private List<String> ignorePatterns = new ArrayList<>();
    }

    @Data
    public static class Ai {
        private boolean enabled = false;

        /**
         * ollama or openai
         */
        private String provider = "ollama";

        private String baseUrl;
        private String model;
        private String apiKey;
        private double temperature = 0.3;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 2;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private int concurrency = 2;
    }

    @Data
    public static class Naming {
        private UserPreferences.NamingStyle style = UserPreferences.NamingStyle.ORIGINAL;
        private boolean removeSpecialChars = false;
    }

    @Data
    public static class Thresholds {
        private double autoApprove = 0.8;
        private double requireReview = 0.5;
    }
}
