package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Naming and threshold preferences for plan building.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserPreferences {

    @Builder.Default
    NamingPreference naming = new NamingPreference(NamingStyle.ORIGINAL, false);

    @Builder.Default
    ConfidenceThresholds confidenceThresholds = new ConfidenceThresholds(0.8, 0.5);

    // Category -> folder name
    @Builder.Default
    Map<String, String> defaultFolders = Map.of();

    public static UserPreferences defaults() {
        return UserPreferences.builder().build();
    }

    public record NamingPreference(NamingStyle style, boolean removeSpecialChars) {
    }

    public record ConfidenceThresholds(double autoApprove, double requireReview) {
    }

    public enum NamingStyle {
        ORIGINAL,
        LOWERCASE,
        TITLECASE,
        CAMELCASE
    }
}
