package com.dcruver.incipit.domain;

import com.dcruver.incipit.config.IncipitProperties;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Per-conversion settings. Defaults come from {@link IncipitProperties}.
 */
@Value
@Builder
@With
public class ConversionOptions {
    int wordCount;
    EmphasisStyle emphasisStyle;
    boolean applyCitationStyle;

    public static ConversionOptions from(IncipitProperties properties) {
        return ConversionOptions.builder()
            .wordCount(properties.getWordCount())
            .emphasisStyle(properties.getEmphasisStyle())
            .applyCitationStyle(properties.isApplyCitationStyle())
            .build();
    }

    /**
     * @throws IllegalArgumentException if the options cannot be used
     */
    public void validate() {
        if (wordCount <= 0) {
            throw new IllegalArgumentException("Word count must be positive: " + wordCount);
        }
        if (emphasisStyle == null) {
            throw new IllegalArgumentException("Emphasis style is required");
        }
    }
}
