package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * Keyword rule mapping document names to a category.
 * The pattern is a case-insensitive regular expression searched in the
 * file name, title and subject, with underscores, dashes and dots read as
 * spaces so that {@code \b} works on names like {@code chem_notes.pdf}.
 * An invalid pattern is rejected when the rule is created.
 */
@Value
public class TaxonomyRule {
    private static final Pattern SEPARATORS = Pattern.compile("[_.\\-]+");

    String pattern;
    String category;
    double confidence;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Pattern compiled;

    @JsonCreator
    public TaxonomyRule(
            @JsonProperty("pattern") String pattern,
            @JsonProperty("category") String category,
            @JsonProperty("confidence") double confidence) {
        this.pattern = pattern;
        this.category = category;
        this.confidence = confidence;
        this.compiled = pattern == null || pattern.isBlank()
            ? null
            : Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    }

    public boolean matches(String text) {
        if (text == null || text.isBlank() || compiled == null) {
            return false;
        }
        return compiled.matcher(SEPARATORS.matcher(text).replaceAll(" ")).find();
    }
}
