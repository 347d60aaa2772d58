package com.nfv.structmatch.comparison;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.nfv.structmatch.config.PathPatterns;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Options for containment and equivalence checks.
 * Loadable from YAML through {@link com.nfv.structmatch.config.ConfigLoader}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContainsOptions {

    /**
     * A v1 string contains a v2 string if v2 is a substring of v1
     */
    private boolean stringContains;

    /**
     * A null or zero v2 value (false, 0, "", zero time) matches any v1 value of the same kind
     */
    private boolean emptyValuesMatchAny;

    /**
     * Compare RFC 3339 strings as points in time
     */
    private boolean parseTimes;

    /**
     * Times with different offsets match if they are the same instant
     */
    private boolean ignoreTimeZones;

    /**
     * Truncate both times to this unit before comparing. Wins over roundTimes.
     */
    private Duration truncateTimes;

    /**
     * Round both times half up to this unit before comparing
     */
    private Duration roundTimes;

    /**
     * Largest difference at which two times still match
     */
    private Duration allowTimeDelta;

    /**
     * Paths skipped by the comparison, see {@link PathPatterns}
     */
    @Builder.Default
    private List<String> ignorePaths = new ArrayList<>();

    /**
     * Receives the description of the first mismatch, or an empty string on a match
     */
    @JsonIgnore
    private transient Consumer<String> trace;

    public static ContainsOptions defaults() {
        return ContainsOptions.builder().build();
    }

    /**
     * Tolerant matching for assertions: empty values are wildcards and times compare by instant
     */
    public static ContainsOptions lenient() {
        return ContainsOptions.builder()
                .emptyValuesMatchAny(true)
                .parseTimes(true)
                .ignoreTimeZones(true)
                .build();
    }

    /**
     * Whether any option requires strings to be parsed as times
     */
    @JsonIgnore
    public boolean isTimeParsingEnabled() {
        return parseTimes
                || ignoreTimeZones
                || truncateTimes != null
                || roundTimes != null
                || allowTimeDelta != null;
    }

    public boolean shouldIgnore(String path) {
        return ignorePaths != null && !ignorePaths.isEmpty() && PathPatterns.matchesAny(path, ignorePaths);
    }
}
