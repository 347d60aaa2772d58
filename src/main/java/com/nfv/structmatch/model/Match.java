package com.nfv.structmatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a containment or equivalence check, with the details of the first mismatch
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Match {

    /**
     * Whether the check passed
     */
    private boolean matches;

    /**
     * Human readable trace of the first mismatch, empty when matched
     */
    @Builder.Default
    private String message = "";

    /**
     * Location of the mismatch without the v1/v2 root, e.g. "labels.tags[1]"
     */
    @Builder.Default
    private String path = "";

    /**
     * Value on the v1 side at the mismatch
     */
    private Object v1;

    /**
     * Value on the v2 side at the mismatch
     */
    private Object v2;

    /**
     * Set when one of the operands could not be normalized
     */
    private Exception error;

    public static Match matched() {
        return Match.builder().matches(true).build();
    }

    public boolean hasError() {
        return error != null;
    }
}
