package com.nfv.structmatch.normalize;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options controlling how values are converted into canonical trees
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NormalizeOptions {

    /**
     * Copy every map and list into a new container. When false the caller's
     * containers may be returned as-is if nothing in them needs rewriting.
     */
    @Builder.Default
    private boolean copy = true;

    /**
     * Normalize children recursively. When false only the top level is coerced.
     */
    @Builder.Default
    private boolean deep = true;

    /**
     * Send values of unknown shape through a JSON round trip.
     * When false they are returned unchanged.
     */
    @Builder.Default
    private boolean marshal = true;

    /**
     * Keep time values as OffsetDateTime and promote RFC 3339 strings to times
     */
    @Builder.Default
    private boolean preserveTime = false;

    public static NormalizeOptions defaults() {
        return NormalizeOptions.builder().build();
    }

    /**
     * Deep normalization that may alias the caller's containers
     */
    public static NormalizeOptions borrow() {
        return NormalizeOptions.builder().copy(false).build();
    }
}
