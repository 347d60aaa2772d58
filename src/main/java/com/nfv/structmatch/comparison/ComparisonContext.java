package com.nfv.structmatch.comparison;

import com.nfv.structmatch.model.TreePath;
import com.nfv.structmatch.normalize.JsonCodec;

import java.util.function.Supplier;

/**
 * Per-call state of a comparison: active options, current location and the first mismatch
 */
class ComparisonContext {

    private final ContainsOptions options;
    private final boolean equivalence;
    private final boolean tracing;
    private final TreePath path = new TreePath();
    private final boolean ignoring;

    /**
     * Nesting depth of existential searches. Failures inside them are not recorded.
     */
    private int trialDepth;

    private boolean mismatchRecorded;
    private String reason = "";
    private TreePath mismatchPath = new TreePath();
    private Object mismatchV1;
    private Object mismatchV2;

    ComparisonContext(ContainsOptions options, boolean equivalence, boolean tracing) {
        this.options = options;
        this.equivalence = equivalence;
        this.tracing = tracing;
        this.ignoring = options.getIgnorePaths() != null && !options.getIgnorePaths().isEmpty();
    }

    ContainsOptions getOptions() {
        return options;
    }

    boolean isEquivalence() {
        return equivalence;
    }

    TreePath getPath() {
        return path;
    }

    /**
     * Renders the path only when ignore patterns are configured
     */
    boolean isIgnored() {
        return ignoring && !path.isRoot() && options.shouldIgnore(path.toString());
    }

    void beginTrial() {
        trialDepth++;
    }

    void endTrial() {
        trialDepth--;
    }

    boolean fail(String reason, Object v1, Object v2) {
        return fail(() -> reason, v1, v2);
    }

    /**
     * Record a mismatch at the current path unless one is already recorded
     *
     * @return always false, so callers can {@code return ctx.fail(...)}
     */
    boolean fail(Supplier<String> reason, Object v1, Object v2) {
        if (tracing && trialDepth == 0 && !mismatchRecorded) {
            mismatchRecorded = true;
            this.reason = reason.get();
            this.mismatchPath = path.snapshot();
            this.mismatchV1 = v1;
            this.mismatchV2 = v2;
        }
        return false;
    }

    boolean isMismatchRecorded() {
        return mismatchRecorded;
    }

    String getReason() {
        return reason;
    }

    TreePath getMismatchPath() {
        return mismatchPath;
    }

    Object getMismatchV1() {
        return mismatchV1;
    }

    Object getMismatchV2() {
        return mismatchV2;
    }

    /**
     * Multi-line description of the recorded mismatch, empty if none
     */
    String describeMismatch() {
        if (!mismatchRecorded) {
            return "";
        }
        JsonCodec codec = JsonCodec.getDefault();
        return reason + "\n"
                + mismatchPath.toString("v1") + " -> " + codec.render(mismatchV1) + "\n"
                + mismatchPath.toString("v2") + " -> " + codec.render(mismatchV2);
    }
}
