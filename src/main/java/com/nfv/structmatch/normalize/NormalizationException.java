package com.nfv.structmatch.normalize;

import com.nfv.structmatch.model.TreePath;

/**
 * Thrown when a value cannot be converted into a canonical tree.
 * Carries the location of the failing node and the raw value found there.
 */
public class NormalizationException extends Exception {

    private final TreePath path;
    private final transient Object value;

    public NormalizationException(String message, TreePath path, Object value, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.value = value;
    }

    public TreePath getPath() {
        return path;
    }

    public Object getValue() {
        return value;
    }
}
