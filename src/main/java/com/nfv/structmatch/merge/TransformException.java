package com.nfv.structmatch.merge;

/**
 * Raised by a {@link NodeTransformer} to abort a transform
 */
public class TransformException extends Exception {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }

    protected TransformException(String message, boolean writableStackTrace) {
        super(message, null, false, writableStackTrace);
    }
}
