package com.nfv.structmatch.merge;

/**
 * Rewrites one node of a normalized tree. Returning the node unchanged keeps it.
 */
@FunctionalInterface
public interface NodeTransformer {

    Object apply(Object node) throws TransformException;
}
