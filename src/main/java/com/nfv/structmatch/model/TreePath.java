package com.nfv.structmatch.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Location inside a value tree, as a sequence of map keys and list indexes.
 * Rendered as {@code labels.tags[2]}, or {@code v1.labels.tags[2]} with a root name.
 */
public class TreePath implements Iterable<Object> {

    private final Deque<Object> tokens;

    public TreePath() {
        this.tokens = new ArrayDeque<>();
    }

    private TreePath(Deque<Object> tokens) {
        this.tokens = tokens;
    }

    public TreePath push(String key) {
        tokens.addLast(key);
        return this;
    }

    public TreePath push(int index) {
        tokens.addLast(index);
        return this;
    }

    public void pop() {
        tokens.removeLast();
    }

    public boolean isRoot() {
        return tokens.isEmpty();
    }

    public int depth() {
        return tokens.size();
    }

    /**
     * Copy of the current location, unaffected by later push/pop calls
     */
    public TreePath snapshot() {
        return new TreePath(new ArrayDeque<>(tokens));
    }

    /**
     * Walk a tree of maps and lists along this path
     *
     * @return the value found, or null when the path does not exist in the tree
     */
    public Object resolve(Object root) {
        Object current = root;
        for (Object token : tokens) {
            if (token instanceof String && current instanceof Map) {
                current = ((Map<?, ?>) current).get(token);
            } else if (token instanceof Integer && current instanceof List) {
                List<?> list = (List<?>) current;
                int index = (Integer) token;
                if (index >= list.size()) {
                    return null;
                }
                current = list.get(index);
            } else {
                return null;
            }
        }
        return current;
    }

    @Override
    public Iterator<Object> iterator() {
        return Collections.unmodifiableCollection(tokens).iterator();
    }

    /**
     * Render with a root name prefix, e.g. {@code v1.color}
     */
    public String toString(String root) {
        StringBuilder sb = new StringBuilder(root);
        appendTokens(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTokens(sb);
        return sb.toString();
    }

    private void appendTokens(StringBuilder sb) {
        for (Object token : tokens) {
            if (token instanceof String) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(token);
            } else if (token instanceof Integer) {
                sb.append('[').append(token).append(']');
            } else {
                throw new IllegalStateException("Path token is neither a key nor an index: " + token);
            }
        }
    }
}
