package com.nfv.structmatch.merge;

import com.nfv.structmatch.normalize.NormalizationException;
import com.nfv.structmatch.normalize.Normalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Pre-order rewrite of every node of a normalized tree
 */
@Slf4j
public class TreeTransformer {

    /**
     * Throw from a {@link NodeTransformer} to end the walk early.
     * The tree rewritten so far is returned.
     */
    public static final TransformException STOP = new StopTransform();

    private TreeTransformer() {
    }

    /**
     * Normalize value, then replace each node with the transformer's result.
     * When the result is a map or list the walk continues into (a copy of) it.
     */
    public static Object transform(Object value, NodeTransformer transformer)
            throws NormalizationException, TransformException {
        Object normalized = Normalizer.getDefault().normalize(value);
        AtomicReference<Object> root = new AtomicReference<>();
        try {
            visit(normalized, root::set, transformer);
        } catch (TransformException e) {
            if (e != STOP) {
                throw e;
            }
            log.debug("Transform stopped early");
        }
        return root.get();
    }

    @SuppressWarnings("unchecked")
    private static void visit(Object node, Consumer<Object> replace, NodeTransformer transformer)
            throws TransformException {
        Object result = transformer.apply(node);

        if (result instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) result);
            replace.accept(copy);
            for (Map.Entry<String, Object> entry : copy.entrySet()) {
                visit(entry.getValue(), entry::setValue, transformer);
            }
        } else if (result instanceof List) {
            List<Object> copy = new ArrayList<>((List<Object>) result);
            replace.accept(copy);
            for (int i = 0; i < copy.size(); i++) {
                int index = i;
                visit(copy.get(i), v -> copy.set(index, v), transformer);
            }
        } else {
            replace.accept(result);
        }
    }

    private static final class StopTransform extends TransformException {

        private StopTransform() {
            super("transform stopped", false);
        }
    }
}
