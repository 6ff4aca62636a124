package org.explorerscript.decompiler.label;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The labels of one decompilation run, keyed by the raw memory offset they stand for.
 * <p>
 * One instance is created per run and threaded through every routine of the run in order.
 * Instances must never be shared between runs, since label ids are assigned from the labels
 * already known.
 * <p>
 * Thread Safety: Not thread-safe.
 */
public final class KnownLabels {

    private final Map<Integer, SsbLabel> byOffset = new LinkedHashMap<>();
    private int maxId = -1;

    /**
     * @param offset The raw memory offset.
     * @return The label for the offset, or empty if no jump to it was resolved yet.
     */
    public Optional<SsbLabel> get(int offset) {
        return Optional.ofNullable(byOffset.get(offset));
    }

    public boolean contains(int offset) {
        return byOffset.containsKey(offset);
    }

    /**
     * Registers a label for a raw offset.
     *
     * @param offset The raw memory offset.
     * @param label  The label.
     * @throws IllegalStateException if the offset already has a label.
     */
    public void put(int offset, SsbLabel label) {
        if (byOffset.containsKey(offset)) {
            throw new IllegalStateException("Offset " + offset + " already has label " + byOffset.get(offset).id());
        }
        byOffset.put(offset, label);
        maxId = Math.max(maxId, label.id());
    }

    /**
     * @return 0 if there are no labels yet, otherwise the highest known id plus one.
     */
    public int nextLabelId() {
        return maxId + 1;
    }

    public int size() {
        return byOffset.size();
    }

    public boolean isEmpty() {
        return byOffset.isEmpty();
    }

    public Collection<SsbLabel> labels() {
        return Collections.unmodifiableCollection(byOffset.values());
    }

    /**
     * @return The offset to label map in discovery order. Unmodifiable view.
     */
    public Map<Integer, SsbLabel> asMap() {
        return Collections.unmodifiableMap(byOffset);
    }
}
