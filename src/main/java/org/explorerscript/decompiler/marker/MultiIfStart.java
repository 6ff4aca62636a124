package org.explorerscript.decompiler.marker;

import org.explorerscript.ssb.SsbOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Several if jumps that target the same label, read as one compound condition.
 * <p>
 * Keeps the original if operations (the roots of the label jumps, without their jump
 * parameter) together with their negation flags, in the order they were merged, so the
 * compound expression can be regenerated.
 */
public final class MultiIfStart implements LabelJumpMarker {

    /**
     * One merged condition.
     *
     * @param op      The original if operation.
     * @param negated Whether this condition is negated.
     */
    public record IfCondition(SsbOperation op, boolean negated) {
    }

    private final int ifId;
    private final List<IfCondition> conditions = new ArrayList<>();

    public MultiIfStart(int ifId) {
        this.ifId = ifId;
    }

    public MultiIfStart(int ifId, List<IfCondition> startConditions) {
        this.ifId = ifId;
        this.conditions.addAll(startConditions);
    }

    public int ifId() {
        return ifId;
    }

    /**
     * Adds the original operation of an if jump (the jump's root, not the jump itself).
     *
     * @param ssbIf   The original if operation.
     * @param negated Whether the condition is negated.
     */
    public void addIf(SsbOperation ssbIf, boolean negated) {
        conditions.add(new IfCondition(ssbIf, negated));
    }

    /**
     * @return The merged conditions in merge order. Unmodifiable view.
     */
    public List<IfCondition> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public int numberOfIfs() {
        return conditions.size();
    }

    @Override
    public String toString() {
        return "MIF(" + ifId + "[" + conditions.size() + "])";
    }
}
