package org.explorerscript.decompiler.marker;

/**
 * The jump is the condition of an if.
 *
 * @param ifId    The id of the if.
 * @param negated Whether the condition is negated ({@code if not}).
 */
public record IfStart(int ifId, boolean negated) implements LabelJumpMarker {

    public IfStart(int ifId) {
        this(ifId, false);
    }

    @Override
    public String toString() {
        return "IF" + (negated ? " NOT" : "") + "(" + ifId + ")";
    }
}
