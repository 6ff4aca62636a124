package org.explorerscript.decompiler.marker;

public record ForeverBreak(int loopId) implements LabelJumpMarker {

    @Override
    public String toString() {
        return "LOOP_BREAK(" + loopId + ")";
    }
}
