package org.explorerscript.decompiler.marker;

public record ForeverContinue(int loopId) implements LabelJumpMarker {

    @Override
    public String toString() {
        return "LOOP_CONTINUE(" + loopId + ")";
    }
}
