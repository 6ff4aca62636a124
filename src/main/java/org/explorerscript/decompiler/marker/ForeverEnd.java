package org.explorerscript.decompiler.marker;

public record ForeverEnd(int loopId) implements LabelMarker {

    @Override
    public String toString() {
        return "END_LOOP(" + loopId + ")";
    }
}
