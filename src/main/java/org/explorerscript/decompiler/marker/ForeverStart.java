package org.explorerscript.decompiler.marker;

public record ForeverStart(int loopId) implements LabelMarker {

    @Override
    public String toString() {
        return "LOOP(" + loopId + ")";
    }
}
