package org.explorerscript.decompiler.marker;

/**
 * A switch case falls through into the case starting at this label.
 */
public record SwitchFallthrough() implements LabelMarker {

    @Override
    public String toString() {
        return "FALL";
    }
}
