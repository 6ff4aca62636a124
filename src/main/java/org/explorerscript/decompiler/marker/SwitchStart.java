package org.explorerscript.decompiler.marker;

/**
 * The jump opens a switch.
 *
 * @param switchId The id of the switch.
 */
public record SwitchStart(int switchId) implements LabelJumpMarker {

    @Override
    public String toString() {
        return "SWITCH(" + switchId + ")";
    }
}
