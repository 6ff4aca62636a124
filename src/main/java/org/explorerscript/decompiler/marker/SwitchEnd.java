package org.explorerscript.decompiler.marker;

/**
 * The label joins the cases of a switch.
 *
 * @param switchId The id of the switch that ends here.
 */
public record SwitchEnd(int switchId) implements LabelMarker {

    @Override
    public String toString() {
        return "SWITCH(" + switchId + ")";
    }
}
