package org.explorerscript.decompiler.label;

import org.explorerscript.ssb.SsbOperation;

/**
 * Annotation of a graph edge that leaves a switch: identifies which case of which switch
 * the edge represents.
 *
 * @param switchIndex The index of the switch among merged switches.
 * @param index       The index of the case within the switch.
 * @param op          The case operation.
 */
public record SwitchCaseOperation(int switchIndex, int index, SsbOperation op) {

    @Override
    public String toString() {
        return switchIndex + ":" + index + " :: " + op;
    }
}
