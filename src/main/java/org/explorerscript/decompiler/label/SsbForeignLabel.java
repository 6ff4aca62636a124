package org.explorerscript.decompiler.label;

import org.explorerscript.ssb.SsbOpCode;
import org.explorerscript.ssb.SsbOpParams;
import org.explorerscript.ssb.SsbOperation;

/**
 * A reference to a label in another routine. Observes the label and owns no state of its own.
 */
public class SsbForeignLabel extends SsbOperation {

    private final SsbLabel label;

    public SsbForeignLabel(SsbLabel label) {
        super(NO_OFFSET, SsbOpCode.synthetic("ES_FOREIGN<" + label.id() + ">"), SsbOpParams.ints(label.id()));
        this.label = label;
    }

    public SsbLabel label() {
        return label;
    }

    @Override
    public String toString() {
        return "ES_FOREIGN<" + label.id() + "> (routine " + label.routineId() + ")";
    }
}
