package org.explorerscript.decompiler.label;

import org.explorerscript.decompiler.marker.LabelJumpMarker;
import org.explorerscript.ssb.SsbOpCode;
import org.explorerscript.ssb.SsbOpParams;
import org.explorerscript.ssb.SsbOperation;

import java.util.Optional;

/**
 * An operation that jumps to a label instead of a memory offset.
 * <p>
 * The {@link #root()} is the original operation without its jump parameter. The label may be
 * {@code null}; in that case the outgoing edges of the jump's graph vertex determine where it
 * goes. A jump holds zero or one {@link LabelJumpMarker}.
 */
public class SsbLabelJump extends SsbOperation {

    private final SsbOperation root;
    private final SsbLabel label;
    private LabelJumpMarker marker;

    /**
     * @param root  The original operation, without its jump parameter.
     * @param label The target label, or {@code null}.
     */
    public SsbLabelJump(SsbOperation root, SsbLabel label) {
        super(root.offset(), SsbOpCode.synthetic("ES_JUMP<" + root.opCode().name() + ">"),
                SsbOpParams.ints(label != null ? label.id() : -1));
        this.root = root;
        this.label = label;
    }

    public SsbOperation root() {
        return root;
    }

    public Optional<SsbLabel> label() {
        return Optional.ofNullable(label);
    }

    /**
     * Sets the marker of this jump.
     *
     * @param marker The marker.
     * @throws IllegalStateException if the jump already has a marker.
     */
    public void addMarker(LabelJumpMarker marker) {
        if (this.marker != null) {
            throw new IllegalStateException(
                    "Jumps can only have one or zero markers. " + this + " already has " + this.marker + ".");
        }
        this.marker = marker;
    }

    /**
     * Removes the marker, if there is one.
     */
    public void removeMarker() {
        this.marker = null;
    }

    public Optional<LabelJumpMarker> marker() {
        return Optional.ofNullable(marker);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(offset()).append(": ES_JUMP<").append(root.opCode().name()).append(">");
        if (marker != null) {
            sb.append('[').append(marker).append(']');
        }
        sb.append(' ').append(root.params());
        sb.append(" -> ").append(label != null ? "@label_" + label.id() : "?");
        return sb.toString();
    }
}
