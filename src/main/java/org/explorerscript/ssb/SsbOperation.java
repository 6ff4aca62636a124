package org.explorerscript.ssb;

import java.util.Objects;

/**
 * A single SSB script operation.
 * <p>
 * Operations read from a script carry their memory offset in the routine data. Nodes that the
 * decompiler generates (labels, jumps to labels, references to labels in other routines) extend
 * this class, use {@link #NO_OFFSET} or the offset of the operation they replace, and carry a
 * synthetic opcode (see {@link SsbOpCode#synthetic(String)}).
 * <p>
 * The offset, opcode and parameters are immutable.
 */
public class SsbOperation {

    /** Offset of operations that do not exist in the script binary. */
    public static final int NO_OFFSET = -1;

    private final int offset;
    private final SsbOpCode opCode;
    private final SsbOpParams params;

    /**
     * Creates a new operation.
     *
     * @param offset The offset in the routine data, or {@link #NO_OFFSET}.
     * @param opCode The opcode.
     * @param params The parameters.
     */
    public SsbOperation(int offset, SsbOpCode opCode, SsbOpParams params) {
        this.offset = offset;
        this.opCode = Objects.requireNonNull(opCode, "opCode");
        this.params = Objects.requireNonNull(params, "params");
    }

    public int offset() {
        return offset;
    }

    public SsbOpCode opCode() {
        return opCode;
    }

    public SsbOpParams params() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SsbOperation that = (SsbOperation) o;
        return offset == that.offset && opCode.equals(that.opCode) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, opCode, params);
    }

    @Override
    public String toString() {
        return offset + ": " + opCode.name() + " " + params;
    }
}
