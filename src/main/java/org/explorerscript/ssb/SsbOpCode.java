package org.explorerscript.ssb;

/**
 * An SSB opcode, identified by its numeric id and its name.
 * <p>
 * ExplorerScript maps opcodes by name only. Nodes that the decompiler synthesizes
 * (labels, label jumps, foreign label references) use {@link #SYNTHETIC_ID}, which never
 * collides with an opcode read from a script file.
 *
 * @param id   The opcode id, or {@link #SYNTHETIC_ID} for generated nodes.
 * @param name The opcode name.
 */
public record SsbOpCode(int id, String name) {

    /** Id used by every opcode the decompiler or compiler generates. */
    public static final int SYNTHETIC_ID = -1;

    /**
     * Creates an opcode for a generated node.
     *
     * @param name The opcode name.
     * @return An opcode with {@link #SYNTHETIC_ID}.
     */
    public static SsbOpCode synthetic(String name) {
        return new SsbOpCode(SYNTHETIC_ID, name);
    }

    /**
     * @return true if this opcode was generated rather than read from a script.
     */
    public boolean isSynthetic() {
        return id < 0;
    }

    @Override
    public String toString() {
        return name;
    }
}
