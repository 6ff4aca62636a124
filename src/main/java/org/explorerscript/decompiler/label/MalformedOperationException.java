package org.explorerscript.decompiler.label;

/**
 * Thrown when an operation that jumps to a memory offset does not carry a usable offset
 * parameter.
 * <p>
 * This is a RuntimeException because the routine set cannot be decompiled with a malformed
 * operation in it; the decompilation of the whole set is aborted.
 */
public class MalformedOperationException extends RuntimeException {

    private final String opName;
    private final int paramIndex;

    /**
     * @param opName     The opcode name of the malformed operation.
     * @param paramIndex The index where the jump offset was expected.
     * @param message    Description of the problem.
     */
    public MalformedOperationException(String opName, int paramIndex, String message) {
        super(message);
        this.opName = opName;
        this.paramIndex = paramIndex;
    }

    public String getOpName() {
        return opName;
    }

    public int getParamIndex() {
        return paramIndex;
    }
}
