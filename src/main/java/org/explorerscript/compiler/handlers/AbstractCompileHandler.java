package org.explorerscript.compiler.handlers;

import org.explorerscript.compiler.SsbCompilerException;
import org.explorerscript.ssb.SsbOpCode;
import org.explorerscript.ssb.SsbOpParam;
import org.explorerscript.ssb.SsbOpParams;
import org.explorerscript.ssb.SsbOperation;

import java.util.List;

/**
 * Base class of compile handlers.
 *
 * @param <T> The type of the compiled result.
 */
public abstract class AbstractCompileHandler<T> implements ICompileHandler<T> {

    /**
     * Creates an operation. Its offset and opcode id are synthetic; the assembler assigns both.
     *
     * @param opName The opcode name.
     * @param params The parameters.
     * @return The new operation.
     */
    protected SsbOperation generateOperation(String opName, List<SsbOpParam> params) {
        return new SsbOperation(SsbOperation.NO_OFFSET, SsbOpCode.synthetic(opName), SsbOpParams.of(params));
    }

    /**
     * Rejects a child handler this handler does not accept.
     *
     * @param obj The rejected child.
     * @throws SsbCompilerException always.
     */
    protected void raiseAddError(ICompileHandler<?> obj) throws SsbCompilerException {
        throw new SsbCompilerException(
                "Invalid element for " + getClass().getSimpleName() + ": " + obj.getClass().getSimpleName() + ".");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
