package org.explorerscript.compiler.handlers;

import org.explorerscript.compiler.SsbCompilerException;
import org.explorerscript.ssb.SsbOpParam;

/**
 * A named script constant used as an integer-like value.
 */
public final class ConstantCompileHandler extends AbstractCompileHandler<SsbOpParam>
        implements IIntegerLikeProducer {

    private final String name;

    public ConstantCompileHandler(String name) {
        this.name = name;
    }

    @Override
    public SsbOpParam collect() throws SsbCompilerException {
        if (name == null || name.isBlank()) {
            throw new SsbCompilerException("Constant name must not be empty.");
        }
        return new SsbOpParam.ConstantParam(name);
    }

    @Override
    public void add(ICompileHandler<?> obj) throws SsbCompilerException {
        raiseAddError(obj);
    }
}
