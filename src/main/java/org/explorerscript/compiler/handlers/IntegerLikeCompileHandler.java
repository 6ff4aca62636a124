package org.explorerscript.compiler.handlers;

import org.explorerscript.compiler.SsbCompilerException;
import org.explorerscript.ssb.SsbOpParam;

/**
 * An integer literal.
 */
public final class IntegerLikeCompileHandler extends AbstractCompileHandler<SsbOpParam>
        implements IIntegerLikeProducer {

    private final int value;

    public IntegerLikeCompileHandler(int value) {
        this.value = value;
    }

    /**
     * Parses an integer literal in decimal or {@code 0x} hexadecimal notation.
     *
     * @param text The literal.
     * @return The handler.
     * @throws SsbCompilerException if the literal is not a valid integer.
     */
    public static IntegerLikeCompileHandler parse(String text) throws SsbCompilerException {
        String trimmed = text.trim();
        try {
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                return new IntegerLikeCompileHandler(Integer.parseInt(trimmed.substring(2), 16));
            }
            return new IntegerLikeCompileHandler(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new SsbCompilerException("Invalid integer: " + text, e);
        }
    }

    @Override
    public SsbOpParam collect() {
        return new SsbOpParam.IntParam(value);
    }

    @Override
    public void add(ICompileHandler<?> obj) throws SsbCompilerException {
        raiseAddError(obj);
    }
}
