package org.explorerscript.compiler.handlers;

import org.explorerscript.compiler.SsbCompilerException;

/**
 * A handler that compiles one node of the source tree.
 * Child handlers are added in source order, then the result is collected once.
 *
 * @param <T> The type of the compiled result.
 */
public interface ICompileHandler<T> {

    /**
     * Compiles the node.
     *
     * @return The compiled result.
     * @throws SsbCompilerException if the node can not be compiled, e.g. a required child is missing.
     */
    T collect() throws SsbCompilerException;

    /**
     * Adds the handler of a child node.
     *
     * @param obj The child handler.
     * @throws SsbCompilerException if this handler does not accept that kind of child.
     */
    void add(ICompileHandler<?> obj) throws SsbCompilerException;
}
