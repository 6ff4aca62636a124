package org.explorerscript.compiler.handlers;

import org.explorerscript.ssb.SsbOpParam;

/**
 * A handler that compiles to a single integer-like parameter: an integer literal or a named constant.
 */
public sealed interface IIntegerLikeProducer extends ICompileHandler<SsbOpParam>
        permits IntegerLikeCompileHandler, ConstantCompileHandler {
}
