package org.explorerscript.compiler.handlers;

import org.explorerscript.ssb.SsbOperation;

import java.util.List;

/**
 * Base class of handlers for assignment statements. An assignment compiles to a list of operations.
 */
public abstract class AbstractAssignmentCompileHandler extends AbstractCompileHandler<List<SsbOperation>> {
}
