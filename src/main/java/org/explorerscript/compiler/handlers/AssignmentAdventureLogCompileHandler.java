package org.explorerscript.compiler.handlers;

import org.explorerscript.compiler.SsbCompilerException;
import org.explorerscript.ssb.SsbOpParam;
import org.explorerscript.ssb.SsbOperation;
import org.explorerscript.ssb.SsbSpecialOps;

import java.util.List;

/**
 * Compiles {@code adventure_log = <integer-like>;} to a single
 * {@value SsbSpecialOps#OPS_FLAG__SET_ADVENTURE_LOG} operation.
 */
public class AssignmentAdventureLogCompileHandler extends AbstractAssignmentCompileHandler {

    private SsbOpParam value;

    @Override
    public List<SsbOperation> collect() throws SsbCompilerException {
        if (value == null) {
            throw new SsbCompilerException("No value for adventure_log set.");
        }
        return List.of(generateOperation(SsbSpecialOps.OPS_FLAG__SET_ADVENTURE_LOG, List.of(value)));
    }

    @Override
    public void add(ICompileHandler<?> obj) throws SsbCompilerException {
        if (obj instanceof IIntegerLikeProducer integerLike) {
            this.value = integerLike.collect();
            return;
        }
        raiseAddError(obj);
    }
}
