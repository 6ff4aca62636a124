package org.explorerscript.compiler.handlers;

import org.explorerscript.compiler.SsbCompilerException;
import org.explorerscript.ssb.SsbOpParam;
import org.explorerscript.ssb.SsbOperation;
import org.explorerscript.ssb.SsbSpecialOps;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AssignmentAdventureLogCompileHandlerTest {

    @Test
    void collectWithoutValueFails() {
        AssignmentAdventureLogCompileHandler handler = new AssignmentAdventureLogCompileHandler();

        assertThatThrownBy(handler::collect)
                .isInstanceOf(SsbCompilerException.class)
                .hasMessage("No value for adventure_log set.");
    }

    @Test
    void compilesIntegerValueToSingleOperation() throws SsbCompilerException {
        AssignmentAdventureLogCompileHandler handler = new AssignmentAdventureLogCompileHandler();
        handler.add(new IntegerLikeCompileHandler(17));

        List<SsbOperation> ops = handler.collect();

        assertThat(ops).hasSize(1);
        SsbOperation op = ops.get(0);
        assertThat(op.opCode().name()).isEqualTo(SsbSpecialOps.OPS_FLAG__SET_ADVENTURE_LOG);
        assertThat(op.opCode().isSynthetic()).isTrue();
        assertThat(op.offset()).isEqualTo(SsbOperation.NO_OFFSET);
        assertThat(op.params().asList()).containsExactly(SsbOpParam.of(17));
    }

    @Test
    void acceptsNamedConstant() throws SsbCompilerException {
        AssignmentAdventureLogCompileHandler handler = new AssignmentAdventureLogCompileHandler();
        handler.add(new ConstantCompileHandler("ADVENTURE_LOG_FIRST_RESCUE"));

        assertThat(handler.collect().get(0).params().asList())
                .containsExactly(SsbOpParam.constant("ADVENTURE_LOG_FIRST_RESCUE"));
    }

    @Test
    void lastValueWins() throws SsbCompilerException {
        AssignmentAdventureLogCompileHandler handler = new AssignmentAdventureLogCompileHandler();
        handler.add(new IntegerLikeCompileHandler(1));
        handler.add(IntegerLikeCompileHandler.parse("0x10"));

        assertThat(handler.collect().get(0).params().asList()).containsExactly(SsbOpParam.of(16));
    }

    @Test
    void rejectsNonIntegerLikeChild() {
        AssignmentAdventureLogCompileHandler handler = new AssignmentAdventureLogCompileHandler();

        assertThatThrownBy(() -> handler.add(new AssignmentAdventureLogCompileHandler()))
                .isInstanceOf(SsbCompilerException.class)
                .hasMessageContaining("AssignmentAdventureLogCompileHandler");
        assertThatThrownBy(handler::collect).isInstanceOf(SsbCompilerException.class);
    }

    @Test
    void atomsRejectChildren() {
        assertThatThrownBy(() -> new IntegerLikeCompileHandler(1).add(new IntegerLikeCompileHandler(2)))
                .isInstanceOf(SsbCompilerException.class);
        assertThatThrownBy(() -> IntegerLikeCompileHandler.parse("twelve"))
                .isInstanceOf(SsbCompilerException.class)
                .hasMessageContaining("twelve");
        assertThatThrownBy(() -> new ConstantCompileHandler(" ").collect())
                .isInstanceOf(SsbCompilerException.class);
    }
}
