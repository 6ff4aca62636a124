package org.explorerscript.decompiler.label;

import org.explorerscript.decompiler.marker.ForeverBreak;
import org.explorerscript.decompiler.marker.IfStart;
import org.explorerscript.decompiler.marker.LabelJumpMarker;
import org.explorerscript.decompiler.marker.MultiIfStart;
import org.explorerscript.decompiler.marker.SwitchStart;
import org.explorerscript.ssb.SsbOpCode;
import org.explorerscript.ssb.SsbOpParams;
import org.explorerscript.ssb.SsbOperation;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SsbLabelJumpTest {

    private static SsbLabelJump newJump() {
        SsbOperation root = new SsbOperation(16, new SsbOpCode(5, "BranchBit"), SsbOpParams.ints(2, 1));
        return new SsbLabelJump(root, new SsbLabel(3, 0));
    }

    @Test
    void addingMarkerToFreshJumpSucceeds() {
        SsbLabelJump jump = newJump();

        jump.addMarker(new IfStart(1, true));

        assertThat(jump.marker()).contains(new IfStart(1, true));
    }

    @Test
    void addingSecondMarkerFails() {
        List<LabelJumpMarker> markers = List.of(
                new IfStart(0), new MultiIfStart(0), new SwitchStart(1), new ForeverBreak(2));
        for (LabelJumpMarker first : markers) {
            for (LabelJumpMarker second : markers) {
                SsbLabelJump jump = newJump();
                jump.addMarker(first);

                assertThatThrownBy(() -> jump.addMarker(second))
                        .isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("one or zero markers");
                assertThat(jump.marker()).containsSame(first);
            }
        }
    }

    @Test
    void removeMarkerClearsSlot() {
        SsbLabelJump jump = newJump();
        jump.addMarker(new SwitchStart(4));

        jump.removeMarker();

        assertThat(jump.marker()).isEmpty();
        jump.addMarker(new SwitchStart(5));
        assertThat(jump.marker()).contains(new SwitchStart(5));
    }

    @Test
    void removeMarkerWithoutMarkerDoesNothing() {
        SsbLabelJump jump = newJump();

        jump.removeMarker();

        assertThat(jump.marker()).isEmpty();
    }

    @Test
    void jumpWithoutLabelUsesMinusOneAsDebugParam() {
        SsbOperation root = new SsbOperation(4, new SsbOpCode(9, "Switch"), SsbOpParams.ints(0));

        SsbLabelJump jump = new SsbLabelJump(root, null);

        assertThat(jump.label()).isEmpty();
        assertThat(jump.params()).isEqualTo(SsbOpParams.ints(-1));
        assertThat(jump.opCode().isSynthetic()).isTrue();
        assertThat(jump.toString()).contains("ES_JUMP<Switch>").endsWith("-> ?");
    }

    @Test
    void labelDebugFormListsMarkers() {
        SsbLabel label = new SsbLabel(7, 2);
        label.addMarker(new org.explorerscript.decompiler.marker.IfEnd(1));
        label.addMarker(new org.explorerscript.decompiler.marker.SwitchFallthrough());

        assertThat(label.toString()).isEqualTo("ES_LABEL<7>[IF(1), FALL]");
        assertThat(label.offset()).isEqualTo(SsbOperation.NO_OFFSET);
        assertThat(new SsbForeignLabel(label).label()).isSameAs(label);
        assertThat(new SsbForeignLabel(label).opCode().name()).isEqualTo("ES_FOREIGN<7>");
    }
}
