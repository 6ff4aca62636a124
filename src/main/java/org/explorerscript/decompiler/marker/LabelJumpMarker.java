package org.explorerscript.decompiler.marker;

/**
 * Marker attached to an {@link org.explorerscript.decompiler.label.SsbLabelJump}. Describes which
 * structure the jump represents. A jump holds at most one of these.
 */
public sealed interface LabelJumpMarker
        permits IfStart, MultiIfStart, SwitchStart, MultiSwitchStart, ForeverContinue, ForeverBreak {
}
