package org.explorerscript.decompiler.marker;

/**
 * Marker attached to an {@link org.explorerscript.decompiler.label.SsbLabel}. Describes which
 * structure ends or falls through at the label. A label without markers is a plain join point.
 */
public sealed interface LabelMarker permits IfEnd, SwitchEnd, SwitchFallthrough, ForeverStart, ForeverEnd {
}
