package org.explorerscript.decompiler;

import org.explorerscript.decompiler.label.KnownLabels;
import org.explorerscript.decompiler.label.SsbForeignLabel;
import org.explorerscript.decompiler.label.SsbLabel;
import org.explorerscript.ssb.SsbOperation;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * The result of resolving the jumps of a routine set.
 *
 * @param routines        Per routine: the operations, with jumps replaced by label jumps and
 *                        (if enabled) labels inserted before their target operation.
 * @param foreignLabels   Per routine: references to labels jumped to from the routine but placed in another one.
 * @param labels          All labels of the run, keyed by raw offset.
 * @param labelPlacements Label id to the index of the routine the label was placed in.
 */
public record ResolvedRoutineSet(
        List<List<SsbOperation>> routines,
        List<List<SsbForeignLabel>> foreignLabels,
        KnownLabels labels,
        Map<Integer, Integer> labelPlacements
) {

    public ResolvedRoutineSet {
        routines = routines.stream().map(List::copyOf).toList();
        foreignLabels = foreignLabels.stream().map(List::copyOf).toList();
        labelPlacements = Map.copyOf(labelPlacements);
    }

    /**
     * @param label A label of this run.
     * @return The index of the routine the label was placed in, or empty if it was not placed.
     */
    public OptionalInt placementOf(SsbLabel label) {
        Integer routine = labelPlacements.get(label.id());
        return routine == null ? OptionalInt.empty() : OptionalInt.of(routine);
    }

    public int routineCount() {
        return routines.size();
    }
}
