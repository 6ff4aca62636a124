package org.explorerscript.decompiler;

import org.explorerscript.decompiler.label.JumpResolver;
import org.explorerscript.decompiler.label.KnownLabels;
import org.explorerscript.decompiler.label.SsbForeignLabel;
import org.explorerscript.decompiler.label.SsbLabel;
import org.explorerscript.decompiler.label.SsbLabelJump;
import org.explorerscript.ssb.SsbOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the jumps of all routines of one script.
 * <p>
 * Every call starts a new decompilation run with its own {@link KnownLabels}, which is threaded
 * through the routines in the given order, so label ids are deterministic for a given input.
 * Routine ids are the indices of the routines in the input list.
 * <p>
 * Any failure aborts the whole run; there is no partial result.
 */
public class RoutineSetResolver {

    private static final Logger log = LoggerFactory.getLogger(RoutineSetResolver.class);

    private final DecompilerOptions options;

    public RoutineSetResolver() {
        this(DecompilerOptions.defaults());
    }

    public RoutineSetResolver(DecompilerOptions options) {
        this.options = options;
    }

    /**
     * Resolves a routine set.
     *
     * @param routines The operations of every routine, in routine order.
     * @return The resolved routines.
     * @throws org.explorerscript.decompiler.label.MalformedOperationException if an operation has no usable jump offset.
     */
    public ResolvedRoutineSet resolve(List<List<SsbOperation>> routines) {
        KnownLabels knownLabels = new KnownLabels();
        List<List<SsbOperation>> processed = new ArrayList<>(routines.size());
        for (int routineId = 0; routineId < routines.size(); routineId++) {
            List<SsbOperation> routine = routines.get(routineId);
            List<SsbOperation> out = new ArrayList<>(routine.size());
            for (SsbOperation op : routine) {
                out.add(JumpResolver.processOpForJump(op, knownLabels, routineId));
            }
            processed.add(out);
        }

        Map<Integer, Integer> placements = options.placeLabels()
                ? findPlacements(processed, knownLabels)
                : Map.of();
        if (options.placeLabels()) {
            processed = insertLabels(processed, knownLabels, placements);
        }

        List<List<SsbForeignLabel>> foreign = options.collectForeignLabels()
                ? collectForeignLabels(processed)
                : emptyPerRoutine(processed.size());

        long crossRoutine = knownLabels.labels().stream().filter(SsbLabel::isReferencedFromOtherRoutine).count();
        log.debug("Resolved {} routine(s): {} label(s), {} referenced from other routines",
                routines.size(), knownLabels.size(), crossRoutine);

        return new ResolvedRoutineSet(processed, foreign, knownLabels, placements);
    }

    /**
     * Decides which labels can be placed: a label is placed in the routine it belongs to, and only
     * if that routine contains an operation at the label's offset.
     */
    private Map<Integer, Integer> findPlacements(List<List<SsbOperation>> routines, KnownLabels knownLabels) {
        List<Set<Integer>> offsets = new ArrayList<>(routines.size());
        for (List<SsbOperation> routine : routines) {
            Set<Integer> routineOffsets = new HashSet<>();
            for (SsbOperation op : routine) {
                if (op.offset() != SsbOperation.NO_OFFSET) {
                    routineOffsets.add(op.offset());
                }
            }
            offsets.add(routineOffsets);
        }

        Map<Integer, Integer> placements = new HashMap<>();
        for (Map.Entry<Integer, SsbLabel> entry : knownLabels.asMap().entrySet()) {
            int offset = entry.getKey();
            SsbLabel label = entry.getValue();
            int own = label.routineId();
            if (own < offsets.size() && offsets.get(own).contains(offset)) {
                placements.put(label.id(), own);
            } else {
                log.warn("No operation at offset {} in routine {} for label {}; label is not placed",
                        offset, own, label.id());
            }
        }
        return placements;
    }

    private List<List<SsbOperation>> insertLabels(List<List<SsbOperation>> routines, KnownLabels knownLabels,
                                                  Map<Integer, Integer> placements) {
        List<List<SsbOperation>> result = new ArrayList<>(routines.size());
        for (int r = 0; r < routines.size(); r++) {
            List<SsbOperation> out = new ArrayList<>();
            for (SsbOperation op : routines.get(r)) {
                if (op.offset() != SsbOperation.NO_OFFSET) {
                    SsbLabel label = knownLabels.get(op.offset()).orElse(null);
                    Integer placement = label != null ? placements.get(label.id()) : null;
                    if (placement != null && placement == r && !out.contains(label)) {
                        out.add(label);
                    }
                }
                out.add(op);
            }
            result.add(out);
        }
        return result;
    }

    private List<List<SsbForeignLabel>> collectForeignLabels(List<List<SsbOperation>> routines) {
        List<List<SsbForeignLabel>> result = new ArrayList<>(routines.size());
        for (int r = 0; r < routines.size(); r++) {
            Map<Integer, SsbForeignLabel> foreign = new LinkedHashMap<>();
            for (SsbOperation op : routines.get(r)) {
                if (!(op instanceof SsbLabelJump jump) || jump.label().isEmpty()) {
                    continue;
                }
                SsbLabel label = jump.label().get();
                if (label.routineId() != r) {
                    foreign.computeIfAbsent(label.id(), id -> new SsbForeignLabel(label));
                }
            }
            result.add(new ArrayList<>(foreign.values()));
        }
        return result;
    }

    private static List<List<SsbForeignLabel>> emptyPerRoutine(int count) {
        List<List<SsbForeignLabel>> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(List.of());
        }
        return result;
    }
}
