package org.explorerscript.decompiler.graph;

import org.explorerscript.decompiler.label.SsbLabel;
import org.explorerscript.decompiler.label.SsbLabelJump;
import org.explorerscript.decompiler.marker.IfEnd;
import org.explorerscript.decompiler.marker.LabelJumpMarker;
import org.explorerscript.decompiler.marker.LabelMarker;
import org.explorerscript.decompiler.marker.MultiSwitchStart;
import org.explorerscript.decompiler.marker.SwitchEnd;
import org.explorerscript.decompiler.marker.SwitchStart;
import org.explorerscript.ssb.SsbOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Decides whether a label has to be printed explicitly in the generated source, or whether
 * all of its incoming edges are explained by the structures ending at it.
 * <p>
 * Must only be used once the graph of the whole routine set is complete, since switch starts
 * are looked up among all vertices.
 */
public final class LabelNecessityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LabelNecessityAnalyzer.class);

    private LabelNecessityAnalyzer() {
    }

    /**
     * Checks whether a label needs to be printed.
     * <p>
     * A label can always absorb one implicit incoming edge (the linear fallthrough). Every
     * {@link IfEnd} adds one (the else branch). Every {@link SwitchEnd} adds the number of
     * outgoing edges of its switch start minus one, since one case may fall straight through.
     * Other markers do not change the threshold.
     *
     * @param label      The label.
     * @param numberInVs The number of incoming edges of the label's vertex.
     * @param graph      The complete routine graph.
     * @return true if {@code numberInVs} exceeds the number of implicit incoming edges.
     * @throws GraphConsistencyException if the start of a switch ending at the label is not in the graph.
     */
    public static boolean needsToBePrinted(SsbLabel label, int numberInVs, IRoutineGraph graph) {
        int maxInVs = maxImplicitIncomingEdges(label, graph);
        boolean needed = numberInVs > maxInVs;
        log.debug("Label {}: {} incoming edge(s), {} implicit allowed, printed: {}",
                label.id(), numberInVs, maxInVs, needed);
        return needed;
    }

    /**
     * @param label The label.
     * @param graph The complete routine graph.
     * @return The number of incoming edges the label can have without being printed.
     * @throws GraphConsistencyException if the start of a switch ending at the label is not in the graph.
     */
    public static int maxImplicitIncomingEdges(SsbLabel label, IRoutineGraph graph) {
        int maxInVs = 1;
        for (LabelMarker m : label.markers()) {
            if (m instanceof IfEnd) {
                maxInVs += 1;
            } else if (m instanceof SwitchEnd switchEnd) {
                int start = findSwitchStartVertex(graph, switchEnd.switchId())
                        .orElseThrow(() -> new GraphConsistencyException(
                                "Start for switch " + switchEnd.switchId() + " not found."));
                maxInVs += graph.outDegree(start) - 1;
            }
        }
        return maxInVs;
    }

    /**
     * Finds the vertex whose label jump carries the {@link SwitchStart} or
     * {@link MultiSwitchStart} with the given id.
     *
     * @param graph    The routine graph.
     * @param switchId The switch id.
     * @return The vertex index, or empty if there is none.
     */
    public static OptionalInt findSwitchStartVertex(IRoutineGraph graph, int switchId) {
        for (int v = 0; v < graph.vertexCount(); v++) {
            Optional<SsbOperation> op = graph.op(v);
            if (op.isPresent() && op.get() instanceof SsbLabelJump jump) {
                Optional<LabelJumpMarker> marker = jump.marker();
                if (marker.isPresent() && startsSwitch(marker.get(), switchId)) {
                    return OptionalInt.of(v);
                }
            }
        }
        return OptionalInt.empty();
    }

    private static boolean startsSwitch(LabelJumpMarker marker, int switchId) {
        if (marker instanceof SwitchStart start) {
            return start.switchId() == switchId;
        }
        if (marker instanceof MultiSwitchStart start) {
            return start.switchId() == switchId;
        }
        return false;
    }
}
