package org.explorerscript.decompiler.label;

import org.explorerscript.decompiler.graph.IRoutineGraph;
import org.explorerscript.decompiler.graph.LabelNecessityAnalyzer;
import org.explorerscript.decompiler.marker.LabelMarker;
import org.explorerscript.ssb.SsbOpCode;
import org.explorerscript.ssb.SsbOpParams;
import org.explorerscript.ssb.SsbOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A label that other operations can jump to.
 * <p>
 * Labels are created by {@link JumpResolver} the first time a jump to their offset is seen and
 * live as long as the decompilation of the routine set. The opcode and parameters only exist
 * for debugging output.
 * <p>
 * Thread Safety: Not thread-safe. A decompilation run is single-threaded.
 */
public class SsbLabel extends SsbOperation {

    private final int id;
    private final int routineId;
    private boolean referencedFromOtherRoutine = false;
    private final List<LabelMarker> markers = new ArrayList<>();

    /**
     * @param id        The label id, unique within one decompilation run.
     * @param routineId The routine this label lies in.
     */
    public SsbLabel(int id, int routineId) {
        super(NO_OFFSET, SsbOpCode.synthetic("ES_LABEL<" + id + ">"), SsbOpParams.ints(id));
        this.id = id;
        this.routineId = routineId;
    }

    public int id() {
        return id;
    }

    public int routineId() {
        return routineId;
    }

    public boolean isReferencedFromOtherRoutine() {
        return referencedFromOtherRoutine;
    }

    /**
     * Flags this label as the target of a jump in another routine. Once set, the flag stays set.
     */
    public void markReferencedFromOtherRoutine() {
        this.referencedFromOtherRoutine = true;
    }

    public void addMarker(LabelMarker marker) {
        markers.add(marker);
    }

    /**
     * @return The markers in the order they were added. Unmodifiable view.
     */
    public List<LabelMarker> markers() {
        return Collections.unmodifiableList(markers);
    }

    /**
     * Checks whether this label has more incoming edges than the structures ending at it explain.
     *
     * @param numberInVs The number of incoming edges of the label's vertex.
     * @param graph      The complete graph of the routine set.
     * @return true if the label has to be printed.
     * @see LabelNecessityAnalyzer#needsToBePrinted(SsbLabel, int, IRoutineGraph)
     */
    public boolean needsToBePrinted(int numberInVs, IRoutineGraph graph) {
        return LabelNecessityAnalyzer.needsToBePrinted(this, numberInVs, graph);
    }

    @Override
    public String toString() {
        String text = "ES_LABEL<" + id + ">";
        if (!markers.isEmpty()) {
            text += markers;
        }
        return text;
    }
}
