package org.explorerscript.decompiler.marker;

import org.explorerscript.ssb.SsbOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Several switch operations whose cases share one end label, read as one switch.
 * The original switch operations are kept in merge order.
 */
public final class MultiSwitchStart implements LabelJumpMarker {

    private final int switchId;
    private final List<SsbOperation> switches = new ArrayList<>();

    public MultiSwitchStart(int switchId) {
        this.switchId = switchId;
    }

    public MultiSwitchStart(int switchId, List<SsbOperation> startSwitches) {
        this.switchId = switchId;
        this.switches.addAll(startSwitches);
    }

    public int switchId() {
        return switchId;
    }

    /**
     * Adds an original switch operation (the jump's root, not the jump itself).
     *
     * @param ssbSwitch The original switch operation.
     */
    public void addSwitch(SsbOperation ssbSwitch) {
        switches.add(ssbSwitch);
    }

    public List<SsbOperation> switches() {
        return Collections.unmodifiableList(switches);
    }

    public int numberOfSwitches() {
        return switches.size();
    }

    @Override
    public String toString() {
        return "MSWITCH(" + switchId + ")";
    }
}
