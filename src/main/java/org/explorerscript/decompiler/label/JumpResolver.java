package org.explorerscript.decompiler.label;

import org.explorerscript.ssb.SsbOpParam;
import org.explorerscript.ssb.SsbOpParams;
import org.explorerscript.ssb.SsbOperation;
import org.explorerscript.ssb.SsbSpecialOps;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Replaces jumps to memory offsets with jumps to labels.
 */
public final class JumpResolver {

    private JumpResolver() {
    }

    /**
     * Processes an operation.
     * <p>
     * If the operation does not jump to a memory offset it is returned unchanged. Otherwise the
     * label for the jump offset is looked up in {@code knownLabels}; if there is none, a new
     * label with the next free id is created for the current routine and registered. A reused
     * label that belongs to another routine is flagged as referenced from another routine.
     * The result is a {@link SsbLabelJump} whose root is a copy of {@code op} without the jump
     * offset parameter.
     *
     * @param op          The operation.
     * @param knownLabels The labels of the current run; new labels are added to it.
     * @param routineId   The id of the routine {@code op} belongs to.
     * @return {@code op} itself, or the label jump replacing it.
     * @throws MalformedOperationException if the operation has no integer jump offset at the expected index.
     */
    public static SsbOperation processOpForJump(SsbOperation op, KnownLabels knownLabels, int routineId) {
        String opName = op.opCode().name();
        OptionalInt jumpIdx = SsbSpecialOps.jumpParamIndex(opName);
        if (jumpIdx.isEmpty()) {
            return op;
        }
        int jumpParamIdx = jumpIdx.getAsInt();
        List<SsbOpParam> paramList = op.params().asList();
        // NOTE: a list of exactly jumpParamIdx entries passes this check and fails on the read below.
        if (paramList.size() < jumpParamIdx) {
            throw new MalformedOperationException(opName, jumpParamIdx,
                    "The parameters for the OpCode " + opName
                            + " must contain a jump address at index " + jumpParamIdx + ".");
        }
        int oldOffset = readOffset(paramList, jumpParamIdx, opName);

        SsbLabel label = knownLabels.get(oldOffset).orElse(null);
        if (label != null) {
            if (routineId != label.routineId()) {
                label.markReferencedFromOtherRoutine();
            }
        } else {
            label = new SsbLabel(knownLabels.nextLabelId(), routineId);
            knownLabels.put(oldOffset, label);
        }

        List<SsbOpParam> newParams = new ArrayList<>(paramList);
        newParams.remove(jumpParamIdx);
        return new SsbLabelJump(
                new SsbOperation(op.offset(), op.opCode(), SsbOpParams.of(newParams)),
                label
        );
    }

    private static int readOffset(List<SsbOpParam> paramList, int jumpParamIdx, String opName) {
        if (jumpParamIdx >= paramList.size()) {
            throw new MalformedOperationException(opName, jumpParamIdx,
                    "The OpCode " + opName + " has no parameter at jump address index " + jumpParamIdx + ".");
        }
        SsbOpParam param = paramList.get(jumpParamIdx);
        if (param instanceof SsbOpParam.IntParam intParam) {
            return intParam.value();
        }
        throw new MalformedOperationException(opName, jumpParamIdx,
                "The jump address of OpCode " + opName + " at index " + jumpParamIdx
                        + " must be an integer, got: " + param);
    }
}
