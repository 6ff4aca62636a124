package org.explorerscript.ssb;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Registry of SSB operations with special meaning for the decompiler.
 *
 * <p>ExplorerScript only maps opcodes by name, so every table here is keyed by opcode name.
 * The tables describe Sky-style SSB.
 *
 * <p>All collections are unmodifiable. This class is thread-safe as it contains only static
 * constants and methods.
 */
public final class SsbSpecialOps {

    /** Unconditional jump. Always jumps to the offset in parameter 0. */
    public static final String OP_JUMP = "Jump";

    /**
     * Freezes the calling object forever, until the script is replaced. Execution flow is treated
     * as stopped after it, but another control-flow-ending operation may still follow in the
     * routine data and has to be read as well.
     */
    public static final String OP_HOLD = "Hold";
    public static final String OP_RETURN = "Return";
    public static final String OP_END = "End";

    public static final String OPS_CTX_LIVES = "lives";
    public static final String OPS_CTX_OBJECT = "object";
    public static final String OPS_CTX_PERFORMER = "performer";

    public static final String OPS_FLAG__CLEAR = "flag_Clear";
    public static final String OPS_FLAG__SET_ADVENTURE_LOG = "flag_SetAdventureLog";

    /** Branch opcodes, mapped to the index of their jump offset parameter. */
    public static final Map<String, Integer> OPS_BRANCH = buildBranchTable();

    private static final List<String> MENU_CASES = List.of("CaseMenu", "CaseMenu2");
    private static final List<String> CASES = List.of("Case", "CaseValue", "CaseVariable", "CaseScenario");
    private static final List<String> TEXT_CASES = List.of("CaseText", "DefaultText");

    /** Switch and menu opcodes, mapped to the opcodes that are valid cases for them. */
    public static final Map<String, List<String>> OPS_SWITCH_CASE_MAP = buildSwitchTable();

    // TODO: CaseText and DefaultText carry no jump offset entry yet; the text switches are not structured.
    /** Text switch opcodes, mapped to their case opcodes. */
    public static final Map<String, List<String>> OPS_SWITCH_TEXT_CASE_MAP = buildTextSwitchTable();

    /**
     * Operations with a jump to a memory offset, mapped to the index of the parameter that
     * contains the offset. Case opcodes with a leading value parameter carry it at index 2.
     */
    public static final Map<String, Integer> OPS_WITH_JUMP_TO_MEM_OFFSET = buildJumpTable();

    /**
     * Operations that end the control flow in the current routine, usually by jumping
     * somewhere else and not returning. Operations that only may jump (branches) are not included.
     */
    public static final Set<String> OPS_THAT_END_CONTROL_FLOW = Set.of(
            OP_JUMP, OP_RETURN, OP_END, OP_HOLD, "JumpCommon", "Destroy"
    );

    /** The operation after one of these is executed in the context of an actor, object or performer. */
    public static final Set<String> OPS_CTX = Set.of(OPS_CTX_LIVES, OPS_CTX_OBJECT, OPS_CTX_PERFORMER);

    private SsbSpecialOps() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the index of the jump offset parameter of an opcode.
     *
     * @param opName the opcode name
     * @return the parameter index, or empty if the opcode does not jump to a memory offset
     */
    public static OptionalInt jumpParamIndex(String opName) {
        Integer idx = OPS_WITH_JUMP_TO_MEM_OFFSET.get(opName);
        return idx == null ? OptionalInt.empty() : OptionalInt.of(idx);
    }

    public static boolean hasJumpToMemOffset(String opName) {
        return OPS_WITH_JUMP_TO_MEM_OFFSET.containsKey(opName);
    }

    public static boolean endsControlFlow(String opName) {
        return OPS_THAT_END_CONTROL_FLOW.contains(opName);
    }

    public static boolean isContextShift(String opName) {
        return OPS_CTX.contains(opName);
    }

    public static boolean isBranch(String opName) {
        return OPS_BRANCH.containsKey(opName);
    }

    /**
     * @param opName the opcode name
     * @return true if the opcode opens a switch, menu or text switch
     */
    public static boolean isSwitchStart(String opName) {
        return OPS_SWITCH_CASE_MAP.containsKey(opName) || OPS_SWITCH_TEXT_CASE_MAP.containsKey(opName);
    }

    /**
     * Returns the case opcodes that are valid for a switch opcode.
     *
     * @param switchOpName the switch opcode name
     * @return the case opcode names, in table order, or an empty list if the opcode is no switch
     */
    public static List<String> caseOpsFor(String switchOpName) {
        List<String> cases = OPS_SWITCH_CASE_MAP.get(switchOpName);
        if (cases != null) {
            return cases;
        }
        return OPS_SWITCH_TEXT_CASE_MAP.getOrDefault(switchOpName, List.of());
    }

    private static Map<String, Integer> buildJumpTable() {
        Map<String, Integer> table = new LinkedHashMap<>();
        table.put("Case", 1);
        table.put("CaseMenu", 1);
        table.put("CaseMenu2", 1);
        table.put("CaseScenario", 2);
        table.put("CaseValue", 2);
        table.put("CaseVariable", 2);
        table.put(OP_JUMP, 0);
        table.putAll(OPS_BRANCH);
        return Collections.unmodifiableMap(table);
    }

    private static Map<String, Integer> buildBranchTable() {
        Map<String, Integer> table = new LinkedHashMap<>();
        table.put("Branch", 2);
        table.put("BranchBit", 2);
        table.put("BranchDebug", 1);
        table.put("BranchEdit", 1);
        table.put("BranchExecuteSub", 1);
        table.put("BranchPerformance", 2);
        table.put("BranchScenarioNow", 3);
        table.put("BranchScenarioNowAfter", 3);
        table.put("BranchScenarioNowBefore", 3);
        table.put("BranchScenarioAfter", 3);
        table.put("BranchScenarioBefore", 3);
        table.put("BranchSum", 3);
        table.put("BranchValue", 3);
        table.put("BranchVariable", 3);
        table.put("BranchVariation", 1);
        return Collections.unmodifiableMap(table);
    }

    private static Map<String, List<String>> buildSwitchTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("message_SwitchMenu", MENU_CASES);
        table.put("message_SwitchMenu2", MENU_CASES);
        table.put("Switch", CASES);
        table.put("SwitchSector", CASES);
        table.put("ProcessSpecial", CASES);
        table.put("message_Menu", CASES);
        table.put("SwitchScenario", CASES);
        table.put("SwitchRandom", CASES);
        table.put("SwitchScenarioLevel", CASES);
        table.put("SwitchDungeonMode", CASES);
        return Collections.unmodifiableMap(table);
    }

    private static Map<String, List<String>> buildTextSwitchTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("message_SwitchTalk", TEXT_CASES);
        table.put("message_SwitchMonologue", TEXT_CASES);
        return Collections.unmodifiableMap(table);
    }
}
