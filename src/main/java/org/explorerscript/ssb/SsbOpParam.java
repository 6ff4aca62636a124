package org.explorerscript.ssb;

/**
 * A single parameter value of an {@link SsbOperation}.
 */
public sealed interface SsbOpParam permits SsbOpParam.IntParam, SsbOpParam.ConstantParam, SsbOpParam.StringParam {

    /**
     * An integer parameter. Jump targets are always integer parameters holding a memory offset.
     *
     * @param value The integer value.
     */
    record IntParam(int value) implements SsbOpParam {
        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }

    /**
     * A reference to a named script constant (e.g. an actor or a scenario variable).
     *
     * @param name The constant name.
     */
    record ConstantParam(String name) implements SsbOpParam {
        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A plain string parameter.
     *
     * @param value The string value.
     */
    record StringParam(String value) implements SsbOpParam {
        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    static SsbOpParam of(int value) {
        return new IntParam(value);
    }

    static SsbOpParam constant(String name) {
        return new ConstantParam(name);
    }

    static SsbOpParam string(String value) {
        return new StringParam(value);
    }
}
