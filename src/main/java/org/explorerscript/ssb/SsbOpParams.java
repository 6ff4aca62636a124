package org.explorerscript.ssb;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parameter collection of an {@link SsbOperation}: either an ordered list or a
 * name-keyed map. Both expose their values in declared order through {@link #asList()}.
 */
public sealed interface SsbOpParams permits SsbOpParams.Positional, SsbOpParams.Named {

    /**
     * @return The parameter values in declared order. The returned list is unmodifiable.
     */
    List<SsbOpParam> asList();

    /**
     * @return The number of parameters.
     */
    default int size() {
        return asList().size();
    }

    /**
     * Ordered parameters.
     *
     * @param values The parameter values.
     */
    record Positional(List<SsbOpParam> values) implements SsbOpParams {
        public Positional {
            values = List.copyOf(values);
        }

        @Override
        public List<SsbOpParam> asList() {
            return values;
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    /**
     * Name-keyed parameters. Iteration order is the insertion order of the given map.
     *
     * @param values The parameters by name.
     */
    record Named(Map<String, SsbOpParam> values) implements SsbOpParams {
        public Named {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public List<SsbOpParam> asList() {
            return List.copyOf(values.values());
        }

        @Override
        public String toString() {
            return values.toString();
        }
    }

    static SsbOpParams of(SsbOpParam... values) {
        return new Positional(List.of(values));
    }

    static SsbOpParams of(List<SsbOpParam> values) {
        return new Positional(values);
    }

    static SsbOpParams ints(int... values) {
        List<SsbOpParam> params = new ArrayList<>(values.length);
        for (int value : values) {
            params.add(new SsbOpParam.IntParam(value));
        }
        return new Positional(params);
    }

    static SsbOpParams named(Map<String, SsbOpParam> values) {
        return new Named(values);
    }
}
