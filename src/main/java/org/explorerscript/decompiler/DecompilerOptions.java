package org.explorerscript.decompiler;

import com.typesafe.config.Config;

/**
 * Options of the jump resolution pass, read from the {@code explorerscript.decompiler} block.
 *
 * @param placeLabels          Insert every label before the operation at its offset.
 * @param collectForeignLabels Collect references to labels placed in other routines.
 */
public record DecompilerOptions(boolean placeLabels, boolean collectForeignLabels) {

    public static final String CONFIG_PATH = "explorerscript.decompiler";

    /**
     * @return Options with every feature enabled, matching {@code reference.conf}.
     */
    public static DecompilerOptions defaults() {
        return new DecompilerOptions(true, true);
    }

    /**
     * Reads the options from a configuration.
     *
     * @param config The application configuration (root, not the decompiler block).
     * @return The options. Missing keys fall back to {@link #defaults()}.
     * @throws com.typesafe.config.ConfigException.WrongType if a key has the wrong type.
     */
    public static DecompilerOptions fromConfig(Config config) {
        DecompilerOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config block = config.getConfig(CONFIG_PATH);
        return new DecompilerOptions(
                block.hasPath("place-labels") ? block.getBoolean("place-labels") : defaults.placeLabels(),
                block.hasPath("collect-foreign-labels")
                        ? block.getBoolean("collect-foreign-labels")
                        : defaults.collectForeignLabels()
        );
    }
}
