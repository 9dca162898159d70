package org.syntaxforge.cst.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Runtime switches for tree mutation, read from the {@code cst} block of the configuration.
 *
 * @param bindingUpdate How many property bindings follow a removed or replaced child.
 * @param verifyInvariants Whether every public mutation re-checks the whole tree afterwards.
 */
public record TreeOptions(BindingUpdate bindingUpdate, boolean verifyInvariants) {

    private static final Logger LOG = LoggerFactory.getLogger(TreeOptions.class);

    private static volatile TreeOptions current;

    public TreeOptions {
        Objects.requireNonNull(bindingUpdate, "bindingUpdate");
    }

    /**
     * Reads the options from a resolved configuration. The binding-update policy is
     * matched case-insensitively.
     * @param config The configuration containing the {@code cst} block.
     * @return The options.
     * @throws ConfigException.BadValue if the binding-update policy is not a known value.
     */
    public static TreeOptions fromConfig(Config config) {
        Config cst = config.getConfig("cst");
        return new TreeOptions(
            readBindingUpdate(cst, "properties.binding-update"),
            cst.getBoolean("mutation.verify-invariants"));
    }

    private static BindingUpdate readBindingUpdate(Config cst, String path) {
        String value = cst.getString(path);
        try {
            return BindingUpdate.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(cst.getValue(path).origin(), path,
                "'" + value + "' is not one of all, first", e);
        }
    }

    /**
     * Returns the options in effect, loading them through {@link ConfigLoader} on first use.
     * @return The active options.
     */
    public static TreeOptions current() {
        TreeOptions options = current;
        if (options == null) {
            options = fromConfig(ConfigLoader.load());
            LOG.debug("Tree options loaded: {}", options);
            current = options;
        }
        return options;
    }

    /**
     * Replaces the active options for all trees.
     * @param options The options to use from now on.
     */
    public static void install(TreeOptions options) {
        current = Objects.requireNonNull(options, "options");
    }

    /**
     * Drops the active options so that the next {@link #current()} call reloads them.
     */
    public static void reset() {
        current = null;
    }
}
