package org.syntaxforge.cst.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Internal i18n facade for tree error messages.
 * Uses ResourceBundles with the base name "tree_messages".
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "tree_messages";
    private static final ResourceBundle BUNDLE = loadBundle(Locale.getDefault());

    private Messages() {}

    /**
     * Gets a message for the given key.
     * @param key The key of the message.
     * @return The message, or "!key!" if not found.
     */
    public static String get(String key) {
        try {
            return BUNDLE.getString(key);
        } catch (MissingResourceException e) {
            return "!" + key + "!";
        }
    }

    /**
     * Gets a formatted message for the given key.
     * @param key The key of the message.
     * @param args The arguments for the message format.
     * @return The formatted message.
     */
    public static String get(String key, Object... args) {
        if (args == null || args.length == 0) {
            return get(key);
        }
        return MessageFormat.format(get(key), args);
    }

    private static ResourceBundle loadBundle(Locale locale) {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale);
        } catch (MissingResourceException e) {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ENGLISH);
        }
    }
}
