package com.skanga.dbgate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Central lookup for user-facing message templates.
 * Templates live in {@code messages.properties} on the classpath and use {@link MessageFormat} placeholders.
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String BUNDLE_NAME = "messages";
    private static final ResourceBundle messageBundle = loadBundle();

    private ResourceManager() {
    }

    private static ResourceBundle loadBundle() {
        try {
            return ResourceBundle.getBundle(BUNDLE_NAME);
        } catch (MissingResourceException e) {
            logger.warn("Message bundle '{}' not found on classpath, falling back to message keys", BUNDLE_NAME);
            return null;
        }
    }

    /**
     * Returns the formatted message for the given key.
     * Unknown keys yield the key itself followed by the arguments, so a missing
     * template never hides the error it was meant to describe.
     *
     * @param messageKey key in messages.properties
     * @param messageArgs values for the {0}, {1}, ... placeholders
     * @return the formatted message
     */
    public static String getErrorMessage(String messageKey, Object... messageArgs) {
        String messageTemplate = null;
        if (messageBundle != null) {
            try {
                messageTemplate = messageBundle.getString(messageKey);
            } catch (MissingResourceException e) {
                logger.debug("No message template for key {}", messageKey);
            }
        }

        if (messageTemplate == null) {
            if (messageArgs == null || messageArgs.length == 0) {
                return messageKey;
            }
            StringBuilder fallbackText = new StringBuilder(messageKey);
            for (Object messageArg : messageArgs) {
                fallbackText.append(' ').append(messageArg);
            }
            return fallbackText.toString();
        }

        if (messageArgs == null || messageArgs.length == 0) {
            return messageTemplate;
        }
        return MessageFormat.format(messageTemplate, messageArgs);
    }
}
