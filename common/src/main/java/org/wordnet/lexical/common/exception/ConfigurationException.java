package org.wordnet.lexical.common.exception;

/**
 * Bad or unusable configuration: unwritable data directory, malformed project
 * index, invalid options.
 */
public class ConfigurationException extends FatalException {
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(String message) {
        super(message);
    }
}
