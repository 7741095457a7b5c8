package com.skillpulse.processing.text;

/**
 * Raised when the skill catalog cannot be loaded: missing source, malformed JSON,
 * an entry without a name, or no skills at all. Fatal at startup.
 */
public class SkillCatalogException extends RuntimeException {

    public SkillCatalogException(String message) {
        super(message);
    }

    public SkillCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
