package org.scopeclient.preferences;

import lombok.Getter;

/**
 * Thrown when a preference is read or written as a kind it does not hold.
 * This is a caller bug (schema mismatch or use after move), never a data condition.
 */
@Getter
public class PreferenceTypeException extends IllegalStateException {
    private final String identifier;
    private final PreferenceType requested;
    private final PreferenceType actual;

    public PreferenceTypeException(String identifier, PreferenceType requested, PreferenceType actual) {
        super(buildMessage(identifier, requested, actual));
        this.identifier = identifier;
        this.requested = requested;
        this.actual = actual;
    }

    private static String buildMessage(String identifier, PreferenceType requested, PreferenceType actual) {
        if (actual == PreferenceType.NONE) {
            String message = "Preference '" + identifier + "' has been moved from";
            return requested == PreferenceType.NONE ? message : message + " and cannot be accessed as " + requested;
        }
        return "Preference '" + identifier + "' holds " + actual + ", not " + requested;
    }
}
