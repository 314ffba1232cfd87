package edu.harvard.hms.dbmi.avillach.profiler.classify;

import javax.annotation.Nullable;

/**
 * Classifies a single raw token. Implementations are pure: no state changes, and an unparseable token is never an
 * error, it simply answers false to every typed check and ends up a {@link ValueType#STRING}.
 */
public interface ValueClassifier {

    boolean isUnknown(@Nullable String token);

    boolean isInteger(@Nullable String token);

    /**
     * @return true if the token is a floating point literal that is not already an integer
     */
    boolean isFloat(@Nullable String token);

    boolean isTimestamp(@Nullable String token);

    /**
     * Checks unknown, integer, float and timestamp in that order, falling back to string.
     */
    default ValueType classify(@Nullable String token) {
        if (isUnknown(token)) {
            return ValueType.UNKNOWN;
        }
        if (isInteger(token)) {
            return ValueType.INTEGER;
        }
        if (isFloat(token)) {
            return ValueType.FLOAT;
        }
        if (isTimestamp(token)) {
            return ValueType.TIMESTAMP;
        }
        return ValueType.STRING;
    }
}
