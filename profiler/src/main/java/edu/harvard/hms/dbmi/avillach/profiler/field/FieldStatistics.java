package edu.harvard.hms.dbmi.avillach.profiler.field;

import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueClassifier;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.BinaryOperator;

/**
 * Case, min/max and length statistics over the values of one field. Every statistic ignores tokens the
 * {@link ValueClassifier} reports as unknown.
 * <p>
 * Each operation accepts either the plain values or a frequency map; a map is treated as its set of distinct keys and
 * the counts are never inspected.
 */
public class FieldStatistics {

    private static final Logger log = LoggerFactory.getLogger(FieldStatistics.class);

    /**
     * Legacy "no minimum found" length, for callers that need an int from {@link #getMinLength(Iterable)}.
     */
    public static final int UNDEFINED_MIN_LENGTH = 999999;

    private final ValueClassifier classifier;

    public FieldStatistics(ValueClassifier classifier) {
        this.classifier = Preconditions.checkNotNull(classifier, "classifier");
    }

    public FieldCase getCase(@Nullable ValueType fieldType, Map<String, ?> frequencies) {
        return getCase(fieldType, frequencies.keySet());
    }

    /**
     * Determines the case of a string field. Numbers and unknown values do not vote. Any individually mixed value makes
     * the field mixed, as does a field holding both lower and upper case values.
     *
     * @return {@link FieldCase#NOT_APPLICABLE} for any type other than string, {@link FieldCase#UNKNOWN} when no value
     *         could vote
     */
    public FieldCase getCase(@Nullable ValueType fieldType, Iterable<String> values) {
        if (fieldType != ValueType.STRING) {
            return FieldCase.NOT_APPLICABLE;
        }

        boolean lower = false;
        boolean upper = false;
        for (String value : values) {
            if (classifier.isUnknown(value) || classifier.isInteger(value) || classifier.isFloat(value)) {
                continue;
            }
            if (isLowerCase(value)) {
                lower = true;
            } else if (isUpperCase(value)) {
                upper = true;
            } else {
                return FieldCase.MIXED;
            }
        }

        if (lower && upper) {
            return FieldCase.MIXED;
        } else if (lower) {
            return FieldCase.LOWER;
        } else if (upper) {
            return FieldCase.UPPER;
        }
        return FieldCase.UNKNOWN;
    }

    public Optional<String> getMin(@Nullable ValueType valueType, Map<String, ?> frequencies) {
        return getMin(valueType, frequencies.keySet());
    }

    /**
     * Returns the smallest known value, compared numerically for integer and float fields and lexicographically for
     * everything else. Numeric results are rendered back to strings. Values the classifier does not accept as the
     * field's type are left out.
     *
     * @param valueType the field's type; null compares raw strings
     * @return the minimum, or empty if no known value remains
     */
    public Optional<String> getMin(@Nullable ValueType valueType, Iterable<String> values) {
        return extreme(valueType, values, false);
    }

    public Optional<String> getMax(@Nullable ValueType valueType, Map<String, ?> frequencies) {
        return getMax(valueType, frequencies.keySet());
    }

    /**
     * Counterpart of {@link #getMin(ValueType, Iterable)} returning the largest known value.
     */
    public Optional<String> getMax(@Nullable ValueType valueType, Iterable<String> values) {
        return extreme(valueType, values, true);
    }

    public int getMaxLength(Map<String, ?> frequencies) {
        return getMaxLength(frequencies.keySet());
    }

    /**
     * @return the character count of the longest known value, or 0 if there is none
     */
    public int getMaxLength(Iterable<String> values) {
        int maxLength = 0;
        for (String value : knownValues(values)) {
            maxLength = Math.max(maxLength, length(value));
        }
        return maxLength;
    }

    public OptionalInt getMinLength(Map<String, ?> frequencies) {
        return getMinLength(frequencies.keySet());
    }

    /**
     * @return the character count of the shortest known value, or empty if there is none
     */
    public OptionalInt getMinLength(Iterable<String> values) {
        return knownValues(values).stream().mapToInt(FieldStatistics::length).min();
    }

    private Optional<String> extreme(@Nullable ValueType valueType, Iterable<String> values, boolean max) {
        List<String> known = knownValues(values);
        if (valueType == null) {
            return known.stream().reduce(pick(Comparator.<String>naturalOrder(), max));
        }
        return switch (valueType) {
            case INTEGER -> known.stream()
                .map(this::toInteger)
                .flatMap(Optional::stream)
                .reduce(pick(Comparator.<BigInteger>naturalOrder(), max))
                .map(BigInteger::toString);
            case FLOAT -> known.stream()
                .map(this::toFloat)
                .flatMap(Optional::stream)
                .reduce(pick(Comparator.<Double>naturalOrder(), max))
                .map(String::valueOf);
            case STRING, TIMESTAMP, UNKNOWN -> known.stream().reduce(pick(Comparator.<String>naturalOrder(), max));
        };
    }

    private static <T> BinaryOperator<T> pick(Comparator<T> order, boolean max) {
        return max ? BinaryOperator.maxBy(order) : BinaryOperator.minBy(order);
    }

    private List<String> knownValues(Iterable<String> values) {
        List<String> known = new ArrayList<>();
        for (String value : values) {
            if (!classifier.isUnknown(value)) {
                known.add(value);
            }
        }
        return known;
    }

    private Optional<BigInteger> toInteger(String value) {
        if (!classifier.isInteger(value)) {
            log.debug("Ignoring non-integer value '{}' in integer field", value);
            return Optional.empty();
        }
        try {
            return Optional.of(new BigInteger(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-integer value '{}' in integer field", value);
            return Optional.empty();
        }
    }

    // integers are valid float values; isFloat alone excludes them
    private Optional<Double> toFloat(String value) {
        if (!classifier.isInteger(value) && !classifier.isFloat(value)) {
            log.debug("Ignoring non-float value '{}' in float field", value);
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (Double.isNaN(parsed)) {
                log.debug("Ignoring NaN value '{}' in float field", value);
                return Optional.empty();
            }
            return Optional.of(parsed);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-float value '{}' in float field", value);
            return Optional.empty();
        }
    }

    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }

    // at least one cased character, none of them upper or title case
    private static boolean isLowerCase(String value) {
        boolean cased = false;
        for (int i = 0; i < value.length(); ) {
            int codePoint = value.codePointAt(i);
            if (Character.isUpperCase(codePoint) || Character.isTitleCase(codePoint)) {
                return false;
            }
            cased |= Character.isLowerCase(codePoint);
            i += Character.charCount(codePoint);
        }
        return cased;
    }

    private static boolean isUpperCase(String value) {
        boolean cased = false;
        for (int i = 0; i < value.length(); ) {
            int codePoint = value.codePointAt(i);
            if (Character.isLowerCase(codePoint) || Character.isTitleCase(codePoint)) {
                return false;
            }
            cased |= Character.isUpperCase(codePoint);
            i += Character.charCount(codePoint);
        }
        return cased;
    }
}
