package edu.harvard.hms.dbmi.avillach.profiler.field;

import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueType;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Statistics for one field, computed once per profiling request.
 *
 * @param minLength empty when the field holds no known value
 * @param truncated true when the statistics were computed from a truncated frequency distribution
 */
public record FieldProfile(
    int fieldNumber,
    String name,
    ValueType valueType,
    FieldCase fieldCase,
    Optional<String> min,
    Optional<String> max,
    OptionalInt minLength,
    int maxLength,
    int distinctCount,
    boolean truncated
) {
}
