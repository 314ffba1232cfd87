package edu.harvard.hms.dbmi.avillach.profiler.classify;

import edu.harvard.hms.dbmi.avillach.profiler.exception.UnsupportedValueTypeException;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.List;

/**
 * The value type of a field. Tokens carry no type of their own; a field's type decides how its tokens are converted and
 * ordered when computing min and max.
 */
public enum ValueType {
    UNKNOWN("unknown"),
    INTEGER("integer"),
    FLOAT("float"),
    TIMESTAMP("timestamp"),
    STRING("string");

    private static final List<String> NAMES = Arrays.stream(values()).map(ValueType::getName).toList();

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    public String getName() {
        return label;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    /**
     * Resolves a type by its exact lowercase name. A null name resolves to null, which min/max treat as an untyped
     * (raw string) field.
     *
     * @throws UnsupportedValueTypeException if the name is not one of the supported names, including differently
     *         cased or padded forms of one
     */
    public static @Nullable ValueType fromName(@Nullable String name) {
        if (name == null) {
            return null;
        }
        for (ValueType type : values()) {
            if (type.label.equals(name)) {
                return type;
            }
        }
        throw new UnsupportedValueTypeException(name, NAMES);
    }

    @Override
    public String toString() {
        return label;
    }
}
