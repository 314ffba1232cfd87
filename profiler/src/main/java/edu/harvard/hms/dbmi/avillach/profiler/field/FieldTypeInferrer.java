package edu.harvard.hms.dbmi.avillach.profiler.field;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueClassifier;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Infers a field's {@link ValueType} from its distinct values.
 */
public class FieldTypeInferrer {

    private static final Logger log = LoggerFactory.getLogger(FieldTypeInferrer.class);

    private static final Set<ValueType> NUMERIC = Sets.immutableEnumSet(ValueType.INTEGER, ValueType.FLOAT);

    private final ValueClassifier classifier;

    public FieldTypeInferrer(ValueClassifier classifier) {
        this.classifier = Preconditions.checkNotNull(classifier, "classifier");
    }

    public ValueType inferType(FieldFrequency frequency) {
        return inferType(frequency.counts().keySet());
    }

    public ValueType inferType(Map<String, ?> frequencies) {
        return inferType(frequencies.keySet());
    }

    /**
     * A field whose known values all share one type gets that type. Integers mixed with floats make a float field;
     * any other mix is a string field. A field with no known values is unknown.
     */
    public ValueType inferType(Iterable<String> values) {
        Set<ValueType> seen = EnumSet.noneOf(ValueType.class);
        for (String value : values) {
            seen.add(classifier.classify(value));
        }
        seen.remove(ValueType.UNKNOWN);

        ValueType inferred;
        if (seen.isEmpty()) {
            inferred = ValueType.UNKNOWN;
        } else if (seen.size() == 1) {
            inferred = seen.iterator().next();
        } else if (NUMERIC.containsAll(seen)) {
            inferred = ValueType.FLOAT;
        } else {
            inferred = ValueType.STRING;
        }
        log.debug("Types seen {} inferred as {}", seen, inferred);
        return inferred;
    }
}
