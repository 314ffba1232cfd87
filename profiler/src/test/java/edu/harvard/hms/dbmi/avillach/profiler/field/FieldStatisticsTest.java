package edu.harvard.hms.dbmi.avillach.profiler.field;

import edu.harvard.hms.dbmi.avillach.profiler.classify.StandardValueClassifier;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueType;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class FieldStatisticsTest {

    private final FieldStatistics statistics = new FieldStatistics(new StandardValueClassifier());

    @Test
    void caseIsNotApplicableForNonStringTypes() {
        List<String> values = List.of("Smith", "JONES", "thompson");
        for (ValueType type : Arrays.asList(ValueType.INTEGER, ValueType.FLOAT, ValueType.TIMESTAMP, ValueType.UNKNOWN, null)) {
            assertEquals(FieldCase.NOT_APPLICABLE, statistics.getCase(type, values), "type " + type);
        }
        assertEquals("n/a", statistics.getCase(ValueType.INTEGER, List.of()).getLabel());
    }

    @Test
    void lowerAndUpperValuesTogetherAreMixed() {
        assertEquals(FieldCase.MIXED, statistics.getCase(ValueType.STRING, List.of("Smith", "JONES", "thompson")));
        assertEquals(FieldCase.MIXED, statistics.getCase(ValueType.STRING, List.of("JONES", "thompson")));
    }

    @Test
    void anyMixedValueMakesTheFieldMixed() {
        assertEquals(FieldCase.MIXED, statistics.getCase(ValueType.STRING, List.of("smith", "jones", "McDonald")));
        assertEquals(FieldCase.MIXED, statistics.getCase(ValueType.STRING, List.of("ABC", "ABC", "---")));
    }

    @Test
    void singleCaseFieldsAreReportedAsSuch() {
        assertEquals(FieldCase.LOWER, statistics.getCase(ValueType.STRING, List.of("smith", "us-cepa", "", "na", "42")));
        assertEquals(FieldCase.UPPER, statistics.getCase(ValueType.STRING, List.of("SMITH", "A1", "3.5", "unknown")));
    }

    @Test
    void caseIsUnknownWithoutVotingValues() {
        assertEquals(FieldCase.UNKNOWN, statistics.getCase(ValueType.STRING, List.of()));
        assertEquals(FieldCase.UNKNOWN, statistics.getCase(ValueType.STRING, List.of("", "unknown", "12", "-4.5")));
    }

    @Test
    void caseOfFrequencyMapLooksAtKeysOnly() {
        Map<String, Long> frequencies = Map.of("smith", 10L, "jones", 2L);
        assertEquals(FieldCase.LOWER, statistics.getCase(ValueType.STRING, frequencies));
    }

    @Test
    void integerMinMaxIgnoreUnknownValues() {
        List<String> values = List.of("10", "20", "unknown", "5");
        assertEquals(Optional.of("5"), statistics.getMin(ValueType.INTEGER, values));
        assertEquals(Optional.of("20"), statistics.getMax(ValueType.INTEGER, values));
    }

    @Test
    void integerMinMaxCompareNumerically() {
        List<String> values = List.of("9", "100", "-3", "+7", "98765432109876543210");
        assertEquals(Optional.of("-3"), statistics.getMin(ValueType.INTEGER, values));
        assertEquals(Optional.of("98765432109876543210"), statistics.getMax(ValueType.INTEGER, values));
    }

    @Test
    void floatMinMaxAreRenderedAsFloats() {
        List<String> values = List.of("1.5", "-2", "3e2", "n/a");
        assertEquals(Optional.of("-2.0"), statistics.getMin(ValueType.FLOAT, values));
        assertEquals(Optional.of("300.0"), statistics.getMax(ValueType.FLOAT, values));
    }

    @Test
    void unparseableValuesAreLeftOut() {
        assertEquals(Optional.of("3"), statistics.getMin(ValueType.INTEGER, List.of("7", "x", "3")));
        assertEquals(Optional.of("7"), statistics.getMax(ValueType.INTEGER, List.of("7", "x", "3")));
        assertEquals(Optional.empty(), statistics.getMin(ValueType.INTEGER, List.of("x", "y")));
        assertEquals(Optional.empty(), statistics.getMax(ValueType.FLOAT, List.of("abc", "NaN")));
    }

    @Test
    void numericValuesRejectedByClassifierAreLeftOut() {
        assertEquals(Optional.of("1.5"), statistics.getMax(ValueType.FLOAT, List.of("1.5", "9d")));
        assertEquals(Optional.of("1.5"), statistics.getMax(ValueType.FLOAT, List.of("1.5", "0x1p4")));
        assertEquals(Optional.of("1.5"), statistics.getMin(ValueType.FLOAT, List.of("1.5", "-1f")));
        assertEquals(Optional.of("4"), statistics.getMax(ValueType.INTEGER, List.of("4", "1_000")));
    }

    @Test
    void stringAndTimestampMinMaxAreLexicographic() {
        List<String> names = List.of("pear", "apple", "Zebra");
        assertEquals(Optional.of("Zebra"), statistics.getMin(ValueType.STRING, names));
        assertEquals(Optional.of("pear"), statistics.getMax(ValueType.STRING, names));
        assertEquals(Optional.of("Zebra"), statistics.getMin(null, names));

        List<String> dates = List.of("2021-03-01", "2020-12-31", "");
        assertEquals(Optional.of("2020-12-31"), statistics.getMin(ValueType.TIMESTAMP, dates));
        assertEquals(Optional.of("2021-03-01"), statistics.getMax(ValueType.TIMESTAMP, dates));

        // numbers in a string field compare as text
        assertEquals(Optional.of("9"), statistics.getMax(ValueType.STRING, List.of("10", "9")));
    }

    @Test
    void minMaxAreEmptyForUnknownOnlyValues() {
        List<String> values = List.of("", "unknown", "NA");
        for (ValueType type : ValueType.values()) {
            assertEquals(Optional.empty(), statistics.getMin(type, values));
            assertEquals(Optional.empty(), statistics.getMax(type, values));
        }
        assertEquals(Optional.empty(), statistics.getMin(ValueType.INTEGER, List.of()));
    }

    @Test
    void minNeverExceedsMax() {
        List<List<String>> samples = List.of(
            List.of("3", "1", "2"), List.of("-5", "5", "0", "unk"), List.of("42"), List.of("1000", "999", "")
        );
        for (List<String> sample : samples) {
            BigInteger min = new BigInteger(statistics.getMin(ValueType.INTEGER, sample).orElseThrow());
            BigInteger max = new BigInteger(statistics.getMax(ValueType.INTEGER, sample).orElseThrow());
            assertTrue(min.compareTo(max) <= 0, "integer sample " + sample);

            String textMin = statistics.getMin(ValueType.STRING, sample).orElseThrow();
            String textMax = statistics.getMax(ValueType.STRING, sample).orElseThrow();
            assertTrue(textMin.compareTo(textMax) <= 0, "string sample " + sample);
        }
    }

    @Test
    void minMaxOfFrequencyMapUseKeys() {
        Map<String, Long> frequencies = Map.of("30", 1L, "4", 500L);
        assertEquals(Optional.of("4"), statistics.getMin(ValueType.INTEGER, frequencies));
        assertEquals(Optional.of("30"), statistics.getMax(ValueType.INTEGER, frequencies));
    }

    @Test
    void lengthsIgnoreUnknownValues() {
        List<String> values = List.of("a", "abc", "", "unknown", "héllo");
        assertEquals(5, statistics.getMaxLength(values));
        assertEquals(OptionalInt.of(1), statistics.getMinLength(values));
    }

    @Test
    void lengthsOfUnknownOnlyValuesAreUndefined() {
        List<String> values = List.of("", "na", "  ");
        assertEquals(0, statistics.getMaxLength(values));
        assertEquals(OptionalInt.empty(), statistics.getMinLength(values));
        assertEquals(FieldStatistics.UNDEFINED_MIN_LENGTH, statistics.getMinLength(values).orElse(FieldStatistics.UNDEFINED_MIN_LENGTH));

        assertEquals(0, statistics.getMaxLength(List.of()));
        assertEquals(OptionalInt.empty(), statistics.getMinLength(List.of()));
    }

    @Test
    void lengthsOfFrequencyMapUseKeys() {
        Map<String, Long> frequencies = Map.of("ab", 1000L, "abcd", 1L);
        assertEquals(4, statistics.getMaxLength(frequencies));
        assertEquals(OptionalInt.of(2), statistics.getMinLength(frequencies));
    }
}
