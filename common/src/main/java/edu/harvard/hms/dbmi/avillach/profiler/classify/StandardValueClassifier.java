package edu.harvard.hms.dbmi.avillach.profiler.classify;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Default {@link ValueClassifier}. Unknown markers are compared trimmed and case-insensitively; blank tokens are always
 * unknown regardless of the configured markers.
 */
public class StandardValueClassifier implements ValueClassifier {

    public static final Set<String> DEFAULT_UNKNOWN_MARKERS = ImmutableSet.of("na", "n/a", "unk", "unknown");

    public static final List<String> DEFAULT_TIMESTAMP_PATTERNS = ImmutableList.of(
        "uuuu-MM-dd", "uuuu-MM-dd HH:mm:ss", "uuuu-MM-dd'T'HH:mm:ss", "uuuu-MM-dd HH:mm:ss.SSS", "MM/dd/uuuu",
        "MM/dd/uuuu HH:mm:ss", "dd-MMM-uuuu"
    );

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final Set<String> unknownMarkers;
    private final List<DateTimeFormatter> timestampFormats;

    public StandardValueClassifier() {
        this(DEFAULT_UNKNOWN_MARKERS, DEFAULT_TIMESTAMP_PATTERNS);
    }

    public StandardValueClassifier(Collection<String> unknownMarkers) {
        this(unknownMarkers, DEFAULT_TIMESTAMP_PATTERNS);
    }

    /**
     * @param unknownMarkers tokens that stand for missing data, matched case-insensitively
     * @param timestampPatterns {@link DateTimeFormatter} patterns, resolved strictly
     * @throws IllegalArgumentException if a timestamp pattern is not a valid formatter pattern
     */
    public StandardValueClassifier(Collection<String> unknownMarkers, Collection<String> timestampPatterns) {
        Preconditions.checkNotNull(unknownMarkers, "unknownMarkers");
        Preconditions.checkNotNull(timestampPatterns, "timestampPatterns");
        this.unknownMarkers = unknownMarkers.stream()
            .map(marker -> marker.trim().toLowerCase(Locale.ROOT))
            .collect(ImmutableSet.toImmutableSet());
        this.timestampFormats = timestampPatterns.stream()
            .map(StandardValueClassifier::strictFormatter)
            .collect(ImmutableList.toImmutableList());
    }

    private static DateTimeFormatter strictFormatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    public Set<String> getUnknownMarkers() {
        return unknownMarkers;
    }

    @Override
    public boolean isUnknown(@Nullable String token) {
        if (token == null) {
            return true;
        }
        String trimmed = token.trim();
        return trimmed.isEmpty() || unknownMarkers.contains(trimmed.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isInteger(@Nullable String token) {
        return token != null && INTEGER_PATTERN.matcher(token.trim()).matches();
    }

    @Override
    public boolean isFloat(@Nullable String token) {
        return token != null && !isInteger(token) && FLOAT_PATTERN.matcher(token.trim()).matches();
    }

    @Override
    public boolean isTimestamp(@Nullable String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        String trimmed = token.trim();
        return timestampFormats.stream().anyMatch(format -> parses(format, trimmed));
    }

    private static boolean parses(DateTimeFormatter format, String text) {
        try {
            format.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
