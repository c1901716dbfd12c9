package io.github.yok.leaksloader.util;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Generated;

/**
 * Pure functions that turn raw CSV cell text into values that fit the destination columns.
 *
 * <p>
 * None of the methods throw on bad input: a value that cannot be interpreted becomes absent
 * ({@code null} / {@link Optional#empty()}), and an over-long value is cut to the column width.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FieldNormalizer {

    /**
     * Cell values treated as "no value". Matches the default NA markers of the tool that produced
     * the first loads, so re-runs store the same NULLs.
     */
    public static final Set<String> MISSING_VALUE_MARKERS = ImmutableSet.of("", "#N/A",
            "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN", "<NA>",
            "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    /**
     * Date formats tried in order.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code dd-MMM-yyyy} (e.g. {@code 03-Apr-2016}, month name case-insensitive)</li>
     * <li>{@code yyyy/MM/dd}</li>
     * <li>{@code dd/MM/yyyy}</li>
     * </ol>
     * Day and month accept one or two digits. Resolution is strict, so {@code 2016-02-30} is
     * rejected.
     */
    static final List<DateTimeFormatter> DATE_FORMATTERS = ImmutableList.of(
            strictDate("uuuu-M-d"), strictDate("d-MMM-uuuu"), strictDate("uuuu/M/d"),
            strictDate("d/M/uuuu"));

    @Generated
    private FieldNormalizer() {}

    /**
     * Returns whether the raw cell value stands for "no value".
     *
     * @param raw raw cell text, may be {@code null}
     * @return {@code true} if {@code raw} is {@code null} or one of
     *         {@link #MISSING_VALUE_MARKERS}
     */
    public static boolean isMissing(String raw) {
        return raw == null || MISSING_VALUE_MARKERS.contains(raw);
    }

    /**
     * Parses a calendar date using {@link #DATE_FORMATTERS}; the first format that accepts the
     * trimmed text wins.
     *
     * @param raw raw cell text, may be {@code null}
     * @return the parsed date, or empty for missing, blank or unparseable input
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (isMissing(raw)) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return Optional.of(LocalDate.parse(text, formatter));
            } catch (DateTimeParseException e) {
                // try next format
            }
        }
        return Optional.empty();
    }

    /**
     * Cuts a value to at most {@code maxLength} characters, keeping the leading part.
     *
     * <p>
     * Characters are counted as Unicode code points so a surrogate pair is never split.
     * </p>
     *
     * @param raw raw cell text, may be {@code null}
     * @param maxLength column width in characters, must be positive
     * @return {@code null} for missing input, otherwise the value or its leading
     *         {@code maxLength} characters
     * @throws IllegalArgumentException if {@code maxLength} is not positive
     */
    public static String truncate(String raw, int maxLength) {
        Preconditions.checkArgument(maxLength > 0, "maxLength must be positive: %s", maxLength);
        if (isMissing(raw)) {
            return null;
        }
        if (raw.codePointCount(0, raw.length()) <= maxLength) {
            return raw;
        }
        return raw.substring(0, raw.offsetByCodePoints(0, maxLength));
    }

    private static DateTimeFormatter strictDate(String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern(pattern)
                .toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
