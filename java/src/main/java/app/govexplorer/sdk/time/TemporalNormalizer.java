package app.govexplorer.sdk.time;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Turns the timestamp representations found in governance documents into comparable UTC instants.
 *
 * <p>
 * Every method is total: {@code null}, blank or unparseable input yields {@link Optional#empty()}, which callers
 * treat as "unknown" and leave out of any max/min comparison. Values without an explicit offset are taken as UTC.
 * </p>
 *
 * <p>Accepted string forms:</p>
 * <ul>
 *   <li>ISO instants and offset date-times, e.g. {@code 2024-01-01T12:00:00Z}, {@code 2024-01-01T12:00:00.5+02:00}</li>
 *   <li>ISO zoned date-times, e.g. {@code 2024-01-01T12:00:00+01:00[Europe/Paris]}</li>
 *   <li>local date-times with {@code T} or a single space as separator</li>
 *   <li>offsets without a colon, e.g. {@code 2024-01-01T12:00:00+0000}</li>
 *   <li>ISO basic format, e.g. {@code 20240101T120000Z}</li>
 *   <li>dates, {@code 2024-01-01}, {@code 2024/01/01} or {@code 20240101}, read as midnight UTC</li>
 *   <li>any other signed integer, read as epoch milliseconds</li>
 * </ul>
 */
public final class TemporalNormalizer {

    private static final Logger LOGGER = Logger.getLogger(TemporalNormalizer.class.getName());

    private static final DateTimeFormatter SLASHED_DATE = DateTimeFormatter.ofPattern("uuuu/M/d", Locale.ROOT);
    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d+");
    private static final Pattern BASIC_DATE = Pattern.compile("\\d{8}");

    private static final DateTimeFormatter COMPACT_OFFSET_DATE_TIME = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffset("+HHMM", "Z")
        .optionalEnd()
        .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter BASIC_DATE_TIME = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.YEAR, 4)
        .appendValue(ChronoField.MONTH_OF_YEAR, 2)
        .appendValue(ChronoField.DAY_OF_MONTH, 2)
        .appendLiteral('T')
        .appendValue(ChronoField.HOUR_OF_DAY, 2)
        .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
        .optionalStart()
        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .optionalEnd()
        .optionalStart()
        .appendOffset("+HHmm", "Z")
        .optionalEnd()
        .toFormatter(Locale.ROOT);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_DATE_TIME,
        COMPACT_OFFSET_DATE_TIME,
        BASIC_DATE_TIME);
    private static final Pattern SPACE_SEPARATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d.*)$");

    private TemporalNormalizer() {
    }

    /**
     * Normalises any supported raw value.
     *
     * @param raw a string, a {@link Number} of epoch milliseconds, a {@link Date} or a {@code java.time} value
     * @return the UTC instant, or empty when nothing could be derived
     */
    public static Optional<Instant> normalize(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Instant) {
            return Optional.of((Instant) raw);
        }
        if (raw instanceof CharSequence) {
            return parse(raw.toString());
        }
        if (raw instanceof OffsetDateTime) {
            return Optional.of(((OffsetDateTime) raw).toInstant());
        }
        if (raw instanceof ZonedDateTime) {
            return Optional.of(((ZonedDateTime) raw).toInstant());
        }
        if (raw instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) raw).toInstant(ZoneOffset.UTC));
        }
        if (raw instanceof LocalDate) {
            return Optional.of(((LocalDate) raw).atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (raw instanceof Date) {
            return Optional.of(((Date) raw).toInstant());
        }
        if (raw instanceof Number) {
            return Optional.of(Instant.ofEpochMilli(((Number) raw).longValue()));
        }
        LOGGER.fine(() -> "[governance-explorer] unsupported timestamp type " + raw.getClass().getName());
        return Optional.empty();
    }

    /**
     * Parses a textual timestamp.
     *
     * @param text raw text, possibly {@code null} or blank
     * @return the UTC instant, or empty when the text is absent or not understood
     */
    public static Optional<Instant> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            if (BASIC_DATE.matcher(trimmed).matches()) {
                Optional<Instant> date = parseBasicDate(trimmed);
                if (date.isPresent()) {
                    return date;
                }
            }
            if (EPOCH_MILLIS.matcher(trimmed).matches()) {
                return Optional.of(Instant.ofEpochMilli(Long.parseLong(trimmed)));
            }
            String candidate = SPACE_SEPARATED.matcher(trimmed).replaceFirst("$1T$2");
            if (candidate.indexOf('T') > 0) {
                return Optional.of(parseDateTime(candidate));
            }
            if (candidate.indexOf('/') > 0) {
                return Optional.of(LocalDate.parse(candidate, SLASHED_DATE).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            return Optional.of(LocalDate.parse(candidate).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeException | NumberFormatException | ArithmeticException ex) {
            LOGGER.log(Level.FINE, ex, () -> String.format(Locale.ROOT,
                "[governance-explorer] treating unparseable timestamp '%s' as unknown", trimmed));
            return Optional.empty();
        }
    }

    /**
     * Formats an instant as ISO-8601 in UTC with a {@code Z} suffix.
     *
     * @return the formatted instant, or {@code ""} when unknown
     */
    public static String formatUtc(Optional<Instant> instant) {
        return instant.map(DateTimeFormatter.ISO_INSTANT::format).orElse("");
    }

    /**
     * Sort key that places unknown timestamps before every known one.
     */
    public static Instant orMin(Optional<Instant> instant) {
        return instant.orElse(Instant.MIN);
    }

    private static Optional<Instant> parseBasicDate(String digits) {
        try {
            return Optional.of(LocalDate.parse(digits, DateTimeFormatter.BASIC_ISO_DATE).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Instant parseDateTime(String text) {
        DateTimeParseException failure = null;
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                TemporalAccessor parsed = format.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
                if (parsed instanceof ZonedDateTime) {
                    return ((ZonedDateTime) parsed).toInstant();
                }
                return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ex) {
                failure = ex;
            }
        }
        throw failure;
    }
}
