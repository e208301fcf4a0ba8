package com.ospicorp.analyticsapi.dataset.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lenient scalar parsing used by {@link SchemaInferencer}. Parsers return {@code null} instead
 * of throwing when a value does not fit the candidate type.
 */
public final class ValueParsers {

  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  // Date and time separated by 'T' or a space, any fraction width, offset as Z, +HH:MM or +HHMM.
  // Without an offset this resolves to a LocalDateTime.
  private static final DateTimeFormatter DATE_TIME_WITH_OFFSET = new DateTimeFormatterBuilder()
      .parseCaseInsensitive()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendPattern("['T'][ ]HH:mm[:ss]")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
      .optionalEnd()
      .optionalStart()
      .appendLiteral(' ')
      .optionalEnd()
      .appendPattern("[XXX][XX]")
      .toFormatter(Locale.ENGLISH);

  private static final List<DateTimeFormatter> ZONED_FORMATS = List.of(
      DateTimeFormatter.ISO_ZONED_DATE_TIME,
      DateTimeFormatter.ISO_INSTANT,
      DATE_TIME_WITH_OFFSET);

  private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ISO_LOCAL_DATE,
      pattern("yyyy/MM/dd[ HH:mm[:ss]]"),
      pattern("M/d/yyyy[ H:mm[:ss]]"),
      pattern("d/M/yyyy[ H:mm[:ss]]"),
      pattern("d.M.yyyy[ H:mm[:ss]]"),
      pattern("MMM d, yyyy"),
      pattern("MMMM d, yyyy"),
      pattern("d MMM yyyy"),
      pattern("d MMMM yyyy"),
      pattern("d-MMM-yyyy"),
      pattern("MMM yyyy"),
      pattern("MMMM yyyy"),
      pattern("yyyy-MM"));

  private ValueParsers() {
  }

  public static boolean isMissing(Object raw) {
    if (raw == null) {
      return true;
    }
    if (raw instanceof String s) {
      return s.isBlank();
    }
    if (raw instanceof Double d) {
      return d.isNaN();
    }
    if (raw instanceof Float f) {
      return f.isNaN();
    }
    return false;
  }

  public static Double parseNumeric(Object raw) {
    if (raw instanceof Boolean) {
      return null;
    }
    if (raw instanceof Number number) {
      return number.doubleValue();
    }
    if (raw instanceof String s) {
      String text = s.trim();
      if (!DECIMAL.matcher(text).matches()) {
        return null;
      }
      try {
        return Double.parseDouble(text);
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  public static Instant parseDatetime(Object raw) {
    if (raw instanceof TemporalAccessor temporal) {
      return toInstant(temporal);
    }
    if (!(raw instanceof String s)) {
      return null;
    }
    String text = s.trim();
    for (DateTimeFormatter format : ZONED_FORMATS) {
      TemporalAccessor parsed = parseOrNull(format, text);
      if (parsed != null) {
        return toInstant(parsed);
      }
    }
    for (DateTimeFormatter format : LOCAL_FORMATS) {
      TemporalAccessor parsed = parseOrNull(format, text);
      if (parsed != null) {
        return toInstant(parsed);
      }
    }
    return null;
  }

  private static TemporalAccessor parseOrNull(DateTimeFormatter format, String text) {
    try {
      return format.parseBest(text, ZonedDateTime::from, Instant::from, LocalDateTime::from,
          LocalDate::from, YearMonth::from);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static Instant toInstant(TemporalAccessor temporal) {
    if (temporal instanceof Instant instant) {
      return instant;
    }
    if (temporal instanceof ZonedDateTime zoned) {
      return zoned.toInstant();
    }
    if (temporal instanceof OffsetDateTime offset) {
      return offset.toInstant();
    }
    if (temporal instanceof LocalDateTime local) {
      return local.toInstant(ZoneOffset.UTC);
    }
    if (temporal instanceof LocalDate date) {
      return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (temporal instanceof YearMonth month) {
      return month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    return null;
  }

  private static DateTimeFormatter pattern(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .toFormatter(Locale.ENGLISH);
  }
}
