package notionstore.domain.date.impl;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import notionstore.domain.date.DateParser;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * A service for parsing dates. It handles ISO8601 date times with and without offsets, as well as bare
 * calendar dates like the ones Notion returns for date properties without a time.
 */
@ApplicationScoped
public class DateParserImpl implements DateParser {
    @Override
    public ZonedDateTime parseDate(final String date) {
        return Try.of(() -> parseZonedDate(date))
                .recoverWith(error -> Try.of(() -> parseLocalDateTime(date)))
                .recoverWith(error -> Try.of(() -> parseLocalDate(date)))
                .get();
    }

    public ZonedDateTime parseZonedDate(final String date) {
        return OffsetDateTime.parse(date, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toZonedDateTime();
    }

    public ZonedDateTime parseLocalDateTime(final String date) {
        return LocalDateTime.parse(date, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atZone(ZoneOffset.UTC);
    }

    public ZonedDateTime parseLocalDate(final String date) {
        return LocalDate.parse(date, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC);
    }
}
