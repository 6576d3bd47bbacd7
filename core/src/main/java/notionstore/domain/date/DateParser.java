package notionstore.domain.date;

import java.time.ZonedDateTime;

/**
 * Defines a service for parsing dates
 */
public interface DateParser {
    /**
     * Parse a date into a ZonedDateTime. Dates without a time are treated as midnight UTC, and date times
     * without an offset are treated as UTC.
     *
     * @param date The date string
     * @return The parsed date
     */
    ZonedDateTime parseDate(String date);
}
