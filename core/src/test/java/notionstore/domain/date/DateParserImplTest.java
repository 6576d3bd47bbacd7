package notionstore.domain.date;

import notionstore.domain.date.impl.DateParserImpl;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DateParserImplTest {

    @Test
    public void testParseZonedDate() {
        DateParserImpl dateParser = new DateParserImpl();
        ZonedDateTime date = dateParser.parseDate("2024-09-08T07:00:54.455Z");
        assertEquals(ZonedDateTime.of(2024, 9, 8, 7, 0, 54, 455_000_000, ZoneOffset.UTC).toInstant(), date.toInstant());
    }

    @Test
    public void testParseZonedDateWithOffset() {
        DateParserImpl dateParser = new DateParserImpl();
        ZonedDateTime date = dateParser.parseDate("2024-09-08T07:00:00.000+02:00");
        assertEquals(ZonedDateTime.of(2024, 9, 8, 5, 0, 0, 0, ZoneOffset.UTC).toInstant(), date.toInstant());
    }

    @Test
    public void testParseLocalDateTimeIsUtc() {
        DateParserImpl dateParser = new DateParserImpl();
        ZonedDateTime date = dateParser.parseDate("2024-09-08T07:00:54");
        assertEquals(ZonedDateTime.of(2024, 9, 8, 7, 0, 54, 0, ZoneOffset.UTC).toInstant(), date.toInstant());
    }

    @Test
    public void testParseBareDateIsMidnightUtc() {
        DateParserImpl dateParser = new DateParserImpl();
        ZonedDateTime date = dateParser.parseDate("2024-09-08");
        assertEquals(ZonedDateTime.of(2024, 9, 8, 0, 0, 0, 0, ZoneOffset.UTC).toInstant(), date.toInstant());
    }

    @Test
    public void testParseInvalidDate() {
        DateParserImpl dateParser = new DateParserImpl();
        assertThrows(Exception.class, () -> dateParser.parseDate("invalid-date"));
    }
}
