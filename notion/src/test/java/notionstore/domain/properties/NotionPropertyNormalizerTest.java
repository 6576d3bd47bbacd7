package notionstore.domain.properties;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notionstore.domain.date.impl.DateParserImpl;
import notionstore.domain.logger.Loggers;
import notionstore.infrastructure.notion.api.NotionDate;
import notionstore.infrastructure.notion.api.NotionProperty;
import notionstore.infrastructure.notion.api.NotionRichText;
import notionstore.infrastructure.notion.api.NotionSelectOption;
import notionstore.infrastructure.notion.api.NotionUser;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(NotionPropertyNormalizer.class)
@AddBeanClasses(DateParserImpl.class)
@AddBeanClasses(Loggers.class)
class NotionPropertyNormalizerTest {

    @Inject
    private NotionPropertyNormalizer normalizer;

    @Test
    void testTitleIsConcatenatedAndTrimmed() {
        final NotionProperty title = NotionProperty.title("title",
                List.of(NotionRichText.of("  Hello "), NotionRichText.of("World  ")));

        assertEquals(Optional.of(new PropertyValue.Text("Hello World")), normalizer.normalize(title));
    }

    @Test
    void testUnicodeSpacesAreStripped() {
        final NotionProperty title = NotionProperty.title("title", List.of(NotionRichText.of("\u3000Roadmap\u2003")));

        assertEquals(Optional.of(new PropertyValue.Text("Roadmap")), normalizer.normalize(title));
    }

    @Test
    void testWhitespaceRichTextIsAbsent() {
        assertTrue(normalizer.normalize(NotionProperty.richText("a", List.of(NotionRichText.of("   ")))).isEmpty());
        assertTrue(normalizer.normalize(NotionProperty.richText("a", List.of())).isEmpty());
    }

    @Test
    void testSelectAndStatus() {
        assertEquals(Optional.of(new PropertyValue.Text("Done")),
                normalizer.normalize(NotionProperty.status("s", NotionSelectOption.of("Done"))));
        assertTrue(normalizer.normalize(NotionProperty.select("s", null)).isEmpty());
        assertTrue(normalizer.normalize(NotionProperty.select("s", new NotionSelectOption("1", null, "red"))).isEmpty());
    }

    @Test
    void testMultiSelectSkipsUnnamedOptions() {
        final NotionProperty tags = NotionProperty.multiSelect("t", List.of(
                NotionSelectOption.of("a"),
                new NotionSelectOption("2", null, null),
                NotionSelectOption.of("b")));

        assertEquals(Optional.of(new PropertyValue.TextList(List.of("a", "b"))), normalizer.normalize(tags));
        assertTrue(normalizer.normalize(NotionProperty.multiSelect("t", List.of())).isEmpty());
    }

    @Test
    void testCheckboxIsAlwaysPresent() {
        assertEquals(Optional.of(new PropertyValue.Bool(true)), normalizer.normalize(NotionProperty.checkbox("c", true)));
        assertEquals(Optional.of(new PropertyValue.Bool(false)), normalizer.normalize(NotionProperty.checkbox("c", null)));
    }

    @Test
    void testNumber() {
        assertEquals(Optional.of(new PropertyValue.Number(3.5)),
                normalizer.normalize(NotionProperty.number("n", new BigDecimal("3.5"))));
        assertTrue(normalizer.normalize(NotionProperty.number("n", null)).isEmpty());
        assertTrue(normalizer.normalize(NotionProperty.number("n", new BigDecimal("1e400"))).isEmpty());
    }

    @Test
    void testContactFields() {
        assertEquals(Optional.of(new PropertyValue.Text("https://example.org")),
                normalizer.normalize(NotionProperty.url("u", "https://example.org")));
        assertEquals(Optional.of(new PropertyValue.Text("a@example.org")),
                normalizer.normalize(NotionProperty.email("e", "a@example.org")));
        assertTrue(normalizer.normalize(NotionProperty.phoneNumber("p", null)).isEmpty());
    }

    @Test
    void testBareDateIsMidnightUtc() {
        assertEquals(Optional.of(new PropertyValue.Timestamp(Instant.parse("2024-03-01T00:00:00Z"))),
                normalizer.normalize(NotionProperty.date("d", NotionDate.of("2024-03-01"))));
    }

    @Test
    void testDateTimeIsConvertedToUtc() {
        assertEquals(Optional.of(new PropertyValue.Timestamp(Instant.parse("2024-03-01T08:30:00Z"))),
                normalizer.normalize(NotionProperty.date("d", NotionDate.of("2024-03-01T10:30:00.000+02:00"))));
    }

    @Test
    void testInvalidDateIsAbsent() {
        assertTrue(normalizer.normalize(NotionProperty.date("d", NotionDate.of("yesterday"))).isEmpty());
        assertTrue(normalizer.normalize(NotionProperty.date("d", null)).isEmpty());
    }

    @Test
    void testTimestamps() {
        assertEquals(Optional.of(new PropertyValue.Timestamp(Instant.parse("2023-01-02T03:04:00Z"))),
                normalizer.normalize(NotionProperty.createdTime("c", "2023-01-02T03:04:00.000Z")));
        assertTrue(normalizer.normalize(NotionProperty.lastEditedTime("l", null)).isEmpty());
    }

    @Test
    void testPeopleSkipsUsersWithoutNames() {
        final NotionProperty people = NotionProperty.people("p", List.of(
                new NotionUser("1", "Ada"),
                new NotionUser("2", null)));

        assertEquals(Optional.of(new PropertyValue.TextList(List.of("Ada"))), normalizer.normalize(people));
        assertTrue(normalizer.normalize(NotionProperty.people("p", List.of(new NotionUser("2", null)))).isEmpty());
    }

    @Test
    void testUnknownKind() {
        assertTrue(normalizer.normalize(NotionProperty.ofType("f", "formula")).isEmpty());
        assertTrue(normalizer.normalize(NotionProperty.ofType("r", "relation")).isEmpty());
    }
}
