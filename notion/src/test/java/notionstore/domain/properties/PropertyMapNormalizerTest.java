package notionstore.domain.properties;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notionstore.domain.date.impl.DateParserImpl;
import notionstore.domain.logger.Loggers;
import notionstore.infrastructure.notion.api.NotionPage;
import notionstore.infrastructure.notion.api.NotionProperty;
import notionstore.infrastructure.notion.api.NotionRichText;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(PropertyMapNormalizer.class)
@AddBeanClasses(NotionPropertyNormalizer.class)
@AddBeanClasses(DateParserImpl.class)
@AddBeanClasses(Loggers.class)
class PropertyMapNormalizerTest {

    private static final NotionPage PAGE = new NotionPage("page1",
            "2024-01-01T00:00:00.000Z",
            "2024-01-02T00:00:00.000Z",
            null,
            Map.of(
                    "Name", NotionProperty.title("title", List.of(NotionRichText.of("Plan"))),
                    "Notes", NotionProperty.richText("abc", List.of()),
                    "Done", NotionProperty.checkbox("xyz", false)));

    @Inject
    private PropertyMapNormalizer normalizer;

    @Test
    void testKeyedByName() {
        assertEquals(
                Map.of("Name", new PropertyValue.Text("Plan"), "Done", new PropertyValue.Bool(false)),
                normalizer.normalize(PAGE));
    }

    @Test
    void testKeyedById() {
        assertEquals(
                Map.of("title", new PropertyValue.Text("Plan"), "xyz", new PropertyValue.Bool(false)),
                normalizer.normalizeById(PAGE));
    }

    @Test
    void testPageWithoutProperties() {
        assertTrue(normalizer.normalize(new NotionPage("empty", null, null, null, null)).isEmpty());
    }
}
