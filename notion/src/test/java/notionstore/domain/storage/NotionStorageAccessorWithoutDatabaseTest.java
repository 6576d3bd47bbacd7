package notionstore.domain.storage;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import notionstore.domain.config.MockConfig;
import notionstore.domain.config.NotionConfig;
import notionstore.domain.date.impl.DateParserImpl;
import notionstore.domain.document.NotionDatabaseLister;
import notionstore.domain.document.NotionDocumentLoader;
import notionstore.domain.exceptionhandling.StorageExceptionMapping;
import notionstore.domain.httpclient.TryHttpClientCaller;
import notionstore.domain.json.JsonDeserializerJackson;
import notionstore.domain.listing.CursorPaginatedLister;
import notionstore.domain.logger.Loggers;
import notionstore.domain.path.FlatPathResolver;
import notionstore.domain.properties.NotionPropertyNormalizer;
import notionstore.domain.properties.PropertyMapNormalizer;
import notionstore.domain.properties.QuotedFrontmatterRenderer;
import notionstore.domain.render.NotionMarkdownRenderer;
import notionstore.domain.response.OkResponseValidation;
import notionstore.infrastructure.notion.NotionClientLive;
import notionstore.infrastructure.notion.NotionClientMock;
import notionstore.infrastructure.notion.NotionClientProducer;
import notionstore.infrastructure.notion.api.NotionPage;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * No token and no database id are configured.
 */
@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(NotionStorageAccessor.class)
@AddBeanClasses(NotionConfig.class)
@AddBeanClasses(MockConfig.class)
@AddBeanClasses(FlatPathResolver.class)
@AddBeanClasses(NotionDocumentLoader.class)
@AddBeanClasses(NotionDatabaseLister.class)
@AddBeanClasses(CursorPaginatedLister.class)
@AddBeanClasses(NotionMarkdownRenderer.class)
@AddBeanClasses(PropertyMapNormalizer.class)
@AddBeanClasses(NotionPropertyNormalizer.class)
@AddBeanClasses(QuotedFrontmatterRenderer.class)
@AddBeanClasses(StorageExceptionMapping.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(DateParserImpl.class)
@AddBeanClasses(NotionClientProducer.class)
@AddBeanClasses(NotionClientMock.class)
@AddBeanClasses(NotionClientLive.class)
@AddBeanClasses(OkResponseValidation.class)
@AddBeanClasses(TryHttpClientCaller.class)
@AddBeanClasses(Loggers.class)
class NotionStorageAccessorWithoutDatabaseTest {

    @Inject
    private NotionStorageAccessor accessor;

    @Inject
    private NotionClientMock notionClient;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("sb.infrastructure.mock", "true",
                        "sb.notion.databaseid", " "),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    void testListIsNotAdvertised() {
        assertFalse(accessor.info().capability().list());
    }

    @Test
    void testListIsUnsupported() {
        final StorageFailure failure = assertThrows(StorageFailure.class, () -> accessor.list("/"));

        assertEquals(StorageErrorKind.UNSUPPORTED, failure.getKind());
        assertEquals("list requires a database_id", failure.getMessage());
    }

    @Test
    void testRootStatNeedsNoToken() {
        assertTrue(accessor.stat("/").isDirectory());
    }

    @Test
    void testReadWithoutTokenIsAConfigurationError() {
        notionClient.addPage(new NotionPage("page", null, null, null, null));

        final StorageFailure failure = assertThrows(StorageFailure.class, () -> accessor.stat("page.md"));

        assertEquals(StorageErrorKind.CONFIG_INVALID, failure.getKind());
        assertEquals("notion token is required", failure.getMessage());
    }
}
