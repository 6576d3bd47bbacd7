package notionstore.infrastructure.notion;

import com.google.common.base.Preconditions;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.MediaType;
import notionstore.domain.exceptions.InvalidHeader;
import notionstore.domain.exceptions.Timeout;
import notionstore.domain.httpclient.HttpClientCaller;
import notionstore.domain.response.ResponseValidation;
import notionstore.infrastructure.notion.api.NotionBlockChildrenResponse;
import notionstore.infrastructure.notion.api.NotionDatabaseQuery;
import notionstore.infrastructure.notion.api.NotionDatabaseQueryResponse;
import notionstore.infrastructure.notion.api.NotionPage;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Calls the Notion API over JAX-RS. There are no retries here: a failed call fails the operation that made it.
 */
@ApplicationScoped
public class NotionClientLive implements NotionClient {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    private static final long API_CALL_TIMEOUT_SECONDS_DEFAULT = 60;

    @Inject
    @ConfigProperty(name = "sb.notion.url", defaultValue = "https://api.notion.com")
    private String url;

    @Inject
    @ConfigProperty(name = "sb.notion.version", defaultValue = "2022-06-28")
    private String version;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private HttpClientCaller httpClientCaller;

    @Inject
    private Logger logger;

    private Client getClient() {
        final ClientBuilder clientBuilder = ClientBuilder.newBuilder();
        clientBuilder.connectTimeout(API_CONNECTION_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        clientBuilder.readTimeout(API_CALL_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        return clientBuilder.build();
    }

    @Override
    public NotionPage getPage(final String token, final String pageId) {
        Preconditions.checkArgument(StringUtils.isNotBlank(pageId), "Page ID is required");

        logger.fine("Getting Notion page " + pageId);

        final String target = url + "/v1/pages/" + encode(pageId);

        return httpClientCaller.call(
                this::getClient,
                client -> withHeaders(client.target(target), token)
                        .get(),
                response -> Try.of(() -> responseValidation.validate(response, target))
                        .map(r -> r.readEntity(NotionPage.class))
                        .get(),
                e -> mapTransportException("Failed to get page from Notion API", e));
    }

    @Override
    public NotionDatabaseQueryResponse queryDatabase(
            final String token,
            final String databaseId,
            @Nullable final String cursor,
            final int pageSize) {
        Preconditions.checkArgument(StringUtils.isNotBlank(databaseId), "Database ID is required");

        logger.fine("Querying Notion database " + databaseId + " with cursor " + cursor);

        final String target = url + "/v1/databases/" + encode(databaseId) + "/query";
        final NotionDatabaseQuery body = new NotionDatabaseQuery(cursor, Math.min(pageSize, MAX_PAGE_SIZE));

        return httpClientCaller.call(
                this::getClient,
                client -> withHeaders(client.target(target), token)
                        .post(Entity.entity(body, MediaType.APPLICATION_JSON)),
                response -> Try.of(() -> responseValidation.validate(response, target))
                        .map(r -> r.readEntity(NotionDatabaseQueryResponse.class))
                        .get(),
                e -> mapTransportException("Failed to query database from Notion API", e));
    }

    @Override
    public NotionBlockChildrenResponse getBlockChildren(
            final String token,
            final String blockId,
            @Nullable final String cursor,
            final int pageSize) {
        Preconditions.checkArgument(StringUtils.isNotBlank(blockId), "Block ID is required");

        logger.fine("Getting Notion block children of " + blockId + " with cursor " + cursor);

        final String target = url + "/v1/blocks/" + encode(blockId) + "/children";

        return httpClientCaller.call(
                this::getClient,
                client -> {
                    final WebTarget webTarget = StringUtils.isNotBlank(cursor)
                            ? client.target(target).queryParam("page_size", Math.min(pageSize, MAX_PAGE_SIZE)).queryParam("start_cursor", cursor)
                            : client.target(target).queryParam("page_size", Math.min(pageSize, MAX_PAGE_SIZE));
                    return withHeaders(webTarget, token).get();
                },
                response -> Try.of(() -> responseValidation.validate(response, target))
                        .map(r -> r.readEntity(NotionBlockChildrenResponse.class))
                        .get(),
                e -> mapTransportException("Failed to get block children from Notion API", e));
    }

    private Invocation.Builder withHeaders(final WebTarget webTarget, final String token) {
        if (StringUtils.isBlank(token) || StringUtils.containsAny(token, '\r', '\n')) {
            throw new InvalidHeader("The Notion token can not be used as an Authorization header");
        }

        return webTarget
                .request()
                .header("Authorization", "Bearer " + token)
                .header("Notion-Version", version)
                .header("Accept", MediaType.APPLICATION_JSON);
    }

    /**
     * Exceptions that already describe the failure are passed through, transport failures are wrapped.
     */
    private RuntimeException mapTransportException(final String message, final Throwable e) {
        if (e instanceof ProcessingException && e.getCause() instanceof SocketTimeoutException) {
            return new Timeout(message, e);
        }

        if (e instanceof RuntimeException runtimeException && e.getClass().getPackageName().startsWith("notionstore.")) {
            return runtimeException;
        }

        return new RuntimeException(message, e);
    }

    private String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
