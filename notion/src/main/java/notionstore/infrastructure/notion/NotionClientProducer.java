package notionstore.infrastructure.notion;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import notionstore.domain.config.MockConfig;
import notionstore.domain.injection.Preferred;

@ApplicationScoped
public class NotionClientProducer {
    @Inject
    private MockConfig mockConfig;

    @Produces
    @Preferred
    @ApplicationScoped
    public NotionClient produceNotionClient(final NotionClientLive clientLive,
                                            final NotionClientMock clientMock) {
        if (mockConfig.isMock()) {
            return clientMock;
        }

        return clientLive;
    }
}
