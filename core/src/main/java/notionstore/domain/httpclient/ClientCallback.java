package notionstore.domain.httpclient;

import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.core.Response;

@FunctionalInterface
public interface ClientCallback {
    Response call(Client client);
}
