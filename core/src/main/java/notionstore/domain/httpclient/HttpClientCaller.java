package notionstore.domain.httpclient;

/**
 * Defines a service that builds a client, generates the response, parses the response, and builds an exception
 * if any of those steps fail. This service will also take care of closing the client and the response.
 */
public interface HttpClientCaller {
    <T> T call(ClientBuilder builder, ClientCallback callback, ResponseCallback<T> responseCallback, ExceptionBuilder exceptionBuilder);
}
