package notionstore.domain.response;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;
import notionstore.domain.exceptions.InvalidResponse;
import notionstore.domain.exceptions.MissingResponse;
import notionstore.domain.exceptions.UnauthorizedResponse;

@ApplicationScoped
public class OkResponseValidation implements ResponseValidation {
    @Override
    public Response validate(final Response response, final String uri) {
        if (response.getStatus() == 200 || response.getStatus() == 201) {
            return response;
        }

        final String responseBody = getResponseBody(response);

        if (response.getStatus() == 404) {
            throw new MissingResponse("Expected status code 200, but got 404 from URI " + uri
                    + ". This likely indicates the requested resource was not found.",
                    responseBody);
        }

        if (response.getStatus() == 401 || response.getStatus() == 403) {
            throw new UnauthorizedResponse("Expected status code 200, but got " + response.getStatus()
                    + " from URI " + uri + ". This likely indicates an authentication issue.",
                    responseBody,
                    response.getStatus());
        }

        throw new InvalidResponse("Expected status code 200, but got "
                + response.getStatus()
                + " from URI " + uri + ". " + responseBody,
                responseBody,
                response.getStatus());
    }

    private String getResponseBody(final Response response) {
        return Try.of(() -> response.readEntity(String.class))
                .getOrElse("No response body available");
    }
}
