package notionstore.domain.exceptionhandling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.exceptions.ExternalException;
import notionstore.domain.storage.StorageErrorKind;
import notionstore.domain.storage.StorageFailure;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "sb.exceptions.printstacktrace", defaultValue = "false")
    private String printStackTrace;

    @Override
    public String getExceptionMessage(final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        if (Boolean.parseBoolean(printStackTrace)
                || e instanceof ExternalException
                || e instanceof StorageFailure failure && failure.is(StorageErrorKind.UNEXPECTED)) {
            return ExceptionUtils.getStackTrace(e);
        }

        if (e instanceof StorageFailure) {
            return e.toString();
        }

        if (StringUtils.isBlank(e.getMessage())) {
            return e.toString();
        }

        return e.getMessage();
    }
}
