package notionstore.domain.httpclient;

@FunctionalInterface
public interface ExceptionBuilder {
    RuntimeException buildException(Throwable cause);
}
