package notionstore.domain.tryext;

import io.vavr.CheckedFunction0;
import io.vavr.CheckedFunction1;
import io.vavr.control.Try;

public final class TryExtensions {
    private TryExtensions() {
    }

    /**
     * Opens a client and then a response built from it, passes the response to the callback,
     * and closes both in reverse order.
     */
    public static <C extends AutoCloseable, R extends AutoCloseable, T> Try<T> withResources(
            final CheckedFunction0<C> client,
            final CheckedFunction1<C, R> response,
            final CheckedFunction1<R, T> callback) {
        return Try.withResources(client)
                .of(c -> Try.withResources(() -> response.apply(c))
                        .of(callback)
                        .get());
    }
}
