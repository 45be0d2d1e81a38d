package world.willfrog.storeagent.integration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.exception.ExternalServiceException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking collaborator call with a hard timeout so one slow dependency cannot stall a batch.
 * Timeouts and failures surface as {@link ExternalServiceException}.
 */
@Slf4j
@Component
public class ExternalCallGuard {

    private final ExecutorService externalCallExecutor;

    public ExternalCallGuard(@Qualifier("externalCallExecutor") ExecutorService externalCallExecutor) {
        this.externalCallExecutor = externalCallExecutor;
    }

    public <T> T call(String service, Duration timeout, Callable<T> call) {
        Future<T> future = externalCallExecutor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("External call timed out service={} timeoutMs={}", service, timeout.toMillis());
            throw new ExternalServiceException(service, "timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalServiceException(service, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ExternalServiceException external) {
                throw external;
            }
            String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            throw new ExternalServiceException(service, message, cause);
        }
    }
}
