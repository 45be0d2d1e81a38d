package world.willfrog.storeagent.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import world.willfrog.storeagent.exception.ExternalServiceException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalCallGuardTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final ExternalCallGuard guard = new ExternalCallGuard(pool);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void call_shouldReturnValueWithinTimeout() {
        assertThat(guard.call("price-search", Duration.ofSeconds(2), () -> "ok")).isEqualTo("ok");
    }

    @Test
    void call_whenSlow_shouldTimeOutAsExternalServiceError() {
        CountDownLatch never = new CountDownLatch(1);

        assertThatThrownBy(() -> guard.call("connector:ebay", Duration.ofMillis(100), () -> never.await(5, TimeUnit.SECONDS)))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageStartingWith("connector:ebay: timed out");
    }

    @Test
    void call_whenCollaboratorThrows_shouldWrapWithServiceName() {
        assertThatThrownBy(() -> guard.call("generative", Duration.ofSeconds(2), () -> {
            throw new IllegalStateException("quota exceeded");
        }))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessage("generative: quota exceeded")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void call_whenCollaboratorRaisesExternalError_shouldKeepIt() {
        ExternalServiceException original = new ExternalServiceException("ebay", "HTTP 503");

        assertThatThrownBy(() -> guard.call("connector:ebay", Duration.ofSeconds(2), () -> {
            throw original;
        })).isSameAs(original);
    }
}
