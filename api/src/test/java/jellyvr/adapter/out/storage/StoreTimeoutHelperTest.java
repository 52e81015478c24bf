package jellyvr.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import jellyvr.core.model.common.StoreUnavailableException;

@DisplayName("StoreTimeoutHelper")
class StoreTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);

    private StoreTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new StoreTimeoutHelper(TIMEOUT, "TestStore");
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWithinTimeout() {
            final var result = helper.withTimeout(Uni.createFrom().item("ok"), "get")
                    .await()
                    .indefinitely();

            assertEquals("ok", result);
        }

        @Test
        @DisplayName("should fail with StoreUnavailableException on timeout")
        void shouldFailOnTimeout() {
            final var never = Uni.createFrom().<String>nothing();

            final var error = assertThrows(StoreUnavailableException.class, () -> helper.withTimeout(never, "get")
                    .await()
                    .atMost(Duration.ofSeconds(5)));

            assertEquals("get", error.getOperation());
        }

        @Test
        @DisplayName("should wrap backend failures")
        void shouldWrapBackendFailures() {
            final var cause = new UncheckedIOException(new IOException("disk full"));
            final var failing = Uni.createFrom().<Void>failure(cause);

            final var error = assertThrows(StoreUnavailableException.class, () -> helper.withTimeout(failing, "put")
                    .await()
                    .indefinitely());

            assertEquals("put", error.getOperation());
            assertSame(cause, error.getCause());
        }

        @Test
        @DisplayName("should pass StoreUnavailableException through unchanged")
        void shouldPassThroughStoreUnavailable() {
            final var original = new StoreUnavailableException("decode", "unreadable");
            final var failing = Uni.createFrom().<Void>failure(original);

            final var error = assertThrows(StoreUnavailableException.class, () -> helper.withTimeout(failing, "get")
                    .await()
                    .indefinitely());

            assertSame(original, error);
        }
    }
}
