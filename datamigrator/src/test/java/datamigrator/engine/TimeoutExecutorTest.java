package datamigrator.engine;

import datamigrator.exceptions.MigrationTimeoutException;
import datamigrator.exceptions.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeoutExecutor")
class TimeoutExecutorTest {

    @Test
    @DisplayName("should run on the calling thread without a timeout")
    void shouldRunInlineWithoutTimeout() throws Exception {
        Thread caller = Thread.currentThread();

        Thread ran = TimeoutExecutor.executeWithTimeout("inline", Duration.ZERO, Thread::currentThread);

        assertThat(ran).isSameAs(caller);
        assertThat(TimeoutExecutor.isEnabled(null)).isFalse();
        assertThat(TimeoutExecutor.isEnabled(Duration.ofSeconds(-1))).isFalse();
    }

    @Test
    @DisplayName("should return the result within the timeout")
    void shouldReturnResult() throws Exception {
        assertThat(TimeoutExecutor.executeWithTimeout("fast", Duration.ofSeconds(5), () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("should throw when the operation is too slow")
    void shouldTimeOut() {
        assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeout("slow check", Duration.ofMillis(50), () -> {
            Thread.sleep(5_000);
            return true;
        }))
                .isInstanceOf(MigrationTimeoutException.class)
                .hasMessage("Operation 'slow check' timed out after 50 ms");
    }

    @Test
    @DisplayName("should rethrow the operation's own exception")
    void shouldUnwrapCause() {
        assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeout("failing", Duration.ofSeconds(5), () -> {
            throw new ValidationException("grade missing");
        }))
                .isInstanceOf(ValidationException.class)
                .hasMessage("grade missing");
    }
}
