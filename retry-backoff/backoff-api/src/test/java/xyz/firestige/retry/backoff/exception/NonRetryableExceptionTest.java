package xyz.firestige.retry.backoff.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NonRetryableExceptionTest {

    private static final String MESSAGE = "Custom message for NonRetryableException";

    @Test
    void noArgs_messageAndCauseNull() {
        NonRetryableException e = new NonRetryableException();

        assertThat(e.getMessage()).isNull();
        assertThat(e.getCause()).isNull();
    }

    @Test
    void message_only() {
        NonRetryableException e = new NonRetryableException(MESSAGE);

        assertThat(e.getMessage()).isEqualTo(MESSAGE);
        assertThat(e.getCause()).isNull();
    }

    @Test
    void cause_only_doesNotDeriveMessage() {
        IllegalStateException cause = new IllegalStateException("Underlying exception");
        NonRetryableException e = new NonRetryableException(cause);

        assertThat(e.getCause()).isSameAs(cause);
        assertThat(e.getMessage()).isNull();
    }

    @Test
    void messageAndCause() {
        IllegalStateException cause = new IllegalStateException("Underlying exception");
        NonRetryableException e = new NonRetryableException(MESSAGE, cause);

        assertThat(e.getMessage()).isEqualTo(MESSAGE);
        assertThat(e.getCause()).isSameAs(cause);
    }
}
