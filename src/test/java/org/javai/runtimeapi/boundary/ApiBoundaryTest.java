package org.javai.runtimeapi.boundary;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.UnknownHostException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ApiBoundaryTest {

    private final ApiBoundary boundary = ApiBoundary.of(new TransportErrorClassifier());

    @AfterEach
    void tearDown() {
        Thread.interrupted();
    }

    @Test
    void call_success_returnsValue() throws ApiError {
        String result = boundary.call("op", () -> "next invocation");

        assertThat(result).isEqualTo("next invocation");
    }

    @Test
    void call_checkedException_isClassifiedAndWrapped() {
        IOException io = new IOException("connection reset");

        assertThatThrownBy(() -> boundary.call("RuntimeApi.next", () -> {
            throw io;
        })).isInstanceOfSatisfying(ApiError.class, error -> {
            assertThat(error.isRecoverable()).isTrue();
            assertThat(error.getCause()).isSameAs(io);
            assertThat(error.getMessage())
                    .isEqualTo("Recoverable API error: IO error in RuntimeApi.next: connection reset");
        });
    }

    @Test
    void call_unrecoverableChecked_isNotRecoverable() {
        assertThatThrownBy(() -> boundary.call("op", () -> {
            throw new UnknownHostException("runtime.invalid");
        })).isInstanceOfSatisfying(ApiError.class, error -> assertThat(error.isRecoverable()).isFalse());
    }

    @Test
    void call_apiError_passesThroughWithoutReclassification() {
        AtomicInteger classifications = new AtomicInteger();
        ApiBoundary counting = ApiBoundary.of((operation, t) -> {
            classifications.incrementAndGet();
            return ErrorKind.unrecoverable("reclassified");
        });
        ApiError original = ApiError.recoverable("already classified");

        assertThatThrownBy(() -> counting.call("op", () -> {
            throw original;
        })).isSameAs(original);
        assertThat(classifications).hasValue(0);
    }

    @Test
    void call_runtimeException_propagatesUnchanged() {
        IllegalStateException defect = new IllegalStateException("bug");

        assertThatThrownBy(() -> boundary.call("op", () -> {
            throw defect;
        })).isSameAs(defect);
    }

    @Test
    void call_interrupted_restoresInterruptFlag() {
        assertThatThrownBy(() -> boundary.call("op", () -> {
            throw new InterruptedException("shutdown");
        })).isInstanceOf(ApiError.class);

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void call_classifierReturningNull_isRejected() {
        ApiBoundary broken = ApiBoundary.of((operation, t) -> null);

        assertThatThrownBy(() -> broken.call("op", () -> {
            throw new IOException("x");
        })).isInstanceOf(NullPointerException.class)
                .hasMessageContaining("java.io.IOException");
    }

    @Test
    void requiresClassifier() {
        assertThatThrownBy(() -> new ApiBoundary(null))
                .isInstanceOf(NullPointerException.class);
    }
}
