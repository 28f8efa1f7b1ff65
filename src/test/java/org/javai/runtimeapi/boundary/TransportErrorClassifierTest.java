package org.javai.runtimeapi.boundary;

import org.javai.runtimeapi.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.nio.file.AccessDeniedException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class TransportErrorClassifierTest {

    private final TransportErrorClassifier classifier = new TransportErrorClassifier();

    @Test
    void socketTimeout_isRecoverable() {
        ErrorKind kind = classifier.classify("RuntimeApi.next", new SocketTimeoutException("read timed out"));

        assertThat(kind.variant()).isEqualTo(ErrorKind.Variant.RECOVERABLE);
        assertThat(kind.message()).isEqualTo("Socket timeout in RuntimeApi.next: read timed out");
    }

    @Test
    void httpConnectTimeout_isRecoverable() {
        ErrorKind kind = classifier.classify("RuntimeApi.next", new HttpConnectTimeoutException("connect timed out"));

        assertThat(kind.variant()).isEqualTo(ErrorKind.Variant.RECOVERABLE);
        assertThat(kind.message()).startsWith("HTTP timeout");
    }

    @Test
    void connectionRefused_isRecoverable() {
        assertThat(classifier.classify("op", new ConnectException("refused")).variant())
                .isEqualTo(ErrorKind.Variant.RECOVERABLE);
    }

    @Test
    void operationTimeout_isRecoverable() {
        assertThat(classifier.classify("op", new TimeoutException()).variant())
                .isEqualTo(ErrorKind.Variant.RECOVERABLE);
    }

    @Test
    void genericIo_isRecoverable() {
        ErrorKind kind = classifier.classify("op", new IOException("stream closed"));

        assertThat(kind.variant()).isEqualTo(ErrorKind.Variant.RECOVERABLE);
        assertThat(kind.message()).isEqualTo("IO error in op: stream closed");
    }

    @Test
    void unknownHost_isUnrecoverable() {
        ErrorKind kind = classifier.classify("op", new UnknownHostException("runtime.invalid"));

        assertThat(kind.variant()).isEqualTo(ErrorKind.Variant.UNRECOVERABLE);
        assertThat(kind.message()).isEqualTo("Unknown host in op: runtime.invalid");
    }

    @Test
    void invalidEndpoint_isUnrecoverable() {
        assertThat(classifier.classify("op", new MalformedURLException("no protocol")).variant())
                .isEqualTo(ErrorKind.Variant.UNRECOVERABLE);
        assertThat(classifier.classify("op", new URISyntaxException("::", "bad")).variant())
                .isEqualTo(ErrorKind.Variant.UNRECOVERABLE);
    }

    @Test
    void localResources_areUnrecoverable() {
        assertThat(classifier.classify("op", new FileNotFoundException("handler.jar")).variant())
                .isEqualTo(ErrorKind.Variant.UNRECOVERABLE);
        assertThat(classifier.classify("op", new AccessDeniedException("/var/task")).variant())
                .isEqualTo(ErrorKind.Variant.UNRECOVERABLE);
    }

    @Test
    void interrupted_isUnrecoverable() {
        assertThat(classifier.classify("op", new InterruptedException("shutdown")).variant())
                .isEqualTo(ErrorKind.Variant.UNRECOVERABLE);
    }

    @Test
    void unknownChecked_isUnrecoverable() {
        ErrorKind kind = classifier.classify("op", new Exception());

        assertThat(kind.variant()).isEqualTo(ErrorKind.Variant.UNRECOVERABLE);
        assertThat(kind.message()).isEqualTo("Exception in op: java.lang.Exception");
    }
}
