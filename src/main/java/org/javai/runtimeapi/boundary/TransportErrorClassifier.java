package org.javai.runtimeapi.boundary;

import org.javai.runtimeapi.ErrorKind;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies the checked exceptions raised while talking to the runtime API.
 *
 * <p>Timeouts, refused connections and other IO failures are recoverable: the
 * endpoint may answer on the next attempt. Failures that stay the same on every
 * attempt (unknown host, malformed address, missing files, denied access, interrupts)
 * are unrecoverable, and so is anything this classifier does not recognize.
 */
public class TransportErrorClassifier implements ErrorClassifier {

    @Override
    public ErrorKind classify(String operation, Throwable t) {
        // Network: transient
        if (t instanceof SocketTimeoutException) {
            return ErrorKind.recoverable(messageFor("Socket timeout", operation, t));
        }

        if (t instanceof HttpTimeoutException) {
            return ErrorKind.recoverable(messageFor("HTTP timeout", operation, t));
        }

        if (t instanceof ConnectException) {
            return ErrorKind.recoverable(messageFor("Connection refused", operation, t));
        }

        if (t instanceof TimeoutException) {
            return ErrorKind.recoverable(messageFor("Operation timeout", operation, t));
        }

        // Addressing and local resources: retrying cannot help
        if (t instanceof UnknownHostException) {
            return ErrorKind.unrecoverable(messageFor("Unknown host", operation, t));
        }

        if (t instanceof MalformedURLException || t instanceof URISyntaxException) {
            return ErrorKind.unrecoverable(messageFor("Invalid endpoint", operation, t));
        }

        if (t instanceof FileNotFoundException || t instanceof NoSuchFileException) {
            return ErrorKind.unrecoverable(messageFor("File not found", operation, t));
        }

        if (t instanceof AccessDeniedException) {
            return ErrorKind.unrecoverable(messageFor("Access denied", operation, t));
        }

        // General IO: assume the connection dropped
        if (t instanceof IOException) {
            return ErrorKind.recoverable(messageFor("IO error", operation, t));
        }

        if (t instanceof InterruptedException) {
            return ErrorKind.unrecoverable(messageFor("Interrupted", operation, t));
        }

        return ErrorKind.unrecoverable(messageFor(t.getClass().getSimpleName(), operation, t));
    }

    private static String messageFor(String prefix, String operation, Throwable t) {
        String detail = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
        return prefix + " in " + operation + ": " + detail;
    }
}
