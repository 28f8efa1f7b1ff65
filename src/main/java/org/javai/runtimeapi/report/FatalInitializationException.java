package org.javai.runtimeapi.report;

import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.ErrorEnvelope;

/**
 * Thrown after an initialization failure has been reported. The runtime must stop:
 * this exception is unchecked because nothing above the runtime can recover from it.
 */
public class FatalInitializationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorEnvelope envelope;

    public FatalInitializationException(ErrorEnvelope envelope, ApiError cause) {
        super("Initialization failed: " + envelope.errorMessage(), cause);
        this.envelope = envelope;
    }

    /**
     * The envelope that was reported.
     */
    public ErrorEnvelope envelope() {
        return envelope;
    }

    @Override
    public synchronized ApiError getCause() {
        return (ApiError) super.getCause();
    }
}
