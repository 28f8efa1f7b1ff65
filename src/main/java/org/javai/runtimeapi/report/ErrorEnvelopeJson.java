package org.javai.runtimeapi.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.runtimeapi.ErrorEnvelope;

import java.util.Objects;

/**
 * Reads and writes the wire format of {@link ErrorEnvelope}:
 * {@code {"errorMessage":"...","errorType":"...","stackTrace":[...]}}, where
 * {@code stackTrace} is null when no backtrace was captured.
 */
public final class ErrorEnvelopeJson {

	private final ObjectMapper mapper;

	public ErrorEnvelopeJson() {
		this(new ObjectMapper());
	}

	public ErrorEnvelopeJson(ObjectMapper mapper) {
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	/**
	 * Serializes an envelope. Envelopes hold only strings, so a failure here means the
	 * mapper itself is misconfigured.
	 *
	 * @throws IllegalStateException if the mapper cannot write the envelope
	 */
	public String write(ErrorEnvelope envelope) {
		Objects.requireNonNull(envelope, "envelope must not be null");
		try {
			return mapper.writeValueAsString(envelope);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize error envelope", e);
		}
	}

	/**
	 * Parses an envelope, for instance one echoed back by a test endpoint.
	 *
	 * @throws JsonProcessingException if the text is not a valid envelope
	 */
	public ErrorEnvelope read(String json) throws JsonProcessingException {
		Objects.requireNonNull(json, "json must not be null");
		return mapper.readValue(json, ErrorEnvelope.class);
	}
}
