package org.javai.runtimeapi.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.javai.runtimeapi.ApiError;
import org.javai.runtimeapi.BacktraceSettings;
import org.javai.runtimeapi.ErrorEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ErrorEnvelopeJsonTest {

	private final ErrorEnvelopeJson json = new ErrorEnvelopeJson();

	@AfterEach
	void tearDown() {
		System.clearProperty(BacktraceSettings.PROPERTY);
	}

	@Test
	void write_withoutTrace_emitsNullStackTrace() {
		ErrorEnvelope envelope = new ErrorEnvelope("Test error", "java.lang.Exception", null);

		assertThat(json.write(envelope))
				.isEqualTo("{\"errorMessage\":\"Test error\",\"errorType\":\"java.lang.Exception\",\"stackTrace\":null}");
	}

	@Test
	void write_withTrace_emitsLinesInOrder() {
		ErrorEnvelope envelope = new ErrorEnvelope("boom", "HandlerError",
				List.of("at a.B.c(B.java:1)", "at d.E.f(E.java:2)"));

		assertThat(json.write(envelope)).isEqualTo(
				"{\"errorMessage\":\"boom\",\"errorType\":\"HandlerError\","
						+ "\"stackTrace\":[\"at a.B.c(B.java:1)\",\"at d.E.f(E.java:2)\"]}");
	}

	@Test
	void write_escapesMessage() {
		ErrorEnvelope envelope = new ErrorEnvelope("say \"hi\"\nplease", "T", null);

		assertThat(json.write(envelope)).contains("\"errorMessage\":\"say \\\"hi\\\"\\nplease\"");
	}

	@Test
	void write_apiError_usesFixedType() {
		System.setProperty(BacktraceSettings.PROPERTY, "0");

		String written = json.write(ErrorEnvelope.from(ApiError.unrecoverable("Invalid handler")));

		assertThat(written).isEqualTo(
				"{\"errorMessage\":\"Unrecoverable API error: Invalid handler\",\"errorType\":\"RuntimeApiError\",\"stackTrace\":null}");
	}

	@Test
	void read_parsesWireFormat() throws JsonProcessingException {
		ErrorEnvelope envelope = json.read(
				"{\"errorMessage\":\"boom\",\"errorType\":\"HandlerError\",\"stackTrace\":[\"at a.B.c(B.java:1)\"]}");

		assertThat(envelope).isEqualTo(new ErrorEnvelope("boom", "HandlerError", List.of("at a.B.c(B.java:1)")));
	}

	@Test
	void read_missingStackTrace_isNull() throws JsonProcessingException {
		ErrorEnvelope envelope = json.read("{\"errorMessage\":\"boom\",\"errorType\":\"HandlerError\"}");

		assertThat(envelope.stackTrace()).isNull();
	}

	@Test
	void read_invalidJson_throws() {
		assertThatThrownBy(() -> json.read("not json"))
				.isInstanceOf(JsonProcessingException.class);
	}
}
