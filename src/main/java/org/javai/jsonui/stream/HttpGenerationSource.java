package org.javai.jsonui.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.Reader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link GenerationSource} that POSTs {@code {prompt, context, currentSpec}} as JSON and reads the
 * response body as a chunked text stream.
 */
public class HttpGenerationSource implements GenerationSource {

	private static final Logger logger = LoggerFactory.getLogger(HttpGenerationSource.class);
	private static final int CHUNK_SIZE = 8192;

	private final URI endpoint;
	private final Duration timeout;
	private final Map<String, String> headers;
	private final HttpClient client;
	private final ObjectMapper mapper;

	private HttpGenerationSource(Builder builder) {
		this.endpoint = builder.endpoint;
		this.timeout = builder.timeout;
		this.headers = Map.copyOf(builder.headers);
		this.client = builder.client != null ? builder.client : HttpClient.newHttpClient();
		this.mapper = builder.mapper != null ? builder.mapper : new ObjectMapper();
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public GenerationStream open(GenerationRequest request) throws IOException {
		String body;
		try {
			body = mapper.writeValueAsString(request.toBody());
		}
		catch (JsonProcessingException ex) {
			throw new GenerationTransportException("Could not serialise generation request: " + ex.getOriginalMessage(), ex);
		}

		HttpRequest.Builder http = HttpRequest.newBuilder(endpoint)
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
		if (timeout != null) {
			http.timeout(timeout);
		}
		headers.forEach(http::header);

		logger.debug("POST {} ({} chars)", endpoint, body.length());
		HttpResponse<InputStream> response;
		try {
			response = client.send(http.build(), HttpResponse.BodyHandlers.ofInputStream());
		}
		catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("Interrupted while waiting for " + endpoint);
		}

		int status = response.statusCode();
		if (status < 200 || status >= 300) {
			String message;
			try (InputStream in = response.body()) {
				message = errorMessage(status, new String(in.readAllBytes(), StandardCharsets.UTF_8));
			}
			logger.warn("Generation request failed: {}", message);
			throw new GenerationTransportException(message, status);
		}
		return new ReaderStream(response.body());
	}

	/**
	 * Prefer the body's {@code message} field, then {@code error}, then the bare status.
	 */
	String errorMessage(int status, String body) {
		String fallback = "HTTP error: " + status;
		if (body == null || body.isBlank()) {
			return fallback;
		}
		try {
			Object parsed = mapper.readValue(body, Object.class);
			if (parsed instanceof Map<?, ?> map) {
				if (map.get("message") instanceof String message && !message.isEmpty()) {
					return message;
				}
				if (map.get("error") instanceof String error && !error.isEmpty()) {
					return error;
				}
			}
		}
		catch (JsonProcessingException ex) {
			logger.debug("Error body is not JSON: {}", ex.getOriginalMessage());
		}
		return fallback;
	}

	/**
	 * {@link #close()} closes the body, not the reader: a blocked read holds the reader's lock.
	 */
	private static final class ReaderStream implements GenerationStream {

		private final InputStream body;
		private final Reader reader;
		private final char[] buffer = new char[CHUNK_SIZE];

		ReaderStream(InputStream body) {
			this.body = body;
			this.reader = new InputStreamReader(body, StandardCharsets.UTF_8);
		}

		@Override
		public String nextChunk() throws IOException {
			int read = reader.read(buffer);
			return read < 0 ? null : new String(buffer, 0, read);
		}

		@Override
		public void close() {
			try {
				body.close();
			}
			catch (IOException ex) {
				logger.debug("Error closing generation stream: {}", ex.getMessage());
			}
		}
	}

	public static final class Builder {

		private URI endpoint;
		private Duration timeout;
		private final Map<String, String> headers = new LinkedHashMap<>();
		private HttpClient client;
		private ObjectMapper mapper;

		private Builder() {
		}

		public Builder withEndpoint(URI endpoint) {
			this.endpoint = endpoint;
			return this;
		}

		public Builder withEndpoint(String endpoint) {
			return withEndpoint(URI.create(endpoint));
		}

		/**
		 * Time allowed until response headers arrive. The body stream itself is not bounded.
		 */
		public Builder withTimeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		public Builder withHeader(String name, String value) {
			if (name == null || value == null) {
				throw new IllegalArgumentException("header name and value must not be null");
			}
			this.headers.put(name, value);
			return this;
		}

		public Builder withHttpClient(HttpClient client) {
			this.client = client;
			return this;
		}

		public Builder withObjectMapper(ObjectMapper mapper) {
			this.mapper = mapper;
			return this;
		}

		public HttpGenerationSource build() {
			if (endpoint == null) {
				throw new IllegalStateException("endpoint must be set");
			}
			return new HttpGenerationSource(this);
		}
	}
}
