/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.reflectrpc.server.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.reflectrpc.common.RpcTransportContext;
import io.reflectrpc.json.RpcJsonMapper;
import io.reflectrpc.openapi.OpenApiAssembler;
import io.reflectrpc.schema.SchemaOptions;
import io.reflectrpc.server.RpcErrorKind;
import io.reflectrpc.server.RpcHandler;
import io.reflectrpc.server.RpcResponse;
import io.reflectrpc.util.Assert;
import io.reflectrpc.util.Utils;

/**
 * Serves an {@link RpcHandler} over HTTP. Every method is a POST endpoint named by the
 * last path segment of the request; the body carries the encoded arguments.
 * <ul>
 * <li>200 with a JSON body when the method produced a value</li>
 * <li>204 when it did not</li>
 * <li>400, 404 or 500 with a plain-text message on failure</li>
 * <li>405 for any other HTTP method, except a GET of the schema endpoint which returns the
 * OpenAPI document</li>
 * </ul>
 */
public class HttpServletRpcTransport extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(HttpServletRpcTransport.class);

	/**
	 * Context key under which the default extractor stores the
	 * {@link HttpServletRequest}.
	 */
	public static final String REQUEST_KEY = "jakarta.servlet.http.HttpServletRequest";

	public static final String DEFAULT_SCHEMA_ENDPOINT = "swagger.json";

	private static final String APPLICATION_JSON = "application/json";

	private static final String TEXT_PLAIN = "text/plain";

	private static final String UTF_8 = "UTF-8";

	private final RpcHandler handler;

	private final RpcJsonMapper jsonMapper;

	private final RpcTransportContextExtractor<HttpServletRequest> contextExtractor;

	private final String schemaEndpoint;

	private final SchemaOptions schemaOptions;

	private volatile byte[] schema;

	private HttpServletRpcTransport(RpcHandler handler, RpcJsonMapper jsonMapper,
			RpcTransportContextExtractor<HttpServletRequest> contextExtractor, String schemaEndpoint,
			SchemaOptions schemaOptions) {
		this.handler = handler;
		this.jsonMapper = jsonMapper;
		this.contextExtractor = contextExtractor;
		this.schemaEndpoint = schemaEndpoint;
		this.schemaOptions = schemaOptions;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String method = Utils.lastPathSegment(requestPath(request));
		byte[] body = request.getInputStream().readAllBytes();
		RpcTransportContext context = this.contextExtractor.extract(request, RpcTransportContext.create());

		RpcResponse result = this.handler.handle(method, body, context).block();
		if (result == null) {
			result = RpcResponse.failure(RpcErrorKind.INTERNAL_ERROR, "no response");
		}
		logger.debug("POST {} -> {}", method, result.error() != null ? result.error() : "ok");
		write(response, result);
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		if (this.schemaEndpoint == null || !this.schemaEndpoint.equals(Utils.lastPathSegment(requestPath(request)))) {
			response.setStatus(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
			return;
		}
		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		response.getOutputStream().write(schema());
	}

	/**
	 * The OpenAPI document of the handler, assembled on first use.
	 * @return the encoded document
	 * @throws IOException if the document cannot be encoded
	 */
	byte[] schema() throws IOException {
		byte[] current = this.schema;
		if (current == null) {
			current = this.jsonMapper
				.writeValueAsBytes(new OpenApiAssembler(this.schemaOptions).assemble(this.handler));
			this.schema = current;
		}
		return current;
	}

	private static String requestPath(HttpServletRequest request) {
		String pathInfo = request.getPathInfo();
		return pathInfo != null ? pathInfo : request.getRequestURI();
	}

	static int statusOf(RpcErrorKind kind) {
		switch (kind) {
			case BAD_REQUEST:
				return HttpServletResponse.SC_BAD_REQUEST;
			case NOT_FOUND:
				return HttpServletResponse.SC_NOT_FOUND;
			default:
				return HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
		}
	}

	private static void write(HttpServletResponse response, RpcResponse result) throws IOException {
		if (!result.isSuccess()) {
			response.setStatus(statusOf(result.error()));
			response.setContentType(TEXT_PLAIN);
			response.setCharacterEncoding(UTF_8);
			response.getOutputStream().write(result.bodyAsString().getBytes(StandardCharsets.UTF_8));
			return;
		}
		if (!result.hasBody()) {
			response.setStatus(HttpServletResponse.SC_NO_CONTENT);
			return;
		}
		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		response.getOutputStream().write(result.body());
	}

	/**
	 * Builder for {@link HttpServletRpcTransport}.
	 */
	public static class Builder {

		private RpcHandler handler;

		private RpcJsonMapper jsonMapper;

		private RpcTransportContextExtractor<HttpServletRequest> contextExtractor = (request, context) -> {
			context.put(REQUEST_KEY, request);
			return context;
		};

		private String schemaEndpoint = DEFAULT_SCHEMA_ENDPOINT;

		private SchemaOptions schemaOptions = SchemaOptions.defaults();

		private Builder() {
		}

		/**
		 * Sets the handler the calls are dispatched to.
		 * @param handler the handler. Must not be null.
		 * @return this builder instance
		 */
		public Builder handler(RpcHandler handler) {
			Assert.notNull(handler, "handler must not be null");
			this.handler = handler;
			return this;
		}

		/**
		 * Sets the mapper used to encode the OpenAPI document.
		 * @param jsonMapper the mapper. Must not be null.
		 * @return this builder instance
		 */
		public Builder jsonMapper(RpcJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		/**
		 * Sets the function that fills the ambient context from the servlet request.
		 * @param contextExtractor the extractor. Must not be null.
		 * @return this builder instance
		 */
		public Builder contextExtractor(RpcTransportContextExtractor<HttpServletRequest> contextExtractor) {
			Assert.notNull(contextExtractor, "contextExtractor must not be null");
			this.contextExtractor = contextExtractor;
			return this;
		}

		/**
		 * Sets the last path segment a GET request must name to receive the OpenAPI
		 * document, or {@code null} to disable it.
		 * @param schemaEndpoint the segment
		 * @return this builder instance
		 */
		public Builder schemaEndpoint(String schemaEndpoint) {
			this.schemaEndpoint = schemaEndpoint;
			return this;
		}

		public Builder schemaOptions(SchemaOptions schemaOptions) {
			Assert.notNull(schemaOptions, "schemaOptions must not be null");
			this.schemaOptions = schemaOptions;
			return this;
		}

		public HttpServletRpcTransport build() {
			Assert.notNull(this.handler, "handler must be set");
			RpcJsonMapper mapper = this.jsonMapper != null ? this.jsonMapper : RpcJsonMapper.createDefault();
			return new HttpServletRpcTransport(this.handler, mapper, this.contextExtractor, this.schemaEndpoint,
					this.schemaOptions);
		}

	}

}
