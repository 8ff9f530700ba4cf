/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import java.util.List;
import java.util.Map;

import io.mcpcli.MockMcpTransport;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 直接在JSON-RPC层面驱动 {@link McpAsyncServer}，覆盖真实客户端不会发出的请求。
 */
@Timeout(15)
class McpAsyncServerTests {

	private MockMcpTransport transport;

	private McpAsyncServer server;

	@BeforeEach
	void setUp() {
		transport = new MockMcpTransport();
		server = McpServer.async(transport)
			.serverInfo("raw-server", "2.0.0")
			.tool(new McpSchema.Tool("noop", "Does nothing", Map.of("type", "object")),
					(exchange, args) -> Mono.just(McpSchema.CallToolResult.text("")))
			.build();
	}

	@AfterEach
	void tearDown() {
		server.close();
	}

	private McpSchema.JSONRPCResponse call(Object id, String method, Object params) {
		transport.simulateIncomingMessage(new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params));
		return transport.awaitSentResponse();
	}

	private McpSchema.JSONRPCResponse initialize(Object id, String protocolVersion) {
		return call(id, McpSchema.METHOD_INITIALIZE, Map.of("protocolVersion", protocolVersion, "capabilities",
				Map.of(), "clientInfo", Map.of("name", "raw-client", "version", "0.1")));
	}

	@Test
	void testInitialize() {
		McpSchema.JSONRPCResponse response = initialize(1, McpSchema.LATEST_PROTOCOL_VERSION);

		assertThat(response.error()).isNull();
		McpSchema.InitializeResult result = (McpSchema.InitializeResult) response.result();
		assertThat(result.protocolVersion()).isEqualTo(McpSchema.LATEST_PROTOCOL_VERSION);
		assertThat(result.serverInfo().name()).isEqualTo("raw-server");
		assertThat(result.capabilities().tools().listChanged()).isTrue();
		assertThat(server.getState()).isEqualTo(McpSession.State.READY);
		assertThat(server.getClientInfo().name()).isEqualTo("raw-client");
	}

	@Test
	void testUnsupportedProtocolVersion() {
		McpSchema.JSONRPCResponse response = initialize(1, "1999-01-01");

		assertThat(response.result()).isNull();
		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.UNSUPPORTED_PROTOCOL_VERSION);
		assertThat(response.error().message()).isEqualTo("Unsupported protocol version: 1999-01-01");
		assertThat(response.error().data()).isEqualTo(Map.of("supported", List.of(McpSchema.LATEST_PROTOCOL_VERSION)));
		assertThat(server.getState()).isEqualTo(McpSession.State.UNCONNECTED);

		// the client may retry with a supported version
		assertThat(initialize(2, McpSchema.LATEST_PROTOCOL_VERSION).error()).isNull();
		assertThat(server.isInitialized()).isTrue();
	}

	@Test
	void testOlderSupportedVersionIsEchoed() {
		server.setProtocolVersions(List.of("2024-11-05", McpSchema.LATEST_PROTOCOL_VERSION));

		McpSchema.JSONRPCResponse response = initialize(1, "2024-11-05");

		assertThat(((McpSchema.InitializeResult) response.result()).protocolVersion()).isEqualTo("2024-11-05");
	}

	@Test
	void testSecondInitializeIsRejected() {
		initialize(1, McpSchema.LATEST_PROTOCOL_VERSION);

		McpSchema.JSONRPCResponse response = initialize(2, McpSchema.LATEST_PROTOCOL_VERSION);

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
		assertThat(response.error().message()).startsWith("Server already initialized");
	}

	@Test
	void testInitializeWithoutParams() {
		McpSchema.JSONRPCResponse response = call(1, McpSchema.METHOD_INITIALIZE, null);

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(server.getState()).isEqualTo(McpSession.State.UNCONNECTED);
	}

	@Test
	void testRequestBeforeInitializeIsRejected() {
		McpSchema.JSONRPCResponse response = call(1, McpSchema.METHOD_TOOLS_LIST, null);

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
	}

	@Test
	void testPingBeforeInitialize() {
		McpSchema.JSONRPCResponse response = call(1, McpSchema.METHOD_PING, null);

		assertThat(response.error()).isNull();
		assertThat(response.result()).isEqualTo(Map.of());
	}

	@Test
	void testUndeclaredCapabilityGetsMethodNotFound() {
		initialize(1, McpSchema.LATEST_PROTOCOL_VERSION);

		McpSchema.JSONRPCResponse response = call(2, McpSchema.METHOD_PROMPT_LIST, null);

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND);
	}

	@Test
	void testSetLoggingLevel() {
		initialize(1, McpSchema.LATEST_PROTOCOL_VERSION);

		McpSchema.JSONRPCResponse response = call(2, McpSchema.METHOD_LOGGING_SET_LEVEL, Map.of("level", "warning"));

		assertThat(response.error()).isNull();
		assertThat(server.getMinLoggingLevel()).isEqualTo(McpSchema.LoggingLevel.WARNING);
	}

	@Test
	void testSetUnknownLoggingLevel() {
		initialize(1, McpSchema.LATEST_PROTOCOL_VERSION);

		McpSchema.JSONRPCResponse response = call(2, McpSchema.METHOD_LOGGING_SET_LEVEL, Map.of("level", "verbose"));

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(response.error().message()).isEqualTo("Unknown logging level: verbose");
		assertThat(server.getMinLoggingLevel()).isEqualTo(McpSchema.LoggingLevel.INFO);
	}

	@Test
	void testToolCallWithoutArguments() {
		initialize(1, McpSchema.LATEST_PROTOCOL_VERSION);

		McpSchema.JSONRPCResponse response = call(2, McpSchema.METHOD_TOOLS_CALL, Map.of("name", "noop"));

		assertThat(response.error()).isNull();
		assertThat(((McpSchema.CallToolResult) response.result()).isError()).isFalse();
	}

}
