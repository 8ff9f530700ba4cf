/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.UnaryOperator;

import io.mcpcli.client.McpAsyncClient;
import io.mcpcli.client.McpClient;
import io.mcpcli.spec.McpError;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.CallToolResult;
import io.mcpcli.spec.McpSchema.GetPromptResult;
import io.mcpcli.spec.McpSchema.Prompt;
import io.mcpcli.spec.McpSchema.PromptMessage;
import io.mcpcli.spec.McpSchema.Resource;
import io.mcpcli.spec.McpSchema.ResourceContents;
import io.mcpcli.spec.McpSchema.ServerCapabilities;
import io.mcpcli.spec.McpSchema.Tool;
import io.mcpcli.spec.McpTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * {@link McpAsyncServer} 的测试套件，可以用于不同的 {@link McpTransport} 实现。
 * 服务器的每项能力都通过真实的 {@link McpAsyncClient} 驱动。
 */
public abstract class AbstractMcpAsyncServerTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final String TEST_RESOURCE_URI = "test://resource";

	private static final String TEST_PROMPT_NAME = "test-prompt";

	private static final Map<String, Object> EMPTY_JSON_SCHEMA = Map.of("type", "object", "properties", Map.of());

	private final List<McpAsyncClient> clients = new ArrayList<>();

	private final List<McpAsyncServer> servers = new ArrayList<>();

	/**
	 * 服务器一侧的通道。每个测试最多创建一个服务器。
	 * @return 服务器通道
	 */
	protected abstract McpTransport serverTransport();

	/**
	 * 与 {@link #serverTransport()} 相连的客户端通道。
	 * @return 客户端通道
	 */
	protected abstract McpTransport clientTransport();

	protected void onStart() {
	}

	protected void onClose() {
	}

	@BeforeEach
	void setUp() {
		onStart();
	}

	@AfterEach
	void tearDown() {
		clients.forEach(McpAsyncClient::close);
		servers.forEach(McpAsyncServer::close);
		onClose();
	}

	private McpAsyncServer server(UnaryOperator<McpServer.AsyncSpecification> customizer) {
		McpAsyncServer server = customizer.apply(McpServer.async(serverTransport()).serverInfo("test-server", "1.0.0"))
			.build();
		servers.add(server);
		return server;
	}

	private McpAsyncClient initializedClient(UnaryOperator<McpClient.AsyncSpec> customizer) {
		McpAsyncClient client = customizer.apply(McpClient.async(clientTransport()).requestTimeout(TIMEOUT)).build();
		clients.add(client);
		client.initialize().block(TIMEOUT);
		return client;
	}

	private McpAsyncClient initializedClient() {
		return initializedClient(spec -> spec);
	}

	private static McpServerFeatures.AsyncToolSpecification tool(String name,
			Function<Map<String, Object>, Mono<CallToolResult>> call) {
		return new McpServerFeatures.AsyncToolSpecification(new Tool(name, "Tool " + name, EMPTY_JSON_SCHEMA),
				(exchange, args) -> call.apply(args));
	}

	private static McpServerFeatures.AsyncToolSpecification echoTool() {
		return tool("echo", args -> Mono.just(CallToolResult.text("ECHO: " + args.get("text"))));
	}

	// ---------------------------------------
	// Server Lifecycle Tests
	// ---------------------------------------

	@Test
	void testConstructorWithInvalidArguments() {
		assertThatThrownBy(() -> McpServer.async(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Transport must not be null");

		assertThatThrownBy(() -> McpServer.async(serverTransport()).serverInfo((McpSchema.Implementation) null))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("Server info must not be null");
	}

	@Test
	void testDuplicateRegistrationIsRejectedByBuilder() {
		assertThatThrownBy(() -> McpServer.async(serverTransport()).tools(echoTool(), echoTool()))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("echo");
	}

	@Test
	void testGracefulShutdown() {
		var mcpAsyncServer = server(spec -> spec);

		StepVerifier.create(mcpAsyncServer.closeGracefully()).verifyComplete();
	}

	@Test
	void testImmediateClose() {
		var mcpAsyncServer = server(spec -> spec);

		assertThatCode(mcpAsyncServer::close).doesNotThrowAnyException();
	}

	@Test
	void testHandshake() {
		var mcpAsyncServer = server(spec -> spec.instructions("demo").tools(echoTool()));

		var client = initializedClient(spec -> spec.clientInfo(new McpSchema.Implementation("test-client", "0.0.1")));

		assertThat(client.getHandshakeResult().protocolVersion()).isEqualTo(McpSchema.LATEST_PROTOCOL_VERSION);
		assertThat(client.getHandshakeResult().requestId()).isEqualTo(1L);
		assertThat(client.getServerInstructions()).isEqualTo("demo");
		assertThat(client.getServerInfo().name()).isEqualTo("test-server");
		assertThat(client.getServerCapabilities().tools()).isNotNull();
		assertThat(client.getServerCapabilities().logging()).isNotNull();
		assertThat(client.getServerCapabilities().prompts()).isNull();

		assertThat(mcpAsyncServer.isInitialized()).isTrue();
		assertThat(mcpAsyncServer.getClientInfo().name()).isEqualTo("test-client");
	}

	// ---------------------------------------
	// Tools Tests
	// ---------------------------------------

	@Test
	void testCallTool() {
		server(spec -> spec.tools(echoTool()));
		var client = initializedClient();

		StepVerifier.create(client.callTool("echo", Map.of("text", "hi"))).consumeNextWith(result -> {
			assertThat(result.isError()).isFalse();
			assertThat(McpSchema.joinText(result.content())).isEqualTo("ECHO: hi");
		}).verifyComplete();
	}

	@Test
	void testListToolsKeepsRegistrationOrder() {
		server(spec -> spec.tools(tool("zeta", args -> Mono.just(CallToolResult.text("z"))), echoTool(),
				tool("alpha", args -> Mono.just(CallToolResult.text("a")))));
		var client = initializedClient();

		StepVerifier.create(client.listTools())
			.consumeNextWith(result -> assertThat(result.tools()).extracting(Tool::name)
				.containsExactly("zeta", "echo", "alpha"))
			.verifyComplete();
	}

	@Test
	void testCallUnknownTool() {
		server(spec -> spec.tools(echoTool()));
		var client = initializedClient();

		StepVerifier.create(client.callTool("missing", Map.of())).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(McpError.class).hasMessage("Unknown tool: missing");
			assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.UNKNOWN_TOOL);
		}).verify(TIMEOUT);
	}

	@Test
	void testToolFailureIsReportedInResult() {
		server(spec -> spec.tools(tool("broken", args -> Mono.error(new IllegalStateException("disk full")))));
		var client = initializedClient();

		StepVerifier.create(client.callTool("broken", Map.of())).consumeNextWith(result -> {
			assertThat(result.isError()).isTrue();
			assertThat(McpSchema.joinText(result.content())).isEqualTo("Tool broken failed: disk full");
		}).verifyComplete();
	}

	@Test
	void testAddToolNotifiesClient() throws Exception {
		var mcpAsyncServer = server(spec -> spec.tools(echoTool()));
		AtomicReference<List<Tool>> announced = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);
		initializedClient(spec -> spec.toolsChangeConsumer(tools -> Mono.fromRunnable(() -> {
			announced.set(tools);
			latch.countDown();
		})));

		StepVerifier.create(mcpAsyncServer.addTool(tool("late", args -> Mono.just(CallToolResult.text("late")))))
			.verifyComplete();

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(announced.get()).extracting(Tool::name).containsExactly("echo", "late");
	}

	@Test
	void testAddDuplicateTool() {
		var mcpAsyncServer = server(spec -> spec.tools(echoTool()));

		StepVerifier.create(mcpAsyncServer.addTool(echoTool()))
			.verifyErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Tool with name 'echo' already exists"));
	}

	@Test
	void testAddToolWithoutCapability() {
		var mcpAsyncServer = server(spec -> spec.capabilities(ServerCapabilities.builder().logging().build()));

		StepVerifier.create(mcpAsyncServer.addTool(echoTool()))
			.verifyErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Server must be configured with tool capabilities"));
	}

	@Test
	void testRemoveTool() {
		var mcpAsyncServer = server(spec -> spec.tools(echoTool()));
		var client = initializedClient();

		StepVerifier.create(mcpAsyncServer.removeTool("echo")).verifyComplete();
		StepVerifier.create(client.listTools())
			.consumeNextWith(result -> assertThat(result.tools()).isEmpty())
			.verifyComplete();

		StepVerifier.create(mcpAsyncServer.removeTool("echo")).verifyErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(McpError.class);
			assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.UNKNOWN_TOOL);
		});
	}

	@Test
	void testClientRefusesUndeclaredCapability() {
		server(spec -> spec.tools(echoTool()));
		var client = initializedClient();

		StepVerifier.create(client.listPrompts())
			.verifyErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Server does not provide the prompts capability"));
	}

	// ---------------------------------------
	// Resources Tests
	// ---------------------------------------

	@Test
	void testReadResourceSeesInPlaceMutation() {
		Resource resource = new Resource(TEST_RESOURCE_URI, "notes", "Shared notes", "text/plain");
		ResourceContents contents = ResourceContents.of(resource, "v1");
		server(spec -> spec.resources(McpServerFeatures.AsyncResourceSpecification.fromContents(resource, contents))
			.tools(tool("append", args -> Mono.fromSupplier(() -> {
				contents.setText(contents.getText() + "\n" + args.get("line"));
				return CallToolResult.text("ok");
			}))));
		var client = initializedClient();

		StepVerifier.create(client.readResource(TEST_RESOURCE_URI))
			.consumeNextWith(result -> assertThat(result.contents().get(0).getText()).isEqualTo("v1"))
			.verifyComplete();

		client.callTool("append", Map.of("line", "v2")).block(TIMEOUT);

		StepVerifier.create(client.readResource(TEST_RESOURCE_URI)).consumeNextWith(result -> {
			assertThat(result.contents()).hasSize(1);
			assertThat(result.contents().get(0).getText()).isEqualTo("v1\nv2");
			assertThat(result.contents().get(0).getUri()).isEqualTo(TEST_RESOURCE_URI);
		}).verifyComplete();
	}

	@Test
	void testReadUnknownResource() {
		server(spec -> spec.resources(McpServerFeatures.AsyncResourceSpecification.fromContents(
				new Resource(TEST_RESOURCE_URI, "notes", null, null),
				new ResourceContents(TEST_RESOURCE_URI, "text/plain", "x"))));
		var client = initializedClient();

		StepVerifier.create(client.readResource("test://missing")).expectErrorSatisfies(error -> {
			assertThat(error).isInstanceOf(McpError.class).hasMessage("Resource not found: test://missing");
			assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND);
		}).verify(TIMEOUT);
	}

	@Test
	void testEmptyContentsFallBackToDescription() {
		Resource resource = new Resource(TEST_RESOURCE_URI, "notes", "Shared notes for the team", null);
		server(spec -> spec.resources(McpServerFeatures.AsyncResourceSpecification.fromContents(resource,
				new ResourceContents(TEST_RESOURCE_URI, null, null))));
		var client = initializedClient();

		StepVerifier.create(client.readResource(TEST_RESOURCE_URI)).consumeNextWith(result -> {
			assertThat(result.contents()).hasSize(1);
			assertThat(result.contents().get(0).getText()).isEqualTo("Shared notes for the team");
			assertThat(result.contents().get(0).getMimeType()).isEqualTo("text/plain");
		}).verifyComplete();
	}

	@Test
	void testListResourcesAndTemplates() {
		server(spec -> spec
			.resources(
					McpServerFeatures.AsyncResourceSpecification.fromContents(
							new Resource("test://b", "b", null, null), new ResourceContents("test://b", null, "b")),
					McpServerFeatures.AsyncResourceSpecification.fromContents(
							new Resource("test://a", "a", null, null), new ResourceContents("test://a", null, "a")))
			.resourceTemplates(new McpSchema.ResourceTemplate("test://files/{name}", "files", "Project files")));
		var client = initializedClient();

		StepVerifier.create(client.listResources())
			.consumeNextWith(result -> assertThat(result.resources()).extracting(Resource::uri)
				.containsExactly("test://b", "test://a"))
			.verifyComplete();
		StepVerifier.create(client.listResourceTemplates())
			.consumeNextWith(result -> assertThat(result.resourceTemplates()).singleElement()
				.satisfies(template -> assertThat(template.uriTemplate()).isEqualTo("test://files/{name}")))
			.verifyComplete();
	}

	@Test
	void testUpdatedNotificationRequiresSubscription() throws Exception {
		Resource resource = new Resource(TEST_RESOURCE_URI, "notes", null, "text/plain");
		var mcpAsyncServer = server(spec -> spec.resources(
				McpServerFeatures.AsyncResourceSpecification.fromContents(resource, ResourceContents.of(resource, "x"))));
		AtomicInteger updates = new AtomicInteger();
		CountDownLatch latch = new CountDownLatch(1);
		var client = initializedClient(spec -> spec.resourcesUpdateConsumer(notification -> Mono.fromRunnable(() -> {
			updates.incrementAndGet();
			latch.countDown();
		})));

		// not subscribed yet, skipped silently
		StepVerifier.create(mcpAsyncServer.notifyResourcesUpdated(TEST_RESOURCE_URI)).verifyComplete();
		assertThat(mcpAsyncServer.isSubscribed(TEST_RESOURCE_URI)).isFalse();

		StepVerifier.create(client.subscribeResource(TEST_RESOURCE_URI)).verifyComplete();
		StepVerifier.create(client.subscribeResource(TEST_RESOURCE_URI)).verifyComplete();
		assertThat(mcpAsyncServer.isSubscribed(TEST_RESOURCE_URI)).isTrue();

		StepVerifier.create(mcpAsyncServer.notifyResourcesUpdated(TEST_RESOURCE_URI, "notes")).verifyComplete();

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(updates.get()).isEqualTo(1);

		StepVerifier.create(client.unsubscribeResource(TEST_RESOURCE_URI)).verifyComplete();
		assertThat(mcpAsyncServer.isSubscribed(TEST_RESOURCE_URI)).isFalse();
	}

	@Test
	void testSubscribeUnknownResource() {
		server(spec -> spec.resources(McpServerFeatures.AsyncResourceSpecification.fromContents(
				new Resource(TEST_RESOURCE_URI, "notes", null, null),
				new ResourceContents(TEST_RESOURCE_URI, null, "x"))));
		var client = initializedClient();

		StepVerifier.create(client.subscribeResource("test://missing"))
			.expectErrorSatisfies(error -> assertThat(((McpError) error).getCode())
				.isEqualTo(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND))
			.verify(TIMEOUT);
	}

	@Test
	void testRemoveResourceDropsSubscription() {
		Resource resource = new Resource(TEST_RESOURCE_URI, "notes", null, null);
		var mcpAsyncServer = server(spec -> spec.resources(
				McpServerFeatures.AsyncResourceSpecification.fromContents(resource, ResourceContents.of(resource, "x"))));
		var client = initializedClient();
		client.subscribeResource(TEST_RESOURCE_URI).block(TIMEOUT);

		StepVerifier.create(mcpAsyncServer.removeResource(TEST_RESOURCE_URI)).verifyComplete();

		assertThat(mcpAsyncServer.isSubscribed(TEST_RESOURCE_URI)).isFalse();
		StepVerifier.create(client.listResources())
			.consumeNextWith(result -> assertThat(result.resources()).isEmpty())
			.verifyComplete();
	}

	// ---------------------------------------
	// Prompts Tests
	// ---------------------------------------

	private static McpServerFeatures.AsyncPromptSpecification greetingPrompt() {
		return new McpServerFeatures.AsyncPromptSpecification(
				new Prompt(TEST_PROMPT_NAME, "Greets someone",
						List.of(new McpSchema.PromptArgument("name", "Who to greet", true))),
				(exchange, request) -> Mono.just(new GetPromptResult("Greeting", List.of(new PromptMessage(
						McpSchema.Role.USER, McpSchema.Content.text("Hello " + request.arguments().get("name")))))));
	}

	@Test
	void testGetPrompt() {
		server(spec -> spec.prompts(greetingPrompt()));
		var client = initializedClient();

		StepVerifier
			.create(client.getPrompt(new McpSchema.GetPromptRequest(TEST_PROMPT_NAME, Map.of("name", "Ada"))))
			.consumeNextWith(result -> {
				assertThat(result.description()).isEqualTo("Greeting");
				assertThat(result.messages()).singleElement()
					.satisfies(message -> assertThat(message.content().text()).isEqualTo("Hello Ada"));
			})
			.verifyComplete();
	}

	@Test
	void testGetUnknownPrompt() {
		server(spec -> spec.prompts(greetingPrompt()));
		var client = initializedClient();

		StepVerifier.create(client.getPrompt(new McpSchema.GetPromptRequest("nope", Map.of())))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(McpError.class).hasMessage("Unknown prompt: nope");
				assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
			})
			.verify(TIMEOUT);
	}

	@Test
	void testPromptFailureIsProtocolError() {
		server(spec -> spec.prompts(new McpServerFeatures.AsyncPromptSpecification(
				new Prompt("fragile", "Always fails", List.of()),
				(exchange, request) -> Mono.error(new IllegalStateException("template missing")))));
		var client = initializedClient();

		StepVerifier.create(client.getPrompt(new McpSchema.GetPromptRequest("fragile", null)))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(McpError.class).hasMessage("template missing");
				assertThat(((McpError) error).getCode()).isEqualTo(McpSchema.ErrorCodes.INTERNAL_HANDLER_ERROR);
			})
			.verify(TIMEOUT);
	}

	@Test
	void testAddAndRemovePrompt() throws Exception {
		var mcpAsyncServer = server(spec -> spec.prompts(greetingPrompt()));
		List<List<Prompt>> announcements = new CopyOnWriteArrayList<>();
		CountDownLatch latch = new CountDownLatch(2);
		var client = initializedClient(spec -> spec.promptsChangeConsumer(prompts -> Mono.fromRunnable(() -> {
			announcements.add(prompts);
			latch.countDown();
		})));

		StepVerifier.create(mcpAsyncServer.addPrompt(new McpServerFeatures.AsyncPromptSpecification(
				new Prompt("farewell", "Says goodbye", List.of()),
				(exchange, request) -> Mono.just(new GetPromptResult(null, List.of())))))
			.verifyComplete();
		StepVerifier.create(mcpAsyncServer.removePrompt(TEST_PROMPT_NAME)).verifyComplete();

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		StepVerifier.create(client.listPrompts())
			.consumeNextWith(result -> assertThat(result.prompts()).extracting(Prompt::name).containsExactly("farewell"))
			.verifyComplete();
	}

	// ---------------------------------------
	// Logging Tests
	// ---------------------------------------

	@Test
	void testLoggingThreshold() throws Exception {
		var mcpAsyncServer = server(spec -> spec);
		List<Object> received = Collections.synchronizedList(new ArrayList<>());
		CountDownLatch latch = new CountDownLatch(2);
		var client = initializedClient(spec -> spec.loggingConsumer(notification -> Mono.fromRunnable(() -> {
			received.add(notification.data());
			latch.countDown();
		})));

		assertThat(mcpAsyncServer.getMinLoggingLevel()).isEqualTo(McpSchema.LoggingLevel.INFO);
		mcpAsyncServer
			.loggingNotification(new McpSchema.LoggingMessageNotification(McpSchema.LoggingLevel.DEBUG, "test", "d"))
			.block(TIMEOUT);
		mcpAsyncServer
			.loggingNotification(new McpSchema.LoggingMessageNotification(McpSchema.LoggingLevel.INFO, "test", "i"))
			.block(TIMEOUT);

		StepVerifier.create(client.setLoggingLevel(McpSchema.LoggingLevel.WARNING)).verifyComplete();
		assertThat(mcpAsyncServer.getMinLoggingLevel()).isEqualTo(McpSchema.LoggingLevel.WARNING);

		mcpAsyncServer
			.loggingNotification(new McpSchema.LoggingMessageNotification(McpSchema.LoggingLevel.NOTICE, "test", "n"))
			.block(TIMEOUT);
		mcpAsyncServer
			.loggingNotification(new McpSchema.LoggingMessageNotification(McpSchema.LoggingLevel.ERROR, "test", "e"))
			.block(TIMEOUT);

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(received).containsExactly("i", "e");
	}

	@Test
	void testLoggingBeforeHandshakeIsDropped() {
		var mcpAsyncServer = server(spec -> spec);

		StepVerifier
			.create(mcpAsyncServer.loggingNotification(
					new McpSchema.LoggingMessageNotification(McpSchema.LoggingLevel.EMERGENCY, "test", "lost")))
			.verifyComplete();
	}

	// ---------------------------------------
	// Delegation Tests
	// ---------------------------------------

	@Test
	void testCreateMessageThroughClient() {
		var mcpAsyncServer = server(spec -> spec);
		initializedClient(spec -> spec.sampling(request -> Mono.just(new McpSchema.CreateMessageResult(
				McpSchema.Role.ASSISTANT, McpSchema.Content.text("sampled: " + request.systemPrompt()), "stub-model",
				McpSchema.CreateMessageResult.STOP_REASON_END_TURN))));

		StepVerifier
			.create(mcpAsyncServer.createMessage(
					new McpSchema.CreateMessageRequest(List.of(McpSchema.SamplingMessage.user("hi")), "be brief", 32)))
			.consumeNextWith(result -> {
				assertThat(result.content().text()).isEqualTo("sampled: be brief");
				assertThat(result.model()).isEqualTo("stub-model");
				assertThat(result.stopReason()).isEqualTo(McpSchema.CreateMessageResult.STOP_REASON_END_TURN);
			})
			.verifyComplete();
	}

	@Test
	void testCreateMessageWithoutSamplingCapability() {
		var mcpAsyncServer = server(spec -> spec);
		initializedClient();

		StepVerifier
			.create(mcpAsyncServer.createMessage(
					new McpSchema.CreateMessageRequest(List.of(McpSchema.SamplingMessage.user("hi")), null, null)))
			.expectErrorSatisfies(error -> assertThat(((McpError) error).getCode())
				.isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST))
			.verify(TIMEOUT);

		StepVerifier.create(mcpAsyncServer.requestSampling(List.of(McpSchema.SamplingMessage.user("hi")), null, null))
			.consumeNextWith(result -> {
				assertThat(result.stopReason()).isEqualTo(McpSchema.CreateMessageResult.STOP_REASON_ERROR);
				assertThat(result.content().text()).startsWith("[sampling fallback] ");
			})
			.verifyComplete();
	}

	@Test
	void testCreateMessageBeforeHandshake() {
		var mcpAsyncServer = server(spec -> spec);

		StepVerifier
			.create(mcpAsyncServer.createMessage(
					new McpSchema.CreateMessageRequest(List.of(McpSchema.SamplingMessage.user("hi")), null, null)))
			.verifyErrorSatisfies(error -> assertThat(error).isInstanceOf(McpError.class)
				.hasMessage("Client must be initialized before sampling"));
	}

	@Test
	void testElicitWithDefaults() {
		var mcpAsyncServer = server(spec -> spec);
		initializedClient(spec -> spec.elicitation(request -> Mono.just(request.message().startsWith("accept")
				? new McpSchema.ElicitResult(McpSchema.ElicitResult.Action.ACCEPT, Map.of("title", "From user"))
				: new McpSchema.ElicitResult(McpSchema.ElicitResult.Action.DECLINE, null))));

		Map<String, Object> defaults = Map.of("title", "Untitled", "priority", "low");

		StepVerifier.create(mcpAsyncServer.elicitWithDefaults("accept please", null, defaults))
			.consumeNextWith(values -> assertThat(values).containsEntry("title", "From user")
				.containsEntry("priority", "low"))
			.verifyComplete();

		StepVerifier.create(mcpAsyncServer.elicitWithDefaults("decline please", null, defaults))
			.consumeNextWith(values -> assertThat(values).isEqualTo(defaults))
			.verifyComplete();
	}

	@Test
	void testRootsChangeHandler() throws Exception {
		AtomicReference<List<McpSchema.Root>> seen = new AtomicReference<>();
		CountDownLatch latch = new CountDownLatch(1);
		var mcpAsyncServer = server(spec -> spec.rootsChangeHandler((exchange, roots) -> Mono.fromRunnable(() -> {
			seen.set(roots);
			latch.countDown();
		})));
		var client = initializedClient(spec -> spec.roots(new McpSchema.Root("file:///work", "work")));

		StepVerifier.create(mcpAsyncServer.listRoots())
			.consumeNextWith(result -> assertThat(result.roots()).extracting(McpSchema.Root::uri)
				.containsExactly("file:///work"))
			.verifyComplete();

		StepVerifier.create(client.addRoot(new McpSchema.Root("file:///docs", "docs"))).verifyComplete();

		assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(seen.get()).extracting(McpSchema.Root::uri).containsExactly("file:///work", "file:///docs");
	}

	@Test
	void testPingBothDirections() {
		var mcpAsyncServer = server(spec -> spec);
		var client = initializedClient();

		StepVerifier.create(client.ping()).expectNextCount(1).verifyComplete();
		StepVerifier.create(mcpAsyncServer.ping()).expectNextCount(1).verifyComplete();
	}

}
