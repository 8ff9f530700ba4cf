/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcli.spec.McpError;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.CallToolResult;
import io.mcpcli.spec.McpSchema.ElicitResult;
import io.mcpcli.spec.McpSchema.LoggingLevel;
import io.mcpcli.spec.McpSchema.LoggingMessageNotification;
import io.mcpcli.spec.McpSchema.ResourceContents;
import io.mcpcli.spec.McpServerSession;
import io.mcpcli.spec.McpSession;
import io.mcpcli.spec.McpSession.NotificationHandler;
import io.mcpcli.spec.McpSession.RequestHandler;
import io.mcpcli.spec.McpTransport;
import io.mcpcli.telemetry.McpEventRecorder;
import io.mcpcli.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 模型上下文协议(MCP)服务器实现，使用Project Reactor提供异步通信。
 *
 * <p>
 * 服务器在一条通道上为单个客户端服务，负责：
 * <ul>
 * <li>响应 {@code initialize} 握手，记录客户端能力和实现信息</li>
 * <li>维护工具、资源、资源模板和提示词注册表，并在运行时变更时广播 list_changed 通知</li>
 * <li>维护资源订阅集合，只为已订阅的URI发送 {@code notifications/resources/updated}</li>
 * <li>按客户端设置的阈值过滤日志消息通知</li>
 * <li>向客户端委托采样、征询和根目录枚举请求</li>
 * </ul>
 *
 * <p>
 * 服务器在构建完 {@code initialize} 结果时即进入就绪状态，不等待 {@code notifications/initialized}。
 * 握手完成之前收到的其他请求（{@code ping} 除外）以 INVALID_REQUEST 拒绝。
 * </p>
 *
 * @see McpServer
 * @see McpSyncServer
 */
public class McpAsyncServer {

	private static final Logger logger = LoggerFactory.getLogger(McpAsyncServer.class);

	private static final TypeReference<McpSchema.InitializeRequest> INITIALIZE_REQUEST_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.CallToolRequest> CALL_TOOL_REQUEST_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ReadResourceRequest> READ_RESOURCE_REQUEST_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.SubscribeRequest> SUBSCRIBE_REQUEST_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.UnsubscribeRequest> UNSUBSCRIBE_REQUEST_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.GetPromptRequest> GET_PROMPT_REQUEST_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.SetLevelRequest> SET_LEVEL_REQUEST_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<Object> OBJECT_TYPE_REF = new TypeReference<>() {
	};

	private final McpServerSession mcpSession;

	private final ObjectMapper objectMapper;

	private final McpSchema.ServerCapabilities serverCapabilities;

	private final McpSchema.Implementation serverInfo;

	private final String instructions;

	/** 以工具名为键，保持注册顺序 */
	private final Map<String, McpServerFeatures.AsyncToolSpecification> tools = Collections
		.synchronizedMap(new LinkedHashMap<>());

	/** 以URI为键，保持注册顺序 */
	private final Map<String, McpServerFeatures.AsyncResourceSpecification> resources = Collections
		.synchronizedMap(new LinkedHashMap<>());

	private final CopyOnWriteArrayList<McpSchema.ResourceTemplate> resourceTemplates = new CopyOnWriteArrayList<>();

	/** 以提示词名为键，保持注册顺序 */
	private final Map<String, McpServerFeatures.AsyncPromptSpecification> prompts = Collections
		.synchronizedMap(new LinkedHashMap<>());

	private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

	/**
	 * 握手完成前为 {@code null}。
	 */
	private volatile McpAsyncServerExchange exchange;

	/**
	 * 服务器支持的协议版本。
	 */
	private List<String> protocolVersions = List.of(McpSchema.LATEST_PROTOCOL_VERSION);

	/**
	 * 创建服务器并立即开始在通道上接收消息。
	 * @param transport 与客户端通信的通道
	 * @param objectMapper 用于解析请求参数的ObjectMapper
	 * @param features 服务器功能声明
	 * @param requestTimeout 服务器发起请求的超时，{@code null} 表示不设超时
	 * @param eventRecorder 观察收发消息的记录器
	 */
	McpAsyncServer(McpTransport transport, ObjectMapper objectMapper, McpServerFeatures.Async features,
			Duration requestTimeout, McpEventRecorder eventRecorder) {
		Assert.notNull(transport, "Transport must not be null");
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		Assert.notNull(features, "Features must not be null");
		Assert.notNull(eventRecorder, "Event recorder must not be null");

		this.objectMapper = objectMapper;
		this.serverInfo = features.serverInfo();
		this.serverCapabilities = features.serverCapabilities();
		this.instructions = features.instructions();
		for (var tool : features.tools()) {
			putUnique(this.tools, tool.tool().name(), tool, "Tool");
		}
		features.resources().forEach((uri, resource) -> putUnique(this.resources, uri, resource, "Resource"));
		this.resourceTemplates.addAll(features.resourceTemplates());
		features.prompts().forEach((name, prompt) -> putUnique(this.prompts, name, prompt, "Prompt"));

		Map<String, RequestHandler<?>> requestHandlers = new HashMap<>();

		requestHandlers.put(McpSchema.METHOD_INITIALIZE, initializeRequestHandler());

		// Ping MUST respond with an empty data, but not NULL response.
		requestHandlers.put(McpSchema.METHOD_PING, params -> Mono.just(Map.of()));

		if (this.serverCapabilities.tools() != null) {
			requestHandlers.put(McpSchema.METHOD_TOOLS_LIST, toolsListRequestHandler());
			requestHandlers.put(McpSchema.METHOD_TOOLS_CALL, toolsCallRequestHandler());
		}

		if (this.serverCapabilities.resources() != null) {
			requestHandlers.put(McpSchema.METHOD_RESOURCES_LIST, resourcesListRequestHandler());
			requestHandlers.put(McpSchema.METHOD_RESOURCES_READ, resourcesReadRequestHandler());
			requestHandlers.put(McpSchema.METHOD_RESOURCES_TEMPLATES_LIST, resourceTemplateListRequestHandler());
			requestHandlers.put(McpSchema.METHOD_RESOURCES_SUBSCRIBE, resourcesSubscribeRequestHandler());
			requestHandlers.put(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE, resourcesUnsubscribeRequestHandler());
		}

		if (this.serverCapabilities.prompts() != null) {
			requestHandlers.put(McpSchema.METHOD_PROMPT_LIST, promptsListRequestHandler());
			requestHandlers.put(McpSchema.METHOD_PROMPT_GET, promptsGetRequestHandler());
		}

		if (this.serverCapabilities.logging() != null) {
			requestHandlers.put(McpSchema.METHOD_LOGGING_SET_LEVEL, setLoggerRequestHandler());
		}

		Map<String, NotificationHandler> notificationHandlers = new HashMap<>();

		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_INITIALIZED,
				params -> Mono.fromRunnable(() -> logger.debug("Client confirmed initialization: {}", getClientInfo())));

		List<BiFunction<McpAsyncServerExchange, List<McpSchema.Root>, Mono<Void>>> rootsChangeConsumersFinal = new ArrayList<>(
				features.rootsChangeConsumers());
		if (rootsChangeConsumersFinal.isEmpty()) {
			rootsChangeConsumersFinal.add((exchange, roots) -> Mono.fromRunnable(
					() -> logger.warn("Roots list changed notification, but no consumers provided. Roots list changed: {}",
							roots)));
		}
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_ROOTS_LIST_CHANGED,
				rootsListChangedNotificationHandler(rootsChangeConsumersFinal));

		this.mcpSession = new McpServerSession(transport, requestTimeout, eventRecorder);
		this.mcpSession.registerRequestHandlers(requestHandlers);
		this.mcpSession.registerNotificationHandlers(notificationHandlers);
		this.mcpSession.connect();
	}

	private static <T> void putUnique(Map<String, T> registry, String key, T value, String kind) {
		Assert.hasText(key, kind + " key must not be empty");
		Assert.isTrue(registry.putIfAbsent(key, value) == null, kind + " with key '" + key + "' already exists");
	}

	private <T> T parseParams(Object params, TypeReference<T> typeRef) {
		T request = (params != null) ? this.objectMapper.convertValue(params, typeRef) : null;
		if (request == null) {
			throw McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Missing request parameters");
		}
		return request;
	}

	// ---------------------------------------
	// Lifecycle Management
	// ---------------------------------------
	private RequestHandler<McpSchema.InitializeResult> initializeRequestHandler() {
		return params -> Mono.defer(() -> {
			McpSchema.InitializeRequest initializeRequest = parseParams(params, INITIALIZE_REQUEST_TYPE_REF);

			if (!this.mcpSession.transition(McpSession.State.UNCONNECTED, McpSession.State.NEGOTIATING)) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_REQUEST,
						"Server already initialized, state: " + this.mcpSession.getState()));
			}

			logger.info("Client initialize request - Protocol: {}, Capabilities: {}, Info: {}",
					initializeRequest.protocolVersion(), initializeRequest.capabilities(),
					initializeRequest.clientInfo());

			if (!this.protocolVersions.contains(initializeRequest.protocolVersion())) {
				this.mcpSession.transition(McpSession.State.NEGOTIATING, McpSession.State.UNCONNECTED);
				return Mono.error(new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(
						McpSchema.ErrorCodes.UNSUPPORTED_PROTOCOL_VERSION,
						"Unsupported protocol version: " + initializeRequest.protocolVersion(),
						Map.of("supported", this.protocolVersions))));
			}

			this.exchange = new McpAsyncServerExchange(this.mcpSession, initializeRequest.capabilities(),
					initializeRequest.clientInfo());

			// ready as soon as the result exists, the client may pipeline requests after it
			this.mcpSession.transition(McpSession.State.NEGOTIATING, McpSession.State.READY);

			return Mono.just(new McpSchema.InitializeResult(initializeRequest.protocolVersion(),
					this.serverCapabilities, this.serverInfo, this.instructions));
		});
	}

	/**
	 * 获取服务器能力。
	 * @return 服务器能力
	 */
	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.serverCapabilities;
	}

	public McpSchema.Implementation getServerInfo() {
		return this.serverInfo;
	}

	/**
	 * 获取客户端在握手中声明的能力。
	 * @return 客户端能力，握手完成前为 {@code null}
	 */
	public McpSchema.ClientCapabilities getClientCapabilities() {
		McpAsyncServerExchange current = this.exchange;
		return (current != null) ? current.getClientCapabilities() : null;
	}

	/**
	 * 获取客户端在握手中声明的实现信息。
	 * @return 客户端实现信息，握手完成前为 {@code null}
	 */
	public McpSchema.Implementation getClientInfo() {
		McpAsyncServerExchange current = this.exchange;
		return (current != null) ? current.getClientInfo() : null;
	}

	public McpSession.State getState() {
		return this.mcpSession.getState();
	}

	public boolean isInitialized() {
		return this.exchange != null && this.mcpSession.getState() == McpSession.State.READY;
	}

	/**
	 * 优雅地关闭服务器：向客户端发送关闭通知并释放通道。
	 * @return 当服务器关闭时完成的Mono
	 */
	public Mono<Void> closeGracefully() {
		return this.mcpSession.closeGracefully();
	}

	public void close() {
		this.mcpSession.close();
	}

	private NotificationHandler rootsListChangedNotificationHandler(
			List<BiFunction<McpAsyncServerExchange, List<McpSchema.Root>, Mono<Void>>> rootsChangeConsumers) {
		return params -> withExchange("roots list change", exchange -> exchange.listRoots()
			.flatMap(listRootsResult -> Flux.fromIterable(rootsChangeConsumers)
				.flatMap(consumer -> consumer.apply(exchange, listRootsResult.roots()))
				.onErrorResume(error -> {
					logger.error("Error handling roots list change notification", error);
					return Mono.empty();
				})
				.then()));
	}

	private <T> Mono<T> withExchange(String actionName, Function<McpAsyncServerExchange, Mono<T>> action) {
		return Mono.defer(() -> {
			McpAsyncServerExchange current = this.exchange;
			if (current == null) {
				logger.debug("Ignoring {} before initialization", actionName);
				return Mono.empty();
			}
			return action.apply(current);
		});
	}

	// ---------------------------------------
	// Tool Management
	// ---------------------------------------

	/**
	 * 在运行时添加新工具，并在客户端已连接时广播工具列表变更。
	 * @param toolSpecification 要添加的工具规范
	 * @return 当客户端被通知后完成的Mono
	 */
	public Mono<Void> addTool(McpServerFeatures.AsyncToolSpecification toolSpecification) {
		if (toolSpecification == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Tool specification must not be null"));
		}
		if (this.serverCapabilities.tools() == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_REQUEST,
					"Server must be configured with tool capabilities"));
		}

		return Mono.defer(() -> {
			String name = toolSpecification.tool().name();
			if (this.tools.putIfAbsent(name, toolSpecification) != null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS,
						"Tool with name '" + name + "' already exists"));
			}
			logger.debug("Added tool handler: {}", name);
			return notifyToolsListChanged();
		});
	}

	/**
	 * 在运行时移除工具，并广播工具列表变更。
	 * @param toolName 要移除的工具名
	 * @return 当客户端被通知后完成的Mono
	 */
	public Mono<Void> removeTool(String toolName) {
		if (toolName == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Tool name must not be null"));
		}
		return Mono.defer(() -> {
			if (this.tools.remove(toolName) == null) {
				return Mono.error(
						McpError.of(McpSchema.ErrorCodes.UNKNOWN_TOOL, "Tool with name '" + toolName + "' not found"));
			}
			logger.debug("Removed tool handler: {}", toolName);
			return notifyToolsListChanged();
		});
	}

	/**
	 * 向客户端广播工具列表已变更。
	 * @return 当通知发送后完成的Mono
	 */
	public Mono<Void> notifyToolsListChanged() {
		return this.mcpSession.sendNotification(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED);
	}

	private RequestHandler<McpSchema.ListToolsResult> toolsListRequestHandler() {
		return params -> Mono.fromSupplier(() -> {
			List<McpSchema.Tool> tools;
			synchronized (this.tools) {
				tools = this.tools.values().stream().map(McpServerFeatures.AsyncToolSpecification::tool).toList();
			}
			return new McpSchema.ListToolsResult(tools, null);
		});
	}

	private RequestHandler<CallToolResult> toolsCallRequestHandler() {
		return params -> Mono.defer(() -> {
			McpSchema.CallToolRequest callToolRequest = parseParams(params, CALL_TOOL_REQUEST_TYPE_REF);

			McpServerFeatures.AsyncToolSpecification toolSpecification = this.tools.get(callToolRequest.name());
			if (toolSpecification == null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.UNKNOWN_TOOL,
						"Unknown tool: " + callToolRequest.name()));
			}

			Map<String, Object> arguments = (callToolRequest.arguments() != null) ? callToolRequest.arguments()
					: Map.of();

			return Mono.defer(() -> toolSpecification.call().apply(this.exchange, arguments))
				.switchIfEmpty(Mono.error(() -> new IllegalStateException("Tool returned no result")))
				.onErrorResume(error -> {
					logger.warn("Tool {} failed: {}", callToolRequest.name(), error.getMessage());
					return Mono.just(CallToolResult.error("Tool " + callToolRequest.name() + " failed: "
							+ ((error.getMessage() != null) ? error.getMessage() : error.getClass().getSimpleName())));
				});
		});
	}

	// ---------------------------------------
	// Resource Management
	// ---------------------------------------

	/**
	 * 在运行时添加新资源，并广播资源列表变更。
	 * @param resourceSpecification 要添加的资源规范
	 * @return 当客户端被通知后完成的Mono
	 */
	public Mono<Void> addResource(McpServerFeatures.AsyncResourceSpecification resourceSpecification) {
		if (resourceSpecification == null) {
			return Mono
				.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Resource specification must not be null"));
		}
		if (this.serverCapabilities.resources() == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_REQUEST,
					"Server must be configured with resource capabilities"));
		}

		return Mono.defer(() -> {
			String uri = resourceSpecification.resource().uri();
			if (this.resources.putIfAbsent(uri, resourceSpecification) != null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS,
						"Resource with URI '" + uri + "' already exists"));
			}
			logger.debug("Added resource handler: {}", uri);
			return notifyResourcesListChanged();
		});
	}

	/**
	 * 在运行时移除资源及其订阅，并广播资源列表变更。
	 * @param resourceUri 要移除的资源URI
	 * @return 当客户端被通知后完成的Mono
	 */
	public Mono<Void> removeResource(String resourceUri) {
		if (resourceUri == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Resource URI must not be null"));
		}
		return Mono.defer(() -> {
			if (this.resources.remove(resourceUri) == null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND,
						"Resource with URI '" + resourceUri + "' not found"));
			}
			this.subscriptions.remove(resourceUri);
			logger.debug("Removed resource handler: {}", resourceUri);
			return notifyResourcesListChanged();
		});
	}

	public Mono<Void> notifyResourcesListChanged() {
		return this.mcpSession.sendNotification(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED);
	}

	/**
	 * 通知客户端资源内容已更新。只有客户端订阅了该URI时才发送通知，否则静默跳过。
	 * @param uri 资源URI
	 * @param title 可选的标题
	 * @return 当通知发送（或跳过）后完成的Mono
	 */
	public Mono<Void> notifyResourcesUpdated(String uri, String title) {
		return Mono.defer(() -> {
			if (uri == null || !this.subscriptions.contains(uri)) {
				logger.debug("Skipping update notification for unsubscribed resource {}", uri);
				return Mono.empty();
			}
			return this.mcpSession.sendNotification(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED,
					new McpSchema.ResourcesUpdatedNotification(uri, title));
		});
	}

	public Mono<Void> notifyResourcesUpdated(String uri) {
		return notifyResourcesUpdated(uri, null);
	}

	/**
	 * 判断客户端是否订阅了给定URI。
	 * @param uri 资源URI
	 * @return 是否已订阅
	 */
	public boolean isSubscribed(String uri) {
		return uri != null && this.subscriptions.contains(uri);
	}

	private RequestHandler<McpSchema.ListResourcesResult> resourcesListRequestHandler() {
		return params -> Mono.fromSupplier(() -> {
			List<McpSchema.Resource> resources;
			synchronized (this.resources) {
				resources = this.resources.values()
					.stream()
					.map(McpServerFeatures.AsyncResourceSpecification::resource)
					.toList();
			}
			return new McpSchema.ListResourcesResult(resources, null);
		});
	}

	private RequestHandler<McpSchema.ListResourceTemplatesResult> resourceTemplateListRequestHandler() {
		return params -> Mono.fromSupplier(
				() -> new McpSchema.ListResourceTemplatesResult(List.copyOf(this.resourceTemplates), null));
	}

	private RequestHandler<McpSchema.ReadResourceResult> resourcesReadRequestHandler() {
		return params -> Mono.defer(() -> {
			McpSchema.ReadResourceRequest resourceRequest = parseParams(params, READ_RESOURCE_REQUEST_TYPE_REF);
			var specification = this.resources.get(resourceRequest.uri());
			if (specification == null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND,
						"Resource not found: " + resourceRequest.uri()));
			}
			return specification.readHandler()
				.apply(this.exchange, resourceRequest)
				.map(result -> withDescriptionFallback(specification.resource(), result));
		});
	}

	/**
	 * 当读取结果中没有任何文本或二进制负载时，使用资源描述生成一个文本内容块。
	 */
	static McpSchema.ReadResourceResult withDescriptionFallback(McpSchema.Resource resource,
			McpSchema.ReadResourceResult result) {
		List<ResourceContents> contents = (result.contents() != null) ? result.contents() : List.of();
		if (contents.stream().anyMatch(c -> c != null && !c.isEmpty())) {
			return result;
		}
		String description = (resource.description() != null) ? resource.description() : "";
		ResourceContents fallback = ResourceContents.of(resource, description);
		if (fallback.getMimeType() == null) {
			fallback.setMimeType("text/plain");
		}
		return new McpSchema.ReadResourceResult(List.of(fallback));
	}

	private RequestHandler<Object> resourcesSubscribeRequestHandler() {
		return params -> Mono.defer(() -> {
			McpSchema.SubscribeRequest subscribeRequest = parseParams(params, SUBSCRIBE_REQUEST_TYPE_REF);
			if (!this.resources.containsKey(subscribeRequest.uri())) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND,
						"Resource not found: " + subscribeRequest.uri()));
			}
			if (this.subscriptions.add(subscribeRequest.uri())) {
				logger.debug("Client subscribed to {}", subscribeRequest.uri());
			}
			return Mono.just(Map.of());
		});
	}

	private RequestHandler<Object> resourcesUnsubscribeRequestHandler() {
		return params -> Mono.defer(() -> {
			McpSchema.UnsubscribeRequest unsubscribeRequest = parseParams(params, UNSUBSCRIBE_REQUEST_TYPE_REF);
			if (this.subscriptions.remove(unsubscribeRequest.uri())) {
				logger.debug("Client unsubscribed from {}", unsubscribeRequest.uri());
			}
			return Mono.just(Map.of());
		});
	}

	// ---------------------------------------
	// Prompt Management
	// ---------------------------------------

	/**
	 * 在运行时添加新提示词，并广播提示词列表变更。
	 * @param promptSpecification 要添加的提示词规范
	 * @return 当客户端被通知后完成的Mono
	 */
	public Mono<Void> addPrompt(McpServerFeatures.AsyncPromptSpecification promptSpecification) {
		if (promptSpecification == null) {
			return Mono
				.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Prompt specification must not be null"));
		}
		if (this.serverCapabilities.prompts() == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_REQUEST,
					"Server must be configured with prompt capabilities"));
		}

		return Mono.defer(() -> {
			String name = promptSpecification.prompt().name();
			if (this.prompts.putIfAbsent(name, promptSpecification) != null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS,
						"Prompt with name '" + name + "' already exists"));
			}
			logger.debug("Added prompt handler: {}", name);
			return notifyPromptsListChanged();
		});
	}

	public Mono<Void> removePrompt(String promptName) {
		if (promptName == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Prompt name must not be null"));
		}
		return Mono.defer(() -> {
			if (this.prompts.remove(promptName) == null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS,
						"Prompt with name '" + promptName + "' not found"));
			}
			logger.debug("Removed prompt handler: {}", promptName);
			return notifyPromptsListChanged();
		});
	}

	public Mono<Void> notifyPromptsListChanged() {
		return this.mcpSession.sendNotification(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED);
	}

	private RequestHandler<McpSchema.ListPromptsResult> promptsListRequestHandler() {
		return params -> Mono.fromSupplier(() -> {
			List<McpSchema.Prompt> prompts;
			synchronized (this.prompts) {
				prompts = this.prompts.values()
					.stream()
					.map(McpServerFeatures.AsyncPromptSpecification::prompt)
					.toList();
			}
			return new McpSchema.ListPromptsResult(prompts, null);
		});
	}

	private RequestHandler<McpSchema.GetPromptResult> promptsGetRequestHandler() {
		return params -> Mono.defer(() -> {
			McpSchema.GetPromptRequest promptRequest = parseParams(params, GET_PROMPT_REQUEST_TYPE_REF);

			var specification = this.prompts.get(promptRequest.name());
			if (specification == null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS,
						"Unknown prompt: " + promptRequest.name()));
			}
			if (promptRequest.arguments() == null) {
				promptRequest = new McpSchema.GetPromptRequest(promptRequest.name(), Map.of());
			}
			// render failures surface as INTERNAL_HANDLER_ERROR through the session
			return specification.promptHandler().apply(this.exchange, promptRequest);
		});
	}

	// ---------------------------------------
	// Logging Management
	// ---------------------------------------

	/**
	 * 向客户端发送日志消息通知。低于客户端设置的阈值（默认 {@code info}）的消息被丢弃；
	 * 握手完成前没有可用的阈值，消息同样被丢弃。
	 * @param loggingMessageNotification 要发送的日志消息
	 * @return 当通知发送（或丢弃）后完成的Mono
	 */
	public Mono<Void> loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		return withExchange("logging notification",
				exchange -> exchange.loggingNotification(loggingMessageNotification));
	}

	/**
	 * 获取当前的日志阈值。
	 * @return 日志阈值，握手完成前为默认的 {@code info}
	 */
	public LoggingLevel getMinLoggingLevel() {
		McpAsyncServerExchange current = this.exchange;
		return (current != null) ? current.getMinLoggingLevel() : LoggingLevel.INFO;
	}

	private RequestHandler<Object> setLoggerRequestHandler() {
		return params -> Mono.defer(() -> {
			McpSchema.SetLevelRequest setLevelRequest = parseParams(params, SET_LEVEL_REQUEST_TYPE_REF);
			LoggingLevel level = LoggingLevel.fromName(setLevelRequest.level())
				.orElseThrow(() -> McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS,
						"Unknown logging level: " + setLevelRequest.level()));
			this.exchange.setMinLoggingLevel(level);
			logger.debug("Client logging level set to {}", level.levelName());
			return Mono.just(Map.of());
		});
	}

	// ---------------------------------------
	// Delegation
	// ---------------------------------------

	/**
	 * 请求客户端执行一次生成。
	 * @param createMessageRequest 生成请求
	 * @return 客户端返回的生成结果；客户端拒绝或未声明采样能力时以错误结束
	 */
	public Mono<McpSchema.CreateMessageResult> createMessage(McpSchema.CreateMessageRequest createMessageRequest) {
		return requireExchange("sampling").flatMap(exchange -> exchange.createMessage(createMessageRequest));
	}

	/**
	 * 以尽力而为的方式请求客户端执行一次生成。任何失败都被吞掉并替换为带
	 * {@code [sampling fallback]} 标记、{@code stopReason="error"} 的合成结果，调用方的流程不会因此中断。
	 * @param messages 有序的对话消息
	 * @param systemPrompt 可选的系统提示词
	 * @param maxTokens 可选的最大生成长度
	 * @return 生成结果或合成的回退结果
	 */
	public Mono<McpSchema.CreateMessageResult> requestSampling(List<McpSchema.SamplingMessage> messages,
			String systemPrompt, Integer maxTokens) {
		return createMessage(new McpSchema.CreateMessageRequest(messages, systemPrompt, maxTokens))
			.onErrorResume(error -> {
				logger.warn("Sampling delegation failed, using fallback: {}", error.getMessage());
				return Mono.just(new McpSchema.CreateMessageResult(McpSchema.Role.ASSISTANT,
						McpSchema.Content.text("[sampling fallback] " + error.getMessage()), null,
						McpSchema.CreateMessageResult.STOP_REASON_ERROR));
			});
	}

	/**
	 * 请求客户端收集结构化的用户输入。
	 * @param elicitRequest 征询请求
	 * @return 客户端返回的征询结果
	 */
	public Mono<ElicitResult> createElicitation(McpSchema.ElicitRequest elicitRequest) {
		return requireExchange("elicitation").flatMap(exchange -> exchange.createElicitation(elicitRequest));
	}

	/**
	 * 征询用户输入并合并到默认值上。{@code accept} 时返回的字段覆盖默认值；
	 * {@code decline} 和 {@code cancel} 时直接使用默认值，不视为错误。
	 * @param message 展示给用户的消息
	 * @param requestedSchema 可选的字段模式
	 * @param defaults 默认值
	 * @return 合并后的值
	 */
	public Mono<Map<String, Object>> elicitWithDefaults(String message, Map<String, Object> requestedSchema,
			Map<String, Object> defaults) {
		Map<String, Object> base = (defaults != null) ? defaults : Map.of();
		return createElicitation(new McpSchema.ElicitRequest(message, requestedSchema)).map(result -> {
			Map<String, Object> merged = new LinkedHashMap<>(base);
			if (result.action() == ElicitResult.Action.ACCEPT && result.content() != null) {
				merged.putAll(result.content());
			}
			else {
				logger.debug("Elicitation ended with {}, using defaults", result.action());
			}
			return Collections.unmodifiableMap(merged);
		});
	}

	/**
	 * 获取客户端当前声明的全部根目录。
	 * @return 根目录列表结果
	 */
	public Mono<McpSchema.ListRootsResult> listRoots() {
		return requireExchange("roots listing").flatMap(McpAsyncServerExchange::listRoots);
	}

	/**
	 * 向客户端发送 {@code ping}。
	 * @return 当客户端响应后完成的Mono
	 */
	public Mono<Object> ping() {
		return this.mcpSession.sendRequest(McpSchema.METHOD_PING, null, OBJECT_TYPE_REF);
	}

	private Mono<McpAsyncServerExchange> requireExchange(String actionName) {
		return Mono.defer(() -> {
			McpAsyncServerExchange current = this.exchange;
			if (current == null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_REQUEST,
						"Client must be initialized before " + actionName));
			}
			return Mono.just(current);
		});
	}

	// ---------------------------------------
	// Testing
	// ---------------------------------------

	/**
	 * 仅用于测试：设置服务器支持的协议版本。
	 * @param protocolVersions 支持的协议版本
	 */
	void setProtocolVersions(List<String> protocolVersions) {
		this.protocolVersions = protocolVersions;
	}

	McpServerSession getSession() {
		return this.mcpSession;
	}

}
