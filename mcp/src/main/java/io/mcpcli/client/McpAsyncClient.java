/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcpcli.sampling.McpSamplingProvider;
import io.mcpcli.spec.McpClientSession;
import io.mcpcli.spec.McpError;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.ClientCapabilities;
import io.mcpcli.spec.McpSchema.CreateMessageRequest;
import io.mcpcli.spec.McpSchema.CreateMessageResult;
import io.mcpcli.spec.McpSchema.ElicitRequest;
import io.mcpcli.spec.McpSchema.ElicitResult;
import io.mcpcli.spec.McpSchema.GetPromptRequest;
import io.mcpcli.spec.McpSchema.GetPromptResult;
import io.mcpcli.spec.McpSchema.Implementation;
import io.mcpcli.spec.McpSchema.ListPromptsResult;
import io.mcpcli.spec.McpSchema.LoggingLevel;
import io.mcpcli.spec.McpSchema.LoggingMessageNotification;
import io.mcpcli.spec.McpSchema.PaginatedRequest;
import io.mcpcli.spec.McpSchema.Root;
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
 * 模型上下文协议(MCP)客户端实现，使用Project Reactor的Mono和Flux类型提供异步通信。
 *
 * <p>
 * 客户端负责：
 * <ul>
 * <li>发起 {@code initialize} 握手并在成功后发出 {@code notifications/initialized}</li>
 * <li>调用服务器的工具、资源、提示词和日志接口</li>
 * <li>响应服务器发起的采样、征询和根目录枚举请求</li>
 * <li>将服务器的变更通知分发给已注册的消费者</li>
 * </ul>
 *
 * <p>
 * 握手失败时客户端回到 {@link McpSession.State#UNCONNECTED} 状态，可以再次调用
 * {@link #initialize()}。
 * </p>
 *
 * @see McpClient
 * @see McpSchema
 * @see McpClientSession
 */
public class McpAsyncClient {

	private static final Logger logger = LoggerFactory.getLogger(McpAsyncClient.class);

	private static final TypeReference<Void> VOID_TYPE_REFERENCE = new TypeReference<>() {
	};

	private static final TypeReference<Object> OBJECT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.InitializeResult> INITIALIZE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.CallToolResult> CALL_TOOL_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListToolsResult> LIST_TOOLS_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListResourcesResult> LIST_RESOURCES_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ReadResourceResult> READ_RESOURCE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListResourceTemplatesResult> LIST_RESOURCE_TEMPLATES_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<ListPromptsResult> LIST_PROMPTS_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<GetPromptResult> GET_PROMPT_RESULT_TYPE_REF = new TypeReference<>() {
	};

	/**
	 * 与服务器通信的会话。
	 */
	private final McpClientSession mcpSession;

	private final Duration initializationTimeout;

	private final ClientCapabilities clientCapabilities;

	private final Implementation clientInfo;

	/**
	 * 握手完成前为 {@code null}。
	 */
	private volatile HandshakeResult handshakeResult;

	/**
	 * 客户端声明的根目录，按URI索引并保持插入顺序。
	 */
	private final Map<String, Root> roots;

	private volatile McpSamplingProvider samplingProvider;

	/**
	 * 客户端支持的协议版本。
	 */
	private List<String> protocolVersions = List.of(McpSchema.LATEST_PROTOCOL_VERSION);

	/**
	 * 使用给定通道和功能创建新的McpAsyncClient。
	 * @param transport 用于与服务器通信的通道
	 * @param requestTimeout 请求超时，{@code null} 表示不设超时
	 * @param initializationTimeout 握手超时，{@code null} 表示不设超时
	 * @param eventRecorder 观察收发消息的记录器
	 * @param features 客户端功能声明
	 */
	McpAsyncClient(McpTransport transport, Duration requestTimeout, Duration initializationTimeout,
			McpEventRecorder eventRecorder, McpClientFeatures.Async features) {

		Assert.notNull(transport, "Transport must not be null");
		Assert.notNull(eventRecorder, "Event recorder must not be null");
		Assert.notNull(features, "Features must not be null");

		this.clientInfo = features.clientInfo();
		this.clientCapabilities = features.clientCapabilities();
		this.initializationTimeout = initializationTimeout;
		this.roots = new LinkedHashMap<>();
		this.roots.putAll(features.roots());
		this.samplingProvider = features.samplingProvider();

		// Request Handlers
		Map<String, RequestHandler<?>> requestHandlers = new HashMap<>();

		// Ping MUST respond with an empty data, but not NULL response.
		requestHandlers.put(McpSchema.METHOD_PING, params -> Mono.just(Map.of()));

		// Roots List Request Handler
		if (this.clientCapabilities.roots() != null) {
			requestHandlers.put(McpSchema.METHOD_ROOTS_LIST, rootsListRequestHandler());
		}

		// Sampling Handler
		if (this.clientCapabilities.sampling() != null) {
			requestHandlers.put(McpSchema.METHOD_SAMPLING_CREATE_MESSAGE, samplingCreateMessageHandler());
		}

		// Elicitation Handler
		if (this.clientCapabilities.elicitation() != null) {
			if (features.elicitationHandler() == null) {
				throw new McpError("Elicitation handler must not be null when client capabilities include elicitation");
			}
			requestHandlers.put(McpSchema.METHOD_ELICITATION_CREATE,
					elicitationCreateHandler(features.elicitationHandler()));
		}

		// Notification Handlers
		Map<String, NotificationHandler> notificationHandlers = new HashMap<>();

		// Tools Change Notification
		List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumersFinal = new ArrayList<>();
		toolsChangeConsumersFinal
			.add((notification) -> Mono.fromRunnable(() -> logger.debug("Tools changed: {}", notification)));
		toolsChangeConsumersFinal.addAll(features.toolsChangeConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED,
				listChangedNotificationHandler("tools", () -> this.listTools().map(McpSchema.ListToolsResult::tools),
						toolsChangeConsumersFinal));

		// Resources Change Notification
		List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumersFinal = new ArrayList<>();
		resourcesChangeConsumersFinal
			.add((notification) -> Mono.fromRunnable(() -> logger.debug("Resources changed: {}", notification)));
		resourcesChangeConsumersFinal.addAll(features.resourcesChangeConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED,
				listChangedNotificationHandler("resources",
						() -> this.listResources().map(McpSchema.ListResourcesResult::resources),
						resourcesChangeConsumersFinal));

		// Resource Updated Notification
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED,
				resourcesUpdatedNotificationHandler(features.resourcesUpdateConsumers()));

		// Prompts Change Notification
		List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumersFinal = new ArrayList<>();
		promptsChangeConsumersFinal
			.add((notification) -> Mono.fromRunnable(() -> logger.debug("Prompts changed: {}", notification)));
		promptsChangeConsumersFinal.addAll(features.promptsChangeConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED,
				listChangedNotificationHandler("prompts",
						() -> this.listPrompts().map(McpSchema.ListPromptsResult::prompts),
						promptsChangeConsumersFinal));

		// Utility Logging Notification
		List<Function<LoggingMessageNotification, Mono<Void>>> loggingConsumersFinal = new ArrayList<>();
		loggingConsumersFinal.add((notification) -> Mono.fromRunnable(() -> logger.debug("Logging: {}", notification)));
		loggingConsumersFinal.addAll(features.loggingConsumers());
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_MESSAGE,
				asyncLoggingNotificationHandler(loggingConsumersFinal));

		this.mcpSession = new McpClientSession(transport, requestTimeout, eventRecorder, requestHandlers,
				notificationHandlers);
	}

	/**
	 * 获取握手结果。
	 * @return 握手结果，握手完成前为 {@code null}
	 */
	public HandshakeResult getHandshakeResult() {
		return this.handshakeResult;
	}

	/**
	 * 获取服务器能力。
	 * @return 服务器能力，握手完成前为 {@code null}
	 */
	public McpSchema.ServerCapabilities getServerCapabilities() {
		HandshakeResult result = this.handshakeResult;
		return (result != null) ? result.serverCapabilities() : null;
	}

	/**
	 * 获取服务器提供的使用说明。
	 * @return 使用说明，可能为 {@code null}
	 */
	public String getServerInstructions() {
		HandshakeResult result = this.handshakeResult;
		return (result != null) ? result.instructions() : null;
	}

	/**
	 * 获取服务器实现信息。
	 * @return 服务器实现信息，握手完成前为 {@code null}
	 */
	public McpSchema.Implementation getServerInfo() {
		HandshakeResult result = this.handshakeResult;
		return (result != null) ? result.serverInfo() : null;
	}

	/**
	 * 检查客户端是否已完成握手。
	 * @return 如果客户端处于 {@link McpSession.State#READY} 状态则返回true
	 */
	public boolean isInitialized() {
		return this.mcpSession.getState() == McpSession.State.READY;
	}

	public McpSession.State getState() {
		return this.mcpSession.getState();
	}

	public ClientCapabilities getClientCapabilities() {
		return this.clientCapabilities;
	}

	public Implementation getClientInfo() {
		return this.clientInfo;
	}

	/**
	 * 立即关闭客户端连接。
	 */
	public void close() {
		this.mcpSession.close();
	}

	/**
	 * 优雅地关闭客户端连接：先发送 {@code notifications/shutdown}，再释放通道。
	 * @return 关闭完成时完成的Mono
	 */
	public Mono<Void> closeGracefully() {
		return this.mcpSession.closeGracefully();
	}

	// --------------------------
	// Initialization
	// --------------------------
	/**
	 * 与服务器进行握手：发送能力、实现信息和协议版本，校验结果，然后发出
	 * {@code notifications/initialized}。只有通知发出之后客户端才进入
	 * {@link McpSession.State#READY} 状态。
	 * @return 发出握手结果的Mono
	 */
	public Mono<HandshakeResult> initialize() {
		Mono<HandshakeResult> handshake = Mono.defer(() -> {
			this.mcpSession.connect();
			if (!this.mcpSession.transition(McpSession.State.UNCONNECTED, McpSession.State.NEGOTIATING)) {
				return Mono.error(new McpError("Client cannot initialize in state " + this.mcpSession.getState()));
			}

			String latestVersion = this.protocolVersions.get(this.protocolVersions.size() - 1);
			McpSchema.InitializeRequest initializeRequest = new McpSchema.InitializeRequest(latestVersion,
					this.clientCapabilities, this.clientInfo);

			return this.mcpSession
				.sendCorrelatedRequest(McpSchema.METHOD_INITIALIZE, initializeRequest, INITIALIZE_RESULT_TYPE_REF)
				.switchIfEmpty(Mono.error(() -> new McpError("Initialize response carried no result")))
				.flatMap(correlated -> {
					McpSchema.InitializeResult initializeResult = correlated.result();
					if (initializeResult == null || initializeResult.protocolVersion() == null) {
						return Mono.error(new McpError("Initialize response carried no result"));
					}
					if (!this.protocolVersions.contains(initializeResult.protocolVersion())) {
						return Mono.error(McpError.of(McpSchema.ErrorCodes.UNSUPPORTED_PROTOCOL_VERSION,
								"Unsupported protocol version from the server: "
										+ initializeResult.protocolVersion()));
					}

					HandshakeResult result = new HandshakeResult(initializeResult.protocolVersion(),
							correlated.requestId(), this.clientCapabilities, initializeResult.capabilities(),
							this.clientInfo, initializeResult.serverInfo(), initializeResult.instructions());

					return this.mcpSession.sendNotification(McpSchema.METHOD_NOTIFICATION_INITIALIZED)
						.then(Mono.fromCallable(() -> {
							this.handshakeResult = result;
							this.mcpSession.transition(McpSession.State.NEGOTIATING, McpSession.State.READY);
							logger.info("Server response with Protocol: {}, Capabilities: {}, Info: {} and Instructions {}",
									result.protocolVersion(), result.serverCapabilities(), result.serverInfo(),
									result.instructions());
							return result;
						}));
				});
		});

		if (this.initializationTimeout != null) {
			handshake = handshake.timeout(this.initializationTimeout);
		}

		return handshake.doOnError(error -> {
			if (this.mcpSession.transition(McpSession.State.NEGOTIATING, McpSession.State.UNCONNECTED)) {
				logger.warn("Handshake failed: {}", error.getMessage());
			}
		});
	}

	/**
	 * 确保客户端已完成握手后再执行操作。
	 * @param <T> 操作结果的类型
	 * @param actionName 要执行的操作名称，用于错误消息
	 * @param operation 握手完成后要执行的操作
	 * @return 操作的结果，或者客户端未初始化时的错误
	 */
	private <T> Mono<T> withInitializationCheck(String actionName, Function<HandshakeResult, Mono<T>> operation) {
		return Mono.defer(() -> {
			HandshakeResult result = this.handshakeResult;
			if (result == null || !isInitialized()) {
				return Mono.error(new McpError("Client must be initialized before " + actionName));
			}
			return operation.apply(result);
		});
	}

	// --------------------------
	// Basic Utilites
	// --------------------------

	/**
	 * 向服务器发送ping请求。
	 * @return 服务器响应完成时完成的Mono
	 */
	public Mono<Object> ping() {
		return this.withInitializationCheck("pinging the server",
				result -> this.mcpSession.sendRequest(McpSchema.METHOD_PING, null, OBJECT_TYPE_REF));
	}

	// --------------------------
	// Roots
	// --------------------------
	/**
	 * 添加新的根目录，并在客户端已初始化时通知服务器根目录列表已变更。
	 * @param root 要添加的根目录
	 * @return 根目录添加完成且通知发出时完成的Mono
	 */
	public Mono<Void> addRoot(Root root) {

		if (root == null) {
			return Mono.error(new McpError("Root must not be null"));
		}

		if (this.clientCapabilities.roots() == null) {
			return Mono.error(new McpError("Client must be configured with roots capabilities"));
		}

		return Mono.defer(() -> {
			synchronized (this.roots) {
				if (this.roots.containsKey(root.uri())) {
					return Mono.error(new McpError("Root with uri '" + root.uri() + "' already exists"));
				}
				this.roots.put(root.uri(), root);
			}
			logger.debug("Added root: {}", root);
			return notifyRootsChangedIfReady();
		});
	}

	/**
	 * 移除根目录，并在客户端已初始化时通知服务器根目录列表已变更。
	 * @param rootUri 要移除的根目录URI
	 * @return 根目录移除完成且通知发出时完成的Mono
	 */
	public Mono<Void> removeRoot(String rootUri) {

		if (rootUri == null) {
			return Mono.error(new McpError("Root uri must not be null"));
		}

		if (this.clientCapabilities.roots() == null) {
			return Mono.error(new McpError("Client must be configured with roots capabilities"));
		}

		return Mono.defer(() -> {
			Root removed;
			synchronized (this.roots) {
				removed = this.roots.remove(rootUri);
			}
			if (removed == null) {
				return Mono.error(new McpError("Root with uri '" + rootUri + "' not found"));
			}
			logger.debug("Removed Root: {}", rootUri);
			return notifyRootsChangedIfReady();
		});
	}

	/**
	 * 用给定集合整体替换根目录，并在客户端已初始化时通知服务器。
	 * @param newRoots 新的根目录集合
	 * @return 替换完成且通知发出时完成的Mono
	 */
	public Mono<Void> setRoots(List<Root> newRoots) {

		if (newRoots == null) {
			return Mono.error(new McpError("Roots must not be null"));
		}

		if (this.clientCapabilities.roots() == null) {
			return Mono.error(new McpError("Client must be configured with roots capabilities"));
		}

		return Mono.defer(() -> {
			synchronized (this.roots) {
				this.roots.clear();
				for (Root root : newRoots) {
					this.roots.put(root.uri(), root);
				}
			}
			logger.debug("Replaced roots: {}", newRoots);
			return notifyRootsChangedIfReady();
		});
	}

	/**
	 * 当前声明的根目录。
	 * @return 根目录列表的快照
	 */
	public List<Root> getRoots() {
		synchronized (this.roots) {
			return List.copyOf(this.roots.values());
		}
	}

	private Mono<Void> notifyRootsChangedIfReady() {
		if (Boolean.TRUE.equals(this.clientCapabilities.roots().listChanged()) && this.isInitialized()) {
			return this.rootsListChangedNotification();
		}
		return Mono.empty();
	}

	/**
	 * 手动发送根目录列表变更通知。服务器随后会重新发起 {@code roots/list} 请求。
	 * @return 通知发出时完成的Mono
	 */
	public Mono<Void> rootsListChangedNotification() {
		return this.withInitializationCheck("sending roots list changed notification",
				result -> this.mcpSession.sendNotification(McpSchema.METHOD_NOTIFICATION_ROOTS_LIST_CHANGED));
	}

	private RequestHandler<McpSchema.ListRootsResult> rootsListRequestHandler() {
		return params -> Mono.fromCallable(() -> new McpSchema.ListRootsResult(getRoots()));
	}

	// --------------------------
	// Sampling
	// --------------------------
	/**
	 * 设置或替换用于响应 {@code sampling/createMessage} 的生成能力。
	 * @param samplingProvider 生成能力
	 */
	public void setSamplingProvider(McpSamplingProvider samplingProvider) {
		Assert.notNull(samplingProvider, "Sampling provider must not be null");
		this.samplingProvider = samplingProvider;
	}

	private RequestHandler<CreateMessageResult> samplingCreateMessageHandler() {
		return params -> {
			McpSamplingProvider provider = this.samplingProvider;
			if (provider == null) {
				return Mono.error(McpError.of(McpSchema.ErrorCodes.INTERNAL_HANDLER_ERROR,
						"No sampling provider configured on the client"));
			}
			CreateMessageRequest request = this.mcpSession.unmarshalFrom(params,
					new TypeReference<CreateMessageRequest>() {
					});
			return Mono.defer(() -> provider.createMessage(request)).onErrorResume(error -> {
				logger.warn("Sampling provider failed: {}", error.getMessage());
				return Mono.just(CreateMessageResult.error(error));
			});
		};
	}

	// --------------------------
	// Elicitation
	// --------------------------
	private RequestHandler<ElicitResult> elicitationCreateHandler(
			Function<ElicitRequest, Mono<ElicitResult>> elicitationHandler) {
		return params -> {
			ElicitRequest request = this.mcpSession.unmarshalFrom(params, new TypeReference<ElicitRequest>() {
			});
			return elicitationHandler.apply(request);
		};
	}

	// --------------------------
	// Tools
	// --------------------------
	/**
	 * 使用提供的参数调用服务器端工具。工具执行失败通过结果中的 {@code isError} 报告，
	 * 未知工具以 UNKNOWN_TOOL 错误失败。
	 * @param callToolRequest 包含工具名称和输入参数的请求
	 * @return 发出工具执行结果的Mono
	 */
	public Mono<McpSchema.CallToolResult> callTool(McpSchema.CallToolRequest callToolRequest) {
		return this.withInitializationCheck("calling tools", result -> {
			if (result.serverCapabilities().tools() == null) {
				return Mono.error(new McpError("Server does not provide tools capability"));
			}
			return this.mcpSession.sendRequest(McpSchema.METHOD_TOOLS_CALL, callToolRequest, CALL_TOOL_TYPE_REF);
		});
	}

	public Mono<McpSchema.CallToolResult> callTool(String name, Map<String, Object> arguments) {
		return callTool(new McpSchema.CallToolRequest(name, arguments));
	}

	/**
	 * 获取服务器提供的可用工具列表。
	 * @return 发出工具列表结果的Mono
	 */
	public Mono<McpSchema.ListToolsResult> listTools() {
		return this.listTools(null);
	}

	/**
	 * 获取服务器提供的分页工具列表。
	 * @param cursor 来自前一个列表请求的可选分页游标
	 * @return 发出工具列表结果的Mono
	 */
	public Mono<McpSchema.ListToolsResult> listTools(String cursor) {
		return this.withInitializationCheck("listing tools", result -> {
			if (result.serverCapabilities().tools() == null) {
				return Mono.error(new McpError("Server does not provide tools capability"));
			}
			return this.mcpSession.sendRequest(McpSchema.METHOD_TOOLS_LIST, new PaginatedRequest(cursor),
					LIST_TOOLS_RESULT_TYPE_REF);
		});
	}

	// --------------------------
	// Resources
	// --------------------------
	public Mono<McpSchema.ListResourcesResult> listResources() {
		return this.listResources(null);
	}

	/**
	 * 获取服务器提供的分页资源列表。
	 * @param cursor 来自前一个列表请求的可选分页游标
	 * @return 发出资源列表结果的Mono
	 */
	public Mono<McpSchema.ListResourcesResult> listResources(String cursor) {
		return this.withInitializationCheck("listing resources", result -> {
			if (result.serverCapabilities().resources() == null) {
				return Mono.error(new McpError("Server does not provide the resources capability"));
			}
			return this.mcpSession.sendRequest(McpSchema.METHOD_RESOURCES_LIST, new PaginatedRequest(cursor),
					LIST_RESOURCES_RESULT_TYPE_REF);
		});
	}

	public Mono<McpSchema.ReadResourceResult> readResource(String uri) {
		return this.readResource(new McpSchema.ReadResourceRequest(uri));
	}

	/**
	 * 读取资源内容。未知URI以 RESOURCE_NOT_FOUND 错误失败。
	 * @param readResourceRequest 读取请求
	 * @return 发出资源内容的Mono
	 */
	public Mono<McpSchema.ReadResourceResult> readResource(McpSchema.ReadResourceRequest readResourceRequest) {
		return this.withInitializationCheck("reading resources", result -> {
			if (result.serverCapabilities().resources() == null) {
				return Mono.error(new McpError("Server does not provide the resources capability"));
			}
			return this.mcpSession.sendRequest(McpSchema.METHOD_RESOURCES_READ, readResourceRequest,
					READ_RESOURCE_RESULT_TYPE_REF);
		});
	}

	public Mono<McpSchema.ListResourceTemplatesResult> listResourceTemplates() {
		return this.listResourceTemplates(null);
	}

	public Mono<McpSchema.ListResourceTemplatesResult> listResourceTemplates(String cursor) {
		return this.withInitializationCheck("listing resource templates", result -> {
			if (result.serverCapabilities().resources() == null) {
				return Mono.error(new McpError("Server does not provide the resources capability"));
			}
			return this.mcpSession.sendRequest(McpSchema.METHOD_RESOURCES_TEMPLATES_LIST,
					new PaginatedRequest(cursor), LIST_RESOURCE_TEMPLATES_RESULT_TYPE_REF);
		});
	}

	/**
	 * 订阅资源的更新通知。只有订阅之后，服务器才会为该URI发出
	 * {@code notifications/resources/updated}。重复订阅无副作用。
	 * @param uri 要订阅的资源URI
	 * @return 订阅完成时完成的Mono
	 */
	public Mono<Void> subscribeResource(String uri) {
		return this.withInitializationCheck("subscribing to resources", result -> this.mcpSession
			.sendRequest(McpSchema.METHOD_RESOURCES_SUBSCRIBE, new McpSchema.SubscribeRequest(uri), VOID_TYPE_REFERENCE));
	}

	public Mono<Void> unsubscribeResource(String uri) {
		return this.withInitializationCheck("unsubscribing from resources",
				result -> this.mcpSession.sendRequest(McpSchema.METHOD_RESOURCES_UNSUBSCRIBE,
						new McpSchema.UnsubscribeRequest(uri), VOID_TYPE_REFERENCE));
	}

	private NotificationHandler resourcesUpdatedNotificationHandler(
			List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumers) {
		return params -> {
			McpSchema.ResourcesUpdatedNotification notification = this.mcpSession.unmarshalFrom(params,
					new TypeReference<McpSchema.ResourcesUpdatedNotification>() {
					});
			logger.debug("Resource updated: {}", notification.uri());
			return Flux.fromIterable(resourcesUpdateConsumers)
				.concatMap(consumer -> consumer.apply(notification))
				.then();
		};
	}

	// --------------------------
	// Prompts
	// --------------------------
	public Mono<ListPromptsResult> listPrompts() {
		return this.listPrompts(null);
	}

	public Mono<ListPromptsResult> listPrompts(String cursor) {
		return this.withInitializationCheck("listing prompts", result -> {
			if (result.serverCapabilities().prompts() == null) {
				return Mono.error(new McpError("Server does not provide the prompts capability"));
			}
			return this.mcpSession.sendRequest(McpSchema.METHOD_PROMPT_LIST, new PaginatedRequest(cursor),
					LIST_PROMPTS_RESULT_TYPE_REF);
		});
	}

	/**
	 * 渲染提示词。提示词处理器失败时以 INTERNAL_HANDLER_ERROR 错误失败。
	 * @param getPromptRequest 包含提示词名称和参数的请求
	 * @return 发出渲染结果的Mono
	 */
	public Mono<GetPromptResult> getPrompt(GetPromptRequest getPromptRequest) {
		return this.withInitializationCheck("getting prompts", result -> {
			if (result.serverCapabilities().prompts() == null) {
				return Mono.error(new McpError("Server does not provide the prompts capability"));
			}
			return this.mcpSession.sendRequest(McpSchema.METHOD_PROMPT_GET, getPromptRequest,
					GET_PROMPT_RESULT_TYPE_REF);
		});
	}

	private <T> NotificationHandler listChangedNotificationHandler(String kind,
			Supplier<Mono<List<T>>> lister, List<Function<List<T>, Mono<Void>>> consumers) {
		return params -> lister.get()
			.flatMap(items -> Flux.fromIterable(consumers).concatMap(consumer -> consumer.apply(items)).then())
			.onErrorResume(error -> {
				logger.error("Error handling {} list change notification", kind, error);
				return Mono.empty();
			});
	}

	// --------------------------
	// Logging
	// --------------------------
	private NotificationHandler asyncLoggingNotificationHandler(
			List<Function<LoggingMessageNotification, Mono<Void>>> loggingConsumers) {

		return params -> {
			McpSchema.LoggingMessageNotification loggingMessageNotification = this.mcpSession.unmarshalFrom(params,
					new TypeReference<McpSchema.LoggingMessageNotification>() {
					});

			return Flux.fromIterable(loggingConsumers)
				.concatMap(consumer -> consumer.apply(loggingMessageNotification))
				.then();
		};
	}

	/**
	 * 设置服务器发出日志消息的最小级别。低于此级别的消息不会被发送。
	 * @param loggingLevel 最小日志级别
	 * @return 级别设置完成时完成的Mono
	 */
	public Mono<Void> setLoggingLevel(LoggingLevel loggingLevel) {
		if (loggingLevel == null) {
			return Mono.error(new McpError("Logging level must not be null"));
		}

		return this.withInitializationCheck("setting logging level", result -> {
			if (result.serverCapabilities().logging() == null) {
				return Mono.error(new McpError("Server does not provide the logging capability"));
			}
			var params = new McpSchema.SetLevelRequest(loggingLevel.levelName());
			return this.mcpSession.sendRequest(McpSchema.METHOD_LOGGING_SET_LEVEL, params, VOID_TYPE_REFERENCE);
		});
	}

	/**
	 * 仅用于测试：设置客户端支持的协议版本。
	 * @param protocolVersions 协议版本列表
	 */
	void setProtocolVersions(List<String> protocolVersions) {
		Assert.notEmpty(protocolVersions, "Protocol versions must not be empty");
		this.protocolVersions = protocolVersions;
	}

	/**
	 * 仅用于测试：返回底层会话。
	 * @return 客户端会话
	 */
	McpClientSession getSession() {
		return this.mcpSession;
	}

}
