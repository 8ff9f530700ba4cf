/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import io.mcpcli.sampling.McpSamplingProvider;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.ClientCapabilities;
import io.mcpcli.spec.McpSchema.CreateMessageRequest;
import io.mcpcli.spec.McpSchema.CreateMessageResult;
import io.mcpcli.spec.McpSchema.ElicitRequest;
import io.mcpcli.spec.McpSchema.ElicitResult;
import io.mcpcli.spec.McpSchema.Implementation;
import io.mcpcli.spec.McpSchema.Root;
import io.mcpcli.spec.McpTransport;
import io.mcpcli.telemetry.McpEventRecorder;
import io.mcpcli.util.Assert;
import reactor.core.publisher.Mono;

/**
 * 创建模型上下文协议(MCP)客户端的工厂类。提供同步和异步两种客户端的构建器。
 *
 * <p>
 * 使用示例：
 *
 * <pre>{@code
 * McpAsyncClient client = McpClient.async(transport)
 *     .clientInfo(new McpSchema.Implementation("demo-client", "1.0.0"))
 *     .capabilities(McpSchema.ClientCapabilities.builder().roots(true).sampling().build())
 *     .sampling(new LocalLlmSamplingProvider())
 *     .build();
 *
 * client.initialize()
 *     .flatMap(handshake -> client.callTool("echo", Map.of("message", "hi")))
 *     .subscribe();
 * }</pre>
 *
 * <p>
 * 默认情况下请求不设超时：未得到响应的请求会一直等待，直到通道关闭。
 * </p>
 *
 * @see McpAsyncClient
 * @see McpSyncClient
 */
public interface McpClient {

	Implementation DEFAULT_CLIENT_INFO = new Implementation("mcp-cli-client", "1.0.0");

	/**
	 * 开始构建同步客户端。
	 * @param transport 通道
	 * @return 新的同步客户端构建器
	 */
	static SyncSpec sync(McpTransport transport) {
		return new SyncSpec(transport);
	}

	/**
	 * 开始构建异步客户端。
	 * @param transport 通道
	 * @return 新的异步客户端构建器
	 */
	static AsyncSpec async(McpTransport transport) {
		return new AsyncSpec(transport);
	}

	/**
	 * 同步客户端的构建器。
	 */
	class SyncSpec {

		private final McpTransport transport;

		private Duration requestTimeout;

		private Duration initializationTimeout = Duration.ofSeconds(20);

		private ClientCapabilities capabilities;

		private Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private McpEventRecorder eventRecorder = McpEventRecorder.NOOP;

		private final Map<String, Root> roots = new LinkedHashMap<>();

		private final List<Consumer<List<McpSchema.Tool>>> toolsChangeConsumers = new ArrayList<>();

		private final List<Consumer<List<McpSchema.Resource>>> resourcesChangeConsumers = new ArrayList<>();

		private final List<Consumer<McpSchema.ResourcesUpdatedNotification>> resourcesUpdateConsumers = new ArrayList<>();

		private final List<Consumer<List<McpSchema.Prompt>>> promptsChangeConsumers = new ArrayList<>();

		private final List<Consumer<McpSchema.LoggingMessageNotification>> loggingConsumers = new ArrayList<>();

		private Function<CreateMessageRequest, CreateMessageResult> samplingHandler;

		private Function<ElicitRequest, ElicitResult> elicitationHandler;

		private SyncSpec(McpTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		/**
		 * 设置请求超时。未设置时请求会一直等待直到通道关闭。
		 * @param requestTimeout 请求超时
		 * @return 此构建器实例
		 */
		public SyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public SyncSpec initializationTimeout(Duration initializationTimeout) {
			Assert.notNull(initializationTimeout, "Initialization timeout must not be null");
			this.initializationTimeout = initializationTimeout;
			return this;
		}

		public SyncSpec capabilities(ClientCapabilities capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public SyncSpec clientInfo(Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public SyncSpec eventRecorder(McpEventRecorder eventRecorder) {
			Assert.notNull(eventRecorder, "Event recorder must not be null");
			this.eventRecorder = eventRecorder;
			return this;
		}

		public SyncSpec roots(Root... roots) {
			Assert.notNull(roots, "Roots must not be null");
			for (Root root : roots) {
				this.roots.put(root.uri(), root);
			}
			return this;
		}

		public SyncSpec sampling(Function<CreateMessageRequest, CreateMessageResult> samplingHandler) {
			Assert.notNull(samplingHandler, "Sampling handler must not be null");
			this.samplingHandler = samplingHandler;
			return this;
		}

		public SyncSpec elicitation(Function<ElicitRequest, ElicitResult> elicitationHandler) {
			Assert.notNull(elicitationHandler, "Elicitation handler must not be null");
			this.elicitationHandler = elicitationHandler;
			return this;
		}

		public SyncSpec toolsChangeConsumer(Consumer<List<McpSchema.Tool>> toolsChangeConsumer) {
			Assert.notNull(toolsChangeConsumer, "Tools change consumer must not be null");
			this.toolsChangeConsumers.add(toolsChangeConsumer);
			return this;
		}

		public SyncSpec resourcesChangeConsumer(Consumer<List<McpSchema.Resource>> resourcesChangeConsumer) {
			Assert.notNull(resourcesChangeConsumer, "Resources change consumer must not be null");
			this.resourcesChangeConsumers.add(resourcesChangeConsumer);
			return this;
		}

		public SyncSpec resourcesUpdateConsumer(
				Consumer<McpSchema.ResourcesUpdatedNotification> resourcesUpdateConsumer) {
			Assert.notNull(resourcesUpdateConsumer, "Resources update consumer must not be null");
			this.resourcesUpdateConsumers.add(resourcesUpdateConsumer);
			return this;
		}

		public SyncSpec promptsChangeConsumer(Consumer<List<McpSchema.Prompt>> promptsChangeConsumer) {
			Assert.notNull(promptsChangeConsumer, "Prompts change consumer must not be null");
			this.promptsChangeConsumers.add(promptsChangeConsumer);
			return this;
		}

		public SyncSpec loggingConsumer(Consumer<McpSchema.LoggingMessageNotification> loggingConsumer) {
			Assert.notNull(loggingConsumer, "Logging consumer must not be null");
			this.loggingConsumers.add(loggingConsumer);
			return this;
		}

		public McpSyncClient build() {
			McpClientFeatures.Sync syncFeatures = new McpClientFeatures.Sync(this.clientInfo, this.capabilities,
					this.roots, this.toolsChangeConsumers, this.resourcesChangeConsumers,
					this.resourcesUpdateConsumers, this.promptsChangeConsumers, this.loggingConsumers,
					this.samplingHandler, this.elicitationHandler);
			McpClientFeatures.Async asyncFeatures = McpClientFeatures.Async.fromSync(syncFeatures);
			return new McpSyncClient(new McpAsyncClient(this.transport, this.requestTimeout,
					this.initializationTimeout, this.eventRecorder, asyncFeatures));
		}

	}

	/**
	 * 异步客户端的构建器。
	 */
	class AsyncSpec {

		private final McpTransport transport;

		private Duration requestTimeout;

		private Duration initializationTimeout = Duration.ofSeconds(20);

		private ClientCapabilities capabilities;

		private Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private McpEventRecorder eventRecorder = McpEventRecorder.NOOP;

		private final Map<String, Root> roots = new LinkedHashMap<>();

		private final List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers = new ArrayList<>();

		private final List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers = new ArrayList<>();

		private final List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumers = new ArrayList<>();

		private final List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumers = new ArrayList<>();

		private final List<Function<McpSchema.LoggingMessageNotification, Mono<Void>>> loggingConsumers = new ArrayList<>();

		private McpSamplingProvider samplingProvider;

		private Function<ElicitRequest, Mono<ElicitResult>> elicitationHandler;

		private AsyncSpec(McpTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		/**
		 * 设置请求超时。未设置时请求会一直等待直到通道关闭。
		 * @param requestTimeout 请求超时
		 * @return 此构建器实例
		 */
		public AsyncSpec requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public AsyncSpec initializationTimeout(Duration initializationTimeout) {
			Assert.notNull(initializationTimeout, "Initialization timeout must not be null");
			this.initializationTimeout = initializationTimeout;
			return this;
		}

		public AsyncSpec capabilities(ClientCapabilities capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public AsyncSpec clientInfo(Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public AsyncSpec eventRecorder(McpEventRecorder eventRecorder) {
			Assert.notNull(eventRecorder, "Event recorder must not be null");
			this.eventRecorder = eventRecorder;
			return this;
		}

		public AsyncSpec roots(List<Root> roots) {
			Assert.notNull(roots, "Roots must not be null");
			for (Root root : roots) {
				this.roots.put(root.uri(), root);
			}
			return this;
		}

		public AsyncSpec roots(Root... roots) {
			Assert.notNull(roots, "Roots must not be null");
			return roots(List.of(roots));
		}

		/**
		 * 设置响应 {@code sampling/createMessage} 的生成能力。
		 * @param samplingProvider 生成能力
		 * @return 此构建器实例
		 */
		public AsyncSpec sampling(McpSamplingProvider samplingProvider) {
			Assert.notNull(samplingProvider, "Sampling provider must not be null");
			this.samplingProvider = samplingProvider;
			return this;
		}

		/**
		 * 设置响应 {@code elicitation/create} 的处理器。处理器通过任意方式（交互输入、自动填充等）
		 * 得到 accept/decline/cancel 结果。
		 * @param elicitationHandler 征询处理器
		 * @return 此构建器实例
		 */
		public AsyncSpec elicitation(Function<ElicitRequest, Mono<ElicitResult>> elicitationHandler) {
			Assert.notNull(elicitationHandler, "Elicitation handler must not be null");
			this.elicitationHandler = elicitationHandler;
			return this;
		}

		public AsyncSpec toolsChangeConsumer(Function<List<McpSchema.Tool>, Mono<Void>> toolsChangeConsumer) {
			Assert.notNull(toolsChangeConsumer, "Tools change consumer must not be null");
			this.toolsChangeConsumers.add(toolsChangeConsumer);
			return this;
		}

		public AsyncSpec resourcesChangeConsumer(
				Function<List<McpSchema.Resource>, Mono<Void>> resourcesChangeConsumer) {
			Assert.notNull(resourcesChangeConsumer, "Resources change consumer must not be null");
			this.resourcesChangeConsumers.add(resourcesChangeConsumer);
			return this;
		}

		/**
		 * 添加已订阅资源的更新消费者。
		 * @param resourcesUpdateConsumer 收到 {@code notifications/resources/updated} 时调用
		 * @return 此构建器实例
		 */
		public AsyncSpec resourcesUpdateConsumer(
				Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>> resourcesUpdateConsumer) {
			Assert.notNull(resourcesUpdateConsumer, "Resources update consumer must not be null");
			this.resourcesUpdateConsumers.add(resourcesUpdateConsumer);
			return this;
		}

		public AsyncSpec promptsChangeConsumer(Function<List<McpSchema.Prompt>, Mono<Void>> promptsChangeConsumer) {
			Assert.notNull(promptsChangeConsumer, "Prompts change consumer must not be null");
			this.promptsChangeConsumers.add(promptsChangeConsumer);
			return this;
		}

		public AsyncSpec loggingConsumer(Function<McpSchema.LoggingMessageNotification, Mono<Void>> loggingConsumer) {
			Assert.notNull(loggingConsumer, "Logging consumer must not be null");
			this.loggingConsumers.add(loggingConsumer);
			return this;
		}

		public McpAsyncClient build() {
			return new McpAsyncClient(this.transport, this.requestTimeout, this.initializationTimeout,
					this.eventRecorder,
					new McpClientFeatures.Async(this.clientInfo, this.capabilities, this.roots,
							this.toolsChangeConsumers, this.resourcesChangeConsumers, this.resourcesUpdateConsumers,
							this.promptsChangeConsumers, this.loggingConsumers, this.samplingProvider,
							this.elicitationHandler));
		}

	}

}
