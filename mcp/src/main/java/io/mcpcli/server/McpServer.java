/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.CallToolResult;
import io.mcpcli.spec.McpSchema.ResourceTemplate;
import io.mcpcli.spec.McpTransport;
import io.mcpcli.telemetry.McpEventRecorder;
import io.mcpcli.util.Assert;
import reactor.core.publisher.Mono;

/**
 * 用于创建模型上下文协议(MCP)服务器的工厂类。服务器通过标准化接口向客户端暴露工具、资源和提示词。
 *
 * <p>
 * 创建基本同步服务器的示例：<pre>{@code
 * McpServer.sync(transport)
 *     .serverInfo("my-server", "1.0.0")
 *     .instructions("demo")
 *     .tool(new Tool("echo", "回显输入", schema),
 *           (exchange, args) -> CallToolResult.text("ECHO: " + args.get("message")))
 *     .build();
 * }</pre>
 *
 * 创建基本异步服务器的示例：<pre>{@code
 * McpServer.async(transport)
 *     .serverInfo("my-server", "1.0.0")
 *     .tool(new Tool("echo", "回显输入", schema),
 *           (exchange, args) -> Mono.just(CallToolResult.text("ECHO: " + args.get("message"))))
 *     .resources(McpServerFeatures.AsyncResourceSpecification.fromContents(resource, contents))
 *     .build();
 * }</pre>
 *
 * <p>
 * 未显式设置能力时，服务器根据注册内容推导能力：总是声明 {@code logging}，
 * 有工具时声明 {@code tools}，有资源或模板时声明 {@code resources}（支持订阅），有提示词时声明 {@code prompts}。
 * 服务器在 {@code build()} 时即开始在通道上接收消息。
 * </p>
 *
 * @see McpAsyncServer
 * @see McpSyncServer
 */
public interface McpServer {

	McpSchema.Implementation DEFAULT_SERVER_INFO = new McpSchema.Implementation("mcp-server", "1.0.0");

	/**
	 * 开始构建提供阻塞操作的同步服务器。
	 * @param transport 与客户端通信的通道
	 * @return 新的同步服务器构建器
	 */
	static SyncSpecification sync(McpTransport transport) {
		return new SyncSpecification(transport);
	}

	/**
	 * 开始构建提供非阻塞操作的异步服务器。
	 * @param transport 与客户端通信的通道
	 * @return 新的异步服务器构建器
	 */
	static AsyncSpecification async(McpTransport transport) {
		return new AsyncSpecification(transport);
	}

	/**
	 * 异步服务器的构建器。
	 */
	class AsyncSpecification {

		private final McpTransport transport;

		private ObjectMapper objectMapper;

		private McpSchema.Implementation serverInfo = DEFAULT_SERVER_INFO;

		private McpSchema.ServerCapabilities serverCapabilities;

		private String instructions;

		private McpEventRecorder eventRecorder = McpEventRecorder.NOOP;

		/** 服务器发起请求的超时，默认不设超时 */
		private Duration requestTimeout;

		private final List<McpServerFeatures.AsyncToolSpecification> tools = new ArrayList<>();

		private final Map<String, McpServerFeatures.AsyncResourceSpecification> resources = new LinkedHashMap<>();

		private final List<ResourceTemplate> resourceTemplates = new ArrayList<>();

		private final Map<String, McpServerFeatures.AsyncPromptSpecification> prompts = new LinkedHashMap<>();

		private final List<BiFunction<McpAsyncServerExchange, List<McpSchema.Root>, Mono<Void>>> rootsChangeHandlers = new ArrayList<>();

		private AsyncSpecification(McpTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		/**
		 * 设置服务器向客户端发起请求（采样、征询、根目录）时等待响应的超时。
		 * @param requestTimeout 请求超时，不能为null
		 * @return 此构建器实例
		 */
		public AsyncSpecification requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public AsyncSpecification serverInfo(McpSchema.Implementation serverInfo) {
			Assert.notNull(serverInfo, "Server info must not be null");
			this.serverInfo = serverInfo;
			return this;
		}

		public AsyncSpecification serverInfo(String name, String version) {
			Assert.hasText(name, "Name must not be null or empty");
			Assert.hasText(version, "Version must not be null or empty");
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		/**
		 * 设置在握手结果中返回给客户端的说明文本。
		 * @param instructions 说明文本
		 * @return 此构建器实例
		 */
		public AsyncSpecification instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public AsyncSpecification capabilities(McpSchema.ServerCapabilities serverCapabilities) {
			Assert.notNull(serverCapabilities, "Server capabilities must not be null");
			this.serverCapabilities = serverCapabilities;
			return this;
		}

		public AsyncSpecification eventRecorder(McpEventRecorder eventRecorder) {
			Assert.notNull(eventRecorder, "Event recorder must not be null");
			this.eventRecorder = eventRecorder;
			return this;
		}

		/**
		 * 注册一个工具及其处理函数。
		 * @param tool 工具定义
		 * @param handler 实现工具逻辑的函数
		 * @return 此构建器实例
		 */
		public AsyncSpecification tool(McpSchema.Tool tool,
				BiFunction<McpAsyncServerExchange, Map<String, Object>, Mono<CallToolResult>> handler) {
			return tools(new McpServerFeatures.AsyncToolSpecification(tool, handler));
		}

		public AsyncSpecification tools(List<McpServerFeatures.AsyncToolSpecification> toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			for (McpServerFeatures.AsyncToolSpecification tool : toolSpecifications) {
				Assert.isTrue(this.tools.stream().noneMatch(t -> t.tool().name().equals(tool.tool().name())),
						"Tool with name '" + tool.tool().name() + "' is already registered");
				this.tools.add(tool);
			}
			return this;
		}

		public AsyncSpecification tools(McpServerFeatures.AsyncToolSpecification... toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			return tools(Arrays.asList(toolSpecifications));
		}

		public AsyncSpecification resources(List<McpServerFeatures.AsyncResourceSpecification> resourceSpecifications) {
			Assert.notNull(resourceSpecifications, "Resource handlers list must not be null");
			for (McpServerFeatures.AsyncResourceSpecification resource : resourceSpecifications) {
				Assert.isTrue(!this.resources.containsKey(resource.resource().uri()),
						"Resource with URI '" + resource.resource().uri() + "' is already registered");
				this.resources.put(resource.resource().uri(), resource);
			}
			return this;
		}

		public AsyncSpecification resources(McpServerFeatures.AsyncResourceSpecification... resourceSpecifications) {
			Assert.notNull(resourceSpecifications, "Resource handlers list must not be null");
			return resources(Arrays.asList(resourceSpecifications));
		}

		/**
		 * 注册资源模板。模板可以被列出，但不能单独读取。
		 * @param resourceTemplates 资源模板
		 * @return 此构建器实例
		 */
		public AsyncSpecification resourceTemplates(List<ResourceTemplate> resourceTemplates) {
			Assert.notNull(resourceTemplates, "Resource templates must not be null");
			this.resourceTemplates.addAll(resourceTemplates);
			return this;
		}

		public AsyncSpecification resourceTemplates(ResourceTemplate... resourceTemplates) {
			Assert.notNull(resourceTemplates, "Resource templates must not be null");
			return resourceTemplates(Arrays.asList(resourceTemplates));
		}

		public AsyncSpecification prompts(List<McpServerFeatures.AsyncPromptSpecification> prompts) {
			Assert.notNull(prompts, "Prompts list must not be null");
			for (McpServerFeatures.AsyncPromptSpecification prompt : prompts) {
				Assert.isTrue(!this.prompts.containsKey(prompt.prompt().name()),
						"Prompt with name '" + prompt.prompt().name() + "' is already registered");
				this.prompts.put(prompt.prompt().name(), prompt);
			}
			return this;
		}

		public AsyncSpecification prompts(McpServerFeatures.AsyncPromptSpecification... prompts) {
			Assert.notNull(prompts, "Prompts list must not be null");
			return prompts(Arrays.asList(prompts));
		}

		/**
		 * 注册一个在客户端根目录变更后调用的处理器。服务器收到
		 * {@code notifications/roots/list_changed} 后重新获取根目录，再将完整列表交给处理器。
		 * @param handler 处理器
		 * @return 此构建器实例
		 */
		public AsyncSpecification rootsChangeHandler(
				BiFunction<McpAsyncServerExchange, List<McpSchema.Root>, Mono<Void>> handler) {
			Assert.notNull(handler, "Consumer must not be null");
			this.rootsChangeHandlers.add(handler);
			return this;
		}

		public AsyncSpecification objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public McpAsyncServer build() {
			var features = new McpServerFeatures.Async(this.serverInfo, this.serverCapabilities, this.tools,
					this.resources, this.resourceTemplates, this.prompts, this.rootsChangeHandlers, this.instructions);
			var mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			return new McpAsyncServer(this.transport, mapper, features, this.requestTimeout, this.eventRecorder);
		}

	}

	/**
	 * 同步服务器的构建器。
	 */
	class SyncSpecification {

		private final McpTransport transport;

		private ObjectMapper objectMapper;

		private McpSchema.Implementation serverInfo = DEFAULT_SERVER_INFO;

		private McpSchema.ServerCapabilities serverCapabilities;

		private String instructions;

		private McpEventRecorder eventRecorder = McpEventRecorder.NOOP;

		private Duration requestTimeout;

		private final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

		private final Map<String, McpServerFeatures.SyncResourceSpecification> resources = new LinkedHashMap<>();

		private final List<ResourceTemplate> resourceTemplates = new ArrayList<>();

		private final Map<String, McpServerFeatures.SyncPromptSpecification> prompts = new LinkedHashMap<>();

		private final List<BiConsumer<McpSyncServerExchange, List<McpSchema.Root>>> rootsChangeHandlers = new ArrayList<>();

		private SyncSpecification(McpTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		public SyncSpecification requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public SyncSpecification serverInfo(McpSchema.Implementation serverInfo) {
			Assert.notNull(serverInfo, "Server info must not be null");
			this.serverInfo = serverInfo;
			return this;
		}

		public SyncSpecification serverInfo(String name, String version) {
			Assert.hasText(name, "Name must not be null or empty");
			Assert.hasText(version, "Version must not be null or empty");
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		public SyncSpecification instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public SyncSpecification capabilities(McpSchema.ServerCapabilities serverCapabilities) {
			Assert.notNull(serverCapabilities, "Server capabilities must not be null");
			this.serverCapabilities = serverCapabilities;
			return this;
		}

		public SyncSpecification eventRecorder(McpEventRecorder eventRecorder) {
			Assert.notNull(eventRecorder, "Event recorder must not be null");
			this.eventRecorder = eventRecorder;
			return this;
		}

		public SyncSpecification tool(McpSchema.Tool tool,
				BiFunction<McpSyncServerExchange, Map<String, Object>, CallToolResult> handler) {
			return tools(new McpServerFeatures.SyncToolSpecification(tool, handler));
		}

		public SyncSpecification tools(List<McpServerFeatures.SyncToolSpecification> toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			for (McpServerFeatures.SyncToolSpecification tool : toolSpecifications) {
				Assert.isTrue(this.tools.stream().noneMatch(t -> t.tool().name().equals(tool.tool().name())),
						"Tool with name '" + tool.tool().name() + "' is already registered");
				this.tools.add(tool);
			}
			return this;
		}

		public SyncSpecification tools(McpServerFeatures.SyncToolSpecification... toolSpecifications) {
			Assert.notNull(toolSpecifications, "Tool handlers list must not be null");
			return tools(Arrays.asList(toolSpecifications));
		}

		public SyncSpecification resources(List<McpServerFeatures.SyncResourceSpecification> resourceSpecifications) {
			Assert.notNull(resourceSpecifications, "Resource handlers list must not be null");
			for (McpServerFeatures.SyncResourceSpecification resource : resourceSpecifications) {
				Assert.isTrue(!this.resources.containsKey(resource.resource().uri()),
						"Resource with URI '" + resource.resource().uri() + "' is already registered");
				this.resources.put(resource.resource().uri(), resource);
			}
			return this;
		}

		public SyncSpecification resources(McpServerFeatures.SyncResourceSpecification... resourceSpecifications) {
			Assert.notNull(resourceSpecifications, "Resource handlers list must not be null");
			return resources(Arrays.asList(resourceSpecifications));
		}

		public SyncSpecification resourceTemplates(List<ResourceTemplate> resourceTemplates) {
			Assert.notNull(resourceTemplates, "Resource templates must not be null");
			this.resourceTemplates.addAll(resourceTemplates);
			return this;
		}

		public SyncSpecification resourceTemplates(ResourceTemplate... resourceTemplates) {
			Assert.notNull(resourceTemplates, "Resource templates must not be null");
			return resourceTemplates(Arrays.asList(resourceTemplates));
		}

		public SyncSpecification prompts(List<McpServerFeatures.SyncPromptSpecification> prompts) {
			Assert.notNull(prompts, "Prompts list must not be null");
			for (McpServerFeatures.SyncPromptSpecification prompt : prompts) {
				Assert.isTrue(!this.prompts.containsKey(prompt.prompt().name()),
						"Prompt with name '" + prompt.prompt().name() + "' is already registered");
				this.prompts.put(prompt.prompt().name(), prompt);
			}
			return this;
		}

		public SyncSpecification prompts(McpServerFeatures.SyncPromptSpecification... prompts) {
			Assert.notNull(prompts, "Prompts list must not be null");
			return prompts(Arrays.asList(prompts));
		}

		public SyncSpecification rootsChangeHandler(BiConsumer<McpSyncServerExchange, List<McpSchema.Root>> handler) {
			Assert.notNull(handler, "Consumer must not be null");
			this.rootsChangeHandlers.add(handler);
			return this;
		}

		public SyncSpecification objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "ObjectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public McpSyncServer build() {
			McpServerFeatures.Sync syncFeatures = new McpServerFeatures.Sync(this.serverInfo, this.serverCapabilities,
					this.tools, this.resources, this.resourceTemplates, this.prompts, this.rootsChangeHandlers,
					this.instructions);
			McpServerFeatures.Async asyncFeatures = McpServerFeatures.Async.fromSync(syncFeatures);
			var mapper = (this.objectMapper != null) ? this.objectMapper : new ObjectMapper();
			return new McpSyncServer(
					new McpAsyncServer(this.transport, mapper, asyncFeatures, this.requestTimeout, this.eventRecorder));
		}

	}

}
