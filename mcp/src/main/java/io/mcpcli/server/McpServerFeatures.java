/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;

import io.mcpcli.spec.McpSchema;
import io.mcpcli.util.Assert;
import io.mcpcli.util.Utils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 服务器可以选择支持的功能声明：工具、资源、资源模板、提示词以及根目录变更消费者。
 *
 * <p>
 * 所有注册表都保持注册顺序，列表请求按该顺序返回。
 * </p>
 */
public class McpServerFeatures {

	/**
	 * 异步服务器的功能声明。
	 *
	 * @param serverInfo 服务器实现信息
	 * @param serverCapabilities 服务器能力，为 {@code null} 时根据注册内容推导
	 * @param tools 工具规范列表
	 * @param resources 以URI为键的资源规范
	 * @param resourceTemplates 资源模板列表
	 * @param prompts 以名称为键的提示词规范
	 * @param rootsChangeConsumers 客户端根目录变更时通知的消费者
	 * @param instructions 服务器说明文本
	 */
	record Async(McpSchema.Implementation serverInfo, McpSchema.ServerCapabilities serverCapabilities,
			List<AsyncToolSpecification> tools, Map<String, AsyncResourceSpecification> resources,
			List<McpSchema.ResourceTemplate> resourceTemplates, Map<String, AsyncPromptSpecification> prompts,
			List<BiFunction<McpAsyncServerExchange, List<McpSchema.Root>, Mono<Void>>> rootsChangeConsumers,
			String instructions) {

		Async {
			Assert.notNull(serverInfo, "Server info must not be null");

			if (serverCapabilities == null) {
				var builder = McpSchema.ServerCapabilities.builder().logging();
				if (!Utils.isEmpty(tools)) {
					builder.tools(true);
				}
				if (!Utils.isEmpty(resources) || !Utils.isEmpty(resourceTemplates)) {
					builder.resources(true, true);
				}
				if (!Utils.isEmpty(prompts)) {
					builder.prompts(true);
				}
				serverCapabilities = builder.build();
			}

			tools = (tools != null) ? tools : List.of();
			resources = (resources != null) ? resources : Map.of();
			resourceTemplates = (resourceTemplates != null) ? resourceTemplates : List.of();
			prompts = (prompts != null) ? prompts : Map.of();
			rootsChangeConsumers = (rootsChangeConsumers != null) ? rootsChangeConsumers : List.of();
		}

		/**
		 * 将同步功能声明转换为异步形式，阻塞的回调被移到
		 * {@link Schedulers#boundedElastic()} 上执行。
		 * @param syncSpec 同步功能声明
		 * @return 异步功能声明
		 */
		static Async fromSync(Sync syncSpec) {
			List<AsyncToolSpecification> tools = new ArrayList<>();
			for (var tool : syncSpec.tools()) {
				tools.add(AsyncToolSpecification.fromSync(tool));
			}

			Map<String, AsyncResourceSpecification> resources = new LinkedHashMap<>();
			syncSpec.resources().forEach((key, resource) -> resources.put(key, AsyncResourceSpecification.fromSync(resource)));

			Map<String, AsyncPromptSpecification> prompts = new LinkedHashMap<>();
			syncSpec.prompts().forEach((key, prompt) -> prompts.put(key, AsyncPromptSpecification.fromSync(prompt)));

			List<BiFunction<McpAsyncServerExchange, List<McpSchema.Root>, Mono<Void>>> rootChangeConsumers = new ArrayList<>();
			for (var rootChangeConsumer : syncSpec.rootsChangeConsumers()) {
				rootChangeConsumers.add((exchange, list) -> Mono
					.<Void>fromRunnable(() -> rootChangeConsumer.accept(new McpSyncServerExchange(exchange), list))
					.subscribeOn(Schedulers.boundedElastic()));
			}

			return new Async(syncSpec.serverInfo(), syncSpec.serverCapabilities(), tools, resources,
					syncSpec.resourceTemplates(), prompts, rootChangeConsumers, syncSpec.instructions());
		}
	}

	/**
	 * 同步服务器的功能声明，字段含义与 {@link Async} 相同。
	 */
	record Sync(McpSchema.Implementation serverInfo, McpSchema.ServerCapabilities serverCapabilities,
			List<SyncToolSpecification> tools, Map<String, SyncResourceSpecification> resources,
			List<McpSchema.ResourceTemplate> resourceTemplates, Map<String, SyncPromptSpecification> prompts,
			List<BiConsumer<McpSyncServerExchange, List<McpSchema.Root>>> rootsChangeConsumers, String instructions) {

		Sync {
			Assert.notNull(serverInfo, "Server info must not be null");
			tools = (tools != null) ? tools : List.of();
			resources = (resources != null) ? resources : Map.of();
			resourceTemplates = (resourceTemplates != null) ? resourceTemplates : List.of();
			prompts = (prompts != null) ? prompts : Map.of();
			rootsChangeConsumers = (rootsChangeConsumers != null) ? rootsChangeConsumers : List.of();
		}

	}

	/**
	 * 具有异步处理函数的工具规范。
	 *
	 * <p>
	 * 工具规范示例：<pre>{@code
	 * new McpServerFeatures.AsyncToolSpecification(
	 *     new Tool("echo", "回显输入", Map.of("type", "object")),
	 *     (exchange, args) -> Mono.just(CallToolResult.text("ECHO: " + args.get("message")))
	 * )
	 * }</pre>
	 *
	 * <p>
	 * 处理函数的失败不会作为协议错误返回，而是转换为 {@code isError=true} 的结果。
	 * </p>
	 *
	 * @param tool 工具定义，包括名称、描述和参数模式
	 * @param call 实现工具逻辑的函数。第一个参数是 {@link McpAsyncServerExchange}，
	 * 服务器可以通过它与已连接的客户端交互；第二个参数是工具参数的映射。
	 */
	public record AsyncToolSpecification(McpSchema.Tool tool,
			BiFunction<McpAsyncServerExchange, Map<String, Object>, Mono<McpSchema.CallToolResult>> call) {

		public AsyncToolSpecification {
			Assert.notNull(tool, "Tool must not be null");
			Assert.notNull(call, "Tool call handler must not be null");
		}

		static AsyncToolSpecification fromSync(SyncToolSpecification tool) {
			return new AsyncToolSpecification(tool.tool(),
					(exchange, map) -> Mono
						.fromCallable(() -> tool.call().apply(new McpSyncServerExchange(exchange), map))
						.subscribeOn(Schedulers.boundedElastic()));
		}
	}

	/**
	 * 具有异步读取函数的资源规范。
	 *
	 * <p>
	 * 读取结果中所有内容都既没有文本也没有二进制负载时，服务器使用资源描述生成一个文本块代替。
	 * </p>
	 *
	 * @param resource 资源描述符
	 * @param readHandler 处理资源读取请求的函数
	 */
	public record AsyncResourceSpecification(McpSchema.Resource resource,
			BiFunction<McpAsyncServerExchange, McpSchema.ReadResourceRequest, Mono<McpSchema.ReadResourceResult>> readHandler) {

		public AsyncResourceSpecification {
			Assert.notNull(resource, "Resource must not be null");
			Assert.notNull(readHandler, "Resource read handler must not be null");
		}

		/**
		 * 创建一个每次读取都返回给定内容对象的规范。内容对象可以被就地修改，
		 * 之后的读取会看到修改后的值。
		 * @param resource 资源描述符
		 * @param contents 可变的资源内容
		 * @return 资源规范
		 */
		public static AsyncResourceSpecification fromContents(McpSchema.Resource resource,
				McpSchema.ResourceContents contents) {
			Assert.notNull(contents, "Resource contents must not be null");
			return new AsyncResourceSpecification(resource,
					(exchange, request) -> Mono.fromSupplier(() -> new McpSchema.ReadResourceResult(List.of(contents))));
		}

		static AsyncResourceSpecification fromSync(SyncResourceSpecification resource) {
			return new AsyncResourceSpecification(resource.resource(),
					(exchange, req) -> Mono
						.fromCallable(() -> resource.readHandler().apply(new McpSyncServerExchange(exchange), req))
						.subscribeOn(Schedulers.boundedElastic()));
		}
	}

	/**
	 * 具有异步渲染函数的提示词规范。与工具不同，渲染失败作为协议错误
	 * ({@link McpSchema.ErrorCodes#INTERNAL_HANDLER_ERROR}) 返回给客户端。
	 *
	 * @param prompt 提示词定义
	 * @param promptHandler 渲染提示词的函数
	 */
	public record AsyncPromptSpecification(McpSchema.Prompt prompt,
			BiFunction<McpAsyncServerExchange, McpSchema.GetPromptRequest, Mono<McpSchema.GetPromptResult>> promptHandler) {

		public AsyncPromptSpecification {
			Assert.notNull(prompt, "Prompt must not be null");
			Assert.notNull(promptHandler, "Prompt handler must not be null");
		}

		static AsyncPromptSpecification fromSync(SyncPromptSpecification prompt) {
			return new AsyncPromptSpecification(prompt.prompt(),
					(exchange, req) -> Mono
						.fromCallable(() -> prompt.promptHandler().apply(new McpSyncServerExchange(exchange), req))
						.subscribeOn(Schedulers.boundedElastic()));
		}
	}

	/**
	 * 具有同步处理函数的工具规范。
	 *
	 * @param tool 工具定义
	 * @param call 实现工具逻辑的函数
	 */
	public record SyncToolSpecification(McpSchema.Tool tool,
			BiFunction<McpSyncServerExchange, Map<String, Object>, McpSchema.CallToolResult> call) {

		public SyncToolSpecification {
			Assert.notNull(tool, "Tool must not be null");
			Assert.notNull(call, "Tool call handler must not be null");
		}
	}

	/**
	 * 具有同步读取函数的资源规范。
	 *
	 * @param resource 资源描述符
	 * @param readHandler 处理资源读取请求的函数
	 */
	public record SyncResourceSpecification(McpSchema.Resource resource,
			BiFunction<McpSyncServerExchange, McpSchema.ReadResourceRequest, McpSchema.ReadResourceResult> readHandler) {

		public SyncResourceSpecification {
			Assert.notNull(resource, "Resource must not be null");
			Assert.notNull(readHandler, "Resource read handler must not be null");
		}

		public static SyncResourceSpecification fromContents(McpSchema.Resource resource,
				McpSchema.ResourceContents contents) {
			Assert.notNull(contents, "Resource contents must not be null");
			return new SyncResourceSpecification(resource,
					(exchange, request) -> new McpSchema.ReadResourceResult(List.of(contents)));
		}
	}

	/**
	 * 具有同步渲染函数的提示词规范。
	 *
	 * @param prompt 提示词定义
	 * @param promptHandler 渲染提示词的函数
	 */
	public record SyncPromptSpecification(McpSchema.Prompt prompt,
			BiFunction<McpSyncServerExchange, McpSchema.GetPromptRequest, McpSchema.GetPromptResult> promptHandler) {

		public SyncPromptSpecification {
			Assert.notNull(prompt, "Prompt must not be null");
			Assert.notNull(promptHandler, "Prompt handler must not be null");
		}
	}

}
