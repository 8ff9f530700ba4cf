/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import io.mcpcli.sampling.McpSamplingProvider;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.util.Assert;
import io.mcpcli.util.Utils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 客户端的功能声明：实现信息、能力、根目录、变更消费者以及服务器发起请求的处理器。
 *
 * <p>
 * 同步形式通过 {@link Async#fromSync(Sync)} 适配为异步形式：每个同步回调都被包装为在
 * {@link Schedulers#boundedElastic()} 上执行的 {@link Mono}。
 * </p>
 */
class McpClientFeatures {

	/**
	 * 异步客户端的功能声明。
	 *
	 * @param clientInfo 客户端实现信息
	 * @param clientCapabilities 客户端能力，为 {@code null} 时根据其余配置推导
	 * @param roots 初始根目录
	 * @param toolsChangeConsumers 工具列表变更消费者
	 * @param resourcesChangeConsumers 资源列表变更消费者
	 * @param resourcesUpdateConsumers 已订阅资源的更新消费者
	 * @param promptsChangeConsumers 提示词列表变更消费者
	 * @param loggingConsumers 日志消息消费者
	 * @param samplingProvider 采样请求的生成能力
	 * @param elicitationHandler 征询请求处理器
	 */
	record Async(McpSchema.Implementation clientInfo, McpSchema.ClientCapabilities clientCapabilities,
			Map<String, McpSchema.Root> roots, List<Function<List<McpSchema.Tool>, Mono<Void>>> toolsChangeConsumers,
			List<Function<List<McpSchema.Resource>, Mono<Void>>> resourcesChangeConsumers,
			List<Function<McpSchema.ResourcesUpdatedNotification, Mono<Void>>> resourcesUpdateConsumers,
			List<Function<List<McpSchema.Prompt>, Mono<Void>>> promptsChangeConsumers,
			List<Function<McpSchema.LoggingMessageNotification, Mono<Void>>> loggingConsumers,
			McpSamplingProvider samplingProvider,
			Function<McpSchema.ElicitRequest, Mono<McpSchema.ElicitResult>> elicitationHandler) {

		Async {
			Assert.notNull(clientInfo, "Client info must not be null");
			if (clientCapabilities == null) {
				var builder = McpSchema.ClientCapabilities.builder();
				if (!Utils.isEmpty(roots)) {
					builder.roots(true);
				}
				if (samplingProvider != null) {
					builder.sampling();
				}
				if (elicitationHandler != null) {
					builder.elicitation();
				}
				clientCapabilities = builder.build();
			}
			roots = (roots != null) ? new LinkedHashMap<>(roots) : new LinkedHashMap<>();
			toolsChangeConsumers = (toolsChangeConsumers != null) ? toolsChangeConsumers : List.of();
			resourcesChangeConsumers = (resourcesChangeConsumers != null) ? resourcesChangeConsumers : List.of();
			resourcesUpdateConsumers = (resourcesUpdateConsumers != null) ? resourcesUpdateConsumers : List.of();
			promptsChangeConsumers = (promptsChangeConsumers != null) ? promptsChangeConsumers : List.of();
			loggingConsumers = (loggingConsumers != null) ? loggingConsumers : List.of();
		}

		static Async fromSync(Sync syncSpec) {
			McpSamplingProvider samplingProvider = null;
			if (syncSpec.samplingHandler() != null) {
				samplingProvider = r -> Mono.fromCallable(() -> syncSpec.samplingHandler().apply(r))
					.subscribeOn(Schedulers.boundedElastic());
			}
			Function<McpSchema.ElicitRequest, Mono<McpSchema.ElicitResult>> elicitationHandler = null;
			if (syncSpec.elicitationHandler() != null) {
				elicitationHandler = r -> Mono.fromCallable(() -> syncSpec.elicitationHandler().apply(r))
					.subscribeOn(Schedulers.boundedElastic());
			}
			return new Async(syncSpec.clientInfo(), syncSpec.clientCapabilities(), syncSpec.roots(),
					toAsync(syncSpec.toolsChangeConsumers()), toAsync(syncSpec.resourcesChangeConsumers()),
					toAsync(syncSpec.resourcesUpdateConsumers()), toAsync(syncSpec.promptsChangeConsumers()),
					toAsync(syncSpec.loggingConsumers()), samplingProvider, elicitationHandler);
		}

		private static <T> List<Function<T, Mono<Void>>> toAsync(List<Consumer<T>> consumers) {
			List<Function<T, Mono<Void>>> asyncConsumers = new ArrayList<>();
			for (Consumer<T> consumer : consumers) {
				asyncConsumers.add(value -> Mono.<Void>fromRunnable(() -> consumer.accept(value))
					.subscribeOn(Schedulers.boundedElastic()));
			}
			return asyncConsumers;
		}
	}

	/**
	 * 同步客户端的功能声明，字段含义与 {@link Async} 相同。
	 */
	record Sync(McpSchema.Implementation clientInfo, McpSchema.ClientCapabilities clientCapabilities,
			Map<String, McpSchema.Root> roots, List<Consumer<List<McpSchema.Tool>>> toolsChangeConsumers,
			List<Consumer<List<McpSchema.Resource>>> resourcesChangeConsumers,
			List<Consumer<McpSchema.ResourcesUpdatedNotification>> resourcesUpdateConsumers,
			List<Consumer<List<McpSchema.Prompt>>> promptsChangeConsumers,
			List<Consumer<McpSchema.LoggingMessageNotification>> loggingConsumers,
			Function<McpSchema.CreateMessageRequest, McpSchema.CreateMessageResult> samplingHandler,
			Function<McpSchema.ElicitRequest, McpSchema.ElicitResult> elicitationHandler) {

		Sync {
			Assert.notNull(clientInfo, "Client info must not be null");
			roots = (roots != null) ? roots : Map.of();
			toolsChangeConsumers = (toolsChangeConsumers != null) ? toolsChangeConsumers : List.of();
			resourcesChangeConsumers = (resourcesChangeConsumers != null) ? resourcesChangeConsumers : List.of();
			resourcesUpdateConsumers = (resourcesUpdateConsumers != null) ? resourcesUpdateConsumers : List.of();
			promptsChangeConsumers = (promptsChangeConsumers != null) ? promptsChangeConsumers : List.of();
			loggingConsumers = (loggingConsumers != null) ? loggingConsumers : List.of();
		}
	}

}
