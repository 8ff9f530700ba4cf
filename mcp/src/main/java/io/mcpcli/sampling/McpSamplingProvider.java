/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.sampling;

import io.mcpcli.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * 客户端用来响应 {@code sampling/createMessage} 请求的生成能力。
 */
@FunctionalInterface
public interface McpSamplingProvider {

	/**
	 * 根据生成请求异步产生生成结果。
	 * @param request 服务器委托的生成请求
	 * @return 发出生成结果的Mono
	 */
	Mono<McpSchema.CreateMessageResult> createMessage(McpSchema.CreateMessageRequest request);

}
