/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.LoggingMessageNotification;

/**
 * 表示与客户端的同步交互，将所有操作委托给 {@link McpAsyncServerExchange} 并阻塞等待结果。
 */
public class McpSyncServerExchange {

	private final McpAsyncServerExchange exchange;

	/**
	 * @param exchange 要委托的异步交互
	 */
	public McpSyncServerExchange(McpAsyncServerExchange exchange) {
		this.exchange = exchange;
	}

	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.exchange.getClientCapabilities();
	}

	public McpSchema.Implementation getClientInfo() {
		return this.exchange.getClientInfo();
	}

	/**
	 * 请求客户端执行一次生成。
	 * @param createMessageRequest 生成请求
	 * @return 客户端返回的生成结果
	 * @see McpAsyncServerExchange#createMessage(McpSchema.CreateMessageRequest)
	 */
	public McpSchema.CreateMessageResult createMessage(McpSchema.CreateMessageRequest createMessageRequest) {
		return this.exchange.createMessage(createMessageRequest).block();
	}

	public McpSchema.ElicitResult createElicitation(McpSchema.ElicitRequest elicitRequest) {
		return this.exchange.createElicitation(elicitRequest).block();
	}

	public McpSchema.ListRootsResult listRoots() {
		return this.exchange.listRoots().block();
	}

	/**
	 * 向客户端发送日志消息通知，低于当前阈值的消息被丢弃。
	 * @param loggingMessageNotification 要发送的日志消息
	 */
	public void loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		this.exchange.loggingNotification(loggingMessageNotification).block();
	}

}
