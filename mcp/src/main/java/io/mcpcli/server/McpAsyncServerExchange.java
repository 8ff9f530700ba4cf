/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcpcli.spec.McpError;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.LoggingLevel;
import io.mcpcli.spec.McpSchema.LoggingMessageNotification;
import io.mcpcli.spec.McpServerSession;
import io.mcpcli.util.Assert;
import reactor.core.publisher.Mono;

/**
 * 表示与已完成握手的客户端的异步交互。通过它可以查询客户端的能力，并向客户端发起
 * 采样、征询和根目录枚举请求。
 */
public class McpAsyncServerExchange {

	private static final TypeReference<McpSchema.CreateMessageResult> CREATE_MESSAGE_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ElicitResult> ELICIT_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private static final TypeReference<McpSchema.ListRootsResult> LIST_ROOTS_RESULT_TYPE_REF = new TypeReference<>() {
	};

	private final McpServerSession session;

	private final McpSchema.ClientCapabilities clientCapabilities;

	private final McpSchema.Implementation clientInfo;

	private volatile LoggingLevel minLoggingLevel = LoggingLevel.INFO;

	/**
	 * 创建与客户端的新异步交互。
	 * @param session 服务器会话
	 * @param clientCapabilities 客户端在握手中声明的能力
	 * @param clientInfo 客户端实现信息
	 */
	public McpAsyncServerExchange(McpServerSession session, McpSchema.ClientCapabilities clientCapabilities,
			McpSchema.Implementation clientInfo) {
		Assert.notNull(session, "Session must not be null");
		this.session = session;
		this.clientCapabilities = (clientCapabilities != null) ? clientCapabilities
				: McpSchema.ClientCapabilities.builder().build();
		this.clientInfo = clientInfo;
	}

	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.clientCapabilities;
	}

	public McpSchema.Implementation getClientInfo() {
		return this.clientInfo;
	}

	/**
	 * 请求客户端执行一次生成。客户端未声明 {@code sampling} 能力时直接失败。
	 * @param createMessageRequest 生成请求
	 * @return 客户端返回的生成结果
	 */
	public Mono<McpSchema.CreateMessageResult> createMessage(McpSchema.CreateMessageRequest createMessageRequest) {
		if (this.clientCapabilities.sampling() == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_REQUEST,
					"Client must be configured with sampling capabilities"));
		}
		return this.session.sendRequest(McpSchema.METHOD_SAMPLING_CREATE_MESSAGE, createMessageRequest,
				CREATE_MESSAGE_RESULT_TYPE_REF);
	}

	/**
	 * 请求客户端收集结构化的用户输入。客户端未声明 {@code elicitation} 能力时直接失败。
	 * @param elicitRequest 征询请求
	 * @return 客户端返回的 accept/decline/cancel 结果
	 */
	public Mono<McpSchema.ElicitResult> createElicitation(McpSchema.ElicitRequest elicitRequest) {
		if (this.clientCapabilities.elicitation() == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_REQUEST,
					"Client must be configured with elicitation capabilities"));
		}
		return this.session.sendRequest(McpSchema.METHOD_ELICITATION_CREATE, elicitRequest, ELICIT_RESULT_TYPE_REF);
	}

	/**
	 * 获取客户端当前声明的全部根目录。
	 * @return 根目录列表结果
	 */
	public Mono<McpSchema.ListRootsResult> listRoots() {
		return this.session.sendRequest(McpSchema.METHOD_ROOTS_LIST, null, LIST_ROOTS_RESULT_TYPE_REF);
	}

	/**
	 * 向客户端发送日志消息通知。低于当前最小日志级别的消息在序列化之前被丢弃。
	 * @param loggingMessageNotification 要发送的日志消息
	 * @return 当通知发送完成时完成的Mono
	 */
	public Mono<Void> loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		if (loggingMessageNotification == null || loggingMessageNotification.level() == null) {
			return Mono.error(McpError.of(McpSchema.ErrorCodes.INVALID_PARAMS, "Logging message must have a level"));
		}
		return Mono.defer(() -> {
			if (isNotificationForLevelAllowed(loggingMessageNotification.level())) {
				return this.session.sendNotification(McpSchema.METHOD_NOTIFICATION_MESSAGE, loggingMessageNotification);
			}
			return Mono.empty();
		});
	}

	LoggingLevel getMinLoggingLevel() {
		return this.minLoggingLevel;
	}

	void setMinLoggingLevel(LoggingLevel minLoggingLevel) {
		Assert.notNull(minLoggingLevel, "minLoggingLevel must not be null");
		this.minLoggingLevel = minLoggingLevel;
	}

	private boolean isNotificationForLevelAllowed(LoggingLevel loggingLevel) {
		return loggingLevel.level() >= this.minLoggingLevel.level();
	}

}
