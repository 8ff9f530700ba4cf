/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.server;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.LoggingMessageNotification;
import io.mcpcli.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 模型上下文协议(MCP)服务器的同步实现，封装 {@link McpAsyncServer} 提供阻塞操作。
 *
 * <p>
 * 运行时可以通过 {@link #addTool}、{@link #addResource} 和 {@link #addPrompt} 等方法修改注册表，
 * 每次修改都会向客户端广播对应的 list_changed 通知。
 * </p>
 *
 * @see McpAsyncServer
 */
public class McpSyncServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpSyncServer.class);

	private final McpAsyncServer asyncServer;

	/**
	 * 创建一个新的同步服务器，封装提供的异步服务器。
	 * @param asyncServer 要封装的异步服务器
	 */
	public McpSyncServer(McpAsyncServer asyncServer) {
		Assert.notNull(asyncServer, "Async server must not be null");
		this.asyncServer = asyncServer;
	}

	public void addTool(McpServerFeatures.SyncToolSpecification toolSpecification) {
		this.asyncServer.addTool(McpServerFeatures.AsyncToolSpecification.fromSync(toolSpecification)).block();
	}

	public void removeTool(String toolName) {
		this.asyncServer.removeTool(toolName).block();
	}

	public void addResource(McpServerFeatures.SyncResourceSpecification resourceSpecification) {
		this.asyncServer.addResource(McpServerFeatures.AsyncResourceSpecification.fromSync(resourceSpecification))
			.block();
	}

	public void removeResource(String resourceUri) {
		this.asyncServer.removeResource(resourceUri).block();
	}

	public void addPrompt(McpServerFeatures.SyncPromptSpecification promptSpecification) {
		this.asyncServer.addPrompt(McpServerFeatures.AsyncPromptSpecification.fromSync(promptSpecification)).block();
	}

	public void removePrompt(String promptName) {
		this.asyncServer.removePrompt(promptName).block();
	}

	public void notifyToolsListChanged() {
		this.asyncServer.notifyToolsListChanged().block();
	}

	public void notifyResourcesListChanged() {
		this.asyncServer.notifyResourcesListChanged().block();
	}

	public void notifyPromptsListChanged() {
		this.asyncServer.notifyPromptsListChanged().block();
	}

	/**
	 * 通知客户端资源内容已更新；未订阅的URI被静默跳过。
	 * @param uri 资源URI
	 * @param title 可选的标题
	 */
	public void notifyResourcesUpdated(String uri, String title) {
		this.asyncServer.notifyResourcesUpdated(uri, title).block();
	}

	public void loggingNotification(LoggingMessageNotification loggingMessageNotification) {
		this.asyncServer.loggingNotification(loggingMessageNotification).block();
	}

	public McpSchema.CreateMessageResult createMessage(McpSchema.CreateMessageRequest createMessageRequest) {
		return this.asyncServer.createMessage(createMessageRequest).block();
	}

	/**
	 * 以尽力而为的方式请求客户端执行一次生成，失败时返回带回退标记的合成结果。
	 * @param messages 有序的对话消息
	 * @param systemPrompt 可选的系统提示词
	 * @param maxTokens 可选的最大生成长度
	 * @return 生成结果或合成的回退结果
	 */
	public McpSchema.CreateMessageResult requestSampling(List<McpSchema.SamplingMessage> messages,
			String systemPrompt, Integer maxTokens) {
		return this.asyncServer.requestSampling(messages, systemPrompt, maxTokens).block();
	}

	public McpSchema.ElicitResult createElicitation(McpSchema.ElicitRequest elicitRequest) {
		return this.asyncServer.createElicitation(elicitRequest).block();
	}

	public Map<String, Object> elicitWithDefaults(String message, Map<String, Object> requestedSchema,
			Map<String, Object> defaults) {
		return this.asyncServer.elicitWithDefaults(message, requestedSchema, defaults).block();
	}

	public McpSchema.ListRootsResult listRoots() {
		return this.asyncServer.listRoots().block();
	}

	public Object ping() {
		return this.asyncServer.ping().block();
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.asyncServer.getServerCapabilities();
	}

	public McpSchema.Implementation getServerInfo() {
		return this.asyncServer.getServerInfo();
	}

	public McpSchema.ClientCapabilities getClientCapabilities() {
		return this.asyncServer.getClientCapabilities();
	}

	public McpSchema.Implementation getClientInfo() {
		return this.asyncServer.getClientInfo();
	}

	public boolean isInitialized() {
		return this.asyncServer.isInitialized();
	}

	public boolean closeGracefully() {
		try {
			this.asyncServer.closeGracefully().block(Duration.ofSeconds(10));
			return true;
		}
		catch (RuntimeException e) {
			logger.warn("Server didn't close within timeout", e);
			return false;
		}
	}

	@Override
	public void close() {
		this.asyncServer.close();
	}

	/**
	 * 获取底层的异步服务器。
	 * @return 异步服务器
	 */
	public McpAsyncServer getAsyncServer() {
		return this.asyncServer;
	}

}
