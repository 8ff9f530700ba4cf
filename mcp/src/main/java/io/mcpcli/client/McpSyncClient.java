/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.mcpcli.sampling.McpSamplingProvider;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.ClientCapabilities;
import io.mcpcli.spec.McpSchema.GetPromptRequest;
import io.mcpcli.spec.McpSchema.GetPromptResult;
import io.mcpcli.spec.McpSchema.ListPromptsResult;
import io.mcpcli.spec.McpSession;
import io.mcpcli.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 包装 {@link McpAsyncClient} 的阻塞式客户端。每个方法都阻塞直到对应的异步操作完成。
 *
 * @see McpClient
 * @see McpAsyncClient
 */
public class McpSyncClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpSyncClient.class);

	private static final long DEFAULT_CLOSE_TIMEOUT_MS = 10_000L;

	private final McpAsyncClient delegate;

	McpSyncClient(McpAsyncClient delegate) {
		Assert.notNull(delegate, "The delegate can not be null");
		this.delegate = delegate;
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.delegate.getServerCapabilities();
	}

	public String getServerInstructions() {
		return this.delegate.getServerInstructions();
	}

	public McpSchema.Implementation getServerInfo() {
		return this.delegate.getServerInfo();
	}

	public ClientCapabilities getClientCapabilities() {
		return this.delegate.getClientCapabilities();
	}

	public McpSchema.Implementation getClientInfo() {
		return this.delegate.getClientInfo();
	}

	public HandshakeResult getHandshakeResult() {
		return this.delegate.getHandshakeResult();
	}

	public McpSession.State getState() {
		return this.delegate.getState();
	}

	public boolean isInitialized() {
		return this.delegate.isInitialized();
	}

	@Override
	public void close() {
		this.delegate.close();
	}

	public boolean closeGracefully() {
		try {
			this.delegate.closeGracefully().block(Duration.ofMillis(DEFAULT_CLOSE_TIMEOUT_MS));
		}
		catch (RuntimeException e) {
			logger.warn("Client didn't close within timeout of {} ms.", DEFAULT_CLOSE_TIMEOUT_MS, e);
			return false;
		}
		return true;
	}

	public HandshakeResult initialize() {
		return this.delegate.initialize().block();
	}

	public Object ping() {
		return this.delegate.ping().block();
	}

	// --------------------------
	// Roots
	// --------------------------
	public void rootsListChangedNotification() {
		this.delegate.rootsListChangedNotification().block();
	}

	public void addRoot(McpSchema.Root root) {
		this.delegate.addRoot(root).block();
	}

	public void removeRoot(String rootUri) {
		this.delegate.removeRoot(rootUri).block();
	}

	public void setRoots(List<McpSchema.Root> roots) {
		this.delegate.setRoots(roots).block();
	}

	public void setSamplingProvider(McpSamplingProvider samplingProvider) {
		this.delegate.setSamplingProvider(samplingProvider);
	}

	// --------------------------
	// Tools
	// --------------------------
	public McpSchema.CallToolResult callTool(McpSchema.CallToolRequest callToolRequest) {
		return this.delegate.callTool(callToolRequest).block();
	}

	public McpSchema.CallToolResult callTool(String name, Map<String, Object> arguments) {
		return this.delegate.callTool(name, arguments).block();
	}

	public McpSchema.ListToolsResult listTools() {
		return this.delegate.listTools().block();
	}

	// --------------------------
	// Resources
	// --------------------------
	public McpSchema.ListResourcesResult listResources() {
		return this.delegate.listResources().block();
	}

	public McpSchema.ReadResourceResult readResource(String uri) {
		return this.delegate.readResource(uri).block();
	}

	public McpSchema.ListResourceTemplatesResult listResourceTemplates() {
		return this.delegate.listResourceTemplates().block();
	}

	public void subscribeResource(String uri) {
		this.delegate.subscribeResource(uri).block();
	}

	public void unsubscribeResource(String uri) {
		this.delegate.unsubscribeResource(uri).block();
	}

	// --------------------------
	// Prompts
	// --------------------------
	public ListPromptsResult listPrompts() {
		return this.delegate.listPrompts().block();
	}

	public GetPromptResult getPrompt(GetPromptRequest getPromptRequest) {
		return this.delegate.getPrompt(getPromptRequest).block();
	}

	public void setLoggingLevel(McpSchema.LoggingLevel loggingLevel) {
		this.delegate.setLoggingLevel(loggingLevel).block();
	}

}
