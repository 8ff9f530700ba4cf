/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.client;

import io.mcpcli.spec.McpSchema;

/**
 * 一次成功协商的不可变结果。只有在 {@code initialize} 请求得到响应并且
 * {@code notifications/initialized} 已发出之后才会创建。
 *
 * @param protocolVersion 协商的协议版本
 * @param requestId {@code initialize} 请求使用的ID
 * @param clientCapabilities 客户端声明的能力
 * @param serverCapabilities 服务器声明的能力
 * @param clientInfo 客户端实现信息
 * @param serverInfo 服务器实现信息
 * @param instructions 服务器提供的可选使用说明
 */
public record HandshakeResult(String protocolVersion, long requestId,
		McpSchema.ClientCapabilities clientCapabilities, McpSchema.ServerCapabilities serverCapabilities,
		McpSchema.Implementation clientInfo, McpSchema.Implementation serverInfo, String instructions) {
}
