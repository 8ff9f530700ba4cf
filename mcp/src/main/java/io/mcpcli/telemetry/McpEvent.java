/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.telemetry;

import java.time.Instant;

/**
 * 会话观察到的一条消息事件。
 *
 * @param id 记录器内单调递增的事件ID
 * @param timestamp 记录时间
 * @param role 记录此事件的一方，例如 {@code client} 或 {@code server}
 * @param direction 消息方向
 * @param channel 消息类别，例如 {@code request}、{@code response} 或 {@code notification}
 * @param payload 消息本身
 */
public record McpEvent(long id, Instant timestamp, String role, Direction direction, String channel,
		Object payload) {

	public enum Direction {

		INBOUND, OUTBOUND

	}

}
