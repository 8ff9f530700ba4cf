/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.telemetry;

import java.util.List;

import io.mcpcli.telemetry.McpEvent.Direction;

/**
 * 会话收发消息的观察点。记录器由调用方创建并注入，其生命周期由调用方管理。
 */
public interface McpEventRecorder {

	/**
	 * 不记录任何内容的记录器。
	 */
	McpEventRecorder NOOP = new McpEventRecorder() {

		@Override
		public McpEvent record(String role, Direction direction, String channel, Object payload) {
			return null;
		}

		@Override
		public List<McpEvent> query(long sinceId) {
			return List.of();
		}

	};

	/**
	 * 记录一条事件。
	 * @param role 记录方的角色
	 * @param direction 消息方向
	 * @param channel 消息类别
	 * @param payload 消息
	 * @return 记录的事件；不保存事件的实现返回 {@code null}
	 */
	McpEvent record(String role, Direction direction, String channel, Object payload);

	/**
	 * 查询ID大于 {@code sinceId} 的所有事件，按ID升序排列。
	 * @param sinceId 起始ID（不含），传 0 返回全部
	 * @return 事件列表
	 */
	List<McpEvent> query(long sinceId);

}
