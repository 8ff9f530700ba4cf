/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.telemetry;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import io.mcpcli.telemetry.McpEvent.Direction;
import io.mcpcli.util.Assert;

/**
 * 在内存中保存事件的记录器，可以设置容量上限，超过上限时丢弃最旧的事件。
 */
public class InMemoryEventRecorder implements McpEventRecorder {

	/**
	 * 默认容量。
	 */
	public static final int DEFAULT_CAPACITY = 10_000;

	private final Object lock = new Object();

	private final Deque<McpEvent> events = new ArrayDeque<>();

	private final int capacity;

	private final Clock clock;

	private long nextId = 1;

	public InMemoryEventRecorder() {
		this(DEFAULT_CAPACITY, Clock.systemUTC());
	}

	public InMemoryEventRecorder(int capacity, Clock clock) {
		Assert.isTrue(capacity > 0, "capacity must be positive");
		Assert.notNull(clock, "clock must not be null");
		this.capacity = capacity;
		this.clock = clock;
	}

	@Override
	public McpEvent record(String role, Direction direction, String channel, Object payload) {
		synchronized (this.lock) {
			McpEvent event = new McpEvent(this.nextId++, this.clock.instant(), role, direction, channel, payload);
			this.events.addLast(event);
			if (this.events.size() > this.capacity) {
				this.events.pollFirst();
			}
			return event;
		}
	}

	@Override
	public List<McpEvent> query(long sinceId) {
		synchronized (this.lock) {
			return this.events.stream().filter(e -> e.id() > sinceId).toList();
		}
	}

	/**
	 * 清除所有已记录的事件。事件ID不会重置。
	 */
	public void clear() {
		synchronized (this.lock) {
			this.events.clear();
		}
	}

}
