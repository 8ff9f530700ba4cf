/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.telemetry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import io.mcpcli.telemetry.McpEvent.Direction;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventRecorderTests {

	private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

	@Test
	void testIdsAreMonotonicAndQueryIsExclusive() {
		InMemoryEventRecorder recorder = new InMemoryEventRecorder(100, clock);

		McpEvent first = recorder.record("client", Direction.OUTBOUND, "request", "a");
		McpEvent second = recorder.record("server", Direction.INBOUND, "request", "a");
		recorder.record("server", Direction.OUTBOUND, "response", "b");

		assertThat(first.id()).isEqualTo(1);
		assertThat(second.id()).isEqualTo(2);
		assertThat(first.timestamp()).isEqualTo(clock.instant());

		List<McpEvent> since = recorder.query(second.id());
		assertThat(since).hasSize(1);
		assertThat(since.get(0).channel()).isEqualTo("response");
		assertThat(recorder.query(0)).hasSize(3);
	}

	@Test
	void testCapacityDropsOldestEvents() {
		InMemoryEventRecorder recorder = new InMemoryEventRecorder(2, clock);

		recorder.record("client", Direction.OUTBOUND, "notification", 1);
		recorder.record("client", Direction.OUTBOUND, "notification", 2);
		recorder.record("client", Direction.OUTBOUND, "notification", 3);

		assertThat(recorder.query(0)).extracting(McpEvent::payload).containsExactly(2, 3);
	}

	@Test
	void testDefaultCapacityIsBounded() {
		InMemoryEventRecorder recorder = new InMemoryEventRecorder();

		for (int i = 0; i < InMemoryEventRecorder.DEFAULT_CAPACITY + 5; i++) {
			recorder.record("client", Direction.OUTBOUND, "notification", i);
		}

		List<McpEvent> events = recorder.query(0);
		assertThat(events).hasSize(InMemoryEventRecorder.DEFAULT_CAPACITY);
		assertThat(events.get(0).id()).isEqualTo(6);
		assertThat(events.get(events.size() - 1).payload()).isEqualTo(InMemoryEventRecorder.DEFAULT_CAPACITY + 4);
	}

	@Test
	void testClear() {
		InMemoryEventRecorder recorder = new InMemoryEventRecorder();
		recorder.record("client", Direction.OUTBOUND, "request", "x");

		recorder.clear();

		assertThat(recorder.query(0)).isEmpty();
		// ids keep increasing after a clear
		assertThat(recorder.record("client", Direction.OUTBOUND, "request", "y").id()).isEqualTo(2);
	}

	@Test
	void testNoopRecorder() {
		assertThat(McpEventRecorder.NOOP.record("client", Direction.INBOUND, "request", "x")).isNull();
		assertThat(McpEventRecorder.NOOP.query(0)).isEmpty();
	}

	@Test
	void testInvalidCapacity() {
		assertThatThrownBy(() -> new InMemoryEventRecorder(0, clock)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("capacity must be positive");
	}

}
