/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.transport;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.JSONRPCMessage;
import io.mcpcli.spec.McpTransport;
import io.mcpcli.spec.McpTransportClosedException;
import io.mcpcli.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 基于一对进程内队列的通道实现。两个端点通过 {@link #pair()} 创建，一方的出站队列就是另一方的入站队列。
 *
 * <p>
 * 消息在发送时被转换为JSON形式的Map，在接收时重新分类为JSON-RPC信封，
 * 因此两端不会共享任何可变对象。关闭通过队列中的哨兵对象传递，队列中在其之前的消息仍会被投递。
 * </p>
 */
public class InMemoryTransport implements McpTransport {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTransport.class);

	private static final Object CLOSE = new Object();

	private final String name;

	private final Lane incoming;

	private final Lane outgoing;

	private final ObjectMapper objectMapper;

	/**
	 * 一个方向上的消息队列及其关闭标记。
	 */
	private static final class Lane {

		private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

		private final AtomicBoolean closed = new AtomicBoolean(false);

		void close() {
			if (this.closed.compareAndSet(false, true)) {
				this.queue.offer(CLOSE);
			}
		}

	}

	/**
	 * 一对相互连接的端点。
	 *
	 * @param client 客户端一侧的端点
	 * @param server 服务器一侧的端点
	 */
	public record Pair(InMemoryTransport client, InMemoryTransport server) {
	}

	private InMemoryTransport(String name, Lane incoming, Lane outgoing, ObjectMapper objectMapper) {
		this.name = name;
		this.incoming = incoming;
		this.outgoing = outgoing;
		this.objectMapper = objectMapper;
	}

	public static Pair pair() {
		return pair(new ObjectMapper());
	}

	/**
	 * 创建一对相互连接的端点。
	 * @param objectMapper 用于消息转换的ObjectMapper
	 * @return 端点对
	 */
	public static Pair pair(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "The ObjectMapper can not be null");
		Lane clientToServer = new Lane();
		Lane serverToClient = new Lane();
		return new Pair(new InMemoryTransport("client", serverToClient, clientToServer, objectMapper),
				new InMemoryTransport("server", clientToServer, serverToClient, objectMapper));
	}

	@Override
	public Mono<Void> sendMessage(JSONRPCMessage message) {
		return Mono.defer(() -> {
			if (this.outgoing.closed.get()) {
				return Mono.error(new McpTransportClosedException("Transport " + this.name + " is closed"));
			}
			Map<String, Object> json = this.objectMapper.convertValue(message, McpSchema.MAP_TYPE_REF);
			logger.debug("[{}] Sending: {}", this.name, json);
			this.outgoing.queue.offer(json);
			return Mono.empty();
		});
	}

	@Override
	@SuppressWarnings("unchecked")
	public Mono<JSONRPCMessage> receive() {
		return Mono.fromCallable(() -> {
			Object item = this.incoming.queue.take();
			if (item == CLOSE) {
				// keep the sentinel so every later receive fails the same way
				this.incoming.queue.offer(CLOSE);
				throw new McpTransportClosedException("Transport " + this.name + " is closed");
			}
			return McpSchema.deserializeJsonRpcMessage(this.objectMapper, (Map<String, Object>) item);
		}).subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			logger.debug("[{}] Closing outbound direction", this.name);
			this.outgoing.close();
		});
	}

	@Override
	public void halt() {
		logger.debug("[{}] Halting inbound direction", this.name);
		this.incoming.close();
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeReference<T> typeRef) {
		return this.objectMapper.convertValue(data, typeRef);
	}

}
