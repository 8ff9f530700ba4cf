/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.sampling;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcpcli.spec.McpSchema;
import io.mcpcli.spec.McpSchema.CreateMessageRequest;
import io.mcpcli.spec.McpSchema.CreateMessageResult;
import io.mcpcli.spec.McpSchema.Role;
import io.mcpcli.spec.McpSchema.SamplingMessage;
import io.mcpcli.util.Assert;
import io.mcpcli.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * 调用本地兼容OpenAI {@code chat/completions} 接口的模型服务器（例如 llama.cpp server）的生成能力。
 *
 * <p>
 * 任何失败（连接错误、非2xx状态码、无法解析的响应）都不会以错误信号传播，而是转换为
 * {@code stopReason="error"} 且文本以 {@code [sampling error]} 开头的生成结果。
 * </p>
 */
public class LocalLlmSamplingProvider implements McpSamplingProvider {

	private static final Logger logger = LoggerFactory.getLogger(LocalLlmSamplingProvider.class);

	private final Config config;

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	/**
	 * 本地模型服务器的连接配置。
	 *
	 * @param baseUrl 服务器基础URL
	 * @param path 补全接口路径
	 * @param modelName 请求中使用的模型名称
	 * @param temperature 采样温度
	 * @param maxTokens 请求未指定时使用的最大生成长度
	 * @param timeout 单次请求超时
	 * @param apiKey 可选的Bearer令牌
	 */
	public record Config(String baseUrl, String path, String modelName, double temperature, int maxTokens,
			Duration timeout, String apiKey) {

		public Config {
			Assert.hasText(baseUrl, "baseUrl must not be empty");
			Assert.hasText(path, "path must not be empty");
			Assert.hasText(modelName, "modelName must not be empty");
			Assert.isTrue(maxTokens > 0, "maxTokens must be positive");
			Assert.notNull(timeout, "timeout must not be null");
		}

		public static Builder builder() {
			return new Builder();
		}

		public static class Builder {

			private String baseUrl = "http://127.0.0.1:8080";

			private String path = "/v1/chat/completions";

			private String modelName = "local-llm";

			private double temperature = 0.7;

			private int maxTokens = 512;

			private Duration timeout = Duration.ofSeconds(60);

			private String apiKey;

			public Builder baseUrl(String baseUrl) {
				this.baseUrl = baseUrl;
				return this;
			}

			public Builder path(String path) {
				this.path = path;
				return this;
			}

			public Builder modelName(String modelName) {
				this.modelName = modelName;
				return this;
			}

			public Builder temperature(double temperature) {
				this.temperature = temperature;
				return this;
			}

			public Builder maxTokens(int maxTokens) {
				this.maxTokens = maxTokens;
				return this;
			}

			public Builder timeout(Duration timeout) {
				this.timeout = timeout;
				return this;
			}

			public Builder apiKey(String apiKey) {
				this.apiKey = apiKey;
				return this;
			}

			public Config build() {
				return new Config(baseUrl, path, modelName, temperature, maxTokens, timeout, apiKey);
			}

		}

	}

	public LocalLlmSamplingProvider() {
		this(Config.builder().build());
	}

	public LocalLlmSamplingProvider(Config config) {
		this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build(), new ObjectMapper());
	}

	public LocalLlmSamplingProvider(Config config, HttpClient httpClient, ObjectMapper objectMapper) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.config = config;
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public Mono<CreateMessageResult> createMessage(CreateMessageRequest request) {
		return Mono.defer(() -> {
			Map<String, Object> payload = buildPayload(request);
			logger.debug("Submitting sampling request to local LLM: {}", payload);

			HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
				.uri(endpoint())
				.timeout(this.config.timeout())
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(writeJson(payload)));
			if (Utils.hasText(this.config.apiKey())) {
				requestBuilder.header("Authorization", "Bearer " + this.config.apiKey());
			}

			return Mono
				.fromFuture(this.httpClient.sendAsync(requestBuilder.build(), HttpResponse.BodyHandlers.ofString()));
		}).map(response -> {
			if (response.statusCode() / 100 != 2) {
				throw new IllegalStateException("HTTP " + response.statusCode() + ": " + response.body());
			}
			logger.debug("Received response from local LLM: {}", response.body());
			return parseResponse(readJson(response.body()));
		}).onErrorResume(error -> {
			logger.warn("Local LLM sampling failed: {}", error.getMessage());
			return Mono.just(new CreateMessageResult(Role.ASSISTANT,
					McpSchema.Content.text("[sampling error] " + error.getMessage()), this.config.modelName(),
					CreateMessageResult.STOP_REASON_ERROR));
		});
	}

	URI endpoint() {
		return Utils.resolveUri(URI.create(this.config.baseUrl()), this.config.path());
	}

	Map<String, Object> buildPayload(CreateMessageRequest request) {
		List<Map<String, Object>> messages = new ArrayList<>();
		if (Utils.hasText(request.systemPrompt())) {
			messages.add(Map.of("role", "system", "content", request.systemPrompt()));
		}
		if (request.messages() != null) {
			for (SamplingMessage message : request.messages()) {
				String text = (message.content() != null && message.content().text() != null)
						? message.content().text() : "";
				String role = (message.role() == Role.ASSISTANT) ? "assistant" : "user";
				messages.add(Map.of("role", role, "content", text));
			}
		}

		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("model", this.config.modelName());
		payload.put("messages", messages);
		payload.put("temperature", this.config.temperature());
		payload.put("max_tokens", (request.maxTokens() != null) ? request.maxTokens() : this.config.maxTokens());
		payload.put("stream", false);
		return payload;
	}

	/**
	 * 解析 {@code choices[0].message}，或者顶层带有 {@code content} 字段的响应。
	 * @param response 响应JSON
	 * @return 生成结果
	 */
	CreateMessageResult parseResponse(JsonNode response) {
		JsonNode choice = null;
		if (response != null && response.isObject()) {
			if (response.has("choices")) {
				JsonNode choices = response.get("choices");
				if (choices.isArray() && !choices.isEmpty()) {
					choice = choices.get(0);
				}
			}
			else if (response.has("content")) {
				choice = response;
			}
		}

		if (choice == null || !choice.isObject()) {
			return new CreateMessageResult(Role.ASSISTANT,
					McpSchema.Content.text("[sampling error] Invalid response payload"), this.config.modelName(),
					CreateMessageResult.STOP_REASON_ERROR);
		}

		JsonNode message = choice.has("message") ? choice.get("message") : choice;
		Role role = "user".equals(message.path("role").asText()) ? Role.USER : Role.ASSISTANT;

		JsonNode contentNode = message.path("content");
		String text;
		if (contentNode.isArray()) {
			StringBuilder parts = new StringBuilder();
			for (JsonNode part : contentNode) {
				if (part.isObject()) {
					parts.append(part.path("text").asText(""));
				}
			}
			text = parts.toString();
		}
		else if (contentNode.isTextual()) {
			text = contentNode.asText();
		}
		else {
			text = contentNode.isMissingNode() ? "" : contentNode.toString();
		}

		String stopReason = firstText(choice, "finish_reason", "stopReason");
		String model = firstText(response, "model");
		if (model == null) {
			model = firstText(choice, "model");
		}

		return new CreateMessageResult(role, McpSchema.Content.text(text.strip()),
				(model != null) ? model : this.config.modelName(), stopReason);
	}

	private static String firstText(JsonNode node, String... fieldNames) {
		for (String fieldName : fieldNames) {
			JsonNode value = node.get(fieldName);
			if (value != null && value.isTextual() && !value.asText().isEmpty()) {
				return value.asText();
			}
		}
		return null;
	}

	private String writeJson(Map<String, Object> payload) {
		try {
			return this.objectMapper.writeValueAsString(payload);
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to serialize sampling payload", e);
		}
	}

	private JsonNode readJson(String body) {
		try {
			return this.objectMapper.readTree(body);
		}
		catch (IOException e) {
			throw new IllegalStateException("Invalid JSON from local LLM: " + e.getMessage(), e);
		}
	}

}
