/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.mcpcli.util;

import java.util.Collection;

import reactor.util.annotation.Nullable;

/**
 * 构建器和注册方法使用的参数断言。所有断言失败时抛出 {@link IllegalArgumentException}。
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * 断言集合不为 {@code null} 且不为空。
	 * @param collection 要检查的集合
	 * @param message 断言失败时使用的异常消息
	 */
	public static void notEmpty(@Nullable Collection<?> collection, String message) {
		if (collection == null || collection.isEmpty()) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言对象不为 {@code null}。
	 * <pre class="code">Assert.notNull(transport, "Transport must not be null");</pre>
	 * @param object 要检查的对象
	 * @param message 断言失败时使用的异常消息
	 */
	public static void notNull(@Nullable Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言字符串不为 {@code null} 且至少包含一个非空白字符。
	 * <pre class="code">Assert.hasText(name, "'name' must not be empty");</pre>
	 * @param text 要检查的字符串
	 * @param message 断言失败时使用的异常消息
	 */
	public static void hasText(@Nullable String text, String message) {
		if (!Utils.hasText(text)) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * 断言布尔表达式为 {@code true}。
	 * @param expression 要检查的表达式
	 * @param message 断言失败时使用的异常消息
	 */
	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

}
