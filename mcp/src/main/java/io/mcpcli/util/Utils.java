/*
 * Copyright 2024-2024 原始作者保留所有权利。
 */

package io.mcpcli.util;

import java.net.URI;
import java.util.Collection;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * 杂项工具方法。
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * 字符串不为{@code null}且至少包含一个非空白字符时返回{@code true}。
	 * @param str 要检查的字符串（可能为{@code null}）
	 * @return 是否包含实际文本
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * 集合为{@code null}或为空时返回{@code true}。
	 * @param collection 要检查的集合
	 * @return 集合是否为空
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Map为{@code null}或为空时返回{@code true}。
	 * @param map 要检查的Map
	 * @return Map是否为空
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * 根据基础URL解析端点路径。相对路径基于基础URL解析；绝对URL必须与基础URL的方案、
	 * 主机和端口一致，否则抛出{@link IllegalArgumentException}。
	 * @param baseUrl 基础URL（必须是绝对的）
	 * @param endpoint 端点路径或URL
	 * @return 解析后的端点URI
	 */
	public static URI resolveUri(URI baseUrl, String endpoint) {
		URI endpointUri = URI.create(endpoint);
		if (endpointUri.isAbsolute()) {
			if (!baseUrl.getScheme().equals(endpointUri.getScheme())
					|| !baseUrl.getAuthority().equals(endpointUri.getAuthority())) {
				throw new IllegalArgumentException("Absolute endpoint URL does not match the base URL.");
			}
			return endpointUri;
		}
		// "v1/x" against "http://h:1/api" would drop "api" without the trailing slash
		String base = baseUrl.toString();
		if (!base.endsWith("/")) {
			base = base + "/";
		}
		String relative = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
		return URI.create(base).resolve(relative);
	}

}
