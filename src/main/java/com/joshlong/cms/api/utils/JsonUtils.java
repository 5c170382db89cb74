package com.joshlong.cms.api.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.util.StringUtils;

/**
 * jackson helpers for the bits of content we keep as json strings (atom content, type
 * schemas, collection metadata, request variables).
 */
public abstract class JsonUtils {

	private static final ObjectMapper objectMapper = new ObjectMapper();

	public static <T> T read(String json, ParameterizedTypeReference<T> typeReference) {
		try {
			var javaType = objectMapper.getTypeFactory().constructType(typeReference.getType());
			return objectMapper.readValue(json, javaType);
		} //
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("couldn't read the json [" + json + "]", e);
		}
	}

	/**
	 * returns {@code null} for blank input or anything that isn't json at all.
	 */
	public static JsonNode readTreeOrNull(String json) {
		if (!StringUtils.hasText(json))
			return null;
		try {
			return objectMapper.readTree(json);
		} //
		catch (JsonProcessingException e) {
			return null;
		}
	}

	public static String write(Object o) {
		try {
			return objectMapper.writeValueAsString(o);
		} //
		catch (JsonProcessingException e) {
			throw new IllegalStateException("couldn't write [" + o + "] as json", e);
		}
	}

}
