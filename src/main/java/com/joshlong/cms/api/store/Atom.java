package com.joshlong.cms.api.store;

import java.time.Instant;

/**
 * the smallest unit of content. {@code content} is usually json shaped by the type's
 * schema. any edit bumps {@code published}.
 */
public record Atom(Long id, String key, String content, Long typeId, Instant published) {
}
