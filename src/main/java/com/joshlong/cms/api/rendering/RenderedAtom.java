package com.joshlong.cms.api.rendering;

public record RenderedAtom(Long id, String key, String typeName, int sortOrder, String content) {
}
