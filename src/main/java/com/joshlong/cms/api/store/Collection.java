package com.joshlong.cms.api.store;

public record Collection(Long id, String name, Long clientId) {
}
