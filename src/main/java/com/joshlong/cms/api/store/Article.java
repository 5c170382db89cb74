package com.joshlong.cms.api.store;

import java.time.Instant;

public record Article(Long id, String name, Long clientId, Instant published) {
}
