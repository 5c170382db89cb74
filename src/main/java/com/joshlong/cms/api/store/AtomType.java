package com.joshlong.cms.api.store;

import java.time.Instant;

public record AtomType(Long id, String name, String schema, String template, Instant updated) {
}
