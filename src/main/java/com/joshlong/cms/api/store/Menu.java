package com.joshlong.cms.api.store;

public record Menu(Long id, String name, Long collectionId, Long clientId) {
}
