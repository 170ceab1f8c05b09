package org.cloudfiles.storage.dto;

import java.time.Instant;
import java.util.UUID;

public record SessionDto(String id, UUID userId, Instant expiresAt) {
}
