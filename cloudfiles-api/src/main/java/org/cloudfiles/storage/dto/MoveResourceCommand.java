package org.cloudfiles.storage.dto;

import java.util.UUID;

public record MoveResourceCommand(UUID userId, String currentPath, String targetPath) {
}
