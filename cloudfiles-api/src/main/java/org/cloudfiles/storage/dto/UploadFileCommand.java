package org.cloudfiles.storage.dto;

import java.util.UUID;

public record UploadFileCommand(UUID userId, String targetPath, byte[] content) {
}
