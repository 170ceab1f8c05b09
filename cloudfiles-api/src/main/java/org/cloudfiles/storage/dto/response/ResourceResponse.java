package org.cloudfiles.storage.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import org.cloudfiles.storage.domain.Resource;
import org.cloudfiles.storage.domain.ResourceType;

public record ResourceResponse(
        @Schema(description = "Path of the parent directory, empty for the root") String path,
        String name,
        ResourceType type,
        @Schema(description = "Size in bytes, null for directories") Long size
) {

    public static ResourceResponse from(Resource resource) {
        return new ResourceResponse(resource.getParentPath().getValue(), resource.getName(), resource.getType(), resource.getSize());
    }
}
