package org.cloudfiles.storage.dto;

import org.springframework.core.io.Resource;

/**
 * Content of a downloaded file, or the zip archive of a downloaded directory.
 */
public record DownloadedResource(String fileName, boolean archive, Resource content) {
}
