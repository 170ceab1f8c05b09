package org.cloudfiles.storage.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

/**
 * Configuration properties for file transfers.
 * Maps to cloudfiles.transfer.* properties in application.yml
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "cloudfiles.transfer")
public class TransferProperties {

    /**
     * Largest accepted file, uploads are buffered in memory before being written to the object store.
     */
    private DataSize maxFileSize = DataSize.ofMegabytes(100);

    /**
     * Size of the pipe between the zip writer and the HTTP response when a directory is downloaded.
     */
    private int pipedBufferSize = 8192;

    @PostConstruct
    public void validate() {
        if (maxFileSize == null || maxFileSize.toBytes() <= 0) {
            throw new IllegalArgumentException("cloudfiles.transfer.max-file-size must be > 0. Current value: " + maxFileSize);
        }
        // uploads are joined into a single buffer, limited to an int size
        if (maxFileSize.toBytes() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("cloudfiles.transfer.max-file-size must not exceed " + Integer.MAX_VALUE
                    + " bytes. Current value: " + maxFileSize);
        }
        if (pipedBufferSize <= 0) {
            throw new IllegalArgumentException("cloudfiles.transfer.piped-buffer-size must be > 0. Current value: " + pipedBufferSize);
        }
        log.info("Maximum upload size is {} MB", maxFileSize.toMegabytes());
    }
}
