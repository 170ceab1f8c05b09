package org.cloudfiles.storage.infrastructure.archive;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.cloudfiles.storage.config.TransferProperties;
import org.cloudfiles.storage.exception.StorageException;
import org.cloudfiles.storage.gateway.ArchiveBuilder;
import org.cloudfiles.storage.gateway.ArchiveEntry;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;

/**
 * Writes archive entries into a zip stream through a pipe: the caller reads the archive while it is produced.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ZipArchiveBuilder implements ArchiveBuilder {

    private final TransferProperties transferProperties;

    @Override
    public Mono<Resource> build(Flux<ArchiveEntry> entries) {
        try {
            ArchivePipeInputStream pipedInputStream = new ArchivePipeInputStream(transferProperties.getPipedBufferSize());
            PipedOutputStream pipedOutputStream = new PipedOutputStream(pipedInputStream);
            ZipArchiveOutputStream zos = new ZipArchiveOutputStream(pipedOutputStream);
            entries.concatMap(entry -> addEntry(entry, zos))
                    .then()
                    .doOnSuccess(ignored -> closeOutputStream(zos))
                    .doOnError(error -> abort(pipedInputStream, pipedOutputStream, error))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(
                            null,
                            error -> log.error("Error during zip creation", error)
                    );

            return Mono.just(new InputStreamResource(pipedInputStream));
        } catch (IOException e) {
            return Mono.error(new StorageException("Failed to create piped stream", e));
        }
    }

    private Mono<Boolean> addEntry(ArchiveEntry entry, ZipArchiveOutputStream zos) {
        if (entry.isDirectory()) {
            return addDirectory(entry.name(), zos);
        }
        return entry.content().flatMap(resource -> addFile(entry.name(), resource, zos));
    }

    private Mono<Boolean> addDirectory(String name, ZipArchiveOutputStream zos) {
        try {
            zos.putArchiveEntry(new ZipArchiveEntry(name));
            zos.closeArchiveEntry();
            return Mono.just(true);
        } catch (IOException ioe) {
            return Mono.error(new StorageException("Failed to add directory " + name + " to zip", ioe));
        }
    }

    private Mono<Boolean> addFile(String name, Resource resource, ZipArchiveOutputStream zos) {
        return Mono.fromCallable(() -> {
            try (InputStream is = resource.getInputStream()) {
                zos.putArchiveEntry(new ZipArchiveEntry(name));
                is.transferTo(zos);
                zos.closeArchiveEntry();
                return true;
            } catch (IOException ioe) {
                log.error("Exception while adding {} to zip", name, ioe);
                throw new StorageException("Failed to add file " + name + " to zip", ioe);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Leaves the archive unfinished: the reader gets the failure instead of a valid but incomplete zip.
     */
    private static void abort(ArchivePipeInputStream in, PipedOutputStream out, Throwable error) {
        in.fail(error);
        try {
            out.close();
        } catch (IOException e) {
            log.error("Failed to close zip pipe", e);
        }
    }

    private static void closeOutputStream(ZipArchiveOutputStream zos) {
        try {
            zos.close();
        } catch (IOException e) {
            log.error("Failed to close zip stream", e);
        }
    }

    static final class ArchivePipeInputStream extends PipedInputStream {

        private volatile Throwable failure;

        ArchivePipeInputStream(int pipeSize) {
            super(pipeSize);
        }

        void fail(Throwable error) {
            this.failure = error;
        }

        @Override
        public synchronized int read() throws IOException {
            checkFailure();
            int b = super.read();
            if (b < 0) {
                checkFailure();
            }
            return b;
        }

        @Override
        public synchronized int read(byte[] b, int off, int len) throws IOException {
            checkFailure();
            int n = super.read(b, off, len);
            if (n < 0) {
                checkFailure();
            }
            return n;
        }

        private void checkFailure() throws IOException {
            Throwable error = failure;
            if (error != null) {
                throw new IOException("Archive creation failed", error);
            }
        }
    }
}
