package org.cloudfiles.storage.infrastructure.storage;

import io.minio.*;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.cloudfiles.storage.config.MinioProperties;
import org.cloudfiles.storage.exception.StorageException;
import org.cloudfiles.storage.gateway.ObjectStorageGateway;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Iterator;
import java.util.List;

import static org.cloudfiles.storage.gateway.ObjectStorageGateway.isDirectoryKey;

/**
 * {@link ObjectStorageGateway} backed by a single MinIO bucket.
 * The MinIO SDK is blocking, every call runs on the bounded elastic scheduler.
 */
@Slf4j
@Service
public class MinioStorageGateway implements ObjectStorageGateway {

    private static final String NO_SUCH_KEY = "NoSuchKey";

    private final MinioClient minioClient;
    private final MinioProperties minioProperties;
    private final String bucketName;

    public MinioStorageGateway(MinioClient minioClient, MinioProperties minioProperties) {
        this.minioClient = minioClient;
        this.minioProperties = minioProperties;
        this.bucketName = minioProperties.getBucketName();
    }

    @PostConstruct
    public void init() {
        if (!minioProperties.isCreateBucket()) {
            return;
        }
        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build());
            if (!found) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucketName).build());
                log.info("Bucket '{}' created successfully.", bucketName);
            } else {
                log.info("Bucket '{}' already exists.", bucketName);
            }
        } catch (Exception e) {
            log.error("Error ensuring bucket '{}' exists", bucketName, e);
            throw new StorageException("Unable to initialize bucket " + bucketName, e);
        }
    }

    @Override
    public Mono<Boolean> exists(String path) {
        return Mono.fromCallable(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucketName).object(path).build());
                return true;
            } catch (ErrorResponseException e) {
                if (!NO_SUCH_KEY.equals(e.errorResponse().code())) {
                    throw new StorageException("MinIO stat failed for " + path, e);
                }
            } catch (Exception e) {
                log.error("Error checking {} in MinIO", path, e);
                throw new StorageException("MinIO stat failed for " + path, e);
            }
            // a directory without marker still exists while something lives under it
            return isDirectoryKey(path) && hasObjectUnder(path);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private boolean hasObjectUnder(String prefix) throws Exception {
        Iterable<Result<Item>> results = minioClient.listObjects(ListObjectsArgs.builder()
                .bucket(bucketName)
                .prefix(prefix)
                .maxKeys(1)
                .build());
        Iterator<Result<Item>> iterator = results.iterator();
        if (!iterator.hasNext()) {
            return false;
        }
        iterator.next().get();
        return true;
    }

    @Override
    public Mono<Void> saveFile(String path, byte[] content) {
        return Mono.fromRunnable(() -> {
            String contentType = MediaTypeFactory.getMediaType(path)
                    .orElse(MediaType.APPLICATION_OCTET_STREAM)
                    .toString();
            putObject(path, content, contentType);
            log.info("Uploaded {} ({} bytes) to MinIO bucket {}", path, content.length, bucketName);
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Void> createDirectoryMarker(String path) {
        return Mono.fromRunnable(() -> {
            putObject(path, new byte[0], MediaType.APPLICATION_OCTET_STREAM_VALUE);
            log.info("Directory marker {} created in MinIO bucket {}", path, bucketName);
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    private void putObject(String path, byte[] content, String contentType) {
        try {
            minioClient.putObject(PutObjectArgs.builder()
                    .bucket(bucketName)
                    .object(path)
                    .stream(new ByteArrayInputStream(content), content.length, -1)
                    .contentType(contentType)
                    .build());
        } catch (Exception e) {
            log.error("Error writing {} to MinIO", path, e);
            throw new StorageException("MinIO put object failed for " + path, e);
        }
    }

    @Override
    public Mono<byte[]> getFile(String path) {
        return Mono.fromCallable(() -> {
            try (InputStream stream = minioClient.getObject(GetObjectArgs.builder().bucket(bucketName).object(path).build())) {
                return stream.readAllBytes();
            } catch (Exception e) {
                log.error("Error reading file {} from MinIO", path, e);
                throw new StorageException("MinIO get file failed for " + path, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<? extends Resource> getFileStream(String path) {
        return Mono.fromCallable(() -> {
            try {
                InputStream stream = minioClient.getObject(GetObjectArgs.builder().bucket(bucketName).object(path).build());
                // InputStreamResource will close the stream when the resource is consumed
                return new InputStreamResource(stream);
            } catch (Exception e) {
                log.error("Error loading file {} from MinIO", path, e);
                throw new StorageException("MinIO load file failed for " + path, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String path) {
        if (!isDirectoryKey(path)) {
            return removeObject(path);
        }
        return listKeys(path, true)
                .concatMap(this::removeObject)
                .then()
                .doOnSuccess(ignored -> log.info("Directory '{}' deleted from MinIO bucket '{}'", path, bucketName));
    }

    private Mono<Void> removeObject(String path) {
        return Mono.fromRunnable(() -> {
            try {
                minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucketName).object(path).build());
                log.debug("Object '{}' deleted from MinIO bucket '{}'", path, bucketName);
            } catch (Exception e) {
                log.error("Error deleting object {} from MinIO", path, e);
                throw new StorageException("MinIO delete failed for " + path, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Mono<Void> move(String fromPath, String toPath) {
        if (!isDirectoryKey(fromPath)) {
            return copyObject(fromPath, toPath).then(removeObject(fromPath));
        }
        return listKeys(fromPath, true)
                .collectList()
                .flatMap(keys -> copyAll(keys, fromPath, toPath).then(removeAll(keys)))
                .doOnSuccess(ignored -> log.info("Directory '{}' moved to '{}' in MinIO bucket '{}'", fromPath, toPath, bucketName));
    }

    private Mono<Void> copyAll(List<String> keys, String fromPath, String toPath) {
        return Flux.fromIterable(keys)
                .concatMap(key -> copyObject(key, toPath + key.substring(fromPath.length())))
                .then();
    }

    private Mono<Void> removeAll(List<String> keys) {
        return Flux.fromIterable(keys)
                .concatMap(this::removeObject)
                .then();
    }

    private Mono<Void> copyObject(String source, String destination) {
        return Mono.fromRunnable(() -> {
            try {
                minioClient.copyObject(CopyObjectArgs.builder()
                        .bucket(bucketName)
                        .object(destination)
                        .source(CopySource.builder().bucket(bucketName).object(source).build())
                        .build());
                log.debug("Object copied from {} to {} in MinIO bucket '{}'", source, destination, bucketName);
            } catch (Exception e) {
                log.error("Error copying object {} to {} in MinIO", source, destination, e);
                throw new StorageException("MinIO copy failed for " + source, e);
            }
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public Flux<String> listDirectChildren(String path) {
        return listKeys(path, false).filter(key -> !key.equals(path));
    }

    @Override
    public Flux<String> listRecursive(String path) {
        return listKeys(path, true).filter(key -> !key.equals(path));
    }

    private Flux<String> listKeys(String prefix, boolean recursive) {
        return Flux.defer(() -> Flux.fromIterable(minioClient.listObjects(ListObjectsArgs.builder()
                        .bucket(bucketName)
                        .prefix(prefix)
                        .recursive(recursive)
                        .build())))
                .map(result -> {
                    try {
                        return result.get().objectName();
                    } catch (Exception e) {
                        log.error("Error listing objects under {} in MinIO", prefix, e);
                        throw new StorageException("MinIO listing failed for " + prefix, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Long> getSize(String path) {
        return Mono.fromCallable(() -> {
            try {
                StatObjectResponse response = minioClient.statObject(StatObjectArgs.builder()
                        .bucket(bucketName)
                        .object(path)
                        .build());
                return response.size();
            } catch (Exception e) {
                log.error("Error to get file length {} in MinIO", path, e);
                throw new StorageException("MinIO getSize failed for " + path, e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
