package org.cloudfiles.storage.controller;

import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.cloudfiles.storage.config.RestApiVersion;
import org.cloudfiles.storage.config.TransferProperties;
import org.cloudfiles.storage.dto.DownloadedResource;
import org.cloudfiles.storage.dto.MoveResourceCommand;
import org.cloudfiles.storage.dto.UploadFileCommand;
import org.cloudfiles.storage.dto.response.ResourceResponse;
import org.cloudfiles.storage.interactor.*;
import org.springframework.core.io.Resource;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.*;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(RestApiVersion.API_PREFIX + RestApiVersion.ENDPOINT_RESOURCE)
@RequiredArgsConstructor
public class ResourceController {

    private static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");

    private final GetResourceInteractor getResourceInteractor;
    private final DeleteResourceInteractor deleteResourceInteractor;
    private final UploadFileInteractor uploadFileInteractor;
    private final DownloadResourceInteractor downloadResourceInteractor;
    private final MoveResourceInteractor moveResourceInteractor;
    private final SearchResourceInteractor searchResourceInteractor;
    private final SessionUserResolver sessionUserResolver;
    private final TransferProperties transferProperties;

    @GetMapping
    @Operation(summary = "Get resource info", description = "Returns the type, name, parent path and size of a file or directory.")
    public Mono<ResourceResponse> getResource(@RequestParam String path, ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMap(userId -> getResourceInteractor.execute(userId, path))
                .map(ResourceResponse::from);
    }

    @DeleteMapping
    @Operation(summary = "Delete a resource", description = "Deletes a file, or a directory with everything it contains.")
    public Mono<ResponseEntity<Void>> deleteResource(@RequestParam String path, ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMap(userId -> deleteResourceInteractor.execute(userId, path))
                .thenReturn(ResponseEntity.noContent().build());
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a file", description = "Uploads a file into the given directory, creating missing parent directories.")
    public Mono<ResponseEntity<ResourceResponse>> uploadFile(@RequestParam(defaultValue = "") String path,
                                                             @RequestPart("file") FilePart filePart,
                                                             ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMap(userId -> readContent(filePart)
                        .flatMap(content -> uploadFileInteractor.execute(new UploadFileCommand(userId, path + filePart.filename(), content))))
                .map(resource -> ResponseEntity.status(HttpStatus.CREATED).body(ResourceResponse.from(resource)));
    }

    private Mono<byte[]> readContent(FilePart filePart) {
        return DataBufferUtils.join(filePart.content(), (int) transferProperties.getMaxFileSize().toBytes())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0]);
    }

    @GetMapping("/download")
    @Operation(summary = "Download a resource", description = "Downloads a file, or a directory as a zip archive.")
    public Mono<ResponseEntity<Resource>> downloadResource(@RequestParam String path, ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMap(userId -> downloadResourceInteractor.execute(userId, path))
                .map(this::sendDownloadResponse);
    }

    private ResponseEntity<Resource> sendDownloadResponse(DownloadedResource download) {
        MediaType contentType = download.archive()
                ? APPLICATION_ZIP
                : MediaTypeFactory.getMediaType(download.fileName()).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(download.fileName()).build().toString())
                .contentType(contentType)
                .body(download.content());
    }

    @GetMapping("/move")
    @Operation(summary = "Move or rename a resource", description = "Moves a file or a directory tree to a new path.")
    public Mono<ResourceResponse> moveResource(@RequestParam String from, @RequestParam String to, ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMap(userId -> moveResourceInteractor.execute(new MoveResourceCommand(userId, from, to)))
                .map(ResourceResponse::from);
    }

    @GetMapping("/search")
    @Operation(summary = "Search resources by name", description = "Finds every file and directory named exactly as the query.")
    public Flux<ResourceResponse> searchResources(@RequestParam String query, ServerWebExchange exchange) {
        return sessionUserResolver.userId(exchange)
                .flatMapMany(userId -> searchResourceInteractor.execute(userId, query))
                .map(ResourceResponse::from);
    }
}
