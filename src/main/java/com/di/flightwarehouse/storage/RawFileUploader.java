package com.di.flightwarehouse.storage;

import com.di.flightwarehouse.config.PipelineProperties;
import com.di.flightwarehouse.exception.StructuralPipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;

/**
 * First pipeline stage: pushes every regular file of the local raw directory into the bucket
 * under the raw prefix. Re-uploading an unchanged file is harmless; discovery keys on the file name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RawFileUploader {

    private final RawObjectStore objectStore;
    private final PipelineProperties properties;

    /**
     * @return the object keys written, in file-name order; empty when upload is disabled
     */
    public List<String> uploadRawFiles() {
        if (!properties.isUploadEnabled()) {
            log.info("[UPLOAD] Disabled; using objects already in gs://{}/{}", properties.getBucket(), properties.getRawPrefix());
            return List.of();
        }
        Path dir = Paths.get(properties.getLocalRawDir());
        if (!Files.isDirectory(dir)) {
            throw new StructuralPipelineException("Local raw directory " + dir.toAbsolutePath() + " does not exist");
        }

        objectStore.ensureBucket(properties.getBucket());
        List<Path> files;
        try (Stream<Path> entries = Files.list(dir)) {
            files = entries.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new StructuralPipelineException("Cannot list local raw directory " + dir, e);
        }

        List<String> keys = files.stream().map(file -> {
            String key = properties.getRawPrefix() + file.getFileName();
            objectStore.upload(properties.getBucket(), key, file);
            return key;
        }).toList();
        log.info("[UPLOAD] {} files uploaded to gs://{}/{}", keys.size(), properties.getBucket(), properties.getRawPrefix());
        return keys;
    }
}
