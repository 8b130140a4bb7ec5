package com.di.flightwarehouse.storage;

import com.di.flightwarehouse.exception.StructuralPipelineException;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.BucketInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link RawObjectStore} backed by Google Cloud Storage.
 * Objects are read through a {@code ReadChannel}, so large fact files are never held in memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GcsRawObjectStore implements RawObjectStore {

    private final Storage storage;

    @Override
    public void ensureBucket(String bucket) {
        if (storage.get(bucket) == null) {
            storage.create(BucketInfo.of(bucket));
            log.info("[GCS] Created bucket {}", bucket);
        }
    }

    @Override
    public void upload(String bucket, String key, Path file) {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, key))
                .setContentType(key.endsWith(".csv") ? "text/csv" : "text/plain")
                .build();
        try {
            storage.createFrom(blobInfo, file);
            log.info("[GCS] Uploaded {} -> gs://{}/{} ({} bytes)", file, bucket, key, Files.size(file));
        } catch (IOException e) {
            throw StructuralPipelineException.inFile(file.getFileName().toString(), "Upload to gs://" + bucket + "/" + key + " failed", e);
        }
    }

    @Override
    public List<String> list(String bucket, String prefix) {
        List<String> keys = new ArrayList<>();
        try {
            for (Blob blob : storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll()) {
                keys.add(blob.getName());
            }
        } catch (StorageException e) {
            throw new StructuralPipelineException("Listing gs://" + bucket + "/" + prefix + " failed", e);
        }
        return keys;
    }

    @Override
    public Reader openReader(String bucket, String key) {
        BlobId blobId = BlobId.of(bucket, key);
        if (storage.get(blobId) == null) {
            throw StructuralPipelineException.inFile(key, "Object gs://" + bucket + "/" + key + " not found", null);
        }
        return Channels.newReader(storage.reader(blobId), StandardCharsets.UTF_8);
    }
}
