package com.di.flightwarehouse.storage;

import com.di.flightwarehouse.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.Reader;
import java.util.List;

/**
 * Read access to the configured raw bucket: fact file listing and streaming readers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RawFileCatalog {

    private final RawObjectStore objectStore;
    private final PipelineProperties properties;

    /** All fact files under the raw prefix, ordered by key. */
    public List<RawFile> listFactFiles() {
        List<RawFile> facts = objectStore.list(properties.getBucket(), properties.getRawPrefix()).stream()
                .map(key -> RawFile.classify(key, properties.getAirportsKey()))
                .filter(RawFile::isFact)
                .sorted()
                .toList();
        log.debug("[CATALOG] {} fact files under gs://{}/{}", facts.size(), properties.getBucket(), properties.getRawPrefix());
        return facts;
    }

    public RawFile airportsFile() {
        return RawFile.classify(properties.getAirportsKey(), properties.getAirportsKey());
    }

    public Reader open(RawFile file) {
        return objectStore.openReader(properties.getBucket(), file.key());
    }
}
