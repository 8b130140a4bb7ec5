package com.di.flightwarehouse.dimension;

import com.di.flightwarehouse.storage.FactFileReader;
import com.di.flightwarehouse.storage.RawFile;
import com.di.flightwarehouse.util.TypeCoercion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Builds the carrier dimension from the fact files themselves, so that every carrier a pending
 * file mentions exists before any of its rows is validated.
 * <p>
 * Files are scanned in the given order and merged into a map ordered by carrier code; the DOT id
 * of the first sighting wins. Given the same files the output is always the same.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CarrierExtractor {

    static final String COL_CARRIER = "Reporting_Airline";
    static final String COL_DOT_ID = "DOT_ID_Reporting_Airline";

    private final FactFileReader factFileReader;
    private final DimensionStore dimensionStore;

    public DimensionLoadResult extract(List<RawFile> files) {
        SortedMap<String, Carrier> carriers = collect(files);
        int inserted = dimensionStore.insertCarriers(carriers.values());
        long unnamed = carriers.keySet().stream().filter(code -> !KnownCarriers.isKnown(code)).count();
        log.info("[CARRIERS] {} files scanned, {} distinct carriers ({} with placeholder names), {} new",
                files.size(), carriers.size(), unnamed, inserted);
        return DimensionLoadResult.builder()
                .dimension("carriers")
                .discovered(carriers.size())
                .inserted(inserted)
                .filesScanned(files.size())
                .build();
    }

    SortedMap<String, Carrier> collect(List<RawFile> files) {
        SortedMap<String, Carrier> carriers = new TreeMap<>();
        for (RawFile file : files) {
            Map<String, Integer> seenInFile = new TreeMap<>();
            factFileReader.scan(file, List.of(COL_CARRIER), record -> {
                String code = TypeCoercion.toStr(FactFileReader.field(record, COL_CARRIER));
                if (code != null) {
                    seenInFile.putIfAbsent(code, TypeCoercion.toInteger(FactFileReader.field(record, COL_DOT_ID)));
                }
            });
            seenInFile.forEach((code, dotId) -> carriers.putIfAbsent(code,
                    Carrier.builder().code(code).name(KnownCarriers.nameOf(code)).dotId(dotId).build()));
            log.debug("[CARRIERS] {}: {} carriers", file.fileName(), seenInFile.size());
        }
        return carriers;
    }
}
