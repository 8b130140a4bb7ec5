package com.di.flightwarehouse.support;

import com.di.flightwarehouse.config.PipelineProperties;
import com.di.flightwarehouse.config.WeatherProperties;
import com.di.flightwarehouse.dimension.Airport;
import com.di.flightwarehouse.dimension.AirportLoader;
import com.di.flightwarehouse.dimension.Carrier;
import com.di.flightwarehouse.dimension.CarrierExtractor;
import com.di.flightwarehouse.dimension.DateDimGenerator;
import com.di.flightwarehouse.dimension.DateDimensionService;
import com.di.flightwarehouse.dimension.DateDimensions;
import com.di.flightwarehouse.fact.FlightLoadService;
import com.di.flightwarehouse.fact.FlightLoader;
import com.di.flightwarehouse.ledger.PendingFileResolver;
import com.di.flightwarehouse.pipeline.FlightPipelineOrchestrator;
import com.di.flightwarehouse.pipeline.RetryPolicy;
import com.di.flightwarehouse.quality.QualityGate;
import com.di.flightwarehouse.storage.FactFileReader;
import com.di.flightwarehouse.storage.RawFile;
import com.di.flightwarehouse.storage.RawFileCatalog;
import com.di.flightwarehouse.storage.RawFileUploader;
import com.di.flightwarehouse.util.PipelineMetrics;
import com.di.flightwarehouse.weather.WeatherLoader;
import com.di.flightwarehouse.weather.WeatherSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Pipeline services wired against in-memory storage and warehouse.
 */
public class PipelineFixture {

    public static final String AIRPORTS_DAT = String.join("\n",
            "3682,\"Hartsfield Jackson Atlanta International Airport\",\"Atlanta\",\"United States\",\"ATL\",\"KATL\",33.6367,-84.428101,1026,-5,\"A\",\"America/New_York\",\"airport\",\"OurAirports\"",
            "3830,\"Chicago O'Hare International Airport\",\"Chicago\",\"United States\",\"ORD\",\"KORD\",41.9786,-87.9048,672,-6,\"A\",\"America/Chicago\",\"airport\",\"OurAirports\"",
            "3670,\"Dallas Fort Worth International Airport\",\"Dallas-Fort Worth\",\"United States\",\"DFW\",\"KDFW\",32.896801,-97.038002,607,-6,\"A\",\"America/Chicago\",\"airport\",\"OurAirports\"",
            "3797,\"John F Kennedy International Airport\",\"New York\",\"United States\",\"JFK\",\"KJFK\",40.63980103,-73.77890015,13,-5,\"A\",\"America/New_York\",\"airport\",\"OurAirports\"",
            "3484,\"Los Angeles International Airport\",\"Los Angeles\",\"United States\",\"LAX\",\"KLAX\",33.94250107,-118.4079971,125,-8,\"A\",\"America/Los_Angeles\",\"airport\",\"OurAirports\"")
            + "\n";

    public final PipelineProperties properties = new PipelineProperties();
    public final WeatherProperties weatherProperties = new WeatherProperties();
    public final InMemoryRawObjectStore objectStore = new InMemoryRawObjectStore();
    public final InMemoryWarehouse warehouse = new InMemoryWarehouse();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final PipelineMetrics metrics = new PipelineMetrics(meterRegistry);

    public final RawFileUploader rawFileUploader = new RawFileUploader(objectStore, properties);
    public final RawFileCatalog catalog = new RawFileCatalog(objectStore, properties);
    public final FactFileReader factFileReader = new FactFileReader(catalog);
    public final PendingFileResolver pendingFileResolver = new PendingFileResolver(catalog, warehouse);
    public final DateDimensionService dateDimensionService = new DateDimensionService(warehouse);
    public final AirportLoader airportLoader = new AirportLoader(catalog, warehouse, warehouse);
    public final CarrierExtractor carrierExtractor = new CarrierExtractor(factFileReader, warehouse);
    public final DateDimGenerator dateDimGenerator = new DateDimGenerator(factFileReader, dateDimensionService);
    public final FlightLoader flightLoader = new FlightLoader(factFileReader, warehouse, dateDimensionService,
            warehouse, warehouse, properties, metrics);
    public final FlightLoadService flightLoadService = new FlightLoadService(pendingFileResolver, flightLoader);
    public final QualityGate qualityGate = new QualityGate(warehouse, warehouse, properties, metrics);

    public WeatherLoader weatherLoader(WeatherSource source) {
        return new WeatherLoader(warehouse, warehouse, source, warehouse, weatherProperties, metrics);
    }

    public FlightPipelineOrchestrator orchestrator(WeatherSource source, RetryPolicy retryPolicy, ExecutorService executor) {
        return new FlightPipelineOrchestrator(rawFileUploader, airportLoader, pendingFileResolver, carrierExtractor,
                dateDimGenerator, flightLoadService, weatherLoader(source), qualityGate, retryPolicy, executor, metrics);
    }

    /* ---- raw bucket ---- */

    /** Content of a file under {@code src/test/resources/fixtures}. */
    public static String fixture(String name) {
        try {
            return new ClassPathResource("fixtures/" + name).getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public RawFile putFactFile(String fileName, String content) {
        String key = properties.getRawPrefix() + fileName;
        objectStore.put(properties.getBucket(), key, content);
        return RawFile.classify(key, properties.getAirportsKey());
    }

    public PipelineFixture putAirportsFile(String content) {
        objectStore.put(properties.getBucket(), properties.getAirportsKey(), content);
        return this;
    }

    /* ---- dimension seeding ---- */

    public PipelineFixture seedAirports(String... codes) {
        warehouse.insertAirports(Arrays.stream(codes).map(c -> Airport.builder().code(c).name(c + " Airport").build()).toList());
        return this;
    }

    public PipelineFixture seedCarriers(String... codes) {
        warehouse.insertCarriers(Arrays.stream(codes).map(c -> Carrier.builder().code(c).name("Carrier " + c).build()).toList());
        return this;
    }

    public PipelineFixture seedDates(String... isoDates) {
        List<LocalDate> dates = Arrays.stream(isoDates).map(LocalDate::parse).toList();
        warehouse.insertDates(dates.stream().map(DateDimensions::derive).toList());
        return this;
    }
}
