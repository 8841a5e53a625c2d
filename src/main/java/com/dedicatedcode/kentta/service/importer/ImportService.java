/*
 *  This file is part of kentta.
 *
 *  Kentta is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Kentta is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Kentta. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.kentta.service.importer;

import com.dedicatedcode.kentta.config.KenttaConfiguration;
import com.dedicatedcode.kentta.service.GeoHelper;
import com.dedicatedcode.kentta.service.importer.ImportStatistics.Kind;
import com.dedicatedcode.kentta.service.importer.ImportStatistics.Stage;
import com.dedicatedcode.kentta.service.importer.airport.AirportIndex;
import com.dedicatedcode.kentta.service.importer.airport.RowDispatcher;
import com.dedicatedcode.kentta.service.importer.airport.SceneryFileContext;
import com.dedicatedcode.kentta.service.store.AirportStore;
import com.dedicatedcode.kentta.service.store.SceneryFile;
import com.dedicatedcode.kentta.service.store.SqliteAirportStore;
import com.dedicatedcode.kentta.service.store.StoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Imports a scenery file or a directory tree of scenery files into the airport database. Each file is imported in
 * its own transaction. A file that cannot be read is rolled back and skipped, a failing database aborts the import.
 */
@Service
public class ImportService {

    private static final Logger logger = LoggerFactory.getLogger(ImportService.class);

    static final String METADATA_FILE = "kentta_metadata.json";

    private final GeoHelper geoHelper;
    private final KenttaConfiguration config;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Opens the text of one scenery file.
     */
    @FunctionalInterface
    interface SceneryReaderSource {
        BufferedReader open() throws IOException;
    }

    public ImportService(GeoHelper geoHelper, KenttaConfiguration config) {
        this.geoHelper = geoHelper;
        this.config = config;
    }

    public ImportStatistics importData(String sceneryPath, String dataDir) throws IOException {
        cancelled.set(false);
        ImportStatistics stats = new ImportStatistics();
        Path sceneryRoot = Paths.get(sceneryPath);
        Path dataDirectory = Paths.get(dataDir);
        dataDirectory.toFile().mkdirs();
        Path databasePath = dataDirectory.resolve(Paths.get(config.getDatabasePath()).getFileName());
        printHeader(sceneryRoot, databasePath);

        SceneryFilter filter = new PatternSceneryFilter(config.getFilterConfiguration());

        stats.printPhaseHeader("PHASE 1: Discovering scenery files");
        List<Path> files = discoverFiles(sceneryRoot, filter, stats);
        stats.setFilesFound(files.size());
        logger.info("Found {} scenery files below {}", files.size(), sceneryRoot);

        stats.printPhaseHeader("PHASE 2: Importing airports");
        AirportIndex airportIndex = new AirportIndex(filter);
        try (SqliteAirportStore store = new SqliteAirportStore(databasePath,
                                                              config.getImportConfiguration().isRecreateSchema())) {
            for (Path file : files) {
                if (cancelled.get()) {
                    logger.info("Import cancelled, {} files left", files.size() - stats.getFilesImported());
                    stats.recordError(Stage.OVERALL, Kind.CANCELLED, null, "cancel",
                                      new IllegalStateException("Import cancelled"));
                    break;
                }
                importFile(file, store, airportIndex, stats);
            }
            stats.setTotalTime(System.currentTimeMillis() - stats.getStartTime());
            stats.printFinalStatistics();
            stats.printOutcomeAndErrors();
            writeMetadataFile(sceneryRoot, dataDirectory, stats);
            stats.printSuccess();
        } catch (StoreException e) {
            stats.setTotalTime(System.currentTimeMillis() - stats.getStartTime());
            stats.printError("IMPORT FAILED: " + e.getMessage());
            stats.recordError(Stage.OVERALL, Kind.STORE, null, "fatal", e);
            stats.printOutcomeAndErrors();
            throw e;
        }
        return stats;
    }

    /**
     * Stops the running import after the current file.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void importFile(Path file, AirportStore store, AirportIndex airportIndex, ImportStatistics stats) {
        SceneryFile sceneryFile = new SceneryFile(file.toString(), file.getFileName().toString(), sizeOf(file));
        importFile(sceneryFile,
                   () -> new BufferedReader(new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8)),
                   store, airportIndex, stats);
    }

    void importFile(SceneryFile sceneryFile, SceneryReaderSource source, AirportStore store, AirportIndex airportIndex,
                    ImportStatistics stats) {
        long fileStart = System.currentTimeMillis();
        String fileName = sceneryFile.fileName();
        KenttaConfiguration.ImportConfiguration importConfig = config.getImportConfiguration();

        Set<String> admitted = airportIndex.snapshot();
        int fileId = store.beginFile(sceneryFile);
        SceneryFileContext context = new SceneryFileContext(fileId, fileName, importConfig.isAddon(),
                                                            importConfig.isThreeD(),
                                                            importConfig.getLengthPrecision());
        RowDispatcher dispatcher = new RowDispatcher(context, airportIndex, store, geoHelper);
        try (BufferedReader reader = source.open()) {
            new AptDatReader().read(reader, dispatcher::accept);
            dispatcher.finish();
            store.commitFile();
        } catch (IOException e) {
            logger.error("Failed to read scenery file {}, rolling back", sceneryFile.localPath(), e);
            store.rollbackFile();
            airportIndex.restore(admitted);
            stats.recordError(Stage.READ, Kind.IO, fileName, "read", e);
            return;
        } catch (StoreException e) {
            store.rollbackFile();
            airportIndex.restore(admitted);
            throw e;
        }

        stats.incrementFilesImported();
        stats.addRowsRead(dispatcher.rowsConsumed());
        stats.addAirportsWritten(dispatcher.airportsWritten());
        stats.addDiagnostics(dispatcher.diagnostics());
        stats.printFileSummary(fileName, dispatcher.rowsConsumed(), dispatcher.airportsWritten(), fileStart);
        logger.debug("Imported {}: {} rows, {} airports, {} diagnostics", fileName, dispatcher.rowsConsumed(),
                     dispatcher.airportsWritten(), dispatcher.diagnostics().total());
    }

    List<Path> discoverFiles(Path sceneryRoot, SceneryFilter filter, ImportStatistics stats) throws IOException {
        if (Files.isRegularFile(sceneryRoot)) {
            return List.of(sceneryRoot);
        }
        if (!Files.isDirectory(sceneryRoot)) {
            throw new IOException("Scenery path " + sceneryRoot + " does not exist");
        }
        Pattern fileNamePattern = PatternSceneryFilter.toPattern(config.getImportConfiguration().getFileNamePattern());
        try (Stream<Path> walk = Files.walk(sceneryRoot)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> fileNamePattern.matcher(path.getFileName().toString()).matches())
                    .filter(path -> {
                        Path parent = sceneryRoot.relativize(path).getParent();
                        String relative = parent == null ? "" : parent.toString();
                        boolean included = filter.includePath(relative)
                                && filter.includeFilename(path.getFileName().toString());
                        if (!included) {
                            logger.debug("Skipping filtered scenery file {}", path);
                            stats.incrementFilesSkipped();
                        }
                        return included;
                    })
                    .sorted()
                    .toList();
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            logger.warn("Cannot determine size of {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private void writeMetadataFile(Path sceneryRoot, Path dataDirectory, ImportStatistics stats) {
        Path metadataPath = dataDirectory.resolve(METADATA_FILE);
        Instant now = Instant.now();
        String importTimestamp = DateTimeFormatter.ISO_INSTANT.format(now);
        String dataVersion = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC).format(now);
        ObjectMapper objectMapper = new ObjectMapper();
        KenttaMetadata metadata = new KenttaMetadata(
                importTimestamp,
                dataVersion,
                sceneryRoot.toString(),
                stats.getFilesImported(),
                stats.getAirportsWritten(),
                "1.0.0"
        );
        try {
            objectMapper.writeValue(metadataPath.toFile(), metadata);
            System.out.println("\n\033[1;32mMetadata file written to: " + metadataPath + "\033[0m");
        } catch (IOException e) {
            logger.error("Failed to write metadata file {}", metadataPath, e);
            stats.recordError(Stage.OVERALL, Kind.IO, METADATA_FILE, "metadata", e);
        }
    }

    private void printHeader(Path sceneryRoot, Path databasePath) {
        System.out.println("\n\033[1;34m" + "=".repeat(80) + "\n" + " ".repeat(25) + "KENTTA AIRPORT IMPORT"
                                   + "\n" + "=".repeat(80) + "\033[0m");
        System.out.println("\033[1mScenery:\033[0m  " + sceneryRoot);
        System.out.println("\033[1mDatabase:\033[0m " + databasePath);
    }
}
