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
import com.dedicatedcode.kentta.service.importer.airport.AirportIndex;
import com.dedicatedcode.kentta.service.store.SceneryFile;
import com.dedicatedcode.kentta.service.store.SqliteAirportStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportServiceTest {

    @TempDir
    Path dataDir;

    private Path sceneryRoot;
    private KenttaConfiguration config;
    private ImportService importService;

    @BeforeEach
    void setUp() throws Exception {
        sceneryRoot = Paths.get(getClass().getClassLoader().getResource("scenery").toURI());
        config = new KenttaConfiguration();
        importService = new ImportService(new GeoHelper(), config);
    }

    private Connection openDatabase() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dataDir.resolve("airports.db"));
    }

    private static long count(Connection connection, String table) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Test
    void testImportsSceneryDirectory() throws Exception {
        ImportStatistics stats = importService.importData(sceneryRoot.toString(), dataDir.toString());

        assertEquals(2, stats.getFilesFound());
        assertEquals(2, stats.getFilesImported());
        assertEquals(0, stats.getFilesFailed());
        assertEquals(3, stats.getAirportsWritten());
        assertEquals(1, stats.getIgnoredAirports());
        assertFalse(stats.hasErrors());

        try (Connection connection = openDatabase()) {
            assertEquals(2, count(connection, "scenery_file"));
            assertEquals(4, count(connection, "airport_file"));
            assertEquals(3, count(connection, "airport"));
            assertEquals(4, count(connection, "runway"));
            assertEquals(8, count(connection, "runway_end"));
            assertEquals(9, count(connection, "start"));
            assertEquals(1, count(connection, "helipad"));
            assertEquals(2, count(connection, "com"));
            assertEquals(4, count(connection, "parking"));
            assertEquals(1, count(connection, "apron"));
            assertEquals(1, count(connection, "taxi_path"));
        }
    }

    @Test
    void testFirstFileWinsForDuplicateAirport() throws Exception {
        importService.importData(sceneryRoot.toString(), dataDir.toString());

        try (Connection connection = openDatabase();
             PreparedStatement stmt = connection.prepareStatement("""
                     SELECT a.name, a.is_closed, a.rating, a.largest_parking_gate, a.num_runway_end_vasi,
                            a.num_runway_end_als, a.tower_frequency, a.atis_frequency, a.has_tower_object, f.filename,
                            f.local_path
                     FROM airport a JOIN scenery_file f ON f.file_id = a.file_id
                     WHERE a.ident = ?
                     """)) {
            stmt.setString(1, "EDDT");
            try (ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("Tegel", rs.getString("name"));
                assertEquals(1, rs.getInt("is_closed"));
                assertEquals(4, rs.getInt("rating"));
                assertEquals("GH", rs.getString("largest_parking_gate"));
                assertEquals(2, rs.getInt("num_runway_end_vasi"));
                assertEquals(2, rs.getInt("num_runway_end_als"));
                assertEquals(118800, rs.getInt("tower_frequency"));
                assertEquals(125900, rs.getInt("atis_frequency"));
                assertEquals(1, rs.getInt("has_tower_object"));
                assertTrue(rs.getString("local_path").contains("custom"));
                assertFalse(rs.next());
            }
        }
    }

    @Test
    void testFuelFromParkingAndTrucks() throws Exception {
        importService.importData(sceneryRoot.toString(), dataDir.toString());

        try (Connection connection = openDatabase();
             PreparedStatement stmt = connection.prepareStatement(
                     "SELECT has_avgas, has_jetfuel, city, num_helipad FROM airport WHERE ident = ?")) {
            stmt.setString(1, "EFHK");
            try (ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals(1, rs.getInt("has_avgas"));
                assertEquals(1, rs.getInt("has_jetfuel"));
                assertEquals("Vantaa", rs.getString("city"));
                assertEquals(1, rs.getInt("num_helipad"));
            }
        }
    }

    @Test
    void testExcludedPathIsSkipped() throws Exception {
        config.getFilterConfiguration().setExcludePaths(List.of("custom"));

        ImportStatistics stats = importService.importData(sceneryRoot.toString(), dataDir.toString());

        assertEquals(1, stats.getFilesFound());
        assertEquals(1, stats.getFilesSkipped());
        assertEquals(2, stats.getAirportsWritten());
        try (Connection connection = openDatabase();
             PreparedStatement stmt = connection.prepareStatement("SELECT name FROM airport WHERE ident = ?")) {
            stmt.setString(1, "EDDT");
            try (ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("Berlin Tegel", rs.getString("name"));
            }
            assertEquals(2, count(connection, "runway"));
        }
    }

    @Test
    void testExcludedAirportIsNotWritten() throws Exception {
        config.getFilterConfiguration().setExcludeAirports(List.of("ED*"));

        ImportStatistics stats = importService.importData(sceneryRoot.toString(), dataDir.toString());

        assertEquals(2, stats.getAirportsWritten());
        assertEquals(2, stats.getIgnoredAirports());
        try (Connection connection = openDatabase()) {
            assertEquals(2, count(connection, "airport"));
            assertEquals(4, count(connection, "airport_file"));
        }
    }

    @Test
    void testSingleFileImport() throws Exception {
        Path file = sceneryRoot.resolve("global").resolve("apt.dat");

        ImportStatistics stats = importService.importData(file.toString(), dataDir.toString());

        assertEquals(1, stats.getFilesImported());
        assertEquals(2, stats.getAirportsWritten());
    }

    @Test
    void testWritesMetadataFile() throws Exception {
        importService.importData(sceneryRoot.toString(), dataDir.toString());

        Path metadata = dataDir.resolve(ImportService.METADATA_FILE);
        assertTrue(Files.exists(metadata));
        JsonNode json = new ObjectMapper().readTree(metadata.toFile());
        assertEquals(2, json.get("files").asLong());
        assertEquals(3, json.get("airports").asLong());
        assertNotNull(json.get("importTimestamp").asText());
    }

    @Test
    void testReimportRecreatesSchema() throws Exception {
        importService.importData(sceneryRoot.toString(), dataDir.toString());
        importService.importData(sceneryRoot.toString(), dataDir.toString());

        try (Connection connection = openDatabase()) {
            assertEquals(3, count(connection, "airport"));
        }
    }

    @Test
    void testFailedFileReleasesItsAirports() throws Exception {
        String truncated = String.join("\n",
                                       "I",
                                       "1200 Version",
                                       "1 1503 0 0 EDDT Tegel",
                                       "100 46.00 2 0 0.25 1 3 1 08L 52.55542 13.26290 0.00 0.00 3 8 1 1 26R 52.56305 "
                                               + "13.31289 0.00 0.00 3 8 1 1",
                                       "");
        Reader failing = new Reader() {
            private final StringReader content = new StringReader(truncated);

            @Override
            public int read(char[] buffer, int offset, int length) throws IOException {
                int read = content.read(buffer, offset, length);
                if (read < 0) {
                    throw new IOException("Connection to scenery share lost");
                }
                return read;
            }

            @Override
            public void close() {
                content.close();
            }
        };

        ImportStatistics stats = new ImportStatistics();
        AirportIndex airportIndex = new AirportIndex(SceneryFilter.INCLUDE_ALL);
        try (SqliteAirportStore store = new SqliteAirportStore(dataDir.resolve("airports.db"), true)) {
            importService.importFile(new SceneryFile("/share/apt.dat", "apt.dat", truncated.length()),
                                     () -> new BufferedReader(failing), store, airportIndex, stats);

            assertEquals(1, stats.getErrors().size());
            assertEquals(ImportStatistics.Kind.IO, stats.getErrors().get(0).kind());
            assertFalse(airportIndex.contains("EDDT"));

            importService.importFile(sceneryRoot.resolve("global").resolve("apt.dat"), store, airportIndex, stats);

            assertEquals(1, stats.getFilesImported());
            assertEquals(1, store.countRows("scenery_file"));
            assertEquals(2, store.countRows("airport"));
            assertTrue(airportIndex.contains("EDDT"));
        }
    }

    @Test
    void testMissingSceneryPath() {
        Path missing = dataDir.resolve("does-not-exist");
        assertThrows(IOException.class, () -> importService.importData(missing.toString(), dataDir.toString()));
    }

    @Test
    void testDiscoveryHonorsFileNamePattern() throws Exception {
        config.getImportConfiguration().setFileNamePattern("*.txt");

        ImportStatistics stats = new ImportStatistics();
        List<Path> files = importService.discoverFiles(sceneryRoot, SceneryFilter.INCLUDE_ALL, stats);

        assertTrue(files.isEmpty());
    }

    @Test
    void testDiscoveryIsSorted() throws Exception {
        List<Path> files = importService.discoverFiles(sceneryRoot, SceneryFilter.INCLUDE_ALL, new ImportStatistics());

        assertEquals(2, files.size());
        assertEquals("custom", files.get(0).getParent().getFileName().toString());
        assertEquals("global", files.get(1).getParent().getFileName().toString());
    }
}
