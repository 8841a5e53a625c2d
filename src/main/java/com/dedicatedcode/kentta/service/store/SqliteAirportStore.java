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

package com.dedicatedcode.kentta.service.store;

import com.dedicatedcode.kentta.model.AirportRecord;
import com.dedicatedcode.kentta.model.Apron;
import com.dedicatedcode.kentta.model.Com;
import com.dedicatedcode.kentta.model.CompletedAirport;
import com.dedicatedcode.kentta.model.Helipad;
import com.dedicatedcode.kentta.model.Parking;
import com.dedicatedcode.kentta.model.ParkingType;
import com.dedicatedcode.kentta.model.Runway;
import com.dedicatedcode.kentta.model.RunwayEnd;
import com.dedicatedcode.kentta.model.Start;
import com.dedicatedcode.kentta.model.Surface;
import com.dedicatedcode.kentta.model.TaxiPath;
import com.dedicatedcode.kentta.model.VasiAssignment;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Set;

/**
 * SQLite implementation of the airport store. Row ids are assigned here, continuing after the highest id already in
 * the database, so that the runway end handles of an airport can be mapped to ids before anything is written.
 */
public class SqliteAirportStore implements AirportStore {

    private static final Logger logger = LoggerFactory.getLogger(SqliteAirportStore.class);

    static final String CREATE_SCHEMA_SCRIPT = "/db/create_airport_schema.sql";
    static final String DROP_SCHEMA_SCRIPT = "/db/drop_airport_tables.sql";

    private static final Set<String> TABLES = Set.of("scenery_file", "airport_file", "airport", "runway", "runway_end",
                                                     "start", "helipad", "com", "parking", "apron", "taxi_path");

    private static final String INSERT_SCENERY_FILE = """
            INSERT INTO scenery_file (file_id, local_path, filename, size) VALUES (?, ?, ?, ?)
            """;

    private static final String INSERT_AIRPORT_FILE = """
            INSERT INTO airport_file (file_id, ident) VALUES (?, ?)
            """;

    private static final String INSERT_AIRPORT = """
            INSERT INTO airport (airport_id, file_id, ident, icao, iata, faa, name, city, country, region,
                has_avgas, has_jetfuel, has_tower_object, tower_frequency, atis_frequency, awos_frequency,
                asos_frequency, unicom_frequency, is_closed, is_military, is_addon, is_3d, rating, num_com,
                num_parking_gate, num_parking_ga_ramp, num_parking_cargo, num_parking_mil_cargo,
                num_parking_mil_combat, num_parking, num_runway_hard, num_runway_soft, num_runway_water,
                num_runway_light, num_runway_end_als, num_runway_end_vasi, num_runways, num_helipad, num_starts,
                num_apron, num_taxi_path, longest_runway_length, longest_runway_width, longest_runway_heading,
                longest_runway_surface, largest_parking_ramp, largest_parking_gate, tower_altitude, tower_lonx,
                tower_laty, altitude, left_lonx, top_laty, right_lonx, bottom_laty, lonx, laty)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?,
                ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_RUNWAY_END = """
            INSERT INTO runway_end (runway_end_id, name, end_type, offset_threshold, blast_pad, has_reils,
                has_touchdown_lights, has_closed_markings, app_light_system_type, left_vasi_type, left_vasi_pitch,
                right_vasi_type, right_vasi_pitch, heading, lonx, laty)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_RUNWAY = """
            INSERT INTO runway (runway_id, airport_id, primary_end_id, secondary_end_id, surface, shoulder, length,
                width, heading, marking_flags, edge_light, center_light, primary_lonx, primary_laty, secondary_lonx,
                secondary_laty, altitude, lonx, laty)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_START = """
            INSERT INTO start (start_id, airport_id, runway_end_id, runway_name, type, heading, altitude, lonx, laty)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_HELIPAD = """
            INSERT INTO helipad (helipad_id, airport_id, start_id, designator, surface, length, width, heading,
                is_closed, altitude, lonx, laty)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_COM = """
            INSERT INTO com (com_id, airport_id, type, frequency, name) VALUES (?, ?, ?, ?, ?)
            """;

    private static final String INSERT_PARKING = """
            INSERT INTO parking (parking_id, airport_id, type, name, airline_codes, radius, heading, has_avgas,
                has_jetfuel, lonx, laty)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_APRON = """
            INSERT INTO apron (apron_id, airport_id, surface, geometry, geometry_wkb) VALUES (?, ?, ?, ?, ?)
            """;

    private static final String INSERT_TAXI_PATH = """
            INSERT INTO taxi_path (taxi_path_id, airport_id, type, name, start_lonx, start_laty, end_lonx, end_laty)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final Connection connection;
    private final IdSequences ids = new IdSequences();
    private IdSequences committedIds;
    private Integer currentFileId;

    public SqliteAirportStore(Path databasePath, boolean recreateSchema) {
        try {
            Path parent = databasePath.toAbsolutePath().getParent();
            if (parent != null) {
                parent.toFile().mkdirs();
            }
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
            this.connection.setAutoCommit(false);
            if (recreateSchema) {
                runScript(DROP_SCHEMA_SCRIPT);
            }
            runScript(CREATE_SCHEMA_SCRIPT);
            connection.commit();
            initializeIds();
            logger.info("Airport database opened at {}", databasePath);
        } catch (SQLException e) {
            throw new StoreException("Failed to open airport database " + databasePath, e);
        }
    }

    @Override
    public int beginFile(SceneryFile file) {
        if (currentFileId != null) {
            throw new StoreException("File " + currentFileId + " is still open");
        }
        committedIds = ids.copy();
        int fileId = ++ids.file;
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_SCENERY_FILE)) {
            stmt.setInt(1, fileId);
            stmt.setString(2, file.localPath());
            stmt.setString(3, file.fileName());
            stmt.setLong(4, file.size());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to write scenery file " + file.fileName(), e);
        }
        currentFileId = fileId;
        return fileId;
    }

    @Override
    public void writeAirportFile(int fileId, String ident) {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_AIRPORT_FILE)) {
            stmt.setInt(1, fileId);
            stmt.setString(2, ident);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to write airport file entry for " + ident, e);
        }
    }

    @Override
    public int writeAirport(CompletedAirport completed) {
        if (currentFileId == null) {
            throw new StoreException("No scenery file open for airport " + completed.airport().ident());
        }
        AirportRecord airport = completed.airport();
        int airportId = ++ids.airport;
        try {
            insertAirport(airportId, airport);
            int firstEndId = ids.runwayEnd + 1;
            insertRunwayEnds(completed.runwayEnds(), airport.closed());
            insertRunways(airportId, firstEndId, airport.elevationFt(), completed.runways(), completed.runwayEnds());
            int firstStartId = ids.start + 1;
            insertStarts(airportId, firstEndId, airport.elevationFt(), completed.starts());
            insertHelipads(airportId, firstStartId, airport.elevationFt(), completed.helipads());
            insertComs(airportId, completed.coms());
            insertParkings(airportId, completed.parkings());
            insertAprons(airportId, completed.aprons());
            insertTaxiPaths(airportId, completed.taxiPaths());
        } catch (SQLException e) {
            throw new StoreException("Failed to write airport " + airport.ident(), e);
        }
        return airportId;
    }

    @Override
    public void commitFile() {
        try {
            connection.commit();
            currentFileId = null;
            committedIds = ids.copy();
        } catch (SQLException e) {
            throw new StoreException("Failed to commit scenery file", e);
        }
    }

    @Override
    public void rollbackFile() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new StoreException("Failed to roll back scenery file", e);
        } finally {
            if (committedIds != null) {
                ids.restore(committedIds);
            }
            currentFileId = null;
        }
    }

    /**
     * Number of rows in one of the airport tables.
     */
    public long countRows(String table) {
        if (!TABLES.contains(table)) {
            throw new IllegalArgumentException("Unknown table " + table);
        }
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            return rs.next() ? rs.getLong(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count rows of " + table, e);
        }
    }

    @Override
    public void close() {
        try {
            if (currentFileId != null) {
                logger.warn("Closing airport database with open file {}, rolling back", currentFileId);
                connection.rollback();
            }
            if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            throw new StoreException("Error closing airport database connection", e);
        }
    }

    private void insertAirport(int airportId, AirportRecord airport) throws SQLException {
        AirportRecord.AirportMetadata metadata = airport.metadata();
        AirportRecord.AirportFrequencies frequencies = airport.frequencies();
        AirportRecord.AirportCounters counters = airport.counters();
        AirportRecord.LongestRunway longest = airport.longestRunway();
        Envelope bounds = airport.bounds();
        Coordinate position = airport.position();

        try (PreparedStatement stmt = connection.prepareStatement(INSERT_AIRPORT)) {
            int i = 1;
            stmt.setInt(i++, airportId);
            stmt.setInt(i++, currentFileId);
            stmt.setString(i++, airport.ident());
            stmt.setString(i++, metadata.icao());
            stmt.setString(i++, metadata.iata());
            stmt.setString(i++, metadata.faa());
            stmt.setString(i++, airport.name());
            stmt.setString(i++, metadata.city());
            stmt.setString(i++, metadata.country());
            stmt.setString(i++, metadata.region());
            stmt.setInt(i++, bool(airport.avgas()));
            stmt.setInt(i++, bool(airport.jetFuel()));
            stmt.setInt(i++, bool(airport.towerObject().isPresent()));
            stmt.setObject(i++, frequencies.tower());
            stmt.setObject(i++, frequencies.atis());
            stmt.setObject(i++, frequencies.awos());
            stmt.setObject(i++, frequencies.asos());
            stmt.setObject(i++, frequencies.unicom());
            stmt.setInt(i++, bool(airport.closed()));
            stmt.setInt(i++, bool(airport.military()));
            stmt.setInt(i++, bool(airport.addon()));
            stmt.setInt(i++, bool(airport.threeD()));
            stmt.setInt(i++, airport.rating());
            stmt.setInt(i++, counters.coms());
            stmt.setInt(i++, counters.gates());
            stmt.setInt(i++, counters.gaRamps());
            stmt.setInt(i++, counters.cargoRamps());
            stmt.setInt(i++, counters.militaryCargoRamps());
            stmt.setInt(i++, counters.militaryCombatRamps());
            stmt.setInt(i++, counters.parkings());
            stmt.setInt(i++, counters.hardRunways());
            stmt.setInt(i++, counters.softRunways());
            stmt.setInt(i++, counters.waterRunways());
            stmt.setInt(i++, counters.lightedRunways());
            stmt.setInt(i++, counters.runwayEndsWithAls());
            stmt.setInt(i++, counters.runwayEndsWithVasi());
            stmt.setInt(i++, counters.runways());
            stmt.setInt(i++, counters.helipads());
            stmt.setInt(i++, counters.starts());
            stmt.setInt(i++, counters.aprons());
            stmt.setInt(i++, counters.taxiPaths());
            stmt.setInt(i++, longest.lengthFt());
            stmt.setInt(i++, longest.widthFt());
            stmt.setDouble(i++, longest.heading());
            stmt.setString(i++, longest.surface().dbValue());
            stmt.setString(i++, airport.largestRamp().map(ParkingType::code).orElse(null));
            stmt.setString(i++, airport.largestGate().map(ParkingType::code).orElse(null));
            stmt.setObject(i++, airport.towerObject().map(AirportRecord.Tower::altitudeFt).orElse(null));
            stmt.setObject(i++, airport.towerObject().map(t -> t.position().x).orElse(null));
            stmt.setObject(i++, airport.towerObject().map(t -> t.position().y).orElse(null));
            stmt.setInt(i++, airport.elevationFt());
            boolean hasBounds = bounds != null && !bounds.isNull();
            stmt.setObject(i++, hasBounds ? bounds.getMinX() : null);
            stmt.setObject(i++, hasBounds ? bounds.getMaxY() : null);
            stmt.setObject(i++, hasBounds ? bounds.getMaxX() : null);
            stmt.setObject(i++, hasBounds ? bounds.getMinY() : null);
            stmt.setObject(i++, position != null ? position.x : null);
            stmt.setObject(i, position != null ? position.y : null);
            stmt.executeUpdate();
        }
    }

    private void insertRunwayEnds(List<RunwayEnd> ends, boolean closed) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_RUNWAY_END)) {
            for (RunwayEnd end : ends) {
                VasiAssignment vasi = end.leftVasi().orElse(null);
                stmt.setInt(1, ++ids.runwayEnd);
                stmt.setString(2, end.name());
                stmt.setString(3, end.endType().dbValue());
                stmt.setInt(4, end.displacedThresholdFt());
                stmt.setInt(5, end.blastPadFt());
                stmt.setInt(6, bool(end.reil()));
                stmt.setInt(7, bool(end.touchdownLights()));
                stmt.setInt(8, bool(closed));
                stmt.setString(9, end.approachLight().dbValue().orElse(null));
                stmt.setString(10, vasi != null ? vasi.type().dbValue() : null);
                stmt.setObject(11, vasi != null ? vasi.pitch() : null);
                stmt.setString(12, vasi != null ? "UNKN" : null);
                stmt.setObject(13, vasi != null ? 0.0 : null);
                stmt.setDouble(14, end.heading());
                stmt.setDouble(15, end.position().x);
                stmt.setDouble(16, end.position().y);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertRunways(int airportId, int firstEndId, int altitude, List<Runway> runways,
                               List<RunwayEnd> ends) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_RUNWAY)) {
            for (Runway runway : runways) {
                Coordinate primary = ends.get(runway.primaryEnd()).position();
                Coordinate secondary = ends.get(runway.secondaryEnd()).position();
                stmt.setInt(1, ++ids.runway);
                stmt.setInt(2, airportId);
                stmt.setInt(3, firstEndId + runway.primaryEnd());
                stmt.setInt(4, firstEndId + runway.secondaryEnd());
                stmt.setString(5, runway.surface().dbValue());
                stmt.setString(6, runway.shoulderSurface().map(Surface::dbValue).orElse(null));
                stmt.setInt(7, runway.lengthFt());
                stmt.setInt(8, runway.widthFt());
                stmt.setDouble(9, runway.heading());
                stmt.setInt(10, runway.markingFlags());
                stmt.setString(11, runway.edgeLights().orElse(null));
                stmt.setString(12, runway.centerLights().orElse(null));
                stmt.setDouble(13, primary.x);
                stmt.setDouble(14, primary.y);
                stmt.setDouble(15, secondary.x);
                stmt.setDouble(16, secondary.y);
                stmt.setInt(17, altitude);
                stmt.setDouble(18, runway.center().x);
                stmt.setDouble(19, runway.center().y);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertStarts(int airportId, int firstEndId, int altitude, List<Start> starts) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_START)) {
            for (Start start : starts) {
                stmt.setInt(1, ++ids.start);
                stmt.setInt(2, airportId);
                stmt.setObject(3, start.runwayEndHandle().map(handle -> firstEndId + handle).orElse(null));
                stmt.setString(4, start.number());
                stmt.setString(5, start.type().dbValue());
                stmt.setDouble(6, start.heading());
                stmt.setInt(7, altitude);
                stmt.setDouble(8, start.position().x);
                stmt.setDouble(9, start.position().y);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertHelipads(int airportId, int firstStartId, int altitude, List<Helipad> helipads)
            throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_HELIPAD)) {
            for (Helipad helipad : helipads) {
                stmt.setInt(1, ++ids.helipad);
                stmt.setInt(2, airportId);
                stmt.setInt(3, firstStartId + helipad.startIndex());
                stmt.setString(4, helipad.designator());
                stmt.setString(5, helipad.surface().dbValue());
                stmt.setInt(6, helipad.lengthFt());
                stmt.setInt(7, helipad.widthFt());
                stmt.setDouble(8, helipad.heading());
                stmt.setInt(9, bool(helipad.closed()));
                stmt.setInt(10, altitude);
                stmt.setDouble(11, helipad.position().x);
                stmt.setDouble(12, helipad.position().y);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertComs(int airportId, List<Com> coms) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_COM)) {
            for (Com com : coms) {
                stmt.setInt(1, ++ids.com);
                stmt.setInt(2, airportId);
                stmt.setString(3, com.type().dbValue());
                stmt.setInt(4, com.frequency());
                stmt.setString(5, com.name());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertParkings(int airportId, List<Parking> parkings) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_PARKING)) {
            for (Parking parking : parkings) {
                stmt.setInt(1, ++ids.parking);
                stmt.setInt(2, airportId);
                stmt.setString(3, parking.type().code());
                stmt.setString(4, parking.name());
                stmt.setString(5, parking.airlineCodes().isEmpty() ? null : String.join(",", parking.airlineCodes()));
                stmt.setDouble(6, parking.radius());
                stmt.setDouble(7, parking.heading());
                stmt.setInt(8, bool(parking.avgas()));
                stmt.setInt(9, bool(parking.jetFuel()));
                stmt.setDouble(10, parking.position().x);
                stmt.setDouble(11, parking.position().y);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertAprons(int airportId, List<Apron> aprons) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_APRON)) {
            for (Apron apron : aprons) {
                stmt.setInt(1, ++ids.apron);
                stmt.setInt(2, airportId);
                stmt.setString(3, apron.surface().dbValue());
                stmt.setBytes(4, apron.geometry());
                stmt.setBytes(5, apron.wkbGeometry().orElse(null));
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void insertTaxiPaths(int airportId, List<TaxiPath> taxiPaths) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(INSERT_TAXI_PATH)) {
            for (TaxiPath path : taxiPaths) {
                stmt.setInt(1, ++ids.taxiPath);
                stmt.setInt(2, airportId);
                stmt.setString(3, "T");
                stmt.setString(4, path.name());
                stmt.setDouble(5, path.start().x);
                stmt.setDouble(6, path.start().y);
                stmt.setDouble(7, path.end().x);
                stmt.setDouble(8, path.end().y);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void runScript(String resource) throws SQLException {
        String script;
        try (InputStream in = SqliteAirportStore.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new StoreException("Schema script " + resource + " not found on classpath");
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Failed to read schema script " + resource, e);
        }
        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\n")) {
            if (!line.trim().startsWith("--")) {
                cleaned.append(line).append('\n');
            }
        }
        try (Statement stmt = connection.createStatement()) {
            for (String sql : cleaned.toString().split(";")) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
        }
        logger.debug("Executed schema script {}", resource);
    }

    private void initializeIds() throws SQLException {
        ids.file = maxId("scenery_file", "file_id");
        ids.airport = maxId("airport", "airport_id");
        ids.runway = maxId("runway", "runway_id");
        ids.runwayEnd = maxId("runway_end", "runway_end_id");
        ids.start = maxId("start", "start_id");
        ids.helipad = maxId("helipad", "helipad_id");
        ids.com = maxId("com", "com_id");
        ids.parking = maxId("parking", "parking_id");
        ids.apron = maxId("apron", "apron_id");
        ids.taxiPath = maxId("taxi_path", "taxi_path_id");
        committedIds = ids.copy();
    }

    private int maxId(String table, String column) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COALESCE(MAX(" + column + "), 0) FROM " + table)) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static int bool(boolean value) {
        return value ? 1 : 0;
    }

    private static final class IdSequences {
        int file;
        int airport;
        int runway;
        int runwayEnd;
        int start;
        int helipad;
        int com;
        int parking;
        int apron;
        int taxiPath;

        IdSequences copy() {
            IdSequences copy = new IdSequences();
            copy.restore(this);
            return copy;
        }

        void restore(IdSequences other) {
            file = other.file;
            airport = other.airport;
            runway = other.runway;
            runwayEnd = other.runwayEnd;
            start = other.start;
            helipad = other.helipad;
            com = other.com;
            parking = other.parking;
            apron = other.apron;
            taxiPath = other.taxiPath;
        }
    }
}
