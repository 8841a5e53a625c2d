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

import com.dedicatedcode.kentta.service.GeoHelper;
import com.dedicatedcode.kentta.service.importer.SceneryFilter;
import com.dedicatedcode.kentta.service.importer.SceneryRow;
import com.dedicatedcode.kentta.service.importer.airport.AirportIndex;
import com.dedicatedcode.kentta.service.importer.airport.RowDispatcher;
import com.dedicatedcode.kentta.service.importer.airport.SceneryFileContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class SqliteAirportStoreTest {

    private static final String[] AIRPORT = {
            "1 100 0 0 EDDT Berlin Tegel",
            "1302 city Berlin",
            "100 45.00 1 0 0.25 0 2 0 08L 52.555 13.263 0 0 3 8 1 1 26R 52.563 13.313 0 0 3 0 0 0",
            "21 52.555 13.268 2 82.50 3.00 26R PAPI",
            "102 H1 52.550 13.270 0.00 20.00 20.00 1 0 0 0.25 0",
            "54 11880 TOWER",
            "110 1 0.25 0.00 Apron",
            "111 52.557 13.280",
            "111 52.557 13.290",
            "113 52.558 13.290",
            "1300 52.5575 13.283 180.00 gate jets A1",
            "1301 E airline DLH,BER",
            "1201 52.556 13.270 both 0 A_start",
            "1201 52.5565 13.280 both 1 A_end",
            "1202 0 1 twoway taxiway A"
    };

    @TempDir
    Path tempDir;

    private static int importAirport(AirportStore store, String fileName) {
        int fileId = store.beginFile(new SceneryFile("/scenery/" + fileName, fileName, 1234));
        RowDispatcher dispatcher = new RowDispatcher(SceneryFileContext.of(fileId, fileName),
                                                     new AirportIndex(SceneryFilter.INCLUDE_ALL), store,
                                                     new GeoHelper());
        int line = 0;
        for (String row : AIRPORT) {
            dispatcher.accept(SceneryRow.parse(row, ++line));
        }
        dispatcher.finish();
        return fileId;
    }

    @Test
    void testWritesAirportWithChildren() throws SQLException {
        Path db = tempDir.resolve("airports.db");
        try (SqliteAirportStore store = new SqliteAirportStore(db, true)) {
            importAirport(store, "apt.dat");
            store.commitFile();

            assertEquals(1, store.countRows("scenery_file"));
            assertEquals(1, store.countRows("airport_file"));
            assertEquals(1, store.countRows("airport"));
            assertEquals(1, store.countRows("runway"));
            assertEquals(2, store.countRows("runway_end"));
            assertEquals(3, store.countRows("start"));
            assertEquals(1, store.countRows("helipad"));
            assertEquals(1, store.countRows("com"));
            assertEquals(1, store.countRows("parking"));
            assertEquals(1, store.countRows("apron"));
            assertEquals(1, store.countRows("taxi_path"));
        }

        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db)) {
            try (PreparedStatement stmt = connection.prepareStatement("""
                    SELECT a.ident, a.city, a.num_runways, a.num_runway_end_vasi, a.num_runway_end_als,
                           a.tower_frequency, a.largest_parking_gate, a.has_tower_object, a.rating,
                           a.left_lonx, a.right_lonx
                    FROM airport a
                    """);
                 ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("EDDT", rs.getString("ident"));
                assertEquals("Berlin", rs.getString("city"));
                assertEquals(1, rs.getInt("num_runways"));
                assertEquals(1, rs.getInt("num_runway_end_vasi"));
                assertEquals(1, rs.getInt("num_runway_end_als"));
                assertEquals(118800, rs.getInt("tower_frequency"));
                assertEquals("GH", rs.getString("largest_parking_gate"));
                assertEquals(0, rs.getInt("has_tower_object"));
                assertEquals(3, rs.getInt("rating"));
                assertEquals(13.263, rs.getDouble("left_lonx"), 1e-9);
                assertEquals(13.313, rs.getDouble("right_lonx"), 1e-9);
            }

            try (PreparedStatement stmt = connection.prepareStatement("""
                    SELECT p.name AS primary_name, s.name AS secondary_name, s.left_vasi_type, p.left_vasi_type AS p_vasi,
                           p.app_light_system_type, r.primary_lonx
                    FROM runway r
                    JOIN runway_end p ON p.runway_end_id = r.primary_end_id
                    JOIN runway_end s ON s.runway_end_id = r.secondary_end_id
                    """);
                 ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("08L", rs.getString("primary_name"));
                assertEquals("26R", rs.getString("secondary_name"));
                assertEquals("PAPI4", rs.getString("left_vasi_type"));
                assertNull(rs.getString("p_vasi"));
                assertEquals("MALSR", rs.getString("app_light_system_type"));
                assertEquals(13.263, rs.getDouble("primary_lonx"), 1e-9);
            }

            try (PreparedStatement stmt = connection.prepareStatement("""
                    SELECT h.designator, s.runway_name, s.type
                    FROM helipad h JOIN start s ON s.start_id = h.start_id
                    """);
                 ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("H1", rs.getString("designator"));
                assertEquals("01", rs.getString("runway_name"));
                assertEquals("H", rs.getString("type"));
            }

            try (PreparedStatement stmt = connection.prepareStatement(
                    "SELECT airline_codes, radius, type FROM parking");
                 ResultSet rs = stmt.executeQuery()) {
                assertTrue(rs.next());
                assertEquals("DLH,BER", rs.getString("airline_codes"));
                assertEquals(100, rs.getInt("radius"));
                assertEquals("GH", rs.getString("type"));
            }
        }
    }

    @Test
    void testRollbackDiscardsFileAndReusesIds() {
        try (SqliteAirportStore store = new SqliteAirportStore(tempDir.resolve("airports.db"), true)) {
            int first = importAirport(store, "broken.dat");
            store.rollbackFile();

            assertEquals(0, store.countRows("scenery_file"));
            assertEquals(0, store.countRows("airport"));
            assertEquals(0, store.countRows("runway_end"));

            int second = importAirport(store, "apt.dat");
            store.commitFile();

            assertEquals(first, second);
            assertEquals(1, store.countRows("airport"));
        }
    }

    @Test
    void testReopenWithoutRecreateContinuesIds() {
        Path db = tempDir.resolve("airports.db");
        try (SqliteAirportStore store = new SqliteAirportStore(db, true)) {
            importAirport(store, "first.dat");
            store.commitFile();
        }
        try (SqliteAirportStore store = new SqliteAirportStore(db, false)) {
            int fileId = importAirport(store, "second.dat");
            store.commitFile();

            assertEquals(2, fileId);
            assertEquals(2, store.countRows("airport"));
            assertEquals(4, store.countRows("runway_end"));
        }
        try (SqliteAirportStore store = new SqliteAirportStore(db, true)) {
            assertEquals(0, store.countRows("airport"));
        }
    }

    @Test
    void testUnknownTableIsRejected() {
        try (SqliteAirportStore store = new SqliteAirportStore(tempDir.resolve("airports.db"), true)) {
            assertThrows(IllegalArgumentException.class, () -> store.countRows("sqlite_master"));
        }
    }

    @Test
    void testBeginFileTwiceFails() {
        try (SqliteAirportStore store = new SqliteAirportStore(tempDir.resolve("airports.db"), true)) {
            store.beginFile(new SceneryFile("/a", "a", 0));
            assertThrows(StoreException.class, () -> store.beginFile(new SceneryFile("/b", "b", 0)));
        }
    }
}
