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

package com.dedicatedcode.kentta.service.importer.airport;

import com.dedicatedcode.kentta.model.AirportRecord;
import com.dedicatedcode.kentta.model.CompletedAirport;
import com.dedicatedcode.kentta.model.Runway;
import com.dedicatedcode.kentta.service.GeoHelper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import static com.dedicatedcode.kentta.service.importer.airport.TestAirports.row;
import static org.junit.jupiter.api.Assertions.*;

class AggregateFinalizerTest {

    private AirportAccumulator airport;
    private Diagnostics diagnostics;
    private AggregateFinalizer finalizer;

    @BeforeEach
    void setUp() {
        airport = TestAirports.writing("TEST");
        diagnostics = TestAirports.diagnostics();
        finalizer = new AggregateFinalizer(SceneryFileContext.of(1, "apt.dat"), diagnostics);
    }

    @Test
    void testRating() {
        assertEquals(0, AggregateFinalizer.rating(false, false, false, 0, 0, 0));
        assertEquals(0, AggregateFinalizer.rating(false, true, true, 0, 0, 0));
        assertEquals(1, AggregateFinalizer.rating(false, false, false, 3, 0, 0));
        assertEquals(2, AggregateFinalizer.rating(false, false, true, 3, 0, 0));
        assertEquals(4, AggregateFinalizer.rating(false, false, true, 3, 2, 1));
        assertEquals(5, AggregateFinalizer.rating(true, true, true, 3, 2, 1));
    }

    @Test
    void testDatumNearRectangleIsReferencePoint() {
        airport.extend(new Coordinate(13.0, 52.0));
        airport.extend(new Coordinate(13.1, 52.1));
        // just outside the rectangle but within the 100 m margin
        airport.setDatumLat(52.1005);
        airport.setDatumLon(13.05);

        CompletedAirport completed = finalizer.finish(airport);

        assertEquals(new Coordinate(13.05, 52.1005), completed.airport().position());
        assertEquals(new Envelope(13.0, 13.1, 52.0, 52.1), completed.airport().bounds());
        assertEquals(0, diagnostics.total());
    }

    @Test
    void testSingleRunwayCenterIsReferencePoint() {
        Runway runway = new RunwayAssembler(new GeoHelper(), 0, diagnostics).assemble(airport, row(
                "100 45.00 1 0 0.25 0 0 0 09 0.0 0.0 0 0 0 0 0 0 27 0.0 0.01 0 0 0 0 0 0"));
        airport.extend(new Coordinate(0.02, 0.01));
        // far away datum is ignored
        airport.setDatumLat(10.0);
        airport.setDatumLon(10.0);

        CompletedAirport completed = finalizer.finish(airport);

        assertEquals(runway.center(), completed.airport().position());
    }

    @Test
    void testRectangleCenterWithSeveralRunways() {
        RunwayAssembler assembler = new RunwayAssembler(new GeoHelper(), 0, diagnostics);
        assembler.assemble(airport, row("100 45.00 1 0 0.25 0 0 0 09 0.0 0.0 0 0 0 0 0 0 27 0.0 0.01 0 0 0 0 0 0"));
        assembler.assemble(airport, row("100 45.00 1 0 0.25 0 0 0 18 0.02 0.0 0 0 0 0 0 0 36 0.0 0.0 0 0 0 0 0 0"));

        CompletedAirport completed = finalizer.finish(airport);

        assertEquals(new Coordinate(0.005, 0.01), completed.airport().position());
        assertEquals(2, completed.airport().counters().runways());
        assertEquals(4, completed.runwayEnds().size());
        assertEquals(4, completed.airport().counters().starts());
    }

    @Test
    void testMissingRectangleIsSeededFromDatum() {
        airport.setDatumLat(52.5);
        airport.setDatumLon(13.3);

        CompletedAirport completed = finalizer.finish(airport);

        Envelope bounds = completed.airport().bounds();
        assertEquals(1, diagnostics.count(Diagnostics.Kind.DEGENERATE_GEOMETRY));
        assertEquals(new Coordinate(13.3, 52.5), completed.airport().position());
        assertEquals(2 * GeoHelper.ONE_MINUTE, bounds.getWidth(), 1e-12);
        assertEquals(2 * GeoHelper.ONE_MINUTE, bounds.getHeight(), 1e-12);
        assertTrue(bounds.contains(new Coordinate(13.3, 52.5)));
    }

    @Test
    void testNothingToSeedFrom() {
        CompletedAirport completed = finalizer.finish(airport);

        assertEquals(2, diagnostics.count(Diagnostics.Kind.DEGENERATE_GEOMETRY));
        assertNull(completed.airport().position());
        assertTrue(completed.airport().bounds().isNull());
    }

    @Test
    void testPointRectangleIsInflated() {
        airport.extend(new Coordinate(10.0, 50.0));

        CompletedAirport completed = finalizer.finish(airport);

        Envelope bounds = completed.airport().bounds();
        assertEquals(2 * GeoHelper.ONE_MINUTE, bounds.getWidth(), 1e-12);
        assertEquals(new Coordinate(10.0, 50.0), completed.airport().position());
        assertEquals(0, diagnostics.total());
    }

    @Test
    void testRecordCarriesAccumulatedValues() {
        airport.setMetadata("city", "Berlin");
        airport.setMetadata("icao_code", "EDDT");
        airport.setTowerFrequency(118800);
        airport.setTower(new Coordinate(13.0, 52.0), 130);
        airport.extend(new Coordinate(13.0, 52.0));

        AirportRecord record = finalizer.finish(airport).airport();

        assertEquals("TEST", record.ident());
        assertEquals("Test Field", record.name());
        assertEquals("Berlin", record.metadata().city());
        assertEquals("EDDT", record.metadata().icao());
        assertEquals(Integer.valueOf(118800), record.frequencies().tower());
        assertEquals(130, record.towerObject().orElseThrow().altitudeFt());
        assertEquals(0, record.rating());
    }
}
