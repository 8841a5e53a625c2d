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

import com.dedicatedcode.kentta.model.ApproachLight;
import com.dedicatedcode.kentta.model.Marking;
import com.dedicatedcode.kentta.model.Runway;
import com.dedicatedcode.kentta.model.RunwayEnd;
import com.dedicatedcode.kentta.model.RunwayEndType;
import com.dedicatedcode.kentta.model.Start;
import com.dedicatedcode.kentta.model.StartType;
import com.dedicatedcode.kentta.model.Surface;
import com.dedicatedcode.kentta.service.GeoHelper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import static com.dedicatedcode.kentta.service.importer.airport.TestAirports.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RunwayAssemblerTest {

    // 0.01 degrees of longitude on the equator, 1111.95 m
    private static final String LAND_RUNWAY =
            "100 45.00 1 1 0.25 1 2 1 09 0.0 0.0 0.00 0.00 3 8 1 0 27 0.0 0.01 0.00 0.00 3 0 0 0";

    private final GeoHelper geoHelper = new GeoHelper();
    private AirportAccumulator airport;
    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        airport = TestAirports.writing("TEST");
        diagnostics = TestAirports.diagnostics();
    }

    @Test
    void testLandRunwayGeometry() {
        Runway runway = new RunwayAssembler(geoHelper, 0, diagnostics).assemble(airport, row(LAND_RUNWAY));

        assertEquals(3648, runway.lengthFt());
        assertEquals(148, runway.widthFt());
        assertEquals(90.0, runway.heading(), 1e-6);
        assertEquals(0.005, runway.center().x, 1e-9);
        assertEquals(0.0, runway.center().y, 1e-9);
        assertEquals(Surface.ASPHALT, runway.surface());
        assertEquals(Surface.ASPHALT, runway.shoulderSurface().orElseThrow());
        assertEquals("M", runway.edgeLights().orElseThrow());
        assertEquals("M", runway.centerLights().orElseThrow());
        assertEquals(Marking.PAP.flags(), runway.markingFlags());
    }

    @Test
    void testLengthPrecision() {
        Runway runway = new RunwayAssembler(geoHelper, 2, diagnostics).assemble(airport, row(LAND_RUNWAY));

        assertEquals(3600, runway.lengthFt());
        assertEquals(100, runway.widthFt());
    }

    @Test
    void testStagesEndsAndStarts() {
        Runway runway = new RunwayAssembler(geoHelper, 0, diagnostics).assemble(airport, row(LAND_RUNWAY));

        RunwayEnd primary = airport.index().runwayEnd(runway.primaryEnd());
        RunwayEnd secondary = airport.index().runwayEnd(runway.secondaryEnd());
        assertEquals("09", primary.name());
        assertEquals(RunwayEndType.PRIMARY, primary.endType());
        assertEquals(ApproachLight.MALSR, primary.approachLight());
        assertTrue(primary.touchdownLights());
        assertFalse(primary.reil());
        assertEquals("27", secondary.name());
        assertEquals(RunwayEndType.SECONDARY, secondary.endType());
        assertEquals(270.0, secondary.heading(), 1e-6);

        assertThat(airport.starts()).hasSize(2);
        Start start = airport.starts().get(1);
        assertEquals(StartType.RUNWAY, start.type());
        assertEquals("27", start.number());
        assertEquals(runway.secondaryEnd(), start.runwayEndHandle().orElseThrow());
    }

    @Test
    void testCountersAndLongestRunway() {
        RunwayAssembler assembler = new RunwayAssembler(geoHelper, 0, diagnostics);
        assembler.assemble(airport, row(LAND_RUNWAY));
        // shorter grass strip, same length would not replace either
        assembler.assemble(airport, row("100 20.00 3 0 0.25 0 0 0 18 0.0 0.0 0 0 0 0 0 0 36 0.005 0.0 0 0 0 0 0 0"));

        AirportAccumulator.Counters counters = airport.counters();
        assertEquals(1, counters.hardRunways());
        assertEquals(1, counters.softRunways());
        assertEquals(1, counters.lightedRunways());
        assertEquals(1, counters.runwayEndsWithAls());
        assertEquals(2, counters.runways());
        assertEquals(3648, airport.longestRunway().lengthFt());
        assertEquals(Surface.ASPHALT, airport.longestRunway().surface());
        assertTrue(airport.bounds().contains(new Coordinate(0.01, 0.0)));
        assertTrue(airport.bounds().contains(new Coordinate(0.0, 0.005)));
    }

    @Test
    void testWaterRunway() {
        Runway runway = new RunwayAssembler(geoHelper, 0, diagnostics)
                .assemble(airport, row("101 30.00 0 18 0.0 0.0 36 0.01 0.0"));

        assertEquals(Surface.WATER, runway.surface());
        assertTrue(runway.shoulderSurface().isEmpty());
        assertTrue(runway.edgeLights().isEmpty());
        assertEquals(0.0, runway.heading(), 1e-6);
        assertEquals(1, airport.counters().waterRunways());
        assertEquals("18", airport.index().runwayEnd(runway.primaryEnd()).name());
        assertEquals("36", airport.index().runwayEnd(runway.secondaryEnd()).name());
    }

    @Test
    void testInvalidEdgeLightIsReported() {
        Runway runway = new RunwayAssembler(geoHelper, 0, diagnostics).assemble(airport, row(
                "100 45.00 1 0 0.25 0 7 1 09 0.0 0.0 0.00 0.00 3 0 0 0 27 0.0 0.01 0.00 0.00 3 0 0 0"));

        assertTrue(runway.edgeLights().isEmpty());
        assertEquals(1, diagnostics.count(Diagnostics.Kind.MALFORMED_ROW));
        assertEquals(1, airport.counters().lightedRunways());
    }
}
