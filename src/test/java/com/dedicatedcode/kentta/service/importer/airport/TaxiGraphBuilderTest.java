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

import com.dedicatedcode.kentta.model.TaxiPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.Optional;

import static com.dedicatedcode.kentta.service.importer.airport.TestAirports.row;
import static org.junit.jupiter.api.Assertions.*;

class TaxiGraphBuilderTest {

    private AirportAccumulator airport;
    private Diagnostics diagnostics;
    private TaxiGraphBuilder builder;

    @BeforeEach
    void setUp() {
        airport = TestAirports.writing("TEST");
        diagnostics = TestAirports.diagnostics();
        builder = new TaxiGraphBuilder(diagnostics);
        builder.addNode(airport, row("1201 52.50 13.30 both 0 A_start"));
        builder.addNode(airport, row("1201 52.51 13.31 both 1 A_end"));
    }

    @Test
    void testEdgeResolvesNodes() {
        Optional<TaxiPath> path = builder.addEdge(airport, row("1202 0 1 twoway taxiway A"));

        assertTrue(path.isPresent());
        assertEquals(new Coordinate(13.30, 52.50), path.get().start());
        assertEquals(new Coordinate(13.31, 52.51), path.get().end());
        assertEquals("A", path.get().name());
        assertEquals(1, airport.taxiPaths().size());
        assertTrue(airport.bounds().contains(new Coordinate(13.31, 52.51)));
    }

    @Test
    void testRunwayEdgesAreSkipped() {
        assertTrue(builder.addEdge(airport, row("1202 0 1 twoway runway 09_27")).isEmpty());
        assertTrue(airport.taxiPaths().isEmpty());
        assertEquals(0, diagnostics.total());
    }

    @Test
    void testUnknownNodeIsReported() {
        assertTrue(builder.addEdge(airport, row("1202 0 7 twoway taxiway B")).isEmpty());
        assertEquals(1, diagnostics.count(Diagnostics.Kind.UNRESOLVED_REFERENCE));
    }

    @Test
    void testPlaceholderNames() {
        assertEquals("", TaxiGraphBuilder.sanitizeName("*"));
        assertEquals("", TaxiGraphBuilder.sanitizeName("taxi_to_ramp"));
        assertEquals("", TaxiGraphBuilder.sanitizeName(null));
        assertEquals("B1", TaxiGraphBuilder.sanitizeName(" B1 "));

        TaxiPath unnamed = builder.addEdge(airport, row("1202 0 1 twoway taxiway")).orElseThrow();
        assertEquals("", unnamed.name());
    }
}
