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
import com.dedicatedcode.kentta.service.importer.SceneryRow;
import org.locationtech.jts.geom.Coordinate;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns taxi route network rows into taxi paths. Nodes are only known inside the airport that declared them.
 */
public class TaxiGraphBuilder {

    static final int NODE_LAT = 1;
    static final int NODE_LON = 2;
    static final int NODE_ID = 4;

    static final int EDGE_START = 1;
    static final int EDGE_END = 2;
    static final int EDGE_TYPE = 4;
    static final int EDGE_NAME = 5;

    private static final String RUNWAY_EDGE = "runway";

    private static final Set<String> PLACEHOLDER_NAMES = Set.of("*", "**", "+", "-", ".", "TAXIWAY", "TAXI_TO_RAMP",
                                                                "TAXI_RAMP", "TAXY_RAMP", "UNNAMED", "TWY", "TAXI");

    private final Diagnostics diagnostics;

    public TaxiGraphBuilder(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public void addNode(AirportAccumulator airport, SceneryRow row) {
        int id = row.intAt(NODE_ID);
        Coordinate position = row.coordinateAt(NODE_LAT, NODE_LON);
        airport.index().putTaxiNode(id, position);
    }

    /**
     * Resolves both endpoints and stages a taxi path. Runway edges are skipped, an edge with an unknown endpoint is
     * reported and skipped.
     */
    public Optional<TaxiPath> addEdge(AirportAccumulator airport, SceneryRow row) {
        if (RUNWAY_EDGE.equals(row.value(EDGE_TYPE))) {
            return Optional.empty();
        }
        int startId = row.intAt(EDGE_START);
        int endId = row.intAt(EDGE_END);
        Optional<Coordinate> start = airport.index().taxiNode(startId);
        Optional<Coordinate> end = airport.index().taxiNode(endId);
        if (start.isEmpty() || end.isEmpty()) {
            diagnostics.report(Diagnostics.Kind.UNRESOLVED_REFERENCE, row, "Taxi edge {} -> {} references unknown node {}",
                               startId, endId, start.isEmpty() ? startId : endId);
            return Optional.empty();
        }
        airport.extend(start.get());
        airport.extend(end.get());

        TaxiPath path = new TaxiPath(start.get(), end.get(), sanitizeName(row.value(EDGE_NAME)));
        airport.addTaxiPath(path);
        return Optional.of(path);
    }

    /**
     * Collapses the placeholder names found in many sceneries to an empty name.
     */
    public static String sanitizeName(String name) {
        String trimmed = name == null ? "" : name.trim();
        return PLACEHOLDER_NAMES.contains(trimmed.toUpperCase(Locale.ROOT)) ? "" : trimmed;
    }
}
