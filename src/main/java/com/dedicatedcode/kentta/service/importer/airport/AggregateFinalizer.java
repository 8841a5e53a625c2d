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
import com.dedicatedcode.kentta.service.GeoHelper;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Optional;

/**
 * Derives the values only known once an airport is complete: bounding rectangle, reference point and rating.
 */
public class AggregateFinalizer {

    static final int MAX_RATING = 5;

    private final SceneryFileContext context;
    private final Diagnostics diagnostics;

    public AggregateFinalizer(SceneryFileContext context, Diagnostics diagnostics) {
        this.context = context;
        this.diagnostics = diagnostics;
    }

    public CompletedAirport finish(AirportAccumulator airport) {
        Envelope bounds = new Envelope(airport.bounds());
        Optional<Coordinate> datum = airport.datum();
        Coordinate position = null;

        if (bounds.isNull()) {
            Optional<Coordinate> seed = datum.or(airport::longestRunwayCenter);
            diagnostics.report(Diagnostics.Kind.DEGENERATE_GEOMETRY, location(), "{} has no bounding rectangle",
                               airport.ident());
            if (seed.isPresent()) {
                bounds.expandToInclude(seed.get());
                position = seed.get();
            } else {
                diagnostics.report(Diagnostics.Kind.DEGENERATE_GEOMETRY, location(),
                                   "Could not determine a bounding rectangle for {}", airport.ident());
            }
        } else {
            position = referencePoint(bounds, datum, airport);
        }

        if (!bounds.isNull() && GeoHelper.isPoint(bounds)) {
            bounds.expandBy(GeoHelper.ONE_MINUTE);
        }
        if (position == null && !bounds.isNull()) {
            position = bounds.centre();
        }

        AirportRecord.AirportCounters counters = counters(airport);
        boolean hasTower = airport.tower().isPresent();
        int rating = rating(context.addon(), context.threeD(), hasTower, counters.taxiPaths(), counters.parkings(),
                            counters.aprons());

        AirportRecord record = new AirportRecord(
                airport.ident(),
                airport.name(),
                airport.elevationFt(),
                airport.closed(),
                airport.military(),
                context.addon(),
                context.threeD(),
                position,
                bounds,
                airport.metadata(),
                airport.frequencies(),
                airport.tower().orElse(null),
                airport.longestRunway(),
                counters,
                airport.largestGate().orElse(null),
                airport.largestRamp().orElse(null),
                airport.avgas(),
                airport.jetFuel(),
                rating);

        return new CompletedAirport(record,
                                    airport.runways(),
                                    airport.index().runwayEnds(),
                                    airport.starts(),
                                    airport.helipads(),
                                    airport.coms(),
                                    airport.parkings(),
                                    airport.aprons(),
                                    airport.taxiPaths());
    }

    /**
     * Datum if it lies within about 100 meters of the rectangle, otherwise the center of the only runway, otherwise
     * the rectangle center.
     */
    static Coordinate referencePoint(Envelope bounds, Optional<Coordinate> datum, AirportAccumulator airport) {
        if (datum.isPresent()) {
            Envelope test = new Envelope(bounds);
            test.expandBy(GeoHelper.EPSILON_100M);
            if (test.contains(datum.get())) {
                return datum.get();
            }
        }
        if (airport.counters().runways() == 1 && airport.longestRunwayCenter().isPresent()) {
            return airport.longestRunwayCenter().get();
        }
        return bounds.centre();
    }

    /**
     * One point each for taxi paths, parking, aprons and add-on scenery, one more for a tower or 3D scenery when at
     * least one other point was given.
     */
    public static int rating(boolean addon, boolean threeD, boolean hasTower, int taxiPaths, int parkings,
                             int aprons) {
        int rating = (taxiPaths > 0 ? 1 : 0) + (parkings > 0 ? 1 : 0) + (aprons > 0 ? 1 : 0) + (addon ? 1 : 0);
        if (rating > 0 && (hasTower || threeD)) {
            rating++;
        }
        return Math.min(rating, MAX_RATING);
    }

    private static AirportRecord.AirportCounters counters(AirportAccumulator airport) {
        AirportAccumulator.Counters counters = airport.counters();
        return new AirportRecord.AirportCounters(
                counters.hardRunways(),
                counters.softRunways(),
                counters.waterRunways(),
                counters.lightedRunways(),
                airport.helipads().size(),
                airport.coms().size(),
                airport.starts().size(),
                counters.runwayEndsWithAls(),
                counters.runwayEndsWithVasi(),
                airport.aprons().size(),
                airport.taxiPaths().size(),
                airport.parkings().size(),
                counters.gates(),
                counters.gaRamps(),
                counters.cargoRamps(),
                counters.militaryCargoRamps(),
                counters.militaryCombatRamps());
    }

    private String location() {
        return context.fileName();
    }
}
