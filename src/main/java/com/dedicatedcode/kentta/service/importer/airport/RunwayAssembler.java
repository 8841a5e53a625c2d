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
import com.dedicatedcode.kentta.service.importer.RowCode;
import com.dedicatedcode.kentta.service.importer.SceneryRow;
import org.locationtech.jts.geom.Coordinate;

/**
 * Computes runway geometry from the two end positions and stages the runway, both ends and their start positions.
 */
public class RunwayAssembler {

    static final int WIDTH = 1;
    static final int SURFACE = 2;
    static final int SHOULDER = 3;
    static final int CENTER_LIGHTS = 5;
    static final int EDGE_LIGHTS = 6;

    /** Offset of the secondary end fields relative to the primary ones on land runway rows. */
    static final int SECONDARY_OFFSET = 9;
    static final int NUMBER = 8;
    static final int LAT = 9;
    static final int LON = 10;
    static final int DISPLACED_THRESHOLD = 11;
    static final int BLAST_PAD = 12;
    static final int MARKINGS = 13;
    static final int ALS = 14;
    static final int TDZ_LIGHTS = 15;
    static final int REIL = 16;

    static final int WATER_SECONDARY_OFFSET = 3;
    static final int WATER_NUMBER = 3;
    static final int WATER_LAT = 4;
    static final int WATER_LON = 5;

    private static final String[] EDGE_LIGHT_VALUES = {null, "L", "M", "H"};

    private final GeoHelper geoHelper;
    private final int lengthPrecision;
    private final Diagnostics diagnostics;

    public RunwayAssembler(GeoHelper geoHelper, int lengthPrecision, Diagnostics diagnostics) {
        this.geoHelper = geoHelper;
        this.lengthPrecision = lengthPrecision;
        this.diagnostics = diagnostics;
    }

    public Runway assemble(AirportAccumulator airport, SceneryRow row) {
        return row.code() == RowCode.WATER_RUNWAY ? assembleWater(airport, row) : assembleLand(airport, row);
    }

    Runway assembleLand(AirportAccumulator airport, SceneryRow row) {
        double widthMeter = row.doubleAt(WIDTH);
        Surface surface = Surface.fromCode(row.intAt(SURFACE));
        int shoulderCode = row.intAt(SHOULDER);
        int centerLights = row.intAt(CENTER_LIGHTS);
        int edgeLights = row.intAt(EDGE_LIGHTS);

        EndData primary = landEnd(row, 0);
        EndData secondary = landEnd(row, SECONDARY_OFFSET);

        Surface shoulder = switch (shoulderCode) {
            case 1 -> Surface.ASPHALT;
            case 2 -> Surface.CONCRETE;
            default -> null;
        };
        String edgeLight = null;
        if (edgeLights >= 0 && edgeLights < EDGE_LIGHT_VALUES.length) {
            edgeLight = EDGE_LIGHT_VALUES[edgeLights];
        } else {
            diagnostics.report(Diagnostics.Kind.MALFORMED_ROW, row, "Invalid edge light value {}", edgeLights);
        }
        String centerLight = centerLights == 1 ? "M" : null;
        int markingFlags = primary.marking.flags() | secondary.marking.flags();

        if (edgeLights > 0 || centerLights > 0) {
            airport.counters().lightedRunways++;
        }
        return stage(airport, widthMeter, surface, shoulder, edgeLight, centerLight, markingFlags, primary, secondary);
    }

    Runway assembleWater(AirportAccumulator airport, SceneryRow row) {
        double widthMeter = row.doubleAt(WIDTH);
        EndData primary = waterEnd(row, 0);
        EndData secondary = waterEnd(row, WATER_SECONDARY_OFFSET);
        return stage(airport, widthMeter, Surface.WATER, null, null, null, 0, primary, secondary);
    }

    private Runway stage(AirportAccumulator airport, double widthMeter, Surface surface, Surface shoulder,
                         String edgeLight, String centerLight, int markingFlags, EndData primary, EndData secondary) {
        double lengthMeter = geoHelper.distanceMeters(primary.position, secondary.position);
        int lengthFt = GeoHelper.meterToFeet(lengthMeter, lengthPrecision);
        int widthFt = GeoHelper.meterToFeet(widthMeter, lengthPrecision);
        double primaryHeading = geoHelper.initialBearing(primary.position, secondary.position);
        double secondaryHeading = GeoHelper.opposedCourse(primaryHeading);
        Coordinate center = geoHelper.midpoint(primary.position, secondary.position);

        airport.extend(primary.position);
        airport.extend(secondary.position);

        AirportAccumulator.Counters counters = airport.counters();
        switch (surface.surfaceClass()) {
            case HARD -> counters.hardRunways++;
            case SOFT -> counters.softRunways++;
            case WATER -> counters.waterRunways++;
        }
        airport.offerLongestRunway(lengthFt, widthFt, primaryHeading, surface, center);

        int primaryHandle = stageEnd(airport, primary, RunwayEndType.PRIMARY, primaryHeading);
        int secondaryHandle = stageEnd(airport, secondary, RunwayEndType.SECONDARY, secondaryHeading);

        Runway runway = new Runway(primaryHandle, secondaryHandle, surface, shoulder, lengthFt, widthFt,
                                   primaryHeading, center, edgeLight, centerLight, markingFlags);
        airport.addRunway(runway);

        airport.addStart(new Start(primary.name, StartType.RUNWAY, primary.position, primaryHeading, primaryHandle));
        airport.addStart(new Start(secondary.name, StartType.RUNWAY, secondary.position, secondaryHeading,
                                   secondaryHandle));
        return runway;
    }

    private int stageEnd(AirportAccumulator airport, EndData end, RunwayEndType type, double heading) {
        if (end.approachLight != ApproachLight.NO_ALS) {
            airport.counters().runwayEndsWithAls++;
        }
        RunwayEnd runwayEnd = new RunwayEnd(end.name, type, end.position, heading, end.displacedThresholdFt,
                                            end.blastPadFt, end.approachLight, end.reil, end.touchdownLights, null);
        return airport.index().stageRunwayEnd(runwayEnd);
    }

    private static EndData landEnd(SceneryRow row, int offset) {
        return new EndData(row.at(NUMBER + offset),
                           row.coordinateAt(LAT + offset, LON + offset),
                           GeoHelper.meterToFeet(row.doubleAt(DISPLACED_THRESHOLD + offset)),
                           GeoHelper.meterToFeet(row.doubleAt(BLAST_PAD + offset)),
                           Marking.fromCode(row.intAt(MARKINGS + offset)),
                           ApproachLight.fromCode(row.intAt(ALS + offset)),
                           row.intAt(REIL + offset) > 0,
                           row.intAt(TDZ_LIGHTS + offset) > 0);
    }

    private static EndData waterEnd(SceneryRow row, int offset) {
        return new EndData(row.at(WATER_NUMBER + offset),
                           row.coordinateAt(WATER_LAT + offset, WATER_LON + offset),
                           0, 0, Marking.NO_MARKING, ApproachLight.NO_ALS, false, false);
    }

    private record EndData(String name,
                           Coordinate position,
                           int displacedThresholdFt,
                           int blastPadFt,
                           Marking marking,
                           ApproachLight approachLight,
                           boolean reil,
                           boolean touchdownLights) {
    }
}
