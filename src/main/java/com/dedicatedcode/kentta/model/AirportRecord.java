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

package com.dedicatedcode.kentta.model;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.Optional;

/**
 * The finished airport row. Built once per airport by the finalizer, everything mutable lives in the accumulator.
 */
public record AirportRecord(String ident,
                            String name,
                            int elevationFt,
                            boolean closed,
                            boolean military,
                            boolean addon,
                            boolean threeD,
                            Coordinate position,
                            Envelope bounds,
                            AirportMetadata metadata,
                            AirportFrequencies frequencies,
                            Tower tower,
                            LongestRunway longestRunway,
                            AirportCounters counters,
                            ParkingType largestParkingGate,
                            ParkingType largestParkingRamp,
                            boolean avgas,
                            boolean jetFuel,
                            int rating) {

    public Optional<Tower> towerObject() {
        return Optional.ofNullable(tower);
    }

    public Optional<ParkingType> largestGate() {
        return Optional.ofNullable(largestParkingGate);
    }

    public Optional<ParkingType> largestRamp() {
        return Optional.ofNullable(largestParkingRamp);
    }

    public record AirportMetadata(String city, String country, String region, String iata, String faa, String icao) {

        public static final AirportMetadata EMPTY = new AirportMetadata(null, null, null, null, null, null);
    }

    public record AirportFrequencies(Integer atis, Integer awos, Integer asos, Integer unicom, Integer tower) {
    }

    public record Tower(Coordinate position, int altitudeFt) {
    }

    public record LongestRunway(int lengthFt, int widthFt, double heading, Surface surface) {

        public static final LongestRunway NONE = new LongestRunway(0, 0, 0, Surface.UNKNOWN);
    }

    public record AirportCounters(int hardRunways,
                                  int softRunways,
                                  int waterRunways,
                                  int lightedRunways,
                                  int helipads,
                                  int coms,
                                  int starts,
                                  int runwayEndsWithAls,
                                  int runwayEndsWithVasi,
                                  int aprons,
                                  int taxiPaths,
                                  int parkings,
                                  int gates,
                                  int gaRamps,
                                  int cargoRamps,
                                  int militaryCargoRamps,
                                  int militaryCombatRamps) {

        public int runways() {
            return hardRunways + softRunways + waterRunways;
        }
    }
}
