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

package com.dedicatedcode.kentta.service;

import com.google.common.geometry.S2LatLng;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.springframework.stereotype.Service;

/**
 * Spherical geometry helpers for airport ingestion. Coordinates follow JTS order (x = longitude, y = latitude).
 */
@Service
public class GeoHelper {

    public static final double FEET_PER_METER = 3.281;
    public static final double METERS_PER_NM = 1852.0;
    public static final double EARTH_RADIUS_METERS = 6_371_010.0;

    /**
     * Roughly 100 meters in degrees, used to test if a datum point lies near an airport.
     */
    public static final double EPSILON_100M = 0.0009;

    /**
     * One arc minute, used to inflate rectangles that collapsed to a point.
     */
    public static final double ONE_MINUTE = 1.0 / 60.0;

    /**
     * Great circle distance in meters.
     */
    public double distanceMeters(Coordinate from, Coordinate to) {
        return toLatLng(from).getDistance(toLatLng(to)).radians() * EARTH_RADIUS_METERS;
    }

    /**
     * Initial true course from {@code from} to {@code to} in degrees, normalized to [0, 360).
     */
    public double initialBearing(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.y);
        double lat2 = Math.toRadians(to.y);
        double dLon = Math.toRadians(to.x - from.x);
        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        return normalizeCourse(Math.toDegrees(Math.atan2(y, x)));
    }

    /**
     * Geodesic midpoint of the great circle segment between both points.
     */
    public Coordinate midpoint(Coordinate from, Coordinate to) {
        double lat1 = Math.toRadians(from.y);
        double lon1 = Math.toRadians(from.x);
        double lat2 = Math.toRadians(to.y);
        double dLon = Math.toRadians(to.x - from.x);

        double bx = Math.cos(lat2) * Math.cos(dLon);
        double by = Math.cos(lat2) * Math.sin(dLon);
        double lat = Math.atan2(Math.sin(lat1) + Math.sin(lat2),
                                Math.sqrt((Math.cos(lat1) + bx) * (Math.cos(lat1) + bx) + by * by));
        double lon = lon1 + Math.atan2(by, Math.cos(lat1) + bx);
        S2LatLng mid = S2LatLng.fromRadians(lat, lon).normalized();
        return new Coordinate(mid.lngDegrees(), mid.latDegrees());
    }

    public static double normalizeCourse(double course) {
        double normalized = course % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        return normalized;
    }

    public static double opposedCourse(double course) {
        return normalizeCourse(course + 180.0);
    }

    /**
     * Meters to feet. A {@code precision} of 0 rounds to whole feet, 1 to tens of feet, 2 to hundreds and so on.
     */
    public static int meterToFeet(double meters, int precision) {
        double feet = meters * FEET_PER_METER;
        if (precision <= 0) {
            return (int) Math.round(feet);
        }
        double factor = Math.pow(10, precision);
        return (int) (Math.round(feet / factor) * factor);
    }

    public static int meterToFeet(double meters) {
        return meterToFeet(meters, 0);
    }

    public static int meterToNm(double meters) {
        return (int) Math.round(meters / METERS_PER_NM);
    }

    public static boolean isValid(Coordinate coordinate) {
        return coordinate != null && Double.isFinite(coordinate.x) && Double.isFinite(coordinate.y)
                && Math.abs(coordinate.y) <= 90.0 && Math.abs(coordinate.x) <= 180.0;
    }

    public static boolean isPoint(Envelope envelope) {
        return envelope.getWidth() == 0.0 && envelope.getHeight() == 0.0;
    }

    private static S2LatLng toLatLng(Coordinate coordinate) {
        return S2LatLng.fromDegrees(coordinate.y, coordinate.x);
    }
}
