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

import java.util.Optional;

/**
 * A runway pair. {@code primaryEnd} and {@code secondaryEnd} are handles into the runway end list of the same airport.
 */
public record Runway(int primaryEnd,
                     int secondaryEnd,
                     Surface surface,
                     Surface shoulder,
                     int lengthFt,
                     int widthFt,
                     double heading,
                     Coordinate center,
                     String edgeLight,
                     String centerLight,
                     int markingFlags) {

    public Optional<Surface> shoulderSurface() {
        return Optional.ofNullable(shoulder);
    }

    public Optional<String> edgeLights() {
        return Optional.ofNullable(edgeLight);
    }

    public Optional<String> centerLights() {
        return Optional.ofNullable(centerLight);
    }

    public boolean isLighted() {
        return edgeLight != null || centerLight != null;
    }
}
