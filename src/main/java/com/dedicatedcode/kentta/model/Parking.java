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

import java.util.List;

public record Parking(ParkingType type,
                      String name,
                      Coordinate position,
                      double heading,
                      int radius,
                      List<String> airlineCodes,
                      boolean avgas,
                      boolean jetFuel) {

    public Parking {
        airlineCodes = List.copyOf(airlineCodes);
    }

    public boolean isFuel() {
        return type == ParkingType.FUEL;
    }
}
