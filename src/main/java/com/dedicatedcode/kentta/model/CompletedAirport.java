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

import java.util.List;

/**
 * An airport together with every child entity staged for it, ready to be committed in one go.
 */
public record CompletedAirport(AirportRecord airport,
                               List<Runway> runways,
                               List<RunwayEnd> runwayEnds,
                               List<Start> starts,
                               List<Helipad> helipads,
                               List<Com> coms,
                               List<Parking> parkings,
                               List<Apron> aprons,
                               List<TaxiPath> taxiPaths) {

    public CompletedAirport {
        runways = List.copyOf(runways);
        runwayEnds = List.copyOf(runwayEnds);
        starts = List.copyOf(starts);
        helipads = List.copyOf(helipads);
        coms = List.copyOf(coms);
        parkings = List.copyOf(parkings);
        aprons = List.copyOf(aprons);
        taxiPaths = List.copyOf(taxiPaths);
    }
}
