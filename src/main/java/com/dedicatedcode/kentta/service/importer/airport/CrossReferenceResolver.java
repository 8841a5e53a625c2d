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

import com.dedicatedcode.kentta.model.ApproachIndicator;
import com.dedicatedcode.kentta.model.RunwayEnd;
import com.dedicatedcode.kentta.model.VasiAssignment;
import com.dedicatedcode.kentta.service.importer.SceneryRow;

import java.util.OptionalInt;

/**
 * Attaches visual approach indicators from lighting object rows to staged runway ends.
 */
public class CrossReferenceResolver {

    static final int TYPE = 3;
    static final int ORIENTATION = 4;
    static final int ANGLE = 5;
    static final int RUNWAY = 6;

    static final double MAX_HEADING_DIFFERENCE = 10.0;

    private final Diagnostics diagnostics;

    public CrossReferenceResolver(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Matches by runway name first and falls back to the end with the closest heading.
     *
     * @return the handle of the runway end that received the indicator
     */
    public OptionalInt resolveVasi(AirportAccumulator airport, SceneryRow row) {
        ApproachIndicator type = ApproachIndicator.fromCode(row.intAt(TYPE));
        if (!type.isGlideSlopeIndicator()) {
            return OptionalInt.empty();
        }
        double orientation = row.doubleAt(ORIENTATION);
        double pitch = row.doubleAt(ANGLE);
        String runwayName = row.value(RUNWAY);

        OptionalInt match = match(airport.index(), runwayName, orientation);
        if (match.isEmpty()) {
            diagnostics.report(Diagnostics.Kind.UNRESOLVED_REFERENCE, row,
                               "No runway end {} for VASI with orientation {} found", runwayName, orientation);
            return match;
        }
        int handle = match.getAsInt();
        RunwayEnd end = airport.index().runwayEnd(handle);
        airport.index().replaceRunwayEnd(handle, end.withVasi(new VasiAssignment(type, pitch)));
        airport.counters().runwayEndsWithVasi++;
        return match;
    }

    static OptionalInt match(CrossReferenceIndex index, String runwayName, double orientation) {
        if (runwayName != null && !runwayName.isEmpty()) {
            OptionalInt byName = index.findRunwayEndByName(runwayName);
            if (byName.isPresent()) {
                return byName;
            }
        }
        return index.findRunwayEndByHeading(orientation, MAX_HEADING_DIFFERENCE);
    }
}
