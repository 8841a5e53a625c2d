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
 * One end of a runway as staged while the airport is open. Ends are immutable, attaching an approach indicator
 * produces a copy that replaces the staged entry.
 */
public record RunwayEnd(String name,
                        RunwayEndType endType,
                        Coordinate position,
                        double heading,
                        int displacedThresholdFt,
                        int blastPadFt,
                        ApproachLight approachLight,
                        boolean reil,
                        boolean touchdownLights,
                        VasiAssignment vasi) {

    public RunwayEnd withVasi(VasiAssignment assignment) {
        return new RunwayEnd(name, endType, position, heading, displacedThresholdFt, blastPadFt, approachLight, reil,
                             touchdownLights, assignment);
    }

    public Optional<VasiAssignment> leftVasi() {
        return Optional.ofNullable(vasi);
    }

    public boolean hasApproachLights() {
        return approachLight != ApproachLight.NO_ALS;
    }
}
