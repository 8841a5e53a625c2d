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

import com.dedicatedcode.kentta.service.importer.RowCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * States of the row dispatcher. The ring states and {@link #IN_STARTUP_LOCATION} can be active together with
 * {@link #IN_AIRPORT}, see {@link RowDispatcher#states()}.
 * <p>
 * {@link #closedBy(RowCode)} is the transition table applied before a row is handled: every open entity state a row
 * does not continue is flushed first.
 */
public enum DispatchState {
    IDLE,
    IN_AIRPORT,
    IGNORING,
    IN_BOUNDARY_RING,
    IN_HOLE_RINGS,
    IN_STARTUP_LOCATION;

    private static final Set<DispatchState> ENTITY_STATES = EnumSet.of(IN_BOUNDARY_RING, IN_HOLE_RINGS,
                                                                        IN_STARTUP_LOCATION);
    private static final Set<DispatchState> RING_STATES = EnumSet.of(IN_BOUNDARY_RING, IN_HOLE_RINGS);

    private static final Map<RowCode, Set<DispatchState>> CLOSED_BY = new EnumMap<>(RowCode.class);

    static {
        for (RowCode code : RowCode.values()) {
            CLOSED_BY.put(code, ENTITY_STATES);
        }
        // a pavement header closes the previous polygon in its own handler
        for (RowCode code : EnumSet.of(RowCode.PAVEMENT_HEADER, RowCode.NODE, RowCode.NODE_AND_CONTROL_POINT,
                                       RowCode.NODE_CLOSE, RowCode.NODE_AND_CONTROL_POINT_CLOSE)) {
            CLOSED_BY.put(code, EnumSet.of(IN_STARTUP_LOCATION));
        }
        CLOSED_BY.put(RowCode.RAMP_START_METADATA, RING_STATES);
        CLOSED_BY.replaceAll((code, states) -> Collections.unmodifiableSet(EnumSet.copyOf(states)));
    }

    /**
     * Open entity states that have to be flushed before a row with the given code is handled.
     */
    public static Set<DispatchState> closedBy(RowCode code) {
        return CLOSED_BY.get(code);
    }

    /**
     * Whether a pavement polygon is open in this state.
     */
    public boolean isRing() {
        return RING_STATES.contains(this);
    }
}
