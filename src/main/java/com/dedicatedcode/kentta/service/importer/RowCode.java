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

package com.dedicatedcode.kentta.service.importer;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Row codes of the airport scenery transcript. Codes not listed here decode to {@link #UNKNOWN}.
 */
public enum RowCode {
    UNKNOWN(-1),
    LAND_AIRPORT_HEADER(1),
    AIRPORT_VIEWPOINT(14),
    LEGACY_STARTUP_LOCATION(15),
    SEAPLANE_BASE_HEADER(16),
    HELIPORT_HEADER(17),
    AIRPORT_LIGHT_BEACON(18),
    WINDSOCK(19),
    TAXIWAY_SIGN(20),
    LIGHTING_OBJECT(21),
    COM_WEATHER(50),
    COM_UNICOM(51),
    COM_CLEARANCE(52),
    COM_GROUND(53),
    COM_TOWER(54),
    COM_APPROACH(55),
    COM_DEPARTURE(56),
    END_OF_FILE(99),
    LAND_RUNWAY(100),
    WATER_RUNWAY(101),
    HELIPAD(102),
    PAVEMENT_HEADER(110),
    NODE(111),
    NODE_AND_CONTROL_POINT(112),
    NODE_CLOSE(113),
    NODE_AND_CONTROL_POINT_CLOSE(114),
    NODE_TERMINATING_A_STRING(115),
    NODE_WITH_CONTROL_POINT_TERMINATING_A_STRING(116),
    LINEAR_FEATURE_HEADER(120),
    AIRPORT_BOUNDARY_HEADER(130),
    AIRPORT_TRAFFIC_FLOW(1000),
    TRAFFIC_FLOW_WIND_RULE(1001),
    TRAFFIC_FLOW_MINIMUM_CEILING_RULE(1002),
    TRAFFIC_FLOW_MINIMUM_VISIBILITY_RULE(1003),
    TRAFFIC_FLOW_TIME_RULE(1004),
    RUNWAY_IN_USE(1100),
    VFR_TRAFFIC_PATTERN(1101),
    TAXI_ROUTE_NETWORK_HEADER(1200),
    TAXI_ROUTE_NETWORK_NODE(1201),
    TAXI_ROUTE_NETWORK_EDGE(1202),
    TAXI_ROUTE_EDGE_ACTIVE_ZONE(1204),
    STARTUP_LOCATION(1300),
    RAMP_START_METADATA(1301),
    METADATA_RECORD(1302),
    TRUCK_PARKING_LOCATION(1400),
    TRUCK_DESTINATION_LOCATION(1401);

    private static final Map<Integer, RowCode> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RowCode::code, Function.identity()));

    private final int code;

    RowCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isAirportHeader() {
        return this == LAND_AIRPORT_HEADER || this == SEAPLANE_BASE_HEADER || this == HELIPORT_HEADER;
    }

    public static RowCode fromCode(int code) {
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }
}
