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

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum ComType {
    NONE("NONE"),
    ATIS("ATIS"),
    AWOS("AWOS"),
    ASOS("ASOS"),
    UNICOM("UC"),
    CLEARANCE("C"),
    GROUND("G"),
    TOWER("T"),
    APPROACH("A"),
    DEPARTURE("D");

    private static final Map<String, ComType> BY_DB_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ComType::dbValue, Function.identity()));

    private final String dbValue;

    ComType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ComType fromDbValue(String dbValue) {
        return BY_DB_VALUE.getOrDefault(dbValue, NONE);
    }
}
