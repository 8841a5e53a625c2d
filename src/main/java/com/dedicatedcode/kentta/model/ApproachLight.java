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
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Approach light systems. {@link #NO_ALS} has no database value.
 */
public enum ApproachLight {
    NO_ALS(0, null),
    ALSF_I(1, "ALSF1"),
    ALSF_II(2, "ALSF2"),
    CALVERT(3, "CALVERT"),
    CALVERT_ILS(4, "CALVERT2"),
    SSALR(5, "SSALR"),
    SSALF(6, "SSALF"),
    SALS(7, "SALS"),
    MALSR(8, "MALSR"),
    MALSF(9, "MALSF"),
    MALS(10, "MALS"),
    ODALS(11, "ODALS"),
    RAIL(12, "RAIL");

    private static final Map<Integer, ApproachLight> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ApproachLight::code, Function.identity()));
    private static final Map<String, ApproachLight> BY_DB_VALUE = Arrays.stream(values())
            .filter(a -> a.dbValue != null)
            .collect(Collectors.toUnmodifiableMap(a -> a.dbValue, Function.identity()));

    private final int code;
    private final String dbValue;

    ApproachLight(int code, String dbValue) {
        this.code = code;
        this.dbValue = dbValue;
    }

    public int code() {
        return code;
    }

    public Optional<String> dbValue() {
        return Optional.ofNullable(dbValue);
    }

    public static ApproachLight fromCode(int code) {
        return BY_CODE.getOrDefault(code, NO_ALS);
    }

    public static ApproachLight fromDbValue(String dbValue) {
        return dbValue == null ? NO_ALS : BY_DB_VALUE.getOrDefault(dbValue, NO_ALS);
    }
}
