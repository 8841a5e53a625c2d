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

/**
 * Visual approach indicators from lighting object rows.
 */
public enum ApproachIndicator {
    NONE(0, ""),
    VASI(1, "VASI22"),
    PAPI_4L(2, "PAPI4"),
    PAPI_4R(3, "PAPI4"),
    SPACE_SHUTTLE_PAPI(4, "PAPI4"),
    TRI_COLOR_VASI(5, "TRICOLOR"),
    RUNWAY_GUARD(6, "GUARD");

    private static final Map<Integer, ApproachIndicator> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ApproachIndicator::code, Function.identity()));

    private final int code;
    private final String dbValue;

    ApproachIndicator(int code, String dbValue) {
        this.code = code;
        this.dbValue = dbValue;
    }

    public int code() {
        return code;
    }

    public String dbValue() {
        return dbValue;
    }

    /**
     * Only glide slope indicators are attached to runway ends.
     */
    public boolean isGlideSlopeIndicator() {
        return this != NONE && this != RUNWAY_GUARD;
    }

    public static ApproachIndicator fromCode(int code) {
        return BY_CODE.getOrDefault(code, NONE);
    }
}
