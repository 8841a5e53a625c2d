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
 * Surface codes as used in the scenery transcripts, with their database value and the runway class they count
 * towards.
 */
public enum Surface {
    UNKNOWN(0, "UNKNOWN", SurfaceClass.HARD),
    ASPHALT(1, "A", SurfaceClass.HARD),
    CONCRETE(2, "C", SurfaceClass.HARD),
    TURF_OR_GRASS(3, "G", SurfaceClass.SOFT),
    DIRT(4, "D", SurfaceClass.SOFT),
    GRAVEL(5, "GR", SurfaceClass.SOFT),
    DRY_LAKEBED(12, "DL", SurfaceClass.SOFT),
    WATER(13, "W", SurfaceClass.WATER),
    SNOW_OR_ICE(14, "SN", SurfaceClass.SOFT),
    TRANSPARENT(15, "TR", SurfaceClass.HARD);

    public enum SurfaceClass {
        HARD, SOFT, WATER
    }

    private static final Map<Integer, Surface> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Surface::code, Function.identity()));
    private static final Map<String, Surface> BY_DB_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Surface::dbValue, Function.identity()));

    private final int code;
    private final String dbValue;
    private final SurfaceClass surfaceClass;

    Surface(int code, String dbValue, SurfaceClass surfaceClass) {
        this.code = code;
        this.dbValue = dbValue;
        this.surfaceClass = surfaceClass;
    }

    public int code() {
        return code;
    }

    public String dbValue() {
        return dbValue;
    }

    public SurfaceClass surfaceClass() {
        return surfaceClass;
    }

    public boolean isHard() {
        return surfaceClass == SurfaceClass.HARD;
    }

    public boolean isSoft() {
        return surfaceClass == SurfaceClass.SOFT;
    }

    public boolean isWater() {
        return surfaceClass == SurfaceClass.WATER;
    }

    /**
     * Unknown codes map to {@link #UNKNOWN}.
     */
    public static Surface fromCode(int code) {
        return BY_CODE.getOrDefault(code, UNKNOWN);
    }

    public static Surface fromDbValue(String dbValue) {
        return BY_DB_VALUE.getOrDefault(dbValue, UNKNOWN);
    }
}
