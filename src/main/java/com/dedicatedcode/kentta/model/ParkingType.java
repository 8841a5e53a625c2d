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
 * Parking categories with their database codes. Gates and GA ramps come in sized variants, the size is an
 * ordinal so that {@code HEAVY > MEDIUM > SMALL > NONE}.
 */
public enum ParkingType {
    UNKNOWN("", Category.OTHER, Size.NONE),
    GATE("G", Category.GATE, Size.NONE),
    GATE_SMALL("GS", Category.GATE, Size.SMALL),
    GATE_MEDIUM("GM", Category.GATE, Size.MEDIUM),
    GATE_HEAVY("GH", Category.GATE, Size.HEAVY),
    RAMP_GA("RGA", Category.RAMP_GA, Size.NONE),
    RAMP_GA_SMALL("RGAS", Category.RAMP_GA, Size.SMALL),
    RAMP_GA_MEDIUM("RGAM", Category.RAMP_GA, Size.MEDIUM),
    RAMP_GA_LARGE("RGAL", Category.RAMP_GA, Size.HEAVY),
    RAMP_CARGO("RC", Category.RAMP_CARGO, Size.NONE),
    RAMP_MIL_CARGO("RMC", Category.RAMP_MIL_CARGO, Size.NONE),
    TIE_DOWN("T", Category.OTHER, Size.NONE),
    HANGAR("H", Category.OTHER, Size.NONE),
    FUEL("FUEL", Category.FUEL, Size.NONE);

    public enum Category {
        GATE, RAMP_GA, RAMP_CARGO, RAMP_MIL_CARGO, FUEL, OTHER
    }

    public enum Size {
        NONE, SMALL, MEDIUM, HEAVY
    }

    private static final Map<String, ParkingType> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ParkingType::code, Function.identity()));

    private final String code;
    private final Category category;
    private final Size size;

    ParkingType(String code, Category category, Size size) {
        this.code = code;
        this.category = category;
        this.size = size;
    }

    public String code() {
        return code;
    }

    public Category category() {
        return category;
    }

    public Size size() {
        return size;
    }

    public boolean isSizeable() {
        return category == Category.GATE || category == Category.RAMP_GA;
    }

    /**
     * Returns the variant of this category with the given size, or this type if the category has no sized variants.
     */
    public ParkingType withSize(Size newSize) {
        if (!isSizeable()) {
            return this;
        }
        for (ParkingType type : values()) {
            if (type.category == category && type.size == newSize) {
                return type;
            }
        }
        return this;
    }

    public boolean isLargerThan(ParkingType other) {
        return other == null || size.compareTo(other.size) > 0;
    }

    public static ParkingType fromCode(String code) {
        return code == null ? UNKNOWN : BY_CODE.getOrDefault(code, UNKNOWN);
    }
}
