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
 * Runway end surface markings. Each marking expands to a set of marking flag bits stored on the runway.
 */
public enum Marking {
    NO_MARKING(0, 0),
    VISUAL(1, Flags.EDGES | Flags.DASHES | Flags.IDENT),
    NON_PAP(2, Flags.EDGES | Flags.THRESHOLD | Flags.FIXED_DISTANCE | Flags.TOUCHDOWN | Flags.DASHES | Flags.IDENT
            | Flags.EDGE_PAVEMENT),
    PAP(3, Flags.EDGES | Flags.THRESHOLD | Flags.FIXED_DISTANCE | Flags.TOUCHDOWN | Flags.DASHES | Flags.IDENT
            | Flags.PRECISION | Flags.EDGE_PAVEMENT),
    UK_NON_PAP(4, Flags.EDGES | Flags.ALTERNATE_THRESHOLD | Flags.ALTERNATE_FIXED_DISTANCE | Flags.ALTERNATE_TOUCHDOWN
            | Flags.DASHES | Flags.IDENT | Flags.EDGE_PAVEMENT),
    UK_PAP(5, Flags.EDGES | Flags.ALTERNATE_THRESHOLD | Flags.ALTERNATE_FIXED_DISTANCE | Flags.ALTERNATE_TOUCHDOWN
            | Flags.DASHES | Flags.IDENT | Flags.ALTERNATE_PRECISION | Flags.EDGE_PAVEMENT);

    public static final class Flags {
        public static final int EDGES = 1;
        public static final int THRESHOLD = 1 << 1;
        public static final int FIXED_DISTANCE = 1 << 2;
        public static final int TOUCHDOWN = 1 << 3;
        public static final int DASHES = 1 << 4;
        public static final int IDENT = 1 << 5;
        public static final int PRECISION = 1 << 6;
        public static final int EDGE_PAVEMENT = 1 << 7;
        public static final int ALTERNATE_THRESHOLD = 1 << 13;
        public static final int ALTERNATE_FIXED_DISTANCE = 1 << 14;
        public static final int ALTERNATE_TOUCHDOWN = 1 << 15;
        public static final int ALTERNATE_PRECISION = 1 << 21;

        private Flags() {
        }
    }

    private static final Map<Integer, Marking> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Marking::code, Function.identity()));

    private final int code;
    private final int flags;

    Marking(int code, int flags) {
        this.code = code;
        this.flags = flags;
    }

    public int code() {
        return code;
    }

    public int flags() {
        return flags;
    }

    public static Marking fromCode(int code) {
        return BY_CODE.getOrDefault(code, NO_MARKING);
    }
}
