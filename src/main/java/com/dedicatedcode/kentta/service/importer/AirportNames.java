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

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Clean-up of airport names taken from header rows.
 */
public final class AirportNames {

    private static final Pattern NAME_INDICATOR = Pattern.compile("\\[(h|s|g|x|mil)\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLOSED = Pattern.compile("\\[x\\]|\\bclosed\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MILITARY = Pattern.compile(
            "\\[mil\\]|\\b(military|air force|air base|airbase|army|naval|navy|afb|aaf|ab|ahp|angb|arb|mcaf|mcas|nas|naf|nawc|nas jrb)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> KEEP_UPPER = Set.of("AFB", "AAF", "AB", "AHP", "ANGB", "ARB", "MCAF", "MCAS",
                                                         "NAS", "NAF", "JRB", "RAF", "II", "III", "IV", "USAF");

    private AirportNames() {
    }

    public static boolean isClosed(String name) {
        return CLOSED.matcher(name).find();
    }

    public static boolean isMilitary(String name) {
        return MILITARY.matcher(name).find();
    }

    public static String stripIndicators(String name) {
        return WHITESPACE.matcher(NAME_INDICATOR.matcher(name).replaceAll("")).replaceAll(" ").trim();
    }

    /**
     * Capitalizes every word and keeps common abbreviations in upper case.
     */
    public static String capitalize(String name) {
        StringBuilder result = new StringBuilder(name.length());
        for (String word : WHITESPACE.split(name.trim())) {
            if (word.isEmpty()) {
                continue;
            }
            if (!result.isEmpty()) {
                result.append(' ');
            }
            String upper = word.toUpperCase(Locale.ROOT);
            if (KEEP_UPPER.contains(upper)) {
                result.append(upper);
            } else {
                result.append(capitalizeWord(word.toLowerCase(Locale.ROOT)));
            }
        }
        return result.toString();
    }

    private static String capitalizeWord(String word) {
        StringBuilder sb = new StringBuilder(word);
        boolean start = true;
        for (int i = 0; i < sb.length(); i++) {
            char c = sb.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                if (start) {
                    sb.setCharAt(i, Character.toUpperCase(c));
                }
                start = false;
            } else if (c == '-' || c == '/' || c == '(' || c == '.') {
                start = true;
            }
        }
        return sb.toString();
    }
}
