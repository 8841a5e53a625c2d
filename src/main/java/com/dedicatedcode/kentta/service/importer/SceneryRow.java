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

import com.dedicatedcode.kentta.service.GeoHelper;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * One tokenized transcript line. Field 0 is the row code, so field indexes match the positions in the file.
 */
public final class SceneryRow {

    private final RowCode code;
    private final List<String> fields;
    private final int lineNumber;

    public SceneryRow(RowCode code, List<String> fields, int lineNumber) {
        this.code = code;
        this.fields = List.copyOf(fields);
        this.lineNumber = lineNumber;
    }

    /**
     * Builds a row from whitespace separated text, mostly useful in tests.
     */
    public static SceneryRow parse(String line, int lineNumber) {
        String trimmed = line.trim();
        List<String> fields = trimmed.isEmpty() ? List.of() : List.of(trimmed.split("\\s+"));
        RowCode code = RowCode.UNKNOWN;
        if (!fields.isEmpty()) {
            try {
                code = RowCode.fromCode(Integer.parseInt(fields.get(0)));
            } catch (NumberFormatException e) {
                code = RowCode.UNKNOWN;
            }
        }
        return new SceneryRow(code, fields, lineNumber);
    }

    public RowCode code() {
        return code;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public int size() {
        return fields.size();
    }

    public boolean has(int index) {
        return index >= 0 && index < fields.size();
    }

    /**
     * Required field access.
     *
     * @throws MissingFieldException if the row is too short
     */
    public String at(int index) {
        if (!has(index)) {
            throw new MissingFieldException(this, index);
        }
        return fields.get(index);
    }

    /**
     * Optional field access, returns an empty string when the row is too short.
     */
    public String value(int index) {
        return has(index) ? fields.get(index) : "";
    }

    public int intAt(int index) {
        return Integer.parseInt(at(index));
    }

    public double doubleAt(int index) {
        return Double.parseDouble(at(index));
    }

    public boolean flagAt(int index) {
        return intAt(index) != 0;
    }

    /**
     * Position from two required latitude/longitude fields, in JTS order. Positions outside the valid latitude and
     * longitude range fail like an unparsable number.
     */
    public Coordinate coordinateAt(int latIndex, int lonIndex) {
        Coordinate coordinate = new Coordinate(doubleAt(lonIndex), doubleAt(latIndex));
        if (!GeoHelper.isValid(coordinate)) {
            throw new NumberFormatException("Invalid position " + at(latIndex) + " " + at(lonIndex));
        }
        return coordinate;
    }

    /**
     * All fields from {@code index} to the end joined by a single space, used for names containing blanks.
     */
    public String mid(int index) {
        if (!has(index)) {
            return "";
        }
        return String.join(" ", fields.subList(index, fields.size()));
    }

    @Override
    public String toString() {
        return String.join(" ", fields);
    }
}
