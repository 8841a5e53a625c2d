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

/**
 * Thrown when a row is shorter than a required field index.
 */
public class MissingFieldException extends RuntimeException {

    private final int index;

    public MissingFieldException(SceneryRow row, int index) {
        super("Row " + row.code() + " at line " + row.lineNumber() + " has no field " + index + " (size " + row.size() + ")");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
