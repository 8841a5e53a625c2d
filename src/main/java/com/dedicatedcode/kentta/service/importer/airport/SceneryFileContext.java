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

package com.dedicatedcode.kentta.service.importer.airport;

import com.dedicatedcode.kentta.service.importer.SceneryRow;

/**
 * Per file settings handed to the row dispatcher.
 *
 * @param fileId          id of the {@code scenery_file} row the airports belong to
 * @param fileName        file name used as message prefix
 * @param addon           airports are add-on scenery
 * @param threeD          airports come with 3D scenery
 * @param lengthPrecision rounding of runway dimensions in feet, see
 *                        {@link com.dedicatedcode.kentta.service.GeoHelper#meterToFeet(double, int)}
 */
public record SceneryFileContext(int fileId, String fileName, boolean addon, boolean threeD, int lengthPrecision) {

    public static SceneryFileContext of(int fileId, String fileName) {
        return new SceneryFileContext(fileId, fileName, false, false, 0);
    }

    public String messagePrefix(SceneryRow row) {
        return fileName + ":" + row.lineNumber();
    }
}
