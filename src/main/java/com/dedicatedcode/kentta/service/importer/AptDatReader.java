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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * Splits an airport transcript into rows. The first two lines (byte order marker and version banner) are skipped,
 * reading stops at the end of file row.
 */
public class AptDatReader {

    private static final int HEADER_LINES = 2;

    /**
     * @return the number of rows handed to the consumer
     */
    public int read(BufferedReader reader, Consumer<SceneryRow> consumer) throws IOException {
        int lineNumber = 0;
        int rows = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (lineNumber <= HEADER_LINES || line.isBlank()) {
                continue;
            }
            SceneryRow row = SceneryRow.parse(line, lineNumber);
            if (row.code() == RowCode.END_OF_FILE) {
                break;
            }
            consumer.accept(row);
            rows++;
        }
        return rows;
    }
}
