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
 * Yes/no questions the importer asks before reading a file or committing an airport.
 */
public interface SceneryFilter {

    SceneryFilter INCLUDE_ALL = new SceneryFilter() {
        @Override
        public boolean includeAirport(String ident) {
            return true;
        }

        @Override
        public boolean includePath(String path) {
            return true;
        }

        @Override
        public boolean includeFilename(String filename) {
            return true;
        }
    };

    boolean includeAirport(String ident);

    boolean includePath(String path);

    boolean includeFilename(String filename);
}
