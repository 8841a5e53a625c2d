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

package com.dedicatedcode.kentta.service.store;

import com.dedicatedcode.kentta.model.CompletedAirport;

/**
 * Destination of the import. One transaction spans one scenery file: {@link #beginFile(SceneryFile)} opens it,
 * {@link #commitFile()} or {@link #rollbackFile()} ends it.
 */
public interface AirportStore extends AutoCloseable {

    /**
     * @return the id of the new {@code scenery_file} row
     */
    int beginFile(SceneryFile file);

    /**
     * Records that an airport header was seen in a file, whether or not the airport is written.
     */
    void writeAirportFile(int fileId, String ident);

    /**
     * Writes the airport and all of its children.
     *
     * @return the id of the airport row
     */
    int writeAirport(CompletedAirport airport);

    void commitFile();

    void rollbackFile();

    @Override
    void close();
}
