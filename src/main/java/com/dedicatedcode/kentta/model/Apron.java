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

import java.util.Optional;

/**
 * A finished pavement area. {@code geometry} is the compact ring encoding including control points, {@code wkb} is
 * only present when the rings formed a valid polygon.
 */
public record Apron(Surface surface, PavementPolygon polygon, byte[] geometry, byte[] wkb) {

    public Optional<byte[]> wkbGeometry() {
        return Optional.ofNullable(wkb);
    }
}
