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

import com.dedicatedcode.kentta.model.PavementPolygon;
import com.dedicatedcode.kentta.model.RingNode;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKBReader;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PavementCodecTest {

    private static RingNode node(double lon, double lat) {
        return RingNode.of(new Coordinate(lon, lat));
    }

    @Test
    void testEncodeKeepsControlPointsAndHoles() {
        List<RingNode> boundary = List.of(node(0, 0), new RingNode(new Coordinate(1, 0), new Coordinate(1.5, 0.5)),
                                          node(1, 1), node(0, 1));
        List<RingNode> hole = List.of(node(0.2, 0.2), node(0.4, 0.2), node(0.3, 0.4));
        PavementPolygon polygon = new PavementPolygon(boundary, List.of(hole));

        PavementPolygon decoded = PavementCodec.decode(PavementCodec.encode(polygon));

        assertEquals(2, decoded.ringCount());
        assertEquals(4, decoded.boundary().size());
        assertTrue(decoded.boundary().get(1).hasControl());
        assertEquals(new Coordinate(1.5, 0.5), decoded.boundary().get(1).control());
        assertFalse(decoded.boundary().get(0).hasControl());
        assertEquals(3, decoded.holes().get(0).size());
    }

    @Test
    void testEncodeWkbClosesTheRing() throws ParseException {
        PavementPolygon polygon = new PavementPolygon(List.of(node(0, 0), node(1, 0), node(1, 1), node(0, 1)),
                                                      List.of());

        Optional<byte[]> wkb = PavementCodec.encodeWkb(polygon);

        assertTrue(wkb.isPresent());
        Geometry geometry = new WKBReader().read(wkb.get());
        assertThat(geometry).isInstanceOf(Polygon.class);
        assertEquals(5, geometry.getNumPoints());
        assertEquals(1.0, geometry.getArea(), 1e-9);
    }

    @Test
    void testEncodeWkbDropsDegenerateHoles() {
        PavementPolygon polygon = new PavementPolygon(List.of(node(0, 0), node(1, 0), node(1, 1)),
                                                      List.of(List.of(node(0.5, 0.2), node(0.6, 0.3))));

        Optional<Polygon> jts = PavementCodec.toPolygon(polygon);

        assertTrue(jts.isPresent());
        assertEquals(0, jts.get().getNumInteriorRing());
    }

    @Test
    void testEncodeWkbRejectsTooFewPoints() {
        PavementPolygon polygon = new PavementPolygon(List.of(node(0, 0), node(1, 0)), List.of());

        assertTrue(PavementCodec.encodeWkb(polygon).isEmpty());
    }

    @Test
    void testEncodeWkbOfUnclosableRingIsEmpty() {
        PavementPolygon polygon = new PavementPolygon(List.of(node(13.30, Double.NaN), node(13.31, 52.5),
                                                              node(13.31, 52.51)), List.of());

        assertTrue(PavementCodec.encodeWkb(polygon).isEmpty());
    }
}
