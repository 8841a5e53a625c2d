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
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.WKBWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binary encodings of pavement polygons.
 * <p>
 * The compact layout is {@code int ringCount} followed by every ring as {@code int nodeCount} and per node a flag
 * byte, longitude and latitude as doubles and, when the flag is set, the control point longitude and latitude. Ring 0
 * is the boundary.
 */
public final class PavementCodec {

    private static final Logger logger = LoggerFactory.getLogger(PavementCodec.class);

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();
    private static final byte PLAIN = 0;
    private static final byte WITH_CONTROL = 1;

    private PavementCodec() {
    }

    public static byte[] encode(PavementPolygon polygon) {
        List<List<RingNode>> rings = rings(polygon);
        int cap = 4;
        for (List<RingNode> ring : rings) {
            cap += 4;
            for (RingNode node : ring) {
                cap += 1 + 16 + (node.hasControl() ? 16 : 0);
            }
        }
        ByteBuffer bb = ByteBuffer.allocate(cap);
        bb.putInt(rings.size());
        for (List<RingNode> ring : rings) {
            bb.putInt(ring.size());
            for (RingNode node : ring) {
                bb.put(node.hasControl() ? WITH_CONTROL : PLAIN);
                putCoordinate(bb, node.point());
                if (node.hasControl()) {
                    putCoordinate(bb, node.control());
                }
            }
        }
        return bb.array();
    }

    public static PavementPolygon decode(byte[] b) {
        ByteBuffer bb = ByteBuffer.wrap(b);
        int ringCount = bb.getInt();
        List<List<RingNode>> rings = new ArrayList<>(ringCount);
        for (int r = 0; r < ringCount; r++) {
            int n = bb.getInt();
            List<RingNode> ring = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                byte flag = bb.get();
                Coordinate point = getCoordinate(bb);
                Coordinate control = flag == WITH_CONTROL ? getCoordinate(bb) : null;
                ring.add(new RingNode(point, control));
            }
            rings.add(ring);
        }
        if (rings.isEmpty()) {
            return new PavementPolygon(List.of(), List.of());
        }
        return new PavementPolygon(rings.get(0), rings.subList(1, rings.size()));
    }

    /**
     * Builds a JTS polygon from the ring points (control points are ignored) and encodes it as WKB. Empty when the
     * rings do not form a valid polygon.
     */
    public static Optional<byte[]> encodeWkb(PavementPolygon polygon) {
        try {
            return toPolygon(polygon).filter(Polygon::isValid).map(p -> new WKBWriter().write(p));
        } catch (IllegalArgumentException e) {
            logger.warn("Cannot build pavement geometry: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<Polygon> toPolygon(PavementPolygon polygon) {
        Optional<LinearRing> shell = toRing(polygon.boundary());
        if (shell.isEmpty()) {
            return Optional.empty();
        }
        List<LinearRing> holes = new ArrayList<>();
        for (List<RingNode> hole : polygon.holes()) {
            toRing(hole).ifPresent(holes::add);
        }
        return Optional.of(GEOMETRY_FACTORY.createPolygon(shell.get(), holes.toArray(new LinearRing[0])));
    }

    private static Optional<LinearRing> toRing(List<RingNode> nodes) {
        List<Coordinate> coordinates = new ArrayList<>(nodes.size() + 1);
        for (RingNode node : nodes) {
            coordinates.add(node.point().copy());
        }
        if (coordinates.size() < 3) {
            return Optional.empty();
        }
        if (!coordinates.get(0).equals2D(coordinates.get(coordinates.size() - 1))) {
            coordinates.add(coordinates.get(0).copy());
        }
        if (coordinates.size() < 4) {
            return Optional.empty();
        }
        return Optional.of(GEOMETRY_FACTORY.createLinearRing(coordinates.toArray(new Coordinate[0])));
    }

    private static List<List<RingNode>> rings(PavementPolygon polygon) {
        List<List<RingNode>> rings = new ArrayList<>(polygon.ringCount());
        rings.add(polygon.boundary());
        rings.addAll(polygon.holes());
        return rings;
    }

    private static void putCoordinate(ByteBuffer bb, Coordinate coordinate) {
        bb.putDouble(coordinate.x);
        bb.putDouble(coordinate.y);
    }

    private static Coordinate getCoordinate(ByteBuffer bb) {
        double x = bb.getDouble();
        double y = bb.getDouble();
        return new Coordinate(x, y);
    }
}
