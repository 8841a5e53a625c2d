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

import com.dedicatedcode.kentta.model.Apron;
import com.dedicatedcode.kentta.model.PavementPolygon;
import com.dedicatedcode.kentta.model.RingNode;
import com.dedicatedcode.kentta.model.Surface;
import com.dedicatedcode.kentta.service.importer.PavementCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds one pavement polygon from node rows.
 * <p>
 * After {@link #beginPolygon(Surface)} nodes go to the boundary ring. The first closing node switches to holes, from
 * then on the node following a closing node starts a new hole ring. Only one polygon is open at a time.
 */
public class GeometryAccumulator {

    public enum RingState {
        NONE, BOUNDARY, HOLES
    }

    private RingState state = RingState.NONE;
    private Surface surface = Surface.UNKNOWN;
    private List<RingNode> boundary = new ArrayList<>();
    private List<List<RingNode>> holes = new ArrayList<>();
    private boolean newHole;

    public void beginPolygon(Surface surface) {
        this.surface = surface;
        this.boundary = new ArrayList<>();
        this.holes = new ArrayList<>();
        this.newHole = false;
        this.state = RingState.BOUNDARY;
    }

    /**
     * Appends a node to the open ring and extends the airport rectangle by the node position.
     *
     * @return false if no polygon is open, the node is dropped in that case
     */
    public boolean addNode(AirportAccumulator airport, RingNode node, boolean closing) {
        airport.extend(node.point());
        switch (state) {
            case NONE -> {
                return false;
            }
            case BOUNDARY -> {
                boundary.add(node);
                if (closing) {
                    state = RingState.HOLES;
                    newHole = true;
                }
            }
            case HOLES -> {
                if (newHole || holes.isEmpty()) {
                    holes.add(new ArrayList<>());
                    newHole = false;
                }
                holes.get(holes.size() - 1).add(node);
                if (closing) {
                    newHole = true;
                }
            }
        }
        return true;
    }

    /**
     * Closes the open polygon and encodes it. Empty when nothing was open or the boundary ring has no nodes.
     */
    public Optional<Apron> finish() {
        if (state == RingState.NONE) {
            return Optional.empty();
        }
        state = RingState.NONE;
        if (boundary.isEmpty()) {
            return Optional.empty();
        }
        PavementPolygon polygon = new PavementPolygon(boundary, holes);
        byte[] geometry = PavementCodec.encode(polygon);
        byte[] wkb = PavementCodec.encodeWkb(polygon).orElse(null);
        return Optional.of(new Apron(surface, polygon, geometry, wkb));
    }

    public boolean isOpen() {
        return state != RingState.NONE;
    }

    public RingState state() {
        return state;
    }
}
