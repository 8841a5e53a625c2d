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

import com.dedicatedcode.kentta.model.RunwayEnd;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Lookup structures scoped to the airport currently open: taxi node positions by id and the staged runway ends.
 * <p>
 * Runway ends are addressed by their handle, the index in the staging arena. Handles stay valid while more ends are
 * staged, a staged end is updated by replacing the entry at its handle.
 */
public class CrossReferenceIndex {

    private final Map<Integer, Coordinate> taxiNodes = new HashMap<>();
    private final List<RunwayEnd> runwayEnds = new ArrayList<>();

    public void putTaxiNode(int id, Coordinate position) {
        taxiNodes.put(id, position);
    }

    public Optional<Coordinate> taxiNode(int id) {
        Coordinate position = taxiNodes.get(id);
        return position == null ? Optional.empty() : Optional.of(position.copy());
    }

    public int taxiNodeCount() {
        return taxiNodes.size();
    }

    /**
     * @return the handle of the staged end
     */
    public int stageRunwayEnd(RunwayEnd end) {
        runwayEnds.add(end);
        return runwayEnds.size() - 1;
    }

    public RunwayEnd runwayEnd(int handle) {
        return runwayEnds.get(handle);
    }

    public void replaceRunwayEnd(int handle, RunwayEnd end) {
        runwayEnds.set(handle, end);
    }

    public List<RunwayEnd> runwayEnds() {
        return Collections.unmodifiableList(runwayEnds);
    }

    /**
     * First staged end with exactly this name.
     */
    public OptionalInt findRunwayEndByName(String name) {
        for (int handle = 0; handle < runwayEnds.size(); handle++) {
            if (runwayEnds.get(handle).name().equals(name)) {
                return OptionalInt.of(handle);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Staged end with the smallest plain heading difference below {@code maxDifference}. The difference is not
     * wrapped around north, so 355 and 5 degrees are 350 degrees apart. On equal differences the end staged first
     * wins.
     */
    public OptionalInt findRunwayEndByHeading(double heading, double maxDifference) {
        int best = -1;
        double bestDifference = Double.MAX_VALUE;
        for (int handle = 0; handle < runwayEnds.size(); handle++) {
            double difference = Math.abs(runwayEnds.get(handle).heading() - heading);
            if (difference < maxDifference && difference < bestDifference) {
                best = handle;
                bestDifference = difference;
            }
        }
        return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }

    public void clear() {
        taxiNodes.clear();
        runwayEnds.clear();
    }
}
