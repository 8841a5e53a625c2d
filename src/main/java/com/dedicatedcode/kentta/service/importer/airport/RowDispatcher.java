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
import com.dedicatedcode.kentta.model.Com;
import com.dedicatedcode.kentta.model.ComType;
import com.dedicatedcode.kentta.model.CompletedAirport;
import com.dedicatedcode.kentta.model.Helipad;
import com.dedicatedcode.kentta.model.RingNode;
import com.dedicatedcode.kentta.model.Start;
import com.dedicatedcode.kentta.model.StartType;
import com.dedicatedcode.kentta.model.Surface;
import com.dedicatedcode.kentta.service.GeoHelper;
import com.dedicatedcode.kentta.service.importer.AirportNames;
import com.dedicatedcode.kentta.service.importer.MissingFieldException;
import com.dedicatedcode.kentta.service.importer.RowCode;
import com.dedicatedcode.kentta.service.importer.SceneryRow;
import com.dedicatedcode.kentta.service.store.AirportStore;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Top level state machine of the airport import. Consumes the rows of one scenery file in order.
 * <p>
 * Before a row is dispatched an open pavement polygon is finished unless the row continues it, and a staged parking
 * spot is committed unless the row is its metadata. A new airport header commits the previous airport. The end of
 * the stream finishes pavement, parking and airport in this order.
 */
public class RowDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(RowDispatcher.class);

    static final int HEADER_ELEVATION = 1;
    static final int HEADER_IDENT = 4;
    static final int HEADER_NAME = 5;

    static final int PAVEMENT_SURFACE = 1;
    static final int NODE_LAT = 1;
    static final int NODE_LON = 2;
    static final int NODE_CONTROL_LAT = 3;
    static final int NODE_CONTROL_LON = 4;

    static final int HELIPAD_DESIGNATOR = 1;
    static final int HELIPAD_LAT = 2;
    static final int HELIPAD_LON = 3;
    static final int HELIPAD_ORIENTATION = 4;
    static final int HELIPAD_LENGTH = 5;
    static final int HELIPAD_WIDTH = 6;
    static final int HELIPAD_SURFACE = 7;

    static final int VIEWPOINT_LAT = 1;
    static final int VIEWPOINT_LON = 2;
    static final int VIEWPOINT_HEIGHT = 3;

    static final int COM_FREQUENCY = 1;
    static final int COM_NAME = 2;

    static final int METADATA_KEY = 1;
    static final int METADATA_VALUE = 2;

    static final int TRUCK_TYPES = 4;

    private final SceneryFileContext context;
    private final AirportIndex airportIndex;
    private final AirportStore store;
    private final Diagnostics diagnostics;

    private final GeometryAccumulator geometry = new GeometryAccumulator();
    private final TaxiGraphBuilder taxiGraph;
    private final ParkingStager parking;
    private final RunwayAssembler runways;
    private final CrossReferenceResolver resolver;
    private final AggregateFinalizer finalizer;

    private AirportAccumulator airport = AirportAccumulator.idle();
    private int rowsConsumed;
    private int airportsWritten;

    public RowDispatcher(SceneryFileContext context, AirportIndex airportIndex, AirportStore store,
                         GeoHelper geoHelper) {
        this.context = context;
        this.airportIndex = airportIndex;
        this.store = store;
        this.diagnostics = new Diagnostics(context);
        this.taxiGraph = new TaxiGraphBuilder(diagnostics);
        this.parking = new ParkingStager(diagnostics);
        this.runways = new RunwayAssembler(geoHelper, context.lengthPrecision(), diagnostics);
        this.resolver = new CrossReferenceResolver(diagnostics);
        this.finalizer = new AggregateFinalizer(context, diagnostics);
    }

    /**
     * Processes one row including every flush it triggers. Malformed rows are reported and skipped, only storage
     * failures escape.
     */
    public void accept(SceneryRow row) {
        rowsConsumed++;
        Set<DispatchState> closing = DispatchState.closedBy(row.code());
        if (closing.stream().anyMatch(DispatchState::isRing)) {
            guarded(row, () -> finishPavement(row));
        }
        if (closing.contains(DispatchState.IN_STARTUP_LOCATION)) {
            guarded(row, () -> parking.flush(airport));
        }
        guarded(row, () -> dispatch(row));
    }

    private void guarded(SceneryRow row, Runnable step) {
        try {
            step.run();
        } catch (MissingFieldException | IllegalArgumentException e) {
            diagnostics.report(Diagnostics.Kind.MALFORMED_ROW, row, "Skipping row {}: {}", row.code(), e.getMessage());
        }
    }

    /**
     * End of stream.
     */
    public void finish() {
        finishPavement(null);
        parking.flush(airport);
        flushAirport();
    }

    private void dispatch(SceneryRow row) {
        switch (row.code()) {
            case LAND_AIRPORT_HEADER, SEAPLANE_BASE_HEADER, HELIPORT_HEADER -> beginAirport(row);
            case LAND_RUNWAY, WATER_RUNWAY -> {
                if (accepts(row)) {
                    runways.assemble(airport, row);
                }
            }
            case HELIPAD -> {
                if (accepts(row)) {
                    addHelipad(row);
                }
            }
            case PAVEMENT_HEADER -> {
                finishPavement(row);
                if (accepts(row)) {
                    geometry.beginPolygon(Surface.fromCode(row.intAt(PAVEMENT_SURFACE)));
                }
            }
            case NODE, NODE_AND_CONTROL_POINT, NODE_CLOSE, NODE_AND_CONTROL_POINT_CLOSE -> {
                if (accepts(row)) {
                    addPavementNode(row);
                }
            }
            case AIRPORT_VIEWPOINT -> {
                if (accepts(row)) {
                    setViewpoint(row);
                }
            }
            case LEGACY_STARTUP_LOCATION -> {
                if (accepts(row)) {
                    parking.beginLegacy(airport, row);
                }
            }
            case STARTUP_LOCATION -> {
                if (accepts(row)) {
                    parking.begin(airport, row);
                }
            }
            case RAMP_START_METADATA -> {
                if (accepts(row)) {
                    parking.amend(row);
                }
            }
            case LIGHTING_OBJECT -> {
                if (accepts(row)) {
                    resolver.resolveVasi(airport, row);
                }
            }
            case TAXI_ROUTE_NETWORK_NODE -> {
                if (accepts(row)) {
                    taxiGraph.addNode(airport, row);
                }
            }
            case TAXI_ROUTE_NETWORK_EDGE -> {
                if (accepts(row)) {
                    taxiGraph.addEdge(airport, row);
                }
            }
            case METADATA_RECORD -> {
                if (accepts(row)) {
                    setMetadata(row);
                }
            }
            case TRUCK_PARKING_LOCATION, TRUCK_DESTINATION_LOCATION -> {
                if (accepts(row)) {
                    setFuel(row);
                }
            }
            case COM_WEATHER, COM_UNICOM, COM_CLEARANCE, COM_GROUND, COM_TOWER, COM_APPROACH, COM_DEPARTURE -> {
                if (accepts(row)) {
                    addCom(row);
                }
            }
            default -> logger.trace("Row {} has no effect", row.code());
        }
    }

    /**
     * Ignored airports swallow their rows. Rows outside any airport are reported and applied to the idle accumulator,
     * which is never committed.
     */
    private boolean accepts(SceneryRow row) {
        if (airport.isIgnoring()) {
            return false;
        }
        if (airport.isIdle()) {
            diagnostics.report(Diagnostics.Kind.PROTOCOL_STATE, row, "Row {} outside of an airport", row.code());
        }
        return true;
    }

    private void beginAirport(SceneryRow row) {
        flushAirport();
        // stays ignoring if the header turns out to be malformed
        airport = AirportAccumulator.ignoring(row.value(HEADER_IDENT), null);

        String ident = row.at(HEADER_IDENT);
        int elevation = elevation(row);
        String rawName = row.mid(HEADER_NAME);
        store.writeAirportFile(context.fileId(), ident);

        boolean closed = AirportNames.isClosed(rawName);
        String name = AirportNames.stripIndicators(rawName);
        boolean military = AirportNames.isMilitary(rawName);
        name = AirportNames.capitalize(name);

        airport = AirportAccumulator.begin(airportIndex, ident, name, elevation, closed, military);
        if (airport.isIgnoring()) {
            diagnostics.report(Diagnostics.Kind.IGNORED_AIRPORT, row, "Ignoring airport {}: {}", ident,
                               airport.admission().map(Enum::name).orElse("UNKNOWN"));
        }
    }

    private int elevation(SceneryRow row) {
        String value = row.value(HEADER_ELEVATION);
        try {
            double feet = Double.parseDouble(value);
            if (Double.isFinite(feet)) {
                return (int) Math.round(feet);
            }
        } catch (NumberFormatException e) {
            logger.debug("Unparsable elevation '{}' in line {}", value, row.lineNumber());
        }
        diagnostics.report(Diagnostics.Kind.MALFORMED_ROW, row, "Invalid elevation '{}' for airport {}, using 0", value,
                           row.value(HEADER_IDENT));
        return 0;
    }

    private void flushAirport() {
        Optional<CompletedAirport> completed = airport.flush(finalizer);
        airport = AirportAccumulator.idle();
        if (completed.isPresent()) {
            store.writeAirport(completed.get());
            airportsWritten++;
        }
    }

    private void finishPavement(SceneryRow row) {
        if (!geometry.isOpen()) {
            return;
        }
        Optional<Apron> apron = geometry.finish();
        if (apron.isPresent()) {
            airport.addApron(apron.get());
        } else {
            String location = row == null ? context.fileName() : context.messagePrefix(row);
            diagnostics.report(Diagnostics.Kind.DEGENERATE_GEOMETRY, location, "Pavement without boundary nodes in {}",
                               airport.ident());
        }
    }

    private void addPavementNode(SceneryRow row) {
        RowCode code = row.code();
        Coordinate point = row.coordinateAt(NODE_LAT, NODE_LON);
        Coordinate control = null;
        if (code == RowCode.NODE_AND_CONTROL_POINT || code == RowCode.NODE_AND_CONTROL_POINT_CLOSE) {
            control = row.coordinateAt(NODE_CONTROL_LAT, NODE_CONTROL_LON);
        }
        boolean closing = code == RowCode.NODE_CLOSE || code == RowCode.NODE_AND_CONTROL_POINT_CLOSE;
        if (!geometry.addNode(airport, new RingNode(point, control), closing)) {
            diagnostics.report(Diagnostics.Kind.PROTOCOL_STATE, row, "Pavement node without pavement header");
        }
    }

    private void addHelipad(SceneryRow row) {
        String designator = row.at(HELIPAD_DESIGNATOR);
        Coordinate position = row.coordinateAt(HELIPAD_LAT, HELIPAD_LON);
        double heading = row.doubleAt(HELIPAD_ORIENTATION);
        int lengthFt = GeoHelper.meterToFeet(row.doubleAt(HELIPAD_LENGTH));
        int widthFt = GeoHelper.meterToFeet(row.doubleAt(HELIPAD_WIDTH));
        Surface surface = Surface.fromCode(row.intAt(HELIPAD_SURFACE));

        airport.extend(position);
        int number = airport.nextHelipadStartNumber();
        airport.addStart(new Start(String.format("%02d", number), StartType.HELIPAD, position, heading, null));
        int startIndex = airport.starts().size() - 1;
        airport.addHelipad(new Helipad(designator, position, heading, lengthFt, widthFt, surface, airport.closed(),
                                       startIndex));
    }

    private void setViewpoint(SceneryRow row) {
        Coordinate position = row.coordinateAt(VIEWPOINT_LAT, VIEWPOINT_LON);
        double height = row.doubleAt(VIEWPOINT_HEIGHT);
        airport.extend(position);
        airport.setTower(position, airport.elevationFt() + (int) Math.round(height));
    }

    private void addCom(SceneryRow row) {
        int frequency = row.intAt(COM_FREQUENCY) * 10;
        String name = row.mid(COM_NAME);
        ComType type = switch (row.code()) {
            case COM_WEATHER -> weatherType(name);
            case COM_UNICOM -> ComType.UNICOM;
            case COM_CLEARANCE -> ComType.CLEARANCE;
            case COM_GROUND -> ComType.GROUND;
            case COM_TOWER -> ComType.TOWER;
            case COM_APPROACH -> ComType.APPROACH;
            case COM_DEPARTURE -> ComType.DEPARTURE;
            default -> ComType.NONE;
        };
        switch (type) {
            case ATIS -> airport.setAtisFrequency(frequency);
            case AWOS -> airport.setAwosFrequency(frequency);
            case ASOS -> airport.setAsosFrequency(frequency);
            case UNICOM -> airport.setUnicomFrequency(frequency);
            case TOWER -> airport.setTowerFrequency(frequency);
            default -> {
            }
        }
        airport.addCom(new Com(type, frequency, name));
    }

    static ComType weatherType(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("atis")) {
            return ComType.ATIS;
        } else if (lower.contains("awos")) {
            return ComType.AWOS;
        } else if (lower.contains("asos")) {
            return ComType.ASOS;
        }
        return ComType.ATIS;
    }

    private void setMetadata(SceneryRow row) {
        String key = row.at(METADATA_KEY).toLowerCase(Locale.ROOT);
        String value = row.mid(METADATA_VALUE);
        switch (key) {
            case "datum_lat" -> {
                if (!value.isBlank()) {
                    airport.setDatumLat(Double.parseDouble(value));
                }
            }
            case "datum_lon" -> {
                if (!value.isBlank()) {
                    airport.setDatumLon(Double.parseDouble(value));
                }
            }
            default -> airport.setMetadata(key, value);
        }
    }

    private void setFuel(SceneryRow row) {
        String types = row.value(TRUCK_TYPES);
        if (types.contains("fuel_props")) {
            airport.markAvgas();
        }
        if (types.contains("fuel_liners") || types.contains("fuel_jets")) {
            airport.markJetFuel();
        }
    }

    /**
     * Active states. {@link DispatchState#IN_STARTUP_LOCATION} and the ring states combine with the airport state.
     */
    public Set<DispatchState> states() {
        Set<DispatchState> states = EnumSet.noneOf(DispatchState.class);
        switch (airport.mode()) {
            case IDLE -> states.add(DispatchState.IDLE);
            case WRITING -> states.add(DispatchState.IN_AIRPORT);
            case IGNORING -> states.add(DispatchState.IGNORING);
        }
        switch (geometry.state()) {
            case BOUNDARY -> states.add(DispatchState.IN_BOUNDARY_RING);
            case HOLES -> states.add(DispatchState.IN_HOLE_RINGS);
            default -> {
            }
        }
        if (parking.isOpen()) {
            states.add(DispatchState.IN_STARTUP_LOCATION);
        }
        return states;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public int rowsConsumed() {
        return rowsConsumed;
    }

    public int airportsWritten() {
        return airportsWritten;
    }

    AirportAccumulator currentAirport() {
        return airport;
    }
}
