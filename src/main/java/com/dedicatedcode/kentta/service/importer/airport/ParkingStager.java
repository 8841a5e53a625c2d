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

import com.dedicatedcode.kentta.model.Parking;
import com.dedicatedcode.kentta.model.ParkingType;
import com.dedicatedcode.kentta.service.importer.SceneryRow;
import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Holds the one parking spot that a following ramp start metadata row may still amend.
 */
public class ParkingStager {

    static final int START_LAT = 1;
    static final int START_LON = 2;
    static final int START_HEADING = 3;
    static final int START_TYPE = 4;
    static final int START_NAME = 6;

    static final int LEGACY_LAT = 1;
    static final int LEGACY_LON = 2;
    static final int LEGACY_HEADING = 3;
    static final int LEGACY_NAME = 4;

    static final int METADATA_WIDTH = 1;
    static final int METADATA_OPERATION = 2;
    static final int METADATA_AIRLINES = 3;

    static final int DEFAULT_RADIUS = 50;

    private static final Map<String, ParkingType> DECLARED_KINDS = Map.of(
            "gate", ParkingType.GATE,
            "hangar", ParkingType.HANGAR,
            "tie-down", ParkingType.TIE_DOWN,
            "tie_down", ParkingType.TIE_DOWN,
            "misc", ParkingType.UNKNOWN);

    private static final Map<String, ParkingType> OPERATION_TYPES = Map.of(
            "general_aviation", ParkingType.RAMP_GA,
            "cargo", ParkingType.RAMP_CARGO,
            "military", ParkingType.RAMP_MIL_CARGO);

    /**
     * ICAO aircraft width codes with the parking radius in meters and the size they map to.
     */
    enum WidthCode {
        A(25, ParkingType.Size.SMALL),
        B(40, ParkingType.Size.SMALL),
        C(60, ParkingType.Size.MEDIUM),
        D(80, ParkingType.Size.MEDIUM),
        E(100, ParkingType.Size.HEAVY),
        F(130, ParkingType.Size.HEAVY);

        static final int FALLBACK_RADIUS = 10;

        private static final Map<String, WidthCode> BY_NAME = Arrays.stream(values())
                .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));

        final int radius;
        final ParkingType.Size size;

        WidthCode(int radius, ParkingType.Size size) {
            this.radius = radius;
            this.size = size;
        }

        static Optional<WidthCode> of(String code) {
            return Optional.ofNullable(BY_NAME.get(code));
        }
    }

    private final Diagnostics diagnostics;
    private Pending pending;

    public ParkingStager(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Stages a spot from a startup location row. Fuel keywords in the name win over the declared kind.
     */
    public void begin(AirportAccumulator airport, SceneryRow row) {
        Coordinate position = row.coordinateAt(START_LAT, START_LON);
        double heading = row.doubleAt(START_HEADING);
        String kind = row.at(START_TYPE);
        String name = row.mid(START_NAME);

        flush(airport);
        airport.extend(position);

        String lower = name.toLowerCase(Locale.ROOT);
        boolean avgas = false;
        boolean jetFuel = false;
        if (lower.contains("avgas") || lower.contains("mogas") || lower.contains("gas-station")) {
            avgas = true;
        }
        if (lower.contains("jetfuel")) {
            jetFuel = true;
        }
        if (lower.contains("fuel")) {
            avgas = true;
            jetFuel = true;
        }
        if (avgas) {
            airport.markAvgas();
        }
        if (jetFuel) {
            airport.markJetFuel();
        }

        ParkingType type = avgas || jetFuel ? ParkingType.FUEL : DECLARED_KINDS.getOrDefault(kind, ParkingType.UNKNOWN);
        pending = new Pending(type, name, position, heading, avgas, jetFuel);
    }

    /**
     * Legacy startup location rows carry no kind and no metadata, the spot is committed right away.
     */
    public Optional<Parking> beginLegacy(AirportAccumulator airport, SceneryRow row) {
        Coordinate position = row.coordinateAt(LEGACY_LAT, LEGACY_LON);
        double heading = row.doubleAt(LEGACY_HEADING);
        String name = row.mid(LEGACY_NAME);

        flush(airport);
        airport.extend(position);
        pending = new Pending(ParkingType.UNKNOWN, name, position, heading, false, false);
        return flush(airport);
    }

    /**
     * Applies a ramp start metadata row to the staged spot. Fuel spots keep their category, size and radius.
     *
     * @return false if no spot is staged
     */
    public boolean amend(SceneryRow row) {
        if (pending == null) {
            diagnostics.report(Diagnostics.Kind.PROTOCOL_STATE, row, "Ramp start metadata without startup location");
            return false;
        }
        if (pending.type == ParkingType.FUEL) {
            return true;
        }
        String operation = row.value(METADATA_OPERATION);
        String widthCode = row.value(METADATA_WIDTH);

        pending.type = OPERATION_TYPES.getOrDefault(operation, pending.type);
        if (row.has(METADATA_AIRLINES)) {
            pending.airlineCodes = Arrays.stream(row.value(METADATA_AIRLINES).split(","))
                    .map(String::trim)
                    .filter(code -> !code.isEmpty())
                    .map(code -> code.toUpperCase(Locale.ROOT))
                    .toList();
        }

        Optional<WidthCode> width = WidthCode.of(widthCode);
        pending.radius = width.map(w -> w.radius).orElse(WidthCode.FALLBACK_RADIUS);
        ParkingType.Size size = width.map(w -> w.size).orElse(ParkingType.Size.SMALL);
        if (pending.type.isSizeable()) {
            pending.type = pending.type.withSize(size);
        }
        return true;
    }

    /**
     * Commits the staged spot to the airport and updates the parking counters.
     */
    public Optional<Parking> flush(AirportAccumulator airport) {
        if (pending == null) {
            return Optional.empty();
        }
        Parking parking = pending.toParking();
        pending = null;

        AirportAccumulator.Counters counters = airport.counters();
        switch (parking.type().category()) {
            case GATE -> {
                counters.gates++;
                airport.offerLargestGate(parking.type());
            }
            case RAMP_GA -> {
                counters.gaRamps++;
                airport.offerLargestRamp(parking.type());
            }
            case RAMP_CARGO -> counters.cargoRamps++;
            case RAMP_MIL_CARGO -> {
                // military ramps count for cargo and combat alike
                counters.militaryCargoRamps++;
                counters.militaryCombatRamps++;
            }
            default -> {
            }
        }
        airport.addParking(parking);
        return Optional.of(parking);
    }

    public boolean isOpen() {
        return pending != null;
    }

    public Optional<ParkingType> pendingType() {
        return pending == null ? Optional.empty() : Optional.of(pending.type);
    }

    private static final class Pending {
        private final String name;
        private final Coordinate position;
        private final double heading;
        private final boolean avgas;
        private final boolean jetFuel;
        private ParkingType type;
        private int radius = DEFAULT_RADIUS;
        private List<String> airlineCodes = List.of();

        private Pending(ParkingType type, String name, Coordinate position, double heading, boolean avgas,
                        boolean jetFuel) {
            this.type = type;
            this.name = name;
            this.position = position;
            this.heading = heading;
            this.avgas = avgas;
            this.jetFuel = jetFuel;
        }

        private Parking toParking() {
            return new Parking(type, name, position, heading, radius, airlineCodes, avgas, jetFuel);
        }
    }
}
