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

import com.dedicatedcode.kentta.model.AirportRecord;
import com.dedicatedcode.kentta.model.Apron;
import com.dedicatedcode.kentta.model.Com;
import com.dedicatedcode.kentta.model.CompletedAirport;
import com.dedicatedcode.kentta.model.Helipad;
import com.dedicatedcode.kentta.model.Parking;
import com.dedicatedcode.kentta.model.ParkingType;
import com.dedicatedcode.kentta.model.Runway;
import com.dedicatedcode.kentta.model.Start;
import com.dedicatedcode.kentta.model.Surface;
import com.dedicatedcode.kentta.model.TaxiPath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Everything collected for the airport currently open. The dispatcher creates a fresh instance for every airport
 * header and replaces it with an idle one after the flush, nothing is reset in place.
 */
public class AirportAccumulator {

    public enum Mode {
        /** No airport header seen yet. Rows still go somewhere but are never committed. */
        IDLE,
        WRITING,
        /** Duplicate, excluded or malformed header. */
        IGNORING
    }

    private final Mode mode;
    private final AirportIndex.Admission admission;
    private final String ident;
    private final String name;
    private final int elevationFt;
    private final boolean closed;
    private final boolean military;

    private final CrossReferenceIndex index = new CrossReferenceIndex();
    private final Envelope bounds = new Envelope();
    private final Counters counters = new Counters();

    private final List<Runway> runways = new ArrayList<>();
    private final List<Start> starts = new ArrayList<>();
    private final List<Helipad> helipads = new ArrayList<>();
    private final List<Com> coms = new ArrayList<>();
    private final List<Parking> parkings = new ArrayList<>();
    private final List<Apron> aprons = new ArrayList<>();
    private final List<TaxiPath> taxiPaths = new ArrayList<>();

    private String city;
    private String country;
    private String region;
    private String iata;
    private String faa;
    private String icao;
    private double datumLat;
    private double datumLon;

    private Integer atisFrequency;
    private Integer awosFrequency;
    private Integer asosFrequency;
    private Integer unicomFrequency;
    private Integer towerFrequency;

    private Coordinate towerPosition;
    private int towerAltitudeFt;

    private int longestRunwayLength;
    private int longestRunwayWidth;
    private double longestRunwayHeading;
    private Surface longestRunwaySurface = Surface.UNKNOWN;
    private Coordinate longestRunwayCenter;

    private ParkingType largestGate;
    private ParkingType largestRamp;
    private boolean avgas;
    private boolean jetFuel;
    private int helipadStartNumber;

    private AirportAccumulator(Mode mode, AirportIndex.Admission admission, String ident, String name, int elevationFt,
                               boolean closed, boolean military) {
        this.mode = mode;
        this.admission = admission;
        this.ident = ident;
        this.name = name;
        this.elevationFt = elevationFt;
        this.closed = closed;
        this.military = military;
    }

    public static AirportAccumulator idle() {
        return new AirportAccumulator(Mode.IDLE, null, "", "", 0, false, false);
    }

    public static AirportAccumulator ignoring(String ident, AirportIndex.Admission admission) {
        return new AirportAccumulator(Mode.IGNORING, admission, ident, "", 0, false, false);
    }

    /**
     * Opens an airport. Identifiers already admitted in this run or rejected by the filter give an accumulator in
     * {@link Mode#IGNORING} that consumes the rows of that airport without producing anything.
     */
    public static AirportAccumulator begin(AirportIndex airportIndex, String ident, String name, int elevationFt,
                                           boolean closed, boolean military) {
        AirportIndex.Admission admission = airportIndex.admit(ident);
        if (admission != AirportIndex.Admission.ACCEPTED) {
            return ignoring(ident, admission);
        }
        return new AirportAccumulator(Mode.WRITING, admission, ident, name, elevationFt, closed, military);
    }

    /**
     * Builds the committed form through the finalizer. Empty unless this accumulator is writing.
     */
    public Optional<CompletedAirport> flush(AggregateFinalizer finalizer) {
        if (!isWriting()) {
            return Optional.empty();
        }
        return Optional.of(finalizer.finish(this));
    }

    public Mode mode() {
        return mode;
    }

    public Optional<AirportIndex.Admission> admission() {
        return Optional.ofNullable(admission);
    }

    public boolean isWriting() {
        return mode == Mode.WRITING;
    }

    public boolean isIgnoring() {
        return mode == Mode.IGNORING;
    }

    public boolean isIdle() {
        return mode == Mode.IDLE;
    }

    public String ident() {
        return ident;
    }

    public String name() {
        return name;
    }

    public int elevationFt() {
        return elevationFt;
    }

    public boolean closed() {
        return closed;
    }

    public boolean military() {
        return military;
    }

    public CrossReferenceIndex index() {
        return index;
    }

    public Counters counters() {
        return counters;
    }

    /**
     * Grows the bounding rectangle. Every coordinate of the airport passes through here.
     */
    public void extend(Coordinate coordinate) {
        bounds.expandToInclude(coordinate);
    }

    public Envelope bounds() {
        return bounds;
    }

    void addRunway(Runway runway) {
        runways.add(runway);
    }

    void addStart(Start start) {
        starts.add(start);
    }

    void addHelipad(Helipad helipad) {
        helipads.add(helipad);
    }

    void addCom(Com com) {
        coms.add(com);
    }

    void addParking(Parking parking) {
        parkings.add(parking);
    }

    void addApron(Apron apron) {
        aprons.add(apron);
    }

    void addTaxiPath(TaxiPath taxiPath) {
        taxiPaths.add(taxiPath);
    }

    public List<Runway> runways() {
        return Collections.unmodifiableList(runways);
    }

    public List<Start> starts() {
        return Collections.unmodifiableList(starts);
    }

    public List<Helipad> helipads() {
        return Collections.unmodifiableList(helipads);
    }

    public List<Com> coms() {
        return Collections.unmodifiableList(coms);
    }

    public List<Parking> parkings() {
        return Collections.unmodifiableList(parkings);
    }

    public List<Apron> aprons() {
        return Collections.unmodifiableList(aprons);
    }

    public List<TaxiPath> taxiPaths() {
        return Collections.unmodifiableList(taxiPaths);
    }

    void setMetadata(String key, String value) {
        switch (key) {
            case "city" -> city = value;
            case "country" -> country = value;
            case "iata_code" -> iata = value;
            case "faa_code" -> faa = value;
            case "icao_code" -> icao = value;
            default -> {
                if (key.startsWith("region") && !value.isEmpty()) {
                    region = value;
                }
            }
        }
    }

    void setDatumLat(double lat) {
        this.datumLat = lat;
    }

    void setDatumLon(double lon) {
        this.datumLon = lon;
    }

    /**
     * The reference datum, present when both coordinates were given and are not zero.
     */
    public Optional<Coordinate> datum() {
        if (datumLat == 0.0 || datumLon == 0.0) {
            return Optional.empty();
        }
        return Optional.of(new Coordinate(datumLon, datumLat));
    }

    public AirportRecord.AirportMetadata metadata() {
        return new AirportRecord.AirportMetadata(city, country, region, iata, faa, icao);
    }

    void setAtisFrequency(int frequency) {
        this.atisFrequency = frequency;
    }

    void setAwosFrequency(int frequency) {
        this.awosFrequency = frequency;
    }

    void setAsosFrequency(int frequency) {
        this.asosFrequency = frequency;
    }

    void setUnicomFrequency(int frequency) {
        this.unicomFrequency = frequency;
    }

    void setTowerFrequency(int frequency) {
        this.towerFrequency = frequency;
    }

    public AirportRecord.AirportFrequencies frequencies() {
        return new AirportRecord.AirportFrequencies(atisFrequency, awosFrequency, asosFrequency, unicomFrequency,
                                                    towerFrequency);
    }

    void setTower(Coordinate position, int altitudeFt) {
        this.towerPosition = position;
        this.towerAltitudeFt = altitudeFt;
    }

    public Optional<AirportRecord.Tower> tower() {
        return towerPosition == null ? Optional.empty()
                : Optional.of(new AirportRecord.Tower(towerPosition, towerAltitudeFt));
    }

    /**
     * Replaces the longest runway when {@code lengthFt} is strictly greater, so the first of equal runways stays.
     */
    boolean offerLongestRunway(int lengthFt, int widthFt, double heading, Surface surface, Coordinate center) {
        if (lengthFt <= longestRunwayLength) {
            return false;
        }
        longestRunwayLength = lengthFt;
        longestRunwayWidth = widthFt;
        longestRunwayHeading = heading;
        longestRunwaySurface = surface;
        longestRunwayCenter = center;
        return true;
    }

    public AirportRecord.LongestRunway longestRunway() {
        return new AirportRecord.LongestRunway(longestRunwayLength, longestRunwayWidth, longestRunwayHeading,
                                               longestRunwaySurface);
    }

    public Optional<Coordinate> longestRunwayCenter() {
        return Optional.ofNullable(longestRunwayCenter);
    }

    /**
     * Keeps the larger of the current and the offered type. Never decreases.
     */
    void offerLargestGate(ParkingType type) {
        if (largestGate == null || type.isLargerThan(largestGate)) {
            largestGate = type;
        }
    }

    void offerLargestRamp(ParkingType type) {
        if (largestRamp == null || type.isLargerThan(largestRamp)) {
            largestRamp = type;
        }
    }

    public Optional<ParkingType> largestGate() {
        return Optional.ofNullable(largestGate);
    }

    public Optional<ParkingType> largestRamp() {
        return Optional.ofNullable(largestRamp);
    }

    void markAvgas() {
        avgas = true;
    }

    void markJetFuel() {
        jetFuel = true;
    }

    public boolean avgas() {
        return avgas;
    }

    public boolean jetFuel() {
        return jetFuel;
    }

    int nextHelipadStartNumber() {
        return ++helipadStartNumber;
    }

    /**
     * Running counters that are not simply the size of a child list.
     */
    public static final class Counters {
        int hardRunways;
        int softRunways;
        int waterRunways;
        int lightedRunways;
        int runwayEndsWithAls;
        int runwayEndsWithVasi;
        int gates;
        int gaRamps;
        int cargoRamps;
        int militaryCargoRamps;
        int militaryCombatRamps;

        public int runways() {
            return hardRunways + softRunways + waterRunways;
        }

        public int hardRunways() {
            return hardRunways;
        }

        public int softRunways() {
            return softRunways;
        }

        public int waterRunways() {
            return waterRunways;
        }

        public int lightedRunways() {
            return lightedRunways;
        }

        public int runwayEndsWithAls() {
            return runwayEndsWithAls;
        }

        public int runwayEndsWithVasi() {
            return runwayEndsWithVasi;
        }

        public int gates() {
            return gates;
        }

        public int gaRamps() {
            return gaRamps;
        }

        public int cargoRamps() {
            return cargoRamps;
        }

        public int militaryCargoRamps() {
            return militaryCargoRamps;
        }

        public int militaryCombatRamps() {
            return militaryCombatRamps;
        }
    }
}
