package com.dedicatedcode.kentta.service.importer.airport;

import com.dedicatedcode.kentta.service.importer.SceneryFilter;
import com.dedicatedcode.kentta.service.importer.SceneryRow;

final class TestAirports {

    private TestAirports() {
    }

    static AirportAccumulator writing(String ident) {
        return AirportAccumulator.begin(new AirportIndex(SceneryFilter.INCLUDE_ALL), ident, "Test Field", 100, false,
                                        false);
    }

    static Diagnostics diagnostics() {
        return new Diagnostics(SceneryFileContext.of(1, "apt.dat"));
    }

    static SceneryRow row(String line) {
        return SceneryRow.parse(line, 1);
    }
}
