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

import com.dedicatedcode.kentta.service.importer.SceneryFilter;

import java.util.HashSet;
import java.util.Set;

/**
 * Remembers every airport identifier admitted during one import run.
 */
public class AirportIndex {

    public enum Admission {
        ACCEPTED, DUPLICATE, EXCLUDED
    }

    private final Set<String> idents = new HashSet<>();
    private final SceneryFilter filter;

    public AirportIndex(SceneryFilter filter) {
        this.filter = filter;
    }

    public Admission admit(String ident) {
        if (!filter.includeAirport(ident)) {
            return Admission.EXCLUDED;
        }
        return idents.add(ident) ? Admission.ACCEPTED : Admission.DUPLICATE;
    }

    /**
     * Copy of the admitted identifiers, used to undo the admissions of a file that is rolled back.
     */
    public Set<String> snapshot() {
        return new HashSet<>(idents);
    }

    public void restore(Set<String> snapshot) {
        idents.retainAll(snapshot);
        idents.addAll(snapshot);
    }

    public boolean contains(String ident) {
        return idents.contains(ident);
    }

    public int size() {
        return idents.size();
    }
}
