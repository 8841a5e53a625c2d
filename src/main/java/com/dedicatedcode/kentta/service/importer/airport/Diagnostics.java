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

import com.dedicatedcode.kentta.service.importer.SceneryRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Collects the non-fatal anomalies of one scenery file. Every report is logged with a {@code file:line} prefix and
 * counted by kind.
 */
public class Diagnostics {

    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    public enum Kind {
        /** A handler ran while its required state was not active. */
        PROTOCOL_STATE,
        /** Duplicate or filtered airport, its rows are consumed without effect. */
        IGNORED_AIRPORT,
        /** A reference to a runway end or taxi node could not be resolved. */
        UNRESOLVED_REFERENCE,
        /** Missing or collapsed bounding rectangle, or pavement without a boundary. */
        DEGENERATE_GEOMETRY,
        /** Missing field or unparsable value. */
        MALFORMED_ROW
    }

    private final SceneryFileContext context;
    private final Map<Kind, Integer> counts = new EnumMap<>(Kind.class);

    public Diagnostics(SceneryFileContext context) {
        this.context = context;
    }

    public void report(Kind kind, SceneryRow row, String message, Object... args) {
        report(kind, context.messagePrefix(row), message, args);
    }

    public void report(Kind kind, String location, String message, Object... args) {
        counts.merge(kind, 1, Integer::sum);
        String text = MessageFormatter.arrayFormat(message, args).getMessage();
        if (kind == Kind.IGNORED_AIRPORT) {
            logger.info("{} {}", location, text);
        } else {
            logger.warn("{} [{}] {}", location, kind, text);
        }
    }

    public String fileName() {
        return context.fileName();
    }

    public int count(Kind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<Kind, Integer> snapshot() {
        return counts.isEmpty() ? Map.of() : new EnumMap<>(counts);
    }
}
