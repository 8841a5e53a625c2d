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

import com.dedicatedcode.kentta.config.KenttaConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternSceneryFilterTest {

    @Test
    void testEmptyConfigurationIncludesEverything() {
        PatternSceneryFilter filter = new PatternSceneryFilter(new KenttaConfiguration.FilterConfiguration());

        assertTrue(filter.includeAirport("EDDF"));
        assertTrue(filter.includePath("Custom Scenery/EDDF"));
        assertTrue(filter.includeFilename("apt.dat"));
    }

    @Test
    void testIncludeAndExcludeAirports() {
        KenttaConfiguration.FilterConfiguration configuration = new KenttaConfiguration.FilterConfiguration();
        configuration.setIncludeAirports(List.of("ED*", "EF??"));
        configuration.setExcludeAirports(List.of("EDDT"));
        PatternSceneryFilter filter = new PatternSceneryFilter(configuration);

        assertTrue(filter.includeAirport("EDDF"));
        assertTrue(filter.includeAirport("eddm"));
        assertTrue(filter.includeAirport("EFHK"));
        assertFalse(filter.includeAirport("EFHKX"));
        assertFalse(filter.includeAirport("EDDT"));
        assertFalse(filter.includeAirport("KSEA"));
    }

    @Test
    void testExcludeOnly() {
        KenttaConfiguration.FilterConfiguration configuration = new KenttaConfiguration.FilterConfiguration();
        configuration.setExcludeAirports(List.of("K*"));
        PatternSceneryFilter filter = new PatternSceneryFilter(configuration);

        assertTrue(filter.includeAirport("EDDF"));
        assertFalse(filter.includeAirport("KSEA"));
    }

    @Test
    void testPathsAreNormalized() {
        KenttaConfiguration.FilterConfiguration configuration = new KenttaConfiguration.FilterConfiguration();
        configuration.setExcludePaths(List.of("*/Custom Scenery/*"));
        PatternSceneryFilter filter = new PatternSceneryFilter(configuration);

        assertFalse(filter.includePath("Custom Scenery"));
        assertFalse(filter.includePath("X-Plane\\Custom Scenery\\EDDF"));
        assertTrue(filter.includePath("Global Scenery/Global Airports"));
        assertEquals("/a/b/", PatternSceneryFilter.normalizePath("a\\b"));
        assertEquals("/", PatternSceneryFilter.normalizePath(""));
    }

    @Test
    void testFilenameMatchesLastPathElement() {
        KenttaConfiguration.FilterConfiguration configuration = new KenttaConfiguration.FilterConfiguration();
        configuration.setIncludeFilenames(List.of("apt*.dat"));
        PatternSceneryFilter filter = new PatternSceneryFilter(configuration);

        assertTrue(filter.includeFilename("/scenery/apt.dat"));
        assertTrue(filter.includeFilename("APT_2.DAT"));
        assertFalse(filter.includeFilename("/apt/earth_nav.dat"));
    }
}
