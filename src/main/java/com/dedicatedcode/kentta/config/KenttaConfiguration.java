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

package com.dedicatedcode.kentta.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Name;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "kentta")
public class KenttaConfiguration {

    private String dataDir = "./data";

    private String databasePath = "./data/airports.db";
    @Name("import")
    private ImportConfiguration importConfiguration = new ImportConfiguration();
    @Name("filter")
    private FilterConfiguration filterConfiguration = new FilterConfiguration();

    public ImportConfiguration getImportConfiguration() {
        return importConfiguration;
    }

    public void setImportConfiguration(ImportConfiguration importConfiguration) {
        this.importConfiguration = importConfiguration;
    }

    public FilterConfiguration getFilterConfiguration() {
        return filterConfiguration;
    }

    public void setFilterConfiguration(FilterConfiguration filterConfiguration) {
        this.filterConfiguration = filterConfiguration;
    }

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    public static class ImportConfiguration {

        /**
         * Rounding of runway length and width in feet: 0 rounds to the nearest foot, 1 to the nearest 10 feet and so on.
         */
        private int lengthPrecision = 0;
        /**
         * Marks every imported airport as add-on scenery.
         */
        private boolean addon = false;
        /**
         * Marks every imported airport as having 3D scenery.
         */
        private boolean threeD = false;
        /**
         * Wildcard for scenery files picked up when a directory is imported.
         */
        private String fileNamePattern = "apt.dat";
        /**
         * Drops and recreates all airport tables before importing.
         */
        private boolean recreateSchema = true;

        public int getLengthPrecision() {
            return lengthPrecision;
        }

        public void setLengthPrecision(int lengthPrecision) {
            this.lengthPrecision = Math.max(0, lengthPrecision);
        }

        public boolean isAddon() {
            return addon;
        }

        public void setAddon(boolean addon) {
            this.addon = addon;
        }

        public boolean isThreeD() {
            return threeD;
        }

        public void setThreeD(boolean threeD) {
            this.threeD = threeD;
        }

        public String getFileNamePattern() {
            return fileNamePattern;
        }

        public void setFileNamePattern(String fileNamePattern) {
            this.fileNamePattern = fileNamePattern;
        }

        public boolean isRecreateSchema() {
            return recreateSchema;
        }

        public void setRecreateSchema(boolean recreateSchema) {
            this.recreateSchema = recreateSchema;
        }
    }

    public static class FilterConfiguration {

        private List<String> includeAirports = new ArrayList<>();
        private List<String> excludeAirports = new ArrayList<>();
        private List<String> includePaths = new ArrayList<>();
        private List<String> excludePaths = new ArrayList<>();
        private List<String> includeFilenames = new ArrayList<>();
        private List<String> excludeFilenames = new ArrayList<>();

        public List<String> getIncludeAirports() {
            return includeAirports;
        }

        public void setIncludeAirports(List<String> includeAirports) {
            this.includeAirports = includeAirports;
        }

        public List<String> getExcludeAirports() {
            return excludeAirports;
        }

        public void setExcludeAirports(List<String> excludeAirports) {
            this.excludeAirports = excludeAirports;
        }

        public List<String> getIncludePaths() {
            return includePaths;
        }

        public void setIncludePaths(List<String> includePaths) {
            this.includePaths = includePaths;
        }

        public List<String> getExcludePaths() {
            return excludePaths;
        }

        public void setExcludePaths(List<String> excludePaths) {
            this.excludePaths = excludePaths;
        }

        public List<String> getIncludeFilenames() {
            return includeFilenames;
        }

        public void setIncludeFilenames(List<String> includeFilenames) {
            this.includeFilenames = includeFilenames;
        }

        public List<String> getExcludeFilenames() {
            return excludeFilenames;
        }

        public void setExcludeFilenames(List<String> excludeFilenames) {
            this.excludeFilenames = excludeFilenames;
        }
    }
}
