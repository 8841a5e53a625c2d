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

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Filter backed by include and exclude lists of case-insensitive wildcard patterns ({@code *} and {@code ?}).
 * <p>
 * Evaluation per category: no patterns at all includes everything, exclude-only lists drop matches, include-only
 * lists keep only matches and when both lists are present an object has to match an include pattern and no exclude
 * pattern.
 */
public class PatternSceneryFilter implements SceneryFilter {

    private final PatternList airports;
    private final PatternList paths;
    private final PatternList filenames;

    public PatternSceneryFilter(KenttaConfiguration.FilterConfiguration configuration) {
        this.airports = new PatternList(configuration.getIncludeAirports(), configuration.getExcludeAirports());
        this.paths = new PatternList(normalizePaths(configuration.getIncludePaths()),
                                     normalizePaths(configuration.getExcludePaths()));
        this.filenames = new PatternList(configuration.getIncludeFilenames(), configuration.getExcludeFilenames());
    }

    @Override
    public boolean includeAirport(String ident) {
        return airports.includes(ident);
    }

    @Override
    public boolean includePath(String path) {
        return paths.includes(normalizePath(path));
    }

    @Override
    public boolean includeFilename(String filename) {
        String name = filename.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        return filenames.includes(slash >= 0 ? name.substring(slash + 1) : name);
    }

    static String normalizePath(String path) {
        String normalized = path.replace('\\', '/');
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        if (!normalized.endsWith("/")) {
            normalized = normalized + "/";
        }
        return normalized;
    }

    private static List<String> normalizePaths(List<String> paths) {
        return paths.stream().map(PatternSceneryFilter::normalizePath).toList();
    }

    static Pattern toPattern(String wildcard) {
        StringBuilder regex = new StringBuilder();
        for (char c : wildcard.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static final class PatternList {
        private final List<Pattern> include;
        private final List<Pattern> exclude;

        private PatternList(List<String> include, List<String> exclude) {
            this.include = include.stream().map(String::trim).filter(s -> !s.isEmpty())
                    .map(PatternSceneryFilter::toPattern).toList();
            this.exclude = exclude.stream().map(String::trim).filter(s -> !s.isEmpty())
                    .map(PatternSceneryFilter::toPattern).toList();
        }

        boolean includes(String value) {
            if (include.isEmpty() && exclude.isEmpty()) {
                return true;
            }
            String text = value == null ? "" : value.toLowerCase(Locale.ROOT);
            boolean excluded = matches(exclude, text);
            if (include.isEmpty()) {
                return !excluded;
            }
            boolean included = matches(include, text);
            return exclude.isEmpty() ? included : included && !excluded;
        }

        private static boolean matches(List<Pattern> patterns, String text) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(text).matches()) {
                    return true;
                }
            }
            return false;
        }
    }
}
