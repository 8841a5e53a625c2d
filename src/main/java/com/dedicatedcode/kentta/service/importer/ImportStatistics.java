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

import com.dedicatedcode.kentta.service.importer.airport.Diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class ImportStatistics {

    public enum Stage {
        DISCOVERY,
        READ,
        DISPATCH,
        STORE,
        OVERALL
    }

    public enum Kind {
        IO,
        STORE,
        CANCELLED,
        OVERALL
    }

    public record ImportError(Stage stage, Kind kind, String fileName, String label, String message) {
    }

    private final AtomicLong filesFound = new AtomicLong(0);
    private final AtomicLong filesImported = new AtomicLong(0);
    private final AtomicLong filesSkipped = new AtomicLong(0);
    private final AtomicLong filesFailed = new AtomicLong(0);
    private final AtomicLong rowsRead = new AtomicLong(0);
    private final AtomicLong airportsWritten = new AtomicLong(0);
    private final Map<Diagnostics.Kind, AtomicLong> diagnostics = new EnumMap<>(Diagnostics.Kind.class);
    private final List<ImportError> errors = Collections.synchronizedList(new ArrayList<>());
    private final long startTime = System.currentTimeMillis();
    private volatile long totalTime;

    public ImportStatistics() {
        for (Diagnostics.Kind kind : Diagnostics.Kind.values()) {
            diagnostics.put(kind, new AtomicLong(0));
        }
    }

    public long getFilesFound() {
        return filesFound.get();
    }

    public void setFilesFound(long count) {
        filesFound.set(count);
    }

    public long getFilesImported() {
        return filesImported.get();
    }

    public void incrementFilesImported() {
        filesImported.incrementAndGet();
    }

    public long getFilesSkipped() {
        return filesSkipped.get();
    }

    public void incrementFilesSkipped() {
        filesSkipped.incrementAndGet();
    }

    public long getFilesFailed() {
        return filesFailed.get();
    }

    public long getRowsRead() {
        return rowsRead.get();
    }

    public void addRowsRead(long count) {
        rowsRead.addAndGet(count);
    }

    public long getAirportsWritten() {
        return airportsWritten.get();
    }

    public void addAirportsWritten(long count) {
        airportsWritten.addAndGet(count);
    }

    public void addDiagnostics(Diagnostics fileDiagnostics) {
        for (Diagnostics.Kind kind : Diagnostics.Kind.values()) {
            diagnostics.get(kind).addAndGet(fileDiagnostics.count(kind));
        }
    }

    public long getDiagnostics(Diagnostics.Kind kind) {
        return diagnostics.get(kind).get();
    }

    public long getIgnoredAirports() {
        return getDiagnostics(Diagnostics.Kind.IGNORED_AIRPORT);
    }

    public void recordError(Stage stage, Kind kind, String fileName, String label, Exception e) {
        if (stage != Stage.OVERALL) {
            filesFailed.incrementAndGet();
        }
        errors.add(new ImportError(stage, kind, fileName, label, e.getMessage()));
    }

    public List<ImportError> getErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public long getStartTime() {
        return startTime;
    }

    public long getTotalTime() {
        return totalTime;
    }

    public void setTotalTime(long t) {
        this.totalTime = t;
    }

    public void printFinalStatistics() {
        System.out.println("\n\033[1;36m" + "═".repeat(80) + "\n" + centerText("FINAL IMPORT STATISTICS") + "\n" + "═".repeat(80) + "\033[0m");

        double totalSeconds = Math.max(1, getTotalTime()) / 1000.0;
        System.out.printf("\n\033[1;37mTotal Import Time:\033[0m \033[1;33m%s\033[0m%n%n", formatTime(getTotalTime()));

        System.out.println("\033[1;37mProcessing Summary:\033[0m");
        System.out.println("┌─────────────────┬─────────────────┬─────────────────┐");
        System.out.println("│ \033[1mEntity Type\033[0m     │ \033[1mTotal Count\033[0m     │ \033[1mAvg Speed\033[0m       │");
        System.out.println("├─────────────────┼─────────────────┼─────────────────┤");
        System.out.printf("│ \033[32mScenery Files\033[0m   │ %15s │ %13s/s │%n",
                          formatCompactNumber(getFilesImported()),
                          formatCompactNumber((long) (getFilesImported() / totalSeconds)));
        System.out.printf("│ \033[37mRows\033[0m            │ %15s │ %13s/s │%n",
                          formatCompactNumber(getRowsRead()),
                          formatCompactNumber((long) (getRowsRead() / totalSeconds)));
        System.out.printf("│ \033[34mAirports\033[0m        │ %15s │ %13s/s │%n",
                          formatCompactNumber(getAirportsWritten()),
                          formatCompactNumber((long) (getAirportsWritten() / totalSeconds)));
        System.out.println("└─────────────────┴─────────────────┴─────────────────┘");

        System.out.printf("%n\033[1;37mFiles:\033[0m %d found, %d imported, %d skipped, %d failed%n",
                          getFilesFound(), getFilesImported(), getFilesSkipped(), getFilesFailed());
        System.out.println("\n\033[1;37mDiagnostics:\033[0m");
        for (Diagnostics.Kind kind : Diagnostics.Kind.values()) {
            System.out.printf("  • %-22s %d%n", kind.name().toLowerCase() + ":", getDiagnostics(kind));
        }
        System.out.println();
    }

    public void printOutcomeAndErrors() {
        List<ImportError> snapshot = getErrors();
        if (snapshot.isEmpty()) {
            System.out.println("\033[1;32mNo errors.\033[0m");
            return;
        }
        System.out.printf("\033[1;31m%d error(s):\033[0m%n", snapshot.size());
        for (ImportError error : snapshot) {
            System.out.printf("  • [%s/%s] %s %s: %s%n", error.stage(), error.kind(),
                              error.fileName() == null ? "-" : error.fileName(), error.label(), error.message());
        }
    }

    public void printPhaseHeader(String phase) {
        System.out.println("\n\033[1;36m" + "─".repeat(80) + "\n" + phase + "\n" + "─".repeat(80) + "\033[0m");
    }

    public void printFileSummary(String fileName, long rows, long airports, long fileStartTime) {
        long fileTime = System.currentTimeMillis() - fileStartTime;
        System.out.printf("\u001B[1;32m✓\u001B[0m %s: %s rows, %s airports \u001B[2m(%s)\u001B[0m%n", fileName,
                          formatCompactNumber(rows), formatCompactNumber(airports), formatTime(fileTime));
    }

    public void printSuccess() {
        System.out.println("\n\033[1;32m" + "=".repeat(80) + "\n" + centerText("IMPORT COMPLETED SUCCESSFULLY") + "\n" + "=".repeat(80) + "\033[0m");
    }

    public void printError(String message) {
        System.out.println("\n\033[1;31m" + "=".repeat(80) + "\n" + centerText(message) + "\n" + "=".repeat(80) + "\033[0m");
    }

    private String formatTime(long ms) {
        long s = ms / 1000;
        return String.format("%d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }

    private String formatCompactNumber(long n) {
        if (n < 1000) return String.valueOf(n);
        if (n < 1_000_000) return String.format("%.2fk", n / 1000.0);
        return String.format("%.3fM", n / 1_000_000.0);
    }

    private String centerText(String text) {
        int pad = (80 - text.length()) / 2;
        return " ".repeat(Math.max(0, pad)) + text;
    }
}
