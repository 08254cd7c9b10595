package com.repo.cccp.report;

import com.repo.cccp.core.UnitScores;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class CsvReporter {

    static final String HEADER = "file,PlanDepth,MPI";

    public void generate(List<UnitScores> data, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toCsv(data));
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    public String toCsv(List<UnitScores> data) {
        StringBuilder csv = new StringBuilder();
        csv.append(HEADER).append('\n');

        for (UnitScores d : data) {
            csv.append(String.format("%s,%d,%d\n",
                    escape(d.unitId()),
                    d.planDepth(),
                    d.maxPlanIndex()));
        }
        return csv.toString();
    }

    private String escape(String s) {
        if (s == null)
            return "";
        // Quote fields containing separators, doubling embedded quotes
        if (s.contains(",") || s.contains("\"") || s.contains("\n")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
