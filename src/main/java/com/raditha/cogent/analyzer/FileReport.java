package com.raditha.cogent.analyzer;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Results for one source file.
 *
 * @param file      path of the file as it was scanned
 * @param functions every function found, in source order of completion
 * @param error     why the file could not be analyzed, or null
 */
public record FileReport(String file, List<FunctionReport> functions, @Nullable String error) {

    public FileReport {
        functions = List.copyOf(functions);
    }

    public static FileReport failed(String file, String error) {
        return new FileReport(file, List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasFindings() {
        return functions.stream().anyMatch(FunctionReport::hasFindings);
    }

    /**
     * Get count of findings across all functions.
     */
    public int findingCount() {
        return functions.stream().mapToInt(f -> f.findings().size()).sum();
    }

    /**
     * Functions with at least one finding.
     */
    public List<FunctionReport> flagged() {
        return functions.stream().filter(FunctionReport::hasFindings).toList();
    }
}
