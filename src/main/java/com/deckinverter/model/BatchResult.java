package com.deckinverter.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a blocking batch call: every per-document result plus the
 * assembled output archive.
 */
@Value
public class BatchResult {

    List<ProcessingResult> results;

    /** Zip archive holding every succeeded deck; empty when nothing was submitted. */
    byte[] outputArchive;

    public int getTotalFiles() {
        return results.size();
    }

    public int getSuccessfulFiles() {
        return (int) results.stream().filter(ProcessingResult::isSucceeded).count();
    }

    /** Warnings of all documents, each prefixed with its document name. */
    public List<String> allWarnings() {
        List<String> warnings = new ArrayList<>();
        for (ProcessingResult result : results) {
            for (String warning : result.getWarnings()) {
                warnings.add(result.getName() + ": " + warning);
            }
        }
        return warnings;
    }
}
