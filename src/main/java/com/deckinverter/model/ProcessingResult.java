package com.deckinverter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of processing a single document.
 */
@Value
public class ProcessingResult {

    /** Display name of the input document, unique within a batch. */
    String name;

    /** Archive entry name for the inverted deck. */
    String outputName;

    boolean succeeded;

    byte[] outputBytes;

    /** Non-fatal issues in the order they were found. Never null. */
    List<String> warnings;

    @Builder
    private ProcessingResult(String name, String outputName, boolean succeeded, byte[] outputBytes,
                             @Singular List<String> warnings) {
        this.name = name;
        this.outputName = outputName;
        this.succeeded = succeeded;
        this.outputBytes = outputBytes == null ? null : outputBytes.clone();
        this.warnings = warnings;
    }

    /** A copy of the inverted deck, or null when processing failed. */
    public byte[] getOutputBytes() {
        return outputBytes == null ? null : outputBytes.clone();
    }

    public Optional<byte[]> getOutput() {
        return Optional.ofNullable(getOutputBytes());
    }

    public static ProcessingResult success(String name, String outputName, byte[] outputBytes, List<String> warnings) {
        return ProcessingResult.builder()
                .name(name)
                .outputName(outputName)
                .succeeded(true)
                .outputBytes(outputBytes)
                .warnings(warnings)
                .build();
    }

    public static ProcessingResult failure(String name, String outputName, String warning) {
        return failure(name, outputName, List.of(warning));
    }

    public static ProcessingResult failure(String name, String outputName, List<String> warnings) {
        return ProcessingResult.builder()
                .name(name)
                .outputName(outputName)
                .succeeded(false)
                .warnings(warnings)
                .build();
    }
}
