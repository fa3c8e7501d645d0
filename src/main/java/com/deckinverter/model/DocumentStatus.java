package com.deckinverter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-document progress event sent to streaming clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentStatus {

    private String name;

    private String outputName;

    private boolean succeeded;

    private Long outputSize;

    private List<String> warnings;

    /** Documents finished so far, including this one. */
    private int completed;

    public static DocumentStatus from(ProcessingResult result, int completed) {
        return DocumentStatus.builder()
                .name(result.getName())
                .outputName(result.getOutputName())
                .succeeded(result.isSucceeded())
                .outputSize(result.getOutput().map(bytes -> (long) bytes.length).orElse(null))
                .warnings(result.getWarnings())
                .completed(completed)
                .build();
    }
}
