package com.deckinverter.worker;

import com.deckinverter.model.ProcessingResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result metadata a worker process writes next to the output deck.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkerReport {

    private String name;

    private String outputName;

    private boolean succeeded;

    private List<String> warnings = new ArrayList<>();

    static WorkerReport from(ProcessingResult result) {
        return new WorkerReport(result.getName(), result.getOutputName(), result.isSucceeded(),
                new ArrayList<>(result.getWarnings()));
    }

    ProcessingResult toResult(byte[] outputBytes) {
        List<String> reported = warnings != null ? warnings : List.of();
        return succeeded
                ? ProcessingResult.success(name, outputName, outputBytes, reported)
                : ProcessingResult.failure(name, outputName, reported);
    }
}
