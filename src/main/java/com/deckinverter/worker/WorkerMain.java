package com.deckinverter.worker;

import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.SerializedConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point of a worker JVM started by {@link ProcessWorkerPool}.
 * <pre>
 * WorkerMain &lt;serialized-config&gt; &lt;document-name&gt; &lt;input&gt; &lt;output&gt; &lt;report&gt;
 * </pre>
 * Exit code 0 means a report was written (the document itself may still
 * have failed); any other code means the worker broke down.
 */
@Slf4j
public final class WorkerMain {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private WorkerMain() { }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length != 5) {
            log.error("Usage: WorkerMain <serialized-config> <document-name> <input> <output> <report>");
            return EXIT_USAGE;
        }
        try {
            SerializedConfig config = SerializedConfig.of(args[0]);
            String name = args[1];
            Path input = Path.of(args[2]);
            Path output = Path.of(args[3]);
            Path report = Path.of(args[4]);

            byte[] data = Files.readAllBytes(input);
            ProcessingResult result = new DocumentWorker().process(DocumentSource.of(name, data), config);

            if (result.isSucceeded()) {
                Files.write(output, result.getOutputBytes());
            }
            new ObjectMapper().writeValue(report.toFile(), WorkerReport.from(result));
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Worker failed", e);
            return EXIT_FAILURE;
        }
    }
}
