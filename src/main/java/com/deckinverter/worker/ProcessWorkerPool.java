package com.deckinverter.worker;

import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.SerializedConfig;
import com.deckinverter.util.DeckArchives;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs every document in its own JVM ({@link WorkerMain}). A crash, an
 * out-of-memory error or a native codec failure only takes down that
 * document's process.
 * <p>
 * Documents travel through a private temp directory: the input deck is
 * written there, the worker writes the output deck and a JSON
 * {@link WorkerReport} next to it.
 * <p>
 * From a repackaged Spring Boot jar the worker is started through the Boot
 * {@code PropertiesLauncher} with {@code loader.main} naming {@link WorkerMain}.
 */
@Slf4j
public class ProcessWorkerPool implements WorkerPool {

    /** Boot launcher that runs the class named by {@code loader.main} from a repackaged jar. */
    static final String BOOT_LAUNCHER = "org.springframework.boot.loader.launch.PropertiesLauncher";

    private final int maxWorkers;
    private final WorkerLaunchSettings settings;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ProcessWorkerPool(int maxWorkers, WorkerLaunchSettings settings) {
        this.maxWorkers = maxWorkers;
        this.settings = settings;
        this.executor = WorkerThreads.fixedPool("deck-process", maxWorkers);
    }

    @Override
    public CompletableFuture<ProcessingResult> submit(DocumentSource document, SerializedConfig config) {
        return CompletableFuture.supplyAsync(() -> runWorker(document, config), executor);
    }

    @Override
    public int getMaxWorkers() {
        return maxWorkers;
    }

    @Override
    public void close() {
        executor.shutdown();
        log.debug("Process worker pool closed");
    }

    ProcessingResult runWorker(DocumentSource document, SerializedConfig config) {
        String name = document.getName();
        String outputName = DeckArchives.outputName(name, config.decode().getFileSuffix());
        Path workDir = null;
        Process process = null;
        try {
            workDir = Files.createTempDirectory("deck-inverter-");
            Path input = workDir.resolve("input.pptx");
            Path output = workDir.resolve("output.pptx");
            Path report = workDir.resolve("report.json");
            Files.write(input, document.getData());

            List<String> command = buildCommand(config, name, input, output, report);
            log.debug("Starting worker process for {}", name);
            process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();

            int exitCode = process.waitFor();
            if (exitCode != WorkerMain.EXIT_OK || !Files.exists(report)) {
                log.warn("Worker process for {} exited with code {}", name, exitCode);
                return ProcessingResult.failure(name, outputName,
                        "Processing failed: worker process exited with code " + exitCode);
            }

            WorkerReport workerReport = objectMapper.readValue(report.toFile(), WorkerReport.class);
            byte[] outputBytes = workerReport.isSucceeded() ? Files.readAllBytes(output) : null;
            return workerReport.toResult(outputBytes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            return ProcessingResult.failure(name, outputName, "Processing interrupted");
        } catch (IOException e) {
            log.error("Worker process I/O failed for {}", name, e);
            return ProcessingResult.failure(name, outputName, "Processing failed: " + e.getMessage());
        } finally {
            deleteQuietly(workDir);
        }
    }

    List<String> buildCommand(SerializedConfig config, String name, Path input, Path output, Path report) {
        List<String> command = new ArrayList<>();
        command.add(settings.getJavaCommand());
        command.add("-Djava.awt.headless=true");
        command.addAll(settings.getJvmArgs());
        boolean bootJar = settings.isBootJar();
        if (bootJar) {
            command.add("-Dloader.main=" + WorkerMain.class.getName());
        }
        command.add("-cp");
        command.add(settings.getClasspath());
        command.add(bootJar ? BOOT_LAUNCHER : WorkerMain.class.getName());
        command.add(config.asString());
        command.add(name);
        command.add(input.toString());
        command.add(output.toString());
        command.add(report.toString());
        return command;
    }

    private static void deleteQuietly(Path workDir) {
        if (workDir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            log.debug("Unable to delete worker directory {}: {}", workDir, e.getMessage());
        }
    }
}
