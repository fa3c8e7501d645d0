package com.deckinverter.config;

import com.deckinverter.worker.DocumentWorker;
import com.deckinverter.worker.WorkerLaunchSettings;
import com.deckinverter.worker.WorkerPoolFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * Worker beans. The process backend starts worker JVMs with the current
 * class path unless {@code inverter.worker.classpath} says otherwise.
 */
@Slf4j
@Configuration
public class WorkerConfig {

    @Value("${inverter.worker.java-command:}")
    private String javaCommand;

    @Value("${inverter.worker.classpath:}")
    private String classpath;

    /** Space separated, e.g. {@code -Xmx512m}. */
    @Value("${inverter.worker.jvm-args:}")
    private String jvmArgs;

    @Bean
    public DocumentWorker documentWorker() {
        return new DocumentWorker();
    }

    @Bean
    public WorkerLaunchSettings workerLaunchSettings() {
        WorkerLaunchSettings.WorkerLaunchSettingsBuilder builder = WorkerLaunchSettings.builder();
        if (!javaCommand.isBlank()) {
            builder.javaCommand(javaCommand);
        }
        if (!classpath.isBlank()) {
            builder.classpath(classpath);
        }
        if (!jvmArgs.isBlank()) {
            builder.jvmArgs(List.copyOf(Arrays.asList(jvmArgs.trim().split("\\s+"))));
        }
        WorkerLaunchSettings settings = builder.build();
        log.debug("Worker processes start with {}", settings.getJavaCommand());
        return settings;
    }

    @Bean
    public WorkerPoolFactory workerPoolFactory(DocumentWorker documentWorker, WorkerLaunchSettings workerLaunchSettings) {
        return new WorkerPoolFactory(documentWorker, workerLaunchSettings);
    }
}
