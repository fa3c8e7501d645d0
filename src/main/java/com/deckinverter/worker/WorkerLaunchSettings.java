package com.deckinverter.worker;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * How the process backend starts a worker JVM.
 */
@Slf4j
@Value
@Builder
public class WorkerLaunchSettings {

    /** Manifest attribute that marks a Spring Boot executable jar. */
    static final String BOOT_CLASSES_ATTRIBUTE = "Spring-Boot-Classes";

    /** Path of the {@code java} executable. */
    @Builder.Default
    String javaCommand = defaultJavaCommand();

    /** Class path of the worker JVM; the current JVM's by default. */
    @Builder.Default
    String classpath = System.getProperty("java.class.path");

    /** Extra JVM options, e.g. a heap limit. */
    @Builder.Default
    List<String> jvmArgs = List.of();

    public static WorkerLaunchSettings defaults() {
        return builder().build();
    }

    /**
     * Whether the class path is a single Spring Boot executable jar. Its
     * classes sit under {@code BOOT-INF/}, so the worker has to be started
     * through the Boot launcher rather than by class name.
     */
    public boolean isBootJar() {
        if (classpath == null || classpath.contains(File.pathSeparator)
                || !classpath.toLowerCase(Locale.ROOT).endsWith(".jar") || !new File(classpath).isFile()) {
            return false;
        }
        try (JarFile jar = new JarFile(classpath)) {
            Manifest manifest = jar.getManifest();
            return manifest != null && manifest.getMainAttributes().getValue(BOOT_CLASSES_ATTRIBUTE) != null;
        } catch (IOException e) {
            log.debug("Unable to read manifest of {}: {}", classpath, e.getMessage());
            return false;
        }
    }

    static String defaultJavaCommand() {
        return System.getProperty("java.home") + File.separator + "bin" + File.separator + "java";
    }
}
