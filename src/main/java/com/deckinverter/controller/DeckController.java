package com.deckinverter.controller;

import com.deckinverter.model.BatchResult;
import com.deckinverter.model.ConcurrencyOptions;
import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.DocumentStatus;
import com.deckinverter.model.ErrorResponse;
import com.deckinverter.model.InversionConfig;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.RgbColor;
import com.deckinverter.model.WorkerBackend;
import com.deckinverter.service.DeckProcessingService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

@Slf4j
@RestController
@RequestMapping("/api/deck")
@RequiredArgsConstructor
public class DeckController {

    public static final String WARNINGS_HEADER = "X-Inverter-Warnings";
    public static final String SUCCEEDED_HEADER = "X-Inverter-Succeeded";

    private static final MediaType PPTX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.presentationml.presentation");

    private final DeckProcessingService processingService;

    @Value("${inverter.file-suffix:(inverted)}")
    private String fileSuffix;

    @Value("${inverter.archive-folder:Inverted Presentations}")
    private String archiveFolder;

    private final ExecutorService streamExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "deck-stream");
        thread.setDaemon(true);
        return thread;
    });

    @PostMapping("/process")
    public ResponseEntity<?> processDeck(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "background", defaultValue = "${inverter.default-background:#000000}") String background,
            @RequestParam(value = "foreground", defaultValue = "${inverter.default-foreground:#FFFFFF}") String foreground,
            @RequestParam(value = "invertImages", defaultValue = "${inverter.invert-images:true}") boolean invertImages,
            @RequestParam(value = "imageQuality", defaultValue = "${inverter.image-quality:85}") int imageQuality,
            @RequestParam(value = "recolorBackground", defaultValue = "true") boolean recolorBackground
    ) throws IOException {
        log.info("Processing deck: {} background: {} foreground: {} images: {} quality: {}",
                file.getOriginalFilename(), background, foreground, invertImages, imageQuality);

        InversionConfig config = buildConfig(background, foreground, invertImages, imageQuality, recolorBackground);
        ProcessingResult result = processingService.processOne(file.getBytes(), file.getOriginalFilename(), config);

        if (!result.isSucceeded()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(new ErrorResponse("PROCESSING_FAILED", String.join("; ", result.getWarnings())));
        }

        byte[] deck = result.getOutputBytes();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(PPTX);
        headers.setContentDisposition(attachment(fileNameOf(result.getOutputName())));
        headers.setContentLength(deck.length);
        headers.set(WARNINGS_HEADER, Integer.toString(result.getWarnings().size()));

        return ResponseEntity.ok()
                .headers(headers)
                .body(new ByteArrayResource(deck));
    }

    @PostMapping("/batch")
    public ResponseEntity<ByteArrayResource> processBatch(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "background", defaultValue = "${inverter.default-background:#000000}") String background,
            @RequestParam(value = "foreground", defaultValue = "${inverter.default-foreground:#FFFFFF}") String foreground,
            @RequestParam(value = "invertImages", defaultValue = "${inverter.invert-images:true}") boolean invertImages,
            @RequestParam(value = "imageQuality", defaultValue = "${inverter.image-quality:85}") int imageQuality,
            @RequestParam(value = "recolorBackground", defaultValue = "true") boolean recolorBackground,
            @RequestParam(value = "workerBackend", defaultValue = "${inverter.worker-backend:process}") String workerBackend,
            @RequestParam(value = "maxWorkers", defaultValue = "${inverter.max-workers:2}") int maxWorkers
    ) throws IOException {
        if (files == null || files.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        log.info("Processing batch of {} upload(s) with backend: {} workers: {}", files.size(), workerBackend, maxWorkers);
        InversionConfig config = buildConfig(background, foreground, invertImages, imageQuality, recolorBackground);
        ConcurrencyOptions options = buildOptions(workerBackend, maxWorkers);

        BatchResult batch = processingService.processBatch(toSources(files), config, options);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType("application/zip"));
        headers.setContentDisposition(attachment(config.getArchiveFolder() + ".zip"));
        headers.setContentLength(batch.getOutputArchive().length);
        headers.set(WARNINGS_HEADER, Integer.toString(batch.allWarnings().size()));
        headers.set(SUCCEEDED_HEADER, batch.getSuccessfulFiles() + "/" + batch.getTotalFiles());

        return ResponseEntity.ok()
                .headers(headers)
                .body(new ByteArrayResource(batch.getOutputArchive()));
    }

    /**
     * Server-Sent Events variant of {@code /batch}: one {@code result} event
     * per finished deck, in completion order, then a {@code done} event.
     */
    @PostMapping("/batch/stream")
    public SseEmitter processBatchStream(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "background", defaultValue = "${inverter.default-background:#000000}") String background,
            @RequestParam(value = "foreground", defaultValue = "${inverter.default-foreground:#FFFFFF}") String foreground,
            @RequestParam(value = "invertImages", defaultValue = "${inverter.invert-images:true}") boolean invertImages,
            @RequestParam(value = "imageQuality", defaultValue = "${inverter.image-quality:85}") int imageQuality,
            @RequestParam(value = "recolorBackground", defaultValue = "true") boolean recolorBackground,
            @RequestParam(value = "workerBackend", defaultValue = "${inverter.worker-backend:process}") String workerBackend,
            @RequestParam(value = "maxWorkers", defaultValue = "${inverter.max-workers:2}") int maxWorkers
    ) throws IOException {
        InversionConfig config = buildConfig(background, foreground, invertImages, imageQuality, recolorBackground);
        ConcurrencyOptions options = buildOptions(workerBackend, maxWorkers);
        List<DocumentSource> sources = toSources(files);

        // no timeout: a batch runs as long as its slowest deck
        SseEmitter emitter = new SseEmitter(0L);
        Stream<ProcessingResult> results = processingService.processBatchStreaming(sources, config, options);

        streamExecutor.execute(() -> {
            AtomicInteger completed = new AtomicInteger();
            try (results) {
                results.forEach(result -> {
                    try {
                        emitter.send(SseEmitter.event()
                                .name("result")
                                .data(DocumentStatus.from(result, completed.incrementAndGet()), MediaType.APPLICATION_JSON));
                    } catch (IOException e) {
                        throw new ClientGoneException(e);
                    }
                });
                emitter.send(SseEmitter.event().name("done").data(completed.get()));
                emitter.complete();
            } catch (ClientGoneException e) {
                log.info("Streaming client disconnected after {} result(s)", completed.get());
                emitter.completeWithError(e.getCause());
            } catch (Exception e) {
                log.error("Error streaming batch results", e);
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(
            @RequestParam(value = "background", defaultValue = "${inverter.default-background:#000000}") String background,
            @RequestParam(value = "foreground", defaultValue = "${inverter.default-foreground:#FFFFFF}") String foreground
    ) {
        InversionConfig config = InversionConfig.fromHex(foreground, background);
        List<String> warnings = processingService.validateConfig(config);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("background", config.getBackgroundColor().toHex());
        body.put("foreground", config.getForegroundColor().toHex());
        body.put("warnings", warnings);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Deck Inverter API is running");
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("version", "1.0.0");
        info.put("service", "Slide Deck Color Inverter");
        info.put("supportedFormats", List.of("pptx", "zip of pptx"));
        info.put("workerBackends", List.of("process", "thread"));
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("background", "#RRGGBB (default #000000)");
        options.put("foreground", "#RRGGBB (default #FFFFFF)");
        options.put("invertImages", "true | false");
        options.put("imageQuality", "1-100 (JPEG quality for opaque images)");
        options.put("maxWorkers", "positive integer (default 2)");
        info.put("options", options);
        return ResponseEntity.ok(info);
    }

    @PreDestroy
    void shutdown() {
        streamExecutor.shutdown();
    }

    // ---------------------------------------------------------------- helpers

    private InversionConfig buildConfig(String background, String foreground, boolean invertImages,
                                        int imageQuality, boolean recolorBackground) {
        return InversionConfig.builder()
                .backgroundColor(RgbColor.fromHex(background))
                .foregroundColor(RgbColor.fromHex(foreground))
                .invertImages(invertImages)
                .imageQuality(imageQuality)
                .recolorBackground(recolorBackground)
                .fileSuffix(fileSuffix)
                .archiveFolder(archiveFolder)
                .build();
    }

    private static ConcurrencyOptions buildOptions(String workerBackend, int maxWorkers) {
        ConcurrencyOptions options = ConcurrencyOptions.builder()
                .workerBackend(WorkerBackend.parse(workerBackend))
                .maxWorkers(maxWorkers)
                .build();
        options.validate();
        return options;
    }

    private static List<DocumentSource> toSources(List<MultipartFile> files) throws IOException {
        List<DocumentSource> sources = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
            sources.add(DocumentSource.of(name, file.getBytes()));
        }
        return sources;
    }

    private static ContentDisposition attachment(String fileName) {
        return ContentDisposition.attachment().filename(fileName, StandardCharsets.UTF_8).build();
    }

    private static String fileNameOf(String outputName) {
        return outputName.substring(outputName.lastIndexOf('/') + 1);
    }

    private static final class ClientGoneException extends RuntimeException {
        ClientGoneException(IOException cause) {
            super(cause);
        }
    }
}
