package com.deckinverter.service;

import com.deckinverter.model.BatchResult;
import com.deckinverter.model.ConcurrencyOptions;
import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.InvalidConfigException;
import com.deckinverter.model.InversionConfig;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.SerializedConfig;
import com.deckinverter.util.ContrastValidator;
import com.deckinverter.util.DeckArchives;
import com.deckinverter.util.NameDisambiguator;
import com.deckinverter.worker.DocumentWorker;
import com.deckinverter.worker.WorkerPool;
import com.deckinverter.worker.WorkerPoolFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Batch orchestration: expands archive inputs, gives every deck a unique
 * name, fans the decks out to a bounded worker pool and gathers one
 * {@link ProcessingResult} per deck.
 * <p>
 * Configuration problems fail the whole call before anything is scheduled;
 * problems with a single deck only fail that deck's result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeckProcessingService {

    private final DocumentWorker documentWorker;
    private final WorkerPoolFactory workerPoolFactory;

    /**
     * Advisory contrast check of the configured pair; never throws for a poor pair.
     */
    public List<String> validateConfig(InversionConfig config) {
        requireConfig(config);
        return ContrastValidator.validate(config.getForegroundColor(), config.getBackgroundColor());
    }

    /**
     * Process one deck in the calling thread.
     */
    public ProcessingResult processOne(byte[] documentBytes, String name, InversionConfig config) {
        requireConfig(config);
        log.info("Starting deck processing: {} (background {}, foreground {})",
                name, config.getBackgroundColor(), config.getForegroundColor());
        return documentWorker.process(DocumentSource.of(name, documentBytes), SerializedConfig.encode(config));
    }

    /**
     * Process every deck and wait for all of them. Results come back in
     * submission order; the archive holds every succeeded deck under the
     * configured folder.
     */
    public BatchResult processBatch(List<DocumentSource> documents, InversionConfig config,
                                    ConcurrencyOptions options) throws IOException {
        List<ProcessingResult> results;
        Map<String, Integer> order = new HashMap<>();
        try (StreamingBatch batch = start(documents, config, options)) {
            for (int i = 0; i < batch.names.size(); i++) {
                order.put(batch.names.get(i), i);
            }
            results = new ArrayList<>(batch.total);
            batch.forEachRemaining(results::add);
        }
        results.sort(Comparator.comparingInt(r -> order.getOrDefault(r.getName(), Integer.MAX_VALUE)));

        byte[] archive = DeckArchives.buildArchive(results, config.getArchiveFolder());
        BatchResult batchResult = new BatchResult(results, archive);
        log.info("Batch finished: {}/{} decks succeeded, archive {} bytes",
                batchResult.getSuccessfulFiles(), batchResult.getTotalFiles(), archive.length);
        return batchResult;
    }

    /**
     * Process every deck, handing each result over as soon as its worker
     * finishes (completion order, not submission order). The stream is
     * single-use; closing it early stops decks that have not started yet.
     */
    public Stream<ProcessingResult> processBatchStreaming(List<DocumentSource> documents, InversionConfig config,
                                                          ConcurrencyOptions options) {
        StreamingBatch batch = start(documents, config, options);
        Spliterator<ProcessingResult> spliterator = Spliterators.spliterator(batch, batch.total,
                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.SIZED);
        return StreamSupport.stream(spliterator, false).onClose(batch::close);
    }

    // ------------------------------------------------------------- scheduling

    private StreamingBatch start(List<DocumentSource> documents, InversionConfig config, ConcurrencyOptions options) {
        requireConfig(config);
        if (options == null) {
            throw new InvalidConfigException("Concurrency options must be provided");
        }
        options.validate();
        SerializedConfig serialized = SerializedConfig.encode(config);

        List<ProcessingResult> discoveryFailures = new ArrayList<>();
        List<DocumentSource> decks = NameDisambiguator.disambiguate(
                discover(documents, config, discoveryFailures), config.getFileSuffix());

        log.info("Processing batch of {} deck(s) with {} {} worker(s)",
                decks.size(), options.getMaxWorkers(), options.getWorkerBackend().name().toLowerCase());

        WorkerPool pool = decks.isEmpty() ? null : workerPoolFactory.create(options);
        return new StreamingBatch(pool, decks, serialized, discoveryFailures);
    }

    List<DocumentSource> discover(List<DocumentSource> inputs, InversionConfig config,
                                  List<ProcessingResult> failures) {
        List<DocumentSource> decks = new ArrayList<>();
        for (DocumentSource input : inputs) {
            byte[] data = input.getData();
            if (!DeckArchives.isArchiveContainer(input.getName(), data)) {
                decks.add(input);
                continue;
            }
            String outputName = DeckArchives.outputName(input.getName(), config.getFileSuffix());
            try {
                List<DocumentSource> extracted = DeckArchives.expand(input.getName(), data);
                if (extracted.isEmpty()) {
                    log.warn("Archive {} contains no presentations", input.getName());
                    failures.add(ProcessingResult.failure(input.getName(), outputName,
                            "Archive contains no presentations"));
                }
                decks.addAll(extracted);
            } catch (IOException | RuntimeException e) {
                log.warn("Invalid archive {}: {}", input.getName(), e.getMessage());
                failures.add(ProcessingResult.failure(input.getName(), outputName,
                        "Archive could not be read: " + e.getMessage()));
            }
        }
        return decks;
    }

    private static void requireConfig(InversionConfig config) {
        if (config == null) {
            throw new InvalidConfigException("Inversion config must be provided");
        }
    }

    /**
     * Results of one batch in completion order. Closes its pool after the
     * last result has been taken, or when closed early.
     */
    private static final class StreamingBatch implements Iterator<ProcessingResult>, AutoCloseable {

        private final WorkerPool pool;
        private final List<String> names;
        private final List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>();
        private final BlockingQueue<ProcessingResult> completed = new LinkedBlockingQueue<>();
        private final int total;
        private int delivered;
        private boolean closed;

        StreamingBatch(WorkerPool pool, List<DocumentSource> decks, SerializedConfig config,
                       List<ProcessingResult> discoveryFailures) {
            this.pool = pool;
            this.total = decks.size() + discoveryFailures.size();
            this.names = Stream.concat(
                    discoveryFailures.stream().map(ProcessingResult::getName),
                    decks.stream().map(DocumentSource::getName)).collect(Collectors.toList());
            completed.addAll(discoveryFailures);

            String suffix = config.decode().getFileSuffix();
            for (DocumentSource deck : decks) {
                CompletableFuture<ProcessingResult> future = pool.submit(deck, config);
                futures.add(future);
                future.exceptionally(t -> unexpectedFailure(deck, suffix, t))
                        .thenAccept(completed::add);
            }
        }

        @Override
        public boolean hasNext() {
            boolean more = delivered < total;
            if (!more) {
                close();
            }
            return more;
        }

        @Override
        public ProcessingResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            try {
                ProcessingResult result = completed.take();
                delivered++;
                log.info("Completed {}/{}: {} ({})", delivered, total, result.getName(),
                        result.isSucceeded() ? "ok" : "failed");
                return result;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new IllegalStateException("Interrupted while waiting for batch results", e);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            futures.forEach(future -> future.cancel(false));
            if (pool != null) {
                pool.close();
            }
        }

        private static ProcessingResult unexpectedFailure(DocumentSource deck, String suffix, Throwable t) {
            String outputName = DeckArchives.outputName(deck.getName(), suffix);
            if (t instanceof CancellationException) {
                log.debug("Skipped {}: batch closed before it started", deck.getName());
                return ProcessingResult.failure(deck.getName(), outputName, "Not processed: batch was closed");
            }
            log.error("Worker failed for {}", deck.getName(), t);
            return ProcessingResult.failure(deck.getName(), outputName, "Unexpected error: " + t.getMessage());
        }
    }
}
