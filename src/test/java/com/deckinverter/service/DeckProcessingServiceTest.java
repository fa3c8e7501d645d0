package com.deckinverter.service;

import com.deckinverter.DeckFixtures;
import com.deckinverter.model.BatchResult;
import com.deckinverter.model.ConcurrencyOptions;
import com.deckinverter.model.DocumentSource;
import com.deckinverter.model.InvalidConfigException;
import com.deckinverter.model.InversionConfig;
import com.deckinverter.model.ProcessingResult;
import com.deckinverter.model.RgbColor;
import com.deckinverter.model.SerializedConfig;
import com.deckinverter.worker.DocumentWorker;
import com.deckinverter.worker.WorkerLaunchSettings;
import com.deckinverter.worker.WorkerPool;
import com.deckinverter.worker.WorkerPoolFactory;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeckProcessingServiceTest {

    private final DocumentWorker worker = new DocumentWorker();
    private final DeckProcessingService service =
            new DeckProcessingService(worker, new WorkerPoolFactory(worker, WorkerLaunchSettings.defaults()));
    private final InversionConfig config = InversionConfig.defaults();
    private final ConcurrencyOptions threads = ConcurrencyOptions.threads(2);

    @Test
    void everyEffectiveDeckGetsOneResultAndAUniqueArchiveEntry() throws IOException {
        Map<String, byte[]> zipped = new LinkedHashMap<>();
        zipped.put("c.pptx", DeckFixtures.simpleDeck("c"));
        zipped.put("sub/d.pptx", DeckFixtures.simpleDeck("d"));
        List<DocumentSource> inputs = List.of(
                DocumentSource.of("a.pptx", DeckFixtures.simpleDeck("a")),
                DocumentSource.of("a.pptx", DeckFixtures.simpleDeck("a again")),
                DocumentSource.of("decks.zip", DeckFixtures.zip(zipped)));

        BatchResult batch = service.processBatch(inputs, config, threads);

        assertThat(batch.getTotalFiles()).isEqualTo(4);
        assertThat(batch.getSuccessfulFiles()).isEqualTo(4);
        assertThat(batch.getResults()).extracting(ProcessingResult::getName).containsExactly(
                "a.pptx", "a (2).pptx", "decks.zip/c.pptx", "decks.zip/sub/d.pptx");
        assertThat(entryNames(batch.getOutputArchive())).containsExactlyInAnyOrder(
                "Inverted Presentations/a (inverted).pptx",
                "Inverted Presentations/a (2) (inverted).pptx",
                "Inverted Presentations/decks/c (inverted).pptx",
                "Inverted Presentations/decks/sub/d (inverted).pptx");
    }

    @Test
    void oneCorruptDeckFailsAlone() throws IOException {
        List<DocumentSource> inputs = List.of(
                DocumentSource.of("first.pptx", DeckFixtures.simpleDeck("1")),
                DocumentSource.of("broken.pptx", "garbage".getBytes()),
                DocumentSource.of("third.pptx", DeckFixtures.simpleDeck("3")));

        BatchResult batch = service.processBatch(inputs, config, threads);

        assertThat(batch.getResults()).hasSize(3);
        assertThat(batch.getResults()).filteredOn(r -> !r.isSucceeded())
                .extracting(ProcessingResult::getName).containsExactly("broken.pptx");
        assertThat(batch.getSuccessfulFiles()).isEqualTo(2);
        assertThat(entryNames(batch.getOutputArchive())).hasSize(2);
        assertThat(batch.allWarnings()).singleElement().asString().startsWith("broken.pptx: Processing failed");
    }

    @Test
    void archiveWithoutDecksIsReportedAsOneFailure() throws IOException {
        List<DocumentSource> inputs = List.of(
                DocumentSource.of("notes.zip", DeckFixtures.zip(Map.of("readme.txt", "hi".getBytes()))),
                DocumentSource.of("ok.pptx", DeckFixtures.simpleDeck("ok")));

        BatchResult batch = service.processBatch(inputs, config, threads);

        assertThat(batch.getResults()).hasSize(2);
        ProcessingResult failure = batch.getResults().get(0);
        assertThat(failure.getName()).isEqualTo("notes.zip");
        assertThat(failure.isSucceeded()).isFalse();
        assertThat(failure.getWarnings()).containsExactly("Archive contains no presentations");
        assertThat(batch.getResults().get(1).isSucceeded()).isTrue();
    }

    @Test
    void emptyBatchGivesNoResultsAndAnEmptyArchive() throws IOException {
        WorkerPoolFactory factory = mock(WorkerPoolFactory.class);

        BatchResult batch = new DeckProcessingService(worker, factory).processBatch(List.of(), config, threads);

        assertThat(batch.getResults()).isEmpty();
        assertThat(batch.getOutputArchive()).isEmpty();
        verify(factory, never()).create(any());
    }

    @Test
    void streamingDeliversEveryResult() {
        List<DocumentSource> inputs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            inputs.add(DocumentSource.of("deck" + i + ".pptx", DeckFixtures.simpleDeck("s" + i)));
        }

        List<ProcessingResult> results;
        try (Stream<ProcessingResult> stream = service.processBatchStreaming(inputs, config, threads)) {
            results = stream.collect(Collectors.toList());
        }

        assertThat(results).hasSize(5).allMatch(ProcessingResult::isSucceeded);
        assertThat(results).extracting(ProcessingResult::getName)
                .containsExactlyInAnyOrder("deck0.pptx", "deck1.pptx", "deck2.pptx", "deck3.pptx", "deck4.pptx");
    }

    @Test
    void closingAStreamEarlyCancelsQueuedDocumentsAndClosesThePool() {
        WorkerPool pool = mock(WorkerPool.class);
        CompletableFuture<ProcessingResult> pending = new CompletableFuture<>();
        when(pool.submit(any(DocumentSource.class), any(SerializedConfig.class))).thenReturn(pending);
        WorkerPoolFactory factory = mock(WorkerPoolFactory.class);
        when(factory.create(any())).thenReturn(pool);

        Stream<ProcessingResult> stream = new DeckProcessingService(worker, factory).processBatchStreaming(
                List.of(DocumentSource.of("slow.pptx", new byte[0])), config, threads);
        stream.close();

        assertThat(pending).isCancelled();
        verify(pool).close();
    }

    @Test
    void poolIsClosedAfterABlockingBatch() throws IOException {
        WorkerPool pool = mock(WorkerPool.class);
        when(pool.submit(any(DocumentSource.class), any(SerializedConfig.class))).thenAnswer(call -> {
            DocumentSource doc = call.getArgument(0);
            return CompletableFuture.completedFuture(
                    ProcessingResult.success(doc.getName(), "out.pptx", new byte[]{1}, List.of()));
        });
        WorkerPoolFactory factory = mock(WorkerPoolFactory.class);
        when(factory.create(any())).thenReturn(pool);

        new DeckProcessingService(worker, factory)
                .processBatch(List.of(DocumentSource.of("x.pptx", new byte[0])), config, threads);

        verify(pool).close();
    }

    @Test
    void workerBreakdownBecomesAFailedResult() throws IOException {
        WorkerPool pool = mock(WorkerPool.class);
        when(pool.submit(any(DocumentSource.class), any(SerializedConfig.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("pool died")));
        WorkerPoolFactory factory = mock(WorkerPoolFactory.class);
        when(factory.create(any())).thenReturn(pool);

        BatchResult batch = new DeckProcessingService(worker, factory)
                .processBatch(List.of(DocumentSource.of("x.pptx", new byte[0])), config, threads);

        assertThat(batch.getResults()).singleElement().satisfies(result -> {
            assertThat(result.isSucceeded()).isFalse();
            assertThat(result.getWarnings()).singleElement().asString().contains("pool died");
        });
    }

    @Test
    void invalidOptionsFailBeforeAnythingIsScheduled() {
        WorkerPoolFactory factory = mock(WorkerPoolFactory.class);
        DeckProcessingService guarded = new DeckProcessingService(worker, factory);
        List<DocumentSource> inputs = List.of(DocumentSource.of("a.pptx", new byte[0]));

        assertThatThrownBy(() -> guarded.processBatch(inputs, config, ConcurrencyOptions.threads(0)))
                .isInstanceOf(InvalidConfigException.class);
        assertThatThrownBy(() -> guarded.processBatch(inputs, null, threads))
                .isInstanceOf(InvalidConfigException.class);
        verify(factory, never()).create(any());
    }

    @Test
    void processOneRunsInTheCallingThread() {
        InversionConfig lowContrast = InversionConfig.builder()
                .foregroundColor(new RgbColor(30, 30, 30))
                .backgroundColor(RgbColor.BLACK)
                .build();

        ProcessingResult result = service.processOne(DeckFixtures.simpleDeck("one"), "one.pptx", lowContrast);

        assertThat(result.isSucceeded()).isTrue();
        assertThat(service.validateConfig(lowContrast)).hasSize(1);
        assertThat(service.validateConfig(config)).isEmpty();
    }

    private static List<String> entryNames(byte[] archive) throws IOException {
        List<String> names = new ArrayList<>();
        try (ZipArchiveInputStream zis = new ZipArchiveInputStream(new ByteArrayInputStream(archive))) {
            ZipArchiveEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        return names;
    }
}
