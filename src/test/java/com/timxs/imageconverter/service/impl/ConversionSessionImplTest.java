package com.timxs.imageconverter.service.impl;

import com.timxs.imageconverter.TestImages;
import com.timxs.imageconverter.config.ConversionOptions;
import com.timxs.imageconverter.exception.UnsupportedFormatException;
import com.timxs.imageconverter.model.BatchCompleted;
import com.timxs.imageconverter.model.BatchEvent;
import com.timxs.imageconverter.model.BatchProgress;
import com.timxs.imageconverter.model.BatchResult;
import com.timxs.imageconverter.model.ItemStatus;
import com.timxs.imageconverter.model.MoveResult;
import com.timxs.imageconverter.service.BatchWorker;
import com.timxs.imageconverter.service.MoveService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversionSessionImplTest {

    @TempDir
    Path tempDir;

    @Mock
    BatchWorker batchWorker;

    @Mock
    MoveService moveService;

    private ConversionSessionImpl session;

    private ConversionOptions options;

    @BeforeEach
    void setUp() {
        session = new ConversionSessionImpl(new ConversionQueueImpl(), batchWorker, moveService);
        options = new ConversionOptions("PNG", 90, true, "_converted", tempDir.resolve("out"));
    }

    @Test
    void directoriesAreExpandedRecursively() throws IOException {
        Path dir = tempDir.resolve("photos");
        Path a = TestImages.writePng(dir, "a.png", TestImages.opaque(2, 2));
        Path b = TestImages.writeJpeg(dir, "sub/b.jpg");
        Files.writeString(dir.resolve("notes.txt"), "skip");

        int added = session.addSources(List.of(dir));

        assertEquals(2, added);
        assertEquals(List.of(a, b), session.queued());
    }

    @Test
    void removeAndClearDelegateToQueue() throws IOException {
        Path a = TestImages.writePng(tempDir, "a.png", TestImages.opaque(2, 2));
        Path b = TestImages.writePng(tempDir, "b.png", TestImages.opaque(2, 2));
        session.addSources(List.of(a, b));

        session.removeSources(Set.of(0));
        assertEquals(List.of(b), session.queued());

        session.clearSources();
        assertTrue(session.queued().isEmpty());
    }

    @Test
    void emptyQueueCannotConvert() {
        assertThrows(IllegalStateException.class, () -> session.convert(options));
        verifyNoInteractions(batchWorker);
        assertFalse(session.isBusy());
    }

    @Test
    void secondConvertRejectedWhileRunning() throws IOException {
        queueOne();
        when(batchWorker.run(anyList(), eq(options), anyList())).thenReturn(Flux.never());

        session.convert(options);

        assertTrue(session.isBusy());
        assertThrows(IllegalStateException.class, () -> session.convert(options));
        StepVerifier.create(session.moveConverted(tempDir.resolve("dest")))
            .expectError(IllegalStateException.class)
            .verify();
        verifyNoInteractions(moveService);
    }

    @Test
    void completedBatchRecordsResultAndArtifacts() throws IOException {
        Path source = queueOne();
        Path output = tempDir.resolve("out/a_converted.png");
        stubBatch(source, output);

        StepVerifier.create(session.convert(options))
            .expectNextMatches(event -> event instanceof BatchProgress progress
                && progress.status() == ItemStatus.SUCCESS)
            .expectNextMatches(BatchEvent::isCompletion)
            .verifyComplete();

        assertFalse(session.isBusy());
        assertEquals(List.of(output), session.converted());
        assertEquals(1, session.lastResult().successes());
        // 队列保留，可以再次转换
        assertEquals(List.of(source), session.queued());
    }

    @Test
    void newBatchForgetsPreviousArtifacts() throws IOException {
        Path source = queueOne();
        stubBatch(source, tempDir.resolve("out/first.png"), tempDir.resolve("out/second.png"));

        session.convert(options).blockLast();
        session.convert(options).blockLast();

        assertEquals(List.of(tempDir.resolve("out/second.png")), session.converted());
    }

    @Test
    void unsupportedFormatReleasesSession() throws IOException {
        queueOne();
        when(batchWorker.run(anyList(), any(ConversionOptions.class), anyList()))
            .thenThrow(new UnsupportedFormatException("GIF"));

        assertThrows(UnsupportedFormatException.class, () -> session.convert(options));
        assertFalse(session.isBusy());
        assertNull(session.lastResult());
    }

    @Test
    void failedStreamReleasesSession() throws IOException {
        queueOne();
        when(batchWorker.run(anyList(), eq(options), anyList()))
            .thenReturn(Flux.error(new IllegalArgumentException("boom")));

        StepVerifier.create(session.convert(options))
            .expectError(IllegalArgumentException.class)
            .verify();
        assertFalse(session.isBusy());
    }

    @Test
    void moveWithNothingConverted() {
        Path destination = tempDir.resolve("dest");

        StepVerifier.create(session.moveConverted(destination))
            .expectNext(new MoveResult(0, 0, destination))
            .verifyComplete();
        verifyNoInteractions(moveService);
    }

    @Test
    void moveConvertedArtifacts() throws IOException {
        Path source = queueOne();
        Path output = tempDir.resolve("out/a_converted.png");
        Path destination = tempDir.resolve("dest");
        stubBatch(source, output);
        session.convert(options).blockLast();
        when(moveService.moveAll(anyList(), eq(destination))).thenAnswer(invocation -> {
            List<Path> artifacts = invocation.getArgument(0);
            artifacts.remove(output);
            return 1;
        });

        StepVerifier.create(session.moveConverted(destination))
            .expectNext(new MoveResult(1, 0, destination))
            .verifyComplete();
        assertTrue(session.converted().isEmpty());
    }

    private Path queueOne() throws IOException {
        Path source = TestImages.writePng(tempDir, "a.png", TestImages.opaque(2, 2));
        session.addSources(List.of(source));
        return source;
    }

    /**
     * 模拟 BatchWorker：订阅时写入产物，然后发出进度和完成事件
     */
    private void stubBatch(Path source, Path... outputs) {
        when(batchWorker.run(anyList(), eq(options), anyList())).thenAnswer(new Answer<Flux<BatchEvent>>() {
            private int call;

            @Override
            public Flux<BatchEvent> answer(InvocationOnMock invocation) {
                List<Path> artifacts = invocation.getArgument(2);
                Path output = outputs[Math.min(call++, outputs.length - 1)];
                return Flux.defer(() -> {
                    artifacts.add(output);
                    BatchResult result = new BatchResult(1, 0, options.outputDir(), List.of());
                    return Flux.just(new BatchProgress(1, 1, source, ItemStatus.SUCCESS, output),
                        new BatchCompleted(result));
                });
            }
        });
    }
}
