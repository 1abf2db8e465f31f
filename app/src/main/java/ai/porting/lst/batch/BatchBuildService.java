package ai.porting.lst.batch;

import ai.porting.lst.builder.LstBuilder;
import ai.porting.lst.json.LstDocumentWriter;
import ai.porting.lst.source.SourceFile;
import ai.porting.lst.tree.LstDocument;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Builds and persists the documents of many source files on a fixed pool of workers. Files are independent;
 * a failure is recorded and the remaining files continue.
 */
public class BatchBuildService {

    static final String MDC_FILE = "file";

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchBuildService.class);

    private final LstBuilder builder;
    private final LstDocumentWriter writer;
    private final int threads;

    public BatchBuildService(LstBuilder builder, LstDocumentWriter writer, int threads) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.writer = Objects.requireNonNull(writer, "writer");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        this.threads = threads;
    }

    public BatchOutcome buildAll(List<SourceFile> files, Path outputDir) {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(outputDir, "outputDir");
        if (files.isEmpty()) {
            LOGGER.info("No source files to build");
            return new BatchOutcome(List.of(), List.of());
        }

        int poolSize = Math.min(threads, files.size());
        LOGGER.info("Building {} LST documents into {} with {} workers", files.size(), outputDir, poolSize);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        try {
            List<Future<Path>> futures = new ArrayList<>(files.size());
            for (SourceFile file : files) {
                futures.add(executor.submit(() -> buildAndWrite(file, outputDir)));
            }

            List<Path> written = new ArrayList<>();
            List<String> failed = new ArrayList<>();
            for (int i = 0; i < files.size(); i++) {
                SourceFile file = files.get(i);
                try {
                    written.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    LOGGER.error("LST build failed for {}: {}", file.identifier(), cause.getMessage(), cause);
                    failed.add(file.identifier());
                }
            }
            LOGGER.info("Wrote {} LST documents ({} failed)", written.size(), failed.size());
            return new BatchOutcome(written, failed);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LstBuildException("Interrupted while building LST documents", ex);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Reads and builds one file without persisting it.
     */
    public LstDocument build(SourceFile file) {
        Objects.requireNonNull(file, "file");
        byte[] source;
        try {
            source = Files.readAllBytes(file.path());
        } catch (IOException ex) {
            throw new LstBuildException("Failed to read source file: " + file.path(), ex);
        }
        return builder.build(file.identifier(), source);
    }

    private Path buildAndWrite(SourceFile file, Path outputDir) {
        MDC.put(MDC_FILE, file.identifier());
        try {
            LstDocument document = build(file);
            Path target = writer.writeTo(outputDir, document);
            LOGGER.debug("Wrote {} ({} root nodes)", target, document.nodes().size());
            return target;
        } catch (UncheckedIOException ex) {
            throw new LstBuildException("Failed to persist LST document for " + file.identifier(), ex);
        } finally {
            MDC.remove(MDC_FILE);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "lst-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
