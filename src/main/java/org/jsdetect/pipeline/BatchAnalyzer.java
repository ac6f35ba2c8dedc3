package org.jsdetect.pipeline;

import org.jsdetect.error.FileStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 在固定大小的线程池上分析一批文件。每个文件一个任务，互不共享可变状态；
 * 结果按输入顺序返回，单文件失败不影响其它文件。
 */
public class BatchAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final AnalysisConfig config;
    private final FileAnalyzer fileAnalyzer;

    public BatchAnalyzer(AnalysisConfig config) {
        this(config, new FileAnalyzer(config));
    }

    BatchAnalyzer(AnalysisConfig config, FileAnalyzer fileAnalyzer) {
        this.config = config;
        this.fileAnalyzer = fileAnalyzer;
    }

    public List<FileResult> analyze(List<Sample> samples) {
        return analyze(samples, r -> {
        });
    }

    /**
     * @param onResult 每个文件结束时在工作线程上调用，必须线程安全
     */
    public List<FileResult> analyze(List<Sample> samples, Consumer<FileResult> onResult) {
        ExecutorService pool = Executors.newFixedThreadPool(config.workers, new WorkerFactory());
        try {
            List<Future<FileResult>> futures = new ArrayList<>(samples.size());
            for (Sample sample : samples) {
                futures.add(pool.submit(() -> {
                    FileResult result = fileAnalyzer.analyze(sample);
                    onResult.accept(result);
                    return result;
                }));
            }

            List<FileResult> results = new ArrayList<>(samples.size());
            for (Future<FileResult> f : futures) {
                results.add(await(f));
            }
            logSummary(results);
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private static FileResult await(Future<FileResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // 内存耗尽等 Error 让整批失败
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static void logSummary(List<FileResult> results) {
        Map<FileStatus, Integer> counts = new EnumMap<>(FileStatus.class);
        for (FileResult r : results) {
            counts.merge(r.status, 1, Integer::sum);
        }
        logger.info("Analyzed {} files: {}", results.size(), counts);
    }

    private static final class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "analysis-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
