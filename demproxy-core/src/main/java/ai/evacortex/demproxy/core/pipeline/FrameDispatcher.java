/*
 * DemProxy — Solar DEM Proxy Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.demproxy.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs frame tasks in fixed-size chunks, in the calling thread or on a worker pool.
 *
 * <p>A chunk is completed before the next one is submitted. After the first failed outcome no
 * further chunk is started; outcomes of the chunk already in flight are still returned.</p>
 */
public class FrameDispatcher implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FrameDispatcher.class);

    private final ExecutorService executor;     // null in serial mode
    private final int chunkSize;

    public FrameDispatcher(int workers, int chunkSize) {
        this.chunkSize = Math.max(1, chunkSize);
        if (workers > 1) {
            AtomicInteger seq = new AtomicInteger();
            this.executor = Executors.newFixedThreadPool(workers, r -> {
                Thread t = new Thread(r);
                t.setDaemon(true);
                t.setName("dem-frame-" + seq.incrementAndGet());
                return t;
            });
        } else {
            this.executor = null;
        }
    }

    public boolean parallel() {
        return executor != null;
    }

    /**
     * @return outcomes in task order, ending at the chunk that produced the first failure
     */
    public List<FrameTask.Outcome> run(List<FrameTask> tasks) {
        List<FrameTask.Outcome> outcomes = new ArrayList<>(tasks.size());
        if (executor == null) {
            for (FrameTask task : tasks) {
                FrameTask.Outcome o = task.call();
                outcomes.add(o);
                if (o.failed()) return outcomes;
            }
            return outcomes;
        }

        for (int from = 0; from < tasks.size(); from += chunkSize) {
            List<FrameTask> chunk = tasks.subList(from, Math.min(tasks.size(), from + chunkSize));
            boolean failed = false;
            try {
                for (Future<FrameTask.Outcome> f : executor.invokeAll(chunk)) {
                    FrameTask.Outcome o = get(f);
                    outcomes.add(o);
                    failed |= o.failed();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for frame tasks");
            }
            if (failed) {
                LOG.debug("Stopping after chunk starting at {} of {}", from, tasks.size());
                return outcomes;
            }
        }
        return outcomes;
    }

    private static FrameTask.Outcome get(Future<FrameTask.Outcome> f) throws InterruptedException {
        try {
            return f.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new CompletionException(cause);
        }
    }

    @Override
    public void close() {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
