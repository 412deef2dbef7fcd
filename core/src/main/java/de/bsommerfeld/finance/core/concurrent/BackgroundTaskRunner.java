package de.bsommerfeld.finance.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs blocking store calls off the UI thread and hands the outcome back on
 * it.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li>The call executes on a dedicated worker executor. The default is a
 * single daemon thread, so store calls from one window are serialized in
 * submission order.</li>
 * <li>Exactly one of the two callbacks runs, always on the
 * {@code callbackExecutor}. In the application that executor is
 * {@code Platform::runLater}; tests pass {@code Runnable::run}.</li>
 * <li>There is no cancellation. A view that no longer cares about a result
 * simply ignores the callback.</li>
 * </ul>
 */
public class BackgroundTaskRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BackgroundTaskRunner.class);

    private final ExecutorService worker;
    private final Executor callbackExecutor;

    public BackgroundTaskRunner(Executor callbackExecutor) {
        this(Executors.newSingleThreadExecutor(new WorkerThreadFactory()), callbackExecutor);
    }

    public BackgroundTaskRunner(ExecutorService worker, Executor callbackExecutor) {
        this.worker = worker;
        this.callbackExecutor = callbackExecutor;
    }

    /**
     * Submits a blocking call. Failures are logged and otherwise dropped.
     */
    public <T> CompletableFuture<T> submit(Callable<T> call, Consumer<? super T> onSuccess) {
        return submit(call, onSuccess, error -> LOG.error("Background task failed", error));
    }

    /**
     * Submits a blocking call and routes its outcome to one of the callbacks
     * on the callback executor.
     *
     * @param call      the blocking work, executed on the worker
     * @param onSuccess receives the call's return value
     * @param onError   receives the exception the call threw
     * @return a future completing with the call's result, after the callback
     *         has been dispatched
     */
    public <T> CompletableFuture<T> submit(Callable<T> call, Consumer<? super T> onSuccess,
            Consumer<? super Throwable> onError) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return call.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, worker);

        return future.whenComplete((result, error) -> callbackExecutor.execute(() -> {
            if (error == null) {
                onSuccess.accept(result);
            } else {
                onError.accept(unwrap(error));
            }
        }));
    }

    /**
     * Drains pending calls (up to 30s), then stops the worker. Called once
     * during application shutdown.
     */
    public void shutdown() {
        LOG.info("Shutting down BackgroundTaskRunner...");
        worker.shutdown();
        try {
            if (!worker.awaitTermination(30, TimeUnit.SECONDS)) {
                worker.shutdownNow();
                LOG.warn("BackgroundTaskRunner forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "store-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
