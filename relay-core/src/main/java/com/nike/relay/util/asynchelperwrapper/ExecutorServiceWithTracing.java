package com.nike.relay.util.asynchelperwrapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * An {@link ExecutorService} that hands every task to the delegate wrapped in a {@link RunnableWithTracing} or
 * {@link CallableWithTracing}, so each task runs with the ambient segment and MDC of the thread that submitted it.
 * Worker pools are a suspension point; this is how a transaction's context survives the hop.
 *
 * <p>Lifecycle methods ({@link #shutdown()}, {@link #awaitTermination(long, TimeUnit)}, etc) go straight to the
 * delegate.
 */
@SuppressWarnings("WeakerAccess")
public class ExecutorServiceWithTracing implements ExecutorService {

    protected final ExecutorService delegate;

    public ExecutorServiceWithTracing(ExecutorService delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }

        this.delegate = delegate;
    }

    public static ExecutorServiceWithTracing withTracing(ExecutorService delegate) {
        return new ExecutorServiceWithTracing(delegate);
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(new RunnableWithTracing(command));
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        return delegate.submit(new CallableWithTracing<>(task));
    }

    @Override
    public <T> Future<T> submit(Runnable task, T result) {
        return delegate.submit(new RunnableWithTracing(task), result);
    }

    @Override
    public Future<?> submit(Runnable task) {
        return delegate.submit(new RunnableWithTracing(task));
    }

    @Override
    public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
        return delegate.invokeAll(wrapAll(tasks));
    }

    @Override
    public <T> List<Future<T>> invokeAll(
        Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit
    ) throws InterruptedException {
        return delegate.invokeAll(wrapAll(tasks), timeout, unit);
    }

    @Override
    public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
        return delegate.invokeAny(wrapAll(tasks));
    }

    @Override
    public <T> T invokeAny(
        Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit
    ) throws InterruptedException, ExecutionException, TimeoutException {
        return delegate.invokeAny(wrapAll(tasks), timeout, unit);
    }

    /**
     * Wraps each task with the calling thread's tracing state. Null tasks stay null so the delegate can reject them.
     */
    protected <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
        if (tasks == null) {
            return null;
        }

        List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            wrapped.add((task == null) ? null : new CallableWithTracing<>(task));
        }

        return wrapped;
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }
}
