package com.nike.relay.util.asynchelperwrapper;

import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The timer counterpart of {@link ExecutorServiceWithTracing}: scheduled tasks run with the ambient segment and MDC of
 * the thread that scheduled them. A periodic task reuses the state captured at scheduling time for every run.
 */
@SuppressWarnings("WeakerAccess")
public class ScheduledExecutorServiceWithTracing
    extends ExecutorServiceWithTracing implements ScheduledExecutorService {

    protected final ScheduledExecutorService scheduledDelegate;

    public ScheduledExecutorServiceWithTracing(ScheduledExecutorService delegate) {
        super(delegate);
        this.scheduledDelegate = delegate;
    }

    public static ScheduledExecutorServiceWithTracing withTracing(ScheduledExecutorService delegate) {
        return new ScheduledExecutorServiceWithTracing(delegate);
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
        return scheduledDelegate.schedule(new RunnableWithTracing(command), delay, unit);
    }

    @Override
    public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
        return scheduledDelegate.schedule(new CallableWithTracing<>(callable), delay, unit);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
        return scheduledDelegate.scheduleAtFixedRate(new RunnableWithTracing(command), initialDelay, period, unit);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay, TimeUnit unit) {
        return scheduledDelegate.scheduleWithFixedDelay(new RunnableWithTracing(command), initialDelay, delay, unit);
    }
}
