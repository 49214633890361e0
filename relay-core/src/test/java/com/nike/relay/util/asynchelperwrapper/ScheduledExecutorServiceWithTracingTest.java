package com.nike.relay.util.asynchelperwrapper;

import com.nike.relay.Tracer;
import com.nike.relay.util.TracingState;

import com.tngtech.java.junit.dataprovider.DataProvider;
import com.tngtech.java.junit.dataprovider.DataProviderRunner;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.nike.relay.util.asynchelperwrapper.ScheduledExecutorServiceWithTracing.withTracing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

/**
 * Tests the functionality of {@link ScheduledExecutorServiceWithTracing} and, through it, of
 * {@link ExecutorServiceWithTracing}.
 */
@RunWith(DataProviderRunner.class)
public class ScheduledExecutorServiceWithTracingTest {

    private ScheduledExecutorService executorServiceMock;
    private ScheduledExecutorServiceWithTracing instance;

    @SuppressWarnings("rawtypes")
    private ArgumentCaptor<Callable> callableCaptor;
    private ArgumentCaptor<Runnable> runnableCaptor;
    @SuppressWarnings("rawtypes")
    private ArgumentCaptor<Collection> collectionCaptor;

    @Before
    public void beforeMethod() {
        executorServiceMock = mock(ScheduledExecutorService.class);
        instance = new ScheduledExecutorServiceWithTracing(executorServiceMock);

        callableCaptor = ArgumentCaptor.forClass(Callable.class);
        runnableCaptor = ArgumentCaptor.forClass(Runnable.class);
        collectionCaptor = ArgumentCaptor.forClass(Collection.class);

        resetTracing();
    }

    @After
    public void afterMethod() {
        resetTracing();
    }

    private void resetTracing() {
        MDC.clear();
        Tracer.getInstance().unregisterFromThread();
    }

    private TracingState generateTracingStateOnCurrentThread() {
        Tracer.getInstance().startTransaction(UUID.randomUUID().toString());
        MDC.put("someMdcKey", UUID.randomUUID().toString());
        return TracingState.getCurrentThreadTracingState();
    }

    private void verifyRunnableWithTracingWrapper(Runnable actual, Runnable expectedOrig, TracingState expectedState) {
        assertThat(actual).isInstanceOf(RunnableWithTracing.class);
        RunnableWithTracing wrapper = (RunnableWithTracing) actual;
        assertThat(wrapper.origRunnable).isSameAs(expectedOrig);
        assertThat(wrapper.segmentForExecution).isSameAs(expectedState.segment);
        assertThat(wrapper.mdcContextMapForExecution).isEqualTo(expectedState.mdcInfo);
    }

    private void verifyCallableWithTracingWrapper(Callable<?> actual, Callable<?> expectedOrig,
                                                  TracingState expectedState) {
        assertThat(actual).isInstanceOf(CallableWithTracing.class);
        CallableWithTracing<?> wrapper = (CallableWithTracing<?>) actual;
        assertThat(wrapper.origCallable).isSameAs(expectedOrig);
        assertThat(wrapper.segmentForExecution).isSameAs(expectedState.segment);
        assertThat(wrapper.mdcContextMapForExecution).isEqualTo(expectedState.mdcInfo);
    }

    @DataProvider(value = {
        "true",
        "false"
    })
    @Test
    public void constructor_sets_fields_as_expected(boolean useStaticFactoryMethod) {
        // when
        instance = (useStaticFactoryMethod)
                   ? withTracing(executorServiceMock)
                   : new ScheduledExecutorServiceWithTracing(executorServiceMock);

        // then
        assertThat(instance.delegate).isSameAs(executorServiceMock);
        assertThat(instance.scheduledDelegate).isSameAs(executorServiceMock);
    }

    @Test
    public void constructor_throws_IllegalArgumentException_for_null_delegate() {
        // when
        Throwable ex = catchThrowable(() -> new ScheduledExecutorServiceWithTracing(null));

        // then
        assertThat(ex).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shutdown_passes_through_to_delegate() {
        // when
        instance.shutdown();

        // then
        verify(executorServiceMock).shutdown();
        verifyNoMoreInteractions(executorServiceMock);
    }

    @DataProvider(value = {
        "true",
        "false"
    })
    @Test
    public void awaitTermination_passes_through_to_delegate(boolean delegateValue) throws InterruptedException {
        // given
        doReturn(delegateValue).when(executorServiceMock).awaitTermination(anyLong(), any(TimeUnit.class));

        // when
        boolean result = instance.awaitTermination(42, TimeUnit.MINUTES);

        // then
        assertThat(result).isEqualTo(delegateValue);
        verify(executorServiceMock).awaitTermination(42, TimeUnit.MINUTES);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    public void execute_passes_through_to_delegate_with_tracing_wrapper() {
        // given
        Runnable origTaskMock = mock(Runnable.class);
        TracingState expectedTracingState = generateTracingStateOnCurrentThread();

        // when
        instance.execute(origTaskMock);

        // then
        verify(executorServiceMock).execute(runnableCaptor.capture());
        verifyRunnableWithTracingWrapper(runnableCaptor.getValue(), origTaskMock, expectedTracingState);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    public void submit_callable_passes_through_to_delegate_with_tracing_wrapper() {
        // given
        Callable<?> origTaskMock = mock(Callable.class);
        Future<?> expectedResultMock = mock(Future.class);
        doReturn(expectedResultMock).when(executorServiceMock).submit(any(Callable.class));
        TracingState expectedTracingState = generateTracingStateOnCurrentThread();

        // when
        Future<?> result = instance.submit(origTaskMock);

        // then
        assertThat(result).isSameAs(expectedResultMock);
        verify(executorServiceMock).submit(callableCaptor.capture());
        verifyCallableWithTracingWrapper(callableCaptor.getValue(), origTaskMock, expectedTracingState);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    public void submit_runnable_passes_through_to_delegate_with_tracing_wrapper() {
        // given
        Runnable origTaskMock = mock(Runnable.class);
        Future<?> expectedResultMock = mock(Future.class);
        doReturn(expectedResultMock).when(executorServiceMock).submit(any(Runnable.class));
        TracingState expectedTracingState = generateTracingStateOnCurrentThread();

        // when
        Future<?> result = instance.submit(origTaskMock);

        // then
        assertThat(result).isSameAs(expectedResultMock);
        verify(executorServiceMock).submit(runnableCaptor.capture());
        verifyRunnableWithTracingWrapper(runnableCaptor.getValue(), origTaskMock, expectedTracingState);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void invokeAll_passes_through_to_delegate_with_tracing_wrappers() throws InterruptedException {
        // given
        Callable<Object> firstTaskMock = mock(Callable.class);
        Callable<Object> secondTaskMock = mock(Callable.class);
        List<Future<Object>> expectedResultMock = mock(List.class);
        doReturn(expectedResultMock).when(executorServiceMock).invokeAll(anyCollection());
        TracingState expectedTracingState = generateTracingStateOnCurrentThread();

        // when
        List<Future<Object>> result = instance.invokeAll(Arrays.asList(firstTaskMock, secondTaskMock));

        // then
        assertThat(result).isSameAs(expectedResultMock);
        verify(executorServiceMock).invokeAll(collectionCaptor.capture());
        List<Callable<?>> actualTasks = (List<Callable<?>>) collectionCaptor.getValue();
        assertThat(actualTasks).hasSize(2);
        verifyCallableWithTracingWrapper(actualTasks.get(0), firstTaskMock, expectedTracingState);
        verifyCallableWithTracingWrapper(actualTasks.get(1), secondTaskMock, expectedTracingState);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    public void schedule_runnable_passes_through_to_delegate_with_tracing_wrapper() {
        // given
        Runnable origTaskMock = mock(Runnable.class);
        ScheduledFuture<?> expectedResultMock = mock(ScheduledFuture.class);
        doReturn(expectedResultMock).when(executorServiceMock)
                                    .schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        TracingState expectedTracingState = generateTracingStateOnCurrentThread();

        // when
        ScheduledFuture<?> result = instance.schedule(origTaskMock, 42, TimeUnit.SECONDS);

        // then
        assertThat((Future<?>) result).isSameAs(expectedResultMock);
        verify(executorServiceMock).schedule(runnableCaptor.capture(), anyLong(), any(TimeUnit.class));
        verifyRunnableWithTracingWrapper(runnableCaptor.getValue(), origTaskMock, expectedTracingState);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    public void schedule_callable_passes_through_to_delegate_with_tracing_wrapper() {
        // given
        Callable<?> origTaskMock = mock(Callable.class);
        ScheduledFuture<?> expectedResultMock = mock(ScheduledFuture.class);
        doReturn(expectedResultMock).when(executorServiceMock)
                                    .schedule(any(Callable.class), anyLong(), any(TimeUnit.class));
        TracingState expectedTracingState = generateTracingStateOnCurrentThread();

        // when
        ScheduledFuture<?> result = instance.schedule(origTaskMock, 42, TimeUnit.SECONDS);

        // then
        assertThat((Future<?>) result).isSameAs(expectedResultMock);
        verify(executorServiceMock).schedule(callableCaptor.capture(), anyLong(), any(TimeUnit.class));
        verifyCallableWithTracingWrapper(callableCaptor.getValue(), origTaskMock, expectedTracingState);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    public void scheduleAtFixedRate_passes_through_to_delegate_with_tracing_wrapper() {
        // given
        Runnable origTaskMock = mock(Runnable.class);
        ScheduledFuture<?> expectedResultMock = mock(ScheduledFuture.class);
        doReturn(expectedResultMock).when(executorServiceMock)
                                    .scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(),
                                                         any(TimeUnit.class));
        TracingState expectedTracingState = generateTracingStateOnCurrentThread();

        // when
        ScheduledFuture<?> result = instance.scheduleAtFixedRate(origTaskMock, 1, 2, TimeUnit.SECONDS);

        // then
        assertThat((Future<?>) result).isSameAs(expectedResultMock);
        verify(executorServiceMock).scheduleAtFixedRate(runnableCaptor.capture(), anyLong(), anyLong(),
                                                        any(TimeUnit.class));
        verifyRunnableWithTracingWrapper(runnableCaptor.getValue(), origTaskMock, expectedTracingState);
        verifyNoMoreInteractions(executorServiceMock);
    }

    @Test
    public void tasks_capture_no_segment_when_submitted_outside_a_transaction() {
        // given
        Runnable origTaskMock = mock(Runnable.class);
        assertThat(Tracer.getInstance().getSegment()).isNull();

        // when
        instance.execute(origTaskMock);

        // then
        verify(executorServiceMock).execute(runnableCaptor.capture());
        assertThat(((RunnableWithTracing) runnableCaptor.getValue()).segmentForExecution).isNull();
    }
}
