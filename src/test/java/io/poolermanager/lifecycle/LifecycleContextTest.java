package io.poolermanager.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class LifecycleContextTest {

    @Test
    void testCancelRunsCallbacksOnce() {
        LifecycleContext context = new LifecycleContext();
        AtomicInteger calls = new AtomicInteger();
        context.onCancel(calls::incrementAndGet);

        context.cancel();
        context.cancel();

        assertThat(context.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void testCallbackRegisteredAfterCancelRunsImmediately() {
        LifecycleContext context = new LifecycleContext();
        context.cancel();
        AtomicInteger calls = new AtomicInteger();

        context.onCancel(calls::incrementAndGet);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void testFailingCallbackDoesNotStopOthers() {
        LifecycleContext context = new LifecycleContext();
        List<String> ran = new ArrayList<>();
        context.onCancel(() -> {
            throw new IllegalStateException("first fails");
        });
        context.onCancel(() -> ran.add("second"));

        context.cancel();

        assertThat(ran).containsExactly("second");
    }

    @Test
    void testAwaitCancellation() throws Exception {
        LifecycleContext context = new LifecycleContext();
        assertThat(context.awaitCancellation(10, TimeUnit.MILLISECONDS)).isFalse();

        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            context.cancel();
        });
        canceller.start();

        assertThat(context.awaitCancellation(5, TimeUnit.SECONDS)).isTrue();
        canceller.join();
    }
}
