package com.questrail.tradefeed.core;

import com.questrail.tradefeed.api.MessageListener;
import com.questrail.tradefeed.config.ReceiverConfig;
import com.questrail.tradefeed.observability.NullDispatchObservabilitySink;
import com.questrail.tradefeed.registry.MessageType;
import com.questrail.tradefeed.registry.MessageTypeRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Registration from other threads while the event thread dispatches.
 */
class ReceiverConcurrencyTest
{
    private static final MessageType TICK = MessageType.of("tick", "seq");

    @Test
    void concurrentRegistrationAndDispatchStayConsistent() throws Exception {
        Receiver receiver = new Receiver(ReceiverConfig.builder()
                .withTypes(MessageTypeRegistry.of(TICK))
                .withObservabilitySink(NullDispatchObservabilitySink.INSTANCE)
                .build());

        AtomicInteger stableDeliveries = new AtomicInteger();
        receiver.register(m -> stableDeliveries.incrementAndGet(), "tick");

        int events = 2_000;
        int churners = 4;
        ExecutorService pool = Executors.newFixedThreadPool(churners + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < churners; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < events; i++) {
                        MessageListener churn = m -> {};
                        receiver.register(churn, "tick");
                        receiver.unregister(churn, "tick");
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < events; i++) {
                    receiver.dispatch("tick", Map.of("seq", i));
                }
                return null;
            }));

            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(events, stableDeliveries.get());
        assertEquals(1, receiver.listenersFor("tick").size());
    }
}
