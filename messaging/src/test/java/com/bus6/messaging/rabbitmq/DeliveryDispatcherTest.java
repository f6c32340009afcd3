package com.bus6.messaging.rabbitmq;

import com.bus6.common.util.JsonMessageSerializer;
import com.bus6.messaging.config.ConsumerSettings;
import com.bus6.messaging.core.MessageConsumer.ConsumerStats;
import com.bus6.messaging.core.MessageHandler;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

public class DeliveryDispatcherTest {

    private static final byte[] HELLO = "{\"content\":\"Hello Test!\"}".getBytes(StandardCharsets.UTF_8);

    private Channel channel;
    private DeliveryCounters counters;
    private RedeliveryTracker redeliveries;
    private List<TestMessage> handled;

    @BeforeEach
    void setUp() {
        channel = Mockito.mock(Channel.class);
        when(channel.isOpen()).thenReturn(true);
        counters = new DeliveryCounters();
        redeliveries = new RedeliveryTracker();
        handled = new ArrayList<>();
    }

    private DeliveryDispatcher<TestMessage> dispatcher(ConsumerSettings settings, MessageHandler<TestMessage> handler) {
        return new DeliveryDispatcher<>(settings, TestMessage.class, handler,
                new JsonMessageSerializer(), redeliveries, counters);
    }

    private static Envelope envelope(long tag) {
        return new Envelope(tag, false, "test-exchange", "test.key");
    }

    private static AMQP.BasicProperties withMessageId(String id) {
        return new AMQP.BasicProperties.Builder().messageId(id).build();
    }

    @Test
    void testSuccessfulDeliveryIsAcknowledgedOnce() throws Exception {
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), handled::add);

        DeliveryOutcome outcome = dispatcher.dispatch(channel, envelope(7), withMessageId("m-1"), HELLO);

        assertEquals(DeliveryOutcome.ACKNOWLEDGED, outcome);
        assertEquals(List.of(new TestMessage("Hello Test!")), handled);
        verify(channel, times(1)).basicAck(7, false);
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void testHandlerFailureRequeuesAndLaterDeliveryIsAcked() throws Exception {
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), message -> {
            if (handled.isEmpty()) {
                handled.add(message);
                throw new IllegalStateException("downstream unavailable");
            }
            handled.add(message);
        });

        assertEquals(DeliveryOutcome.REQUEUED, dispatcher.dispatch(channel, envelope(1), null, HELLO));
        assertEquals(DeliveryOutcome.ACKNOWLEDGED, dispatcher.dispatch(channel, envelope(2), null, HELLO));

        verify(channel).basicNack(1, false, true);
        verify(channel).basicAck(2, false);
        ConsumerStats stats = counters.snapshot(true);
        assertEquals(2, stats.messagesReceived());
        assertEquals(1, stats.messagesRequeued());
        assertEquals(1, stats.messagesAcknowledged());
    }

    @Test
    void testUndecodableBodyIsRequeuedWithoutCallingHandler() throws Exception {
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), handled::add);

        DeliveryOutcome outcome = dispatcher.dispatch(channel, envelope(3), null,
                "not json".getBytes(StandardCharsets.UTF_8));

        assertEquals(DeliveryOutcome.REQUEUED, outcome);
        assertTrue(handled.isEmpty());
        verify(channel).basicNack(3, false, true);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void testNullPayloadIsAcknowledgedWithoutHandler() throws Exception {
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), handled::add);

        DeliveryOutcome outcome = dispatcher.dispatch(channel, envelope(4), null,
                "null".getBytes(StandardCharsets.UTF_8));

        assertEquals(DeliveryOutcome.ACKNOWLEDGED, outcome);
        assertTrue(handled.isEmpty());
        verify(channel).basicAck(4, false);
    }

    @Test
    void testAutoAckSubscriptionNeverSettlesExplicitly() throws Exception {
        ConsumerSettings settings = ConsumerSettings.builder("q").autoAck(true).build();
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(settings, message -> {
            throw new RuntimeException("boom");
        });

        assertEquals(DeliveryOutcome.AUTO_ACKNOWLEDGED, dispatcher.dispatch(channel, envelope(5), null, HELLO));
        assertEquals(DeliveryOutcome.AUTO_ACKNOWLEDGED,
                dispatcher(settings, handled::add).dispatch(channel, envelope(6), null, HELLO));

        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }

    @Test
    void testDeliveryCountHeaderRejectsOnFinalAttempt() throws Exception {
        ConsumerSettings settings = ConsumerSettings.builder("q").maxDeliveryAttempts(3).build();
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(settings, message -> {
            throw new IllegalStateException("poison");
        });
        AMQP.BasicProperties secondRedelivery = new AMQP.BasicProperties.Builder()
                .headers(Map.of(RedeliveryTracker.DELIVERY_COUNT_HEADER, 2L))
                .build();

        DeliveryOutcome outcome = dispatcher.dispatch(channel, envelope(9), secondRedelivery, HELLO);

        assertEquals(DeliveryOutcome.REJECTED, outcome);
        verify(channel).basicNack(9, false, false);
        assertEquals(1, counters.snapshot(true).messagesRejected());
    }

    @Test
    void testMessageIdTrackingRejectsAfterMaxAttempts() throws Exception {
        ConsumerSettings settings = ConsumerSettings.builder("q").maxDeliveryAttempts(2).build();
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(settings, message -> {
            throw new IllegalStateException("poison");
        });
        AMQP.BasicProperties props = withMessageId("m-42");

        assertEquals(DeliveryOutcome.REQUEUED, dispatcher.dispatch(channel, envelope(1), props, HELLO));
        assertEquals(DeliveryOutcome.REJECTED, dispatcher.dispatch(channel, envelope(2), props, HELLO));

        verify(channel).basicNack(1, false, true);
        verify(channel).basicNack(2, false, false);
        assertEquals(0, redeliveries.trackedMessages());
    }

    @Test
    void testSuccessForgetsEarlierFailures() throws Exception {
        ConsumerSettings settings = ConsumerSettings.builder("q").maxDeliveryAttempts(5).build();
        boolean[] fail = {true};
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(settings, message -> {
            if (fail[0]) throw new IllegalStateException("transient");
        });
        AMQP.BasicProperties props = withMessageId("m-7");

        dispatcher.dispatch(channel, envelope(1), props, HELLO);
        assertEquals(1, redeliveries.trackedMessages());
        fail[0] = false;
        dispatcher.dispatch(channel, envelope(2), props, HELLO);

        assertEquals(0, redeliveries.trackedMessages());
    }

    @Test
    void testAckFailureIsReportedNotThrown() throws Exception {
        doThrow(new IOException("channel gone")).when(channel).basicAck(anyLong(), anyBoolean());
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), handled::add);

        DeliveryOutcome outcome = assertDoesNotThrow(
                () -> dispatcher.dispatch(channel, envelope(11), null, HELLO));

        assertEquals(DeliveryOutcome.SETTLEMENT_FAILED, outcome);
        assertEquals(1, counters.snapshot(true).settlementFailures());
    }

    @Test
    void testClosedChannelSkipsSettlement() throws Exception {
        when(channel.isOpen()).thenReturn(false);
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), handled::add);

        DeliveryOutcome outcome = dispatcher.dispatch(channel, envelope(12), null, HELLO);

        assertEquals(DeliveryOutcome.SETTLEMENT_FAILED, outcome);
        assertEquals(1, handled.size());
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void testHandlerErrorIsNackedAndDoesNotEscape() throws Exception {
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), message -> {
            throw new AssertionError("handler assertion");
        });

        DeliveryOutcome outcome = assertDoesNotThrow(
                () -> dispatcher.dispatch(channel, envelope(13), null, HELLO));

        assertEquals(DeliveryOutcome.REQUEUED, outcome);
        verify(channel).basicNack(13, false, true);
        assertEquals(1, counters.snapshot(true).messagesRequeued());
    }

    @Test
    void testVirtualMachineErrorIsRethrownUnsettled() throws Exception {
        DeliveryDispatcher<TestMessage> dispatcher = dispatcher(ConsumerSettings.builder("q").build(), message -> {
            throw new OutOfMemoryError("simulated");
        });

        assertThrows(OutOfMemoryError.class, () -> dispatcher.dispatch(channel, envelope(14), null, HELLO));
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        verify(channel, never()).basicNack(anyLong(), anyBoolean(), anyBoolean());
    }
}
