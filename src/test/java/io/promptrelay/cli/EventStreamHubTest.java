package io.promptrelay.cli;

import io.promptrelay.events.ExecutionEvent;
import io.promptrelay.events.ExecutionEventType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.BlockingQueue;

final class EventStreamHubTest {

    @Test
    void framesEventsForEveryConnectedClient() {
        EventStreamHub hub = new EventStreamHub();
        BlockingQueue<String> first = hub.connect();
        BlockingQueue<String> second = hub.connect();

        hub.onEvent(ExecutionEvent.builder(ExecutionEventType.STEP_COMPLETED, "exe_1")
                .step(1, "write")
                .output("line one\nline two")
                .build());

        String frame = first.poll();
        Assertions.assertNotNull(frame);
        Assertions.assertTrue(frame.startsWith("event: step_completed\ndata: {"));
        Assertions.assertTrue(frame.endsWith("}\n\n"));
        Assertions.assertFalse(frame.substring(0, frame.length() - 2).contains("line one\nline two"));
        Assertions.assertEquals(frame, second.poll());

        hub.disconnect(second);
        Assertions.assertEquals(1, hub.clientCount());
    }

    @Test
    void slowClientLosesOldestFrames() {
        EventStreamHub hub = new EventStreamHub();
        BlockingQueue<String> queue = hub.connect();

        for (int i = 0; i < EventStreamHub.CLIENT_BUFFER + 10; i++) {
            hub.onEvent(ExecutionEvent.builder(ExecutionEventType.STATUS_UPDATE, "exe_" + i).build());
        }

        Assertions.assertEquals(EventStreamHub.CLIENT_BUFFER, queue.size());
        Assertions.assertTrue(queue.peek().contains("\"executionId\":\"exe_10\""));
    }
}
