package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.service.orchestration.event.TurnFinishedEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();

    @Override
    public void publishEvent(ApplicationEvent event) {
        events.add(event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
    }

    public List<TurnFinishedEvent> finishedEvents() {
        return events.stream()
                .filter(e -> e instanceof TurnFinishedEvent)
                .map(e -> (TurnFinishedEvent) e)
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
