package dao.fhe.csl.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of every applied change. Each appended event is also published on the
 * Spring application event bus for in-process observers.
 */
@Slf4j
@Component
public class EventJournal {

    private final List<LedgerEvent> events = new ArrayList<>();
    private final ApplicationEventPublisher publisher;

    public EventJournal(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void append(LedgerEvent event) {
        synchronized (events) {
            events.add(event);
        }
        log.info("{}: {}", event.type(), event);
        publisher.publishEvent(event);
    }

    public List<LedgerEvent> getEvents() {
        synchronized (events) {
            return Collections.unmodifiableList(new ArrayList<>(events));
        }
    }

    public int size() {
        synchronized (events) {
            return events.size();
        }
    }
}
