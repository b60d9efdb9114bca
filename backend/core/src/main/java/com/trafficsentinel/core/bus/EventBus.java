package com.trafficsentinel.core.bus;

import com.trafficsentinel.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, CopyOnWriteArrayList<Consumer<? extends Event>>> subscribers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<Event>> allEventSubscribers = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void subscribeAll(Consumer<Event> handler) {
        allEventSubscribers.add(handler);
    }

    public void publish(Event event) {
        List<Consumer<? extends Event>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<? extends Event> rawHandler : handlers) {
                invokeHandler(rawHandler, event);
            }
        }
        for (Consumer<Event> handler : allEventSubscribers) {
            invokeHandler(handler, event);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void invokeHandler(Consumer<? extends Event> rawHandler, Event event) {
        try {
            ((Consumer<T>) rawHandler).accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
