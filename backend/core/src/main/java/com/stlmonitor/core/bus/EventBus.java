package com.stlmonitor.core.bus;

import com.stlmonitor.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process event bus. Handlers subscribed to a concrete event type receive only that type;
 * handlers subscribed to {@link Event} itself receive every published event, after the typed handlers.
 * A failing handler never stops delivery to the others.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, CopyOnWriteArrayList<Consumer<? extends Event>>> subscribers =
            new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void subscribeAll(Consumer<Event> handler) {
        subscribe(Event.class, handler);
    }

    public void publish(Event event) {
        dispatch(subscribers.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>()), event);
        if (event.getClass() != Event.class) {
            dispatch(subscribers.getOrDefault(Event.class, new CopyOnWriteArrayList<>()), event);
        }
    }

    private void dispatch(List<Consumer<? extends Event>> handlers, Event event) {
        for (Consumer<? extends Event> rawHandler : handlers) {
            invokeHandler(rawHandler, event, onHandlerError);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Event> void invokeHandler(
            Consumer<? extends Event> rawHandler,
            Event event,
            BiConsumer<Event, Exception> onHandlerError
    ) {
        try {
            Consumer<T> typedHandler = (Consumer<T>) rawHandler;
            typedHandler.accept((T) event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
