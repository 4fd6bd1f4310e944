package com.newsboard.core.bus;

import com.newsboard.core.events.Event;

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

    private final Map<Class<? extends Event>, List<Consumer<? super Event>>> handlersByType = new ConcurrentHashMap<>();
    private final List<Consumer<? super Event>> catchAll = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler failed for " + event.type() + " event", ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        handlersByType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    public void subscribeAll(Consumer<Event> handler) {
        catchAll.add(handler::accept);
    }

    public void publish(Event event) {
        dispatch(handlersByType.getOrDefault(event.getClass(), List.of()), event);
        dispatch(catchAll, event);
    }

    private void dispatch(List<Consumer<? super Event>> handlers, Event event) {
        for (Consumer<? super Event> handler : handlers) {
            try {
                handler.accept(event);
            } catch (Exception ex) {
                onHandlerError.accept(event, ex);
            }
        }
    }
}
