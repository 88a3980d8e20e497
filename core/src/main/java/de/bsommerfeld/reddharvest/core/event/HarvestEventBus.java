package de.bsommerfeld.reddharvest.core.event;

import com.google.common.eventbus.DeadEvent;
import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous Guava EventBus carrying {@link HarvestEvents}. The harvest
 * loop reports progress here without knowing who listens.
 *
 * <p>
 * A failing listener never breaks the run: its exception is logged with
 * the offending event and dispatch continues. Events nobody subscribed to
 * are logged at TRACE.
 */
@Singleton
public class HarvestEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestEventBus.class);

    private final EventBus eventBus;

    public HarvestEventBus() {
        this.eventBus = new EventBus(HarvestEventBus::logListenerFailure);
        this.eventBus.register(new DeadEventLogger());
    }

    public void post(Object event) {
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.debug("Registering harvest listener {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        eventBus.unregister(listener);
    }

    private static void logListenerFailure(Throwable failure, SubscriberExceptionContext context) {
        LOG.warn("Harvest listener {}.{} failed on {}", context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(), context.getEvent(), failure);
    }

    private static final class DeadEventLogger {

        @Subscribe
        public void onDeadEvent(DeadEvent deadEvent) {
            LOG.trace("No listener for {}", deadEvent.getEvent());
        }
    }
}
