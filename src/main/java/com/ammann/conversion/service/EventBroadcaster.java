/* (C)2026 */
package com.ammann.conversion.service;

import com.ammann.conversion.config.ConversionSettings;
import com.ammann.conversion.exception.SubscriberLimitException;
import com.ammann.conversion.model.LifecycleEvent;
import com.ammann.conversion.service.Subscriber.SubscriberInfo;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/**
 * Fans lifecycle events out to every connected subscriber.
 * <p>
 * Publishing never blocks on a consumer: each subscriber owns a bounded drop-oldest buffer.
 * Subscribers that keep dropping events, or stop reading for longer than the inactivity
 * timeout, are disconnected.
 */
@ApplicationScoped
public class EventBroadcaster {

    private static final Logger LOG = Logger.getLogger(EventBroadcaster.class);

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final ConversionSettings settings;
    private final Clock clock;

    @Inject
    public EventBroadcaster(ConversionSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public EventBroadcaster(ConversionSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Registers a new subscriber.
     *
     * @throws SubscriberLimitException when the maximum number of subscribers is connected
     */
    public synchronized Subscriber subscribe() {
        if (subscribers.size() >= settings.maxSubscribers()) {
            throw new SubscriberLimitException(settings.maxSubscribers());
        }
        Subscriber subscriber = new Subscriber(Subscriber.newId(), settings.bufferCapacity(), clock);
        subscriber.onCancel(() -> unsubscribe(subscriber));
        subscribers.put(subscriber.id(), subscriber);
        LOG.infof("Subscriber %s connected (total subscribers: %d)", subscriber.id(), subscribers.size());
        return subscriber;
    }

    public void unsubscribe(Subscriber subscriber) {
        if (subscribers.remove(subscriber.id(), subscriber)) {
            LOG.infof("Subscriber %s disconnected (total subscribers: %d)", subscriber.id(), subscribers.size());
        }
        subscriber.close();
    }

    /**
     * Offers the event to every subscriber connected at the time of the call.
     */
    public void publish(LifecycleEvent event) {
        if (subscribers.isEmpty()) {
            return;
        }
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            if (!subscriber.offer(event)
                    && subscriber.consecutiveDrops() > settings.maxConsecutiveDrops()) {
                forceUnsubscribe(subscriber, subscriber.consecutiveDrops() + " consecutive events dropped");
            }
        }
    }

    /**
     * Disconnects idle subscribers and sends a heartbeat to the rest.
     *
     * @return number of subscribers disconnected for inactivity
     */
    public int heartbeat() {
        Instant now = clock.instant();
        Instant threshold = now.minus(settings.inactivityTimeout());
        int pruned = 0;
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            if (subscriber.isIdleSince(threshold)) {
                forceUnsubscribe(subscriber, "inactive since " + subscriber.lastActivity());
                pruned++;
            }
        }
        publish(LifecycleEvent.heartbeat(now, subscribers.size()));
        return pruned;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    /** Connected subscribers, oldest connection first. */
    public List<SubscriberInfo> subscribers() {
        List<SubscriberInfo> infos = new ArrayList<>();
        for (Subscriber subscriber : subscribers.values()) {
            infos.add(subscriber.info());
        }
        infos.sort(Comparator.comparing(SubscriberInfo::connectedAt));
        return infos;
    }

    /** Ends every stream; used on application shutdown. */
    public void shutdown() {
        int count = subscribers.size();
        for (Subscriber subscriber : List.copyOf(subscribers.values())) {
            subscribers.remove(subscriber.id(), subscriber);
            subscriber.close();
        }
        if (count > 0) {
            LOG.infof("Closed %d event stream subscribers", count);
        }
    }

    private void forceUnsubscribe(Subscriber subscriber, String reason) {
        if (subscribers.remove(subscriber.id(), subscriber)) {
            LOG.warnf("Subscriber %s forcibly disconnected: %s", subscriber.id(), reason);
        }
        subscriber.close();
    }
}
