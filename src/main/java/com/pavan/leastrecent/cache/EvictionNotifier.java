package com.pavan.leastrecent.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered registry of eviction listeners with synchronous delivery.
 * <p>
 * Every active listener sees every eviction, even when an earlier one throws. The first
 * failure is rethrown once delivery is done; later failures are attached as suppressed.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
final class EvictionNotifier<K, V> {
    
    private static final Logger logger = LoggerFactory.getLogger(EvictionNotifier.class);
    
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    
    Subscription subscribe(EvictionListener<? super K, ? super V> listener) {
        Objects.requireNonNull(listener, "listener");
        Registration registration = new Registration(listener);
        registrations.add(registration);
        return registration;
    }
    
    void notifyEvicted(K key, V value) {
        if (registrations.isEmpty()) {
            return;
        }
        RuntimeException failure = null;
        for (Registration registration : registrations) {
            // Skip listeners unsubscribed earlier in this same delivery
            if (!registration.active) {
                continue;
            }
            try {
                registration.listener.onEvicted(key, value);
            } catch (RuntimeException e) {
                logger.warn("Eviction listener {} failed for key {}", registration.listener, key, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
    
    private final class Registration implements Subscription {
        
        private final EvictionListener<? super K, ? super V> listener;
        private boolean active = true;
        
        Registration(EvictionListener<? super K, ? super V> listener) {
            this.listener = listener;
        }
        
        @Override
        public void unsubscribe() {
            if (active) {
                active = false;
                registrations.remove(this);
            }
        }
        
        @Override
        public boolean isActive() {
            return active;
        }
    }
}
