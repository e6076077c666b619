package com.pgbroker.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySubscriptionRegistry implements SubscriptionRegistry {
    private final Map<String, List<Subscription>> byChannel = new ConcurrentHashMap<>();

    @Override
    public void add(Subscription subscription) {
        byChannel.compute(subscription.channel(), (channel, current) -> {
            List<Subscription> next = current == null ? new ArrayList<>() : new ArrayList<>(current);
            next.add(subscription);
            return List.copyOf(next);
        });
    }

    @Override
    public List<Subscription> forChannel(String channel) {
        return byChannel.getOrDefault(channel, List.of());
    }

    @Override
    public List<Subscription> removeChannel(String channel) {
        List<Subscription> removed = byChannel.remove(channel);
        return removed == null ? List.of() : removed;
    }

    @Override
    public List<Subscription> all() {
        List<Subscription> result = new ArrayList<>();
        byChannel.values().forEach(result::addAll);
        result.sort(Comparator.comparing(Subscription::createdAt).thenComparing(Subscription::id));
        return result;
    }

    @Override
    public Set<String> channels() {
        return Set.copyOf(byChannel.keySet());
    }
}
