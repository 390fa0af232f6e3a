package io.eventrelay.delayed.impl;

import io.eventrelay.delayed.type.ChannelNotClaimedException;
import io.eventrelay.delayed.type.DelayedChannel;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/*
 * Process-local delayed channels. Nothing survives a restart.
 *
 * Per channel:
 *  - pending: unclaimed entries in arrival order
 *  - inFlight: entries handed out by the current claim
 *  - claimed: the claim flag, flipped only while holding the channel monitor
 *
 * Entries are compared by identity so a rollback removes exactly what its unit of work added.
 */
@Slf4j
public final class MemoryDelayedChannel<T> implements DelayedChannel<T> {

    private static final class Entry<T> {
        final T item;
        final Instant arrived;

        Entry(final T item, final Instant arrived) {
            this.item = item;
            this.arrived = arrived;
        }
    }

    private static final class Channel<T> {
        final AtomicBoolean claimed = new AtomicBoolean(false);
        final Deque<Entry<T>> pending = new ArrayDeque<>();
        List<Entry<T>> inFlight = List.of();
    }

    private record Added<T>(String channel, Entry<T> entry) {
    }

    private final Clock clock;
    private final ConcurrentHashMap<String, Channel<T>> channels = new ConcurrentHashMap<>();
    private final ThreadLocal<List<Added<T>>> unitOfWork = new ThreadLocal<>();

    public MemoryDelayedChannel() {
        this(Clock.systemUTC());
    }

    public MemoryDelayedChannel(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public void begin() {
        if (unitOfWork.get() != null) {
            throw new IllegalStateException("A unit of work is already open on " + Thread.currentThread().getName());
        }
        unitOfWork.set(new ArrayList<>());
    }

    @Override
    public void end(final Throwable failure) {
        final List<Added<T>> added = unitOfWork.get();
        unitOfWork.remove();
        if (added == null || failure == null || added.isEmpty()) return;

        int leftovers = 0;
        for (int i = added.size() - 1; i >= 0; i--) {
            final Added<T> a = added.get(i);
            final Channel<T> ch = channels.get(a.channel());
            final boolean removed;
            synchronized (ch) {
                removed = ch.pending.removeIf(e -> e == a.entry());
            }
            if (!removed) leftovers++;
        }

        log.debug("Rolled back {} delayed items after failure: {}", added.size() - leftovers, failure.toString());
        if (leftovers > 0) {
            log.warn("{} delayed items added by the failed unit of work were already claimed and stay queued", leftovers);
        }
    }

    @Override
    public void addToQueue(final String channel, final T item) {
        final Entry<T> entry = new Entry<>(item, clock.instant());
        final Channel<T> ch = channels.computeIfAbsent(channel, k -> new Channel<>());
        synchronized (ch) {
            ch.pending.addLast(entry);
        }

        final List<Added<T>> added = unitOfWork.get();
        if (added != null) {
            added.add(new Added<>(channel, entry));
        }
    }

    @Override
    public int size(final String channel) {
        final Channel<T> ch = channels.get(channel);
        if (ch == null) return 0;
        synchronized (ch) {
            return ch.pending.size();
        }
    }

    @Override
    public Optional<Duration> age(final String channel) {
        final Channel<T> ch = channels.get(channel);
        if (ch == null) return Optional.empty();

        final Entry<T> oldest;
        synchronized (ch) {
            oldest = ch.pending.peekFirst();
        }
        return oldest == null ? Optional.empty() : Optional.of(Duration.between(oldest.arrived, clock.instant()));
    }

    @Override
    public List<T> pull(final String channel) {
        return claim(channel, Integer.MAX_VALUE);
    }

    @Override
    public List<T> pull(final String channel, final int max) {
        if (max < 1) throw new IllegalArgumentException("max must be positive, was " + max);
        return claim(channel, max);
    }

    @Override
    public void ack(final String channel) {
        final Channel<T> ch = channels.get(channel);
        if (ch == null) throw new ChannelNotClaimedException(channel, "ack");

        synchronized (ch) {
            if (!ch.claimed.get()) throw new ChannelNotClaimedException(channel, "ack");
            ch.inFlight = List.of();
            ch.claimed.set(false);
        }
    }

    @Override
    public void nack(final String channel) {
        final Channel<T> ch = channels.get(channel);
        if (ch == null) throw new ChannelNotClaimedException(channel, "nack");

        synchronized (ch) {
            if (!ch.claimed.get()) throw new ChannelNotClaimedException(channel, "nack");
            // returned items go ahead of anything added during the claim
            for (int i = ch.inFlight.size() - 1; i >= 0; i--) {
                ch.pending.addFirst(ch.inFlight.get(i));
            }
            ch.inFlight = List.of();
            ch.claimed.set(false);
        }
    }

    private List<T> claim(final String channel, final int max) {
        final Channel<T> ch = channels.get(channel);
        if (ch == null) return List.of();

        synchronized (ch) {
            if (ch.pending.isEmpty() || !ch.claimed.compareAndSet(false, true)) {
                return List.of();
            }

            final int n = Math.min(max, ch.pending.size());
            final List<Entry<T>> taken = new ArrayList<>(n);
            final List<T> items = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                final Entry<T> e = ch.pending.pollFirst();
                taken.add(e);
                items.add(e.item);
            }
            ch.inFlight = taken;
            return items;
        }
    }
}
