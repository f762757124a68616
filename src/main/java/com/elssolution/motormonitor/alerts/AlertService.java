package com.elssolution.motormonitor.alerts;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operational alert board: one open episode per {@link OperationalAlert} while the
 * condition lasts, plus a short log of raise/resolve transitions and closed episodes.
 * Any open episode means the monitor reports itself degraded.
 */
@Slf4j
@Service
public class AlertService {

    static final int RECENT_CAPACITY = 50;
    static final int CLOSED_CAPACITY = 20;
    static final int MAX_DECK = 50;

    private final Clock clock;
    private final Object lock = new Object();

    // guarded by lock
    private final Map<OperationalAlert, Episode> open = new EnumMap<>(OperationalAlert.class);
    private final Deque<Transition> recent = new ArrayDeque<>();
    private final Deque<Episode> closed = new ArrayDeque<>();

    public AlertService(Clock clock) {
        this.clock = clock;
    }

    /** Opens an episode, or refreshes the running one with the latest message. */
    public void raise(OperationalAlert alert, String message) {
        Instant now = clock.instant();
        Episode episode;
        boolean opened;
        synchronized (lock) {
            Episode running = open.get(alert);
            opened = running == null;
            episode = opened ? Episode.start(alert, message, now) : running.refresh(message, now);
            open.put(alert, episode);
            if (opened) remember(new Transition(alert, Transition.Kind.RAISED, message, now));
        }
        if (opened) {
            log.warn("alert_raised key={} level={} msg={}", alert, alert.level(), message);
        } else if (log.isDebugEnabled()) {
            log.debug("alert_refreshed key={} count={} msg={}", alert, episode.count(), message);
        }
    }

    /** Closes the running episode; no-op when {@code alert} is not open. */
    public void resolve(OperationalAlert alert) {
        Instant now = clock.instant();
        Episode done;
        synchronized (lock) {
            Episode running = open.remove(alert);
            if (running == null) return;
            done = running.close(now);
            closed.addFirst(done);
            while (closed.size() > CLOSED_CAPACITY) closed.removeLast();
            remember(new Transition(alert, Transition.Kind.RESOLVED, running.message(), now));
        }
        log.info("alert_resolved key={} lasted={}s raises={}", alert,
                Duration.between(done.startedAt(), now).toSeconds(), done.count());
    }

    public boolean isActive(OperationalAlert alert) {
        synchronized (lock) {
            return open.containsKey(alert);
        }
    }

    public boolean isDegraded() {
        synchronized (lock) {
            return !open.isEmpty();
        }
    }

    public int activeCount() {
        synchronized (lock) {
            return open.size();
        }
    }

    /** Open episodes (most recently seen first) and the transition log (newest first). */
    public Board board() {
        synchronized (lock) {
            return new Board(openNewestFirst(), List.copyOf(recent));
        }
    }

    /** Open episodes first, then closed ones, newest first, at most {@code limit} (1..50). */
    public List<Episode> deck(int limit) {
        int cap = Math.max(1, Math.min(limit, MAX_DECK));
        synchronized (lock) {
            List<Episode> out = new ArrayList<>(openNewestFirst());
            out.addAll(closed);
            return out.size() > cap ? List.copyOf(out.subList(0, cap)) : List.copyOf(out);
        }
    }

    // caller holds lock
    private List<Episode> openNewestFirst() {
        return open.values().stream()
                .sorted(Comparator.comparing(Episode::lastSeen).reversed())
                .toList();
    }

    // caller holds lock
    private void remember(Transition t) {
        recent.addFirst(t);
        while (recent.size() > RECENT_CAPACITY) recent.removeLast();
    }

    public record Episode(OperationalAlert alert, OperationalAlert.Level level, String component,
                          String message, Instant startedAt, Instant lastSeen, Instant resolvedAt, int count) {

        static Episode start(OperationalAlert alert, String message, Instant at) {
            return new Episode(alert, alert.level(), alert.component(), message, at, at, null, 1);
        }

        Episode refresh(String latest, Instant at) {
            return new Episode(alert, level, component, latest, startedAt, at, null, count + 1);
        }

        Episode close(Instant at) {
            return new Episode(alert, level, component, message, startedAt, lastSeen, at, count);
        }

        @JsonProperty("active")
        public boolean active() {
            return resolvedAt == null;
        }
    }

    public record Transition(OperationalAlert alert, Kind kind, String message, Instant at) {
        public enum Kind { RAISED, RESOLVED }
    }

    public record Board(List<Episode> active, List<Transition> recent) {}
}
