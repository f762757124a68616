package com.elssolution.motormonitor.domain;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class ConnectivityStatus {

    public static final ConnectivityStatus INITIAL = new ConnectivityStatus(false, null);

    boolean connected;
    Instant lastSeen;   // null until the first successful read

    public static ConnectivityStatus seenAt(Instant at) {
        return new ConnectivityStatus(true, at);
    }

    public ConnectivityStatus disconnected() {
        return new ConnectivityStatus(false, lastSeen);
    }

    /** Time since last_seen, or null if the device was never seen. */
    public Duration silenceAt(Instant now) {
        return lastSeen == null ? null : Duration.between(lastSeen, now);
    }
}
