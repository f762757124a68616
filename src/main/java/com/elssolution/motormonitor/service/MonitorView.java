package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.ConnectivityStatus;
import com.elssolution.motormonitor.domain.Device;
import com.elssolution.motormonitor.domain.HealthBreakdown;
import com.elssolution.motormonitor.domain.Recommendation;
import com.elssolution.motormonitor.domain.SensorSnapshot;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of the shared monitoring state. {@link MonitorState} swaps
 * whole instances under its lock; readers never see a half-applied update.
 */
public record MonitorView(
        SensorSnapshot snapshot,
        Map<Device, ConnectivityStatus> connectivity,
        HealthBreakdown health,
        List<Recommendation> recommendations,
        AnalysisStatus analysisStatus,
        Instant lastUpdate
) {

    public static MonitorView initial() {
        Map<Device, ConnectivityStatus> conn = new EnumMap<>(Device.class);
        for (Device d : Device.values()) conn.put(d, ConnectivityStatus.INITIAL);
        return new MonitorView(SensorSnapshot.EMPTY, Map.copyOf(conn), HealthBreakdown.NO_DATA,
                List.of(), AnalysisStatus.INITIALIZING, null);
    }

    public ConnectivityStatus connectivity(Device d) {
        return connectivity.getOrDefault(d, ConnectivityStatus.INITIAL);
    }

    public boolean isConnected(Device d) {
        return connectivity(d).isConnected();
    }

    public Map<Device, Boolean> connectedFlags() {
        Map<Device, Boolean> flags = new EnumMap<>(Device.class);
        for (Device d : Device.values()) flags.put(d, isConnected(d));
        return flags;
    }

    // ---- withers ----

    public MonitorView withSnapshot(SensorSnapshot s) {
        return new MonitorView(s, connectivity, health, recommendations, analysisStatus, lastUpdate);
    }

    public MonitorView withConnectivity(Device d, ConnectivityStatus status) {
        Map<Device, ConnectivityStatus> conn = new EnumMap<>(connectivity);
        conn.put(d, status);
        return new MonitorView(snapshot, Map.copyOf(conn), health, recommendations, analysisStatus, lastUpdate);
    }

    public MonitorView withAnalysis(HealthBreakdown h, List<Recommendation> recs) {
        return new MonitorView(snapshot, connectivity, h, List.copyOf(recs), AnalysisStatus.ACTIVE, lastUpdate);
    }

    public MonitorView withAnalysisStatus(AnalysisStatus status) {
        return new MonitorView(snapshot, connectivity, health, recommendations, status, lastUpdate);
    }

    public MonitorView withLastUpdate(Instant at) {
        return new MonitorView(snapshot, connectivity, health, recommendations, analysisStatus, at);
    }
}
