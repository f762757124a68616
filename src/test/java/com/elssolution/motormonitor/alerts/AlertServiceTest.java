package com.elssolution.motormonitor.alerts;

import com.elssolution.motormonitor.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AlertServiceTest {

    static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final AlertService alerts = new AlertService(clock);

    @Test
    void raise_opens_one_episode_and_refreshes_it() {
        alerts.raise(OperationalAlert.CONTROLLER_UNREACHABLE, "read timed out");
        clock.advance(Duration.ofSeconds(5));
        alerts.raise(OperationalAlert.CONTROLLER_UNREACHABLE, "connection refused");

        AlertService.Board board = alerts.board();
        assertThat(board.active()).singleElement().satisfies(e -> {
            assertThat(e.alert()).isEqualTo(OperationalAlert.CONTROLLER_UNREACHABLE);
            assertThat(e.level()).isEqualTo(OperationalAlert.Level.ERROR);
            assertThat(e.component()).isEqualTo("PLC");
            assertThat(e.message()).isEqualTo("connection refused");
            assertThat(e.startedAt()).isEqualTo(T0);
            assertThat(e.lastSeen()).isEqualTo(T0.plusSeconds(5));
            assertThat(e.count()).isEqualTo(2);
            assertThat(e.active()).isTrue();
        });
        assertThat(board.recent()).hasSize(1);
        assertThat(alerts.isDegraded()).isTrue();
        assertThat(alerts.activeCount()).isEqualTo(1);
    }

    @Test
    void resolve_closes_the_episode_and_clears_degraded() {
        alerts.raise(OperationalAlert.HISTORY_UNAVAILABLE, "db locked");
        clock.advance(Duration.ofSeconds(30));
        alerts.resolve(OperationalAlert.HISTORY_UNAVAILABLE);
        alerts.resolve(OperationalAlert.HISTORY_UNAVAILABLE);

        assertThat(alerts.isActive(OperationalAlert.HISTORY_UNAVAILABLE)).isFalse();
        assertThat(alerts.isDegraded()).isFalse();
        assertThat(alerts.board().recent()).extracting(AlertService.Transition::kind)
                .containsExactly(AlertService.Transition.Kind.RESOLVED, AlertService.Transition.Kind.RAISED);
        assertThat(alerts.deck(10)).singleElement().satisfies(e -> {
            assertThat(e.resolvedAt()).isEqualTo(T0.plusSeconds(30));
            assertThat(e.active()).isFalse();
        });
    }

    @Test
    void resolving_an_unknown_alert_is_a_no_op() {
        alerts.resolve(OperationalAlert.ANALYSIS_FAILED);

        assertThat(alerts.board().recent()).isEmpty();
        assertThat(alerts.deck(10)).isEmpty();
    }

    @Test
    void deck_lists_open_episodes_before_closed_ones_and_caps() {
        alerts.raise(OperationalAlert.PERSISTENCE_FAILED, "disk full");
        clock.advance(Duration.ofSeconds(1));
        alerts.resolve(OperationalAlert.PERSISTENCE_FAILED);
        clock.advance(Duration.ofSeconds(1));
        alerts.raise(OperationalAlert.LIVENESS_SWEEP_FAILED, "boom");
        clock.advance(Duration.ofSeconds(1));
        alerts.raise(OperationalAlert.ANALYSIS_FAILED, "npe");

        assertThat(alerts.deck(10)).extracting(AlertService.Episode::alert).containsExactly(
                OperationalAlert.ANALYSIS_FAILED,
                OperationalAlert.LIVENESS_SWEEP_FAILED,
                OperationalAlert.PERSISTENCE_FAILED);
        assertThat(alerts.deck(1)).extracting(AlertService.Episode::alert)
                .containsExactly(OperationalAlert.ANALYSIS_FAILED);
        assertThat(alerts.deck(0)).hasSize(1);
    }

    @Test
    void a_new_raise_after_resolve_starts_a_fresh_episode() {
        alerts.raise(OperationalAlert.UNCAUGHT, "first");
        alerts.resolve(OperationalAlert.UNCAUGHT);
        clock.advance(Duration.ofMinutes(1));
        alerts.raise(OperationalAlert.UNCAUGHT, "second");

        assertThat(alerts.board().active()).singleElement().satisfies(e -> {
            assertThat(e.count()).isEqualTo(1);
            assertThat(e.startedAt()).isEqualTo(T0.plus(Duration.ofMinutes(1)));
        });
        assertThat(alerts.deck(10)).hasSize(2);
    }
}
