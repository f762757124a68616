package com.elssolution.motormonitor.alerts;

import com.elssolution.motormonitor.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GlobalUncaughtHandlerTest {

    private static RuntimeException thrownFrom(String className) {
        RuntimeException e = new RuntimeException("boom");
        e.setStackTrace(new StackTraceElement[]{
                new StackTraceElement(className, "run", "X.java", 10)
        });
        return e;
    }

    @Test
    void modbus_frames_are_classified_as_controller_failures() {
        RuntimeException wrapped = new RuntimeException("outer",
                thrownFrom("com.ghgande.j2mod.modbus.io.ModbusTCPTransport"));
        wrapped.setStackTrace(new StackTraceElement[0]);

        assertThat(GlobalUncaughtHandler.classify(wrapped)).isEqualTo(OperationalAlert.CONTROLLER_UNCAUGHT);
        assertThat(GlobalUncaughtHandler.classify(thrownFrom("java.util.HashMap")))
                .isEqualTo(OperationalAlert.UNCAUGHT);
    }

    @Test
    void controller_crash_raises_critical_and_publishes_event() {
        AlertService alerts = new AlertService(new MutableClock(Instant.parse("2025-03-01T10:00:00Z")));
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        GlobalUncaughtHandler handler = new GlobalUncaughtHandler(alerts, publisher);

        handler.uncaughtException(Thread.currentThread(), thrownFrom("com.ghgande.j2mod.modbus.net.TCPMasterConnection"));

        assertThat(alerts.isActive(OperationalAlert.CONTROLLER_UNCAUGHT)).isTrue();
        assertThat(alerts.isDegraded()).isTrue();
        verify(publisher).publishEvent(any(ControllerCrashedEvent.class));
    }

    @Test
    void other_crashes_do_not_touch_the_controller() {
        AlertService alerts = new AlertService(new MutableClock(Instant.parse("2025-03-01T10:00:00Z")));
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        GlobalUncaughtHandler handler = new GlobalUncaughtHandler(alerts, publisher);

        handler.uncaughtException(Thread.currentThread(), thrownFrom("com.example.Other"));

        assertThat(alerts.isActive(OperationalAlert.UNCAUGHT)).isTrue();
        verify(publisher, never()).publishEvent(any(Object.class));
    }
}
