package com.elssolution.motormonitor.alerts;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalUncaughtHandler implements Thread.UncaughtExceptionHandler {

    private final AlertService alerts;
    private final ApplicationEventPublisher publisher;

    private volatile boolean stopping = false; // quiet during shutdown

    @PostConstruct
    void registerAsDefault() {
        Thread.setDefaultUncaughtExceptionHandler(this);
        log.info("Global uncaught handler installed");
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent e) {
        stopping = true;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        if (stopping) return;

        OperationalAlert key = classify(e);
        log.error("Uncaught in {} -> {}", t.getName(), e.toString(), e);
        alerts.raise(key, e.toString());

        // the Modbus stack died under us: make the reader drop its connection
        if (key == OperationalAlert.CONTROLLER_UNCAUGHT) {
            publisher.publishEvent(new ControllerCrashedEvent(e));
        }
    }

    static OperationalAlert classify(Throwable e) {
        for (Throwable c = e; c != null; c = c.getCause()) {
            for (StackTraceElement st : c.getStackTrace()) {
                if (st.getClassName().startsWith("com.ghgande.j2mod")) return OperationalAlert.CONTROLLER_UNCAUGHT;
            }
        }
        return OperationalAlert.UNCAUGHT;
    }
}
