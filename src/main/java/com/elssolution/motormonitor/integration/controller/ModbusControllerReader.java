package com.elssolution.motormonitor.integration.controller;

import com.elssolution.motormonitor.alerts.ControllerCrashedEvent;
import com.ghgande.j2mod.modbus.ModbusException;
import com.ghgande.j2mod.modbus.facade.ModbusTCPMaster;
import com.ghgande.j2mod.modbus.procimg.Register;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.net.SocketTimeoutException;
import java.util.Locale;

/**
 * Modbus TCP reader for the motor controller.
 *
 * Voltage and temperature live in two holding registers (default 100 and 102);
 * both are fetched in one request window covering the lower..higher address.
 * The connection is opened lazily and kept between polls. Timeouts are retried on
 * the same connection until {@code timeoutsBeforeReopen} in a row, then it is dropped.
 */
@Slf4j
@Service
@Getter
public class ModbusControllerReader implements ControllerReader {

    // ==== Config ====
    @Value("${controller.host:192.168.3.39}")            private String host;
    @Value("${controller.port:502}")                     private int port;
    @Value("${controller.unitId:1}")                     private int unitId;
    @Value("${controller.voltageRegister:100}")          private int voltageRegister;
    @Value("${controller.temperatureRegister:102}")      private int temperatureRegister;
    @Value("${controller.timeoutMs:1500}")               private int timeoutMs;
    @Value("${controller.timeoutsBeforeReopen:3}")       private int timeoutsBeforeReopen;

    // ==== Modbus master lifecycle ====
    private final Object masterLock = new Object();
    private volatile ModbusTCPMaster master;
    private volatile boolean stopping = false;
    private volatile int consecutiveTimeouts = 0;

    @Override
    public ControllerRegisters read() throws ControllerReadException {
        int start = Math.min(voltageRegister, temperatureRegister);
        int count = Math.abs(voltageRegister - temperatureRegister) + 1;
        try {
            Register[] regs;
            synchronized (masterLock) {
                ensureOpen();
                regs = master.readMultipleRegisters(unitId, start, count);
            }
            if (regs == null || regs.length < count) {
                throw new ControllerReadException("short read: expected " + count + " registers", null, false);
            }
            consecutiveTimeouts = 0;
            int rawV = regs[voltageRegister - start].toUnsignedShort();
            int rawT = regs[temperatureRegister - start].toUnsignedShort();
            if (log.isDebugEnabled()) log.debug("controller_read_ok rawV={} rawT={}", rawV, rawT);
            return new ControllerRegisters(rawV, rawT);

        } catch (ControllerReadException e) {
            closeQuietly();
            throw e;
        } catch (Exception e) {
            boolean timeout = isTimeout(e);
            if (timeout) {
                consecutiveTimeouts++;
                if (consecutiveTimeouts < Math.max(1, timeoutsBeforeReopen)) {
                    log.warn("controller_timeout (streak #{}) - retry without reopen", consecutiveTimeouts);
                } else {
                    log.warn("controller_timeout (streak #{}) - closing connection", consecutiveTimeouts);
                    closeQuietly();
                }
            } else {
                log.warn("controller_transport_err: {}", e.toString());
                closeQuietly();
            }
            throw new ControllerReadException("controller read failed at " + endpoint() + ": " + e.getMessage(),
                    e, timeout);
        }
    }

    @Override
    public String endpoint() {
        return String.format(Locale.ROOT, "%s:%d/%d", host, port, unitId);
    }

    @PreDestroy
    public void shutdown() {
        stopping = true;
        closeQuietly();
    }

    @EventListener
    public void onControllerCrash(ControllerCrashedEvent evt) {
        if (stopping) return;
        log.warn("controller_crash_event -> dropping connection (cause: {})", evt.cause().toString());
        closeQuietly();
    }

    // ---- Helpers ----

    static boolean isTimeout(Throwable e) {
        for (Throwable c = e; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof ModbusException && c.getMessage() != null
                    && c.getMessage().toLowerCase(Locale.ROOT).contains("timed out")) return true;
        }
        return false;
    }

    // caller holds masterLock
    private void ensureOpen() throws Exception {
        if (master != null) return;
        ModbusTCPMaster m = new ModbusTCPMaster(host, port, timeoutMs, true);
        m.connect();
        master = m;
        consecutiveTimeouts = 0;
        log.info("controller_connected endpoint={}", endpoint());
    }

    private void closeQuietly() {
        synchronized (masterLock) {
            if (master == null) return;
            try {
                master.disconnect();
            } catch (RuntimeException e) {
                log.debug("controller_disconnect_err: {}", e.toString());
            } finally {
                master = null;
                log.info("controller_disconnected endpoint={}", endpoint());
            }
        }
    }
}
