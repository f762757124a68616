package com.elssolution.motormonitor.service;

import com.elssolution.motormonitor.domain.SensorModuleReading;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Sensor module push payload -> typed reading.
 *
 * Positional fields:
 *   VAL1 current A, VAL2 voltage V, VAL3 rpm,
 *   VAL4 ambient C, VAL5 humidity %, VAL6 ambient F, VAL7 heat index C, VAL8 heat index F,
 *   VAL9..VAL11 relay states, VAL12 combined alarm flag, TYPE tag (ignored).
 *
 * Numbers arrive as JSON numbers or strings. Missing, empty, unparsable and zero
 * values all mean "no reading" and map to null; a bad field never rejects the payload.
 */
@Component
public class ReadingParser {

    public static final String TYPE_FIELD = "TYPE";
    public static final String RELAY_DEFAULT = "OFF";
    public static final String COMBINED_DEFAULT = "NOR";

    /**
     * @throws IllegalArgumentException when there is no payload at all
     */
    public SensorModuleReading parse(JsonNode payload) {
        if (isEmpty(payload)) {
            throw new IllegalArgumentException("No data received");
        }
        return new SensorModuleReading(
                sentinelNum(payload, "VAL1"),
                sentinelNum(payload, "VAL2"),
                sentinelNum(payload, "VAL3"),
                sentinelNum(payload, "VAL4"),
                sentinelNum(payload, "VAL5"),
                sentinelNum(payload, "VAL6"),
                sentinelNum(payload, "VAL7"),
                sentinelNum(payload, "VAL8"),
                flag(payload, "VAL9", RELAY_DEFAULT),
                flag(payload, "VAL10", RELAY_DEFAULT),
                flag(payload, "VAL11", RELAY_DEFAULT),
                flag(payload, "VAL12", COMBINED_DEFAULT));
    }

    public static boolean isEmpty(JsonNode payload) {
        return payload == null || payload.isNull() || payload.isMissingNode()
                || !payload.isObject() || payload.isEmpty();
    }

    static Double sentinelNum(JsonNode obj, String field) {
        JsonNode n = obj.path(field);
        double v;
        if (n.isNumber()) {
            v = n.asDouble();
        } else if (n.isTextual()) {
            String s = n.asText().trim();
            if (s.isEmpty()) return null;
            try {
                v = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        if (!Double.isFinite(v) || v == 0.0) return null;
        return v;
    }

    static String flag(JsonNode obj, String field, String def) {
        JsonNode n = obj.path(field);
        if (n.isMissingNode() || n.isNull()) return def;
        String s = n.asText("").trim();
        return s.isEmpty() ? def : s;
    }
}
