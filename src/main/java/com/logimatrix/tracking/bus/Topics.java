package com.logimatrix.tracking.bus;

import com.logimatrix.tracking.exception.InvalidTopicException;

import java.util.ArrayList;
import java.util.List;

/**
 * Well-known topic names: {@code vehicle:<id>}, {@code shipment:<id>},
 * {@code tenant:<id>} and {@code accident-zone:<id>}.
 */
public final class Topics {

    public static final String VEHICLE = "vehicle:";
    public static final String SHIPMENT = "shipment:";
    public static final String TENANT = "tenant:";
    public static final String ACCIDENT_ZONE = "accident-zone:";

    private static final List<String> PREFIXES = List.of(VEHICLE, SHIPMENT, TENANT, ACCIDENT_ZONE);

    private Topics() {
    }

    public static String vehicle(String vehicleId) {
        return VEHICLE + vehicleId;
    }

    public static String shipment(String shipmentId) {
        return SHIPMENT + shipmentId;
    }

    public static String tenant(String tenantId) {
        return TENANT + tenantId;
    }

    public static String accidentZone(String zoneId) {
        return ACCIDENT_ZONE + zoneId;
    }

    /**
     * Topics of a fix: its vehicle, its shipment if set, and its tenant.
     */
    public static List<String> forFix(String tenantId, String vehicleId, String shipmentId) {
        List<String> topics = new ArrayList<>(3);
        topics.add(vehicle(vehicleId));
        if (shipmentId != null) {
            topics.add(shipment(shipmentId));
        }
        topics.add(tenant(tenantId));
        return topics;
    }

    /**
     * @return the trimmed topic
     * @throws InvalidTopicException if the prefix is unknown or the id is empty
     */
    public static String validate(String topic) {
        if (topic == null) {
            throw new InvalidTopicException("null");
        }
        String trimmed = topic.trim();
        for (String prefix : PREFIXES) {
            if (trimmed.startsWith(prefix) && trimmed.length() > prefix.length()) {
                return trimmed;
            }
        }
        throw new InvalidTopicException(topic);
    }
}
