package com.ridehailing.shared.util;

import com.uber.h3core.H3Core;

import java.io.IOException;

/**
 * H3 hexagonal geo-cell utilities.
 * Resolution 8 ≈ 0.74 km², the granularity price snapshots are keyed by.
 */
public final class H3Util {

    public static final int SNAPSHOT_RESOLUTION = 8;

    private static final double EARTH_RADIUS_KM = 6371.0;

    private static final H3Core h3;

    static {
        try {
            h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialise H3Core", e);
        }
    }

    private H3Util() {}

    public static String latLngToCell(double lat, double lng, int resolution) {
        return h3.latLngToCellAddress(lat, lng, resolution);
    }

    public static String snapshotCell(double lat, double lng) {
        return latLngToCell(lat, lng, SNAPSHOT_RESOLUTION);
    }

    /**
     * Great-circle distance. Used as a fallback when no routed distance is available.
     */
    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
