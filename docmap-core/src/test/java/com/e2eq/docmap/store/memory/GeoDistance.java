package com.e2eq.docmap.store.memory;

import java.util.List;
import java.util.Map;

/**
 * Great-circle distances on the sphere MongoDB uses for 2dsphere queries.
 */
final class GeoDistance {

    static final double EARTH_RADIUS_METERS = 6378100.0;

    private GeoDistance() {
    }

    static double meters(double lng1, double lat1, double lng2, double lat2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return 2 * EARTH_RADIUS_METERS * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    /**
     * Reads {@code [lng, lat]} out of a GeoJSON point, or returns {@code null} if the value is not one.
     */
    static double[] coordinates(Object geoJson) {
        if (!(geoJson instanceof Map)) {
            return null;
        }
        Object coordinates = ((Map<?, ?>) geoJson).get("coordinates");
        if (!(coordinates instanceof List) || ((List<?>) coordinates).size() != 2) {
            return null;
        }
        List<?> pair = (List<?>) coordinates;
        if (!(pair.get(0) instanceof Number) || !(pair.get(1) instanceof Number)) {
            return null;
        }
        return new double[]{((Number) pair.get(0)).doubleValue(), ((Number) pair.get(1)).doubleValue()};
    }
}
