package com.example.rota.geofence;

/**
 * Outcome of a clock-in position check. {@code distanceMetres} is null when either side lacks coordinates.
 */
public record GeofenceCheck(boolean allowed, Double distanceMetres, Integer radiusMetres) {

    public static GeofenceCheck unchecked(Integer radiusMetres) {
        return new GeofenceCheck(true, null, radiusMetres);
    }

    public boolean evaluated() {
        return distanceMetres != null;
    }
}
