package com.example.rota.geofence;

/**
 * Great-circle distance check between a staff device and a site.
 * Missing coordinates on either side never block a clock-in.
 */
public final class GeofenceValidator {

    static final double EARTH_RADIUS_METRES = 6_371_000d;

    private GeofenceValidator() {
    }

    public static GeofenceCheck check(Double staffLatitude, Double staffLongitude,
                                      Double siteLatitude, Double siteLongitude,
                                      Integer radiusMetres) {
        if (staffLatitude == null || staffLongitude == null || siteLatitude == null || siteLongitude == null) {
            return GeofenceCheck.unchecked(radiusMetres);
        }
        double distance = distanceMetres(staffLatitude, staffLongitude, siteLatitude, siteLongitude);
        if (radiusMetres == null) {
            return new GeofenceCheck(true, distance, null);
        }
        return new GeofenceCheck(distance <= radiusMetres, distance, radiusMetres);
    }

    /**
     * Haversine distance in metres.
     */
    public static double distanceMetres(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METRES * c;
    }
}
