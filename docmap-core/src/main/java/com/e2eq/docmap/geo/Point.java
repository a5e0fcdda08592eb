package com.e2eq.docmap.geo;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A GeoJSON point. Coordinates are held in GeoJSON order: longitude first, then latitude.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Point {

    public static final String GEOJSON_TYPE = "Point";

    private final double longitude;
    private final double latitude;

    public Point(double longitude, double latitude) {
        if (longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude out of range: " + longitude);
        }
        if (latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + latitude);
        }
        this.longitude = longitude;
        this.latitude = latitude;
    }

    public List<Double> coordinates() {
        List<Double> coordinates = new ArrayList<>(2);
        coordinates.add(longitude);
        coordinates.add(latitude);
        return coordinates;
    }
}
