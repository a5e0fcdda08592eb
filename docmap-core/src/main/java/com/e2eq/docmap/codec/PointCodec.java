package com.e2eq.docmap.codec;

import com.e2eq.docmap.exceptions.MalformedDocumentException;
import com.e2eq.docmap.geo.Point;
import org.bson.Document;

import java.util.List;
import java.util.Map;

/**
 * Stores a {@link Point} as a GeoJSON document: {@code {type: "Point", coordinates: [lng, lat]}}.
 */
public class PointCodec implements ValueCodec<Point> {

    private static final String SHAPE = "a GeoJSON point {type: \"Point\", coordinates: [lng, lat]}";

    @Override
    public Class<Point> getValueClass() {
        return Point.class;
    }

    @Override
    public Object encode(Point value) {
        if (value == null) {
            return null;
        }
        return new Document("type", Point.GEOJSON_TYPE).append("coordinates", value.coordinates());
    }

    @Override
    public Point decode(Object primitive, String field) {
        if (primitive == null) {
            return null;
        }
        if (primitive instanceof Point) {
            return (Point) primitive;
        }
        if (!(primitive instanceof Map)) {
            throw new MalformedDocumentException(field, SHAPE, primitive);
        }
        Map<?, ?> map = (Map<?, ?>) primitive;
        if (!Point.GEOJSON_TYPE.equals(map.get("type"))) {
            throw new MalformedDocumentException(field, SHAPE, primitive);
        }
        return fromCoordinates(map.get("coordinates"), field, primitive);
    }

    /**
     * Besides the GeoJSON form, accepts a {@code [lng, lat]} pair and a
     * {@code {lng, lat}} or {@code {longitude, latitude}} mapping.
     */
    @Override
    public Object normalize(Object input, String field) {
        if (input instanceof List) {
            return encode(fromCoordinates(input, field, input));
        }
        if (input instanceof Map && !((Map<?, ?>) input).containsKey("type")) {
            Map<?, ?> map = (Map<?, ?>) input;
            Object lng = map.containsKey("lng") ? map.get("lng") : map.get("longitude");
            Object lat = map.containsKey("lat") ? map.get("lat") : map.get("latitude");
            if (!(lng instanceof Number) || !(lat instanceof Number)) {
                throw new MalformedDocumentException(field, SHAPE, input);
            }
            return encode(toPoint(((Number) lng).doubleValue(), ((Number) lat).doubleValue(), field, input));
        }
        return ValueCodec.super.normalize(input, field);
    }

    private Point fromCoordinates(Object coordinates, String field, Object original) {
        if (!(coordinates instanceof List) || ((List<?>) coordinates).size() != 2) {
            throw new MalformedDocumentException(field, SHAPE, original);
        }
        List<?> pair = (List<?>) coordinates;
        if (!(pair.get(0) instanceof Number) || !(pair.get(1) instanceof Number)) {
            throw new MalformedDocumentException(field, SHAPE, original);
        }
        return toPoint(((Number) pair.get(0)).doubleValue(), ((Number) pair.get(1)).doubleValue(), field, original);
    }

    private Point toPoint(double lng, double lat, String field, Object original) {
        try {
            return new Point(lng, lat);
        } catch (IllegalArgumentException e) {
            throw new MalformedDocumentException(field, SHAPE, original, e);
        }
    }
}
