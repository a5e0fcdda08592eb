package com.e2eq.docmap.query;

import com.e2eq.docmap.codec.PointCodec;
import com.e2eq.docmap.codec.ValueCodec;
import com.e2eq.docmap.geo.Point;
import com.e2eq.docmap.mapping.DocumentEntity;
import com.e2eq.docmap.mapping.EntityType;
import com.e2eq.docmap.mapping.FieldMapping;
import lombok.Value;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fluent builder for store filters.
 * <pre>
 *   Criteria.where("year").gt(2000).and("simplePlot").regex("heist", "i")
 * </pre>
 * Field names may be document keys or aliases. When translated against an {@link EntityType},
 * aliases become document keys and comparison values of mapped fields pass through the field's
 * codec, so a {@code LocalDate} compares against the stored {@code Date}.
 */
public final class Criteria {

    private static final PointCodec POINT_CODEC = new PointCodec();

    private final Map<String, List<Condition>> conditions = new LinkedHashMap<>();
    private String currentField;

    private Criteria(String field) {
        and(field);
    }

    public static Criteria where(String field) {
        return new Criteria(field);
    }

    public Criteria and(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field is required");
        }
        this.currentField = field;
        return this;
    }

    public Criteria is(Object value) {
        return add(null, value, true);
    }

    public Criteria ne(Object value) {
        return add("$ne", value, true);
    }

    public Criteria in(Collection<?> values) {
        return add("$in", new ArrayList<>(values), true);
    }

    public Criteria in(Object... values) {
        return in(List.of(values));
    }

    public Criteria nin(Collection<?> values) {
        return add("$nin", new ArrayList<>(values), true);
    }

    public Criteria gt(Object value) {
        return add("$gt", value, true);
    }

    public Criteria gte(Object value) {
        return add("$gte", value, true);
    }

    public Criteria lt(Object value) {
        return add("$lt", value, true);
    }

    public Criteria lte(Object value) {
        return add("$lte", value, true);
    }

    public Criteria regex(String pattern) {
        return regex(pattern, null);
    }

    public Criteria regex(String pattern, String options) {
        add("$regex", pattern, false);
        if (options != null && !options.isEmpty()) {
            add("$options", options, false);
        }
        return this;
    }

    public Criteria regex(Pattern pattern) {
        StringBuilder options = new StringBuilder();
        if ((pattern.flags() & Pattern.CASE_INSENSITIVE) != 0) {
            options.append('i');
        }
        if ((pattern.flags() & Pattern.MULTILINE) != 0) {
            options.append('m');
        }
        if ((pattern.flags() & Pattern.DOTALL) != 0) {
            options.append('s');
        }
        return regex(pattern.pattern(), options.toString());
    }

    public Criteria exists(boolean exists) {
        return add("$exists", exists, false);
    }

    /**
     * Proximity on a GeoJSON field. Results are ordered nearest first; the field needs a
     * 2dsphere index.
     */
    public Criteria near(Point point) {
        Document near = new Document("$geometry", POINT_CODEC.encode(point));
        return add("$near", near, false);
    }

    /**
     * Bounds the preceding {@link #near(Point)} on the same field, in meters.
     */
    public Criteria maxDistance(double meters) {
        for (Condition condition : conditionsOf(currentField)) {
            if ("$near".equals(condition.operator)) {
                ((Document) condition.value).put("$maxDistance", meters);
                return this;
            }
        }
        throw new IllegalStateException("maxDistance requires near on field '" + currentField + "'");
    }

    private Criteria add(String operator, Object value, boolean translateValue) {
        conditionsOf(currentField).add(new Condition(operator, value, translateValue));
        return this;
    }

    private List<Condition> conditionsOf(String field) {
        return conditions.computeIfAbsent(field, f -> new ArrayList<>());
    }

    /**
     * The filter with field names and values as given.
     */
    public Document toFilter() {
        return toFilter(null);
    }

    public Document toFilter(EntityType<?> type) {
        Document filter = new Document();
        for (Map.Entry<String, List<Condition>> entry : conditions.entrySet()) {
            String key = type == null ? entry.getKey() : type.resolveKey(entry.getKey());
            ValueCodec<?> codec = codecFor(type, key);
            Object equality = null;
            boolean hasEquality = false;
            Document operators = new Document();
            for (Condition condition : entry.getValue()) {
                Object value = condition.translateValue ? translate(codec, key, condition.value) : condition.value;
                if (condition.operator == null) {
                    equality = value;
                    hasEquality = true;
                } else {
                    operators.put(condition.operator, value);
                }
            }
            if (operators.isEmpty()) {
                filter.put(key, equality);
            } else {
                if (hasEquality) {
                    Document withEquality = new Document("$eq", equality);
                    withEquality.putAll(operators);
                    operators = withEquality;
                }
                filter.put(key, operators);
            }
        }
        return filter;
    }

    private static ValueCodec<?> codecFor(EntityType<?> type, String key) {
        if (type == null || DocumentEntity.ID.equals(key) || key.indexOf('.') >= 0) {
            return null;
        }
        ValueCodec<?> codec = type.field(key).map(FieldMapping::getCodec).orElse(null);
        // array fields match element-wise, so comparison values stay scalar
        if (codec != null && Collection.class.isAssignableFrom(codec.getValueClass())) {
            return null;
        }
        return codec;
    }

    private static Object translate(ValueCodec<?> codec, String key, Object value) {
        if (value instanceof Collection) {
            List<Object> translated = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                translated.add(translate(codec, key, element));
            }
            return translated;
        }
        if (codec == null || value == null) {
            return value;
        }
        return codec.normalize(value, key);
    }

    @Override
    public String toString() {
        return "Criteria" + toFilter();
    }

    @Value
    private static class Condition {
        String operator;
        Object value;
        boolean translateValue;
    }
}
