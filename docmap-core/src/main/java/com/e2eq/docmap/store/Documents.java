package com.e2eq.docmap.store;

import org.bson.Document;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Helpers for working with raw documents: deep copies and value comparison that treats
 * numbers by value the way the store does ({@code 5 == 5L == 5.0}).
 */
public final class Documents {

    private Documents() {
    }

    /**
     * Copies nested documents, maps and lists so the copy shares no mutable state with the source.
     * Maps are copied into {@link Document}s, preserving key order.
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Document copy = new Document();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }

    public static Document deepCopy(Document document) {
        return document == null ? null : (Document) deepCopy((Object) document);
    }

    public static boolean valuesEqual(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> ma = (Map<?, ?>) a;
            Map<?, ?> mb = (Map<?, ?>) b;
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : ma.entrySet()) {
                if (!mb.containsKey(entry.getKey()) || !valuesEqual(entry.getValue(), mb.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List && b instanceof List) {
            List<?> la = (List<?>) a;
            List<?> lb = (List<?>) b;
            if (la.size() != lb.size()) {
                return false;
            }
            for (int i = 0; i < la.size(); i++) {
                if (!valuesEqual(la.get(i), lb.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Orders two values of the same kind (numbers, strings, dates).
     *
     * @return the comparison result, or {@code null} when the values are not comparable
     */
    public static Integer compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Date && b instanceof Date) {
            return ((Date) a).compareTo((Date) b);
        }
        return null;
    }
}
