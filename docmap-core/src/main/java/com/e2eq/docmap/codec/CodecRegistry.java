package com.e2eq.docmap.codec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from value class to {@link ValueCodec}. Exact class matches win; otherwise the
 * first registered codec whose value class is a supertype of the requested class is used.
 */
public class CodecRegistry {

    private final Map<Class<?>, ValueCodec<?>> codecs = new LinkedHashMap<>();

    public static CodecRegistry defaults() {
        CodecRegistry registry = new CodecRegistry();
        registry.register(new StringCodec());
        registry.register(new IntegerCodec());
        registry.register(new LongCodec());
        registry.register(new DoubleCodec());
        registry.register(new BooleanCodec());
        registry.register(new LocalDateCodec());
        registry.register(new InstantCodec());
        registry.register(new StringListCodec());
        registry.register(new PointCodec());
        return registry;
    }

    public CodecRegistry register(ValueCodec<?> codec) {
        codecs.put(codec.getValueClass(), codec);
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<ValueCodec<T>> find(Class<T> valueClass) {
        ValueCodec<?> codec = codecs.get(valueClass);
        if (codec == null) {
            for (Map.Entry<Class<?>, ValueCodec<?>> entry : codecs.entrySet()) {
                if (entry.getKey().isAssignableFrom(valueClass)) {
                    codec = entry.getValue();
                    break;
                }
            }
        }
        return Optional.ofNullable((ValueCodec<T>) codec);
    }

    public <T> ValueCodec<T> lookup(Class<T> valueClass) {
        return find(valueClass).orElseThrow(() ->
                new IllegalArgumentException("No codec registered for " + valueClass.getName()));
    }

    /**
     * Normalizes a value whose declared type is unknown: scalar values of a registered class go
     * through their codec, collections and mappings are returned unchanged.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public Object normalizeAny(Object value, String field) {
        if (value == null || value instanceof java.util.Collection || value instanceof Map) {
            return value;
        }
        Optional<ValueCodec<Object>> codec = find((Class) value.getClass());
        return codec.map(c -> c.normalize(value, field)).orElse(value);
    }
}
