package com.e2eq.docmap.codec;

public class LongCodec extends ScalarCodec<Long> {

    public LongCodec() {
        super(Long.class, "a whole number");
    }

    @Override
    protected Long convert(Object primitive) {
        if (primitive instanceof Integer || primitive instanceof Short || primitive instanceof Byte) {
            return ((Number) primitive).longValue();
        }
        if (primitive instanceof Number) {
            double d = ((Number) primitive).doubleValue();
            if (d == Math.rint(d)) {
                return (long) d;
            }
        }
        return null;
    }

    @Override
    protected Long parse(String text) {
        return Long.valueOf(text);
    }
}
