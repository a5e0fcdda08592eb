package com.e2eq.docmap.codec;

public class DoubleCodec extends ScalarCodec<Double> {

    public DoubleCodec() {
        super(Double.class, "a number");
    }

    @Override
    protected Double convert(Object primitive) {
        return primitive instanceof Number ? ((Number) primitive).doubleValue() : null;
    }

    @Override
    protected Double parse(String text) {
        return Double.valueOf(text);
    }
}
