package com.e2eq.docmap.codec;

public class IntegerCodec extends ScalarCodec<Integer> {

    public IntegerCodec() {
        super(Integer.class, "a whole number");
    }

    @Override
    protected Integer convert(Object primitive) {
        if (primitive instanceof Number) {
            double d = ((Number) primitive).doubleValue();
            if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                return (int) d;
            }
        }
        return null;
    }

    @Override
    protected Integer parse(String text) {
        return Integer.valueOf(text);
    }
}
