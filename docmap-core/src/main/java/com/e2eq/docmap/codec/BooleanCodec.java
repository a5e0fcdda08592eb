package com.e2eq.docmap.codec;

public class BooleanCodec extends ScalarCodec<Boolean> {

    public BooleanCodec() {
        super(Boolean.class, "a boolean");
    }

    @Override
    protected Boolean convert(Object primitive) {
        return null;
    }

    @Override
    protected Boolean parse(String text) {
        switch (text.toLowerCase()) {
            case "true":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "0":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("not a boolean: " + text);
        }
    }
}
