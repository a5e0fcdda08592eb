package com.e2eq.docmap.codec;

import org.bson.types.ObjectId;

public class StringCodec extends ScalarCodec<String> {

    public StringCodec() {
        super(String.class, "a string");
    }

    @Override
    protected String convert(Object primitive) {
        if (primitive instanceof Number || primitive instanceof Boolean || primitive instanceof Character) {
            return primitive.toString();
        }
        if (primitive instanceof ObjectId) {
            return ((ObjectId) primitive).toHexString();
        }
        return null;
    }

    @Override
    protected String parse(String text) {
        return text;
    }
}
