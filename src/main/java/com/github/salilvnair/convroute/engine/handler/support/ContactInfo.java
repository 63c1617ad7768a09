package com.github.salilvnair.convroute.engine.handler.support;

public record ContactInfo(Type type, String value) {

    public enum Type {
        ORDER_NUMBER,
        EMAIL,
        PHONE
    }
}
