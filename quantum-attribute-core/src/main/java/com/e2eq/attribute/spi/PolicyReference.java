package com.e2eq.attribute.spi;

public record PolicyReference(String id, String name, String displayName) {
}
