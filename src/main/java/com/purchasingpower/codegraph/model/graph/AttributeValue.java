package com.purchasingpower.codegraph.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;

/**
 * Scalar value stored in node metadata and attribute maps.
 *
 * <p>Only strings, numbers, booleans and timestamps are allowed, so exported
 * snapshots stay flat and JSON-friendly.
 */
@Getter
@EqualsAndHashCode
public final class AttributeValue {

    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        TIMESTAMP
    }

    private final Kind kind;
    private final Object value;

    private AttributeValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Preconditions.checkNotNull(value, "Attribute value cannot be null");
    }

    public static AttributeValue of(String value) {
        return new AttributeValue(Kind.STRING, value);
    }

    public static AttributeValue of(long value) {
        return new AttributeValue(Kind.NUMBER, value);
    }

    public static AttributeValue of(double value) {
        return new AttributeValue(Kind.NUMBER, value);
    }

    public static AttributeValue of(boolean value) {
        return new AttributeValue(Kind.BOOLEAN, value);
    }

    public static AttributeValue of(Instant value) {
        return new AttributeValue(Kind.TIMESTAMP, value);
    }

    public String asString() {
        return value.toString();
    }

    public double asDouble() {
        return kind == Kind.NUMBER ? ((Number) value).doubleValue() : 0.0;
    }

    public boolean asBoolean() {
        return kind == Kind.BOOLEAN && (Boolean) value;
    }

    @JsonValue
    public Object toJson() {
        return kind == Kind.TIMESTAMP ? value.toString() : value;
    }

    @Override
    public String toString() {
        return asString();
    }
}
