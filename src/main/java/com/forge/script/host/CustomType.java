package com.forge.script.host;

import java.util.Iterator;
import java.util.Objects;

import com.forge.script.parser.Callable;
import com.forge.script.parser.Value;

/**
 * Operation table for a host-defined value type. Only {@link #name()} is required; every
 * other operation has a default that treats the payload as an opaque, immutable object.
 */
public interface CustomType {

    /** Type name shown in error messages and returned by typeof. */
    String name();

    default boolean isEqual(Object a, Object b) {
        return Objects.equals(a, b);
    }

    default int hash(Object payload) {
        return Objects.hashCode(payload);
    }

    default String display(Object payload) {
        return "<" + name() + ">";
    }

    /** Elements for "for x in value", or null when the type is not iterable. */
    default Iterator<Value> iterator(Object payload) {
        return null;
    }

    /**
     * Converts the payload to a built-in value of the requested type so an operator can be
     * retried. Returns null when no such conversion exists.
     */
    default Value coerce(Object payload, Value.Type target) {
        return null;
    }

    /** A callable view of the payload, or null when values of this type cannot be called. */
    default Callable asCallable(Object payload) {
        return null;
    }

    /** Payload for "clone"; immutable payloads can be shared. */
    default Object copy(Object payload) {
        return payload;
    }
}
