package com.fhi.model_builder;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A field value as handed to a builder: either a literal, or a producer that is called once
 * per {@link ModelBuilder#build(boolean)} (and never memoized across builds).
 *
 * <p>Deferred values are how a default can embed "build me a related model" or a freshly
 * generated fake value:</p>
 * <pre>{@code
 * Map.of("user", FieldValue.deferred(() -> new UserBuilder(context).build()),
 *        "email", FieldValue.deferred(fake::email))
 * }</pre>
 */
public sealed interface FieldValue permits FieldValue.Literal, FieldValue.Deferred
{
    Object resolve();

    record Literal(Object value) implements FieldValue
    {
        @Override
        public Object resolve()
        {   return value;
        }
    }

    record Deferred(Supplier<?> producer) implements FieldValue
    {
        public Deferred
        {   Objects.requireNonNull(producer, "producer");
        }

        @Override
        public Object resolve()
        {   return producer.get();
        }
    }

    static FieldValue literal(Object value)
    {   return new Literal(value);
    }

    static FieldValue deferred(Supplier<?> producer)
    {   return new Deferred(producer);
    }

    /**
     * Wraps a raw value as a literal, unless it already is a {@code FieldValue}.
     */
    static FieldValue of(Object value)
    {   return value instanceof FieldValue fieldValue ? fieldValue : literal(value);
    }

    /**
     * Resolves {@code value} if it is a {@code FieldValue}, returns it unchanged otherwise.
     */
    static Object resolve(Object value)
    {   return value instanceof FieldValue fieldValue ? fieldValue.resolve() : value;
    }
}
