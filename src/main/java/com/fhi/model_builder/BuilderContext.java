package com.fhi.model_builder;

import com.fhi.model_builder.fake.FakeData;
import com.fhi.model_builder.schema.ModelSchemaProvider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Collaborators shared by every builder: how to look up a model's schema and where unique
 * identifiers come from.
 *
 * <p>Passed to each builder's constructor so tests can swap, reset or seed them instead of
 * relying on process-wide state.</p>
 */
@Getter
@RequiredArgsConstructor
public class BuilderContext
{
    public static final long DEFAULT_ID_OFFSET = 945632L;

    private final ModelSchemaProvider schemas;

    private final FakeData fake;

    /** Added to every generated identity, to keep fixture ids clear of hand-written ones. */
    private final long idOffset;

    public BuilderContext(ModelSchemaProvider schemas, FakeData fake)
    {   this(schemas, fake, DEFAULT_ID_OFFSET);
    }
}
