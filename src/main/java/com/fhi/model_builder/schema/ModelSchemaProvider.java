package com.fhi.model_builder.schema;

/**
 * Resolves the {@link ModelSchema} of a model type.
 */
public interface ModelSchemaProvider
{
    <T> ModelSchema<T> schemaFor(Class<T> modelType);
}
