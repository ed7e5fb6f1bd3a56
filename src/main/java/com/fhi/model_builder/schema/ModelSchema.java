package com.fhi.model_builder.schema;

import java.util.Map;
import java.util.Set;

/**
 * What a model builder needs to know about its target model type.
 *
 * <p>The builder itself never touches the persistence layer: it asks the schema which field
 * names are legitimate, lets it construct an in-memory instance from a map of field values
 * and hands the instance back to it for saving.</p>
 *
 * @param <T> the model type
 */
public interface ModelSchema<T>
{
    /**
     * Suffix of the key under which a related model is referenced by its identifier,
     * e.g. {@code user} -> {@code user_id}.
     */
    String RELATION_ID_SUFFIX = "_id";

    Class<T> getModelType();

    /**
     * Every key {@link #instantiate(Map)} accepts.
     */
    Set<String> getFieldNames();

    /**
     * Name of the identity field the builder must fill in, or {@code null} when the
     * store generates identities itself.
     */
    String getIdentityFieldName();

    /**
     * @return true if {@code value} is an instance of a model known to the persistence layer
     */
    boolean isModel(Object value);

    /**
     * @return the primary key of a model instance, {@code null} if it has none yet
     */
    Object getIdentifier(Object model);

    /**
     * Constructs an in-memory instance. Keys must be a subset of {@link #getFieldNames()}.
     */
    T instantiate(Map<String, Object> fieldValues);

    /**
     * Durably saves the instance and returns it with its primary key set.
     */
    T save(T instance);
}
