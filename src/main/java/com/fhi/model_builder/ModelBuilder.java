package com.fhi.model_builder;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.commons.lang3.StringUtils;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import com.fhi.model_builder.exception.ModelBuilderException;
import com.fhi.model_builder.fake.FakeData;
import com.fhi.model_builder.schema.ModelSchema;

import lombok.extern.slf4j.Slf4j;


/**
 * Base class of test model builders: assembles a fully populated model from caller overrides
 * plus defaults computed by the concrete builder, without going through production code paths.
 *
 * <p>A concrete builder names its model class and supplies defaults:</p>
 * <pre>{@code
 * public class AuthorBuilder extends ModelBuilder<Author, AuthorBuilder>
 * {
 *     public AuthorBuilder(BuilderContext context)
 *     {   super(context, Author.class);
 *     }
 *
 *     @Override
 *     protected Map<String, Object> getDefaultFields()
 *     {   return Map.of("user",           FieldValue.deferred(() -> new UserBuilder(getContext()).build()),
 *                       "publishingName", "Jack Jackson",
 *                       "age",            23);
 *     }
 * }
 *
 * Author author = new AuthorBuilder(context).with("age", 3)
 *                                           .set("withPublishingName", "Billy Fakington")
 *                                           .build();
 * }</pre>
 *
 * <h3>Copy on write</h3>
 * <p>Every setter returns a new builder holding a copy of the pending values; the receiver is
 * never changed. Two chains branched off the same builder never see each other's values. Only
 * the pending-values map is copied: values themselves are shared.</p>
 *
 * <h3>Build</h3>
 * <p>{@link #build(boolean)} runs on a private copy of the builder, so the same builder can be
 * built any number of times:</p>
 * <ol>
 *   <li>defaults are computed ({@link #getDefaultFields()}, called on every build);</li>
 *   <li>caller values win over defaults, whatever the order they were set in;</li>
 *   <li>{@link FieldValue#deferred deferred} values are resolved;</li>
 *   <li>saved related models are replaced by their primary key under {@code <field>_id};</li>
 *   <li>a missing identity is taken from {@link FakeData#id(long)};</li>
 *   <li>{@link #pre(Map)} runs, the model is instantiated from the schema fields only,</li>
 *   <li>saved through {@link #create(Object)} unless {@code persist} is false,</li>
 *   <li>and handed to {@link #post(Object)}.</li>
 * </ol>
 *
 * <p>Builders are not thread-safe; the fixed point is that a builder is never changed by a setter
 * or a build, so one builder can be shared as a read-only template.</p>
 *
 * @param <T> the model type
 * @param <B> the concrete builder type, returned by setters
 */
@Slf4j
public abstract class ModelBuilder<T, B extends ModelBuilder<T, B>> implements Cloneable
{
    public static final String DEFAULT_SETTER_PREFIX = "with";

    private final BuilderContext context;

    private final Class<T> modelType;

    /**
     * Values set by the caller: model fields (as {@link FieldValue}) and non-field context
     * consumed by the hooks. Replaced, never shared, on copy.
     */
    private Map<String, Object> data = new LinkedHashMap<>();


    protected ModelBuilder(BuilderContext context, Class<T> modelType)
    {   this.context   = context;
        this.modelType = modelType;
    }

    /**
     * For builders that resolve their model class by overriding {@link #getModel()}.
     */
    protected ModelBuilder(BuilderContext context)
    {   this(context, null);
    }


    // =====================================================================
    // Configuration (override points)
    // =====================================================================

    /**
     * Default values of the model fields, by field name. Values are literals or
     * {@link FieldValue}s. Called once per build, never cached.
     *
     * @throws ModelBuilderException ({@code UNIMPLEMENTED_DEFAULTS}) unless overridden
     */
    protected Map<String, Object> getDefaultFields()
    {   throw ModelBuilderException.unimplementedDefaults(getClass(), modelType);
    }

    /**
     * Extra non-field values made available to the hooks through {@link #getData(String)}.
     * A key the caller already set keeps the caller's value. Merged after the model fields are
     * computed, so a key named like a field never replaces that field's default.
     */
    protected Map<String, Object> getBuilderContext()
    {   return Map.of();
    }

    /**
     * Prefix of the setter names accepted by {@link #set(String, Object...)}.
     */
    protected String getSetterPrefix()
    {   return DEFAULT_SETTER_PREFIX;
    }

    /**
     * @throws ModelBuilderException ({@code UNIMPLEMENTED_MODEL}) when no model class is configured
     */
    public Class<T> getModel()
    {   if (modelType == null)
        {   throw ModelBuilderException.unimplementedModel(getClass());
        }
        return modelType;
    }

    protected ModelSchema<T> getSchema()
    {   return context.getSchemas().schemaFor(getModel());
    }

    protected BuilderContext getContext()
    {   return context;
    }

    protected FakeData fake()
    {   return context.getFake();
    }


    // =====================================================================
    // Setters
    // =====================================================================

    /**
     * Returns a new builder with {@code field} set to {@code value}. A {@link FieldValue} is
     * stored as is; anything else as a literal.
     *
     * @throws ModelBuilderException ({@code FIELD_NOT_FOUND}) if the model has no such field
     */
    public B with(String field, Object value)
    {   requireField(field);
        return copyWith(field, FieldValue.of(value));
    }

    /**
     * Resolves a setter by name, e.g. {@code set("withPublishingName", "Billy")}.
     *
     * <ul>
     *   <li>If the builder declares a public method with that name and a matching signature,
     *       the method is invoked on a fresh copy of this builder. Its result is returned if it
     *       is a builder; otherwise the (possibly modified) copy is.</li>
     *   <li>Otherwise the name minus the prefix is the field name (first letter lower-cased
     *       unless the field exists as written), and {@link #with(String, Object)} applies.</li>
     * </ul>
     *
     * @throws ModelBuilderException ({@code INVALID_SETTER_NAME}) if the name does not start with
     *         {@link #getSetterPrefix()}, ({@code FIELD_NOT_FOUND}) for an unknown field
     */
    @SuppressWarnings("unchecked")
    public B set(String setterName, Object... args)
    {
        String prefix = getSetterPrefix();
        if (setterName == null || !setterName.startsWith(prefix) || setterName.length() == prefix.length())
        {   throw ModelBuilderException.invalidSetterName(setterName, prefix);
        }
        Object[] arguments = args == null ? new Object[] { null } : args;

        Method custom = findCustomSetter(setterName, arguments);
        if (custom != null)
        {   log.debug("Invoking custom setter {}.{}", getClass().getSimpleName(), setterName);
            B copy = copy();
            Object result = invokeSetter(custom, copy, arguments);
            return result instanceof ModelBuilder<?, ?> builder && getClass().isInstance(builder) ? (B) builder : copy;
        }

        if (arguments.length != 1)
        {   throw new IllegalArgumentException("Setter '" + setterName + "' takes exactly one value, got " + arguments.length);
        }
        return with(fieldNameOf(setterName), arguments[0]);
    }

    /**
     * Returns a new builder carrying a non-field value for the hooks. Not checked against the
     * schema.
     */
    protected B withContext(String key, Object value)
    {   return copyWith(key, value);
    }

    /**
     * Returns a new builder to which {@code change} was applied. For custom setters:
     * <pre>{@code
     * public AuthorBuilder withUserEmail(String email)
     * {   return mutate(b -> b.put("userEmail", email));
     * }
     * }</pre>
     */
    protected B mutate(Consumer<? super B> change)
    {   B copy = copy();
        change.accept(copy);
        return copy;
    }

    /**
     * Writes a pending value into this very builder. Only meant for fresh copies: inside
     * {@link #mutate(Consumer)}, in a void custom setter reached through
     * {@link #set(String, Object...)}, or in the hooks.
     */
    protected void put(String key, Object value)
    {   data.put(key, value);
    }

    /**
     * A pending value (deferred values are resolved on each call).
     */
    public Object getData(String key)
    {   return FieldValue.resolve(data.get(key));
    }

    public boolean hasData(String key)
    {   return data.containsKey(key);
    }

    /**
     * Read-only view of the pending values.
     */
    public Map<String, Object> getPendingValues()
    {   return Collections.unmodifiableMap(data);
    }


    // =====================================================================
    // Build
    // =====================================================================

    public T build()
    {   return build(true);
    }

    /**
     * @param persist false to return the in-memory model without saving it
     */
    public T build(boolean persist)
    {   ModelBuilder<T, B> working = copy();
        return working.runBuild(persist);
    }

    /**
     * Hook run before the model is instantiated. {@code modelFields} holds the resolved values
     * and may be changed; keys that are not model fields are dropped afterwards.
     */
    protected void pre(Map<String, Object> modelFields)
    {}

    /**
     * Saves the in-memory model. Override to save it some other way.
     */
    protected T create(T instance)
    {   return getSchema().save(instance);
    }

    /**
     * Hook run after the model is created (and saved, if requested).
     */
    protected void post(T instance)
    {}


    private T runBuild(boolean persist)
    {
        ModelSchema<T> schema = getSchema();
        Set<String>    fields = schema.getFieldNames();

        Map<String, Object> defaults = getDefaultFields();

        // Defaults first, caller values over them.
        Map<String, Object> modelFields = new LinkedHashMap<>();
        defaults.forEach((field, value) -> {
            if (fields.contains(field) && !isSetByCaller(field))
            {   modelFields.put(field, value);
            }
        });
        data.forEach((key, value) -> {
            if (fields.contains(key))
            {   modelFields.put(key, value);
            }
        });

        modelFields.replaceAll((field, value) -> FieldValue.resolve(value));

        replaceRelationsByIds(schema, fields, modelFields);

        String identity = schema.getIdentityFieldName();
        if (identity != null && modelFields.get(identity) == null)
        {   long id = fake().id(context.getIdOffset());
            modelFields.put(identity, id);
            log.debug("Assigned {}.{} = {}", getModel().getSimpleName(), identity, id);
        }

        // Context only reaches the hooks, never the model fields.
        getBuilderContext().forEach(data::putIfAbsent);

        pre(modelFields);

        modelFields.keySet().retainAll(fields);
        T instance = schema.instantiate(modelFields);
        log.debug("Built {} from {}", getModel().getSimpleName(), modelFields.keySet());

        if (persist)
        {   instance = create(instance);
        }

        post(instance);
        return instance;
    }

    /**
     * True if the caller set {@code field}, or the other form of the same relation
     * ({@code user} vs {@code user_id}).
     */
    private boolean isSetByCaller(String field)
    {   if (data.containsKey(field) || data.containsKey(field + ModelSchema.RELATION_ID_SUFFIX)) return true;
        return field.endsWith(ModelSchema.RELATION_ID_SUFFIX)
            && data.containsKey(StringUtils.removeEnd(field, ModelSchema.RELATION_ID_SUFFIX));
    }

    // An unsaved related model has no id yet and stays an object.
    private void replaceRelationsByIds(ModelSchema<T> schema, Set<String> fields, Map<String, Object> modelFields)
    {
        for (Map.Entry<String, Object> entry : new ArrayList<>(modelFields.entrySet()))
        {
            Object value = entry.getValue();
            if (!schema.isModel(value)) continue;

            String idKey = entry.getKey() + ModelSchema.RELATION_ID_SUFFIX;
            Object id    = schema.getIdentifier(value);
            if (id == null || !fields.contains(idKey)) continue;

            modelFields.remove(entry.getKey());
            modelFields.putIfAbsent(idKey, id);
        }
    }


    // =====================================================================
    // Internal
    // =====================================================================

    private void requireField(String field)
    {   Set<String> fields = getSchema().getFieldNames();
        if (!fields.contains(field))
        {   throw ModelBuilderException.fieldNotFound(field, getModel(), fields);
        }
    }

    private String fieldNameOf(String setterName)
    {   String raw = setterName.substring(getSetterPrefix().length());
        return getSchema().getFieldNames().contains(raw) ? raw : StringUtils.uncapitalize(raw);
    }

    private B copyWith(String key, Object value)
    {   B copy = copy();
        copy.put(key, value);
        return copy;
    }

    private Method findCustomSetter(String setterName, Object[] arguments)
    {
        for (Method method : getClass().getMethods())
        {   if (   method.getName().equals(setterName)
                && method.getDeclaringClass() != ModelBuilder.class
                && method.getDeclaringClass() != Object.class
                && method.getParameterCount() == arguments.length
                && acceptsArguments(method, arguments))
            {   return method;
            }
        }
        return null;
    }

    private static boolean acceptsArguments(Method method, Object[] arguments)
    {   Class<?>[] types = method.getParameterTypes();
        for (int i = 0; i < types.length; i++)
        {   if (!ClassUtils.isAssignableValue(types[i], arguments[i])) return false;
        }
        return true;
    }

    private Object invokeSetter(Method method, B target, Object[] arguments)
    {
        ReflectionUtils.makeAccessible(method);
        try
        {   return method.invoke(target, arguments);
        }
        catch (InvocationTargetException e)
        {   Throwable cause = e.getTargetException();
            if (cause instanceof RuntimeException runtime) throw runtime;
            if (cause instanceof Error error) throw error;
            throw ModelBuilderException.setterInvocation(method.getName(), getClass(), cause);
        }
        catch (IllegalAccessException e)
        {   throw ModelBuilderException.setterInvocation(method.getName(), getClass(), e);
        }
    }

    /**
     * Shallow copy with its own pending-values map.
     */
    @SuppressWarnings("unchecked")
    protected B copy()
    {
        try
        {   ModelBuilder<T, B> copy = (ModelBuilder<T, B>) super.clone();
            copy.data = new LinkedHashMap<>(data);
            return (B) copy;
        }
        catch (CloneNotSupportedException e)
        {   throw new IllegalStateException("ModelBuilder is Cloneable", e);
        }
    }

    @Override
    public String toString()
    {   return getClass().getSimpleName() + data;
    }
}
