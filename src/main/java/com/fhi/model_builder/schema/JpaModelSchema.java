package com.fhi.model_builder.schema;

import java.lang.reflect.AnnotatedElement;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.springframework.beans.BeanUtils;
import org.springframework.beans.DirectFieldAccessor;
import org.springframework.transaction.support.TransactionOperations;

import jakarta.persistence.EntityManager;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.SingularAttribute;
import lombok.extern.slf4j.Slf4j;


/**
 * {@link ModelSchema} backed by the Jakarta Persistence metamodel of an entity.
 *
 * <ul>
 *   <li><b>Field names</b>: every persistent attribute, plus {@code <association>_id} for every
 *       singular association ({@code @ManyToOne}, {@code @OneToOne}).</li>
 *   <li><b>Identity</b>: the {@code @Id} attribute, unless it is {@code @GeneratedValue}
 *       (then the database assigns it and the builder leaves it alone).</li>
 *   <li><b>Instantiation</b>: no-arg constructor, then direct field access. An
 *       {@code <association>_id} value becomes {@link EntityManager#getReference(Class, Object)}.</li>
 *   <li><b>Saving</b>: {@link EntityManager#persist(Object)} inside a transaction callback. When a
 *       test transaction is already open the save joins it and is rolled back with it.</li>
 * </ul>
 *
 * @param <T> the entity type
 */
@Slf4j
public class JpaModelSchema<T> implements ModelSchema<T>
{
    private final Class<T> modelType;
    private final EntityManager entityManager;
    private final TransactionOperations transactionOperations;

    private final Set<String> fieldNames;
    private final String identityFieldName;

    /** {@code <association>_id} key -> association attribute. */
    private final Map<String, SingularAttribute<?, ?>> associationsById;


    public JpaModelSchema(Class<T> modelType,
                          EntityManager entityManager,
                          TransactionOperations transactionOperations)
    {   this.modelType             = modelType;
        this.entityManager         = entityManager;
        this.transactionOperations = transactionOperations;

        EntityType<T> entityType = entityManager.getMetamodel().entity(modelType);

        Set<String> names = new LinkedHashSet<>();
        Map<String, SingularAttribute<?, ?>> associations = new LinkedHashMap<>();
        String identity = null;

        for (Attribute<? super T, ?> attribute : entityType.getAttributes())
        {   names.add(attribute.getName());
            if (attribute instanceof SingularAttribute<?, ?> singular)
            {
                if (singular.isAssociation())
                {   String idKey = attribute.getName() + RELATION_ID_SUFFIX;
                    names.add(idKey);
                    associations.put(idKey, singular);
                }
                if (singular.isId() && !isGenerated(singular))
                {   identity = singular.getName();
                }
            }
        }

        this.fieldNames        = Collections.unmodifiableSet(names);
        this.associationsById  = Collections.unmodifiableMap(associations);
        this.identityFieldName = identity;

        log.debug("Schema of {}: fields={}, identity={}", modelType.getSimpleName(), fieldNames, identityFieldName);
    }


    private static boolean isGenerated(Attribute<?, ?> attribute)
    {   return attribute.getJavaMember() instanceof AnnotatedElement member
            && member.isAnnotationPresent(GeneratedValue.class);
    }

    @Override
    public Class<T> getModelType()
    {   return modelType;
    }

    @Override
    public Set<String> getFieldNames()
    {   return fieldNames;
    }

    @Override
    public String getIdentityFieldName()
    {   return identityFieldName;
    }

    @Override
    public boolean isModel(Object value)
    {   if (value == null) return false;
        return entityManager.getMetamodel()
                            .getEntities()
                            .stream()
                            .anyMatch(entity -> entity.getJavaType().isInstance(value));
    }

    /**
     * Only models managed by the current persistence context have a usable identifier:
     * an unsaved (or detached) model is kept as an object reference.
     */
    @Override
    public Object getIdentifier(Object model)
    {   if (!entityManager.contains(model)) return null;
        return entityManager.getEntityManagerFactory()
                            .getPersistenceUnitUtil()
                            .getIdentifier(model);
    }

    @Override
    public T instantiate(Map<String, Object> fieldValues)
    {
        T instance = BeanUtils.instantiateClass(modelType);
        DirectFieldAccessor accessor = new DirectFieldAccessor(instance);

        fieldValues.forEach((key, value) -> {
            SingularAttribute<?, ?> association = associationsById.get(key);
            if (association == null)
            {   accessor.setPropertyValue(key, value);
            }
            else
            {   Object reference = value == null ? null
                                                 : entityManager.getReference(association.getJavaType(), value);
                accessor.setPropertyValue(association.getName(), reference);
            }
        });
        return instance;
    }

    @Override
    public T save(T instance)
    {   transactionOperations.executeWithoutResult(status -> entityManager.persist(instance));
        log.debug("Persisted {}", modelType.getSimpleName());
        return instance;
    }
}
