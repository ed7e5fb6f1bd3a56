package com.fhi.model_builder.schema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;


/**
 * Provides (and caches) one {@link JpaModelSchema} per entity type.
 *
 * <p>The component is stateless except for a thread-safe cache of resolved schemas.
 */
@Slf4j
@Component
public class JpaModelSchemaProvider implements ModelSchemaProvider
{
    private final EntityManager entityManager;
    private final TransactionOperations transactionOperations;

    /**
     * Cache of schemas keyed by their entity type.
     * <p>Reading the metamodel once per type is enough for a whole test run.</p>
     */
    private final Map<Class<?>, ModelSchema<?>> schemaCache = new ConcurrentHashMap<>();

    // Autowired constructor
    public JpaModelSchemaProvider(EntityManager entityManager,
                                  TransactionOperations transactionOperations)
    {   this.entityManager         = entityManager;
        this.transactionOperations = transactionOperations;
    }

    /**
     * @throws IllegalArgumentException if {@code modelType} is not a managed entity
     */
    @Override
    @SuppressWarnings("unchecked")
    public <T> ModelSchema<T> schemaFor(Class<T> modelType)
    {   return (ModelSchema<T>) schemaCache.computeIfAbsent(modelType, type -> {
            log.debug("Resolving schema for {}", type.getName());
            return new JpaModelSchema<>(type, entityManager, transactionOperations);
        });
    }
}
