package com.fhi.model_builder.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fhi.model_builder.BuilderContext;
import com.fhi.model_builder.fake.FakeData;
import com.fhi.model_builder.fake.Vocabulary;
import com.fhi.model_builder.schema.ModelSchemaProvider;

import lombok.extern.slf4j.Slf4j;


/**
 * Wires the collaborators every model builder needs.
 *
 * <p>Properties (all optional):
 * <pre>
 *   model-builder.fake.seed       = 642              # seed of the random fake values
 *   model-builder.fake.vocabulary = fake-data.yaml   # classpath resource with the word lists
 *   model-builder.id-offset       = 945632           # added to every generated identity
 * </pre>
 */
@Slf4j
@Configuration
public class ModelBuilderConfig
{
    @Bean
    public FakeData fakeData(@Value("${model-builder.fake.seed:" + FakeData.DEFAULT_SEED + "}") long seed,
                             @Value("${model-builder.fake.vocabulary:" + Vocabulary.DEFAULT_RESOURCE + "}") String vocabulary)
    {   log.info("Fake data seeded with {}, vocabulary from {}", seed, vocabulary);
        return new FakeData(seed, Vocabulary.load(vocabulary));
    }

    @Bean
    public BuilderContext builderContext(ModelSchemaProvider schemaProvider,
                                         FakeData fakeData,
                                         @Value("${model-builder.id-offset:" + BuilderContext.DEFAULT_ID_OFFSET + "}") long idOffset)
    {   return new BuilderContext(schemaProvider, fakeData, idOffset);
    }
}
