package com.fhi.model_builder.fake;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;


/**
 * Word lists the finite {@link FakeData} generators draw their cartesian products from.
 *
 * <p>Loaded from a YAML classpath resource, by default {@value #DEFAULT_RESOURCE}:
 * <pre>
 * countries:  [Albania, Algeria, ...]
 * adjectives: [Applied, Modern, ...]
 * fields:     [Biology, Chemistry, ...]
 * words:      [apple, river, ...]
 * firstNames: [Ada, Alan, ...]
 * lastNames:  [Lovelace, Turing, ...]
 * </pre>
 */
@Slf4j
@Getter
@Setter
public class Vocabulary
{
    public static final String DEFAULT_RESOURCE = "fake-data.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
                                                        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private List<String> countries  = List.of();
    private List<String> adjectives = List.of();
    private List<String> fields     = List.of();
    private List<String> words      = List.of();
    private List<String> firstNames = List.of();
    private List<String> lastNames  = List.of();


    public static Vocabulary load()
    {   return load(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalStateException if the resource is missing or is not valid YAML
     */
    public static Vocabulary load(String classpathResource)
    {
        try (InputStream is = new ClassPathResource(classpathResource).getInputStream())
        {   Vocabulary vocabulary = YAML_MAPPER.readValue(is, Vocabulary.class);
            log.debug("Loaded vocabulary from {}: {} countries, {} adjectives, {} fields, {} words, {} first names, {} last names",
                      classpathResource,
                      vocabulary.countries.size(), vocabulary.adjectives.size(), vocabulary.fields.size(),
                      vocabulary.words.size(), vocabulary.firstNames.size(), vocabulary.lastNames.size());
            return vocabulary;
        }
        catch (IOException e)
        {   throw new IllegalStateException("Failed to load fake data vocabulary from " + classpathResource, e);
        }
    }
}
