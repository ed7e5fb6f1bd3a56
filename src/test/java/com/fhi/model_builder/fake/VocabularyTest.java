package com.fhi.model_builder.fake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;


class VocabularyTest
{
    @Test
    void loadsTheDefaultWordLists()
    {
        Vocabulary vocabulary = Vocabulary.load();

        assertThat(vocabulary.getCountries()).startsWith("Argentina", "Australia");
        assertThat(vocabulary.getAdjectives()).startsWith("Advanced");
        assertThat(vocabulary.getFirstNames()).startsWith("Ada", "Alan");
        assertThat(vocabulary.getLastNames()).startsWith("Allen", "Berners-Lee");
        assertThat(vocabulary.getWords()).isNotEmpty();
        assertThat(vocabulary.getFields()).isNotEmpty();
    }

    @Test
    void missingResourceFails()
    {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Vocabulary.load("no-such-words.yaml"));

        assertThat(e.getMessage()).contains("no-such-words.yaml");
    }
}
