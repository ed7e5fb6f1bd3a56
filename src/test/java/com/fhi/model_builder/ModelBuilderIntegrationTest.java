package com.fhi.model_builder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.model_builder.config.ModelBuilderConfig;
import com.fhi.model_builder.config.StartupDiagnosticsLogger;
import com.fhi.model_builder.exception.ModelBuilderException;
import com.fhi.model_builder.schema.JpaModelSchemaProvider;
import com.fhi.model_builder.test_app.builders.AuthorBuilder;
import com.fhi.model_builder.test_app.builders.JournalBuilder;
import com.fhi.model_builder.test_app.builders.UserBuilder;
import com.fhi.model_builder.test_app.model.Author;
import com.fhi.model_builder.test_app.model.Journal;
import com.fhi.model_builder.test_app.model.User;
import com.fhi.model_builder.test_app.repo.AuthorRepository;
import com.fhi.model_builder.test_app.repo.JournalRepository;
import com.fhi.model_builder.test_app.repo.UserRepository;

import jakarta.persistence.EntityManager;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;


/**
 * Builds real JPA entities against an in-memory H2 database.
 * Every test runs in its own transaction, rolled back afterwards, except the one
 * checking a failed save.
 */
@Slf4j
@DataJpaTest
@Import({ModelBuilderConfig.class, JpaModelSchemaProvider.class, StartupDiagnosticsLogger.class})
class ModelBuilderIntegrationTest
{
    @Autowired
    private EntityManager entityManager;

    @Autowired
    private BuilderContext context;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private AuthorRepository authorRepository;

    @Autowired
    private JournalRepository journalRepository;

    @BeforeEach
    void setup()
    {   context.getFake().reset();
    }


    @Test
    @DisplayName("An author built with no overrides is saved with its defaults and a user of its own")
    void authorWithDefaults()
    {
        // WHEN
        Author author = new AuthorBuilder(context).build();
        log.info("Built {}", author);

        entityManager.flush();
        entityManager.clear();

        // THEN it can be read back from the database
        Author stored = authorRepository.findById(author.getId()).orElseThrow();
        assertEquals(AuthorBuilder.DEFAULT_PUBLISHING_NAME, stored.getPublishingName());
        assertEquals(AuthorBuilder.DEFAULT_AGE, stored.getAge());
        assertEquals("0000-0001-5040-6082", stored.getOrcid());
        assertEquals("advanced.allen@test.com", stored.getUser().getEmail());

        assertEquals(1, authorRepository.count());
        assertEquals(1, userRepository.count());
    }

    @Test
    void identitiesStartAfterTheOffset()
    {
        Author author = new AuthorBuilder(context).build();

        // The related user is built (and gets its id) first
        assertEquals(BuilderContext.DEFAULT_ID_OFFSET + 1, author.getUser().getId());
        assertEquals(BuilderContext.DEFAULT_ID_OFFSET + 2, author.getId());
    }

    @Test
    void overridesWinOverDefaults()
    {
        Author author = new AuthorBuilder(context).with("age", 3)
                                                  .set("withPublishingName", "Billy Fakington")
                                                  .build();

        entityManager.flush();
        entityManager.clear();

        Author stored = authorRepository.findById(author.getId()).orElseThrow();
        assertEquals(3, stored.getAge());
        assertEquals("Billy Fakington", stored.getPublishingName());
    }

    @Test
    void authorsShareAGivenUser()
    {
        User user = new UserBuilder(context).withEmail("shared@test.com").build();

        Author first  = new AuthorBuilder(context).with("user", user).build();
        Author second = new AuthorBuilder(context).with("user_id", user.getId()).build();

        assertSame(user, first.getUser());
        assertSame(user, second.getUser());
        assertEquals(1, userRepository.count());
        assertEquals(2, authorRepository.count());
    }

    @Test
    void manyBuildsOfTheSameBuilderAreDistinctRows()
    {
        AuthorBuilder builder = new AuthorBuilder(context).with("age", 40);

        Set<Long> ids = new HashSet<>();
        Set<String> orcids = new HashSet<>();
        for (int i = 0; i < 10; i++)
        {   Author author = builder.build();
            ids.add(author.getId());
            orcids.add(author.getOrcid());
        }
        entityManager.flush();

        assertEquals(10, ids.size());
        assertEquals(10, orcids.size());
        assertEquals(10, authorRepository.count());
        assertEquals(10, userRepository.count());
    }

    @Test
    void unsavedAuthorIsNotPersisted()
    {
        Author author = new AuthorBuilder(context).build(false);

        assertNotNull(author.getId());
        assertFalse(entityManager.contains(author));
        assertEquals(0, authorRepository.count());
        // The default user is a model of its own and is saved
        assertEquals(1, userRepository.count());
    }

    @Test
    @DisplayName("Database-generated identities are left to the database")
    void generatedIdentityIsNotAssigned()
    {
        Journal journal = new JournalBuilder(context).build();
        entityManager.flush();

        assertNotNull(journal.getId());
        assertThat(journal.getId()).isLessThan(BuilderContext.DEFAULT_ID_OFFSET);
        assertEquals("1000-0003", journal.getIssn());
        assertEquals("The Argentina journal of Advanced Agriculture", journal.getName());
        assertEquals("Publisher 0", journal.getPublisher());
        assertEquals(1, journalRepository.count());
    }

    @Test
    void journalsGetDistinctIssns()
    {
        JournalBuilder builder = new JournalBuilder(context);

        Journal first  = builder.build();
        Journal second = builder.build();
        Journal third  = builder.build();
        entityManager.flush();

        assertEquals("1000-0003", first.getIssn());
        assertEquals("1000-0011", second.getIssn());
        assertEquals("1000-002X", third.getIssn());
    }

    @Test
    void unknownFieldIsRejectedBeforeAnythingIsSaved()
    {
        AuthorBuilder builder = new AuthorBuilder(context);

        ModelBuilderException e = assertThrows(ModelBuilderException.class, () -> builder.with("nickname", "Jacko"));

        assertEquals(ModelBuilderException.Cause.FIELD_NOT_FOUND, e.getCauseEnum());
        assertEquals(0, authorRepository.count());
        assertEquals(0, userRepository.count());
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)  // the failed save must not touch a test transaction
    @DisplayName("A save rejected by the persistence layer fails build() with the original exception")
    void persistenceFailurePropagatesUnchanged()
    {
        // GIVEN a journal violating @NotBlank on its name
        JournalBuilder builder = new JournalBuilder(context).with("name", "");

        // WHEN / THEN the bean validation exception reaches the caller as is
        ConstraintViolationException e = assertThrows(ConstraintViolationException.class, builder::build);
        assertThat(e.getConstraintViolations()).anyMatch(v -> v.getPropertyPath().toString().equals("name"));

        // ...and nothing was saved
        assertEquals(0, journalRepository.count());
    }
}
