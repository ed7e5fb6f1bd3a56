package com.fhi.model_builder.fake;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.function.Supplier;

import org.apache.commons.lang3.RandomStringUtils;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * Registry of named synthetic-value generators for fixture fields.
 *
 * <p>Every generator wraps a {@link SequenceGenerator}, so values are repeatable for a given
 * registry state and distinct within one restart epoch:
 * <ul>
 *   <li>counter-backed kinds (ids, DOIs, PMIDs, ...) never repeat;</li>
 *   <li>vocabulary-backed kinds (names, emails, journal names, ...) cycle through the cartesian
 *       product of their word lists and repeat after a full cycle;</li>
 *   <li>ISSNs and ORCIDs cycle through the range of values whose format and check digit are
 *       valid.</li>
 * </ul>
 *
 * <p>The only random draws are the defaults of {@link #researcherId()} and {@link #truid()}.
 * The former uses a {@link Random} seeded at construction; {@link #reset()} restores both the
 * sequences and the seed.</p>
 *
 * <p>Not thread-safe: share one instance per test runner, or serialize access.</p>
 */
@Slf4j
public class FakeData
{
    public static final long DEFAULT_SEED = 642L;

    // Generator kinds
    public static final String ID                = "id";
    public static final String NUMBER            = "number";
    public static final String DOI               = "doi";
    public static final String PMID              = "pmid";
    public static final String ARXIV             = "arxiv";
    public static final String UT                = "ut";
    public static final String MANUSCRIPT_ID     = "manuscriptId";
    public static final String PUBLISHER_NAME    = "publisherName";
    public static final String PUBLICATION_TITLE = "publicationTitle";
    public static final String INSTITUTION_NAME  = "institutionName";
    public static final String AFFILIATION_NAME  = "affiliationName";
    public static final String COUNTRY_NAME      = "countryName";
    public static final String NAME              = "name";
    public static final String JOURNAL_NAME      = "journalName";
    public static final String EMAIL             = "email";
    public static final String GIBBERISH         = "gibberish";
    public static final String ISSN              = "issn";
    public static final String ORCID             = "orcid";
    public static final String RESEARCHER_ID     = "researcherId";

    /** First ISSN base, the lowest seven-digit value. */
    public static final long ISSN_START = 1_000_000L;
    public static final long ISSN_END   = 10_000_000L;

    /**
     * First ORCID counter value. Anything from 15000000 yields a 15-digit payload opening
     * with {@code 00000001 5}; the extra non-zero digits are cosmetic.
     */
    public static final long ORCID_START = 15_040_608L;
    public static final long ORCID_END   = 35_000_000L;

    public static final String DEFAULT_UT_PREFIX = "WOS";
    public static final int    COUNTRY_NAME_MAX_LENGTH = 50;

    public static final int RESEARCHER_ID_FIRST_YEAR = 2008;
    public static final int RESEARCHER_ID_LAST_YEAR  = 2018;

    @Getter
    private final long seed;

    @Getter
    private final Vocabulary vocabulary;

    private final Map<String, SequenceGenerator<?>> generators = new LinkedHashMap<>();

    private Random random;


    public FakeData()
    {   this(DEFAULT_SEED, Vocabulary.load());
    }

    public FakeData(long seed, Vocabulary vocabulary)
    {   this.seed       = seed;
        this.vocabulary = vocabulary;
        this.random     = new Random(seed);

        register(ID,                () -> Sequences.counter(1));
        register(NUMBER,            () -> Sequences.counter(0));
        register(DOI,               () -> Sequences.counter(0));
        register(PMID,              () -> Sequences.counter(0));
        register(ARXIV,             () -> Sequences.counter(1000));
        register(UT,                () -> Sequences.counter(100_000_000_000_000L));
        register(MANUSCRIPT_ID,     () -> Sequences.counter(0));
        register(PUBLISHER_NAME,    () -> Sequences.counter(0));
        register(PUBLICATION_TITLE, () -> Sequences.counter(0));
        register(INSTITUTION_NAME,  () -> Sequences.counter(0));
        register(AFFILIATION_NAME,  () -> Sequences.counter(0));
        register(RESEARCHER_ID,     () -> Sequences.counter(1000));
        register(ISSN,              () -> Sequences.range(ISSN_START, ISSN_END));
        register(ORCID,             () -> Sequences.range(ORCID_START, ORCID_END));

        register(COUNTRY_NAME,      () -> Sequences.product(vocabulary.getCountries()));
        register(NAME,              () -> Sequences.product(vocabulary.getFirstNames(), vocabulary.getLastNames()));
        register(JOURNAL_NAME,      () -> Sequences.product(vocabulary.getCountries(), vocabulary.getAdjectives(), vocabulary.getFields()));
        register(EMAIL,             () -> Sequences.product(vocabulary.getAdjectives(), vocabulary.getLastNames()));
        register(GIBBERISH,         () -> Sequences.product(vocabulary.getWords(), vocabulary.getWords(), vocabulary.getWords()));

        log.debug("FakeData ready with seed {} and generators {}", seed, generators.keySet());
    }


    private <V> void register(String kind, Supplier<Iterator<V>> definition)
    {   generators.put(kind, new SequenceGenerator<>(kind, definition));
    }

    @SuppressWarnings("unchecked")
    private <V> V next(String kind)
    {   SequenceGenerator<V> generator = (SequenceGenerator<V>) generators.get(kind);
        if (generator == null)
        {   throw new IllegalArgumentException("Unknown generator kind: " + kind);
        }
        return generator.next();
    }

    /**
     * @return the generator registered under {@code kind}, e.g. {@link #ISSN}
     * @throws IllegalArgumentException for an unknown kind
     */
    public SequenceGenerator<?> generator(String kind)
    {   SequenceGenerator<?> generator = generators.get(kind);
        if (generator == null)
        {   throw new IllegalArgumentException("Unknown generator kind: " + kind);
        }
        return generator;
    }

    /**
     * Restarts every generator from its first value and reseeds the random source.
     */
    public void reset()
    {   generators.values().forEach(SequenceGenerator::reset);
        random = new Random(seed);
        log.debug("FakeData reset (seed {})", seed);
    }


    // =====================================================================
    // Counter-backed generators
    // =====================================================================

    /**
     * Unique numeric identifier: {@code offset + 1}, {@code offset + 2}, ...
     */
    public long id(long offset)
    {   long n = next(ID);
        return offset + n;
    }

    public long id()
    {   return id(0);
    }

    public long number()
    {   return next(NUMBER);
    }

    public String doi()
    {   return "10.1234/PUBLONS.TEST." + this.<Long>next(DOI);
    }

    public String pmid()
    {   return String.valueOf(this.<Long>next(PMID));
    }

    public String arxiv()
    {   long n = next(ARXIV);
        return n + "." + n;
    }

    public String ut()
    {   return ut(DEFAULT_UT_PREFIX);
    }

    public String ut(String prefix)
    {   return prefix + ":" + next(UT);
    }

    public String manuscriptId()
    {   return "Manuscript:ID-" + next(MANUSCRIPT_ID);
    }

    public String publisherName()
    {   return "Publisher " + next(PUBLISHER_NAME);
    }

    public String publicationTitle()
    {   return "Publication " + next(PUBLICATION_TITLE);
    }

    public String institutionName()
    {   return "Institution " + next(INSTITUTION_NAME);
    }

    public String affiliationName()
    {   return "Affiliation " + next(AFFILIATION_NAME);
    }


    // =====================================================================
    // Vocabulary-backed generators
    // =====================================================================

    public String countryName()
    {   List<String> country = next(COUNTRY_NAME);
        String name = country.get(0);
        return name.length() > COUNTRY_NAME_MAX_LENGTH ? name.substring(0, COUNTRY_NAME_MAX_LENGTH) : name;
    }

    /**
     * Full name: {@code "First Last"}.
     */
    public String name()
    {   List<String> parts = next(NAME);
        return parts.get(0) + " " + parts.get(1);
    }

    /**
     * {@code "The <country> journal of <adjective> <field>"}.
     */
    public String journalName()
    {   List<String> parts = next(JOURNAL_NAME);
        return String.format("The %s journal of %s %s", parts.get(0), parts.get(1), parts.get(2));
    }

    /**
     * {@code "<adjective>.<last name>@test.com"}, lower case.
     */
    public String email()
    {   List<String> parts = next(EMAIL);
        return (parts.get(0) + "." + parts.get(1) + "@test.com").toLowerCase();
    }

    /**
     * Three common words separated by spaces.
     */
    public String gibberish()
    {   List<String> parts = next(GIBBERISH);
        return String.join(" ", parts);
    }


    // =====================================================================
    // Check digit generators
    // =====================================================================

    /**
     * ISSN with a valid check character, e.g. {@code 1000-0003}.
     */
    public String issn()
    {   long base = next(ISSN);
        return CheckDigits.formatIssn(base);
    }

    /**
     * ORCID with a valid check character, e.g. {@code 0000-0001-5040-6082}.
     */
    public String orcid()
    {   long counter = next(ORCID);
        return CheckDigits.formatOrcid(counter);
    }


    // =====================================================================
    // Random
    // =====================================================================

    /**
     * ResearcherID such as {@code MMM-1000-2017}, with a random letter, the next counter value
     * and a random year between 2008 and 2018.
     */
    public String researcherId()
    {   return researcherId(null, null, null);
    }

    /**
     * @param letters prefix letters, random when {@code null}
     * @param number  middle number, next counter value when {@code null}
     * @param year    year of joining, random when {@code null}
     */
    public String researcherId(String letters, Long number, Integer year)
    {
        String prefix = letters != null ? letters
                                        : RandomStringUtils.random(1, 'A', 'Z' + 1, true, false, null, random).repeat(3);
        long n = number != null ? number.longValue() : this.<Long>next(RESEARCHER_ID).longValue();
        int  y = year != null ? year.intValue()
                              : RESEARCHER_ID_FIRST_YEAR + random.nextInt(RESEARCHER_ID_LAST_YEAR - RESEARCHER_ID_FIRST_YEAR + 1);
        return prefix + "-" + n + "-" + y;
    }

    /**
     * Globally unique random token (a random UUID). Not reproducible, by nature.
     */
    public String truid()
    {   return UUID.randomUUID().toString();
    }
}
