package com.fhi.model_builder.fake;

import java.util.Iterator;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * A restart-on-exhaustion cursor over a lazily produced sequence.
 *
 * <p>Each call to {@link #next()} advances the cursor and returns the current element. When a
 * finite sequence runs out, a fresh one is created from the same definition and the cursor
 * continues from its first element. Values produced by a finite definition therefore repeat
 * after a full cycle: uniqueness is only guaranteed within one restart epoch.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <V> the element type
 */
@Slf4j
public class SequenceGenerator<V> implements Supplier<V>
{
    @Getter
    private final String kind;

    private final Supplier<Iterator<V>> definition;

    private Iterator<V> cursor;

    /** Number of times the sequence was recreated after exhaustion. */
    @Getter
    private int restarts;


    /**
     * @param kind       name of the generator, used in logs and errors
     * @param definition creates a new sequence from scratch each time it is called
     */
    public SequenceGenerator(String kind, Supplier<Iterator<V>> definition)
    {   this.kind       = kind;
        this.definition = definition;
        this.cursor     = definition.get();
    }

    /**
     * Returns the next element, restarting the sequence if it is exhausted.
     *
     * @throws IllegalStateException if a freshly created sequence is empty
     */
    public V next()
    {
        if (!cursor.hasNext())
        {   cursor = definition.get();
            restarts++;
            log.debug("Sequence '{}' exhausted, restarted (restart #{})", kind, restarts);

            if (!cursor.hasNext())
            {   throw new IllegalStateException("Sequence '" + kind + "' produces no values");
            }
        }
        return cursor.next();
    }

    @Override
    public V get()
    {   return next();
    }

    /**
     * Drops the current cursor and starts over from the first element.
     */
    public void reset()
    {   cursor   = definition.get();
        restarts = 0;
    }
}
