package com.fhi.model_builder.fake;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;


/**
 * Factories for the sequences wrapped by {@link SequenceGenerator}.
 */
public final class Sequences
{
    private Sequences()
    {}

    /**
     * Infinite series of incrementing longs: {@code start, start + 1, start + 2, ...}
     */
    public static Iterator<Long> counter(long start)
    {   return counter(start, 1);
    }

    /**
     * Infinite series {@code start, start + step, start + 2 * step, ...}
     */
    public static Iterator<Long> counter(long start, long step)
    {   return new Iterator<>()
        {
            private long current = start;

            @Override
            public boolean hasNext()
            {   return true;
            }

            @Override
            public Long next()
            {   long value = current;
                current += step;
                return value;
            }
        };
    }

    /**
     * Finite series of incrementing longs from {@code startInclusive} up to {@code endExclusive}.
     */
    public static Iterator<Long> range(long startInclusive, long endExclusive)
    {   return new Iterator<>()
        {
            private long current = startInclusive;

            @Override
            public boolean hasNext()
            {   return current < endExclusive;
            }

            @Override
            public Long next()
            {   if (!hasNext()) throw new NoSuchElementException();
                return current++;
            }
        };
    }

    /**
     * Lazy cartesian product of the given lists. The last list varies fastest:
     * {@code product([a, b], [x, y])} yields {@code [a, x], [a, y], [b, x], [b, y]}.
     *
     * <p>If any list is empty (or no list is given) the product is empty.</p>
     */
    @SafeVarargs
    public static <E> Iterator<List<E>> product(List<? extends E>... lists)
    {   return new ProductIterator<>(List.of(lists));
    }


    private static final class ProductIterator<E> implements Iterator<List<E>>
    {
        private final List<List<? extends E>> lists;
        private final int[] indices;
        private boolean exhausted;

        ProductIterator(List<List<? extends E>> lists)
        {   this.lists     = lists;
            this.indices   = new int[lists.size()];
            this.exhausted = lists.isEmpty() || lists.stream().anyMatch(List::isEmpty);
        }

        @Override
        public boolean hasNext()
        {   return !exhausted;
        }

        @Override
        public List<E> next()
        {
            if (exhausted) throw new NoSuchElementException();

            List<E> tuple = new ArrayList<>(lists.size());
            for (int i = 0; i < lists.size(); i++)
            {   tuple.add(lists.get(i).get(indices[i]));
            }
            advance();
            return List.copyOf(tuple);
        }

        // Odometer: bump the last index, carry to the left.
        private void advance()
        {
            for (int i = indices.length - 1; i >= 0; i--)
            {   if (++indices[i] < lists.get(i).size()) return;
                indices[i] = 0;
            }
            exhausted = true;
        }
    }
}
