package com.questrail.remotedisplay.stats;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * BoundedHistory
 * -----------------------------------------------------------------------------
 * Fixed-capacity sliding window: appending beyond capacity evicts the oldest
 * entry. O(1) amortized insertion and eviction.
 *
 * <p>Not thread-safe. Owned by a single pipeline; other readers work on a
 * {@link #copy()}.</p>
 */
public final class BoundedHistory<T> implements Iterable<T>
{
    private final int capacity;
    private final ArrayDeque<T> items;

    public BoundedHistory(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    public void add(T item)
    {
        if (items.size() == capacity) {
            items.removeFirst();
        }
        items.addLast(item);
    }

    public Optional<T> last()
    {
        return Optional.ofNullable(items.peekLast());
    }

    public int size()
    {
        return items.size();
    }

    public boolean isEmpty()
    {
        return items.isEmpty();
    }

    public int capacity()
    {
        return capacity;
    }

    public void clear()
    {
        items.clear();
    }

    /**
     * Oldest first. The returned list is a snapshot.
     */
    public List<T> toList()
    {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * Independent copy with the same capacity and contents. Elements are
     * shared, so they should be immutable.
     */
    public BoundedHistory<T> copy()
    {
        BoundedHistory<T> c = new BoundedHistory<>(capacity);
        c.items.addAll(items);
        return c;
    }

    @Override
    public Iterator<T> iterator()
    {
        return toList().iterator();
    }
}
