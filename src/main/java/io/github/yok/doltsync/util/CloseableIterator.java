package io.github.yok.doltsync.util;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Single-pass iterator over a resource such as an open {@link java.sql.ResultSet}.
 *
 * <p>
 * Callers must close the iterator, typically with try-with-resources. Closing an exhausted or
 * already closed iterator has no effect.
 * </p>
 *
 * @param <T> element type
 */
public interface CloseableIterator<T> extends Iterator<T>, AutoCloseable {

    @Override
    void close();

    /**
     * Wraps an in-memory list.
     *
     * @param <T> element type
     * @param elements elements
     * @return iterator whose {@link #close()} does nothing
     */
    static <T> CloseableIterator<T> of(List<T> elements) {
        Iterator<T> delegate = List.copyOf(elements).iterator();
        return new CloseableIterator<T>() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public T next() {
                return delegate.next();
            }

            @Override
            public void close() {}
        };
    }

    /**
     * Returns an empty iterator.
     *
     * @param <T> element type
     * @return empty iterator
     */
    static <T> CloseableIterator<T> empty() {
        return of(Collections.emptyList());
    }
}
