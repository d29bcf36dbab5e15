package io.natspresence.kv.spi;

import java.util.Iterator;

/**
 * Bounded, lazy sequence of the live entries of a bucket.
 *
 * <p>The sequence is finite. It ends at the substrate's end-of-data marker or after one idle
 * interval passes without a new entry, whichever comes first; {@link #hasNext()} never blocks for
 * longer than that interval. Each key appears at most once, with its latest value.
 *
 * <p>Failures while producing entries surface from {@link #hasNext()} as
 * {@link EntrySequenceException}. Close the sequence to release the underlying watch.
 */
public interface EntrySequence extends Iterator<KvEntry>, AutoCloseable {

    /**
     * Releases the underlying watch. Idempotent.
     */
    @Override
    void close();

    /**
     * Unchecked carrier for a {@link KvException} raised mid-iteration.
     */
    final class EntrySequenceException extends RuntimeException {
        public EntrySequenceException(KvException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized KvException getCause() {
            return (KvException) super.getCause();
        }
    }
}
