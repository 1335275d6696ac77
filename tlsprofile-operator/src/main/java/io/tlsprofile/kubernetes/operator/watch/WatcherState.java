/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.watch;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import io.tlsprofile.kubernetes.operator.profile.TlsProfileComparator;
import io.tlsprofile.kubernetes.operator.profile.TlsProfileSpec;

/**
 * Holds the last known TLS profile.
 * Reads may proceed concurrently; {@link #swap(TlsProfileSpec)} and
 * {@link #transitionTo(TlsProfileSpec)} are exclusive.
 */
public class WatcherState {

    /**
     * A committed transition. Only {@link WatcherState} creates these, so sequence numbers
     * are always those it assigned.
     */
    public static final class Transition {
        private final long sequence;
        private final ProfileChange change;

        Transition(long sequence, ProfileChange change) {
            this.sequence = sequence;
            this.change = Objects.requireNonNull(change, "change");
        }

        /**
         * @return Position of this transition in commit order, starting at 1.
         */
        public long sequence() {
            return sequence;
        }

        public ProfileChange change() {
            return change;
        }

        @Override
        public String toString() {
            return "Transition[sequence=" + sequence + ", change=" + change + "]";
        }
    }

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private TlsProfileSpec current;
    private long committedTransitions;

    /**
     * @param initial The profile assumed to be in effect before observation begins.
     */
    public WatcherState(TlsProfileSpec initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    /**
     * @return The last known profile.
     */
    public TlsProfileSpec snapshot() {
        lock.readLock().lock();
        try {
            return current;
        }
        finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Unconditionally replaces the last known profile.
     * @param next The new profile.
     * @return The profile it replaced.
     */
    public TlsProfileSpec swap(TlsProfileSpec next) {
        Objects.requireNonNull(next, "next");
        lock.writeLock().lock();
        try {
            TlsProfileSpec previous = current;
            current = next;
            return previous;
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Compares {@code next} with the last known profile and, if they differ, replaces it,
     * all while holding the write lock. Concurrent callers with the same {@code next}
     * therefore commit at most one transition between them.
     * @param next The newly resolved profile.
     * @return The committed transition, or empty if {@code next} equals the last known profile.
     */
    public Optional<Transition> transitionTo(TlsProfileSpec next) {
        Objects.requireNonNull(next, "next");
        lock.writeLock().lock();
        try {
            TlsProfileSpec previous = current;
            if (TlsProfileComparator.equal(previous, next)) {
                return Optional.empty();
            }
            current = next;
            return Optional.of(new Transition(++committedTransitions, new ProfileChange(previous, next)));
        }
        finally {
            lock.writeLock().unlock();
        }
    }
}
