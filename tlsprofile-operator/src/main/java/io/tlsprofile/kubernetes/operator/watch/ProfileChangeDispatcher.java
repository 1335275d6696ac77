/*
 * Copyright TLS Profile Watcher Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.tlsprofile.kubernetes.operator.watch;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers committed transitions to the registered {@link ProfileChangeListener}.
 * <p>
 * Delivery happens synchronously on the calling thread. Transitions are delivered strictly in
 * {@link WatcherState.Transition#sequence()} order: a caller holding a later transition waits
 * until every earlier one has been delivered. Nothing is queued and nothing is retried.
 * <p>
 * A listener which itself causes a further transition to be dispatched on the same thread
 * has that transition delivered immediately, nested inside the current delivery, because the
 * turn it would otherwise wait for is held by the listener's own thread.
 */
public class ProfileChangeDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProfileChangeDispatcher.class);

    private final ProfileChangeListener listener;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition turn = lock.newCondition();
    private long nextSequence = 1;
    // sequences already delivered by nested dispatch, skipped when their turn comes
    private final Set<Long> deliveredOutOfTurn = new HashSet<>();

    public ProfileChangeDispatcher(ProfileChangeListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Delivers the given transition once its turn comes.
     * @param transition A transition committed by {@link WatcherState#transitionTo}.
     */
    public void dispatch(WatcherState.Transition transition) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                LOGGER.atDebug()
                        .addKeyValue("sequence", transition.sequence())
                        .log("TLS profile change dispatched from within the listener, delivering immediately");
                deliveredOutOfTurn.add(transition.sequence());
                deliver(transition);
                return;
            }
            while (transition.sequence() != nextSequence) {
                turn.awaitUninterruptibly();
            }
            try {
                deliver(transition);
            }
            finally {
                advance();
                turn.signalAll();
            }
        }
        finally {
            lock.unlock();
        }
    }

    private void deliver(WatcherState.Transition transition) {
        try {
            ProfileChange change = transition.change();
            listener.onProfileChange(change.previous(), change.current());
        }
        catch (RuntimeException e) {
            LOGGER.atError()
                    .addKeyValue("sequence", transition.sequence())
                    .setCause(e)
                    .log("TLS profile change listener failed; the change will not be redelivered");
        }
    }

    private void advance() {
        nextSequence++;
        while (deliveredOutOfTurn.remove(nextSequence)) {
            nextSequence++;
        }
    }
}
