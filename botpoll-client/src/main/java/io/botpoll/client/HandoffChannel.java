package io.botpoll.client;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One-way channel between two threads whose ends can be closed independently.
 *
 * <p>Sending fails once the receiving end is closed. Receiving drains pending items and then reports
 * an empty result once the sending end is closed.
 */
final class HandoffChannel<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<T> items = new ArrayDeque<>();
    private boolean senderClosed;
    private boolean receiverClosed;

    boolean send(T item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            if (senderClosed || receiverClosed) {
                return false;
            }
            items.addLast(item);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    Optional<T> receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (senderClosed || receiverClosed) {
                    return Optional.empty();
                }
                changed.await();
            }
            return Optional.of(items.removeFirst());
        } finally {
            lock.unlock();
        }
    }

    Optional<T> receive(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (senderClosed || receiverClosed || nanos <= 0) {
                    return Optional.empty();
                }
                nanos = changed.awaitNanos(nanos);
            }
            return Optional.of(items.removeFirst());
        } finally {
            lock.unlock();
        }
    }

    Optional<T> tryReceive() {
        lock.lock();
        try {
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    void closeSender() {
        lock.lock();
        try {
            senderClosed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void closeReceiver() {
        lock.lock();
        try {
            receiverClosed = true;
            items.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isSenderClosed() {
        lock.lock();
        try {
            return senderClosed;
        } finally {
            lock.unlock();
        }
    }
}
