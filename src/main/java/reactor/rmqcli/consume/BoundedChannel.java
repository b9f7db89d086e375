/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.rmqcli.consume;

import reactor.util.annotation.Nullable;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO hand-off between two stages of the consume pipeline.
 * <p>
 * Writers block while the channel is full and readers block while it is empty.
 * {@link #close()} signals that no more items will be produced: readers drain the
 * buffered items and then observe end-of-stream ({@code null} from {@link #receive()}),
 * while writers that are blocked or that arrive afterwards fail with
 * {@link ChannelClosedException}. The capacity is the backpressure bound between the
 * producing and the consuming stage.
 *
 * @param <T> item type
 */
public final class BoundedChannel<T> {

    private final String name;

    private final int capacity;

    private final ArrayDeque<T> buffer;

    private final ReentrantLock lock = new ReentrantLock();

    private final Condition notEmpty = lock.newCondition();

    private final Condition notFull = lock.newCondition();

    private boolean closed;

    public BoundedChannel(String name, int capacity) {
        if (capacity <= 0)
            throw new IllegalArgumentException("Channel capacity must be > 0");
        this.name = name;
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Appends an item, waiting for free space if the channel is full.
     * @param item item to append
     * @throws ChannelClosedException if the channel is closed before the item could be appended
     * @throws InterruptedException if interrupted while waiting for free space
     */
    public void send(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() >= capacity)
                notFull.await();
            if (closed)
                throw new ChannelClosedException(name);
            buffer.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest item, waiting for one to arrive if the channel is empty.
     * @return the next item or {@code null} if the channel is closed and fully drained
     * @throws InterruptedException if interrupted while waiting for an item
     */
    @Nullable
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.isEmpty())
                notEmpty.await();
            T item = buffer.pollFirst();
            if (item != null)
                notFull.signal();
            return item;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel. Only the first invocation has an effect.
     * @return true if this call closed the channel
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed)
                return false;
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "BoundedChannel(" + name + ", size=" + size() + ", capacity=" + capacity + ")";
    }
}
