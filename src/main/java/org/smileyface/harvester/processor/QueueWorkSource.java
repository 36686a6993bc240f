package org.smileyface.harvester.processor;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-process {@link WorkSource} over a blocking FIFO queue with a bounded number of redeliveries per item.
 */
public class QueueWorkSource<T> implements WorkSource<T> {

    private final BlockingQueue<T> queue = new LinkedBlockingQueue<>();
    private final Map<Object, Integer> redeliveries = new ConcurrentHashMap<>();
    private final Function<? super T, ?> identity;
    private final int maxRedeliveries;

    public QueueWorkSource(Collection<? extends T> items, Function<? super T, ?> identity, int maxRedeliveries) {
        this.identity = identity;
        this.maxRedeliveries = Math.max(0, maxRedeliveries);
        if (items != null) queue.addAll(items);
    }

    public void add(T item) {
        queue.add(item);
    }

    @Override
    public T poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isDrained() {
        return queue.isEmpty();
    }

    @Override
    public boolean requeue(T item, String reason) {
        int attempts = redeliveries.merge(identity.apply(item), 1, Integer::sum);
        if (attempts > maxRedeliveries) {
            return false;
        }
        queue.add(item);
        return true;
    }

    public int size() {
        return queue.size();
    }
}
