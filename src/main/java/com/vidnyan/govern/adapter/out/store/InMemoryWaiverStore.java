package com.vidnyan.govern.adapter.out.store;

import com.vidnyan.govern.application.port.out.WaiverStore;
import com.vidnyan.govern.domain.waiver.Waiver;
import com.vidnyan.govern.domain.waiver.Waiver.WaiverKey;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Waiver store held in memory, keyed by (control or policy, resource).
 * Writes are serialized; reads run concurrently.
 */
public class InMemoryWaiverStore implements WaiverStore {

    private static final Comparator<Waiver> ORDER = Comparator
            .comparing(Waiver::approvedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Waiver::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    protected final Map<WaiverKey, Waiver> waivers = new ConcurrentHashMap<>();
    protected final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Waiver add(Waiver waiver) {
        lock.writeLock().lock();
        try {
            Waiver previous = waivers.put(waiver.key(), waiver);
            try {
                afterWrite();
            } catch (RuntimeException e) {
                restore(waiver.key(), previous);
                throw e;
            }
            return waiver;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(String waiverId) {
        lock.writeLock().lock();
        try {
            Optional<WaiverKey> key = waivers.values().stream()
                    .filter(w -> w.id().equals(waiverId))
                    .map(Waiver::key)
                    .findFirst();
            if (key.isEmpty()) {
                return false;
            }
            Waiver removed = waivers.remove(key.get());
            try {
                afterWrite();
            } catch (RuntimeException e) {
                restore(key.get(), removed);
                throw e;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Waiver> get(String waiverId) {
        lock.readLock().lock();
        try {
            return waivers.values().stream().filter(w -> w.id().equals(waiverId)).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Waiver> list() {
        lock.readLock().lock();
        try {
            return waivers.values().stream().sorted(ORDER).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Waiver> listActive(Instant now) {
        return list().stream().filter(w -> w.isActive(now)).toList();
    }

    @Override
    public boolean isWaived(String controlOrPolicyId, String resourceId, Instant now) {
        Waiver waiver = waivers.get(new WaiverKey(controlOrPolicyId, resourceId));
        return waiver != null && waiver.isActive(now);
    }

    private void restore(WaiverKey key, Waiver previous) {
        if (previous == null) {
            waivers.remove(key);
        } else {
            waivers.put(key, previous);
        }
    }

    /**
     * Hook run under the write lock after every mutation. A failing hook rolls the
     * mutation back before the exception propagates.
     */
    protected void afterWrite() {
    }
}
