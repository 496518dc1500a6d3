package com.questrail.transferd.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * OperationRegistry
 * =============================================================================
 * Name → {@link OperationRecord} table shared by the dispatcher and the
 * plugin layer.
 *
 * <h2>Concurrency</h2>
 * The table is an immutable map published through a volatile field. Writers
 * build a new map under a lock and swap it in with one write; readers never
 * lock. A lookup therefore sees either the table before a mutation or the
 * table after it: an operation is fully present or fully absent, and a batch
 * registered with {@link #registerAll(Collection)} appears all at once.
 */
public final class OperationRegistry
{
    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final Object writeLock = new Object();
    private volatile Map<String, OperationRecord> table = Map.of();

    /**
     * @throws DuplicateOperationException if the name is taken
     */
    public void register(OperationRecord record) {
        registerAll(List.of(record));
    }

    /**
     * Register a batch atomically: either every record is added or, if any
     * name is taken (already or twice within the batch), none is.
     *
     * @throws DuplicateOperationException naming the first conflicting operation
     */
    public void registerAll(Collection<OperationRecord> records) {
        Objects.requireNonNull(records, "records");
        synchronized (writeLock) {
            Map<String, OperationRecord> next = new HashMap<>(table);
            for (OperationRecord record : records) {
                if (next.putIfAbsent(record.name(), record) != null) {
                    throw new DuplicateOperationException(record.name());
                }
            }
            table = Collections.unmodifiableMap(next);
        }
        for (OperationRecord record : records) {
            log.debug("Registered operation {} (level={}, owner={})",
                    record.name(), record.requiredLevel(), record.owner());
        }
    }

    public boolean unregister(String name) {
        synchronized (writeLock) {
            if (!table.containsKey(name)) {
                return false;
            }
            Map<String, OperationRecord> next = new HashMap<>(table);
            next.remove(name);
            table = Collections.unmodifiableMap(next);
        }
        log.debug("Unregistered operation {}", name);
        return true;
    }

    /**
     * Remove every operation owned by {@code owner}. No-op if it owns none.
     *
     * @return names removed
     */
    public List<String> unregisterAll(String owner) {
        Objects.requireNonNull(owner, "owner");
        List<String> removed = new ArrayList<>();
        synchronized (writeLock) {
            Map<String, OperationRecord> next = new HashMap<>(table);
            next.values().removeIf(record -> {
                if (owner.equals(record.owner())) {
                    removed.add(record.name());
                    return true;
                }
                return false;
            });
            if (!removed.isEmpty()) {
                table = Collections.unmodifiableMap(next);
            }
        }
        if (!removed.isEmpty()) {
            log.debug("Unregistered {} operation(s) owned by {}", removed.size(), owner);
        }
        Collections.sort(removed);
        return removed;
    }

    public Optional<OperationRecord> lookup(String name) {
        return Optional.ofNullable(table.get(name));
    }

    public boolean contains(String name) {
        return table.containsKey(name);
    }

    /** Sorted names of every registered operation. */
    public List<String> operationNames() {
        List<String> names = new ArrayList<>(table.keySet());
        Collections.sort(names);
        return names;
    }

    public List<String> operationNamesOwnedBy(String owner) {
        List<String> names = new ArrayList<>();
        for (OperationRecord record : table.values()) {
            if (Objects.equals(owner, record.owner())) {
                names.add(record.name());
            }
        }
        Collections.sort(names);
        return names;
    }

    /** Current table contents; an immutable snapshot. */
    public Map<String, OperationRecord> operations() {
        return table;
    }
}
