package com.mesosphere.master.storage;

import com.mesosphere.master.state.CycleDetectingLockUtils;
import com.mesosphere.master.storage.StorageError.Reason;

import com.google.common.base.Splitter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Implementation of {@link Persister} which stores the data in local memory.
 */
public final class MemPersister implements Persister {

    // Parent paths are nodes without data
    private final Node root;

    private final Optional<Lock> rlock;

    private final Optional<Lock> rwlock;

    private MemPersister(LockMode mode, boolean exitOnDeadlock, Map<String, byte[]> data) {
        this.root = new Node();
        for (Map.Entry<String, byte[]> entry : data.entrySet()) {
            getNode(root, entry.getKey(), true).data = Optional.of(entry.getValue());
        }
        if (mode == LockMode.ENABLED) {
            ReadWriteLock lock = CycleDetectingLockUtils.newLock(exitOnDeadlock, MemPersister.class);
            this.rlock = Optional.of(lock.readLock());
            this.rwlock = Optional.of(lock.writeLock());
        } else {
            this.rlock = Optional.empty();
            this.rwlock = Optional.empty();
        }
    }

    /**
     * Returns a new {@link Builder} instance with locking enabled, exit on deadlock enabled, and no initial data.
     */
    public static Builder newBuilder() {
        return new Builder();
    }

    private static Node getNode(Node root, String path, boolean createIfMissing) {
        return getNode(root, getPathElements(path), createIfMissing);
    }

    private static Node getNode(Node root, List<String> pathElements, boolean createIfMissing) {
        Node curNode = root;
        for (String element : pathElements) {
            Node parent = curNode;
            curNode = parent.children.get(element);
            if (curNode == null) {
                if (!createIfMissing) {
                    return null;
                }
                curNode = new Node();
                parent.children.put(element, curNode);
            }
        }
        return curNode;
    }

    private static List<String> getPathElements(String path) {
        // use this instead of String.split(): avoid problems with paths that look like regexes
        return Splitter.on(PersisterUtils.PATH_DELIM).omitEmptyStrings().splitToList(path);
    }

    @Override
    public byte[] get(String path) throws PersisterException {
        lockR();
        try {
            Node node = getNode(root, path, false);
            if (node == null) {
                throw new PersisterException(Reason.NOT_FOUND, path);
            }
            return node.data.orElse(null);
        } finally {
            unlockR();
        }
    }

    @Override
    public void set(String path, byte[] bytes) {
        lockRW();
        try {
            getNode(root, path, true).data = Optional.of(bytes);
        } finally {
            unlockRW();
        }
    }

    @Override
    public void close() {
        lockRW();
        try {
            clear();
        } finally {
            unlockRW();
        }
    }

    /**
     * Caller must hold the write lock.
     */
    private void clear() {
        root.children.clear();
        root.data = Optional.empty();
    }

    private void lockRW() {
        rwlock.ifPresent(Lock::lock);
    }

    private void unlockRW() {
        rwlock.ifPresent(Lock::unlock);
    }

    private void lockR() {
        rlock.ifPresent(Lock::lock);
    }

    private void unlockR() {
        rlock.ifPresent(Lock::unlock);
    }

    /**
     * Whether to enable or disable thread-safe locking.
     */
    public enum LockMode {
        ENABLED,
        DISABLED
    }

    private static final class Node {
        private final Map<String, Node> children = new TreeMap<>();

        private Optional<byte[]> data = Optional.empty();
    }

    /**
     * Builder for {@link MemPersister}s.
     */
    public static final class Builder {
        private LockMode lockMode = LockMode.ENABLED;

        private boolean exitOnDeadlock = true;

        private Map<String, byte[]> initialData = Collections.emptyMap();

        private Builder() {
        }

        /**
         * Configures whether any deadlocks should result in exiting the master process.
         *
         * @return this
         */
        public Builder configureExitOnDeadlock(boolean exitOnDeadlock) {
            this.exitOnDeadlock = exitOnDeadlock;
            return this;
        }

        /**
         * Disables thread locking, for callers which serialize access themselves. This also disables exit on
         * deadlock.
         *
         * @return this
         */
        public Builder disableLocking() {
            this.lockMode = LockMode.DISABLED;
            this.exitOnDeadlock = false;
            return this;
        }

        /**
         * Assigns some initial data to be stored in the created instance.
         *
         * @param data a mapping of path to raw data
         * @return this
         */
        public Builder setData(Map<String, byte[]> data) {
            this.initialData = data;
            return this;
        }

        public MemPersister build() {
            return new MemPersister(lockMode, exitOnDeadlock, initialData);
        }
    }
}
