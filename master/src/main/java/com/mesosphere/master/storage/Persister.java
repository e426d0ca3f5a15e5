package com.mesosphere.master.storage;

/**
 * A low-level interface for key/value storage in a tree structure, with paths delimited by
 * {@link PersisterUtils#PATH_DELIM}.
 *
 * <p>Parent nodes may lack data of their own. The root-level node (with path "" or "/") is always present.
 */
public interface Persister {

    /**
     * Retrieves the previously stored data at the specified path. If the path exists but has no data (i.e. is only a
     * parent of another path), this returns {@code null}.
     *
     * @throws PersisterException if the requested path doesn't exist, or for other access errors
     */
    byte[] get(String path) throws PersisterException;

    /**
     * Writes a single value to storage at the specified path, replacing any existing data at the path or creating the
     * path if it doesn't exist yet.
     *
     * @throws PersisterException in the event of an access error
     */
    void set(String path, byte[] bytes) throws PersisterException;

    /**
     * Closes this storage. No other operations should be performed against the instance after calling this.
     */
    void close();
}
