package com.mesosphere.master.storage;

import com.mesosphere.master.storage.StorageError.Reason;

/**
 * Utilities relating to usage of {@link Persister}s.
 */
public final class PersisterUtils {

    public static final char PATH_DELIM = '/';

    private static final String PATH_DELIM_STR = String.valueOf(PATH_DELIM);

    private PersisterUtils() {
        // do not instantiate
    }

    /**
     * Combines the provided path elements into a unified path, with a single delimiter between them.
     */
    public static String joinPaths(String first, String second) {
        if (first.endsWith(PATH_DELIM_STR) && second.startsWith(PATH_DELIM_STR)) {
            return first + second.substring(1);
        } else if (first.endsWith(PATH_DELIM_STR) || second.startsWith(PATH_DELIM_STR) || first.isEmpty()) {
            return first + second;
        } else {
            return first + PATH_DELIM_STR + second;
        }
    }

    /**
     * Returns the data at the provided path, or {@code null} if the path doesn't exist.
     *
     * @throws PersisterException for access errors other than the path being missing
     */
    public static byte[] getOrNull(Persister persister, String path) throws PersisterException {
        try {
            return persister.get(path);
        } catch (PersisterException e) {
            if (e.getReason() == Reason.NOT_FOUND) {
                return null;
            }
            throw e;
        }
    }
}
