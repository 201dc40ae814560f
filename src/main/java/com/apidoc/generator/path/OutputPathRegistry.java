package com.apidoc.generator.path;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import com.apidoc.generator.exception.PathCollisionException;

/**
 * Every output path claimed during a run, compared case-insensitively so the
 * tree also survives case-insensitive file systems.
 *
 * Registration is synchronized; it is the single point where concurrently
 * rendered documents would meet.
 */
public class OutputPathRegistry {

    private final Set<String> claimedPaths = new HashSet<>();

    /**
     * Claims a path for writing.
     *
     * @throws PathCollisionException if the path, ignoring case, was claimed
     *                                before
     */
    public synchronized void register(String path) {
        if (!claimedPaths.add(path.toLowerCase(Locale.ROOT))) {
            throw new PathCollisionException(path);
        }
    }

    synchronized boolean isRegistered(String path) {
        return claimedPaths.contains(path.toLowerCase(Locale.ROOT));
    }

    public synchronized int size() {
        return claimedPaths.size();
    }
}
