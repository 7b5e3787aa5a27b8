package com.questrail.dispatch.solver.cpsat;

import com.google.ortools.Loader;

/**
 * Loads the OR-Tools native libraries once per JVM.
 * <p>
 * Failures are not cached: a later call retries, and the error (typically an
 * {@link UnsatisfiedLinkError}) propagates to the caller each time.
 */
final class OrToolsNatives
{
    private static volatile boolean loaded;

    private OrToolsNatives() {}

    static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OrToolsNatives.class) {
            if (!loaded) {
                Loader.loadNativeLibraries();
                loaded = true;
            }
        }
    }
}
