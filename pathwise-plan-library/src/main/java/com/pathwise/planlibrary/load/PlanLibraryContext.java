package com.pathwise.planlibrary.load;

import com.pathwise.planlibrary.config.PlanLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-lifetime cache of the read-only plan library. Populated once (first call to
 * {@link #getOrLoad}); later calls return the cached copy. Picking up a new library requires a restart.
 */
public final class PlanLibraryContext {

    private static final Logger log = LoggerFactory.getLogger(PlanLibraryContext.class);
    private static final AtomicReference<PlanLibrary> LIBRARY = new AtomicReference<>();

    private PlanLibraryContext() {
    }

    /** Returns the cached library, loading it with the given loader on first use. */
    public static PlanLibrary getOrLoad(PlanLibraryLoader loader) {
        PlanLibrary cached = LIBRARY.get();
        if (cached != null) return cached;
        PlanLibrary loaded = loader.loadLibrary();
        if (LIBRARY.compareAndSet(null, loaded)) {
            log.info("Plan library cached | plans={}", loaded.getPlans().size());
            return loaded;
        }
        return LIBRARY.get();
    }

    /** Cached library, or an empty library before the first load. */
    public static PlanLibrary get() {
        PlanLibrary cached = LIBRARY.get();
        return cached != null ? cached : PlanLibrary.empty();
    }

    public static boolean isLoaded() {
        return LIBRARY.get() != null;
    }

    /** Drops the cached library so the next {@link #getOrLoad} reads again. Used by tests. */
    public static void reset() {
        LIBRARY.set(null);
    }
}
