package com.fhi.db_fixtures.lifecycle;

import com.fhi.db_fixtures.loader.LoadReport;

/**
 * The database-side bracket around one fixture scope: opened before the load, then either
 * {@linkplain #abort() aborted} (the load failed) or kept until {@linkplain #discard() discarded}
 * at teardown.
 */
interface ScopeBoundary
{
    /**
     * Called once the load succeeded.
     */
    void loaded(LoadReport report);

    /**
     * Undoes a failed load.
     */
    void abort();

    /**
     * Removes the scope's data at teardown.
     */
    void discard();
}
