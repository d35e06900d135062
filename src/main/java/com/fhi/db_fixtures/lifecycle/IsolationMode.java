package com.fhi.db_fixtures.lifecycle;

/**
 * How the data of a fixture scope is removed again.
 */
public enum IsolationMode
{
    /**
     * Fixtures and test run inside a transaction (or a savepoint of the class transaction) that is
     * rolled back at teardown. Nothing is ever committed.
     */
    ROLLBACK,

    /**
     * Fixtures are committed; teardown deletes every row of the tables they were loaded into, in
     * reverse load order. For databases or code under test that cannot work inside one
     * uncommitted transaction.
     */
    TRUNCATE
}
