package com.fhi.db_fixtures.lifecycle;

import java.sql.Savepoint;

import com.fhi.db_fixtures.loader.LoadReport;

/**
 * Per-test scope nested in a class scope, {@link IsolationMode#ROLLBACK} mode: a savepoint on the
 * class transaction. Rolling back to it removes what the test and its fixtures wrote and keeps
 * the class fixtures.
 */
final class SavepointBoundary implements ScopeBoundary
{
    private final FixtureSession session;
    private final Savepoint savepoint;


    private SavepointBoundary(FixtureSession session, Savepoint savepoint)
    {   this.session = session;
        this.savepoint = savepoint;
    }


    static SavepointBoundary open(FixtureSession session)
    {   return new SavepointBoundary(session, session.createSavepoint());
    }


    @Override
    public void loaded(LoadReport report)
    {}


    @Override
    public void abort()
    {   session.rollbackToSavepoint(savepoint);
    }


    @Override
    public void discard()
    {   session.rollbackToSavepoint(savepoint);
    }
}
