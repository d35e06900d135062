package com.fhi.db_fixtures.lifecycle;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

import com.fhi.db_fixtures.loader.LoadReport;

/**
 * Outermost scope in {@link IsolationMode#ROLLBACK} mode: a transaction that is never committed.
 */
final class TransactionBoundary implements ScopeBoundary
{
    private final FixtureSession session;
    private final TransactionStatus status;


    private TransactionBoundary(FixtureSession session, TransactionStatus status)
    {   this.session = session;
        this.status = status;
    }


    static TransactionBoundary open(FixtureSession session)
    {   return new TransactionBoundary(session, session.begin(TransactionDefinition.PROPAGATION_REQUIRED));
    }


    @Override
    public void loaded(LoadReport report)
    {}


    @Override
    public void abort()
    {   session.rollback(status);
    }


    @Override
    public void discard()
    {   session.rollback(status);
    }
}
