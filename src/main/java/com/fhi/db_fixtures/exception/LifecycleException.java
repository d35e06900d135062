package com.fhi.db_fixtures.exception;

/**
 * Out-of-order or re-entrant setup/teardown call. Always a programming error in the calling
 * adapter or test, never a data problem.
 */
public class LifecycleException extends FixtureException
{
    public LifecycleException(String message)
    {   super(Cause.LIFECYCLE, null, Cause.LIFECYCLE.format(message), null);
    }
}
