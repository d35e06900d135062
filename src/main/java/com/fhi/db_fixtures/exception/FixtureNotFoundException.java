package com.fhi.db_fixtures.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * No search directory / extension combination yielded a file for the requested fixture name.
 */
public class FixtureNotFoundException extends FixtureException
{
    private final List<Path> candidates;

    public FixtureNotFoundException(String fixtureName, List<Path> candidates)
    {   super(Cause.FIXTURE_NOT_FOUND, fixtureName,
              Cause.FIXTURE_NOT_FOUND.format(fixtureName, candidates), null);
        this.candidates = List.copyOf(candidates);
    }

    /**
     * Every path that was checked, in search order.
     */
    public List<Path> getCandidates()
    {   return candidates;
    }
}
