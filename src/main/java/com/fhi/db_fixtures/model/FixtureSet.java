package com.fhi.db_fixtures.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import lombok.Getter;
import lombok.ToString;

/**
 * The fixture names requested by one test or one test class, in declaration order.
 *
 * <p>Declaration order is load order, which matters as soon as fixtures reference each other
 * (load the authors before the books).</p>
 */
@Getter
@ToString
public final class FixtureSet
{
    /**
     * Display name of whoever requested the set, usually the test class or {@code Class#method}.
     * Used to recognise a class-scope re-entry and in log lines.
     */
    private final String owner;

    private final List<String> names;


    public FixtureSet(String owner, List<String> names)
    {   this.owner = Objects.requireNonNull(owner, "owner");
        this.names = List.copyOf(names);
    }

    public static FixtureSet of(String owner, String... names)
    {   return new FixtureSet(owner, Arrays.asList(names));
    }

    public boolean isEmpty()
    {   return names.isEmpty();
    }
}
