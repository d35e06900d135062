package com.fhi.db_fixtures.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/**
 * A parsed fixture file: its record groups in file order.
 */
@Getter
@ToString
public final class FixtureFile
{
    /** File name, e.g. {@code authors.json}. */
    private final String name;

    private final Path path;

    private final List<RecordGroup> groups;


    public FixtureFile(String name, Path path, List<RecordGroup> groups)
    {   this.name = name;
        this.path = path;
        this.groups = List.copyOf(groups);
    }

    /**
     * Number of records over all groups.
     */
    public int recordCount()
    {   return groups.stream().mapToInt(RecordGroup::size).sum();
    }
}
