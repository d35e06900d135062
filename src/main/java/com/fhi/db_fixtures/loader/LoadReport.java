package com.fhi.db_fixtures.loader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fhi.db_fixtures.model.FixtureTarget;

import lombok.Getter;
import lombok.ToString;

/**
 * What one {@link FixtureLoader#load} call wrote.
 *
 * <p>The touched targets, in first-load order, are what the truncating isolation mode deletes
 * from (in reverse) on teardown.</p>
 */
@Getter
@ToString
public final class LoadReport
{
    /**
     * One loaded fixture file.
     */
    @Getter
    @ToString
    public static final class FileResult
    {
        private final String name;
        private final Path path;

        /** Rows or instances written per group, in file order. */
        private final List<Integer> groupCounts;

        FileResult(String name, Path path, List<Integer> groupCounts)
        {   this.name = name;
            this.path = path;
            this.groupCounts = List.copyOf(groupCounts);
        }

        public int total()
        {   return groupCounts.stream().mapToInt(Integer::intValue).sum();
        }
    }

    private static final LoadReport EMPTY = new LoadReport(List.of(), List.of());

    private final List<FileResult> files;
    private final List<FixtureTarget> touchedTargets;


    private LoadReport(List<FileResult> files, List<FixtureTarget> touchedTargets)
    {   this.files = Collections.unmodifiableList(files);
        this.touchedTargets = Collections.unmodifiableList(touchedTargets);
    }


    public static LoadReport empty()
    {   return EMPTY;
    }


    /**
     * Rows and instances written over all files.
     */
    public int total()
    {   return files.stream().mapToInt(FileResult::total).sum();
    }


    static Builder builder()
    {   return new Builder();
    }


    static final class Builder
    {
        private final List<FileResult> files = new ArrayList<>();
        private final Set<FixtureTarget> touched = new LinkedHashSet<>();

        Builder file(String name, Path path, List<Integer> groupCounts)
        {   files.add(new FileResult(name, path, groupCounts));
            return this;
        }

        Builder touched(FixtureTarget target)
        {   touched.add(target);
            return this;
        }

        LoadReport build()
        {   return new LoadReport(new ArrayList<>(files), new ArrayList<>(touched));
        }
    }
}
