package com.fhi.db_fixtures.resolve;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fhi.db_fixtures.exception.FixtureNotFoundException;
import com.fhi.db_fixtures.parser.FixtureFormat;

import lombok.extern.slf4j.Slf4j;


/**
 * Locates the file behind a fixture name.
 *
 * <p>Directories are searched in the given priority order. Inside one directory every supported
 * extension is tried ({@code .json}, then {@code .yaml}, then {@code .yml}) before moving on to the
 * next directory, so for {@code authors} and the directories {@code [fixtures, shared]}:</p>
 * <pre>
 * fixtures/authors.json
 * fixtures/authors.yaml
 * fixtures/authors.yml
 * shared/authors.json
 * ...
 * </pre>
 *
 * <p>A name that already carries a supported extension ({@code authors.yaml}) is looked up as is.
 * Directories that do not exist are skipped.</p>
 */
@Slf4j
public class FixtureFileResolver
{
    /**
     * Returns the first existing file for {@code name}.
     *
     * @param name       fixture name, with or without extension
     * @param searchDirs directories in priority order
     * @return path of the first match
     * @throws FixtureNotFoundException if no candidate exists
     */
    public Path resolve(String name, List<Path> searchDirs)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(searchDirs, "searchDirs");

        List<Path> candidates = new ArrayList<>();
        for (Path dir : searchDirs)
        {   for (String fileName : candidateFileNames(name))
            {   Path candidate = dir.resolve(fileName);
                candidates.add(candidate);
                log.debug("Attempting fixture candidate {}", candidate);
                if (Files.isRegularFile(candidate))
                {   log.debug("Fixture '{}' resolved to {}", name, candidate);
                    return candidate;
                }
            }
        }

        throw new FixtureNotFoundException(name, candidates);
    }


    private static List<String> candidateFileNames(String name)
    {
        if (FixtureFormat.fromFileName(name).isPresent())
        {   return List.of(name);
        }
        List<String> out = new ArrayList<>();
        for (String ext : FixtureFormat.searchOrder())
        {   out.add(name + ext);
        }
        return out;
    }
}
