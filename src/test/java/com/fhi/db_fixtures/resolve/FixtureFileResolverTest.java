package com.fhi.db_fixtures.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fhi.db_fixtures.exception.FixtureException;
import com.fhi.db_fixtures.exception.FixtureNotFoundException;


class FixtureFileResolverTest
{
    @TempDir
    Path root;

    private Path primary;
    private Path secondary;
    private final FixtureFileResolver resolver = new FixtureFileResolver();


    @BeforeEach
    void createDirs() throws IOException
    {   primary = Files.createDirectory(root.resolve("fixtures"));
        secondary = Files.createDirectory(root.resolve("shared"));
    }


    @Test
    @DisplayName("JSON wins over YAML in the same directory")
    void prefersJsonInSameDirectory() throws IOException
    {   touch(primary, "authors.yaml");
        Path json = touch(primary, "authors.json");

        assertEquals(json, resolver.resolve("authors", List.of(primary, secondary)));
    }


    @Test
    void prefersYamlOverYml() throws IOException
    {   touch(primary, "authors.yml");
        Path yaml = touch(primary, "authors.yaml");

        assertEquals(yaml, resolver.resolve("authors", List.of(primary)));
    }


    @Test
    @DisplayName("Every extension is tried in a directory before moving to the next one")
    void exhaustsDirectoryBeforeNext() throws IOException
    {   touch(secondary, "authors.json");
        Path yml = touch(primary, "authors.yml");

        assertEquals(yml, resolver.resolve("authors", List.of(primary, secondary)));
    }


    @Test
    void fallsBackToLaterDirectory() throws IOException
    {   Path json = touch(secondary, "authors.json");

        assertEquals(json, resolver.resolve("authors", List.of(primary, secondary)));
    }


    @Test
    void nameWithExtensionIsTakenAsIs() throws IOException
    {   touch(primary, "authors.json");
        Path yaml = touch(primary, "authors.yaml");

        assertEquals(yaml, resolver.resolve("authors.yaml", List.of(primary)));
    }


    @Test
    void missingDirectoryIsSkipped() throws IOException
    {   Path json = touch(secondary, "authors.json");

        assertEquals(json, resolver.resolve("authors", List.of(root.resolve("does-not-exist"), secondary)));
    }


    @Test
    void directoryNamedLikeFixtureIsNotAMatch() throws IOException
    {   Files.createDirectory(primary.resolve("authors.json"));
        Path json = touch(secondary, "authors.json");

        assertEquals(json, resolver.resolve("authors", List.of(primary, secondary)));
    }


    @Test
    @DisplayName("Unknown name reports every candidate path that was tried")
    void unknownNameListsCandidates()
    {
        FixtureNotFoundException e = assertThrows(FixtureNotFoundException.class,
                () -> resolver.resolve("nobody", List.of(primary, secondary)));

        assertEquals(FixtureException.Cause.FIXTURE_NOT_FOUND, e.getCauseEnum());
        assertEquals("nobody", e.getFixtureName());
        assertEquals(List.of(primary.resolve("nobody.json"), primary.resolve("nobody.yaml"), primary.resolve("nobody.yml"),
                             secondary.resolve("nobody.json"), secondary.resolve("nobody.yaml"), secondary.resolve("nobody.yml")),
                     e.getCandidates());
        assertTrue(e.getMessage().contains("nobody"));
    }


    private static Path touch(Path dir, String fileName) throws IOException
    {   return Files.writeString(dir.resolve(fileName), "[]");
    }
}
