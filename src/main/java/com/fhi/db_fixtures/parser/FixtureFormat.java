package com.fhi.db_fixtures.parser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported fixture file formats and the extensions they are recognised by.
 *
 * <p>Declaration order is the order in which extensions are tried when a fixture is requested
 * by bare name.</p>
 */
public enum FixtureFormat
{
    JSON(".json"),
    YAML(".yaml", ".yml");

    private final List<String> extensions;

    FixtureFormat(String... extensions)
    {   this.extensions = List.of(extensions);
    }

    public List<String> getExtensions()
    {   return extensions;
    }


    /**
     * All supported extensions in search order: {@code .json, .yaml, .yml}.
     */
    public static List<String> searchOrder()
    {   List<String> out = new ArrayList<>();
        for (FixtureFormat format : values())
        {   out.addAll(format.extensions);
        }
        return out;
    }


    public static Optional<FixtureFormat> fromFileName(String fileName)
    {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (FixtureFormat format : values())
        {   for (String ext : format.extensions)
            {   if (lower.endsWith(ext)) return Optional.of(format);
            }
        }
        return Optional.empty();
    }


    public static Optional<FixtureFormat> fromPath(Path path)
    {   Path fileName = path.getFileName();
        return fileName == null ? Optional.empty() : fromFileName(fileName.toString());
    }
}
