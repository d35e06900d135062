package com.fhi.db_fixtures.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.fhi.db_fixtures.lifecycle.IsolationMode;

import lombok.Getter;
import lombok.Setter;


/**
 * Fixture engine settings, read from the {@code fixtures.*} keys:
 * <pre>
 * fixtures:
 *   app-root: .                 # base of relative directories
 *   default-dir: fixtures       # searched first
 *   dirs: [ shared, ../common ] # searched next, in this order
 *   isolation: ROLLBACK         # or TRUNCATE
 *   enabled: true
 * </pre>
 *
 * <p>{@code dirs} can also be given as the comma-separated environment variable
 * {@code FIXTURES_DIRS}.</p>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fixtures")
public class FixturesProperties
{
    /**
     * Switches the fixture engine off.
     */
    private boolean enabled = true;

    /**
     * Directory that relative fixture directories are resolved against.
     */
    private String appRoot = ".";

    /**
     * Fixture directory searched before {@link #dirs}.
     */
    private String defaultDir = "fixtures";

    /**
     * Additional fixture directories, absolute or relative to {@link #appRoot}.
     */
    private List<String> dirs = new ArrayList<>();

    private IsolationMode isolation = IsolationMode.ROLLBACK;


    /**
     * Fixture directories in search order: the default directory, then {@link #dirs}.
     */
    public List<Path> searchDirs()
    {
        Path root = Paths.get(appRoot);
        List<Path> out = new ArrayList<>(dirs.size() + 1);
        out.add(resolve(root, defaultDir));
        for (String dir : dirs)
        {   if (dir != null && !dir.isBlank())
            {   out.add(resolve(root, dir.trim()));
            }
        }
        return out;
    }


    private static Path resolve(Path root, String dir)
    {   Path path = Paths.get(dir);
        return (path.isAbsolute() ? path : root.resolve(path)).normalize();
    }
}
