package com.fhi.db_fixtures.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import com.fhi.db_fixtures.lifecycle.IsolationMode;


class FixturesPropertiesTest
{
    @Test
    void defaults()
    {
        FixturesProperties properties = new FixturesProperties();

        assertTrue(properties.isEnabled());
        assertEquals(IsolationMode.ROLLBACK, properties.getIsolation());
        assertEquals(List.of(Paths.get("fixtures")), properties.searchDirs());
    }


    @Test
    void extraDirectoriesFollowTheDefaultOne(@TempDir Path absolute)
    {
        FixturesProperties properties = new FixturesProperties();
        properties.setAppRoot("app");
        properties.setDirs(List.of("shared", "../common", " ", absolute.toString()));

        assertEquals(List.of(Paths.get("app/fixtures"), Paths.get("app/shared"), Paths.get("common"), absolute),
                     properties.searchDirs());
    }


    @Test
    void bindsRelaxedKeys()
    {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
                "fixtures.app-root", "src/test/resources",
                "fixtures.default-dir", "data",
                "fixtures.dirs", "one,two",
                "fixtures.isolation", "truncate"));

        FixturesProperties properties = new Binder(source).bind("fixtures", FixturesProperties.class).get();

        assertEquals(IsolationMode.TRUNCATE, properties.getIsolation());
        assertEquals(List.of(Paths.get("src/test/resources/data"),
                             Paths.get("src/test/resources/one"),
                             Paths.get("src/test/resources/two")),
                     properties.searchDirs());
    }
}
