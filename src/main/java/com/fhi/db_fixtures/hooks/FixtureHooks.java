package com.fhi.db_fixtures.hooks;

import java.lang.reflect.Method;
import java.util.Objects;

import com.fhi.db_fixtures.annotation.ClassFixtures;
import com.fhi.db_fixtures.annotation.FixtureDeclarations;
import com.fhi.db_fixtures.annotation.Fixtures;
import com.fhi.db_fixtures.lifecycle.FixtureLifecycleManager;
import com.fhi.db_fixtures.loader.LoadReport;
import com.fhi.db_fixtures.model.FixtureSet;
import com.fhi.db_fixtures.model.LoadScope;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * Maps the four test-runner events onto a {@link FixtureLifecycleManager}, reading the fixtures to
 * load from {@link ClassFixtures} and {@link Fixtures} on the test class.
 *
 * <p>The JUnit extension and the Spring listener both delegate to this class. It can also be called
 * directly from lifecycle methods when neither is wanted:</p>
 * <pre>{@code
 *    @SpringBootTest
 *    @ClassFixtures("authors")
 *    class AuthorQueriesTest
 *    {
 *        static FixtureHooks hooks;
 *
 *        @BeforeAll
 *        static void loadAuthors(@Autowired FixtureLifecycleManager manager)
 *        {   hooks = FixtureHooks.forTestClass(AuthorQueriesTest.class, manager);
 *            hooks.beforeClass();
 *        }
 *
 *        @AfterAll
 *        static void discardAuthors()
 *        {   hooks.afterClass();
 *        }
 *    }
 * }</pre>
 *
 * <p>Teardown hooks only act on a scope that is actually open, so after a failed setup the runner
 * reports the setup error and not a follow-up lifecycle error.</p>
 */
@Slf4j
public final class FixtureHooks
{
    @Getter
    private final Class<?> testClass;

    @Getter
    private final FixtureLifecycleManager manager;

    private boolean testFixturesRequested;
    private boolean classFixturesRequested;


    private FixtureHooks(Class<?> testClass, FixtureLifecycleManager manager)
    {   this.testClass = Objects.requireNonNull(testClass, "testClass");
        this.manager = Objects.requireNonNull(manager, "manager");
    }


    public static FixtureHooks forTestClass(Class<?> testClass, FixtureLifecycleManager manager)
    {   return new FixtureHooks(testClass, manager);
    }


    /**
     * Loads the {@link ClassFixtures} of the test class, if any.
     */
    public LoadReport beforeClass()
    {
        FixtureSet set = FixtureDeclarations.classFixtures(testClass);
        if (set.isEmpty()) return LoadReport.empty();

        classFixturesRequested = true;
        return manager.setup(set, LoadScope.PER_CLASS);
    }


    /**
     * Loads the {@link Fixtures} applying to {@code testMethod}, if any.
     */
    public LoadReport beforeTest(Method testMethod)
    {
        FixtureSet set = FixtureDeclarations.testFixtures(testClass, testMethod);
        if (set.isEmpty()) return LoadReport.empty();

        testFixturesRequested = true;
        return manager.setup(set, LoadScope.PER_TEST);
    }


    public void afterTest()
    {
        boolean requested = testFixturesRequested;
        testFixturesRequested = false;
        if (manager.isActive(LoadScope.PER_TEST))
        {   manager.teardown(LoadScope.PER_TEST);
        }
        else if (requested)
        {   log.warn("No per-test fixture scope to discard for {} (setup failed?)", testClass.getName());
        }
    }


    public void afterClass()
    {
        boolean requested = classFixturesRequested;
        classFixturesRequested = false;
        if (manager.isActive(LoadScope.PER_CLASS))
        {   manager.teardown(LoadScope.PER_CLASS);
        }
        else if (requested)
        {   log.warn("No class fixture scope to discard for {} (setup failed?)", testClass.getName());
        }
    }
}
