package com.fhi.db_fixtures.junit;

import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import com.fhi.db_fixtures.hooks.FixtureHooks;
import com.fhi.db_fixtures.lifecycle.FixtureLifecycleManager;

import lombok.extern.slf4j.Slf4j;


/**
 * JUnit Jupiter extension loading {@link com.fhi.db_fixtures.annotation.ClassFixtures} before all
 * tests of a class and {@link com.fhi.db_fixtures.annotation.Fixtures} before each test.
 *
 * <p>The {@link FixtureLifecycleManager} is taken from the Spring test context, so the test class
 * must also run with the {@link SpringExtension} (e.g. through {@code @SpringBootTest}), declared
 * before this extension:</p>
 * <pre>{@code
 *    @SpringBootTest
 *    @ExtendWith(FixturesExtension.class)
 *    @ClassFixtures("authors")
 *    class AuthorRepositoryTest { ... }
 * }</pre>
 */
@Slf4j
public class FixturesExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback
{
    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(FixturesExtension.class);


    @Override
    public void beforeAll(ExtensionContext context)
    {   hooks(context).beforeClass();
    }


    @Override
    public void beforeEach(ExtensionContext context)
    {   hooks(context).beforeTest(context.getRequiredTestMethod());
    }


    @Override
    public void afterEach(ExtensionContext context)
    {   hooks(context).afterTest();
    }


    @Override
    public void afterAll(ExtensionContext context)
    {   hooks(context).afterClass();
    }


    /**
     * One {@link FixtureHooks} per test class, kept in the class-level store.
     */
    private static FixtureHooks hooks(ExtensionContext context)
    {
        Class<?> testClass = context.getRequiredTestClass();
        return context.getStore(NAMESPACE).getOrComputeIfAbsent(testClass, cls ->
        {   log.debug("Creating fixture hooks for {}", cls.getName());
            FixtureLifecycleManager manager = SpringExtension.getApplicationContext(context)
                                                             .getBean(FixtureLifecycleManager.class);
            return FixtureHooks.forTestClass(cls, manager);
        }, FixtureHooks.class);
    }
}
