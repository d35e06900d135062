package com.fhi.db_fixtures.spring;

import org.springframework.test.context.TestContext;
import org.springframework.test.context.support.AbstractTestExecutionListener;

import com.fhi.db_fixtures.hooks.FixtureHooks;
import com.fhi.db_fixtures.lifecycle.FixtureLifecycleManager;

import lombok.extern.slf4j.Slf4j;


/**
 * Spring {@link org.springframework.test.context.TestExecutionListener} loading
 * {@link com.fhi.db_fixtures.annotation.ClassFixtures} once per test class and
 * {@link com.fhi.db_fixtures.annotation.Fixtures} around each test method.
 *
 * <p>Usually registered through {@link FixtureTest}. Unlike the JUnit extension it works with any
 * runner Spring's TestContext framework supports.</p>
 *
 * <p>Do not combine with {@code @Transactional} tests: the fixture scope is the test's
 * transaction, and a second one opened by {@code TransactionalTestExecutionListener} is refused.</p>
 */
@Slf4j
public class FixturesTestExecutionListener extends AbstractTestExecutionListener
{
    private static final String HOOKS_ATTRIBUTE = FixturesTestExecutionListener.class.getName() + ".hooks";


    public FixturesTestExecutionListener()
    {   log.debug("Constructor FixturesTestExecutionListener");
    }


    @Override
    public void beforeTestClass(TestContext testContext)
    {   hooks(testContext).beforeClass();
    }


    @Override
    public void beforeTestMethod(TestContext testContext)
    {   hooks(testContext).beforeTest(testContext.getTestMethod());
    }


    @Override
    public void afterTestMethod(TestContext testContext)
    {   hooks(testContext).afterTest();
    }


    @Override
    public void afterTestClass(TestContext testContext)
    {   hooks(testContext).afterClass();
    }


    private static FixtureHooks hooks(TestContext testContext)
    {   return testContext.computeAttribute(HOOKS_ATTRIBUTE, name ->
        {   // TestContext hands out the Spring context, no injection needed here.
            FixtureLifecycleManager manager = testContext.getApplicationContext().getBean(FixtureLifecycleManager.class);
            return FixtureHooks.forTestClass(testContext.getTestClass(), manager);
        });
    }
}
