package com.fhi.db_fixtures.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares fixtures to load before each test method, and to discard after it.
 *
 * <p>Values are fixture names, resolved against the configured fixture directories
 * ({@code authors} finds {@code fixtures/authors.json}, {@code .yaml} or {@code .yml}). Fixtures are
 * loaded in the order they are declared, which matters as soon as they reference each other:
 * load the authors before the books.</p>
 *
 * <p>On the class, the list applies to every test method. On a method, it replaces the class list
 * for that method; {@code @Fixtures({})} on a method turns per-test fixtures off for it.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 *    @FixtureTest
 *    @ClassFixtures("authors")
 *    @Fixtures("books")
 *    class BookServiceTest
 *    {
 *        @Test
 *        @Fixtures({ "books", "reviews" })
 *        void ranksReviewedBooksFirst() { ... }
 *    }
 * }</pre>
 *
 * @see ClassFixtures
 */
@Documented
@Target({ ElementType.TYPE, ElementType.METHOD })
@Retention(RetentionPolicy.RUNTIME)     // = read at runtime by the test-runner adapters
@Inherited                              // = abstract base test classes can declare shared fixtures
public @interface Fixtures
{
    /**
     * Fixture names, in load order.
     */
    String[] value();
}
