package com.fhi.db_fixtures.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares fixtures loaded once before the first test of the class and discarded after the last.
 *
 * <p>Every test of the class sees the class fixtures, plus whatever the previous tests of the class
 * wrote on top of them outside of a per-test scope. Per-test fixtures ({@link Fixtures}) are layered
 * on top and removed after each test without touching the class fixtures.</p>
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
public @interface ClassFixtures
{
    /**
     * Fixture names, in load order.
     */
    String[] value();
}
