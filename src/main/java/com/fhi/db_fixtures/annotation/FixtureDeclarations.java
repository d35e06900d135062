package com.fhi.db_fixtures.annotation;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import org.springframework.core.annotation.AnnotatedElementUtils;

import com.fhi.db_fixtures.model.FixtureSet;

/**
 * Reads {@link ClassFixtures} and {@link Fixtures} off test classes and methods.
 *
 * <p>Annotations are looked up with Spring's merged-annotation support, so they may also be used
 * as meta-annotations and are found on superclasses and enclosing interfaces.</p>
 */
public final class FixtureDeclarations
{
    private FixtureDeclarations()
    {}


    /**
     * Fixtures to load once for {@code testClass}; empty set if none are declared.
     */
    public static FixtureSet classFixtures(Class<?> testClass)
    {
        ClassFixtures declared = AnnotatedElementUtils.findMergedAnnotation(testClass, ClassFixtures.class);
        return new FixtureSet(testClass.getName(), names(declared == null ? null : declared.value()));
    }


    /**
     * Fixtures to load around {@code testMethod}: the method's own {@link Fixtures} when present,
     * else the class's.
     */
    public static FixtureSet testFixtures(Class<?> testClass, Method testMethod)
    {
        Fixtures declared = AnnotatedElementUtils.findMergedAnnotation(testMethod, Fixtures.class);
        if (declared == null)
        {   declared = AnnotatedElementUtils.findMergedAnnotation(testClass, Fixtures.class);
        }
        return new FixtureSet(testClass.getName() + "#" + testMethod.getName(),
                              names(declared == null ? null : declared.value()));
    }


    private static List<String> names(String[] values)
    {   return values == null ? List.of() : Arrays.asList(values);
    }
}
