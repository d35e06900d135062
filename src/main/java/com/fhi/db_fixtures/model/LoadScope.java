package com.fhi.db_fixtures.model;

/**
 * Defines when loaded fixture data is discarded.
 */
public enum LoadScope
{
    /**
     * Discarded after each test method. Ensures test isolation.
     */
    PER_TEST,

    /**
     * Kept until the last test of the class has run. Use when tests can share state.
     */
    PER_CLASS
}
