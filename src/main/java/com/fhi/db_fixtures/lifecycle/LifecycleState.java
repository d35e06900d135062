package com.fhi.db_fixtures.lifecycle;

/**
 * State of a {@link FixtureLifecycleManager}.
 *
 * <pre>
 * IDLE --setup--> LOADING --ok--> LOADED --teardown--> TEARING_DOWN --> IDLE (or LOADED of the class scope)
 *                    |
 *                    +--failure--> previous state
 * </pre>
 */
public enum LifecycleState
{
    IDLE,
    LOADING,
    LOADED,
    TEARING_DOWN
}
