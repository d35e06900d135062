package com.fhi.db_fixtures.lifecycle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.fhi.db_fixtures.exception.LifecycleException;
import com.fhi.db_fixtures.loader.FixtureLoader;
import com.fhi.db_fixtures.loader.LoadReport;
import com.fhi.db_fixtures.model.FixtureSet;
import com.fhi.db_fixtures.model.LoadScope;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * Brackets fixture loads so that every test starts from the same database state.
 *
 * <p>Each {@link #setup} opens a scope and loads a {@link FixtureSet} into it; the matching
 * {@link #teardown} throws the scope's data away again. Scopes nest at most two deep:</p>
 * <pre>
 * setup(classFixtures, PER_CLASS)          transaction opened, class fixtures loaded
 *   setup(testFixtures, PER_TEST)          savepoint, test fixtures loaded
 *   ... test ...
 *   teardown(PER_TEST)                     back to the savepoint: class fixtures still there
 *   setup(testFixtures, PER_TEST)
 *   ...
 *   teardown(PER_TEST)
 * teardown(PER_CLASS)                      transaction rolled back
 * </pre>
 *
 * <p>A per-test scope may also be opened on its own, in which case it gets its own transaction.
 * What "throw away" means depends on the {@link IsolationMode}.</p>
 *
 * <p>Calls out of order fail fast with a {@link LifecycleException} rather than leaving data behind:
 * a setup while another setup or teardown runs, a second per-test scope, a class scope inside
 * another scope, or a teardown of a scope that is not the innermost one.</p>
 *
 * <h3>Threading</h3>
 * <p>Transactions are bound to the calling thread, so setup, test and teardown must run on the
 * same thread. The manager itself is not thread-safe; one instance serves one test context.</p>
 */
@Slf4j
public class FixtureLifecycleManager
{
    private static final class Frame
    {
        private final LoadScope scope;
        private final String owner;
        private final ScopeBoundary boundary;
        private final LoadReport report;

        Frame(LoadScope scope, String owner, ScopeBoundary boundary, LoadReport report)
        {   this.scope = scope;
            this.owner = owner;
            this.boundary = boundary;
            this.report = report;
        }

        @Override
        public String toString()
        {   return scope + " scope of " + owner;
        }
    }

    private final FixtureSession session;
    private final FixtureLoader loader;

    @Getter
    private final IsolationMode isolationMode;

    private final Deque<Frame> frames = new ArrayDeque<>();

    @Getter
    private LifecycleState state = LifecycleState.IDLE;


    public FixtureLifecycleManager(FixtureSession session, FixtureLoader loader, IsolationMode isolationMode)
    {   this.session = session;
        this.loader = loader;
        this.isolationMode = isolationMode;
    }


    /**
     * Opens a scope and loads {@code set} into it.
     *
     * <p>Calling {@code setup(set, PER_CLASS)} again for the owner whose class scope is active
     * does nothing and returns the report of the original load.</p>
     *
     * <p>If loading fails, the scope is rolled back, the manager returns to the state it had before
     * the call and the original exception is rethrown.</p>
     *
     * @return what was loaded
     * @throws LifecycleException if the call is out of order
     * @throws com.fhi.db_fixtures.exception.FixtureException if a fixture cannot be loaded
     */
    public LoadReport setup(FixtureSet set, LoadScope scope)
    {
        Objects.requireNonNull(set, "set");
        Objects.requireNonNull(scope, "scope");

        if (state == LifecycleState.LOADING || state == LifecycleState.TEARING_DOWN)
        {   throw new LifecycleException(String.format("setup(%s) for %s while %s", scope, set.getOwner(), state));
        }

        Frame top = frames.peek();
        if (top != null)
        {   if (scope == LoadScope.PER_CLASS)
            {   if (top.scope == LoadScope.PER_CLASS && top.owner.equals(set.getOwner()))
                {   log.debug("Class fixtures of {} already loaded", set.getOwner());
                    return top.report;
                }
                throw new LifecycleException(String.format("setup(PER_CLASS) for %s while the %s is active", set.getOwner(), top));
            }
            if (top.scope == LoadScope.PER_TEST)
            {   throw new LifecycleException(String.format("setup(PER_TEST) for %s while the %s is active", set.getOwner(), top));
            }
        }
        else if (isolationMode == IsolationMode.ROLLBACK && TransactionSynchronizationManager.isActualTransactionActive())
        {   throw new LifecycleException(String.format(
                    "setup(%s) for %s inside an existing transaction; fixtures cannot be combined with @Transactional tests",
                    scope, set.getOwner()));
        }

        LifecycleState previous = state;
        state = LifecycleState.LOADING;
        ScopeBoundary boundary = null;
        try
        {   boundary = openBoundary(top != null);
            LoadReport report = loader.load(set, session.getSchema());
            boundary.loaded(report);

            frames.push(new Frame(scope, set.getOwner(), boundary, report));
            state = LifecycleState.LOADED;
            log.info("Opened {} fixture scope for {}: {} record(s) from {} file(s)", scope, set.getOwner(),
                     report.total(), report.getFiles().size());
            return report;
        }
        catch (RuntimeException | Error e)
        {   log.debug("Fixture setup for {} failed, rolling back: {}", set.getOwner(), e.toString());
            if (boundary != null)
            {   try
                {   boundary.abort();
                }
                catch (RuntimeException rollbackFailure)
                {   e.addSuppressed(rollbackFailure);
                }
            }
            state = previous;
            throw e;
        }
    }


    /**
     * Discards the innermost scope, which must be of the given kind.
     *
     * <p>Leaves the manager {@link LifecycleState#IDLE}, or {@link LifecycleState#LOADED} with the
     * enclosing class scope active.</p>
     *
     * @throws LifecycleException if nothing is loaded or the innermost scope is of another kind
     */
    public void teardown(LoadScope scope)
    {
        Objects.requireNonNull(scope, "scope");
        if (state != LifecycleState.LOADED)
        {   throw new LifecycleException(String.format("teardown(%s) while %s", scope, state));
        }
        Frame top = frames.peek();
        if (top.scope != scope)
        {   throw new LifecycleException(String.format("teardown(%s) while the %s is innermost", scope, top));
        }

        state = LifecycleState.TEARING_DOWN;
        try
        {   top.boundary.discard();
        }
        finally
        {   frames.pop();
            state = frames.isEmpty() ? LifecycleState.IDLE : LifecycleState.LOADED;
        }
        log.info("Discarded {}", top);
    }


    /**
     * Innermost active scope, empty when idle.
     */
    public Optional<LoadScope> getActiveScope()
    {   Frame top = frames.peek();
        return top == null ? Optional.empty() : Optional.of(top.scope);
    }


    public boolean isActive(LoadScope scope)
    {   return frames.stream().anyMatch(frame -> frame.scope == scope);
    }


    private ScopeBoundary openBoundary(boolean nested)
    {
        if (isolationMode == IsolationMode.TRUNCATE)
        {   return TruncateBoundary.open(session);
        }
        return nested ? SavepointBoundary.open(session) : TransactionBoundary.open(session);
    }
}
