package com.fhi.db_fixtures.lifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

import com.fhi.db_fixtures.loader.LoadReport;
import com.fhi.db_fixtures.materialize.SchemaContext;
import com.fhi.db_fixtures.model.FixtureTarget;

import lombok.extern.slf4j.Slf4j;

/**
 * Scope in {@link IsolationMode#TRUNCATE} mode: the load is committed in a transaction of its own,
 * and teardown deletes every row of the touched tables and models, last loaded first.
 *
 * <p>Rows the test itself wrote into other tables are not removed.</p>
 */
@Slf4j
final class TruncateBoundary implements ScopeBoundary
{
    private final FixtureSession session;
    private final TransactionStatus loadTransaction;
    private List<FixtureTarget> touched = List.of();


    private TruncateBoundary(FixtureSession session, TransactionStatus loadTransaction)
    {   this.session = session;
        this.loadTransaction = loadTransaction;
    }


    static TruncateBoundary open(FixtureSession session)
    {   return new TruncateBoundary(session, session.begin(TransactionDefinition.PROPAGATION_REQUIRES_NEW));
    }


    @Override
    public void loaded(LoadReport report)
    {   touched = report.getTouchedTargets();
        session.commit(loadTransaction);
    }


    @Override
    public void abort()
    {   if (!loadTransaction.isCompleted())
        {   session.rollback(loadTransaction);
        }
    }


    @Override
    public void discard()
    {
        if (touched.isEmpty()) return;

        List<FixtureTarget> reversed = new ArrayList<>(touched);
        Collections.reverse(reversed);

        SchemaContext schema = session.getSchema();
        TransactionStatus status = session.begin(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        try
        {   for (FixtureTarget target : reversed)
            {   int deleted = target.isTable()
                        ? schema.getJdbcTemplate().update("DELETE FROM " + schema.tableSchema(null, target.getName()).qualifiedName())
                        : schema.getEntityManager()
                                .createQuery("delete from " + schema.resolveModel(null, target.getName()).getEntityName())
                                .executeUpdate();
                log.debug("Deleted {} row(s) of {}", deleted, target);
            }
            schema.clear();
        }
        catch (RuntimeException | Error e)
        {   session.rollback(status);
            throw e;
        }
        session.commit(status);
    }
}
