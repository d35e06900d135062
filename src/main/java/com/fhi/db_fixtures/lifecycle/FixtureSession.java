package com.fhi.db_fixtures.lifecycle;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;

import javax.sql.DataSource;

import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.orm.jpa.EntityManagerFactoryInfo;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.orm.jpa.vendor.HibernateJpaDialect;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import com.fhi.db_fixtures.materialize.SchemaContext;

import jakarta.persistence.EntityManagerFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * Database handles of the fixture engine: the persistence unit, its {@code DataSource} and the
 * {@link SchemaContext} the loader writes through.
 *
 * <p>Transactions are opened with a {@link JpaTransactionManager} private to the session. It binds
 * the {@code EntityManager} and the JDBC connection to the thread exactly like the application's own
 * transaction manager, so repositories called by the test join the fixture transaction. It is not
 * registered as a bean, so the application keeps its single {@code transactionManager}.</p>
 */
@Slf4j
public class FixtureSession
{
    @Getter
    private final EntityManagerFactory entityManagerFactory;

    @Getter
    private final DataSource dataSource;

    @Getter
    private final SchemaContext schema;

    private final JpaTransactionManager transactionManager;


    public FixtureSession(EntityManagerFactory entityManagerFactory, DataSource dataSource, SchemaContext schema)
    {
        this.entityManagerFactory = entityManagerFactory;
        this.dataSource = dataSource;
        this.schema = schema;

        this.transactionManager = new JpaTransactionManager(entityManagerFactory);
        if (transactionManager.getDataSource() == null)
        {   transactionManager.setDataSource(dataSource);
        }
        if (!(entityManagerFactory instanceof EntityManagerFactoryInfo))
        {   transactionManager.setJpaDialect(new HibernateJpaDialect());   // exposes the JDBC connection
        }
    }


    /**
     * @param propagation a {@link TransactionDefinition} propagation constant
     */
    public TransactionStatus begin(int propagation)
    {   DefaultTransactionDefinition definition = new DefaultTransactionDefinition(propagation);
        definition.setName("fixtures");
        return transactionManager.getTransaction(definition);
    }


    public void commit(TransactionStatus status)
    {   transactionManager.commit(status);
    }


    public void rollback(TransactionStatus status)
    {   transactionManager.rollback(status);
    }


    /**
     * Sets a savepoint on the connection of the current transaction, after flushing pending entity
     * changes so that they end up before it.
     */
    public Savepoint createSavepoint()
    {
        schema.flush();
        Connection con = DataSourceUtils.getConnection(dataSource);
        try
        {   return con.setSavepoint();
        }
        catch (SQLException e)
        {   throw new TransactionSystemException("Could not create fixture savepoint", e);
        }
        finally
        {   DataSourceUtils.releaseConnection(con, dataSource);
        }
    }


    /**
     * Rolls the current transaction back to {@code savepoint} and releases it, so that a long class
     * scope does not pile up savepoints on its connection. The persistence context is cleared
     * first: entities loaded or changed after the savepoint must not outlive it.
     *
     * <p>A driver that cannot release savepoints explicitly keeps them until the transaction ends;
     * that is logged at debug level and not treated as an error.</p>
     */
    public void rollbackToSavepoint(Savepoint savepoint)
    {
        schema.clear();
        Connection con = DataSourceUtils.getConnection(dataSource);
        try
        {   con.rollback(savepoint);
        }
        catch (SQLException e)
        {   DataSourceUtils.releaseConnection(con, dataSource);
            throw new TransactionSystemException("Could not roll back to fixture savepoint", e);
        }

        try
        {   con.releaseSavepoint(savepoint);
        }
        catch (SQLException e)
        {   log.debug("Could not release fixture savepoint, it stays until the transaction ends: {}", e.toString());
        }
        finally
        {   DataSourceUtils.releaseConnection(con, dataSource);
        }
    }
}
