package com.fhi.db_fixtures.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.sql.Savepoint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionSystemException;


/**
 * Not {@code @Transactional}: each test opens and rolls back its own session transaction.
 */
@SpringBootTest
class FixtureSessionTest
{
    @Autowired
    private FixtureSession session;


    @Test
    @DisplayName("Rolling back to a savepoint removes later rows and releases the savepoint")
    void savepointIsReleasedAfterRollback()
    {
        TransactionStatus status = session.begin(TransactionDefinition.PROPAGATION_REQUIRED);
        try
        {   JdbcTemplate jdbc = session.getSchema().getJdbcTemplate();
            jdbc.update("INSERT INTO author (id, name) VALUES (1, 'Kept')");

            Savepoint savepoint = session.createSavepoint();
            jdbc.update("INSERT INTO author (id, name) VALUES (2, 'Dropped')");
            session.rollbackToSavepoint(savepoint);

            assertEquals(Integer.valueOf(1), jdbc.queryForObject("SELECT COUNT(*) FROM author", Integer.class));
            assertThrows(TransactionSystemException.class, () -> session.rollbackToSavepoint(savepoint));
        }
        finally
        {   session.rollback(status);
        }
    }
}
