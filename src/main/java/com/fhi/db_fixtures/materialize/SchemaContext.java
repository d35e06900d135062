package com.fhi.db_fixtures.materialize;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import com.fhi.db_fixtures.exception.ModelNotFoundException;
import com.fhi.db_fixtures.exception.TableNotFoundException;

import jakarta.persistence.EntityManager;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * What the materializer sees of the database: the persistence context for model records, a
 * {@link JdbcTemplate} for table records, and the lookups for both.
 *
 * <p>The {@code EntityManager} is expected to be Spring's shared, transaction-bound proxy and the
 * {@code JdbcTemplate} to sit on the same {@code DataSource}, so that both paths write through the
 * connection of the transaction the lifecycle manager opened.</p>
 *
 * <p>Table layouts are read once per table and cached for the life of the context.</p>
 */
@Slf4j
public class SchemaContext
{
    @Getter
    private final EntityManager entityManager;

    @Getter
    private final JdbcTemplate jdbcTemplate;

    @Getter
    private final ModelRegistry modelRegistry;

    private final Map<String, TableSchema> tables = new ConcurrentHashMap<>();


    public SchemaContext(EntityManager entityManager, JdbcTemplate jdbcTemplate, ModelRegistry modelRegistry)
    {   this.entityManager = entityManager;
        this.jdbcTemplate = jdbcTemplate;
        this.modelRegistry = modelRegistry;
    }


    /**
     * @param fixtureName file asking for the table, for the error message
     * @throws TableNotFoundException if the database has no such table
     */
    public TableSchema tableSchema(String fixtureName, String table)
    {
        String key = table.toLowerCase(Locale.ROOT);
        TableSchema cached = tables.get(key);
        if (cached != null) return cached;

        Optional<TableSchema> read = jdbcTemplate.execute((ConnectionCallback<Optional<TableSchema>>) con ->
                TableSchema.read(con.getMetaData(), con.getCatalog(), table));

        TableSchema schema = (read == null ? Optional.<TableSchema>empty() : read)
                .orElseThrow(() -> new TableNotFoundException(fixtureName, table));
        log.debug("Read layout of table {}: columns {}", schema.qualifiedName(), schema.getColumns().keySet());
        tables.put(key, schema);
        return schema;
    }


    /**
     * @throws ModelNotFoundException if no model is registered under {@code name}
     */
    public ModelType resolveModel(String fixtureName, String name)
    {   return modelRegistry.resolve(name)
                            .orElseThrow(() -> new ModelNotFoundException(fixtureName, name));
    }


    /**
     * Writes pending entity changes, so that SQL issued next sees them.
     */
    public void flush()
    {   entityManager.flush();
    }


    /**
     * Detaches all managed entities. Needed whenever rows are removed behind the persistence
     * context's back (savepoint rollback, bulk delete).
     */
    public void clear()
    {   entityManager.clear();
    }
}
