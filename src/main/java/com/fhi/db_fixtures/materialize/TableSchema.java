package com.fhi.db_fixtures.materialize;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;
import lombok.ToString;

/**
 * Column layout of one table, as reported by the JDBC driver.
 *
 * <p>Names are kept exactly as the database stores them ({@code AUTHOR} on H2, {@code author} on
 * PostgreSQL) and quoted when rendered, so generated SQL never depends on the database's
 * identifier folding. Lookups by fixture key are case-insensitive.</p>
 */
@Getter
@ToString
public final class TableSchema
{
    @Getter
    @ToString
    public static final class Column
    {
        private final String name;

        /** {@link java.sql.Types} constant. */
        private final int sqlType;

        Column(String name, int sqlType)
        {   this.name = name;
            this.sqlType = sqlType;
        }
    }

    private final String schemaName;
    private final String tableName;
    private final String quote;

    /** Keyed by lower-cased column name. */
    private final Map<String, Column> columns;


    TableSchema(String schemaName, String tableName, String quote, List<Column> columns)
    {
        this.schemaName = schemaName;
        this.tableName = tableName;
        this.quote = quote;
        Map<String, Column> byName = new LinkedHashMap<>();
        for (Column column : columns)
        {   byName.put(column.getName().toLowerCase(Locale.ROOT), column);
        }
        this.columns = Collections.unmodifiableMap(byName);
    }


    public Optional<Column> column(String key)
    {   return Optional.ofNullable(columns.get(key.toLowerCase(Locale.ROOT)));
    }


    /**
     * Table name ready to be used in SQL, schema-qualified when the fixture asked for a schema.
     */
    public String qualifiedName()
    {   return schemaName == null ? quote(tableName) : quote(schemaName) + "." + quote(tableName);
    }


    public String quote(String identifier)
    {   return quote + identifier + quote;
    }


    /**
     * Reads the columns of {@code requestedName} ({@code table} or {@code schema.table}).
     *
     * <p>The name is tried as given, then upper-cased, then lower-cased. When the table exists in
     * several schemas and none was requested, the first schema reported by the driver wins.</p>
     *
     * @return the schema, or empty if the table does not exist
     */
    static Optional<TableSchema> read(DatabaseMetaData metaData, String catalog, String requestedName) throws SQLException
    {
        String requestedSchema = null;
        String requestedTable = requestedName;
        int dot = requestedName.lastIndexOf('.');
        if (dot > 0)
        {   requestedSchema = requestedName.substring(0, dot);
            requestedTable = requestedName.substring(dot + 1);
        }

        String quoteString = metaData.getIdentifierQuoteString();
        String quote = (quoteString == null || quoteString.isBlank()) ? "" : quoteString.trim();

        for (String table : spellings(requestedTable))
        {   for (String schema : requestedSchema == null ? Collections.<String>singletonList(null) : spellings(requestedSchema))
            {
                String foundSchema = null;
                List<Column> columns = new ArrayList<>();
                try (ResultSet rs = metaData.getColumns(catalog, schema, table, null))
                {   while (rs.next())
                    {   String columnSchema = rs.getString("TABLE_SCHEM");
                        if (foundSchema == null)
                        {   foundSchema = columnSchema == null ? "" : columnSchema;
                        }
                        else if (!foundSchema.equals(columnSchema == null ? "" : columnSchema))
                        {   continue;   // same table name in another schema
                        }
                        columns.add(new Column(rs.getString("COLUMN_NAME"), rs.getInt("DATA_TYPE")));
                    }
                }
                if (!columns.isEmpty())
                {   String qualifier = requestedSchema == null ? null : foundSchema;
                    return Optional.of(new TableSchema(qualifier, table, quote, columns));
                }
            }
        }
        return Optional.empty();
    }


    private static List<String> spellings(String name)
    {   Set<String> out = new LinkedHashSet<>();
        out.add(name);
        out.add(name.toUpperCase(Locale.ROOT));
        out.add(name.toLowerCase(Locale.ROOT));
        return new ArrayList<>(out);
    }
}
