package com.fhi.db_fixtures.exception;

import java.util.Set;

/**
 * A table-targeted record group mixes records with different key sets, which a single bulk
 * insert statement cannot carry.
 */
public class HeterogeneousRecordsException extends FixtureException
{
    private final String table;
    private final int recordIndex;

    public HeterogeneousRecordsException(String fixtureName, String table, int recordIndex,
                                         Set<String> actualKeys, Set<String> expectedKeys)
    {   super(Cause.HETEROGENEOUS_RECORDS, fixtureName,
              Cause.HETEROGENEOUS_RECORDS.format(fixtureName, table, recordIndex, actualKeys, expectedKeys),
              null);
        this.table = table;
        this.recordIndex = recordIndex;
    }

    public String getTable()
    {   return table;
    }

    /**
     * Zero-based index of the first record whose keys differ from record #0.
     */
    public int getRecordIndex()
    {   return recordIndex;
    }
}
