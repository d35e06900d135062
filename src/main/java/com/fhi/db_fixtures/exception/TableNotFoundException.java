package com.fhi.db_fixtures.exception;

public class TableNotFoundException extends FixtureException
{
    private final String table;

    public TableNotFoundException(String fixtureName, String table)
    {   super(Cause.TABLE_NOT_FOUND, fixtureName, Cause.TABLE_NOT_FOUND.format(fixtureName, table), null);
        this.table = table;
    }

    public String getTable()
    {   return table;
    }
}
