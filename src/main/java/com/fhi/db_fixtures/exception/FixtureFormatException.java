package com.fhi.db_fixtures.exception;

/**
 * A fixture file could not be decoded, or its content does not have the expected shape.
 */
public class FixtureFormatException extends FixtureException
{
    public FixtureFormatException(String fixtureName, String problem, Throwable cause)
    {   super(Cause.FORMAT, fixtureName, Cause.FORMAT.format(fixtureName, problem), cause);
    }


    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

    public static FixtureFormatException of(String fixtureName, String problem)
    {   return new FixtureFormatException(fixtureName, problem, null);
    }

    /**
     * Problem located in a given record group of the file.
     */
    public static FixtureFormatException inGroup(String fixtureName, int groupIndex, String problem)
    {   return new FixtureFormatException(fixtureName, "group #" + groupIndex + ": " + problem, null);
    }

    /**
     * @param cause the decoder error, pass null if none.
     */
    public static FixtureFormatException unreadable(String fixtureName, Throwable cause)
    {   String detail = (cause != null && cause.getMessage() != null) ? cause.getMessage() : "unreadable content";
        return new FixtureFormatException(fixtureName, detail, cause);
    }
}
