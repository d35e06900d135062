package com.fhi.db_fixtures.exception;

/**
 * Base class of every failure raised while resolving, parsing, materializing or scoping fixtures.
 *
 * <p>Each concrete subclass maps to one {@link Cause}. Tests usually catch the subclass; code that
 * only needs to report the problem can switch on {@link #getCauseEnum()}.</p>
 *
 * <p>All fixture errors are unchecked and are never retried: loading is deterministic, so a second
 * attempt would fail the same way.</p>
 */
public class FixtureException extends RuntimeException
{
    /**
     * Enum representing the specific reason why a fixture operation failed.
     */
    public enum Cause
    {
        FIXTURE_NOT_FOUND     ("Fixture '%s' not found (looked in: %s)"),
        FORMAT                ("Malformed fixture file '%s': %s"),
        HETEROGENEOUS_RECORDS ("Fixture '%s': records of table '%s' must all have the same keys; record #%d has %s, expected %s"),
        MODEL_NOT_FOUND       ("Fixture '%s': no model registered under '%s'"),
        TABLE_NOT_FOUND       ("Fixture '%s': table '%s' does not exist"),
        LIFECYCLE             ("Illegal fixture lifecycle call: %s");

        private final String messageTemplate;

        Cause(String messageTemplate)
        {   this.messageTemplate = messageTemplate;
        }

        public String format(Object... args)
        {   return String.format(messageTemplate, args);
        }

        public String getCode()
        {   return this.name();
        }
    }

    private final Cause causeEnum;

    /**
     * Name of the fixture file being processed, {@code null} for lifecycle errors.
     */
    private final String fixtureName;


    protected FixtureException(Cause causeEnum, String fixtureName, String message, Throwable cause)
    {   super(message, cause);
        this.causeEnum = causeEnum;
        this.fixtureName = fixtureName;
    }


    public Cause getCauseEnum()
    {   return causeEnum;
    }


    public String getFixtureName()
    {   return fixtureName;
    }


    /**
     * Returns the message of this exception followed, if present, by the message of its cause:
     * <pre>
     * FixtureFormatException: Main error message | Caused by: CauseClass: Cause message
     * </pre>
     */
    @Override
    public String toString()
    {
        String errMsg = String.format("%s: %s", this.getClass().getSimpleName(), this.getMessage());

        Throwable cause = getCause();
        if (     cause != null && cause.getMessage() != null
              && !cause.getMessage().isBlank())
        {  errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
        }
        return errMsg;
    }
}
