package com.fhi.db_fixtures.model;

import java.util.Objects;

import lombok.Getter;

/**
 * What a record group is inserted into: either a raw table (bulk insert, no model logic)
 * or a model type (one entity instance per record).
 *
 * <p>Use the {@link #table(String)} and {@link #model(String)} factories.</p>
 */
@Getter
public final class FixtureTarget
{
    public enum Kind
    {
        /** Raw table, loaded with a single batched INSERT. */
        TABLE,

        /** Model (entity) type, loaded instance by instance through the persistence context. */
        MODEL
    }

    private final Kind kind;

    /**
     * Table name, or the qualified model type name.
     */
    private final String name;


    private FixtureTarget(Kind kind, String name)
    {   this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
    }

    public static FixtureTarget table(String tableName)
    {   return new FixtureTarget(Kind.TABLE, tableName);
    }

    public static FixtureTarget model(String qualifiedTypeName)
    {   return new FixtureTarget(Kind.MODEL, qualifiedTypeName);
    }

    public boolean isTable()
    {   return kind == Kind.TABLE;
    }

    public boolean isModel()
    {   return kind == Kind.MODEL;
    }


    @Override
    public boolean equals(Object o)
    {   if (this == o) return true;
        if (!(o instanceof FixtureTarget)) return false;
        FixtureTarget other = (FixtureTarget) o;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode()
    {   return Objects.hash(kind, name);
    }

    @Override
    public String toString()
    {   return kind.name().toLowerCase() + ":" + name;
    }
}
