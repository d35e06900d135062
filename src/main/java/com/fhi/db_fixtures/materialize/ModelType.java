package com.fhi.db_fixtures.materialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.ToString;

/**
 * Everything the model path needs to know about one entity type: how to create an instance,
 * which property holds the identifier, and which to-one associations can be set from a
 * foreign-key value.
 */
@Getter
@ToString(of = { "entityName", "javaType" })
public final class ModelType
{
    /**
     * A to-one association ({@code @ManyToOne} / {@code @OneToOne}) that a record may set either by
     * its attribute name ({@code author: 1}) or by its join column ({@code author_id: 1}).
     */
    @Getter
    @ToString
    public static final class Association
    {
        private final String attributeName;
        private final String joinColumn;
        private final Class<?> targetType;
        private final Class<?> targetIdType;

        public Association(String attributeName, String joinColumn, Class<?> targetType, Class<?> targetIdType)
        {   this.attributeName = attributeName;
            this.joinColumn = joinColumn;
            this.targetType = targetType;
            this.targetIdType = targetIdType;
        }
    }

    private final String entityName;
    private final Class<?> javaType;
    private final Supplier<?> factory;

    /** Identifier property, {@code null} when the type has a composite id. */
    private final String idAttribute;

    /** Whether the database or the provider generates the identifier ({@code @GeneratedValue}). */
    private final boolean generatedId;

    private final Map<String, Association> associationsByKey;


    public ModelType(String entityName, Class<?> javaType, Supplier<?> factory, String idAttribute,
                     boolean generatedId, Iterable<Association> associations)
    {
        this.entityName = Objects.requireNonNull(entityName, "entityName");
        this.javaType = Objects.requireNonNull(javaType, "javaType");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.idAttribute = idAttribute;
        this.generatedId = generatedId;

        Map<String, Association> byKey = new LinkedHashMap<>();
        for (Association association : associations)
        {   byKey.put(association.getAttributeName(), association);
            if (association.getJoinColumn() != null)
            {   byKey.putIfAbsent(association.getJoinColumn().toLowerCase(Locale.ROOT), association);
            }
        }
        this.associationsByKey = Collections.unmodifiableMap(byKey);
    }


    public Object newInstance()
    {   return factory.get();
    }


    /**
     * Association addressed by a record key: exact attribute name first, then join column
     * (case-insensitive).
     */
    public Optional<Association> association(String key)
    {   Association byAttribute = associationsByKey.get(key);
        if (byAttribute != null) return Optional.of(byAttribute);
        return Optional.ofNullable(associationsByKey.get(key.toLowerCase(Locale.ROOT)));
    }
}
