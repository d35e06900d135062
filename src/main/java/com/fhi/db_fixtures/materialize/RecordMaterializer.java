package com.fhi.db_fixtures.materialize;

import java.io.IOException;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.PropertyAccessor;
import org.springframework.beans.PropertyAccessorFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhi.db_fixtures.exception.FixtureFormatException;
import com.fhi.db_fixtures.exception.HeterogeneousRecordsException;
import com.fhi.db_fixtures.model.RecordGroup;
import com.fhi.db_fixtures.parser.FixtureObjectMappers;

import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;


/**
 * Writes one record group to the database.
 *
 * <p><b>Table groups</b> become a single batched {@code INSERT}. All records must have the same
 * keys, every key must be a column of the table. The statement goes straight to JDBC: entity
 * defaults, validation and lifecycle callbacks do not apply, which is what you want for lookup
 * tables and for rows that are deliberately invalid.</p>
 *
 * <p><b>Model groups</b> become one entity per record, created through the model's factory (so
 * field initialisers provide defaults), populated with Jackson and handed to the
 * {@link EntityManager}. A key naming a to-one association, either by attribute ({@code author})
 * or by join column ({@code author_id}), takes the referenced id and is resolved to a reference of
 * the target entity.</p>
 *
 * <p>Model records are always inserted with {@code persist}: a record repeating the id of a row
 * that already exists fails, at the latest when the loader flushes. An id may only be given for
 * entities with an assigned identifier; setting a generated one is a format error.</p>
 *
 * <pre>
 * - table: author
 *   records:
 *     - { id: 1, name: "Ursula K. Le Guin" }
 * - model: Book
 *   records:
 *     - { title: "The Dispossessed", author_id: 1 }
 * </pre>
 *
 * <p>The materializer never flushes after writing; the loader does that between groups.</p>
 */
@Slf4j
public class RecordMaterializer
{
    private final ObjectMapper modelMapper;


    public RecordMaterializer()
    {   this(FixtureObjectMappers.model());
    }


    public RecordMaterializer(ObjectMapper modelMapper)
    {   this.modelMapper = modelMapper;
    }


    /**
     * @return number of rows (table group) or instances (model group) written
     * @throws HeterogeneousRecordsException  table group whose records differ in their keys
     * @throws com.fhi.db_fixtures.exception.TableNotFoundException  unknown table
     * @throws com.fhi.db_fixtures.exception.ModelNotFoundException  unknown model name
     * @throws FixtureFormatException         unknown column, or a value the target cannot take
     */
    public int materialize(RecordGroup group, SchemaContext schema)
    {
        return group.getTarget().isTable()
                ? insertRows(group, schema)
                : persistModels(group, schema);
    }


    // -----------------------------------------
    // Table path
    // -----------------------------------------

    private int insertRows(RecordGroup group, SchemaContext schema)
    {
        String source = group.getSource();
        String table = group.getTarget().getName();
        TableSchema tableSchema = schema.tableSchema(source, table);

        List<Map<String, Object>> records = group.getRecords();
        if (records.isEmpty())
        {   log.debug("{} group #{}: no records for table {}", source, group.getIndex(), table);
            return 0;
        }

        // Checked for the whole group before anything is written.
        Set<String> keys = records.get(0).keySet();
        for (int i = 1; i < records.size(); i++)
        {   Set<String> actual = records.get(i).keySet();
            if (!actual.equals(keys))
            {   throw new HeterogeneousRecordsException(source, table, i, new LinkedHashSet<>(actual), new LinkedHashSet<>(keys));
            }
        }
        if (keys.isEmpty())
        {   throw FixtureFormatException.inGroup(source, group.getIndex(), "records of table '" + table + "' have no fields");
        }

        List<TableSchema.Column> columns = new ArrayList<>(keys.size());
        for (String key : keys)
        {   columns.add(tableSchema.column(key).orElseThrow(() -> FixtureFormatException.inGroup(source, group.getIndex(),
                    "table '" + table + "' has no column '" + key + "'")));
        }

        String sql = "INSERT INTO " + tableSchema.qualifiedName()
                   + columns.stream().map(c -> tableSchema.quote(c.getName())).collect(Collectors.joining(", ", " (", ")"))
                   + columns.stream().map(c -> "?").collect(Collectors.joining(", ", " VALUES (", ")"));

        int[] argTypes = columns.stream().mapToInt(TableSchema.Column::getSqlType).toArray();
        List<Object[]> batchArgs = new ArrayList<>(records.size());
        for (int r = 0; r < records.size(); r++)
        {   Map<String, Object> record = records.get(r);
            Object[] args = new Object[columns.size()];
            int c = 0;
            for (String key : keys)
            {   args[c] = convert(group, r, key, record.get(key), argTypes[c]);
                c++;
            }
            batchArgs.add(args);
        }

        // Rows inserted by SQL must come after entities still pending in the persistence context.
        schema.flush();

        log.debug("{} group #{}: {}", source, group.getIndex(), sql);
        schema.getJdbcTemplate().batchUpdate(sql, batchArgs, argTypes);
        return records.size();
    }


    private static Object convert(RecordGroup group, int recordIndex, String key, Object value, int sqlType)
    {   try
        {   return ColumnValueConverter.convert(value, sqlType);
        }
        catch (DateTimeParseException e)
        {   throw new FixtureFormatException(group.getSource(),
                    "group #" + group.getIndex() + ": record #" + recordIndex + ", field '" + key + "': " + e.getMessage(), e);
        }
    }


    // -----------------------------------------
    // Model path
    // -----------------------------------------

    private int persistModels(RecordGroup group, SchemaContext schema)
    {
        String source = group.getSource();
        ModelType type = schema.resolveModel(source, group.getTarget().getName());
        EntityManager em = schema.getEntityManager();

        List<Map<String, Object>> records = group.getRecords();
        for (int r = 0; r < records.size(); r++)
        {
            Object instance = type.newInstance();
            PropertyAccessor fields = PropertyAccessorFactory.forDirectFieldAccess(instance);

            Map<String, Object> properties = new LinkedHashMap<>();
            Map<ModelType.Association, Object> links = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : records.get(r).entrySet())
            {   Optional<ModelType.Association> association = type.association(entry.getKey());
                if (association.isPresent())
                {   links.put(association.get(), entry.getValue());
                }
                else
                {   properties.put(entry.getKey(), entry.getValue());
                }
            }

            try
            {   JsonNode tree = modelMapper.valueToTree(properties);
                modelMapper.readerForUpdating(instance).readValue(tree);
            }
            catch (IOException | IllegalArgumentException e)
            {   throw new FixtureFormatException(source, "group #" + group.getIndex() + ": record #" + r
                        + " cannot be applied to " + type.getJavaType().getSimpleName() + ": " + e.getMessage(), e);
            }

            for (Map.Entry<ModelType.Association, Object> link : links.entrySet())
            {   ModelType.Association association = link.getKey();
                Object reference = link.getValue() == null
                        ? null
                        : em.getReference(association.getTargetType(), referencedId(group, r, association, link.getValue()));
                fields.setPropertyValue(association.getAttributeName(), reference);
            }

            if (type.isGeneratedId() && hasAssignedId(type, fields))
            {   throw FixtureFormatException.of(source, "group #" + group.getIndex() + ": record #" + r + " sets '"
                        + type.getIdAttribute() + "', which " + type.getJavaType().getSimpleName()
                        + " generates; leave it out or load the record as a table row");
            }
            em.persist(instance);
        }

        log.debug("{} group #{}: {} instance(s) of {}", source, group.getIndex(), records.size(), type.getJavaType().getName());
        return records.size();
    }


    private Object referencedId(RecordGroup group, int recordIndex, ModelType.Association association, Object value)
    {   try
        {   return modelMapper.convertValue(value, association.getTargetIdType());
        }
        catch (IllegalArgumentException e)
        {   throw new FixtureFormatException(group.getSource(), "group #" + group.getIndex() + ": record #" + recordIndex
                    + ", field '" + association.getAttributeName() + "': " + value + " is not a "
                    + association.getTargetIdType().getSimpleName() + " id of " + association.getTargetType().getSimpleName(), e);
        }
    }


    /**
     * A primitive id left at zero counts as unset.
     */
    private static boolean hasAssignedId(ModelType type, PropertyAccessor fields)
    {
        if (type.getIdAttribute() == null) return false;
        Object id = fields.getPropertyValue(type.getIdAttribute());
        if (id == null) return false;
        Class<?> idType = fields.getPropertyType(type.getIdAttribute());
        return !(idType != null && idType.isPrimitive() && id instanceof Number && ((Number) id).longValue() == 0L);
    }
}
