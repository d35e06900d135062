package com.fhi.db_fixtures.parser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhi.db_fixtures.exception.FixtureFormatException;
import com.fhi.db_fixtures.model.FixtureFile;
import com.fhi.db_fixtures.model.FixtureTarget;
import com.fhi.db_fixtures.model.RecordGroup;

import lombok.extern.slf4j.Slf4j;


/**
 * Decodes a fixture file into its record groups.
 *
 * <p>JSON and YAML files have the same structure:</p>
 * <pre>
 * - table: author                    # or  model: com.example.model.Book
 *   records:
 *     - { id: 1, name: "Ursula K. Le Guin" }
 *     - { id: 2, name: "Terry Pratchett" }
 * </pre>
 *
 * <p>Each group has exactly one of {@code table} / {@code model} and a {@code records} array of
 * objects whose values are scalars. Keys starting with {@code _} (e.g. {@code _comment}) are
 * ignored at group level. Anything else is reported as a {@link FixtureFormatException} naming the
 * file and the offending group.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
@Slf4j
public class FixtureParser
{
    private static final String KEY_TABLE   = "table";
    private static final String KEY_MODEL   = "model";
    private static final String KEY_RECORDS = "records";

    private final Map<FixtureFormat, ObjectMapper> mappers = new EnumMap<>(FixtureFormat.class);


    public FixtureParser()
    {   for (FixtureFormat format : FixtureFormat.values())
        {   mappers.put(format, FixtureObjectMappers.forFormat(format));
        }
    }


    /**
     * Parses one fixture file.
     *
     * @param file path of a {@code .json}, {@code .yaml} or {@code .yml} file
     * @return the file's record groups, in file order
     * @throws FixtureFormatException if the content cannot be decoded or has the wrong shape
     * @throws UncheckedIOException   if the file cannot be read
     */
    public FixtureFile parse(Path file)
    {
        String fileName = String.valueOf(file.getFileName());
        FixtureFormat format = FixtureFormat.fromPath(file)
                .orElseThrow(() -> FixtureFormatException.of(fileName, "unsupported file extension"));

        JsonNode root;
        try
        {   root = mappers.get(format).readTree(file.toFile());
        }
        catch (JsonProcessingException e)
        {   throw FixtureFormatException.unreadable(fileName, e);
        }
        catch (IOException e)
        {   throw new UncheckedIOException("Failed reading fixture file " + file, e);
        }

        if (root == null || root.isMissingNode())
        {   throw FixtureFormatException.of(fileName, "file is empty");
        }
        if (!root.isArray())
        {   throw FixtureFormatException.of(fileName, "top level must be a list of record groups, found " + root.getNodeType());
        }

        List<RecordGroup> groups = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++)
        {   groups.add(parseGroup(fileName, i, root.get(i)));
        }

        FixtureFile parsed = new FixtureFile(fileName, file, groups);
        log.debug("Parsed {}: {} group(s), {} record(s)", fileName, groups.size(), parsed.recordCount());
        return parsed;
    }


    private RecordGroup parseGroup(String fileName, int index, JsonNode node)
    {
        if (!node.isObject())
        {   throw FixtureFormatException.inGroup(fileName, index, "expected an object, found " + node.getNodeType());
        }

        Iterator<String> fieldNames = node.fieldNames();
        while (fieldNames.hasNext())
        {   String key = fieldNames.next();
            if (!key.startsWith("_") && !KEY_TABLE.equals(key) && !KEY_MODEL.equals(key) && !KEY_RECORDS.equals(key))
            {   throw FixtureFormatException.inGroup(fileName, index, "unexpected key '" + key + "'");
            }
        }

        boolean hasTable = node.has(KEY_TABLE);
        boolean hasModel = node.has(KEY_MODEL);
        if (hasTable && hasModel)
        {   throw FixtureFormatException.inGroup(fileName, index, "'table' and 'model' are mutually exclusive");
        }
        if (!hasTable && !hasModel)
        {   throw FixtureFormatException.inGroup(fileName, index, "one of 'table' or 'model' is required");
        }

        String key = hasTable ? KEY_TABLE : KEY_MODEL;
        JsonNode nameNode = node.get(key);
        if (!nameNode.isTextual() || nameNode.textValue().isBlank())
        {   throw FixtureFormatException.inGroup(fileName, index, "'" + key + "' must be a non-blank string");
        }
        String name = nameNode.textValue().trim();
        FixtureTarget target = hasTable ? FixtureTarget.table(name) : FixtureTarget.model(name);

        JsonNode recordsNode = node.get(KEY_RECORDS);
        if (recordsNode == null)
        {   throw FixtureFormatException.inGroup(fileName, index, "'records' is required");
        }
        if (!recordsNode.isArray())
        {   throw FixtureFormatException.inGroup(fileName, index, "'records' must be a list, found " + recordsNode.getNodeType());
        }

        List<Map<String, Object>> records = new ArrayList<>(recordsNode.size());
        for (int r = 0; r < recordsNode.size(); r++)
        {   records.add(parseRecord(fileName, index, r, recordsNode.get(r)));
        }
        return new RecordGroup(fileName, index, target, records);
    }


    private static Map<String, Object> parseRecord(String fileName, int groupIndex, int recordIndex, JsonNode node)
    {
        if (!node.isObject())
        {   throw FixtureFormatException.inGroup(fileName, groupIndex,
                    "record #" + recordIndex + " must be an object, found " + node.getNodeType());
        }

        Map<String, Object> record = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext())
        {   Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isContainerNode())
            {   throw FixtureFormatException.inGroup(fileName, groupIndex,
                        "record #" + recordIndex + ", field '" + field.getKey() + "': only scalar values are supported");
            }
            record.put(field.getKey(), toScalar(value));
        }
        return record;
    }


    private static Object toScalar(JsonNode value)
    {
        if (value.isNull())    return null;
        if (value.isBoolean()) return value.booleanValue();
        if (value.isNumber())  return value.numberValue();
        if (value.isTextual()) return value.textValue();
        return value.asText();
    }
}
