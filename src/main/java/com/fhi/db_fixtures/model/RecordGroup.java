package com.fhi.db_fixtures.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.ToString;

/**
 * One entry of a fixture file: a target plus the records to insert against it.
 *
 * <p>A record is a field name to scalar value mapping (String, Number, Boolean or null), kept in
 * file order. Records of a {@link FixtureTarget.Kind#TABLE TABLE} group must all share one key set;
 * that is checked when the group is materialized, not here.</p>
 */
@Getter
@ToString(exclude = "records")
public final class RecordGroup
{
    /** Name of the fixture file this group comes from. */
    private final String source;

    /** Zero-based position of the group in its file. */
    private final int index;

    private final FixtureTarget target;

    private final List<Map<String, Object>> records;


    public RecordGroup(String source, int index, FixtureTarget target, List<Map<String, Object>> records)
    {
        this.source = source;
        this.index = index;
        this.target = target;

        List<Map<String, Object>> copy = new ArrayList<>(records.size());
        for (Map<String, Object> record : records)
        {   copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        }
        this.records = Collections.unmodifiableList(copy);
    }

    public int size()
    {   return records.size();
    }
}
