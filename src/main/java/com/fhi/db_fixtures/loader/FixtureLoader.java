package com.fhi.db_fixtures.loader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fhi.db_fixtures.materialize.RecordMaterializer;
import com.fhi.db_fixtures.materialize.SchemaContext;
import com.fhi.db_fixtures.model.FixtureFile;
import com.fhi.db_fixtures.model.FixtureSet;
import com.fhi.db_fixtures.model.RecordGroup;
import com.fhi.db_fixtures.parser.FixtureParser;
import com.fhi.db_fixtures.resolve.FixtureFileResolver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;


/**
 * Loads the fixture files of a {@link FixtureSet} into the database.
 *
 * <p>For every fixture name, in declaration order:</p>
 * <ol>
 *   <li>resolve the name to a file in the search directories ({@link FixtureFileResolver}),</li>
 *   <li>parse it into record groups ({@link FixtureParser}),</li>
 *   <li>write each group, in file order ({@link RecordMaterializer}), flushing the persistence
 *       context after every group.</li>
 * </ol>
 *
 * <p>The flush makes each group visible to the next: a table group inserted by plain SQL can
 * reference model instances persisted just before it, and a model group can reference rows of an
 * earlier table group. Since the last group of a file is flushed too, every file is fully written
 * before the next one is resolved.</p>
 *
 * <h3>Transactions</h3>
 * <p>The loader opens no transaction of its own. It writes through whatever transaction is bound to
 * the current thread, normally the one opened by
 * {@link com.fhi.db_fixtures.lifecycle.FixtureLifecycleManager}, which also decides whether the
 * data is later rolled back or deleted.</p>
 *
 * <p>Stateless apart from its configuration; thread-safe.</p>
 */
@Slf4j
public class FixtureLoader
{
    private final FixtureFileResolver resolver;
    private final FixtureParser parser;
    private final RecordMaterializer materializer;

    /**
     * Fixture directories in priority order.
     */
    @Getter
    private final List<Path> searchDirs;


    public FixtureLoader(FixtureFileResolver resolver, FixtureParser parser, RecordMaterializer materializer,
                         List<Path> searchDirs)
    {
        this.resolver = resolver;
        this.parser = parser;
        this.materializer = materializer;
        this.searchDirs = List.copyOf(searchDirs);
    }


    /**
     * Loads every fixture of {@code set}.
     *
     * <p>Stops at the first failure; what was written before it stays in the current transaction
     * and is discarded by whoever rolls that transaction back.</p>
     *
     * @param set    fixture names in load order
     * @param schema database access for the materializer
     * @return counts per file and the targets written to
     *
     * @throws com.fhi.db_fixtures.exception.FixtureNotFoundException if a name resolves to no file
     * @throws com.fhi.db_fixtures.exception.FixtureFormatException   if a file is malformed
     * @throws com.fhi.db_fixtures.exception.FixtureException         for any other fixture problem
     * @throws org.springframework.dao.DataAccessException            if the database rejects a row
     */
    public LoadReport load(FixtureSet set, SchemaContext schema)
    {
        if (set.isEmpty())
        {   log.debug("No fixtures declared for {}", set.getOwner());
            return LoadReport.empty();
        }

        LoadReport.Builder report = LoadReport.builder();
        for (String name : set.getNames())
        {
            Path path = resolver.resolve(name, searchDirs);
            FixtureFile file = parser.parse(path);

            List<Integer> counts = new ArrayList<>(file.getGroups().size());
            for (RecordGroup group : file.getGroups())
            {   counts.add(materializer.materialize(group, schema));
                report.touched(group.getTarget());
                schema.flush();
            }

            report.file(file.getName(), path, counts);
            log.info("Loaded fixture {} for {}: {} record(s) in {} group(s)", path, set.getOwner(),
                     counts.stream().mapToInt(Integer::intValue).sum(), counts.size());
        }
        return report.build();
    }
}
