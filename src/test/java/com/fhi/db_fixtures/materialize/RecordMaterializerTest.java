package com.fhi.db_fixtures.materialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.db_fixtures.exception.FixtureFormatException;
import com.fhi.db_fixtures.exception.HeterogeneousRecordsException;
import com.fhi.db_fixtures.exception.ModelNotFoundException;
import com.fhi.db_fixtures.exception.TableNotFoundException;
import com.fhi.db_fixtures.model.FixtureTarget;
import com.fhi.db_fixtures.model.RecordGroup;
import com.fhi.db_fixtures.sample.model.Author;
import com.fhi.db_fixtures.sample.model.Book;
import com.fhi.db_fixtures.sample.repo.AuthorRepository;
import com.fhi.db_fixtures.sample.repo.BookRepository;

import jakarta.persistence.PersistenceException;
import jakarta.validation.ConstraintViolationException;


/**
 * Runs inside the test's own transaction, rolled back by Spring after each test.
 */
@SpringBootTest
@Transactional
class RecordMaterializerTest
{
    @Autowired
    private SchemaContext schema;

    @Autowired
    private AuthorRepository authorRepository;

    @Autowired
    private BookRepository bookRepository;

    private final RecordMaterializer materializer = new RecordMaterializer();


    @Test
    @DisplayName("A table group is inserted as plain rows, dates converted from ISO strings")
    void insertsTableRows()
    {
        int written = materializer.materialize(group(FixtureTarget.table("author"),
                record("id", 1, "name", "Ursula K. Le Guin", "born", "1929-10-21"),
                record("id", 2, "name", "Terry Pratchett", "born", null)), schema);

        assertEquals(2, written);
        assertEquals(2, countRows("author"));
        schema.clear();
        Author author = authorRepository.findById(1L).orElseThrow();
        assertEquals("Ursula K. Le Guin", author.getName());
        assertEquals(LocalDate.of(1929, 10, 21), author.getBorn());
        assertNull(authorRepository.findById(2L).orElseThrow().getBorn());
    }


    @Test
    void tableNameAndColumnsAreCaseInsensitive()
    {
        materializer.materialize(group(FixtureTarget.table("AUTHOR"), record("ID", 7, "Name", "Iain M. Banks")), schema);

        assertEquals(1, countRows("author"));
    }


    @Test
    @DisplayName("Table rows bypass entity defaults")
    void tableRowsGetNoEntityDefaults()
    {
        materializer.materialize(group(FixtureTarget.table("author"), record("id", 1, "name", "Le Guin")), schema);
        materializer.materialize(group(FixtureTarget.table("book"), record("title", "Lavinia", "author_id", 1)), schema);

        schema.clear();
        assertNull(bookRepository.findAll().get(0).getStatus());
    }


    @Test
    @DisplayName("Heterogeneous table group is rejected before anything is written")
    void rejectsHeterogeneousTableGroup()
    {
        HeterogeneousRecordsException e = assertThrows(HeterogeneousRecordsException.class,
                () -> materializer.materialize(group(FixtureTarget.table("author"),
                        record("id", 10, "name", "A"),
                        record("id", 11, "name", "B"),
                        record("id", 12)), schema));

        assertEquals("author", e.getTable());
        assertEquals(2, e.getRecordIndex());
        assertEquals(0, countRows("author"));
    }


    @Test
    void rejectsUnknownColumn()
    {
        FixtureFormatException e = assertThrows(FixtureFormatException.class,
                () -> materializer.materialize(group(FixtureTarget.table("author"), record("id", 1, "nickname", "x")), schema));

        assertTrue(e.getMessage().contains("nickname"));
        assertEquals(0, countRows("author"));
    }


    @Test
    void rejectsUnknownTable()
    {
        TableNotFoundException e = assertThrows(TableNotFoundException.class,
                () -> materializer.materialize(group(FixtureTarget.table("no_such_table"), record("id", 1)), schema));

        assertEquals("no_such_table", e.getTable());
        assertEquals("inline.json", e.getFixtureName());
    }


    @Test
    void rejectsMalformedDate()
    {
        assertThrows(FixtureFormatException.class,
                () -> materializer.materialize(group(FixtureTarget.table("author"), record("id", 1, "name", "x", "born", "21/10/1929")), schema));
    }


    @Test
    @DisplayName("Model records get entity defaults and link to-one associations by join column or attribute")
    void persistsModelsWithAssociations()
    {
        materializer.materialize(group(FixtureTarget.table("author"), record("id", 1, "name", "Ursula K. Le Guin")), schema);
        schema.flush();

        int written = materializer.materialize(group(FixtureTarget.model("Book"),
                record("title", "A Wizard of Earthsea", "author_id", 1, "pageCount", 183),
                record("title", "The Tombs of Atuan", "author", 1, "status", "published"),
                record("title", "Untitled", "author_id", null)), schema);
        schema.flush();
        schema.clear();

        assertEquals(3, written);
        List<Book> books = bookRepository.findByAuthorId(1L);
        assertEquals(2, books.size());
        for (Book book : books)
        {   assertEquals("Ursula K. Le Guin", book.getAuthor().getName());
        }
        Book earthsea = books.stream().filter(b -> b.getTitle().equals("A Wizard of Earthsea")).findFirst().orElseThrow();
        assertEquals("draft", earthsea.getStatus());
        assertEquals(Integer.valueOf(183), earthsea.getPageCount());
        assertEquals(3, bookRepository.count());
    }


    @Test
    void modelResolvedByQualifiedName()
    {
        materializer.materialize(group(FixtureTarget.model(Author.class.getName()),
                record("id", 5, "name", "Octavia E. Butler", "born", "1947-06-22", "_note", "skipped silently")), schema);
        schema.flush();
        schema.clear();

        assertEquals(LocalDate.of(1947, 6, 22), authorRepository.findById(5L).orElseThrow().getBorn());
    }


    @Test
    void unknownModelPropertyIsSkipped()
    {
        materializer.materialize(group(FixtureTarget.model("Author"), record("id", 6, "name", "N. K. Jemisin", "isbn", "n/a")), schema);
        schema.flush();

        assertEquals(1, countRows("author"));
    }


    @Test
    void rejectsUnknownModel()
    {
        ModelNotFoundException e = assertThrows(ModelNotFoundException.class,
                () -> materializer.materialize(group(FixtureTarget.model("Bok"), record("title", "x")), schema));

        assertEquals("Bok", e.getModelName());
    }


    @Test
    @DisplayName("Model records go through bean validation")
    void modelRecordsAreValidated()
    {
        assertThrows(ConstraintViolationException.class,
                () -> materializer.materialize(group(FixtureTarget.model("Book"), record("title", "")), schema));
    }


    @Test
    @DisplayName("A model record may not set a generated id")
    void rejectsIdForGeneratedIdentifier()
    {
        FixtureFormatException e = assertThrows(FixtureFormatException.class,
                () -> materializer.materialize(group(FixtureTarget.model("Book"), record("id", 42, "title", "Lavinia")), schema));

        assertTrue(e.getMessage().contains("record #0"));
        assertTrue(e.getMessage().contains("'id'"));
        schema.flush();
        assertEquals(0, countRows("book"));
    }


    @Test
    @DisplayName("A model record repeating an existing id fails instead of overwriting the row")
    void duplicateModelIdFails()
    {
        materializer.materialize(group(FixtureTarget.table("author"), record("id", 1, "name", "First")), schema);
        schema.flush();

        assertThrows(PersistenceException.class, () ->
        {   materializer.materialize(group(FixtureTarget.model("Author"), record("id", 1, "name", "Second")), schema);
            schema.flush();
        });

        assertEquals("First", schema.getJdbcTemplate().queryForObject("SELECT name FROM author WHERE id = 1", String.class));
    }


    @Test
    void rejectsAssociationIdOfWrongType()
    {
        FixtureFormatException e = assertThrows(FixtureFormatException.class,
                () -> materializer.materialize(group(FixtureTarget.model("Book"), record("title", "T", "author_id", "abc")), schema));

        assertEquals("inline.json", e.getFixtureName());
        assertTrue(e.getMessage().contains("'author'"));
        assertTrue(e.getMessage().contains("abc"));
    }


    private int countRows(String table)
    {   return schema.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }


    @SafeVarargs
    private static RecordGroup group(FixtureTarget target, Map<String, Object>... records)
    {   return new RecordGroup("inline.json", 0, target, new ArrayList<>(List.of(records)));
    }


    private static Map<String, Object> record(Object... keysAndValues)
    {   Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2)
        {   record.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return record;
    }
}
