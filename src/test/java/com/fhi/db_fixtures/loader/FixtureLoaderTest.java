package com.fhi.db_fixtures.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.db_fixtures.exception.FixtureFormatException;
import com.fhi.db_fixtures.exception.FixtureNotFoundException;
import com.fhi.db_fixtures.exception.HeterogeneousRecordsException;
import com.fhi.db_fixtures.exception.ModelNotFoundException;
import com.fhi.db_fixtures.exception.TableNotFoundException;
import com.fhi.db_fixtures.materialize.SchemaContext;
import com.fhi.db_fixtures.model.FixtureSet;
import com.fhi.db_fixtures.model.FixtureTarget;
import com.fhi.db_fixtures.sample.model.Book;
import com.fhi.db_fixtures.sample.repo.AuthorRepository;
import com.fhi.db_fixtures.sample.repo.BookRepository;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;


/**
 * The loader writes through the current transaction; here that is the test's, rolled back by
 * Spring after each test.
 */
@SpringBootTest
@Transactional
@Slf4j
class FixtureLoaderTest
{
    @Autowired
    private FixtureLoader loader;

    @Autowired
    private SchemaContext schema;

    @Autowired
    private AuthorRepository authorRepository;

    @Autowired
    private BookRepository bookRepository;


    @Test
    @DisplayName("One author row and three Book models referencing it")
    void loadsAuthorAndBooks()
    {
        LoadReport report = loader.load(FixtureSet.of("loadsAuthorAndBooks", "library"), schema);

        assertEquals(4, report.total());
        assertEquals(1, report.getFiles().size());
        assertEquals("library.json", report.getFiles().get(0).getName());
        assertEquals(List.of(1, 3), report.getFiles().get(0).getGroupCounts());
        assertEquals(List.of(FixtureTarget.table("author"), FixtureTarget.model("com.fhi.db_fixtures.sample.model.Book")),
                     report.getTouchedTargets());

        schema.clear();
        assertEquals(1, authorRepository.count());
        List<Book> books = bookRepository.findAll();
        assertEquals(3, books.size());
        for (Book book : books)
        {   log.debug("Book[id={}, title={}, author={}]", book.getId(), book.getTitle(), book.getAuthor().getName());
            assertEquals(Long.valueOf(1L), book.getAuthor().getId());
            assertEquals("Ursula K. Le Guin", book.getAuthor().getName());
        }
    }


    @Test
    @DisplayName("Fixtures load in declaration order across formats and directories")
    void loadsSeveralFilesInOrder()
    {
        LoadReport report = loader.load(FixtureSet.of("loadsSeveralFilesInOrder", "authors", "books", "more_authors"), schema);

        assertEquals(List.of("authors.json", "books.yaml", "more_authors.yml"),
                     report.getFiles().stream().map(LoadReport.FileResult::getName).collect(Collectors.toList()));
        assertTrue(report.getFiles().get(2).getPath().endsWith("fixtures/extra/more_authors.yml"));
        assertEquals(6, report.total());
        assertEquals(3, authorRepository.count());
        assertEquals(2, bookRepository.findByAuthorId(1L).size());
        assertEquals("published", bookRepository.findByAuthorId(2L).get(0).getStatus());
    }


    @Test
    void emptySetLoadsNothing()
    {
        LoadReport report = loader.load(FixtureSet.of("emptySetLoadsNothing"), schema);

        assertEquals(0, report.total());
        assertTrue(report.getTouchedTargets().isEmpty());
    }


    @Test
    void unknownFixtureName()
    {
        FixtureNotFoundException e = assertThrows(FixtureNotFoundException.class,
                () -> loader.load(FixtureSet.of("unknownFixtureName", "nobody"), schema));

        assertEquals(6, e.getCandidates().size());
    }


    @Test
    void heterogeneousGroupWritesNothing()
    {
        assertThrows(HeterogeneousRecordsException.class,
                () -> loader.load(FixtureSet.of("heterogeneousGroupWritesNothing", "heterogeneous"), schema));

        assertEquals(0, authorRepository.count());
    }


    @Test
    void malformedFile()
    {
        FixtureFormatException e = assertThrows(FixtureFormatException.class,
                () -> loader.load(FixtureSet.of("malformedFile", "malformed"), schema));

        assertEquals("malformed.json", e.getFixtureName());
    }


    @Test
    void unknownModelAndTable()
    {
        assertThrows(ModelNotFoundException.class,
                () -> loader.load(FixtureSet.of("unknownModelAndTable", "unknown_model"), schema));
        assertThrows(TableNotFoundException.class,
                () -> loader.load(FixtureSet.of("unknownModelAndTable", "unknown_table"), schema));
    }


    @Test
    @DisplayName("Model fixtures are validated like any other entity")
    void invalidModelRecord()
    {
        assertThrows(ConstraintViolationException.class,
                () -> loader.load(FixtureSet.of("invalidModelRecord", "invalid_book"), schema));
    }
}
