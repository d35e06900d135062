package com.fhi.db_fixtures.sample.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.db_fixtures.sample.model.Author;

public interface AuthorRepository extends JpaRepository<Author, Long>
{
}
