package com.fhi.model_builder.test_app.repo;

import org.springframework.data.jpa.repository.JpaRepository;

import com.fhi.model_builder.test_app.model.Journal;

public interface JournalRepository extends JpaRepository<Journal, Long>
{}
