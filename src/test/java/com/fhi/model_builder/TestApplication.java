package com.fhi.model_builder;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Boots the library against the entities of {@code test_app}.
 */
@SpringBootApplication
public class TestApplication
{}
