package com.whereq.scribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Scribe.
 * This service rewrites WordPress pages through an AI synthesis engine and publishes the result,
 * one page at a time or in concurrency-bounded bulk batches.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class ScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScribeApplication.class, args);
    }
}
