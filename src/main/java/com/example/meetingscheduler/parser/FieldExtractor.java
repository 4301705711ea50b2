package com.example.meetingscheduler.parser;

import java.time.LocalDate;

/**
 * One independent strategy for reading a single field out of request text.
 * Returns null when the strategy does not apply.
 */
@FunctionalInterface
public interface FieldExtractor<T> {

    T extract(String text, LocalDate today);
}
