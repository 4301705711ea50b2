package com.example.meetingscheduler.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;

/**
 * Ordered strategies for one field. A strategy that throws is logged and treated as "no match",
 * so a broken rule never aborts the whole parse.
 */
public class ExtractorChain<T> {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorChain.class);

    private final String field;
    private final List<FieldExtractor<T>> strategies;

    public ExtractorChain(String field, List<FieldExtractor<T>> strategies) {
        this.field = field;
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Result of the first strategy that returns a non-null value, or null.
     */
    public T firstMatch(String text, LocalDate today) {
        for (int i = 0; i < strategies.size(); i++) {
            T value = apply(i, text, today);
            if (value != null) {
                logger.debug("Field '{}' resolved by strategy #{}: {}", field, i, value);
                return value;
            }
        }
        return null;
    }

    private T apply(int index, String text, LocalDate today) {
        try {
            return strategies.get(index).extract(text, today);
        } catch (RuntimeException e) {
            logger.warn("Extractor #{} for field '{}' failed, treating as absent: {}", index, field, e.getMessage());
            return null;
        }
    }
}
