package com.atlas.eventmodel;

import java.util.List;

/**
 * A webhook event is missing fields its {@code webhook_events} row requires.
 */
public class InvalidEventException extends RuntimeException {

    private final List<String> problems;

    public InvalidEventException(List<String> problems) {
        super("Invalid webhook event: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
