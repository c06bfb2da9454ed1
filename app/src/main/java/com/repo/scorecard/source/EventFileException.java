package com.repo.scorecard.source;

import java.io.IOException;

/**
 * Thrown when an entry in an events or roster file cannot be parsed.
 */
public class EventFileException extends IOException {

    private final String section;
    private final int index;

    public EventFileException(String section, int index, String message) {
        super(section + "[" + index + "]: " + message);
        this.section = section;
        this.index = index;
    }

    public EventFileException(String section, int index, String message, Throwable cause) {
        super(section + "[" + index + "]: " + message, cause);
        this.section = section;
        this.index = index;
    }

    /** The top-level list the bad entry belongs to, e.g. "deployments" */
    public String getSection() {
        return section;
    }

    public int getIndex() {
        return index;
    }
}
