package io.downloader4j.core;

public enum JobState {

    PENDING("Pending"),
    IN_PROGRESS("InProgress"),
    SUCCESS("Success"),
    FAILED("Failed");

    private final String value;

    JobState(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
