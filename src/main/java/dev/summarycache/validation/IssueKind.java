package dev.summarycache.validation;

/**
 * Every problem the validator can report. The severity of a kind is fixed.
 */
public enum IssueKind {
    /** Payload is not well-formed JSON or does not bind to its record type. */
    UNREADABLE_RECORD(Severity.CRITICAL),
    /** {@code videoId} or {@code channelId} is absent or blank. */
    MISSING_REQUIRED_FIELD(Severity.CRITICAL),
    /** {@code title} is absent. */
    MISSING_DISPLAY_FIELD(Severity.WARNING),
    /** {@code processed} is set but the summary is empty. */
    PROCESSED_WITHOUT_SUMMARY(Severity.WARNING),
    /** Two keys hold a record with the same {@code videoId}. */
    DUPLICATE_VIDEO_ID(Severity.WARNING),
    /** The last-sync timestamp is ahead of the device clock. */
    FUTURE_SYNC_TIMESTAMP(Severity.INFO);

    private final Severity severity;

    IssueKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
