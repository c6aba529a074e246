package com.questrail.acars.splitter.cli;

/**
 * Process exit statuses of {@code acars-splitter}.
 */
public enum ExitCode {
    /** Clean shutdown, or offline split completed. */
    SUCCESS(0),
    /** Command-line arguments were invalid. */
    USAGE(1),
    /** Configuration missing or invalid; nothing was bound. */
    CONFIG_ERROR(2),
    /** Offline input file missing or unreadable. */
    INPUT_ERROR(3),
    /** Output directory could not be created. */
    OUTPUT_ERROR(4);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
