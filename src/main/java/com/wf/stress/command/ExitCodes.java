package com.wf.stress.command;

/**
 * Process exit statuses.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int CONFIG_ERROR = 2;
    /** 128 + SIGINT, matching what the shell reports for an interrupted process. */
    public static final int INTERRUPTED = 130;

    private ExitCodes() {
    }
}
