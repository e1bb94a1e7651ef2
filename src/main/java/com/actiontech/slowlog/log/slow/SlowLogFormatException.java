/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

import java.io.IOException;

/**
 * A header line of the slow log could not be parsed and the stream is aborted.
 */
public class SlowLogFormatException extends IOException {
    private static final long serialVersionUID = -3285310786549221732L;

    private final long lineNumber;

    public SlowLogFormatException(long lineNumber, String line, Throwable cause) {
        super("malformed slow log line " + lineNumber + ": " + line, cause);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
