/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

import java.time.Instant;

/**
 * One classified line of a slow query log. Only the fields matching {@link #getType()} are set.
 */
public final class SlowLogLine {
    private static final SlowLogLine NOISE_LINE = new SlowLogLine(LineType.NOISE);

    private final LineType type;
    private Instant timestamp;
    private String user;
    private String host;
    private double queryTime;
    private double lockTime;
    private long rowsSent;
    private long rowsExamined;
    private String text;

    private SlowLogLine(LineType type) {
        this.type = type;
    }

    static SlowLogLine noise() {
        return NOISE_LINE;
    }

    static SlowLogLine timestamp(Instant timestamp) {
        SlowLogLine line = new SlowLogLine(LineType.TIMESTAMP);
        line.timestamp = timestamp;
        return line;
    }

    static SlowLogLine userHost(String user, String host) {
        SlowLogLine line = new SlowLogLine(LineType.USER_HOST);
        line.user = user;
        line.host = host;
        return line;
    }

    static SlowLogLine stats(double queryTime, double lockTime, long rowsSent, long rowsExamined) {
        SlowLogLine line = new SlowLogLine(LineType.STATS);
        line.queryTime = queryTime;
        line.lockTime = lockTime;
        line.rowsSent = rowsSent;
        line.rowsExamined = rowsExamined;
        return line;
    }

    static SlowLogLine statement(String text) {
        SlowLogLine line = new SlowLogLine(LineType.STATEMENT);
        line.text = text;
        return line;
    }

    public LineType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getUser() {
        return user;
    }

    public String getHost() {
        return host;
    }

    public double getQueryTime() {
        return queryTime;
    }

    public double getLockTime() {
        return lockTime;
    }

    public long getRowsSent() {
        return rowsSent;
    }

    public long getRowsExamined() {
        return rowsExamined;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "SlowLogLine{type=" + type + ", text=" + text + "}";
    }
}
