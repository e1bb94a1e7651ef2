/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.model;

import java.time.Instant;

/**
 * Execution statistics of one slow log entry, as written in its header lines.
 */
public final class QueryStats {
    private final String user;
    private final String host;
    private final Instant timestamp;
    private final double queryTime;
    private final double lockTime;
    private final long rowsSent;
    private final long rowsExamined;

    public QueryStats(String user, String host, Instant timestamp, double queryTime, double lockTime, long rowsSent, long rowsExamined) {
        this.user = user;
        this.host = host;
        this.timestamp = timestamp;
        this.queryTime = queryTime;
        this.lockTime = lockTime;
        this.rowsSent = rowsSent;
        this.rowsExamined = rowsExamined;
    }

    public String getUser() {
        return user;
    }

    public String getHost() {
        return host;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return seconds
     */
    public double getQueryTime() {
        return queryTime;
    }

    /**
     * @return seconds
     */
    public double getLockTime() {
        return lockTime;
    }

    /**
     * row counts are never negative and at most {@link Long#MAX_VALUE}, a larger count makes the statistics line malformed
     */
    public long getRowsSent() {
        return rowsSent;
    }

    public long getRowsExamined() {
        return rowsExamined;
    }

    @Override
    public String toString() {
        return "QueryStats{" +
                "user='" + user + '\'' +
                ", host='" + host + '\'' +
                ", timestamp=" + timestamp +
                ", queryTime=" + queryTime +
                ", lockTime=" + lockTime +
                ", rowsSent=" + rowsSent +
                ", rowsExamined=" + rowsExamined +
                '}';
    }
}
