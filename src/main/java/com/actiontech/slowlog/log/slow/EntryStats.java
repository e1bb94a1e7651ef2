/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

import com.actiontech.slowlog.model.QueryStats;

import java.time.Instant;

/**
 * Statistics of the entry being assembled. Every field keeps its value until a header line replaces it.
 */
public class EntryStats {
    private String user = "";
    private String host = "";
    // placeholder until the first "# Time:" line
    private Instant timestamp = Instant.now();
    private double queryTime;
    private double lockTime;
    private long rowsSent;
    private long rowsExamined;

    public QueryStats snapshot() {
        return new QueryStats(user, host, timestamp, queryTime, lockTime, rowsSent, rowsExamined);
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getQueryTime() {
        return queryTime;
    }

    public void setQueryTime(double queryTime) {
        this.queryTime = queryTime;
    }

    public double getLockTime() {
        return lockTime;
    }

    public void setLockTime(double lockTime) {
        this.lockTime = lockTime;
    }

    public long getRowsSent() {
        return rowsSent;
    }

    public void setRowsSent(long rowsSent) {
        this.rowsSent = rowsSent;
    }

    public long getRowsExamined() {
        return rowsExamined;
    }

    public void setRowsExamined(long rowsExamined) {
        this.rowsExamined = rowsExamined;
    }
}
