/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.statistic;

import com.actiontech.slowlog.model.CanonicalQuery;
import com.actiontech.slowlog.model.QueryStats;

import java.time.Instant;

/**
 * Running totals of every query sharing one fingerprint.
 */
public class QueryDigest {
    private final String fingerprint;
    private final String canonicalSql;
    private final String exampleSql;

    private long count;
    private double totalQueryTime;
    private double maxQueryTime;
    private double totalLockTime;
    private long totalRowsSent;
    private long totalRowsExamined;
    private Instant firstSeen;
    private Instant lastSeen;

    QueryDigest(CanonicalQuery first) {
        this.fingerprint = first.getFingerprint();
        this.canonicalSql = first.getCanonicalSql();
        this.exampleSql = first.getSql();
    }

    void add(CanonicalQuery query) {
        QueryStats stats = query.getStats();
        count++;
        totalQueryTime += stats.getQueryTime();
        maxQueryTime = Math.max(maxQueryTime, stats.getQueryTime());
        totalLockTime += stats.getLockTime();
        totalRowsSent += stats.getRowsSent();
        totalRowsExamined += stats.getRowsExamined();
        Instant time = stats.getTimestamp();
        if (firstSeen == null || time.isBefore(firstSeen)) {
            firstSeen = time;
        }
        if (lastSeen == null || time.isAfter(lastSeen)) {
            lastSeen = time;
        }
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getCanonicalSql() {
        return canonicalSql;
    }

    /**
     * @return the original text of the first query seen
     */
    public String getExampleSql() {
        return exampleSql;
    }

    public long getCount() {
        return count;
    }

    public double getTotalQueryTime() {
        return totalQueryTime;
    }

    public double getMaxQueryTime() {
        return maxQueryTime;
    }

    public double getAvgQueryTime() {
        return count == 0 ? 0 : totalQueryTime / count;
    }

    public double getAvgLockTime() {
        return count == 0 ? 0 : totalLockTime / count;
    }

    public long getAvgRowsSent() {
        return count == 0 ? 0 : totalRowsSent / count;
    }

    public long getAvgRowsExamined() {
        return count == 0 ? 0 : totalRowsExamined / count;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }
}
