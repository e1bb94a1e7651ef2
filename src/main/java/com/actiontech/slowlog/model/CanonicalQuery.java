/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.model;

/**
 * A slow log entry whose statement has been normalized.
 * <p>
 * Statements which differ only in their literal values share the same canonical sql and fingerprint.
 */
public final class CanonicalQuery {
    private final String sql;
    private final String canonicalSql;
    private final String fingerprint;
    private final QueryStats stats;

    public CanonicalQuery(String sql, String canonicalSql, String fingerprint, QueryStats stats) {
        this.sql = sql;
        this.canonicalSql = canonicalSql;
        this.fingerprint = fingerprint;
        this.stats = stats;
    }

    /**
     * @return the statement as it appeared in the log, trimmed
     */
    public String getSql() {
        return sql;
    }

    /**
     * @return the statement with every literal replaced by {@code ?}
     */
    public String getCanonicalSql() {
        return canonicalSql;
    }

    /**
     * @return lowercase hex digest of {@link #getCanonicalSql()}
     */
    public String getFingerprint() {
        return fingerprint;
    }

    public QueryStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "CanonicalQuery{" +
                "sql='" + sql + '\'' +
                ", canonicalSql='" + canonicalSql + '\'' +
                ", fingerprint='" + fingerprint + '\'' +
                ", stats=" + stats +
                '}';
    }
}
