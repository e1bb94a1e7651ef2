/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

import com.actiontech.slowlog.model.QueryStats;

public final class RawEntry {
    private final String sql;
    private final QueryStats stats;
    private final boolean statsMalformed;

    RawEntry(String sql, QueryStats stats, boolean statsMalformed) {
        this.sql = sql;
        this.stats = stats;
        this.statsMalformed = statsMalformed;
    }

    /**
     * @return the accumulated statement text, trimmed and never empty
     */
    public String getSql() {
        return sql;
    }

    public QueryStats getStats() {
        return stats;
    }

    /**
     * @return true if a statistics line of this entry could not be parsed, so {@link #getStats()} is not its own
     */
    public boolean isStatsMalformed() {
        return statsMalformed;
    }
}
