/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

/**
 * Mutable state of one log stream: the statement text since the last boundary and the current statistics.
 * Not thread safe, every processing run owns its own instance.
 */
public class EntryAccumulator {
    private final StringBuilder pendingText = new StringBuilder();
    private final EntryStats currentStats = new EntryStats();
    private boolean statsMalformed = false;

    public void append(String fragment) {
        pendingText.append(' ').append(fragment);
    }

    public void applyTimestamp(SlowLogLine line) {
        currentStats.setTimestamp(line.getTimestamp());
    }

    public void applyStats(SlowLogLine line) {
        currentStats.setQueryTime(line.getQueryTime());
        currentStats.setLockTime(line.getLockTime());
        currentStats.setRowsSent(line.getRowsSent());
        currentStats.setRowsExamined(line.getRowsExamined());
    }

    public void applyUserHost(SlowLogLine line) {
        currentStats.setUser(line.getUser());
        currentStats.setHost(line.getHost());
    }

    public void markStatsMalformed() {
        statsMalformed = true;
    }

    /**
     * take the statement collected so far together with the statistics as they stand now, then start over.
     *
     * @return null if nothing but whitespace was collected
     */
    public RawEntry drain() {
        String sql = pendingText.toString().trim();
        boolean malformed = statsMalformed;
        pendingText.setLength(0);
        statsMalformed = false;
        if (sql.isEmpty()) {
            return null;
        }
        return new RawEntry(sql, currentStats.snapshot(), malformed);
    }

    public boolean hasPendingText() {
        for (int i = 0; i < pendingText.length(); i++) {
            if (!Character.isWhitespace(pendingText.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    EntryStats getCurrentStats() {
        return currentStats;
    }
}
