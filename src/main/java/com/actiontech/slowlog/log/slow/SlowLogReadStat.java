/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

/**
 * Counters of one processing run.
 */
public class SlowLogReadStat {
    private long lines;
    private long emitted;
    private long unparsable;
    private long malformedStats;
    private boolean trailingDiscarded;

    void incLines() {
        lines++;
    }

    void incEmitted() {
        emitted++;
    }

    void incUnparsable() {
        unparsable++;
    }

    void incMalformedStats() {
        malformedStats++;
    }

    void setTrailingDiscarded(boolean trailingDiscarded) {
        this.trailingDiscarded = trailingDiscarded;
    }

    public long getLines() {
        return lines;
    }

    /**
     * @return entries handed to the sink
     */
    public long getEmitted() {
        return emitted;
    }

    /**
     * @return entries skipped because their statement could not be normalized
     */
    public long getUnparsable() {
        return unparsable;
    }

    /**
     * @return statistics lines that could not be parsed, each one drops the entry it belongs to if that entry has statement text
     */
    public long getMalformedStats() {
        return malformedStats;
    }

    /**
     * @return true if statement text was left over at end of input with no boundary line after it
     */
    public boolean isTrailingDiscarded() {
        return trailingDiscarded;
    }

    @Override
    public String toString() {
        return "lines=" + lines + ", emitted=" + emitted + ", unparsable=" + unparsable +
                ", malformedStats=" + malformedStats + ", trailingDiscarded=" + trailingDiscarded;
    }
}
