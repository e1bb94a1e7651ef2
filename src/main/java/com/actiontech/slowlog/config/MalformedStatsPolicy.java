/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.config;

import java.util.Locale;

/**
 * What to do with a "# Query_time:" line whose numbers can not be parsed.
 */
public enum MalformedStatsPolicy {
    /**
     * drop the entry the line belongs to and go on with the stream
     */
    SKIP,
    /**
     * fail the whole processing call
     */
    ABORT;

    /**
     * @return null if the name is unknown
     */
    public static MalformedStatsPolicy of(String name) {
        if (name == null) {
            return null;
        }
        for (MalformedStatsPolicy policy : values()) {
            if (policy.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return policy;
            }
        }
        return null;
    }
}
