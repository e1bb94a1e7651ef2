/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

public enum LineType {
    NOISE,
    TIMESTAMP,
    USER_HOST,
    STATS,
    STATEMENT
}
