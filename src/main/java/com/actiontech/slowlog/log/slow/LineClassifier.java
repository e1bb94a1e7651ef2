/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless matchers over a single slow log line.
 * <p>
 * The header layout is the one mysqld writes:
 * <pre>
 * # Time: 2021-07-01T00:00:00.000000Z
 * # User@Host: user[user] @  [192.168.89.201]  Id: 541085
 * # Query_time: 0.997582  Lock_time: 0.000284 Rows_sent: 1  Rows_examined: 410716
 * </pre>
 */
public final class LineClassifier {
    private static final Pattern BINARY_PATTERN = Pattern.compile("^/");
    private static final Pattern SET_PATTERN = Pattern.compile("^SET (?:last_insert_id|insert_id|timestamp)");
    private static final Pattern USE_PATTERN = Pattern.compile("^use ", Pattern.CASE_INSENSITIVE);
    private static final Pattern TCP_PATTERN = Pattern.compile("^(?:Tcp|Time)", Pattern.CASE_INSENSITIVE);

    private static final Pattern TIME_PATTERN = Pattern.compile("#\\sTime: (\\d{4})-(\\d{2})-(\\d{2})T(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d+)Z");
    private static final Pattern USER_HOST_PATTERN = Pattern.compile("User@Host: (.+?)\\s+@\\s+\\[(.+?)\\]");
    private static final Pattern STATS_PATTERN = Pattern.compile("#\\sQuery_time: ([0-9.]+)  Lock_time: ([0-9.]+) Rows_sent: ([0-9]+)  Rows_examined: ([0-9]+)");

    private LineClassifier() {
    }

    /**
     * classify one line, noise first, then the header extractors, anything else is statement text
     *
     * @throws NumberFormatException when a statistics line carries a number that can not be parsed
     */
    public static SlowLogLine classify(String line) {
        if (isNoise(line)) {
            return SlowLogLine.noise();
        }
        Instant timestamp = parseTimestamp(line);
        if (timestamp != null) {
            return SlowLogLine.timestamp(timestamp);
        }
        SlowLogLine userHost = parseUserHost(line);
        if (userHost != null) {
            return userHost;
        }
        SlowLogLine stats = parseQueryStats(line);
        if (stats != null) {
            return stats;
        }
        return SlowLogLine.statement(line);
    }

    public static boolean isNoise(String line) {
        return matchBinary(line) || matchSet(line) || matchUse(line) || matchTcp(line);
    }

    static boolean matchBinary(String line) {
        return BINARY_PATTERN.matcher(line).find();
    }

    static boolean matchSet(String line) {
        return SET_PATTERN.matcher(line).find();
    }

    static boolean matchUse(String line) {
        return USE_PATTERN.matcher(line).find();
    }

    static boolean matchTcp(String line) {
        return TCP_PATTERN.matcher(line).find();
    }

    /**
     * @return the UTC instant truncated to seconds, or null if the line is not a valid time header
     */
    static Instant parseTimestamp(String line) {
        Matcher matcher = TIME_PATTERN.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        try {
            LocalDateTime time = LocalDateTime.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    Integer.parseInt(matcher.group(4)),
                    Integer.parseInt(matcher.group(5)),
                    Integer.parseInt(matcher.group(6)));
            return time.toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            return null;
        }
    }

    static SlowLogLine parseUserHost(String line) {
        Matcher matcher = USER_HOST_PATTERN.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        return SlowLogLine.userHost(matcher.group(1), matcher.group(2));
    }

    /**
     * @throws NumberFormatException if a row count exceeds {@link Long#MAX_VALUE}
     */
    static SlowLogLine parseQueryStats(String line) {
        Matcher matcher = STATS_PATTERN.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        double queryTime = Double.parseDouble(matcher.group(1));
        double lockTime = Double.parseDouble(matcher.group(2));
        long rowsSent = Long.parseLong(matcher.group(3));
        long rowsExamined = Long.parseLong(matcher.group(4));
        return SlowLogLine.stats(queryTime, lockTime, rowsSent, rowsExamined);
    }
}
