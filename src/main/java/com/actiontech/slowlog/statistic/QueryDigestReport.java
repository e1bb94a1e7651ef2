/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.statistic;

import com.google.common.base.Strings;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Plain text report of a {@link QueryDigestStat}, one block per fingerprint.
 */
public final class QueryDigestReport {
    private static final int WIDTH = 120;

    private QueryDigestReport() {
    }

    /**
     * @param topN print only the first topN digests, 0 or less prints all of them
     */
    public static String format(QueryDigestStat stat, int topN) {
        List<QueryDigest> digests = stat.getDigests();
        if (topN > 0 && digests.size() > topN) {
            digests = digests.subList(0, topN);
        }
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append("Aggregated Slow Query Report").append('\n');
        sb.append(Strings.repeat("=", WIDTH)).append("\n\n");
        for (QueryDigest digest : digests) {
            sb.append(digest.getCanonicalSql()).append("\n\n");
            line(sb, "Count:", String.valueOf(digest.getCount()));
            line(sb, "Avg query time:", seconds(digest.getAvgQueryTime()));
            line(sb, "Max query time:", seconds(digest.getMaxQueryTime()));
            line(sb, "Avg lock time:", seconds(digest.getAvgLockTime()));
            line(sb, "Avg rows sent:", String.valueOf(digest.getAvgRowsSent()));
            line(sb, "Avg rows examined:", String.valueOf(digest.getAvgRowsExamined()));
            line(sb, "Total query time:", seconds(digest.getTotalQueryTime()));
            sb.append('\n').append(Strings.repeat("-", WIDTH)).append("\n\n");
        }
        return sb.toString();
    }

    public static void print(QueryDigestStat stat, int topN, PrintStream out) {
        out.print(format(stat, topN));
        out.flush();
    }

    private static void line(StringBuilder sb, String name, String value) {
        sb.append("- ").append(Strings.padEnd(name, 20, ' ')).append(value).append('\n');
    }

    private static String seconds(double value) {
        return String.format(Locale.ROOT, "%.3fs", value);
    }
}
