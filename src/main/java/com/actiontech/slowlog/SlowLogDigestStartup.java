/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */
package com.actiontech.slowlog;

import com.actiontech.slowlog.config.SlowLogConfig;
import com.actiontech.slowlog.config.SlowLogConfigLoader;
import com.actiontech.slowlog.log.slow.SlowLogReadStat;
import com.actiontech.slowlog.model.CanonicalQuery;
import com.actiontech.slowlog.statistic.CanonicalQueryJsonWriter;
import com.actiontech.slowlog.statistic.QueryDigestReport;
import com.actiontech.slowlog.statistic.QueryDigestStat;

import java.io.IOException;
import java.io.PrintStream;
import java.util.function.Consumer;

public final class SlowLogDigestStartup {
    public static final String STDIN = "-";

    private SlowLogDigestStartup() {
    }

    public static void main(String[] args) {
        try {
            if (args.length != 1) {
                System.out.println("Usage: SlowLogDigestStartup <slow-log-path | ->");
                System.exit(-1);
                return;
            }
            SlowLogConfig config = SlowLogConfigLoader.load();
            run(args[0], config, System.out);
        } catch (Throwable e) {
            e.printStackTrace();
            System.exit(-1);
        }
    }

    public static SlowLogReadStat run(String source, SlowLogConfig config, PrintStream out) throws IOException {
        SlowLogAnalyzer analyzer = new SlowLogAnalyzer(config);
        if (SlowLogConfig.OUTPUT_JSON.equals(config.getOutputFormat())) {
            SlowLogReadStat stat = process(analyzer, source, new CanonicalQueryJsonWriter(out));
            out.flush();
            return stat;
        }
        QueryDigestStat digestStat = new QueryDigestStat();
        SlowLogReadStat stat = process(analyzer, source, digestStat);
        QueryDigestReport.print(digestStat, config.getReportTopN(), out);
        return stat;
    }

    private static SlowLogReadStat process(SlowLogAnalyzer analyzer, String source,
                                           Consumer<CanonicalQuery> sink) throws IOException {
        if (STDIN.equals(source)) {
            return analyzer.processStream(System.in, sink);
        }
        return analyzer.processFile(source, sink);
    }
}
