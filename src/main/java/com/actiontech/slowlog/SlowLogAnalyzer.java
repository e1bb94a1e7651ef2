/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog;

import com.actiontech.slowlog.config.SlowLogConfig;
import com.actiontech.slowlog.digest.Sha1Fingerprinter;
import com.actiontech.slowlog.log.slow.SlowLogEntryReader;
import com.actiontech.slowlog.log.slow.SlowLogReadStat;
import com.actiontech.slowlog.model.CanonicalQuery;
import com.actiontech.slowlog.parser.QueryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.function.Consumer;

/**
 * Entry point of the library: turns a MySQL slow query log into a sequence of {@link CanonicalQuery}.
 * <pre>
 * new SlowLogAnalyzer().processFile("/var/log/mysql/slow.log", query -&gt; ...);
 * </pre>
 * Every call is independent, one instance may serve several streams at the same time.
 */
public class SlowLogAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlowLogAnalyzer.class);

    private final SlowLogConfig config;
    private final SlowLogEntryReader entryReader;

    public SlowLogAnalyzer() {
        this(new SlowLogConfig());
    }

    public SlowLogAnalyzer(SlowLogConfig config) {
        this.config = config;
        this.entryReader = new SlowLogEntryReader(new QueryNormalizer(), new Sha1Fingerprinter(), config.getStatsPolicy());
    }

    public SlowLogReadStat processFile(String path, Consumer<CanonicalQuery> sink) throws IOException {
        LOGGER.info("start to read slow log {}", path);
        try (InputStream in = new FileInputStream(path)) {
            SlowLogReadStat stat = processStream(in, sink);
            LOGGER.info("finish reading slow log {}, {}", path, stat);
            return stat;
        }
    }

    /**
     * the stream is decoded with the configured charset and is not closed
     */
    public SlowLogReadStat processStream(InputStream in, Consumer<CanonicalQuery> sink) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, Charset.forName(config.getCharset())));
        return processReader(reader, sink);
    }

    public SlowLogReadStat processReader(BufferedReader reader, Consumer<CanonicalQuery> sink) throws IOException {
        return entryReader.read(reader, sink);
    }
}
