/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.log.slow;

import com.actiontech.slowlog.config.MalformedStatsPolicy;
import com.actiontech.slowlog.digest.Fingerprinter;
import com.actiontech.slowlog.model.CanonicalQuery;
import com.actiontech.slowlog.parser.QueryFormatException;
import com.actiontech.slowlog.parser.QueryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.function.Consumer;

/**
 * Assembles the entries of a slow log stream and hands every one that normalizes to the sink.
 * <p>
 * A "# User@Host:" line closes the entry collected before it: the pending statement is flushed
 * with the statistics as they stood before that line, and only then are user and host updated.
 * Statement text left at end of input has no closing line and is discarded.
 */
public class SlowLogEntryReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SlowLogEntryReader.class);

    private final QueryNormalizer normalizer;
    private final Fingerprinter fingerprinter;
    private final MalformedStatsPolicy statsPolicy;

    public SlowLogEntryReader(QueryNormalizer normalizer, Fingerprinter fingerprinter, MalformedStatsPolicy statsPolicy) {
        this.normalizer = normalizer;
        this.fingerprinter = fingerprinter;
        this.statsPolicy = statsPolicy;
    }

    /**
     * read the stream to its end, the sink runs on the calling thread
     *
     * @throws SlowLogFormatException if a statistics line is malformed and the policy is {@link MalformedStatsPolicy#ABORT}
     * @throws IOException            if the reader fails
     */
    public SlowLogReadStat read(BufferedReader reader, Consumer<CanonicalQuery> sink) throws IOException {
        EntryAccumulator accumulator = new EntryAccumulator();
        SlowLogReadStat stat = new SlowLogReadStat();
        long lineNumber = 0;
        for (String line; (line = reader.readLine()) != null; ) {
            lineNumber++;
            stat.incLines();
            SlowLogLine slowLogLine;
            try {
                slowLogLine = LineClassifier.classify(line);
            } catch (NumberFormatException e) {
                if (statsPolicy == MalformedStatsPolicy.ABORT) {
                    throw new SlowLogFormatException(lineNumber, line, e);
                }
                LOGGER.warn("malformed statistics at line {}, the entry will be dropped: {}", lineNumber, line);
                accumulator.markStatsMalformed();
                stat.incMalformedStats();
                continue;
            }
            switch (slowLogLine.getType()) {
                case NOISE:
                    break;
                case TIMESTAMP:
                    accumulator.applyTimestamp(slowLogLine);
                    break;
                case STATS:
                    accumulator.applyStats(slowLogLine);
                    break;
                case USER_HOST:
                    flush(accumulator, lineNumber, stat, sink);
                    accumulator.applyUserHost(slowLogLine);
                    break;
                case STATEMENT:
                    accumulator.append(slowLogLine.getText());
                    break;
                default:
                    break;
            }
        }
        if (accumulator.hasPendingText()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("statement text after the last User@Host line is discarded");
            }
            stat.setTrailingDiscarded(true);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("slow log read finished, {}", stat);
        }
        return stat;
    }

    private void flush(EntryAccumulator accumulator, long lineNumber, SlowLogReadStat stat, Consumer<CanonicalQuery> sink) {
        RawEntry entry = accumulator.drain();
        if (entry == null) {
            return;
        }
        if (entry.isStatsMalformed()) {
            LOGGER.warn("entry closed at line {} is dropped for its malformed statistics: {}", lineNumber, entry.getSql());
            return;
        }
        String canonicalSql;
        try {
            canonicalSql = normalizer.normalize(entry.getSql());
        } catch (QueryFormatException e) {
            LOGGER.warn("entry closed at line {} is skipped, {}: {}", lineNumber, e.getMessage(), entry.getSql());
            stat.incUnparsable();
            return;
        }
        sink.accept(new CanonicalQuery(entry.getSql(), canonicalSql, fingerprinter.fingerprint(canonicalSql), entry.getStats()));
        stat.incEmitted();
    }
}
