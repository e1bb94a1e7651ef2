/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog;

import com.actiontech.slowlog.config.SlowLogConfig;
import com.actiontech.slowlog.log.slow.SlowLogReadStat;
import com.actiontech.slowlog.model.CanonicalQuery;
import com.google.gson.JsonParser;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class SlowLogAnalyzerTest {

    private static String fixturePath() throws URISyntaxException {
        return new File(SlowLogAnalyzerTest.class.getResource("/slow.log").toURI()).getPath();
    }

    @Test
    public void testProcessFile() throws Exception {
        List<CanonicalQuery> queries = new ArrayList<>();
        SlowLogReadStat stat = new SlowLogAnalyzer().processFile(fixturePath(), queries::add);

        Assert.assertEquals(39L, stat.getLines());
        Assert.assertEquals(4L, stat.getEmitted());
        Assert.assertEquals(1L, stat.getUnparsable());
        Assert.assertEquals(0L, stat.getMalformedStats());
        Assert.assertTrue(stat.isTrailingDiscarded());
        Assert.assertEquals(4, queries.size());

        CanonicalQuery first = queries.get(0);
        Assert.assertEquals("SELECT * FROM users WHERE id = 1;", first.getSql());
        Assert.assertEquals("SELECT * FROM users WHERE id = ?", first.getCanonicalSql());
        Assert.assertEquals("app[app]", first.getStats().getUser());
        Assert.assertEquals("192.168.1.10", first.getStats().getHost());
        Assert.assertEquals(Instant.parse("2021-07-01T10:00:05Z"), first.getStats().getTimestamp());
        Assert.assertEquals(1.5, first.getStats().getQueryTime(), 0);
        Assert.assertEquals(0.0001, first.getStats().getLockTime(), 1e-9);
        Assert.assertEquals(1000L, first.getStats().getRowsExamined());

        Assert.assertEquals(first.getFingerprint(), queries.get(1).getFingerprint());
        Assert.assertEquals(2.0, queries.get(1).getStats().getQueryTime(), 0);

        CanonicalQuery multiLine = queries.get(2);
        Assert.assertEquals("SELECT * FROM users WHERE age > ? AND status = ?", multiLine.getCanonicalSql());
        Assert.assertEquals("report[report]", multiLine.getStats().getUser());
        Assert.assertEquals("10.0.0.5", multiLine.getStats().getHost());
        Assert.assertEquals(50000L, multiLine.getStats().getRowsExamined());
        Assert.assertNotEquals(first.getFingerprint(), multiLine.getFingerprint());

        CanonicalQuery update = queries.get(3);
        Assert.assertTrue(update.getCanonicalSql().startsWith("UPDATE orders SET status = ?"));
        Assert.assertEquals("admin[admin]", update.getStats().getUser());
        Assert.assertEquals("127.0.0.1", update.getStats().getHost());
        Assert.assertEquals(Instant.parse("2021-07-01T10:04:00Z"), update.getStats().getTimestamp());
    }

    @Test
    public void testProcessStream() throws IOException {
        String log = "# User@Host: a[a] @  [10.0.0.1]  Id: 1\n" +
                "# Query_time: 1.000000  Lock_time: 0.100000 Rows_sent: 1  Rows_examined: 10\n" +
                "SELECT * FROM cafe WHERE name = 'crème'\n" +
                "# User@Host: b[b] @  [10.0.0.2]  Id: 2\n";
        List<CanonicalQuery> queries = new ArrayList<>();
        new SlowLogAnalyzer().processStream(new ByteArrayInputStream(log.getBytes(StandardCharsets.UTF_8)), queries::add);
        Assert.assertEquals(1, queries.size());
        Assert.assertEquals("SELECT * FROM cafe WHERE name = 'crème'", queries.get(0).getSql());
        Assert.assertFalse(queries.get(0).getCanonicalSql().contains("crème"));
    }

    @Test(expected = IOException.class)
    public void testMissingFile() throws IOException {
        new SlowLogAnalyzer().processFile("/no/such/dir/slow.log", query -> Assert.fail());
    }

    @Test
    public void testReportOutput() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        SlowLogDigestStartup.run(fixturePath(), new SlowLogConfig(), out);
        String report = new String(bytes.toByteArray(), StandardCharsets.UTF_8);

        Assert.assertTrue(report.contains("Aggregated Slow Query Report"));
        // 3.5s in total for the id lookups, ahead of the 3.25s range scan
        Assert.assertTrue(report.indexOf("SELECT * FROM users WHERE id = ?") < report.indexOf("SELECT * FROM users WHERE age > ? AND status = ?"));
        Assert.assertTrue(report.contains("- Count:              2\n"));
        Assert.assertTrue(report.contains("- Total query time:   3.500s\n"));
    }

    @Test
    public void testJsonOutput() throws Exception {
        SlowLogConfig config = new SlowLogConfig();
        config.setOutputFormat("json");
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, "UTF-8");
        SlowLogReadStat stat = SlowLogDigestStartup.run(fixturePath(), config, out);

        String[] lines = new String(bytes.toByteArray(), StandardCharsets.UTF_8).trim().split("\n");
        Assert.assertEquals(stat.getEmitted(), lines.length);
        Assert.assertEquals("admin[admin]", JsonParser.parseString(lines[3]).getAsJsonObject().get("user").getAsString());
    }
}
