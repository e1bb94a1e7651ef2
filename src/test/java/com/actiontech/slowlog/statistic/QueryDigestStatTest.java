/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.statistic;

import com.actiontech.slowlog.model.CanonicalQuery;
import com.actiontech.slowlog.model.QueryStats;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Assert;
import org.junit.Test;

import java.time.Instant;
import java.util.List;

public class QueryDigestStatTest {

    private static CanonicalQuery query(String sql, String canonical, String fingerprint, String time, double queryTime, long rowsExamined) {
        QueryStats stats = new QueryStats("app[app]", "10.0.0.1", Instant.parse(time), queryTime, queryTime / 10, 1, rowsExamined);
        return new CanonicalQuery(sql, canonical, fingerprint, stats);
    }

    private static QueryDigestStat sample() {
        QueryDigestStat stat = new QueryDigestStat();
        stat.accept(query("SELECT * FROM users WHERE id = 1", "SELECT * FROM users WHERE id = ?", "f1", "2021-07-01T10:00:05Z", 1.5, 1000));
        stat.accept(query("DELETE FROM logs WHERE id < 10", "DELETE FROM logs WHERE id < ?", "f2", "2021-07-01T10:00:10Z", 5.0, 9));
        stat.accept(query("SELECT * FROM users WHERE id = 42", "SELECT * FROM users WHERE id = ?", "f1", "2021-07-01T09:00:00Z", 2.0, 2001));
        return stat;
    }

    @Test
    public void testGroupByFingerprint() {
        QueryDigestStat stat = sample();
        Assert.assertEquals(2, stat.size());

        QueryDigest digest = stat.getDigest("f1");
        Assert.assertEquals(2L, digest.getCount());
        Assert.assertEquals("SELECT * FROM users WHERE id = 1", digest.getExampleSql());
        Assert.assertEquals("SELECT * FROM users WHERE id = ?", digest.getCanonicalSql());
        Assert.assertEquals(3.5, digest.getTotalQueryTime(), 1e-9);
        Assert.assertEquals(1.75, digest.getAvgQueryTime(), 1e-9);
        Assert.assertEquals(2.0, digest.getMaxQueryTime(), 1e-9);
        Assert.assertEquals(0.175, digest.getAvgLockTime(), 1e-9);
        Assert.assertEquals(1L, digest.getAvgRowsSent());
        Assert.assertEquals(1500L, digest.getAvgRowsExamined());
        Assert.assertEquals(Instant.parse("2021-07-01T09:00:00Z"), digest.getFirstSeen());
        Assert.assertEquals(Instant.parse("2021-07-01T10:00:05Z"), digest.getLastSeen());
    }

    @Test
    public void testSortedByTotalQueryTime() {
        List<QueryDigest> digests = sample().getDigests();
        Assert.assertEquals("f2", digests.get(0).getFingerprint());
        Assert.assertEquals("f1", digests.get(1).getFingerprint());
    }

    @Test
    public void testReport() {
        QueryDigestStat stat = sample();
        String report = QueryDigestReport.format(stat, 0);
        Assert.assertTrue(report.contains("Aggregated Slow Query Report"));
        Assert.assertTrue(report.indexOf("DELETE FROM logs WHERE id < ?") < report.indexOf("SELECT * FROM users WHERE id = ?"));
        Assert.assertTrue(report.contains("- Count:              2\n"));
        Assert.assertTrue(report.contains("- Avg query time:     1.750s\n"));
        Assert.assertTrue(report.contains("- Max query time:     2.000s\n"));
        Assert.assertTrue(report.contains("- Avg rows examined:  1500\n"));
        Assert.assertTrue(report.contains("- Total query time:   3.500s\n"));

        String top = QueryDigestReport.format(stat, 1);
        Assert.assertTrue(top.contains("DELETE FROM logs WHERE id < ?"));
        Assert.assertFalse(top.contains("SELECT * FROM users WHERE id = ?"));
    }

    @Test
    public void testJson() {
        CanonicalQuery query = query("SELECT * FROM users WHERE name = '<a>'", "SELECT * FROM users WHERE name = ?", "f1", "2021-07-01T10:00:05Z", 1.5, 1000);
        JsonObject json = JsonParser.parseString(CanonicalQueryJsonWriter.toJson(query)).getAsJsonObject();
        Assert.assertEquals("SELECT * FROM users WHERE name = '<a>'", json.get("sql").getAsString());
        Assert.assertEquals("SELECT * FROM users WHERE name = ?", json.get("canonicalSql").getAsString());
        Assert.assertEquals("f1", json.get("fingerprint").getAsString());
        Assert.assertEquals("app[app]", json.get("user").getAsString());
        Assert.assertEquals("10.0.0.1", json.get("host").getAsString());
        Assert.assertEquals("2021-07-01T10:00:05Z", json.get("timestamp").getAsString());
        Assert.assertEquals(1.5, json.get("queryTime").getAsDouble(), 0);
        Assert.assertEquals(1000L, json.get("rowsExamined").getAsLong());
        Assert.assertFalse(CanonicalQueryJsonWriter.toJson(query).contains("\\u003c"));
    }
}
