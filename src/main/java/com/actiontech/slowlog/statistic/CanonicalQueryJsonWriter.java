/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.statistic;

import com.actiontech.slowlog.model.CanonicalQuery;
import com.actiontech.slowlog.model.QueryStats;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * Prints every canonical query as one line of JSON.
 */
public class CanonicalQueryJsonWriter implements Consumer<CanonicalQuery> {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final PrintStream out;

    public CanonicalQueryJsonWriter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void accept(CanonicalQuery query) {
        out.println(toJson(query));
    }

    public static String toJson(CanonicalQuery query) {
        return GSON.toJson(toJsonObject(query));
    }

    static JsonObject toJsonObject(CanonicalQuery query) {
        QueryStats stats = query.getStats();
        JsonObject json = new JsonObject();
        json.addProperty("sql", query.getSql());
        json.addProperty("canonicalSql", query.getCanonicalSql());
        json.addProperty("fingerprint", query.getFingerprint());
        json.addProperty("user", stats.getUser());
        json.addProperty("host", stats.getHost());
        json.addProperty("timestamp", stats.getTimestamp().toString());
        json.addProperty("queryTime", stats.getQueryTime());
        json.addProperty("lockTime", stats.getLockTime());
        json.addProperty("rowsSent", stats.getRowsSent());
        json.addProperty("rowsExamined", stats.getRowsExamined());
        return json;
    }
}
