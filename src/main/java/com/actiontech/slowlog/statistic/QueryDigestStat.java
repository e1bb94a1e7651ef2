/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.statistic;

import com.actiontech.slowlog.model.CanonicalQuery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Groups canonical queries by fingerprint. Usable directly as the sink of a processing call.
 */
public class QueryDigestStat implements Consumer<CanonicalQuery> {
    private final Map<String, QueryDigest> digestMap = new LinkedHashMap<>();

    public void add(CanonicalQuery query) {
        QueryDigest digest = digestMap.get(query.getFingerprint());
        if (digest == null) {
            digest = new QueryDigest(query);
            digestMap.put(query.getFingerprint(), digest);
        }
        digest.add(query);
    }

    @Override
    public void accept(CanonicalQuery query) {
        add(query);
    }

    /**
     * @return the digests, highest total query time first
     */
    public List<QueryDigest> getDigests() {
        List<QueryDigest> list = new ArrayList<>(digestMap.values());
        list.sort(Comparator.comparingDouble(QueryDigest::getTotalQueryTime).reversed());
        return list;
    }

    public QueryDigest getDigest(String fingerprint) {
        return digestMap.get(fingerprint);
    }

    public int size() {
        return digestMap.size();
    }
}
