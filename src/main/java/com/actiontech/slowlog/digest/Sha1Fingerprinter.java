/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.digest;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * SHA-1 of the canonical sql. Not salted or versioned, changing it invalidates every stored fingerprint.
 * Guava deprecates sha1 for security use only, here it is a grouping key.
 */
public class Sha1Fingerprinter implements Fingerprinter {
    private static final HashFunction SHA1 = Hashing.sha1();

    @Override
    public String fingerprint(String canonicalSql) {
        return SHA1.hashString(canonicalSql, StandardCharsets.UTF_8).toString();
    }
}
