/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.digest;

public interface Fingerprinter {

    /**
     * @return lowercase hex digest of the utf-8 bytes of the text
     */
    String fingerprint(String canonicalSql);
}
