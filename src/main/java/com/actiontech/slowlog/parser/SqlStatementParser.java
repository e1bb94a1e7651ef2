/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.parser;

import com.alibaba.druid.sql.ast.SQLStatement;

import java.util.List;

/**
 * Turns sql text into syntax trees and back.
 */
public interface SqlStatementParser {

    /**
     * @return every statement found in the text, possibly none
     * @throws QueryFormatException with {@link QueryFormatException.ErrorCode#PARSE_ERROR} if the text is not valid sql
     */
    List<SQLStatement> parse(String sql) throws QueryFormatException;

    /**
     * @return the canonical single line text of the statement
     */
    String render(SQLStatement statement);
}
