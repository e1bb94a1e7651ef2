/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.parser.druid;

import com.actiontech.slowlog.parser.QueryFormatException;
import com.actiontech.slowlog.parser.SqlStatementParser;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.dialect.mysql.parser.MySqlStatementParser;
import com.alibaba.druid.sql.dialect.mysql.visitor.MySqlOutputVisitor;
import com.alibaba.druid.sql.parser.ParserException;

import java.util.List;

/**
 * MySQL dialect parser and writer backed by druid.
 */
public class DruidStatementParser implements SqlStatementParser {

    @Override
    public List<SQLStatement> parse(String sql) throws QueryFormatException {
        try {
            MySqlStatementParser parser = new MySqlStatementParser(sql);
            return parser.parseStatementList();
        } catch (ParserException e) {
            throw QueryFormatException.parseError(e.getMessage(), e);
        } catch (RuntimeException e) {
            // druid reports some unsupported syntax with plain runtime exceptions
            throw QueryFormatException.parseError(String.valueOf(e), e);
        }
    }

    @Override
    public String render(SQLStatement statement) {
        StringBuilder out = new StringBuilder();
        MySqlOutputVisitor visitor = new MySqlOutputVisitor(out);
        visitor.setUppCase(true);
        visitor.setPrettyFormat(false);
        visitor.setParameterized(false);
        statement.accept(visitor);
        return stripTrailingSemicolon(out.toString().trim());
    }

    private static String stripTrailingSemicolon(String sql) {
        String result = sql;
        while (result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }
}
