/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.parser;

import com.actiontech.slowlog.parser.druid.DruidStatementParser;
import com.actiontech.slowlog.parser.druid.LiteralPlaceholderReplacer;
import com.alibaba.druid.sql.ast.SQLStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Rewrites a statement into its canonical form, where every literal value is a {@code ?} placeholder:
 * <pre>
 * select * from users where id = 123   ->   SELECT * FROM users WHERE id = ?
 * </pre>
 * Only the first statement of a multi statement text is kept.
 */
public class QueryNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryNormalizer.class);

    private final SqlStatementParser parser;

    public QueryNormalizer() {
        this(new DruidStatementParser());
    }

    public QueryNormalizer(SqlStatementParser parser) {
        this.parser = parser;
    }

    public String normalize(String sql) throws QueryFormatException {
        List<SQLStatement> statements = parser.parse(sql);
        if (statements == null || statements.isEmpty()) {
            throw QueryFormatException.invalidQuery();
        }
        if (statements.size() > 1 && LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} statements found, only the first one is normalized: {}", statements.size(), sql);
        }
        SQLStatement statement = statements.get(0);
        LiteralPlaceholderReplacer.replace(statement);
        return parser.render(statement);
    }
}
