/*
 * Copyright (C) 2016-2023 ActionTech.
 * License: http://www.gnu.org/licenses/gpl.html GPL version 2 or higher.
 */

package com.actiontech.slowlog.parser.druid;

import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.expr.SQLAggregateExpr;
import com.alibaba.druid.sql.ast.expr.SQLBetweenExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExpr;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOpExprGroup;
import com.alibaba.druid.sql.ast.expr.SQLBinaryOperator;
import com.alibaba.druid.sql.ast.expr.SQLCaseExpr;
import com.alibaba.druid.sql.ast.expr.SQLCastExpr;
import com.alibaba.druid.sql.ast.expr.SQLExistsExpr;
import com.alibaba.druid.sql.ast.expr.SQLExtractExpr;
import com.alibaba.druid.sql.ast.expr.SQLGroupingSetExpr;
import com.alibaba.druid.sql.ast.expr.SQLInListExpr;
import com.alibaba.druid.sql.ast.expr.SQLInSubQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLIntervalExpr;
import com.alibaba.druid.sql.ast.expr.SQLListExpr;
import com.alibaba.druid.sql.ast.expr.SQLLiteralExpr;
import com.alibaba.druid.sql.ast.expr.SQLMethodInvokeExpr;
import com.alibaba.druid.sql.ast.expr.SQLNotExpr;
import com.alibaba.druid.sql.ast.expr.SQLQueryExpr;
import com.alibaba.druid.sql.ast.expr.SQLUnaryExpr;
import com.alibaba.druid.sql.ast.expr.SQLVariantRefExpr;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLReplaceStatement;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectItem;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLUpdateSetItem;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replaces every literal reachable from the clauses below with a {@code ?} placeholder, in place.
 * <ul>
 * <li>SELECT: where, select items</li>
 * <li>UPDATE: set values, where</li>
 * <li>INSERT, REPLACE: every value of every row</li>
 * <li>DELETE: where</li>
 * </ul>
 * Statements and expressions of any other kind are left as they are.
 */
public final class LiteralPlaceholderReplacer {
    private static final Logger LOGGER = LoggerFactory.getLogger(LiteralPlaceholderReplacer.class);
    public static final String PLACEHOLDER = "?";

    private LiteralPlaceholderReplacer() {
    }

    public static void replace(SQLStatement statement) {
        if (statement instanceof SQLSelectStatement) {
            SQLSelectQueryBlock block = ((SQLSelectStatement) statement).getSelect().getQueryBlock();
            if (block != null) {
                if (block.getWhere() != null) {
                    block.setWhere(replace(block.getWhere()));
                }
                replaceSelectItems(block.getSelectList());
            }
        } else if (statement instanceof SQLUpdateStatement) {
            SQLUpdateStatement update = (SQLUpdateStatement) statement;
            for (SQLUpdateSetItem item : update.getItems()) {
                item.setValue(replace(item.getValue()));
            }
            if (update.getWhere() != null) {
                update.setWhere(replace(update.getWhere()));
            }
        } else if (statement instanceof SQLInsertStatement) {
            for (SQLInsertStatement.ValuesClause row : ((SQLInsertStatement) statement).getValuesList()) {
                replaceAll(row.getValues());
            }
        } else if (statement instanceof SQLReplaceStatement) {
            for (SQLInsertStatement.ValuesClause row : ((SQLReplaceStatement) statement).getValuesList()) {
                replaceAll(row.getValues());
            }
        } else if (statement instanceof SQLDeleteStatement) {
            SQLDeleteStatement delete = (SQLDeleteStatement) statement;
            if (delete.getWhere() != null) {
                delete.setWhere(replace(delete.getWhere()));
            }
        } else if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("literals of {} are kept", statement.getClass().getSimpleName());
        }
    }

    /**
     * @return the placeholder if expr is a literal, otherwise expr itself with its children replaced
     */
    static SQLExpr replace(SQLExpr expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof SQLLiteralExpr) {
            return placeholder(expr);
        }
        if (expr instanceof SQLBinaryOpExpr) {
            SQLBinaryOpExpr binary = (SQLBinaryOpExpr) expr;
            binary.setLeft(replace(binary.getLeft()));
            // IS [NOT] NULL / TRUE / FALSE / UNKNOWN keep their keyword
            if (binary.getOperator() != SQLBinaryOperator.Is && binary.getOperator() != SQLBinaryOperator.IsNot) {
                binary.setRight(replace(binary.getRight()));
            }
        } else if (expr instanceof SQLBinaryOpExprGroup) {
            // long AND / OR chains
            replaceAll(((SQLBinaryOpExprGroup) expr).getItems());
        } else if (expr instanceof SQLNotExpr) {
            SQLNotExpr not = (SQLNotExpr) expr;
            not.setExpr(replace(not.getExpr()));
        } else if (expr instanceof SQLUnaryExpr) {
            SQLUnaryExpr unary = (SQLUnaryExpr) expr;
            unary.setExpr(replace(unary.getExpr()));
        } else if (expr instanceof SQLInListExpr) {
            SQLInListExpr in = (SQLInListExpr) expr;
            in.setExpr(replace(in.getExpr()));
            replaceAll(in.getTargetList());
        } else if (expr instanceof SQLInSubQueryExpr) {
            SQLInSubQueryExpr in = (SQLInSubQueryExpr) expr;
            replaceSubQuery(in.getSubQuery());
            in.setExpr(replace(in.getExpr()));
        } else if (expr instanceof SQLBetweenExpr) {
            SQLBetweenExpr between = (SQLBetweenExpr) expr;
            between.setTestExpr(replace(between.getTestExpr()));
            between.setBeginExpr(replace(between.getBeginExpr()));
            between.setEndExpr(replace(between.getEndExpr()));
        } else if (expr instanceof SQLCaseExpr) {
            replaceCase((SQLCaseExpr) expr);
        } else if (expr instanceof SQLAggregateExpr) {
            replaceAll(((SQLAggregateExpr) expr).getArguments());
        } else if (expr instanceof SQLMethodInvokeExpr) {
            replaceAll(((SQLMethodInvokeExpr) expr).getArguments());
        } else if (expr instanceof SQLCastExpr) {
            SQLCastExpr cast = (SQLCastExpr) expr;
            cast.setExpr(replace(cast.getExpr()));
        } else if (expr instanceof SQLExtractExpr) {
            SQLExtractExpr extract = (SQLExtractExpr) expr;
            extract.setValue(replace(extract.getValue()));
        } else if (expr instanceof SQLIntervalExpr) {
            SQLIntervalExpr interval = (SQLIntervalExpr) expr;
            interval.setValue(replace(interval.getValue()));
        } else if (expr instanceof SQLQueryExpr) {
            replaceSubQuery(((SQLQueryExpr) expr).getSubQuery());
        } else if (expr instanceof SQLExistsExpr) {
            replaceSubQuery(((SQLExistsExpr) expr).getSubQuery());
        } else if (expr instanceof SQLListExpr) {
            replaceAll(((SQLListExpr) expr).getItems());
        } else if (expr instanceof SQLGroupingSetExpr) {
            replaceAll(((SQLGroupingSetExpr) expr).getParameters());
        }
        // identifiers, wildcards, variables and anything not listed above pass through
        return expr;
    }

    private static void replaceCase(SQLCaseExpr caseExpr) {
        if (caseExpr.getValueExpr() != null) {
            caseExpr.setValueExpr(replace(caseExpr.getValueExpr()));
        }
        for (SQLCaseExpr.Item item : caseExpr.getItems()) {
            item.setConditionExpr(replace(item.getConditionExpr()));
            item.setValueExpr(replace(item.getValueExpr()));
        }
        if (caseExpr.getElseExpr() != null) {
            caseExpr.setElseExpr(replace(caseExpr.getElseExpr()));
        }
    }

    /**
     * a subquery only has its where replaced, or its select items when there is no where
     */
    private static void replaceSubQuery(SQLSelect select) {
        if (select == null) {
            return;
        }
        SQLSelectQueryBlock block = select.getQueryBlock();
        if (block == null) {
            return;
        }
        if (block.getWhere() != null) {
            block.setWhere(replace(block.getWhere()));
        } else {
            replaceSelectItems(block.getSelectList());
        }
    }

    private static void replaceSelectItems(List<SQLSelectItem> items) {
        for (SQLSelectItem item : items) {
            item.setExpr(replace(item.getExpr()));
        }
    }

    private static void replaceAll(List<SQLExpr> exprs) {
        if (exprs == null) {
            return;
        }
        for (int i = 0; i < exprs.size(); i++) {
            exprs.set(i, replace(exprs.get(i)));
        }
    }

    private static SQLExpr placeholder(SQLExpr literal) {
        SQLVariantRefExpr placeholder = new SQLVariantRefExpr(PLACEHOLDER);
        placeholder.setParent(literal.getParent());
        return placeholder;
    }
}
