package com.tablerewriter.rewrite;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;

import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.AnyComparisonExpression;
import net.sf.jsqlparser.expression.ArrayConstructor;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.CaseExpression;
import net.sf.jsqlparser.expression.CastExpression;
import net.sf.jsqlparser.expression.CollateExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExtractExpression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.SignedExpression;
import net.sf.jsqlparser.expression.WhenClause;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.WithItem;

/**
 * Depth-first walk over a SELECT tree that reports every {@link Table} in table position.
 *
 * <p>Column qualifiers, aliases and function names are never reported. The walk itself does not
 * mutate the tree; handlers may swap a table for another through the supplied parent slot.
 */
class TableReferenceWalker {

    @FunctionalInterface
    interface TableHandler {
        /**
         * @param table the table node as parsed
         * @param cteReference true when the table is a bare name matching a WITH item in scope
         * @param parentSlot replaces the table node in its parent
         */
        void handle(Table table, boolean cteReference, Consumer<FromItem> parentSlot);
    }

    private final TableHandler handler;
    private final Deque<Set<String>> cteScopes = new ArrayDeque<>();

    TableReferenceWalker(TableHandler handler) {
        this.handler = handler;
    }

    void walk(Select select) {
        walkSelect(select);
    }

    private void walkSelect(Select select) {
        if (select == null) {
            return;
        }

        List<WithItem> withItems = select.getWithItemsList();
        boolean scoped = withItems != null && !withItems.isEmpty();
        try {
            if (scoped) {
                walkWithItems(withItems);
            }

            if (select instanceof PlainSelect) {
                walkPlainSelect((PlainSelect) select);
            } else if (select instanceof SetOperationList) {
                for (Select s : ((SetOperationList) select).getSelects()) {
                    walkSelect(s);
                }
            } else if (select instanceof ParenthesedSelect) {
                walkSelect(((ParenthesedSelect) select).getSelect());
            }
            walkOrderBy(select.getOrderByElements());
        } finally {
            if (scoped) {
                cteScopes.pop();
            }
        }
    }

    /**
     * Pushes the scope of a WITH list. Under RECURSIVE every item sees every name; otherwise an
     * item only sees the items declared before it.
     */
    private void walkWithItems(List<WithItem> withItems) {
        Set<String> names = new HashSet<>();
        cteScopes.push(names);

        boolean recursive = false;
        for (WithItem withItem : withItems) {
            recursive |= withItem.isRecursive();
        }
        if (recursive) {
            for (WithItem withItem : withItems) {
                addName(names, withItem);
            }
        }

        for (WithItem withItem : withItems) {
            walkSelect(withItem.getSelect());
            addName(names, withItem);
        }
    }

    private static void addName(Set<String> names, WithItem withItem) {
        if (withItem.getAlias() != null) {
            names.add(normalize(withItem.getAlias().getName()));
        }
    }

    private void walkPlainSelect(PlainSelect plainSelect) {
        if (plainSelect.getSelectItems() != null) {
            for (SelectItem<?> item : plainSelect.getSelectItems()) {
                walkExpression(item.getExpression());
            }
        }

        if (plainSelect.getFromItem() != null) {
            walkFromItem(plainSelect.getFromItem(), plainSelect::setFromItem);
        }
        walkJoins(plainSelect.getJoins());

        walkExpression(plainSelect.getWhere());

        GroupByElement groupBy = plainSelect.getGroupBy();
        if (groupBy != null) {
            walkExpression(groupBy.getGroupByExpressionList());
            if (groupBy.getGroupingSets() != null) {
                for (Object groupingSet : groupBy.getGroupingSets()) {
                    if (groupingSet instanceof Expression) {
                        walkExpression((Expression) groupingSet);
                    }
                }
            }
        }

        walkExpression(plainSelect.getHaving());
        walkExpression(plainSelect.getQualify());
    }

    private void walkJoins(List<Join> joins) {
        if (joins == null) {
            return;
        }
        for (Join join : joins) {
            walkFromItem(join.getRightItem(), join::setRightItem);
            Collection<Expression> onExpressions = join.getOnExpressions();
            if (onExpressions != null) {
                for (Expression expr : onExpressions) {
                    walkExpression(expr);
                }
            }
        }
    }

    private void walkFromItem(FromItem fromItem, Consumer<FromItem> parentSlot) {
        if (fromItem instanceof Table) {
            Table table = (Table) fromItem;
            handler.handle(table, isCteReference(table), parentSlot);
        } else if (fromItem instanceof ParenthesedSelect) {
            // derived tables and LATERAL subqueries
            walkSelect((ParenthesedSelect) fromItem);
        } else if (fromItem instanceof ParenthesedFromItem) {
            ParenthesedFromItem nested = (ParenthesedFromItem) fromItem;
            walkFromItem(nested.getFromItem(), nested::setFromItem);
            walkJoins(nested.getJoins());
        } else if (fromItem instanceof TableFunction) {
            walkExpression(((TableFunction) fromItem).getFunction());
        }
    }

    private void walkOrderBy(List<OrderByElement> orderByElements) {
        if (orderByElements == null) {
            return;
        }
        for (OrderByElement orderBy : orderByElements) {
            walkExpression(orderBy.getExpression());
        }
    }

    private void walkExpression(Expression expr) {
        if (expr == null) {
            return;
        }

        if (expr instanceof Select) {
            walkSelect((Select) expr);
        } else if (expr instanceof BinaryExpression) {
            BinaryExpression binExpr = (BinaryExpression) expr;
            walkExpression(binExpr.getLeftExpression());
            walkExpression(binExpr.getRightExpression());
        } else if (expr instanceof ExpressionList) {
            // also covers ParenthesedExpressionList
            for (Expression e : (ExpressionList<?>) expr) {
                walkExpression(e);
            }
        } else if (expr instanceof InExpression) {
            InExpression inExpr = (InExpression) expr;
            walkExpression(inExpr.getLeftExpression());
            walkExpression(inExpr.getRightExpression());
        } else if (expr instanceof ExistsExpression) {
            walkExpression(((ExistsExpression) expr).getRightExpression());
        } else if (expr instanceof AnyComparisonExpression) {
            walkSelect(((AnyComparisonExpression) expr).getSelect());
        } else if (expr instanceof NotExpression) {
            walkExpression(((NotExpression) expr).getExpression());
        } else if (expr instanceof SignedExpression) {
            walkExpression(((SignedExpression) expr).getExpression());
        } else if (expr instanceof Function) {
            walkExpression(((Function) expr).getParameters());
        } else if (expr instanceof Parenthesis) {
            walkExpression(((Parenthesis) expr).getExpression());
        } else if (expr instanceof AnalyticExpression) {
            walkAnalytic((AnalyticExpression) expr);
        } else if (expr instanceof CaseExpression) {
            CaseExpression caseExpr = (CaseExpression) expr;
            walkExpression(caseExpr.getSwitchExpression());
            if (caseExpr.getWhenClauses() != null) {
                for (WhenClause when : caseExpr.getWhenClauses()) {
                    walkExpression(when.getWhenExpression());
                    walkExpression(when.getThenExpression());
                }
            }
            walkExpression(caseExpr.getElseExpression());
        } else if (expr instanceof Between) {
            Between between = (Between) expr;
            walkExpression(between.getLeftExpression());
            walkExpression(between.getBetweenExpressionStart());
            walkExpression(between.getBetweenExpressionEnd());
        } else if (expr instanceof CastExpression) {
            walkExpression(((CastExpression) expr).getLeftExpression());
        } else if (expr instanceof IsNullExpression) {
            walkExpression(((IsNullExpression) expr).getLeftExpression());
        } else if (expr instanceof ExtractExpression) {
            walkExpression(((ExtractExpression) expr).getExpression());
        } else if (expr instanceof ArrayConstructor) {
            walkExpression(((ArrayConstructor) expr).getExpressions());
        } else if (expr instanceof CollateExpression) {
            walkExpression(((CollateExpression) expr).getLeftExpression());
        }
    }

    private void walkAnalytic(AnalyticExpression analytic) {
        walkExpression(analytic.getExpression());
        walkExpression(analytic.getOffset());
        walkExpression(analytic.getDefaultValue());
        walkExpression(analytic.getFilterExpression());
        walkOrderBy(analytic.getFuncOrderBy());
        walkExpression(analytic.getPartitionExpressionList());
        walkOrderBy(analytic.getOrderByElements());
    }

    private boolean isCteReference(Table table) {
        if (table.getSchemaName() != null || table.getName() == null || cteScopes.isEmpty()) {
            return false;
        }
        String name = normalize(table.getName());
        for (Set<String> scope : cteScopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String identifier) {
        return IdentifierQuoting.unquote(identifier).toLowerCase(Locale.ROOT);
    }
}
