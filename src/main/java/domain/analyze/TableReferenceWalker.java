package domain.analyze;

import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.AnyComparisonExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.KeepExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.Fetch;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.Offset;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.TableFunction;
import net.sf.jsqlparser.statement.select.WithItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Recursive walk over a query AST reporting every table reference that is not a visible CTE name.
 *
 * <p>Covers CTEs, set operations, derived tables, nested joins and their {@code ON} predicates,
 * {@code WHERE}/{@code GROUP BY}/{@code HAVING}, subqueries inside expressions ({@code IN},
 * {@code EXISTS}, scalar, {@code ANY}/{@code ALL}), function arguments, {@code CASE}, aggregate
 * {@code FILTER}/{@code WITHIN GROUP}/{@code ORDER BY}, window {@code PARTITION BY}/{@code ORDER BY},
 * {@code ORDER BY} and {@code LIMIT}/{@code OFFSET}/{@code FETCH}.</p>
 *
 * <p>The names of a {@code WITH} clause are pushed before any CTE body or the main query is
 * visited and popped afterwards.</p>
 */
public final class TableReferenceWalker {

    /** Receives each non-CTE table reference with its unquoted name parts. */
    @FunctionalInterface
    public interface Handler {
        void onTable(Table table, List<String> nameParts);
    }

    private final Handler handler;
    private final CteScopeStack scopes = new CteScopeStack();
    private final SubqueryVisitor expressions = new SubqueryVisitor();

    private TableReferenceWalker(Handler handler) {
        this.handler = handler;
    }

    public static void walk(Select query, Handler handler) {
        new TableReferenceWalker(handler).select(query);
    }

    /**
     * {@code db.schema."Name"} -> {@code [db, schema, Name]}.
     */
    public static List<String> nameParts(Table table) {
        List<String> parts = new ArrayList<>(3);
        String fqn = table.getFullyQualifiedName();
        if (fqn == null) return parts;
        for (String p : fqn.split("\\.")) {
            String u = unquote(p.trim());
            if (!u.isEmpty()) parts.add(u);
        }
        return parts;
    }

    static String unquote(String ident) {
        if (ident.length() >= 2) {
            char f = ident.charAt(0);
            char l = ident.charAt(ident.length() - 1);
            if ((f == '"' && l == '"') || (f == '`' && l == '`')) {
                return ident.substring(1, ident.length() - 1).replace("\"\"", "\"");
            }
        }
        return ident;
    }

    private void select(Select select) {
        if (select == null) return;

        List<WithItem<?>> withItems = select.getWithItemsList();
        boolean scoped = withItems != null && !withItems.isEmpty();
        if (scoped) {
            List<String> names = new ArrayList<>(withItems.size());
            for (WithItem<?> item : withItems) {
                if (item != null && item.getUnquotedAliasName() != null) {
                    names.add(item.getUnquotedAliasName());
                }
            }
            scopes.push(names);
            for (WithItem<?> item : withItems) {
                if (item != null) select(item.getSelect());
            }
        }

        if (select instanceof PlainSelect plain) {
            plainSelect(plain);
        } else if (select instanceof SetOperationList setOps) {
            for (Select branch : setOps.getSelects()) {
                select(branch);
            }
            orderBy(setOps.getOrderByElements());
            limits(setOps.getLimit(), setOps.getOffset(), setOps.getFetch());
        } else if (select instanceof ParenthesedSelect parenthesed) {
            select(parenthesed.getSelect());
            orderBy(parenthesed.getOrderByElements());
            limits(parenthesed.getLimit(), parenthesed.getOffset(), parenthesed.getFetch());
        }

        if (scoped) scopes.pop();
    }

    private void plainSelect(PlainSelect ps) {
        List<SelectItem<?>> items = ps.getSelectItems();
        if (items != null) {
            for (SelectItem<?> item : items) {
                expression(item.getExpression());
            }
        }

        fromItem(ps.getFromItem());
        joins(ps.getJoins());

        expression(ps.getWhere());
        GroupByElement groupBy = ps.getGroupBy();
        if (groupBy != null) {
            expressionList(groupBy.getGroupByExpressionList());
        }
        expression(ps.getHaving());
        orderBy(ps.getOrderByElements());
        limits(ps.getLimit(), ps.getOffset(), ps.getFetch());
    }

    private void fromItem(FromItem item) {
        if (item == null) return;
        if (item instanceof Table table) {
            table(table);
        } else if (item instanceof ParenthesedSelect sub) {
            select(sub);
        } else if (item instanceof ParenthesedFromItem nested) {
            fromItem(nested.getFromItem());
            joins(nested.getJoins());
        } else if (item instanceof TableFunction function) {
            expression(function.getFunction());
        } else if (item instanceof Select other) {
            select(other);
        }
    }

    private void joins(List<Join> joins) {
        if (joins == null) return;
        for (Join join : joins) {
            fromItem(join.getRightItem());
            Collection<Expression> on = join.getOnExpressions();
            if (on != null) {
                for (Expression e : on) {
                    expression(e);
                }
            }
        }
    }

    private void table(Table table) {
        List<String> parts = nameParts(table);
        if (parts.isEmpty()) return;
        if (parts.size() == 1 && scopes.isVisible(parts.get(0))) return;
        handler.onTable(table, parts);
    }

    private void orderBy(List<OrderByElement> elements) {
        if (elements == null) return;
        for (OrderByElement e : elements) {
            expression(e.getExpression());
        }
    }

    private void limits(Limit limit, Offset offset, Fetch fetch) {
        if (limit != null) {
            expression(limit.getRowCount());
            expression(limit.getOffset());
        }
        if (offset != null) {
            expression(offset.getOffset());
        }
        if (fetch != null) {
            expression(fetch.getExpression());
        }
    }

    private void expressionList(ExpressionList<?> list) {
        if (list == null) return;
        for (Expression e : list) {
            expression(e);
        }
    }

    private void expression(Expression expr) {
        if (expr != null) expr.accept(expressions);
    }

    private void keep(KeepExpression keep) {
        if (keep != null) orderBy(keep.getOrderByElements());
    }

    /**
     * Default traversal of every expression node; subqueries re-enter the query walk so CTE
     * scoping and table handling stay in one place. Function and window calls are walked by hand
     * so {@code PARTITION BY}, {@code FILTER}, {@code WITHIN GROUP} and aggregate {@code ORDER BY}
     * are all reached.
     */
    private final class SubqueryVisitor extends ExpressionVisitorAdapter<Void> {

        @Override
        public <S> Void visit(Select select, S context) {
            select(select);
            return null;
        }

        @Override
        public <S> Void visit(AnyComparisonExpression any, S context) {
            select(any.getSelect());
            return null;
        }

        @Override
        public <S> Void visit(Function function, S context) {
            expressionList(function.getParameters());
            expressionList(function.getNamedParameters());
            orderBy(function.getOrderByElements());
            keep(function.getKeep());
            limits(function.getLimit(), null, null);
            return null;
        }

        @Override
        public <S> Void visit(AnalyticExpression analytic, S context) {
            expression(analytic.getExpression());
            expression(analytic.getOffset());
            expression(analytic.getDefaultValue());
            expressionList(analytic.getPartitionExpressionList());
            orderBy(analytic.getOrderByElements());
            orderBy(analytic.getFuncOrderBy());
            expression(analytic.getFilterExpression());
            keep(analytic.getKeep());
            limits(analytic.getLimit(), null, null);
            return null;
        }
    }
}
