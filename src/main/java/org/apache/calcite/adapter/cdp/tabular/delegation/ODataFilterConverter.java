package org.apache.calcite.adapter.cdp.tabular.delegation;

import org.apache.calcite.adapter.cdp.model.ColumnDescriptor;
import org.apache.calcite.adapter.cdp.model.TableCapabilities;
import org.apache.calcite.rex.RexCall;
import org.apache.calcite.rex.RexInputRef;
import org.apache.calcite.rex.RexLiteral;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.sql.SqlKind;
import org.apache.commons.lang3.time.FastDateFormat;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.TimeZone;

/**
 * Converts Calcite RexNode filter expressions to OData {@code $filter} text.
 *
 * <p>Handles comparisons between a column and a literal, {@code IS [NOT] NULL}, and
 * AND/OR combinations of those. Anything else yields {@code null}, meaning the predicate
 * stays with Calcite.</p>
 *
 * <p><b>Example conversion:</b></p>
 * <pre>
 * SQL: WHERE name = 'Alice' AND (age &gt;= 25 OR age &lt; 18)
 * →
 * OData: name eq 'Alice' and (age ge 25 or age lt 18)
 * </pre>
 */
public class ODataFilterConverter {

    private static final TimeZone GMT = TimeZone.getTimeZone("GMT");
    private static final FastDateFormat DATE_FORMAT = FastDateFormat.getInstance("yyyy-MM-dd", GMT);
    private static final FastDateFormat TIME_FORMAT = FastDateFormat.getInstance("HH:mm:ss", GMT);
    private static final FastDateFormat TIMESTAMP_FORMAT = FastDateFormat.getInstance("yyyy-MM-dd'T'HH:mm:ss'Z'", GMT);

    /** Table columns in row type order, filters reference them by index */
    private final List<ColumnDescriptor> columns;
    private final TableCapabilities capabilities;

    public ODataFilterConverter(List<ColumnDescriptor> columns, TableCapabilities capabilities) {
        this.columns = columns;
        this.capabilities = capabilities;
    }

    /**
     * Converts the conjunction of {@code filters}, dropping the conjuncts that cannot be pushed.
     *
     * @return OData filter, or null when nothing could be converted
     */
    public String convertConjunction(List<RexNode> filters) {
        List<String> converted = new ArrayList<>();
        for (RexNode filter : filters) {
            String odata = convert(filter);
            if (odata != null) {
                converted.add(odata);
            }
        }
        if (converted.isEmpty()) {
            return null;
        }
        return String.join(" and ", converted);
    }

    /**
     * @param node filter expression
     * @return OData text, or null if the expression (or any part of it) cannot be pushed
     */
    public String convert(RexNode node) {
        if (!(node instanceof RexCall)) {
            return null;
        }
        RexCall call = (RexCall) node;
        switch (call.getKind()) {
            case AND:
                return combine(call.getOperands(), " and ");
            case OR:
                return combine(call.getOperands(), " or ");
            case IS_NULL:
                return nullCheck(call, "eq");
            case IS_NOT_NULL:
                return nullCheck(call, "ne");
            case EQUALS:
            case NOT_EQUALS:
            case GREATER_THAN:
            case GREATER_THAN_OR_EQUAL:
            case LESS_THAN:
            case LESS_THAN_OR_EQUAL:
                return comparison(call);
            default:
                return null;
        }
    }

    private String combine(List<RexNode> operands, String separator) {
        List<String> parts = new ArrayList<>();
        for (RexNode operand : operands) {
            String part = convert(operand);
            if (part == null) {
                return null;
            }
            parts.add(part);
        }
        return "(" + String.join(separator, parts) + ")";
    }

    private String nullCheck(RexCall call, String operator) {
        String column = filterableColumn(unwrapCast(call.getOperands().get(0)));
        if (column == null) {
            return null;
        }
        return column + " " + operator + " null";
    }

    private String comparison(RexCall call) {
        if (call.getOperands().size() != 2) {
            return null;
        }
        RexNode left = unwrapCast(call.getOperands().get(0));
        RexNode right = unwrapCast(call.getOperands().get(1));
        SqlKind kind = call.getKind();

        if (left instanceof RexLiteral && right instanceof RexInputRef) {
            RexNode swap = left;
            left = right;
            right = swap;
            kind = kind.reverse();
        }
        if (!(right instanceof RexLiteral)) {
            return null;
        }

        String column = filterableColumn(left);
        if (column == null) {
            return null;
        }
        String literal = formatLiteral((RexLiteral) right);
        if (literal == null) {
            return null;
        }
        return column + " " + operator(kind) + " " + literal;
    }

    private String filterableColumn(RexNode node) {
        if (!(node instanceof RexInputRef)) {
            return null;
        }
        int index = ((RexInputRef) node).getIndex();
        if (index >= columns.size()) {
            return null;
        }
        String name = columns.get(index).getLogicalName();
        return capabilities.isColumnFilterable(name) ? name : null;
    }

    private static RexNode unwrapCast(RexNode node) {
        if (node instanceof RexCall && node.getKind() == SqlKind.CAST) {
            RexNode operand = ((RexCall) node).getOperands().get(0);
            if (operand instanceof RexInputRef || operand instanceof RexLiteral) {
                return operand;
            }
        }
        return node;
    }

    private static String operator(SqlKind kind) {
        switch (kind) {
            case EQUALS:
                return "eq";
            case NOT_EQUALS:
                return "ne";
            case GREATER_THAN:
                return "gt";
            case GREATER_THAN_OR_EQUAL:
                return "ge";
            case LESS_THAN:
                return "lt";
            case LESS_THAN_OR_EQUAL:
                return "le";
            default:
                throw new IllegalStateException("Unexpected operator: " + kind);
        }
    }

    /**
     * Formats a literal in OData syntax; strings are quoted with embedded quotes doubled.
     *
     * @return OData literal, or null for types that are not pushed down
     */
    static String formatLiteral(RexLiteral literal) {
        if (literal.isNull()) {
            return "null";
        }
        switch (literal.getTypeName()) {
            case BOOLEAN:
                return String.valueOf(literal.getValueAs(Boolean.class));
            case CHAR:
            case VARCHAR:
                return "'" + literal.getValueAs(String.class).replace("'", "''") + "'";
            case TINYINT:
            case SMALLINT:
            case INTEGER:
            case BIGINT:
            case DECIMAL:
            case FLOAT:
            case REAL:
            case DOUBLE:
                return literal.getValueAs(BigDecimal.class).toPlainString();
            case DATE:
                return DATE_FORMAT.format(literal.getValueAs(Calendar.class));
            case TIME:
                return TIME_FORMAT.format(literal.getValueAs(Calendar.class));
            case TIMESTAMP:
                return TIMESTAMP_FORMAT.format(literal.getValueAs(Calendar.class));
            default:
                return null;
        }
    }
}
