package com.duckql.filter;

import com.duckql.exception.ValidationException;
import com.duckql.schema.ColumnType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Comparison operators available in filter leaves.
 *
 * <p>Each operator renders to a fixed SQL fragment; values are always bound
 * as parameters. {@link #supports(ColumnType)} decides which operators a
 * column of a given type category accepts.
 */
public enum FilterOperator {

    EQ("eq", "="),
    NE("ne", "!="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    IN("in", "IN"),
    NOT_IN("not_in", "NOT IN"),
    LIKE("like", "LIKE"),
    ILIKE("ilike", "ILIKE"),
    IS_NULL("is_null", "IS NULL");

    private final String operatorName;
    private final String sql;

    FilterOperator(String operatorName, String sql) {
        this.operatorName = operatorName;
        this.sql = sql;
    }

    /**
     * Returns the operator name as written in filter input ({@code eq}, {@code not_in}, ...).
     *
     * @return the operator name
     */
    public String operatorName() {
        return operatorName;
    }

    /**
     * Returns the SQL fragment placed between column and value.
     *
     * @return the SQL fragment
     */
    public String sql() {
        return sql;
    }

    public boolean isListOperator() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Returns whether a column of the given category accepts this operator.
     *
     * @param type the column type category
     * @return true if the operator may be applied
     */
    public boolean supports(ColumnType type) {
        switch (this) {
            case IS_NULL:
            case EQ:
            case NE:
                return true;
            case LIKE:
            case ILIKE:
                return type == ColumnType.STRING;
            case GT:
            case GTE:
            case LT:
            case LTE:
                return type.isOrdered();
            case IN:
            case NOT_IN:
                return type.isOrdered() || type == ColumnType.UUID;
            default:
                return false;
        }
    }

    /**
     * Lists the operator names a column of the given category accepts.
     *
     * @param type the column type category
     * @return the operator names, in declaration order
     */
    public static List<String> supportedNames(ColumnType type) {
        List<String> names = new ArrayList<>();
        for (FilterOperator op : values()) {
            if (op.supports(type)) {
                names.add(op.operatorName);
            }
        }
        return names;
    }

    /**
     * Looks up an operator by its filter-input name (case-insensitive).
     *
     * @param name the operator name
     * @return the operator
     * @throws ValidationException if no operator has that name
     */
    public static FilterOperator fromName(String name) {
        if (name != null) {
            String normalized = name.toLowerCase(Locale.ROOT);
            for (FilterOperator op : values()) {
                if (op.operatorName.equals(normalized)) {
                    return op;
                }
            }
        }
        List<String> known = new ArrayList<>();
        for (FilterOperator op : values()) {
            known.add(op.operatorName);
        }
        throw ValidationException.malformed(null, "Unknown filter operator '" + name + "'",
            "Use one of: " + String.join(", ", known));
    }
}
