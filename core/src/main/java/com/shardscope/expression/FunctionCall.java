package com.shardscope.expression;

import com.shardscope.types.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a function call.
 *
 * <p>Examples:
 * <pre>
 *   upper(name)
 *   random()
 *   is_active(account_id)
 * </pre>
 *
 * <p>The shard pruner never looks inside a function call; a boolean
 * function used as a filter is an unknown restriction.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;

    /**
     * Creates a function call expression with a nullable result.
     *
     * @param functionName the function name
     * @param arguments the function arguments
     * @param dataType the return data type
     */
    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public String toSQL() {
        return functionName + arguments.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return Objects.equals(functionName, that.functionName) &&
               Objects.equals(arguments, that.arguments) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType);
    }
}
