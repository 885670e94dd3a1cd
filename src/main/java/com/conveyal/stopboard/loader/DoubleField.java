package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.error.ValueParseException;

import java.sql.JDBCType;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLType;

public class DoubleField extends Field {

    private final double minValue;
    private final double maxValue;

    public DoubleField (String name, Requirement requirement, double minValue, double maxValue) {
        super(name, requirement);
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    double validate(String string) {
        double value;
        try {
            value = Double.parseDouble(string);
        } catch (NumberFormatException e) {
            throw new ValueParseException("Not a number for " + name, string, e);
        }
        // Double.parseDouble happily accepts "NaN" and "Infinity".
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ValueParseException("Not a finite number for " + name, string);
        }
        if (value < minValue) throw new ValueParseException("Number too small for " + name, string);
        if (value > maxValue) throw new ValueParseException("Number too large for " + name, string);
        return value;
    }

    @Override
    protected void setTypedParameter (PreparedStatement preparedStatement, int oneBasedIndex, String string)
        throws SQLException {
        preparedStatement.setDouble(oneBasedIndex, validate(string));
    }

    @Override
    public SQLType getSqlType () {
        return JDBCType.DOUBLE;
    }

    @Override
    public String getSqlTypeName () {
        return "double precision";
    }

}
