package com.conveyal.stopboard.loader;

import com.conveyal.stopboard.error.ValueParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLType;

/**
 * Field subclasses process an incoming String that represents a single GTFS CSV field value. The value is validated,
 * converted to its column type and bound to a prepared statement parameter.
 *
 * Problems are signalled with {@link ValueParseException}. Whether such a problem skips the whole row or just
 * nulls out the value depends on the field: required fields and fields marked {@link #strict()} skip the row,
 * all other optional fields fall back to their default value (or null).
 */
public abstract class Field {

    private static final Logger LOG = LoggerFactory.getLogger(Field.class);

    public final String name;
    public final Requirement requirement;
    /**
     * Indicates that this field acts as a foreign key to this referenced table. This is used when creating the
     * table so that referential integrity is enforced by the store.
     */
    public Table referenceTable = null;
    private String defaultValue = null;
    private boolean emptyValuePermitted;
    private boolean strict;

    public Field(String name, Requirement requirement) {
        this.name = name;
        this.requirement = requirement;
    }

    /**
     * Bind the already trimmed, non-empty string to the prepared statement.
     * @throws ValueParseException if the string cannot be converted to this field's type
     */
    protected abstract void setTypedParameter(PreparedStatement preparedStatement, int oneBasedIndex, String string)
        throws SQLException;

    public abstract SQLType getSqlType ();

    /**
     * Validate the raw CSV value and bind it, applying this field's default, empty and strictness rules.
     *
     * @param string raw value from the CSV reader, possibly null when the column is absent from the file
     * @throws ValueParseException if the row holding this value must be skipped
     */
    public void setParameter(PreparedStatement preparedStatement, int oneBasedIndex, String string) throws SQLException {
        String clean = string == null ? "" : string.trim();
        if (clean.isEmpty() && defaultValue != null) clean = defaultValue;
        if (clean.isEmpty()) {
            if (emptyValuePermitted) {
                preparedStatement.setString(oneBasedIndex, "");
            } else if (isRequired()) {
                throw new ValueParseException("Missing required field " + name, clean);
            } else {
                setNull(preparedStatement, oneBasedIndex);
            }
            return;
        }
        try {
            setTypedParameter(preparedStatement, oneBasedIndex, clean);
        } catch (ValueParseException e) {
            if (isRequired() || strict) throw e;
            LOG.debug("Replacing unparseable {} value '{}' with default {}", name, clean, defaultValue);
            if (defaultValue != null) setTypedParameter(preparedStatement, oneBasedIndex, defaultValue);
            else setNull(preparedStatement, oneBasedIndex);
        }
    }

    public void setNull(PreparedStatement preparedStatement, int oneBasedIndex) throws SQLException {
        preparedStatement.setNull(oneBasedIndex, getSqlType().getVendorTypeNumber());
    }

    /**
     * Finds the index of the field given a string name.
     * @return the index of the field or -1 if no match is found
     */
    public static int getFieldIndex (Field[] fields, String name) {
        // Linear search, assuming a small number of fields per table.
        for (int i = 0; i < fields.length; i++) if (fields[i].name.equals(name)) return i;
        return -1;
    }

    // Overridden to create exception for "double precision", since its enum value is just called DOUBLE.
    public String getSqlTypeName () {
        return getSqlType().getName().toLowerCase();
    }

    public String getSqlDeclaration() {
        return String.join(" ", name, getSqlTypeName());
    }

    public boolean isRequired () {
        return this.requirement == Requirement.REQUIRED;
    }

    public boolean isForeignReference () {
        return this.referenceTable != null;
    }

    /**
     * Fluent method that indicates that this field is a reference to an entry in the table provided as an argument.
     */
    public Field isReferenceTo(Table table) {
        this.referenceTable = table;
        return this;
    }

    /**
     * Fluent method to substitute a value for empty or unparseable optional values.
     */
    public Field withDefault(String defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    /**
     * Fluent method to store an empty value as the empty string rather than rejecting the row or storing null. Used
     * for key columns that GTFS allows to be blank.
     */
    public Field permitEmptyValue () {
        this.emptyValuePermitted = true;
        return this;
    }

    /**
     * Fluent method to skip the whole row when this optional field holds an unparseable value, instead of storing
     * null. Used for coordinates, where a null that looks like zero would be worse than no row at all.
     */
    public Field strict () {
        this.strict = true;
        return this;
    }

}
