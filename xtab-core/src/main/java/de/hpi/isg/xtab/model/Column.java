package de.hpi.isg.xtab.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Represents a column in a {@link TableSchema} (i.e., without data).
 */
public class Column implements Serializable {

    private final TableSchema schema;

    private final String name;

    private final int index;

    Column(TableSchema schema, String name, int index) {
        this.schema = schema;
        this.name = name;
        this.index = index;
    }

    public int getIndex() {
        return this.index;
    }

    public String getName() {
        return this.name;
    }

    public TableSchema getSchema() {
        return this.schema;
    }

    @Override
    public String toString() {
        return '[' + this.name + ']';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Column column = (Column) o;
        return index == column.index &&
                Objects.equals(name, column.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, index);
    }
}
