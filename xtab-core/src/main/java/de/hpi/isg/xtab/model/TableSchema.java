package de.hpi.isg.xtab.model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Represents the schema of a respondent table, i.e., its named {@link Column}s.
 *
 * @see RespondentTable
 */
public class TableSchema implements Serializable {

    private final String name;

    private final List<Column> columns = new ArrayList<>();

    private final Object2IntMap<String> columnIndex = new Object2IntOpenHashMap<>();

    public TableSchema(String name) {
        this.name = name;
        this.columnIndex.defaultReturnValue(-1);
    }

    public String getName() {
        return this.name;
    }

    public List<Column> getColumns() {
        return Collections.unmodifiableList(this.columns);
    }

    /**
     * Append a {@link Column} to this instance.
     *
     * @param name the name of the new {@link Column}
     * @return the new {@link Column}
     */
    Column appendColumn(String name) {
        if (this.columnIndex.containsKey(name)) {
            throw new IllegalArgumentException(String.format("Duplicate column \"%s\" in %s.", name, this.name));
        }
        Column column = new Column(this, name, this.columns.size());
        this.columns.add(column);
        this.columnIndex.put(name, column.getIndex());
        return column;
    }

    /**
     * @return the {@link Column} with the given name or {@code null} if there is no such {@link Column}
     */
    public Column getColumn(String name) {
        int index = this.columnIndex.getInt(name);
        return index == -1 ? null : this.columns.get(index);
    }

    public Column getColumn(int index) {
        return this.columns.get(index);
    }

    public boolean hasColumn(String name) {
        return this.columnIndex.containsKey(name);
    }

    public List<String> getColumnNames() {
        return this.columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    /**
     * Find the names of all {@link Column}s that satisfy a {@link Predicate}, in schema order.
     */
    public List<String> findColumnNames(Predicate<String> predicate) {
        return this.columns.stream().map(Column::getName).filter(predicate).collect(Collectors.toList());
    }

    public int getNumColumns() {
        return this.columns.size();
    }

    @Override
    public String toString() {
        return "TableSchema[" + this.name + ", " + this.columns.size() + " columns]";
    }
}
