package de.hpi.isg.xtab.filter;

import de.hpi.isg.xtab.model.ColumnVector;
import de.hpi.isg.xtab.model.RespondentTable;

import java.util.List;
import java.util.Set;

/**
 * A node in the syntax tree of a filter expression. Evaluation follows three-valued logic: {@code null} stands for
 * an unknown result, e.g., a comparison with a missing value.
 */
abstract class FilterNode {

    /**
     * Evaluates this node for a single respondent.
     *
     * @return the result or {@code null} if it is unknown
     */
    abstract Boolean evaluate(RespondentTable table, int row);

    /**
     * Collects the names of all columns referenced by this node.
     */
    abstract void collectColumns(Set<String> columns);

    /**
     * A literal value, either a number or a text.
     */
    static class Literal {

        private final String text;

        private final double number;

        private Literal(String text, double number) {
            this.text = text;
            this.number = number;
        }

        static Literal ofText(String text) {
            return new Literal(text, Double.NaN);
        }

        static Literal ofNumber(String text) {
            return new Literal(text, Double.parseDouble(text));
        }

        boolean isNumeric() {
            return !Double.isNaN(this.number);
        }

        /**
         * Compares a column value with this literal.
         *
         * @return the comparison result or {@code null} if the value is missing or not comparable
         */
        Integer compareWith(ColumnVector column, int row) {
            if (this.isNumeric()) {
                double value = column.getNumber(row);
                return Double.isNaN(value) ? null : Double.compare(value, this.number);
            }
            String value = column.getText(row);
            return value == null ? null : value.compareTo(this.text);
        }

        @Override
        public String toString() {
            return this.isNumeric() ? this.text : "'" + this.text + "'";
        }
    }

    /**
     * Compares a column with a literal.
     */
    static class Comparison extends FilterNode {

        private final String column;

        private final String comparator;

        private final Literal literal;

        Comparison(String column, String comparator, Literal literal) {
            this.column = column;
            this.comparator = comparator;
            this.literal = literal;
        }

        @Override
        Boolean evaluate(RespondentTable table, int row) {
            Integer comparison = this.literal.compareWith(table.getColumn(this.column), row);
            if (comparison == null) return null;
            switch (this.comparator) {
                case "==":
                    return comparison == 0;
                case "!=":
                    return comparison != 0;
                case "<":
                    return comparison < 0;
                case "<=":
                    return comparison <= 0;
                case ">":
                    return comparison > 0;
                case ">=":
                    return comparison >= 0;
                default:
                    throw new IllegalStateException("Unknown comparator: " + this.comparator);
            }
        }

        @Override
        void collectColumns(Set<String> columns) {
            columns.add(this.column);
        }

        @Override
        public String toString() {
            return String.format("%s %s %s", this.column, this.comparator, this.literal);
        }
    }

    /**
     * Tests whether a column value is one of several literals. Missing values are never members.
     */
    static class Membership extends FilterNode {

        private final String column;

        private final List<Literal> literals;

        Membership(String column, List<Literal> literals) {
            this.column = column;
            this.literals = literals;
        }

        @Override
        Boolean evaluate(RespondentTable table, int row) {
            ColumnVector vector = table.getColumn(this.column);
            for (Literal literal : this.literals) {
                Integer comparison = literal.compareWith(vector, row);
                if (comparison != null && comparison == 0) return true;
            }
            return false;
        }

        @Override
        void collectColumns(Set<String> columns) {
            columns.add(this.column);
        }

        @Override
        public String toString() {
            return String.format("%s %%in%% c%s", this.column, this.literals);
        }
    }

    /**
     * Tests whether a column value is missing.
     */
    static class MissingCheck extends FilterNode {

        private final String column;

        MissingCheck(String column) {
            this.column = column;
        }

        @Override
        Boolean evaluate(RespondentTable table, int row) {
            return table.getColumn(this.column).isMissing(row);
        }

        @Override
        void collectColumns(Set<String> columns) {
            columns.add(this.column);
        }

        @Override
        public String toString() {
            return String.format("is.na(%s)", this.column);
        }
    }

    static class Negation extends FilterNode {

        private final FilterNode operand;

        Negation(FilterNode operand) {
            this.operand = operand;
        }

        @Override
        Boolean evaluate(RespondentTable table, int row) {
            Boolean result = this.operand.evaluate(table, row);
            return result == null ? null : !result;
        }

        @Override
        void collectColumns(Set<String> columns) {
            this.operand.collectColumns(columns);
        }

        @Override
        public String toString() {
            return "!(" + this.operand + ")";
        }
    }

    /**
     * Combines two nodes with {@code &} ({@code isConjunction}) or {@code |}.
     */
    static class Junction extends FilterNode {

        private final FilterNode left, right;

        private final boolean isConjunction;

        Junction(FilterNode left, FilterNode right, boolean isConjunction) {
            this.left = left;
            this.right = right;
            this.isConjunction = isConjunction;
        }

        @Override
        Boolean evaluate(RespondentTable table, int row) {
            Boolean left = this.left.evaluate(table, row), right = this.right.evaluate(table, row);
            // Kleene logic: a decisive operand wins over an unknown one.
            boolean decisive = !this.isConjunction;
            if (Boolean.valueOf(decisive).equals(left) || Boolean.valueOf(decisive).equals(right)) return decisive;
            if (left == null || right == null) return null;
            return !decisive;
        }

        @Override
        void collectColumns(Set<String> columns) {
            this.left.collectColumns(columns);
            this.right.collectColumns(columns);
        }

        @Override
        public String toString() {
            return String.format("(%s %s %s)", this.left, this.isConjunction ? "&" : "|", this.right);
        }
    }
}
