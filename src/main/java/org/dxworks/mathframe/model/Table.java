package org.dxworks.mathframe.model;

import java.util.ArrayList;
import java.util.List;

/** {@code <mtable>}: rows of cells, each cell a single node. */
public final class Table extends MathNode {
    public final List<List<MathNode>> rows;

    public Table(List<List<MathNode>> rows) {
        List<List<MathNode>> copy = new ArrayList<>(rows.size());
        for (List<MathNode> row : rows) {
            copy.add(List.copyOf(row));
        }
        this.rows = List.copyOf(copy);
    }

    @Override
    public String flatText() {
        return "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table)) return false;
        return rows.equals(((Table) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "Table" + rows;
    }
}
