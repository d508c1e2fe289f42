package org.example.stackanalysis.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Report {
    private final List<String> rows;

    public Report(String header) {
        this.rows = new ArrayList<>();
        this.rows.add(header);
    }

    public void addRow(String row) {
        rows.add(row);
    }

    public List<String> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public int getDataRowCount() {
        return rows.size() - 1;
    }

    public String toCsv() {
        return String.join("\n", rows);
    }
}
