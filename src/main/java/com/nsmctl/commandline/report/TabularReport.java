package com.nsmctl.commandline.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Value;

/**
 * Read-only tabulated view returned when an execution pass changes nothing.
 */
@Value
public class TabularReport {

    List<String> headers;
    List<List<Object>> rows;

    public TabularReport(List<String> headers, List<List<Object>> rows) {
        this.headers = List.copyOf(headers);
        List<List<Object>> copied = new ArrayList<>();
        for (List<Object> row : rows) {
            if (row.size() != headers.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " cell(s), expected " + headers.size() + ": " + row);
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = List.copyOf(copied);
    }

    public int rowCount() {
        return rows.size();
    }

    public String render() {
        return ReportRenderer.getDefault().render(this);
    }

    @Override
    public String toString() {
        return render();
    }
}
