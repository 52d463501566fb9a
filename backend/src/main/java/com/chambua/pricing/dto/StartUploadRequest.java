package com.chambua.pricing.dto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public class StartUploadRequest {
    private String filename;
    private LocalDate observedDate;
    private List<PriceListRow> rows = new ArrayList<>();

    public StartUploadRequest() {}

    public StartUploadRequest(String filename, LocalDate observedDate, List<PriceListRow> rows) {
        this.filename = filename;
        this.observedDate = observedDate;
        this.rows = rows;
    }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public LocalDate getObservedDate() { return observedDate; }
    public void setObservedDate(LocalDate observedDate) { this.observedDate = observedDate; }
    public List<PriceListRow> getRows() { return rows; }
    public void setRows(List<PriceListRow> rows) { this.rows = rows; }
}
