package com.chambua.pricing.service;

import com.chambua.pricing.dto.PriceListRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the fixed price-list layout {@code article,name,price[,currency][,in_stock]} with a header row.
 * English and Russian header names are accepted, and a semicolon-separated file is detected from its
 * header line.
 *
 * Every data row is returned, even one with an empty article or an unreadable price, so failures keep
 * their position in the batch and are reported by the upload.
 */
@Component
public class PriceListCsvReader {

    private static final Set<String> ARTICLE_HEADERS = Set.of("article", "external_id", "sku", "артикул");
    private static final Set<String> NAME_HEADERS = Set.of("name", "raw_name", "наименование");
    private static final Set<String> PRICE_HEADERS = Set.of("price", "raw_price", "цена");
    private static final Set<String> CURRENCY_HEADERS = Set.of("currency", "валюта");
    private static final Set<String> STOCK_HEADERS = Set.of("in_stock", "stock", "наличие");

    /**
     * @throws IllegalArgumentException when the header row lacks an article or price column
     */
    public List<PriceListRow> read(Reader source, LocalDate observedDate) throws IOException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        reader.mark(8192);
        String headerLine = reader.readLine();
        if (headerLine == null) throw new IllegalArgumentException("Empty file");
        reader.reset();
        char delimiter = headerLine.indexOf(';') >= 0 && headerLine.indexOf(',') < 0 ? ';' : ',';

        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        List<PriceListRow> rows = new ArrayList<>();
        try (CSVParser parser = new CSVParser(reader, fmt)) {
            Map<String, String> columns = columnsByKey(parser.getHeaderNames());
            String article = find(columns, ARTICLE_HEADERS);
            String price = find(columns, PRICE_HEADERS);
            if (article == null) throw new IllegalArgumentException("Missing article column");
            if (price == null) throw new IllegalArgumentException("Missing price column");
            String name = find(columns, NAME_HEADERS);
            String currency = find(columns, CURRENCY_HEADERS);
            String stock = find(columns, STOCK_HEADERS);

            for (CSVRecord rec : parser) {
                rows.add(new PriceListRow(
                        opt(rec, article),
                        parsePrice(opt(rec, price)),
                        opt(rec, currency),
                        observedDate,
                        parseStock(opt(rec, stock)),
                        opt(rec, name)));
            }
        }
        return rows;
    }

    private static Map<String, String> columnsByKey(List<String> headers) {
        Map<String, String> out = new HashMap<>();
        for (String h : headers) {
            if (h == null) continue;
            String key = h.replace("\uFEFF", "").trim().toLowerCase(Locale.ROOT);
            out.putIfAbsent(key, h);
        }
        return out;
    }

    private static String find(Map<String, String> columns, Set<String> aliases) {
        for (Map.Entry<String, String> e : columns.entrySet()) {
            if (aliases.contains(e.getKey())) return e.getValue();
        }
        return null;
    }

    private static String opt(CSVRecord rec, String column) {
        if (column == null || !rec.isMapped(column) || !rec.isSet(column)) return null;
        String v = rec.get(column);
        return v == null || v.isBlank() ? null : v.trim();
    }

    /** "1 234,50", "1 234.5" and "1234" are read; anything else is no price. */
    static BigDecimal parsePrice(String s) {
        if (s == null) return null;
        String t = s.replace(" ", "").replace("\u00A0", "").replace("\u202F", "").replace(',', '.');
        if (t.isEmpty()) return null;
        try {
            return new BigDecimal(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static Boolean parseStock(String s) {
        if (s == null) return null;
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "0": case "false": case "no": case "n": case "нет":
                return Boolean.FALSE;
            default:
                return Boolean.TRUE;
        }
    }
}
