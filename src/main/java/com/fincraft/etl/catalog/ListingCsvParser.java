package com.fincraft.etl.catalog;

import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.EntityKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the upstream listing file: {@code symbol,name,exchange,assetType,ipoDate,delistingDate,status}.
 */
public final class ListingCsvParser {

    public List<CatalogEntity> parse(String body, String source) {
        if (body == null || body.trim().isEmpty()) {
            return List.of();
        }
        String[] lines = body.trim().split("\\r?\\n");
        Map<String, Integer> header = indexHeader(splitLine(lines[0]));
        if (!header.containsKey("symbol")) {
            String sample = lines[0].length() > 120 ? lines[0].substring(0, 120) : lines[0];
            throw new IllegalArgumentException("unexpected_listing_header:" + sample);
        }

        List<CatalogEntity> out = new ArrayList<>(Math.max(16, lines.length));
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            List<String> cols = splitLine(line);
            String symbol = column(cols, header, "symbol");
            if (symbol.isEmpty()) {
                continue;
            }
            String status = column(cols, header, "status");
            boolean active = status.isEmpty() || "active".equalsIgnoreCase(status);
            out.add(new CatalogEntity(
                    symbol,
                    column(cols, header, "name"),
                    EntityKind.SYMBOL,
                    column(cols, header, "assettype"),
                    column(cols, header, "exchange"),
                    status.isEmpty() ? "Active" : status,
                    active,
                    source,
                    null
            ));
        }
        return out;
    }

    private Map<String, Integer> indexHeader(List<String> cols) {
        Map<String, Integer> out = new HashMap<>();
        for (int i = 0; i < cols.size(); i++) {
            out.put(cols.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        return out;
    }

    private String column(List<String> cols, Map<String, Integer> header, String name) {
        Integer idx = header.get(name);
        if (idx == null || idx >= cols.size()) {
            return "";
        }
        String value = cols.get(idx).trim();
        return "null".equalsIgnoreCase(value) ? "" : value;
    }

    static List<String> splitLine(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == ',' && !quoted) {
                out.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        out.add(current.toString());
        return out;
    }
}
