package com.fincraft.etl.catalog;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rejects listings that are not common equity: warrants, rights, preferred share classes and units.
 */
public final class SymbolScreener {
    private static final Pattern SUFFIXED = Pattern.compile("^[A-Z0-9]+[.\\-/ ](WS|W|WT|R|RT|RTS|U|UN|UNT|P|PR|PF[A-Z]?|P[A-Z])$");
    private static final Pattern WARRANT_SERIES = Pattern.compile("^[A-Z0-9]+[.\\-/ ]WS[.\\-/ ]?[A-Z]?$");
    private static final Pattern NASDAQ_FIFTH_LETTER = Pattern.compile("^[A-Z]{4}[WRU]$");

    public boolean accept(String symbol) {
        return rejectReason(symbol) == null;
    }

    /**
     * @return null when the symbol is accepted, otherwise a short reason label
     */
    public String rejectReason(String symbol) {
        if (symbol == null || symbol.trim().isEmpty()) {
            return "blank";
        }
        String s = symbol.trim().toUpperCase(Locale.ROOT);
        if (s.contains("^") || s.contains("$")) {
            return "preferred";
        }
        if (WARRANT_SERIES.matcher(s).matches()) {
            return "warrant";
        }
        if (SUFFIXED.matcher(s).matches()) {
            String suffix = s.substring(lastSeparator(s) + 1);
            if (suffix.startsWith("W")) {
                return "warrant";
            }
            if (suffix.startsWith("R")) {
                return "right";
            }
            if (suffix.startsWith("U")) {
                return "unit";
            }
            return "preferred";
        }
        if (NASDAQ_FIFTH_LETTER.matcher(s).matches()) {
            char last = s.charAt(4);
            if (last == 'W') {
                return "warrant";
            }
            return last == 'R' ? "right" : "unit";
        }
        return null;
    }

    private static int lastSeparator(String s) {
        int idx = -1;
        for (char c : new char[]{'.', '-', '/', ' '}) {
            idx = Math.max(idx, s.lastIndexOf(c));
        }
        return idx;
    }
}
