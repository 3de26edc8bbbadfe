package com.fincraft.etl.table;

public enum PayloadLayout {
    /** Named arrays of reports, each report carrying its own period field (statements). */
    REPORT_SECTIONS,
    /** One object keyed by period date (daily price series). */
    PERIOD_KEYED,
    /** A {@code data} array of {date, value} points (macro series). */
    SERIES_ARRAY
}
