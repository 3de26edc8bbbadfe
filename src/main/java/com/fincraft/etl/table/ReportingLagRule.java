package com.fincraft.etl.table;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Decides which period upstream can be expected to have published by a given date.
 * Data for a period ending on {@code E} is assumed available from {@code E + 1 + lagDays}.
 */
public final class ReportingLagRule {
    private static final int MAX_WALK_BACK = 64;

    public enum Frequency {
        QUARTERLY,
        MONTHLY,
        DAILY,
        NONE
    }

    private final Frequency frequency;
    private final int lagDays;

    private ReportingLagRule(Frequency frequency, int lagDays) {
        if (lagDays < 0) {
            throw new IllegalArgumentException("reporting lag must not be negative: " + lagDays);
        }
        this.frequency = frequency == null ? Frequency.NONE : frequency;
        this.lagDays = lagDays;
    }

    public static ReportingLagRule quarterly(int lagDays) {
        return new ReportingLagRule(Frequency.QUARTERLY, lagDays);
    }

    public static ReportingLagRule monthly(int lagDays) {
        return new ReportingLagRule(Frequency.MONTHLY, lagDays);
    }

    public static ReportingLagRule daily(int lagDays) {
        return new ReportingLagRule(Frequency.DAILY, lagDays);
    }

    public static ReportingLagRule none() {
        return new ReportingLagRule(Frequency.NONE, 0);
    }

    public ReportingLagRule withLagDays(int days) {
        return new ReportingLagRule(frequency, days);
    }

    public Frequency frequency() {
        return frequency;
    }

    public int lagDays() {
        return lagDays;
    }

    /**
     * @return the most recent period end whose data should exist on {@code asOf}, or null when the rule is disabled
     */
    public LocalDate expectedLatestPeriod(LocalDate asOf) {
        if (asOf == null || frequency == Frequency.NONE) {
            return null;
        }
        LocalDate end = periodEndOnOrBefore(asOf);
        for (int i = 0; i < MAX_WALK_BACK; i++) {
            if (!asOf.isBefore(end.plusDays(1L + lagDays))) {
                return end;
            }
            end = previousPeriodEnd(end);
        }
        return end;
    }

    /**
     * True when {@code latestPeriod} already covers the period expected on {@code asOf}.
     */
    public boolean coversExpected(LocalDate latestPeriod, LocalDate asOf) {
        LocalDate expected = expectedLatestPeriod(asOf);
        return expected != null && latestPeriod != null && !latestPeriod.isBefore(expected);
    }

    private LocalDate periodEndOnOrBefore(LocalDate date) {
        switch (frequency) {
            case QUARTERLY: {
                int quarterEndMonth = ((date.getMonthValue() - 1) / 3) * 3 + 3;
                LocalDate end = endOfMonth(LocalDate.of(date.getYear(), quarterEndMonth, 1));
                return end.isAfter(date) ? previousPeriodEnd(end) : end;
            }
            case MONTHLY: {
                LocalDate end = endOfMonth(date);
                return end.isAfter(date) ? previousPeriodEnd(end) : end;
            }
            case DAILY:
                return isWeekend(date) ? previousPeriodEnd(date) : date;
            default:
                return date;
        }
    }

    private LocalDate previousPeriodEnd(LocalDate end) {
        switch (frequency) {
            case QUARTERLY:
                return endOfMonth(end.withDayOfMonth(1).minusMonths(3));
            case MONTHLY:
                return end.withDayOfMonth(1).minusDays(1);
            case DAILY: {
                LocalDate prev = end.minusDays(1);
                while (isWeekend(prev)) {
                    prev = prev.minusDays(1);
                }
                return prev;
            }
            default:
                return end;
        }
    }

    private static LocalDate endOfMonth(LocalDate date) {
        return date.withDayOfMonth(date.lengthOfMonth());
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    @Override
    public String toString() {
        return frequency.name().toLowerCase(Locale.ROOT) + "+" + lagDays + "d";
    }
}
