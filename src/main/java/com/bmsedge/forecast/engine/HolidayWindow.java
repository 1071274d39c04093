package com.bmsedge.forecast.engine;

import lombok.Getter;

import java.time.LocalDate;

/**
 * A run of days within one month that carries its own demand multiplier.
 */
@Getter
public final class HolidayWindow {

    private final String name;
    private final int monthIndex;
    private final int firstDay;
    private final int lastDay;
    private final double multiplier;

    public HolidayWindow(String name, int monthIndex, int firstDay, int lastDay, double multiplier) {
        this.name = name;
        this.monthIndex = monthIndex;
        this.firstDay = firstDay;
        this.lastDay = lastDay;
        this.multiplier = multiplier;
    }

    public boolean contains(LocalDate date) {
        int day = date.getDayOfMonth();
        return date.getMonthValue() - 1 == monthIndex && day >= firstDay && day <= lastDay;
    }
}
