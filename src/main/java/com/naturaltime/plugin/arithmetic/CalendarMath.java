package com.naturaltime.plugin.arithmetic;

import com.naturaltime.config.Constants;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoField;

/**
 * 按年、月、日分量做日历加法，日期超出目标月份时截断到月末。
 */
public final class CalendarMath {

    private CalendarMath() {
    }

    /**
     * 增加若干个月，保留时刻；1 月 31 日加一个月得到 2 月最后一天。
     */
    public static LocalDateTime plusMonths(LocalDateTime base, long months) {
        if (months == 0) {
            return base;
        }
        long monthIndex = Math.addExact(
                Math.multiplyExact((long) base.getYear(), Constants.MONTHS_PER_YEAR),
                base.getMonthValue() - 1L);
        long targetIndex = Math.addExact(monthIndex, months);

        int year = ChronoField.YEAR.checkValidIntValue(Math.floorDiv(targetIndex, Constants.MONTHS_PER_YEAR));
        int month = (int) Math.floorMod(targetIndex, Constants.MONTHS_PER_YEAR) + 1;
        int day = Math.min(base.getDayOfMonth(), YearMonth.of(year, month).lengthOfMonth());

        return LocalDateTime.of(LocalDate.of(year, month, day), base.toLocalTime());
    }

    /**
     * 增加若干年；闰年 2 月 29 日落到平年时截断为 2 月 28 日。
     */
    public static LocalDateTime plusYears(LocalDateTime base, long years) {
        return plusMonths(base, Math.multiplyExact(years, Constants.MONTHS_PER_YEAR));
    }
}
