package com.example.finrecon.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

import java.time.LocalDate;

/** Closed date interval [from, to]. */
@Value
@Schema(description = "조회 기간(양 끝 포함)")
public class DateRange {
    @Schema(description = "시작일", example = "2024-05-01")
    LocalDate from;

    @Schema(description = "종료일", example = "2024-05-31")
    LocalDate to;

    public DateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) throw new IllegalArgumentException("from/to must not be null");
        if (to.isBefore(from)) throw new IllegalArgumentException("to (" + to + ") is before from (" + from + ")");
        this.from = from;
        this.to = to;
    }

    /** today - behindDays .. today + aheadDays */
    public static DateRange around(LocalDate today, int behindDays, int aheadDays) {
        return new DateRange(today.minusDays(Math.max(0, behindDays)), today.plusDays(Math.max(0, aheadDays)));
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(from) && !date.isAfter(to);
    }
}
