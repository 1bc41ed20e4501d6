package com.reportsync.session;

import java.time.LocalDate;
import java.util.Objects;

public record DateFilter(LocalDate start, LocalDate end, String inputId) {

    public DateFilter {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
        inputId = inputId == null || inputId.isBlank() ? "0" : inputId.trim();
    }

    public static DateFilter sameDay(LocalDate date, String inputId) {
        return new DateFilter(date, date, inputId);
    }
}
