package com.actexport.core.grid;

import com.actexport.core.model.ActTable;

import java.util.List;
import java.util.Optional;

/**
 * Domain tables whose stored two-row header is replaced by a fixed one-row header.
 */
public final class FixedHeaders {

    /** Number of stored header rows discarded by the override. */
    public static final int STORED_HEADER_ROWS = 2;

    public static final List<String> METRICS = List.of(
        "Код метрики",
        "Наименование метрики",
        "Количество клиентов / элементов (ФЛ), ед.",
        "Количество клиентов / элементов (ЮЛ), ед.",
        "Сумма, руб.",
        "Код БП",
        "Пункт / подпункт акта"
    );

    public static final List<String> OPERATIONAL_RISK = List.of(
        "Код процесса",
        "Блок - владелец процесса",
        "Тип рискового события (уровень 2)",
        "Оценка суммы события, руб",
        "Подтип последствия",
        "Сумма последствия"
    );

    private FixedHeaders() {
    }

    /**
     * Returns the fixed header of a domain table.
     *
     * @param table table to inspect
     * @return fixed header, or empty for ordinary tables
     */
    public static Optional<List<String>> forTable(ActTable table) {
        if (table.metricsTable() || table.mainMetricsTable()) {
            return Optional.of(METRICS);
        }
        if (table.operationalRiskTable()) {
            return Optional.of(OPERATIONAL_RISK);
        }
        return Optional.empty();
    }
}
