package com.example.dsload.processor;

import com.example.dsload.exception.MalformedFileException;
import com.example.dsload.model.Dataset;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DeduplicatorTest {

    private final Deduplicator deduplicator = new Deduplicator();

    @Test
    public void testKeepsLastOccurrenceInFileOrder() {
        Dataset dataset = dataset(
                row(1, "2024-01-01", "first"),
                row(2, "2024-01-01", "other"),
                row(1, "2024-01-01", "correction"),
                row(3, "2024-01-01", "third"));

        int removed = deduplicator.deduplicate(dataset, List.of("account_rk", "on_date"));

        assertThat(removed).isEqualTo(1);
        assertThat(dataset.getRows()).extracting(r -> r.get("note"))
                .containsExactly("other", "correction", "third");
    }

    @Test
    public void testWholeKeyMustMatch() {
        Dataset dataset = dataset(
                row(1, "2024-01-01", "a"),
                row(1, "2024-01-02", "b"));

        assertThat(deduplicator.deduplicate(dataset, List.of("account_rk", "on_date"))).isZero();
        assertThat(dataset.size()).isEqualTo(2);
    }

    @Test
    public void testNullKeyValuesCollide() {
        Dataset dataset = dataset(
                row(1, null, "a"),
                row(1, null, "b"));

        assertThat(deduplicator.deduplicate(dataset, List.of("account_rk", "on_date"))).isEqualTo(1);
        assertThat(dataset.getRows().get(0)).containsEntry("note", "b");
    }

    @Test
    public void testWithoutKeyDatasetIsUntouched() {
        Dataset dataset = dataset(
                row(1, "2024-01-01", "a"),
                row(1, "2024-01-01", "a"));

        assertThat(deduplicator.deduplicate(dataset, List.of())).isZero();
        assertThat(dataset.size()).isEqualTo(2);
    }

    @Test
    public void testMissingKeyColumnIsRejected() {
        Dataset dataset = dataset(row(1, "2024-01-01", "a"));

        assertThatThrownBy(() -> deduplicator.deduplicate(dataset, List.of("currency_rk")))
                .isInstanceOf(MalformedFileException.class)
                .hasMessageContaining("currency_rk");
    }

    private static Map<String, Object> row(int account, String date, String note) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("account_rk", String.valueOf(account));
        row.put("on_date", date == null ? null : LocalDate.parse(date));
        row.put("note", note);
        return row;
    }

    @SafeVarargs
    private static Dataset dataset(Map<String, Object>... rows) {
        return new Dataset(List.of("account_rk", "on_date", "note"), new ArrayList<>(List.of(rows)));
    }
}
