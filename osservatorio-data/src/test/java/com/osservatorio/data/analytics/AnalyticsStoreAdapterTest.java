package com.osservatorio.data.analytics;

import com.osservatorio.common.concurrent.CancellationSignal;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.model.Subsystem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyticsStoreAdapterTest {

    private SingleConnectionDataSource dataSource;
    private AnalyticsStoreAdapter adapter;

    @BeforeEach
    void setUp() {
        dataSource = new SingleConnectionDataSource("jdbc:duckdb:", true);
        dataSource.setDriverClassName("org.duckdb.DuckDBDriver");
        adapter = new AnalyticsStoreAdapter(new JdbcTemplate(dataSource),
                new DataSourceTransactionManager(dataSource), Duration.ofSeconds(30), 2);
        adapter.initializeSchema();
    }

    @AfterEach
    void tearDown() {
        adapter.shutdown();
        dataSource.destroy();
    }

    private static Observation obs(int year, String territory, String measure, Double value) {
        return Observation.builder()
                .periodYear(year)
                .territoryCode(territory)
                .territoryName("Territory " + territory)
                .measureCode(measure)
                .measureName("Measure " + measure)
                .value(value)
                .status("A")
                .build();
    }

    private static ObservationBatch populationBatch() {
        return ObservationBatch.builder()
                .datasetId("pop")
                .batchId("b1")
                .row(obs(2020, "ITC1", "POP", 4300.0))
                .row(obs(2021, "ITC1", "POP", 4250.0))
                .row(obs(2020, "ITF3", "POP", 5700.0))
                .row(obs(2021, "ITF3", "POP", 5650.0))
                .row(obs(2021, "ITH5", "POP", 4400.0))
                .build();
    }

    @Test
    void loadsBatchAcrossSeveralChunks() {
        int written = adapter.loadBatch(populationBatch(), CancellationSignal.none());

        assertThat(written).isEqualTo(5);
        assertThat(adapter.countObservations("pop")).isEqualTo(5);
        assertThat(adapter.countObservations("other")).isZero();
    }

    @Test
    void timeSeriesIsOrderedAndFiltered() {
        adapter.loadBatch(populationBatch(), CancellationSignal.none());

        List<TimeSeriesPoint> series = adapter.getTimeSeries("pop", null, "ITC1", null, null, null);
        assertThat(series).extracting(TimeSeriesPoint::getYear).containsExactly(2020, 2021);
        assertThat(series.get(0).getValue()).isEqualTo(4300.0);

        List<TimeSeriesPoint> recent = adapter.getTimeSeries("pop", "b1", null, "POP", 2021, 2021);
        assertThat(recent).hasSize(3);
    }

    @Test
    void statisticsSummarizeTheDataset() {
        adapter.loadBatch(populationBatch(), CancellationSignal.none());

        DatasetStatistics stats = adapter.getDatasetStatistics("pop", null);

        assertThat(stats.getRecordCount()).isEqualTo(5);
        assertThat(stats.getMinYear()).isEqualTo(2020);
        assertThat(stats.getMaxYear()).isEqualTo(2021);
        assertThat(stats.getTerritoryCount()).isEqualTo(3);
        assertThat(stats.getMeasureCount()).isEqualTo(1);
        assertThat(stats.getMaxValue()).isEqualTo(5700.0);
    }

    @Test
    void statisticsOfUnknownDatasetAreEmpty() {
        DatasetStatistics stats = adapter.getDatasetStatistics("nothing", null);

        assertThat(stats.getRecordCount()).isZero();
        assertThat(stats.getMinYear()).isNull();
    }

    @Test
    void territoriesAreRankedByValue() {
        adapter.loadBatch(populationBatch(), CancellationSignal.none());

        List<TerritoryComparison> ranking = adapter.compareTerritories("pop", null, 2021, "POP", List.of());

        assertThat(ranking).extracting(TerritoryComparison::getTerritoryCode)
                .containsExactly("ITF3", "ITH5", "ITC1");
        assertThat(ranking).extracting(TerritoryComparison::getRank).containsExactly(1, 2, 3);

        List<TerritoryComparison> subset = adapter.compareTerritories("pop", "b1", 2021, "POP", List.of("ITC1", "ITH5"));
        assertThat(subset).extracting(TerritoryComparison::getTerritoryCode).containsExactly("ITH5", "ITC1");
    }

    @Test
    void readsCanBeScopedToOneBatch() {
        adapter.loadBatch(populationBatch(), CancellationSignal.none());
        adapter.loadBatch(ObservationBatch.builder()
                .datasetId("pop")
                .batchId("b2")
                .row(obs(2022, "ITC1", "POP", 4200.0))
                .build(), CancellationSignal.none());

        assertThat(adapter.getTimeSeries("pop", "b2", "ITC1", null, null, null))
                .extracting(TimeSeriesPoint::getYear).containsExactly(2022);
        assertThat(adapter.getTimeSeries("pop", null, "ITC1", null, null, null)).hasSize(3);
        assertThat(adapter.getDatasetStatistics("pop", "b1").getRecordCount()).isEqualTo(5);
        assertThat(adapter.getDatasetStatistics("pop", "b2").getRecordCount()).isEqualTo(1);
        assertThat(adapter.compareTerritories("pop", "b2", 2021, "POP", List.of())).isEmpty();
    }

    @Test
    void failedLoadLeavesNoRowsBehind() {
        ObservationBatch broken = ObservationBatch.builder()
                .datasetId("broken")
                .row(obs(2020, "ITC1", "POP", 1.0))
                .row(obs(2021, "ITC1", "POP", 2.0))
                .row(Observation.builder().territoryCode("ITC1").measureCode("POP").value(3.0).build())
                .build();

        assertThatThrownBy(() -> adapter.loadBatch(broken, CancellationSignal.none()))
                .isInstanceOf(PersistenceException.class)
                .extracting(e -> ((PersistenceException) e).getSubsystem())
                .isEqualTo(Subsystem.ANALYTICS);
        assertThat(adapter.countObservations("broken")).isZero();
    }

    @Test
    void cancelledLoadWritesNothing() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel("caller gave up");

        assertThatThrownBy(() -> adapter.loadBatch(populationBatch(), signal))
                .isInstanceOf(CancellationException.class)
                .hasMessageContaining("caller gave up");
        assertThat(adapter.countObservations("pop")).isZero();
    }

    @Test
    void deleteByDatasetRemovesOnlyThatDataset() {
        adapter.loadBatch(populationBatch(), CancellationSignal.none());
        adapter.loadBatch(ObservationBatch.builder().datasetId("gdp").row(obs(2020, "IT", "GDP", 1.7)).build(),
                CancellationSignal.none());

        assertThat(adapter.deleteByDataset("pop")).isEqualTo(5);
        assertThat(adapter.countObservations("pop")).isZero();
        assertThat(adapter.countObservations("gdp")).isEqualTo(1);
    }

    @Test
    void concurrentLoadsAreSerializedWithoutLosingRows() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> futures = new java.util.ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String id = "ds" + i;
                futures.add(pool.submit(() -> adapter.loadBatch(ObservationBatch.builder()
                        .datasetId(id)
                        .row(obs(2020, "A", "M", 1.0))
                        .row(obs(2021, "A", "M", 2.0))
                        .row(obs(2022, "A", "M", 3.0))
                        .build(), CancellationSignal.none())));
            }
            for (Future<Integer> f : futures) {
                assertThat(f.get()).isEqualTo(3);
            }
        } finally {
            pool.shutdownNow();
        }
        for (int i = 0; i < 8; i++) {
            assertThat(adapter.countObservations("ds" + i)).isEqualTo(3);
        }
    }

    @Test
    void pingSucceedsOnAHealthyStore() {
        adapter.ping();
    }
}
