package com.ethval.ingestion.adapter;

import com.ethval.catalog.CsvTier;
import com.ethval.catalog.FieldSpec;
import com.ethval.catalog.MetricDefinition;
import com.ethval.catalog.RecordSchema;
import com.ethval.catalog.SourceApi;
import com.ethval.common.RunDeadline;
import com.ethval.domain.DateWindow;
import com.ethval.ingestion.config.SourceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvHttpSourceAdapterTest {

    private static final CsvTier TX_CHART = CsvTier.etherscanChart("tx", "tx_count");

    @Test
    @DisplayName("Etherscan chart export with quoted cells")
    void parsesEtherscanChart() {
        String body = "\"Date(UTC)\",\"UnixTimeStamp\",\"Value\"\n"
                + "\"7/30/2015\",\"1438214400\",\"8893\"\n"
                + "\"7/31/2015\",\"1438300800\",\"0\"\n";

        List<RawRow> rows = CsvHttpSourceAdapter.parse(body, TX_CHART);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).dateToken()).isEqualTo("7/30/2015");
        assertThat(rows.get(0).timestampToken()).isEqualTo("1438214400");
        assertThat(rows.get(0).values()).containsEntry("tx_count", "8893");
        assertThat(rows.get(0).source()).isEqualTo("etherscan_csv");
    }

    @Test
    @DisplayName("commas inside quoted fields stay in the cell")
    void quotedCommas() {
        CsvTier tier = new CsvTier("csv", SourceApi.ETHERSCAN_WEB, "{etherscan_web}/x", "Date", null,
                Map.of("label", "Label", "value", "Value"));
        String body = "Date,Label,Value\n2024-01-01,\"Arbitrum, One\",\"1,234\"\n";

        List<RawRow> rows = CsvHttpSourceAdapter.parse(body, tier);

        assertThat(rows).singleElement().satisfies(r -> {
            assertThat(r.values()).containsEntry("label", "Arbitrum, One");
            assertThat(r.values()).containsEntry("value", "1,234");
            assertThat(r.timestampToken()).isNull();
        });
    }

    @Test
    @DisplayName("a leading byte-order mark does not hide the first header")
    void stripsBom() {
        String body = "\uFEFFDate(UTC),UnixTimeStamp,Value\n1/1/2024,1704067200,42\n";

        assertThat(CsvHttpSourceAdapter.parse(body, TX_CHART)).singleElement()
                .satisfies(r -> assertThat(r.dateToken()).isEqualTo("1/1/2024"));
    }

    @Test
    @DisplayName("a column name matches a header that starts with it")
    void prefixColumnMatch() {
        String body = "Date(UTC),UnixTimeStamp,Value (Wei)\n1/1/2024,1704067200,25000000000\n";

        assertThat(CsvHttpSourceAdapter.parse(body, TX_CHART)).singleElement()
                .satisfies(r -> assertThat(r.values()).containsEntry("tx_count", "25000000000"));
    }

    @Test
    @DisplayName("an HTML page in place of the export is a schema mismatch")
    void rejectsHtml() {
        assertThatThrownBy(() -> CsvHttpSourceAdapter.parse("  <!DOCTYPE html><html></html>", TX_CHART))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("HTML");
    }

    @Test
    @DisplayName("a missing configured column is a schema mismatch naming the headers")
    void missingColumn() {
        assertThatThrownBy(() -> CsvHttpSourceAdapter.parse("Day,Count\n1/1/2024,5\n", TX_CHART))
                .isInstanceOf(SchemaMismatchException.class)
                .hasMessageContaining("Date(UTC)")
                .hasMessageContaining("[Day, Count]");
    }

    @Test
    @DisplayName("fetch follows the template URL and fails on a header-only export")
    void fetchHeaderOnlyIsEmpty() {
        StubExchange stub = new StubExchange(uri -> StubExchange.text("\"Date(UTC)\",\"UnixTimeStamp\",\"Value\"\n"));
        CsvHttpSourceAdapter adapter = new CsvHttpSourceAdapter(stub.client(1),
                new SourceVariables(new SourceProperties()));
        MetricDefinition metric = MetricDefinition.builder("tx_count")
                .schema(RecordSchema.of(FieldSpec.integer("tx_count")))
                .tier(TX_CHART)
                .build();
        FetchContext context = new FetchContext(metric, DateWindow.ending(LocalDate.of(2024, 1, 31), 31), null,
                RunDeadline.unbounded(Clock.systemUTC()));

        assertThatThrownBy(() -> adapter.fetch(TX_CHART, context)).isInstanceOf(EmptyResultException.class);
        assertThat(stub.requested).singleElement()
                .satisfies(u -> assertThat(u.toString()).isEqualTo("https://etherscan.io/chart/tx?output=csv"));
    }
}
