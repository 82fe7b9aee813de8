package com.consullo.standby.analytics;

import com.consullo.standby.core.EventLog;
import com.consullo.standby.core.events.SedentaryEvent;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for CSV and PNG export.
 *
 * @since 1.0
 */
public class AnalyticsExporterTest {

  private static final Instant NOW = Instant.parse("2026-10-14T15:04:05Z");

  private final LocalTimeResolver resolver = new LocalTimeResolver(ZoneOffset.UTC, () -> NOW);
  private final AnalyticsAggregator aggregator = new AnalyticsAggregator(resolver);

  @TempDir
  Path exportDir;

  @Test
  @DisplayName("Should refuse CSV export below five records")
  void exportCsv_ThreeRecords_NotEnoughData() {
    AnalyticsExporter exporter = new AnalyticsExporter(new ExportDirectoryResolver(List.of(exportDir)), resolver);
    AnalyticsReport report = aggregator.aggregate(logWith(2, 1), Period.DAILY);

    assertThat(report.recordCount()).isEqualTo(3);
    assertThatThrownBy(() -> exporter.exportCsv(report))
        .isInstanceOfSatisfying(ExportException.class, e -> {
          assertThat(e.reason()).isEqualTo(ExportException.Reason.NOT_ENOUGH_DATA);
          assertThat(e.getMessage()).isEqualTo("NOT_ENOUGH_DATA:5");
        });
  }

  @Test
  @DisplayName("Should write 27 CSV lines for five records")
  void exportCsv_FiveRecords_WritesFile() throws Exception {
    AnalyticsExporter exporter = new AnalyticsExporter(new ExportDirectoryResolver(List.of(exportDir)), resolver);
    AnalyticsReport report = aggregator.aggregate(logWith(3, 2), Period.DAILY);

    Path written = exporter.exportCsv(report);

    assertThat(written.getParent()).isEqualTo(exportDir);
    assertThat(written.getFileName().toString()).isEqualTo("standby_daily_analytics_20261014_150405.csv");
    List<String> lines = Files.readAllLines(written, StandardCharsets.UTF_8);
    assertThat(lines).hasSize(27);
    assertThat(lines.get(0)).isEqualTo("hour,sedentary_sessions,standup_sessions");
    assertThat(lines.get(1)).isEqualTo("00:00,0,0");
    assertThat(lines.get(10)).isEqualTo("09:00,3,0");
    assertThat(lines.get(11)).isEqualTo("10:00,0,2");
    assertThat(lines.get(24)).isEqualTo("23:00,0,0");
    assertThat(lines.get(25)).isEqualTo("totals,3,2");
    assertThat(lines.get(26)).isEqualTo("total_sitting_minutes,45,");
    assertThat(Files.readString(written, StandardCharsets.UTF_8)).doesNotEndWith("\n");
  }

  @Test
  @DisplayName("Should surface an unresolvable export directory")
  void exportCsv_NoCandidates_NoExportDirectory() {
    AnalyticsExporter exporter = new AnalyticsExporter(new ExportDirectoryResolver(List.of()), resolver);
    AnalyticsReport report = aggregator.aggregate(logWith(5, 0), Period.DAILY);

    assertThatThrownBy(() -> exporter.exportCsv(report))
        .isInstanceOfSatisfying(ExportException.class,
            e -> assertThat(e.reason()).isEqualTo(ExportException.Reason.NO_EXPORT_DIRECTORY));
  }

  @Test
  @DisplayName("Should surface a write failure when the export target is not a directory")
  void exportCsv_TargetIsFile_WriteFailed() throws Exception {
    Path file = Files.createFile(exportDir.resolve("not-a-dir"));
    AnalyticsExporter exporter = new AnalyticsExporter(new ExportDirectoryResolver(List.of(file)), resolver);
    AnalyticsReport report = aggregator.aggregate(logWith(5, 0), Period.DAILY);

    assertThatThrownBy(() -> exporter.exportCsv(report))
        .isInstanceOfSatisfying(ExportException.class,
            e -> assertThat(e.reason()).isEqualTo(ExportException.Reason.WRITE_FAILED));
  }

  @Test
  @DisplayName("Should decode and write a PNG data URL")
  void exportPng_ValidPayload_WritesBytes() throws Exception {
    AnalyticsExporter exporter = new AnalyticsExporter(new ExportDirectoryResolver(List.of(exportDir)), resolver);
    byte[] png = new byte[] {(byte) 0x89, 'P', 'N', 'G', 13, 10, 26, 10};

    Path written = exporter.exportPng("data:image/png;base64," + Base64.getEncoder().encodeToString(png));

    assertThat(written.getFileName().toString()).isEqualTo("standby_24h_heatmap_20261014_150405.png");
    assertThat(Files.readAllBytes(written)).isEqualTo(png);
  }

  @Test
  @DisplayName("Should reject payloads without the PNG data URL marker")
  void exportPng_WrongPrefix_InvalidPayload() {
    AnalyticsExporter exporter = new AnalyticsExporter(new ExportDirectoryResolver(List.of(exportDir)), resolver);

    assertThatThrownBy(() -> exporter.exportPng("data:image/jpeg;base64,AAAA"))
        .isInstanceOfSatisfying(ExportException.class,
            e -> assertThat(e.reason()).isEqualTo(ExportException.Reason.INVALID_PAYLOAD));
    assertThatThrownBy(() -> exporter.exportPng(null))
        .isInstanceOfSatisfying(ExportException.class,
            e -> assertThat(e.reason()).isEqualTo(ExportException.Reason.INVALID_PAYLOAD));
  }

  @Test
  @DisplayName("Should report a decode failure for malformed base64")
  void exportPng_BadBase64_DecodeFailed() {
    AnalyticsExporter exporter = new AnalyticsExporter(new ExportDirectoryResolver(List.of(exportDir)), resolver);

    assertThatThrownBy(() -> exporter.exportPng("data:image/png;base64,@@@not-base64@@@"))
        .isInstanceOfSatisfying(ExportException.class,
            e -> assertThat(e.reason()).isEqualTo(ExportException.Reason.DECODE_FAILED));
  }

  @Test
  @DisplayName("Should prefer the first existing candidate and otherwise use the last one")
  void resolve_Candidates_PreferExisting() throws Exception {
    Path missing = exportDir.resolve("Downloads");
    Path desktop = Files.createDirectories(exportDir.resolve("Desktop"));
    Path appData = exportDir.resolve("app-data");

    assertThat(new ExportDirectoryResolver(List.of(missing, desktop, appData)).resolve()).contains(desktop);
    assertThat(new ExportDirectoryResolver(List.of(missing, appData)).resolve()).contains(appData);
    assertThat(new ExportDirectoryResolver(List.of()).resolve()).isEmpty();
  }

  private static EventLog logWith(int sedentary, int standups) {
    List<SedentaryEvent> reminders = new ArrayList<>();
    for (int i = 0; i < sedentary; i++) {
      reminders.add(new SedentaryEvent(Instant.parse("2026-10-14T09:00:00Z").getEpochSecond() + i * 60L, 900));
    }
    List<Long> ups = new ArrayList<>();
    for (int i = 0; i < standups; i++) {
      ups.add(Instant.parse("2026-10-14T10:00:00Z").getEpochSecond() + i * 60L);
    }
    return new EventLog(reminders, ups);
  }
}
