package com.consullo.standby.analytics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes analytics reports as CSV and dashboard heatmaps as PNG.
 *
 * <p>
 * CSV layout: a header row, one row per hour {@code HH:00}, a {@code totals}
 * row and a {@code total_sitting_minutes} row. Reports with fewer than
 * {@link #MIN_EXPORT_RECORDS} records are refused.
 * </p>
 */
public final class AnalyticsExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsExporter.class);

  public static final int MIN_EXPORT_RECORDS = 5;

  public static final String PNG_DATA_URL_PREFIX = "data:image/png;base64,";

  static final String CSV_HEADER = "hour,sedentary_sessions,standup_sessions";

  private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final ExportDirectoryResolver directoryResolver;
  private final LocalTimeResolver timeResolver;

  public AnalyticsExporter(final ExportDirectoryResolver directoryResolver, final LocalTimeResolver timeResolver) {
    Validate.notNull(directoryResolver, "directoryResolver must not be null");
    Validate.notNull(timeResolver, "timeResolver must not be null");
    this.directoryResolver = directoryResolver;
    this.timeResolver = timeResolver;
  }

  /**
   * Renders the CSV lines for a report without any threshold check.
   *
   * @param report report
   * @return lines, without terminators
   */
  public static List<String> renderCsv(final AnalyticsReport report) {
    Validate.notNull(report, "report must not be null");
    List<String> rows = new ArrayList<>(AnalyticsReport.HOURS + 3);
    rows.add(CSV_HEADER);
    for (int hour = 0; hour < AnalyticsReport.HOURS; hour++) {
      rows.add(String.format("%02d:00,%d,%d",
          hour, report.hourlySedentary().get(hour), report.hourlyStandup().get(hour)));
    }
    rows.add("totals," + report.sedentarySessions() + "," + report.standupSessions());
    rows.add("total_sitting_minutes," + report.totalSittingMinutes() + ",");
    return rows;
  }

  /**
   * Writes {@code report} as CSV into the export directory.
   *
   * @param report report
   * @return written file
   * @throws ExportException if there is not enough data, no directory, or the write fails
   */
  public Path exportCsv(final AnalyticsReport report) throws ExportException {
    Validate.notNull(report, "report must not be null");
    if (report.recordCount() < MIN_EXPORT_RECORDS) {
      throw ExportException.notEnoughData(MIN_EXPORT_RECORDS);
    }
    String fileName = "standby_" + report.period().key() + "_analytics_" + stamp() + ".csv";
    byte[] content = String.join("\n", renderCsv(report)).getBytes(StandardCharsets.UTF_8);
    return write(fileName, content);
  }

  /**
   * Decodes a {@code data:image/png;base64,} payload and writes the PNG into the export directory.
   *
   * @param dataUrl data URL produced by the dashboard canvas
   * @return written file
   * @throws ExportException if the payload is malformed, no directory, or the write fails
   */
  public Path exportPng(final String dataUrl) throws ExportException {
    if (dataUrl == null || !dataUrl.startsWith(PNG_DATA_URL_PREFIX)) {
      throw new ExportException(ExportException.Reason.INVALID_PAYLOAD, "invalid png payload");
    }
    byte[] png;
    try {
      png = Base64.getDecoder().decode(dataUrl.substring(PNG_DATA_URL_PREFIX.length()));
    } catch (IllegalArgumentException e) {
      throw new ExportException(ExportException.Reason.DECODE_FAILED, "decode failed: " + e.getMessage(), e);
    }
    return write("standby_24h_heatmap_" + stamp() + ".png", png);
  }

  private Path write(final String fileName, final byte[] content) throws ExportException {
    Path dir = directoryResolver.resolve()
        .orElseThrow(() -> new ExportException(ExportException.Reason.NO_EXPORT_DIRECTORY,
            "cannot resolve export directory"));
    Path target = dir.resolve(fileName);
    try {
      Files.createDirectories(dir);
      Files.write(target, content);
    } catch (IOException e) {
      LOGGER.warn("Export write failed for {}: {}", target, e.getMessage());
      throw new ExportException(ExportException.Reason.WRITE_FAILED, "write failed: " + e.getMessage(), e);
    }
    LOGGER.info("Exported {} bytes to {}", content.length, target);
    return target;
  }

  private String stamp() {
    LocalDateTime now = timeResolver.localNow();
    return FILE_STAMP.format(now);
  }
}
