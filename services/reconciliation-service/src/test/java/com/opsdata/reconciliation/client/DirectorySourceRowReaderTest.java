package com.opsdata.reconciliation.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.exception.SourceReadException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectorySourceRowReaderTest {

    @TempDir
    Path sources;

    private DirectorySourceRowReader reader;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getSources().getProduction().setLocation(sources.resolve("production").toString());
        properties.getSources().getQuality().setLocation(sources.resolve("quality").toString());
        properties.getSources().getQuality().setFormat("xlsx");
        properties.getSources().getShipping().setLocation(sources.resolve("shipping").toString());
        reader = new DirectorySourceRowReader(properties, new ObjectMapper());
    }

    @Test
    @DisplayName("CSV export: header row names the fields and blank lines are skipped")
    void readsCsvWithHeaderRow() throws IOException {
        Path dir = Files.createDirectories(sources.resolve("production"));
        Path file = dir.resolve("production-2026-02-10.csv");
        Files.writeString(file, "Lot ID,Production Line,Actual\nLOT-9,P1,90\n\n LOT-10 ,P2,\n");

        SourceExport export = reader.read(SourceKind.PRODUCTION);

        assertThat(export.format()).isEqualTo("csv");
        assertThat(export.location()).isEqualTo(file.toString());
        assertThat(export.rows()).hasSize(2);
        assertThat(export.rows().get(0))
            .containsEntry("Lot ID", "LOT-9")
            .containsEntry("Production Line", "P1")
            .containsEntry("Actual", "90");
        assertThat(export.rows().get(1)).containsEntry("Lot ID", "LOT-10");
    }

    @Test
    @DisplayName("XLSX export: first sheet is read with typed numeric and date cells")
    void readsFirstSheetOfWorkbook() throws IOException {
        Path dir = Files.createDirectories(sources.resolve("quality"));
        Path file = dir.resolve("quality-2026-02-10.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Inspections");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Lot ID");
            header.createCell(1).setCellValue("Inspection Date");
            header.createCell(2).setCellValue("Defect Count");
            header.createCell(3).setCellValue("Pass");

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue("LOT-9");
            first.createCell(1).setCellValue(LocalDate.of(2026, 2, 10));
            first.getCell(1).setCellStyle(dateStyle);
            first.createCell(2).setCellValue(3);
            first.createCell(3).setCellValue("Fail");

            sheet.createRow(2);

            Row third = sheet.createRow(3);
            third.createCell(0).setCellValue("LOT-10");
            third.createCell(2).setCellValue(1.5);

            workbook.createSheet("Ignored").createRow(0).createCell(0).setCellValue("Lot ID");
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }

        SourceExport export = reader.read(SourceKind.QUALITY);

        assertThat(export.format()).isEqualTo("xlsx");
        assertThat(export.location()).isEqualTo(file.toString());
        assertThat(export.rows()).hasSize(2);
        assertThat(export.rows().get(0))
            .containsEntry("Lot ID", "LOT-9")
            .containsEntry("Inspection Date", LocalDate.of(2026, 2, 10))
            .containsEntry("Defect Count", 3L)
            .containsEntry("Pass", "Fail");
        assertThat(export.rows().get(1))
            .containsEntry("Lot ID", "LOT-10")
            .containsEntry("Defect Count", 1.5)
            .doesNotContainKey("Inspection Date");
    }

    @Test
    @DisplayName("JSON export: array of objects keeps native value types")
    void readsJsonArray() throws IOException {
        Path dir = Files.createDirectories(sources.resolve("shipping"));
        Files.writeString(dir.resolve("shipping.json"), "[{\"Lot ID\": \"LOT-7\", \"Qty Shipped\": 40}]");

        SourceExport export = reader.read(SourceKind.SHIPPING);

        assertThat(export.format()).isEqualTo("json");
        assertThat(export.rows()).singleElement()
            .satisfies(row -> assertThat(row).containsEntry("Lot ID", "LOT-7").containsEntry("Qty Shipped", 40));
    }

    @Test
    @DisplayName("Latest export is the alphabetically last supported file across extensions")
    void picksLatestFileAcrossFormats() throws IOException {
        Path dir = Files.createDirectories(sources.resolve("production"));
        Files.writeString(dir.resolve("2026-02-01.json"), "[{\"Lot ID\": \"OLD\"}]");
        Files.writeString(dir.resolve("2026-02-10.CSV"), "Lot ID\nLOT-NEW\n");
        Files.writeString(dir.resolve("2026-02-05.csv"), "Lot ID\nLOT-MID\n");
        Files.writeString(dir.resolve("zz-notes.txt"), "ignored");

        SourceExport export = reader.read(SourceKind.PRODUCTION);

        assertThat(export.format()).isEqualTo("csv");
        assertThat(export.location()).endsWith("2026-02-10.CSV");
        assertThat(export.rows()).singleElement()
            .satisfies(row -> assertThat(row).containsEntry("Lot ID", "LOT-NEW"));
    }

    @Test
    void missingDirectoryYieldsNoRowsWithConfiguredFormat() {
        SourceExport export = reader.read(SourceKind.QUALITY);

        assertThat(export.rows()).isEmpty();
        assertThat(export.format()).isEqualTo("xlsx");
        assertThat(export.location()).isEqualTo(sources.resolve("quality").toString());
    }

    @Test
    void directoryWithoutSupportedFilesYieldsNoRows() throws IOException {
        Path dir = Files.createDirectories(sources.resolve("shipping"));
        Files.writeString(dir.resolve("readme.txt"), "nothing here");

        SourceExport export = reader.read(SourceKind.SHIPPING);

        assertThat(export.rows()).isEmpty();
        assertThat(export.format()).isEqualTo("csv");
    }

    @Test
    void malformedExportIsASourceReadFailure() throws IOException {
        Path dir = Files.createDirectories(sources.resolve("quality"));
        Files.writeString(dir.resolve("broken.xlsx"), "not a workbook");

        assertThatThrownBy(() -> reader.read(SourceKind.QUALITY))
            .isInstanceOf(SourceReadException.class)
            .hasMessageContaining("broken.xlsx")
            .hasMessageContaining("Quality Inspection");
    }

    @Test
    void formatComesFromTheExtensionIgnoringCase() {
        assertThat(DirectorySourceRowReader.formatOf(Path.of("EXPORT.XLSX"))).isEqualTo("xlsx");
        assertThat(DirectorySourceRowReader.formatOf(Path.of("lots.Csv"))).isEqualTo("csv");
        assertThat(DirectorySourceRowReader.formatOf(Path.of("no-extension"))).isEmpty();
    }
}
