package com.opsdata.reconciliation.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.exception.SourceReadException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DirectorySourceRowReader implements SourceRowReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DirectorySourceRowReader.class);

    static final String CSV = "csv";
    static final String XLSX = "xlsx";
    static final String XLS = "xls";
    static final String JSON = "json";

    private static final Set<String> SUPPORTED_FORMATS = Set.of(CSV, XLSX, XLS, JSON);

    private static final TypeReference<List<Map<String, Object>>> JSON_ROWS = new TypeReference<>() {
    };

    private final ReconciliationProperties properties;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;
    private final DataFormatter dataFormatter = new DataFormatter(Locale.ROOT);

    public DirectorySourceRowReader(ReconciliationProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();
    }

    @Override
    public SourceExport read(SourceKind kind) {
        Path directory = Path.of(location(kind));
        if (!Files.isDirectory(directory)) {
            LOGGER.warn("Source directory {} for {} does not exist; nothing to read", directory, kind.sourceName());
            return SourceExport.empty(directory.toString(), format(kind));
        }
        Optional<Path> latest = latestExport(directory);
        if (latest.isEmpty()) {
            LOGGER.warn("No CSV, XLSX or JSON export found in {} for {}", directory, kind.sourceName());
            return SourceExport.empty(directory.toString(), format(kind));
        }

        Path file = latest.get();
        String format = formatOf(file);
        try {
            List<Map<String, Object>> rows = switch (format) {
                case CSV -> readCsv(file);
                case XLSX, XLS -> readWorkbook(file);
                default -> readJson(file);
            };
            LOGGER.info("Read {} rows for {} from {}", rows.size(), kind.sourceName(), file);
            return new SourceExport(rows, file.toString(), format);
        } catch (IOException | RuntimeException e) {
            throw new SourceReadException("Failed to read " + file + " for " + kind.sourceName(), e);
        }
    }

    @Override
    public String location(SourceKind kind) {
        return properties.source(kind).getLocation();
    }

    @Override
    public String format(SourceKind kind) {
        return properties.source(kind).getFormat();
    }

    private Optional<Path> latestExport(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> SUPPORTED_FORMATS.contains(formatOf(path)))
                .max(Comparator.comparing(path -> path.getFileName().toString()));
        } catch (IOException e) {
            throw new SourceReadException("Failed to list " + directory, e);
        }
    }

    static String formatOf(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }

    private List<Map<String, Object>> readCsv(Path file) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, Object>> rows = csvMapper.readerForMapOf(Object.class).with(schema).readValues(file.toFile())) {
            return rows.readAll();
        }
    }

    private List<Map<String, Object>> readJson(Path file) throws IOException {
        List<Map<String, Object>> rows = objectMapper.readValue(file.toFile(), JSON_ROWS);
        return rows == null ? List.of() : rows;
    }

    private List<Map<String, Object>> readWorkbook(Path file) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                return List.of();
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return List.of();
            }
            List<String> headers = new ArrayList<>();
            for (int col = 0; col < headerRow.getLastCellNum(); col++) {
                Cell cell = headerRow.getCell(col);
                headers.add(cell == null ? "" : dataFormatter.formatCellValue(cell).trim());
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int col = 0; col < headers.size(); col++) {
                    Object value = cellValue(row.getCell(col));
                    if (!headers.get(col).isEmpty() && value != null) {
                        values.put(headers.get(col), value);
                    }
                }
                if (!values.isEmpty()) {
                    rows.add(values);
                }
            }
            return rows;
        }
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                return cell.getLocalDateTimeCellValue().toLocalDate();
            }
            double number = cell.getNumericCellValue();
            if (number == Math.rint(number) && Math.abs(number) < Long.MAX_VALUE) {
                return (long) number;
            }
            return number;
        }
        if (type == CellType.BOOLEAN) {
            return cell.getBooleanCellValue();
        }
        if (type == CellType.STRING) {
            String text = cell.getStringCellValue();
            return text.isBlank() ? null : text;
        }
        return null;
    }
}
