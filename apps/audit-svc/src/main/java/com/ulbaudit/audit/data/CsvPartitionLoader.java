package com.ulbaudit.audit.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ulbaudit.audit.config.AuditProperties;
import com.ulbaudit.audit.model.AuditEntity;
import com.ulbaudit.audit.model.PartitionRow;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads questionnaire CSV exports into the in-memory provider, one partition per file.
 * File names like {@code mp_270126_p1_7.csv} are stored under the partition {@code p1_7}.
 */
@Component
public class CsvPartitionLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvPartitionLoader.class);
    private static final Pattern EXPORT_PREFIX = Pattern.compile("^mp_\\d+_");
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    static final String ASSETS_PARTITION = "p7_assets";
    static final String COMMISSION_YEAR_COLUMN = "p7_comm_year";
    private static final Pattern BEFORE_1990 = Pattern.compile("(?i)^before\\s*1990$");

    public record LoadReport(int partitionsLoaded, int entities, List<String> failures) {
    }

    private final InMemoryAuditDataProvider provider;
    private final AuditProperties.Data dataConfig;
    private final ObjectReader rowReader;

    public CsvPartitionLoader(InMemoryAuditDataProvider provider, AuditProperties properties) {
        this.provider = provider;
        this.dataConfig = properties.data();
        this.rowReader = new CsvMapper()
                .readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader());
    }

    public LoadReport loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new DataProviderUnavailableException("data directory not found: " + directory);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv"))
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new DataProviderUnavailableException("cannot list data directory " + directory, null, ex);
        }
        int loaded = 0;
        List<String> failures = new ArrayList<>();
        for (Path file : files) {
            String partition = partitionName(file.getFileName().toString());
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                int rows = loadPartition(partition, content);
                log.info("Loaded partition {}: {} rows from {}", partition, rows, file.getFileName());
                loaded++;
            } catch (IOException | UncheckedIOException | RuntimeJsonMappingException | IllegalArgumentException ex) {
                log.warn("Failed to load {}: {}", file.getFileName(), ex.getMessage());
                failures.add(file.getFileName().toString());
            }
        }
        int entities = registerEntities();
        log.info("Loaded {} of {} partitions, {} entities", loaded, files.size(), entities);
        return new LoadReport(loaded, entities, failures);
    }

    /**
     * Parses one CSV document into a partition. Rows without an entity id are dropped, and the
     * asset register's commission year is normalized to a number.
     *
     * @return number of rows stored
     */
    public int loadPartition(String partition, String csvContent) throws IOException {
        String content = !csvContent.isEmpty() && csvContent.charAt(0) == BYTE_ORDER_MARK
                ? csvContent.substring(1)
                : csvContent;
        List<PartitionRow> rows = new ArrayList<>();
        int dropped = 0;
        try (MappingIterator<Map<String, String>> iterator = rowReader.readValues(content)) {
            while (iterator.hasNext()) {
                Map<String, String> cells = iterator.next();
                String entityId = cells.get(dataConfig.idColumn());
                if (entityId == null || entityId.isBlank()) {
                    dropped++;
                    continue;
                }
                if (ASSETS_PARTITION.equals(partition)) {
                    cells = normalizeCommissionYear(cells);
                }
                rows.add(new PartitionRow(entityId.trim(), cells));
            }
        }
        if (dropped > 0) {
            log.warn("Partition {}: dropped {} rows without {}", partition, dropped, dataConfig.idColumn());
        }
        provider.savePartition(partition, rows);
        return rows.size();
    }

    /**
     * Builds the entity register from the configured entity partition.
     *
     * @return number of registered entities
     */
    public int registerEntities() {
        String entityPartition = dataConfig.entityPartition();
        if (!provider.hasPartition(entityPartition)) {
            log.error("Entity partition {} not loaded; entity register left unchanged", entityPartition);
            return provider.entityCount();
        }
        List<AuditEntity> entities = new ArrayList<>();
        for (String entityId : provider.partitionEntityIds(entityPartition)) {
            PartitionRow first = provider.findRows(entityPartition, entityId).get(0);
            entities.add(new AuditEntity(
                    entityId,
                    first.cell(dataConfig.nameColumn()).orElse(""),
                    column(first, dataConfig.districtColumn()),
                    column(first, dataConfig.populationColumn()).flatMap(CsvPartitionLoader::parseNumber)
            ));
        }
        provider.replaceEntities(entities);
        return entities.size();
    }

    /**
     * "Before 1990" becomes 1989; non-numeric years are blanked.
     */
    static Map<String, String> normalizeCommissionYear(Map<String, String> cells) {
        if (!cells.containsKey(COMMISSION_YEAR_COLUMN)) {
            return cells;
        }
        Map<String, String> normalized = new LinkedHashMap<>(cells);
        String raw = cells.get(COMMISSION_YEAR_COLUMN);
        String year = raw == null ? "" : raw.trim();
        if (BEFORE_1990.matcher(year).matches()) {
            normalized.put(COMMISSION_YEAR_COLUMN, "1989");
        } else if (parseNumber(year).isPresent()) {
            normalized.put(COMMISSION_YEAR_COLUMN, year);
        } else {
            normalized.put(COMMISSION_YEAR_COLUMN, "");
        }
        return normalized;
    }

    static String partitionName(String fileName) {
        String base = fileName.replaceFirst("(?i)\\.csv$", "");
        return EXPORT_PREFIX.matcher(base).replaceFirst("");
    }

    private static Optional<String> column(PartitionRow row, String column) {
        if (column == null || column.isBlank()) {
            return Optional.empty();
        }
        return row.cell(column);
    }

    private static Optional<Double> parseNumber(String raw) {
        try {
            double parsed = Double.parseDouble(raw.replace(",", ""));
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
