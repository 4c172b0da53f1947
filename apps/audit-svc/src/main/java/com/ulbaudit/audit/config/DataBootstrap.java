package com.ulbaudit.audit.config;

import com.ulbaudit.audit.data.CsvPartitionLoader;
import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the questionnaire CSV exports at startup when {@code audit.data.directory} is set.
 * A failed load leaves the provider empty; rule evaluations then report it as unavailable.
 */
@Component
public class DataBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DataBootstrap.class);

    private final CsvPartitionLoader loader;
    private final AuditProperties.Data dataConfig;

    public DataBootstrap(CsvPartitionLoader loader, AuditProperties properties) {
        this.loader = loader;
        this.dataConfig = properties.data();
    }

    @PostConstruct
    void maybeLoad() {
        if (!dataConfig.hasDirectory()) {
            log.info("Data bootstrap disabled (audit.data.directory not set)");
            return;
        }
        try {
            CsvPartitionLoader.LoadReport report = loader.loadDirectory(Path.of(dataConfig.directory()));
            if (!report.failures().isEmpty()) {
                log.warn("Data bootstrap finished with {} failed files: {}", report.failures().size(), report.failures());
            }
        } catch (RuntimeException e) {
            // evaluations report the missing data per rule
            log.error("Data bootstrap failed (application will continue to start)", e);
        }
    }
}
