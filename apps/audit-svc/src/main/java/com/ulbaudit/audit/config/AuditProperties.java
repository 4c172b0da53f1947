package com.ulbaudit.audit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "audit")
public record AuditProperties(
        Data data,
        Rules rules,
        Statistics statistics,
        Run run
) {

    @ConstructorBinding
    public AuditProperties {
        if (data == null) {
            throw new IllegalArgumentException("data configuration must be provided");
        }
        if (rules == null) {
            throw new IllegalArgumentException("rules configuration must be provided");
        }
        // statistics and run fall back to defaults via accessor methods
    }

    public Statistics statistics() {
        return statistics != null ? statistics : new Statistics(null, null);
    }

    public Run run() {
        return run != null ? run : new Run(null);
    }

    public record Data(
            String directory,
            String entityPartition,
            String idColumn,
            String nameColumn,
            String districtColumn,
            String populationColumn
    ) {
        public Data {
            if (entityPartition == null || entityPartition.isBlank()) {
                throw new IllegalArgumentException("entityPartition must be provided");
            }
            if (idColumn == null || idColumn.isBlank()) {
                throw new IllegalArgumentException("idColumn must be provided");
            }
            if (nameColumn == null || nameColumn.isBlank()) {
                throw new IllegalArgumentException("nameColumn must be provided");
            }
            // district and population columns are optional; grouping modes needing them exclude every entity
        }

        public boolean hasDirectory() {
            return directory != null && !directory.isBlank();
        }
    }

    public record Rules(String location) {
        public Rules {
            if (location == null || location.isBlank()) {
                throw new IllegalArgumentException("location must be provided");
            }
        }
    }

    public record Statistics(Double defaultIqrMultiplier, Double defaultZScoreLimit) {
        public Statistics {
            defaultIqrMultiplier = defaultIqrMultiplier == null ? 1.5d : defaultIqrMultiplier;
            defaultZScoreLimit = defaultZScoreLimit == null ? 2.0d : defaultZScoreLimit;
            if (!(defaultIqrMultiplier > 0) || defaultIqrMultiplier.isInfinite()) {
                throw new IllegalArgumentException("defaultIqrMultiplier must be positive");
            }
            if (!(defaultZScoreLimit > 0) || defaultZScoreLimit.isInfinite()) {
                throw new IllegalArgumentException("defaultZScoreLimit must be positive");
            }
        }
    }

    public record Run(Integer parallelism) {
        public Run {
            parallelism = parallelism == null ? 1 : parallelism;
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
        }
    }
}
