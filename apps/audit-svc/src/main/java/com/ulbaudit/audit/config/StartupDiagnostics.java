package com.ulbaudit.audit.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final AuditProperties props;

    public StartupDiagnostics(AuditProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var data = props.data();
        log.info("Data config: directory='{}', entityPartition='{}', idColumn='{}', nameColumn='{}', districtColumn='{}', populationColumn='{}'",
                data.hasDirectory() ? data.directory() : "<none>",
                data.entityPartition(), data.idColumn(), data.nameColumn(), data.districtColumn(), data.populationColumn());

        var statistics = props.statistics();
        log.info("Statistics config: defaultIqrMultiplier={}, defaultZScoreLimit={}, rules='{}', parallelism={}",
                statistics.defaultIqrMultiplier(), statistics.defaultZScoreLimit(),
                props.rules().location(), props.run().parallelism());
    }
}
