package com.ulbaudit.audit.health;

import com.ulbaudit.audit.data.InMemoryAuditDataProvider;
import com.ulbaudit.audit.rules.RuleCatalog;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness plus a glance at what an audit run would work on.
 */
@RestController
public class HealthzController {

    private final InMemoryAuditDataProvider dataProvider;
    private final RuleCatalog ruleCatalog;

    public HealthzController(InMemoryAuditDataProvider dataProvider, RuleCatalog ruleCatalog) {
        this.dataProvider = dataProvider;
        this.ruleCatalog = ruleCatalog;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("dataLoaded", dataProvider.isLoaded());
        body.put("entities", dataProvider.entityCount());
        body.put("partitions", dataProvider.partitionNames().size());
        body.put("rules", ruleCatalog.rules().size());
        body.put("checks", ruleCatalog.checks().size());
        return body;
    }
}
