package com.ulbaudit.audit.rules;

import com.ulbaudit.audit.config.AuditProperties;
import com.ulbaudit.audit.model.CheckRule;
import com.ulbaudit.audit.model.RuleDefinition;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

@Component
public class RuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalog.class);
    static final String CATALOG_ID = "<catalog>";

    private final RuleDefinitionLoader loader;
    private final ResourceLoader resourceLoader;
    private final String location;
    private volatile RuleDefinitionLoader.LoadedRules loaded = RuleDefinitionLoader.LoadedRules.empty();

    public RuleCatalog(RuleDefinitionLoader loader, ResourceLoader resourceLoader, AuditProperties properties) {
        this.loader = loader;
        this.resourceLoader = resourceLoader;
        this.location = properties.rules().location();
    }

    @PostConstruct
    public void reload() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Rule catalog {} not found; no rules loaded", location);
            loaded = RuleDefinitionLoader.LoadedRules.empty();
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            loaded = loader.load(in);
        } catch (IOException ex) {
            // every run reports the unreadable catalog until it is fixed and reloaded
            log.error("Rule catalog {} could not be read: {}", location, ex.getMessage());
            loaded = new RuleDefinitionLoader.LoadedRules(List.of(), List.of(),
                    List.of(new RuleDefinitionLoader.RuleLoadFailure(CATALOG_ID, "malformed rule catalog " + location + ": " + ex.getMessage())));
        }
    }

    public List<RuleDefinition> rules() {
        return loaded.rules();
    }

    public List<CheckRule> checks() {
        return loaded.checks();
    }

    public List<RuleDefinitionLoader.RuleLoadFailure> failures() {
        return loaded.failures();
    }

    public Optional<RuleDefinition> find(String ruleId) {
        return loaded.rules().stream()
                .filter(rule -> rule.id().equals(ruleId))
                .findFirst();
    }

    public Optional<CheckRule> findCheck(String ruleId) {
        return loaded.checks().stream()
                .filter(check -> check.id().equals(ruleId))
                .findFirst();
    }
}
