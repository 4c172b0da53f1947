package com.ulbaudit.audit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class AuditPropertiesTest {

    private static AuditProperties.Data data(String directory) {
        return new AuditProperties.Data(directory, "p1_1_1_2", "mp_id", "municipality_name", null, null);
    }

    @Test
    void statisticsAndRunFallBackToDefaults() {
        AuditProperties props = new AuditProperties(data(null), new AuditProperties.Rules("classpath:rules.json"), null, null);

        assertEquals(1.5, props.statistics().defaultIqrMultiplier());
        assertEquals(2.0, props.statistics().defaultZScoreLimit());
        assertEquals(1, props.run().parallelism());
        assertFalse(props.data().hasDirectory());
    }

    @Test
    void blankDirectoryMeansNoDirectory() {
        assertFalse(data("  ").hasDirectory());
        assertTrue(data("/srv/audit").hasDirectory());
    }

    @Test
    void requiredSectionsAreEnforced() {
        assertThrows(IllegalArgumentException.class,
                () -> new AuditProperties(null, new AuditProperties.Rules("classpath:rules.json"), null, null));
        assertThrows(IllegalArgumentException.class, () -> new AuditProperties.Rules(" "));
        assertThrows(IllegalArgumentException.class,
                () -> new AuditProperties.Data(null, "p1", "", "municipality_name", null, null));
    }

    @Test
    void sensitivityDefaultsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new AuditProperties.Statistics(0d, null));
        assertThrows(IllegalArgumentException.class, () -> new AuditProperties.Statistics(null, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new AuditProperties.Run(0));
    }
}
