package com.ulbaudit.audit.statistics;

import com.ulbaudit.audit.model.Bounds;
import com.ulbaudit.audit.model.Cohort;
import com.ulbaudit.audit.model.MetricValue;
import com.ulbaudit.audit.model.OutlierFlag;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class OutlierEvaluator {

    /**
     * Flags cohort members strictly outside the bounds. Members without a defined metric are ignored.
     */
    public List<OutlierFlag> evaluate(Cohort cohort, Bounds bounds, Map<String, MetricValue> metrics) {
        List<OutlierFlag> flags = new ArrayList<>();
        for (String entityId : cohort.memberIds()) {
            MetricValue metric = metrics.get(entityId);
            if (metric == null || !metric.isDefined()) {
                continue;
            }
            double value = metric.asDouble();
            bounds.crossedBy(value)
                    .ifPresent(side -> flags.add(new OutlierFlag(entityId, cohort.name(), value, bounds, side)));
        }
        return flags;
    }
}
