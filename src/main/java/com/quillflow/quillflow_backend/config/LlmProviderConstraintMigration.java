package com.quillflow.quillflow_backend.config;

import com.quillflow.quillflow_backend.model.domain.AttemptOutcome;
import com.quillflow.quillflow_backend.model.domain.LlmProvider;
import com.quillflow.quillflow_backend.model.domain.TaskStatus;
import com.quillflow.quillflow_backend.model.pipeline.Phase;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Rewrites the enum check constraints Hibernate created earlier so newly added
 * enum values are accepted by existing tables.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmProviderConstraintMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void updateEnumConstraints() {
        replaceCheck("llm_provider_configs", "provider", LlmProvider.values());
        replaceCheck("cost_records", "provider", LlmProvider.values());
        replaceCheck("cost_records", "outcome", AttemptOutcome.values());
        replaceCheck("cost_records", "phase", Phase.values());
        replaceCheck("content_tasks", "status", TaskStatus.values());
        replaceCheck("content_tasks", "phase", Phase.values());
    }

    private void replaceCheck(String table, String column, Enum<?>[] values) {
        String constraint = table + "_" + column + "_check";
        try {
            String allowed = String.join("', '", Arrays.stream(values).map(Enum::name).toList());
            jdbcTemplate.execute("ALTER TABLE " + table + " DROP CONSTRAINT IF EXISTS " + constraint);
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD CONSTRAINT " + constraint
                    + " CHECK (" + column + " IN ('" + allowed + "'))");
            log.debug("Updated {} to allow {}", constraint, allowed);
        } catch (Exception e) {
            log.warn("Could not update {}: {}", constraint, e.getMessage());
        }
    }
}
