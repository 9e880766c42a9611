package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.conductor.core.model.Domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural validator for raw orchestra manifests.
 *
 * <p>Validation runs on the raw JSON tree so that every structural problem is reported at
 * once, instead of failing on the first field a binder trips over. An empty error list means
 * the tree can be bound to {@link OrchestraManifest}.</p>
 *
 * <p><strong>Rules:</strong></p>
 * <ul>
 *   <li>name, version, domain, description: non-blank strings</li>
 *   <li>version: semantic version {@code MAJOR.MINOR.PATCH[-pre][+build]}</li>
 *   <li>domain and every dependency: known {@link Domain} ids</li>
 *   <li>agents: array with at least one entry; each agent has name, role, description, capabilities</li>
 *   <li>tools: array; each tool has name, description, inputSchema</li>
 *   <li>policies: array; each policy has id, domain, rule, a known precedence and a boolean enforced flag</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestValidator {

    private static final Pattern SEMVER = Pattern.compile(
        "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
            + "(?:-[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?"
            + "(?:\\+[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*)?$");

    /**
     * Validates a raw manifest tree.
     *
     * @param raw the raw manifest (may be null)
     * @return the list of structural errors, empty when valid
     */
    public List<String> validate(JsonNode raw) {
        List<String> errors = new ArrayList<>();
        if (raw == null || !raw.isObject()) {
            errors.add("manifest must be a JSON object");
            return errors;
        }

        requireText(raw, "name", "manifest", errors);
        requireText(raw, "description", "manifest", errors);

        if (requireText(raw, "version", "manifest", errors)
            && !SEMVER.matcher(raw.get("version").asText()).matches()) {
            errors.add("manifest.version must be a semantic version (MAJOR.MINOR.PATCH): " + raw.get("version").asText());
        }

        if (requireText(raw, "domain", "manifest", errors)
            && Domain.find(raw.get("domain").asText()).isEmpty()) {
            errors.add("manifest.domain is not a known orchestration domain: " + raw.get("domain").asText());
        }

        JsonNode agents = raw.get("agents");
        if (agents == null || !agents.isArray()) {
            errors.add("manifest.agents is required and must be an array");
        } else if (agents.isEmpty()) {
            errors.add("manifest.agents must declare at least one agent");
        } else {
            for (int i = 0; i < agents.size(); i++) {
                validateAgent(agents.get(i), "manifest.agents[" + i + "]", errors);
            }
        }

        JsonNode tools = raw.get("tools");
        if (tools == null || !tools.isArray()) {
            errors.add("manifest.tools is required and must be an array");
        } else {
            for (int i = 0; i < tools.size(); i++) {
                validateTool(tools.get(i), "manifest.tools[" + i + "]", errors);
            }
        }

        JsonNode policies = raw.get("policies");
        if (policies == null || !policies.isArray()) {
            errors.add("manifest.policies is required and must be an array");
        } else {
            for (int i = 0; i < policies.size(); i++) {
                validatePolicy(policies.get(i), "manifest.policies[" + i + "]", errors);
            }
        }

        JsonNode dependencies = raw.get("dependencies");
        if (dependencies != null && !dependencies.isNull()) {
            if (!dependencies.isArray()) {
                errors.add("manifest.dependencies must be an array");
            } else {
                for (int i = 0; i < dependencies.size(); i++) {
                    JsonNode dependency = dependencies.get(i);
                    if (!dependency.isTextual() || Domain.find(dependency.asText()).isEmpty()) {
                        errors.add("manifest.dependencies[" + i + "] is not a known orchestration domain: " + dependency);
                    }
                }
            }
        }

        requireOptionalStringArray(raw, "mcpServers", "manifest", errors);

        JsonNode metadata = raw.get("metadata");
        if (metadata != null && !metadata.isNull() && !metadata.isObject()) {
            errors.add("manifest.metadata must be an object");
        }
        return errors;
    }

    private void validateAgent(JsonNode agent, String path, List<String> errors) {
        if (agent == null || !agent.isObject()) {
            errors.add(path + " must be an object");
            return;
        }
        requireText(agent, "name", path, errors);
        requireText(agent, "role", path, errors);
        requireText(agent, "description", path, errors);
        JsonNode capabilities = agent.get("capabilities");
        if (capabilities == null || !capabilities.isArray()) {
            errors.add(path + ".capabilities is required and must be an array");
        }
        requireOptionalStringArray(agent, "mcpServers", path, errors);
    }

    private void validateTool(JsonNode tool, String path, List<String> errors) {
        if (tool == null || !tool.isObject()) {
            errors.add(path + " must be an object");
            return;
        }
        requireText(tool, "name", path, errors);
        requireText(tool, "description", path, errors);
        JsonNode inputSchema = tool.get("inputSchema");
        if (inputSchema == null || !inputSchema.isObject()) {
            errors.add(path + ".inputSchema is required and must be an object");
        }
        JsonNode outputSchema = tool.get("outputSchema");
        if (outputSchema != null && !outputSchema.isNull() && !outputSchema.isObject()) {
            errors.add(path + ".outputSchema must be an object");
        }
        requireOptionalStringArray(tool, "requiredPermissions", path, errors);
    }

    private void validatePolicy(JsonNode policy, String path, List<String> errors) {
        if (policy == null || !policy.isObject()) {
            errors.add(path + " must be an object");
            return;
        }
        requireText(policy, "id", path, errors);
        requireText(policy, "domain", path, errors);
        requireText(policy, "rule", path, errors);
        if (requireText(policy, "precedence", path, errors)) {
            try {
                PolicyPrecedence.of(policy.get("precedence").asText());
            } catch (IllegalArgumentException e) {
                errors.add(path + ".precedence must be one of legal, industry, internal: " + policy.get("precedence").asText());
            }
        }
        JsonNode enforced = policy.get("enforced");
        if (enforced == null || !enforced.isBoolean()) {
            errors.add(path + ".enforced is required and must be a boolean");
        }
    }

    private boolean requireText(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            errors.add(path + "." + field + " is required and must be a non-blank string");
            return false;
        }
        return true;
    }

    private void requireOptionalStringArray(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isArray()) {
            errors.add(path + "." + field + " must be an array of strings");
            return;
        }
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                errors.add(path + "." + field + " must be an array of strings");
                return;
            }
        }
    }
}
