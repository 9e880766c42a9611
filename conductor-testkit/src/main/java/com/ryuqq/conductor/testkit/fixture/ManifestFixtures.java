package com.ryuqq.conductor.testkit.fixture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conductor.core.json.JsonSupport;
import com.ryuqq.conductor.core.model.Domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Raw manifest trees for tests.
 *
 * <p>Every fixture is a fresh mutable {@link ObjectNode}, so tests can break a field before
 * registering it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestFixtures {

    private ManifestFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Valid manifest for a domain, version 1.0.0.
     *
     * @param domain the domain
     * @param dependencies direct dependencies
     * @return a valid raw manifest
     */
    public static ObjectNode manifest(Domain domain, Domain... dependencies) {
        return manifest(domain, "1.0.0", dependencies);
    }

    /**
     * Valid manifest for a domain with an explicit version.
     *
     * @param domain the domain
     * @param version semantic version
     * @param dependencies direct dependencies
     * @return a valid raw manifest
     */
    public static ObjectNode manifest(Domain domain, String version, Domain... dependencies) {
        ObjectNode root = JsonSupport.newObject();
        root.put("name", domain.getId() + "-orchestra");
        root.put("version", version);
        root.put("domain", domain.getId());
        root.put("description", "Orchestra for the " + domain.getId() + " domain");

        ArrayNode agents = root.putArray("agents");
        ObjectNode agent = agents.addObject();
        agent.put("name", domain.getId() + "-agent");
        agent.put("role", "specialist");
        agent.put("description", "Primary agent of " + domain.getId());
        agent.putArray("capabilities").add("analyze").add("report");

        ArrayNode tools = root.putArray("tools");
        ObjectNode tool = tools.addObject();
        tool.put("name", domain.getId() + "_inspect");
        tool.put("description", "Inspects " + domain.getId() + " resources");
        ObjectNode inputSchema = tool.putObject("inputSchema");
        inputSchema.put("type", "object");
        ObjectNode properties = inputSchema.putObject("properties");
        properties.putObject("target").put("type", "string");
        properties.putObject("depth").put("type", "integer");
        tool.putArray("requiredPermissions").add("orchestra." + domain.getId() + ".inspect");

        ArrayNode policies = root.putArray("policies");
        ObjectNode policy = policies.addObject();
        policy.put("id", domain.getId() + "-baseline");
        policy.put("domain", domain.getId());
        policy.put("rule", "all actions are audited");
        policy.put("precedence", "internal");
        policy.put("enforced", true);

        if (dependencies.length > 0) {
            ArrayNode deps = root.putArray("dependencies");
            for (Domain dependency : dependencies) {
                deps.add(dependency.getId());
            }
        }

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("author", "platform-team");
        metadata.putArray("tags").add(domain.getId()).add("test");
        metadata.put("priority", "normal");
        return root;
    }

    /**
     * Copy of a tree whose object keys are reversed at every depth. Array order is kept.
     *
     * @param node the tree
     * @return an equal tree with a different key order
     */
    public static JsonNode reorderKeys(JsonNode node) {
        if (node.isObject()) {
            List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
            iterator.forEachRemaining(fields::add);
            Collections.reverse(fields);
            ObjectNode reordered = JsonSupport.newObject();
            for (Map.Entry<String, JsonNode> field : fields) {
                reordered.set(field.getKey(), reorderKeys(field.getValue()));
            }
            return reordered;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonSupport.mapper().createArrayNode();
            node.forEach(element -> copy.add(reorderKeys(element)));
            return copy;
        }
        return node;
    }
}
