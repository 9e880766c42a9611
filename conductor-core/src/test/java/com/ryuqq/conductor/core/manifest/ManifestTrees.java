package com.ryuqq.conductor.core.manifest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.conductor.core.json.JsonSupport;

/**
 * 테스트용 매니페스트 트리.
 */
final class ManifestTrees {

    private ManifestTrees() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static ObjectNode valid() {
        ObjectNode root = JsonSupport.newObject();
        root.put("name", "finance-orchestra");
        root.put("version", "1.2.0");
        root.put("domain", "finance");
        root.put("description", "Finance orchestra");

        ObjectNode agent = root.putArray("agents").addObject();
        agent.put("name", "ledger-agent");
        agent.put("role", "accountant");
        agent.put("description", "Keeps the ledger");
        agent.putArray("capabilities").add("reconcile");

        ObjectNode tool = root.putArray("tools").addObject();
        tool.put("name", "generate_invoice");
        tool.put("description", "Generates an invoice");
        ObjectNode schema = tool.putObject("inputSchema");
        schema.put("type", "object");
        schema.putObject("properties").putObject("amount").put("type", "number");

        ObjectNode policy = root.putArray("policies").addObject();
        policy.put("id", "sox-404");
        policy.put("domain", "finance");
        policy.put("rule", "dual control on ledger writes");
        policy.put("precedence", "legal");
        policy.put("enforced", true);

        root.putArray("dependencies").add("database");
        root.putObject("metadata").put("author", "finance-team").put("priority", "high");
        return root;
    }
}
