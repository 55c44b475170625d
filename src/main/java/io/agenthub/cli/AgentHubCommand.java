package io.agenthub.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agenthub.agent.CoordinatedResponse;
import io.agenthub.agent.EchoAgent;
import io.agenthub.agent.FailAgent;
import io.agenthub.bus.MessageRecord;
import io.agenthub.bus.SendOutcome;
import io.agenthub.bus.workflow.WorkflowOutcome;
import io.agenthub.bus.workflow.WorkflowPattern;
import io.agenthub.bus.workflow.WorkflowState;
import io.agenthub.config.HubConfig;
import io.agenthub.config.HubSettings;
import io.agenthub.conflict.ConflictStrategy;
import io.agenthub.conflict.Escalation;
import io.agenthub.model.Request;
import io.agenthub.observability.AuditLogger;
import io.agenthub.runtime.AgentHubRuntime;
import io.agenthub.state.AccessLevel;
import io.agenthub.state.Checkpoint;
import io.agenthub.state.ConsistencyLevel;
import io.agenthub.state.DeleteOutcome;
import io.agenthub.state.RestoreOutcome;
import io.agenthub.state.Scope;
import io.agenthub.state.StateEntry;
import io.agenthub.state.StateType;
import io.agenthub.state.WriteOutcome;
import io.agenthub.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(
        name = "agenthub",
        mixinStandardHelpOptions = true,
        description = "Agent hub coordination core CLI",
        subcommands = {
                AgentHubCommand.InitCommand.class,
                AgentHubCommand.StateSetCommand.class,
                AgentHubCommand.StateGetCommand.class,
                AgentHubCommand.StateDeleteCommand.class,
                AgentHubCommand.CheckpointCommand.class,
                AgentHubCommand.RestoreCommand.class,
                AgentHubCommand.DeadLettersCommand.class,
                AgentHubCommand.EscalationsCommand.class,
                AgentHubCommand.MaintenanceCommand.class,
                AgentHubCommand.MetricsCommand.class,
                AgentHubCommand.AuditVerifyCommand.class,
                AgentHubCommand.DemoCommand.class
        }
)
public final class AgentHubCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = HubConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | state-set | state-get | state-delete | checkpoint | restore | dead-letters | escalations | maintenance | metrics | audit-verify | demo");
    }

    HubConfig config() {
        return HubConfig.fromRoot(root);
    }

    AgentHubRuntime runtime() {
        return new AgentHubRuntime(config());
    }

    static JsonNode parseValue(String raw) {
        try {
            return Jsons.fromJson(raw, JsonNode.class);
        } catch (IllegalStateException e) {
            // Not JSON: store it as a plain string.
            return TextNode.valueOf(raw);
        }
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                System.out.println("Initialized agent hub at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "state-set", description = "Write a state entry")
    static final class StateSetCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Parameters(index = "0", description = "State key")
        String key;

        @Parameters(index = "1", description = "Value (JSON, or plain text)")
        String value;

        @Option(names = {"--scope"}, defaultValue = "global", description = "global|workflow|agent|user|temporary")
        String scope;

        @Option(names = {"--owner"}, defaultValue = "cli", description = "Owning agent id")
        String owner;

        @Option(names = {"--consistency"}, defaultValue = "eventual", description = "strong|eventual|weak")
        String consistency;

        @Option(names = {"--strategy"}, defaultValue = "last_writer_wins", description = "Conflict strategy")
        String strategy;

        @Option(names = {"--type"}, defaultValue = "configuration", description = "State type")
        String stateType;

        @Option(names = {"--ttl-ms"}, description = "Optional time to live")
        Long ttlMs;

        @Option(names = {"--access"}, description = "public|protected|private|restricted (default: keep, or public)")
        String access;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                WriteOutcome out = runtime.state().set(
                        key,
                        parseValue(value),
                        Scope.fromString(scope),
                        StateType.fromString(stateType),
                        access == null ? null : AccessLevel.fromString(access),
                        owner,
                        ConsistencyLevel.fromString(consistency),
                        ttlMs,
                        ConflictStrategy.fromString(strategy)
                );
                System.out.println(Jsons.toJson(out));
                return out.accepted() ? 0 : 1;
            }
        }
    }

    @Command(name = "state-get", description = "Read a state entry")
    static final class StateGetCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Parameters(index = "0", description = "State key")
        String key;

        @Option(names = {"--scope"}, defaultValue = "global", description = "global|workflow|agent|user|temporary")
        String scope;

        @Option(names = {"--consistency"}, defaultValue = "eventual", description = "strong|eventual|weak")
        String consistency;

        @Option(names = {"--agent"}, description = "Read on behalf of this agent, applying access levels")
        String agent;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                Optional<StateEntry> entry = agent == null
                        ? runtime.state().getEntry(key, Scope.fromString(scope), ConsistencyLevel.fromString(consistency))
                        : runtime.state().getEntry(key, Scope.fromString(scope), ConsistencyLevel.fromString(consistency), agent);
                if (entry.isEmpty()) {
                    System.out.println("State entry not found: " + scope + "/" + key);
                    return 1;
                }
                System.out.println(Jsons.toJson(entry.get()));
                return 0;
            }
        }
    }

    @Command(name = "state-delete", description = "Delete a state entry")
    static final class StateDeleteCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Parameters(index = "0", description = "State key")
        String key;

        @Option(names = {"--scope"}, defaultValue = "global", description = "global|workflow|agent|user|temporary")
        String scope;

        @Option(names = {"--owner"}, defaultValue = "cli", description = "Deleting agent id")
        String owner;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                DeleteOutcome out = runtime.state().delete(key, Scope.fromString(scope), owner);
                System.out.println(Jsons.toJson(out));
                return out.deleted() ? 0 : 1;
            }
        }
    }

    @Command(name = "checkpoint", description = "Snapshot one scope under a name")
    static final class CheckpointCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Parameters(index = "0", description = "Checkpoint name")
        String name;

        @Option(names = {"--scope"}, defaultValue = "global", description = "Scope to snapshot")
        String scope;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                Checkpoint checkpoint = runtime.checkpoints().create(name, Scope.fromString(scope));
                System.out.println(Jsons.toJson(Map.of(
                        "name", checkpoint.name(),
                        "scope", checkpoint.scope().wireName(),
                        "entries", checkpoint.entries().size(),
                        "createdAtMs", checkpoint.createdAtMs()
                )));
                return 0;
            }
        }
    }

    @Command(name = "restore", description = "Restore a scope from a checkpoint")
    static final class RestoreCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Parameters(index = "0", description = "Checkpoint name")
        String name;

        @Option(names = {"--scope"}, defaultValue = "global", description = "Scope to restore")
        String scope;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                RestoreOutcome out = runtime.checkpoints().restore(name, Scope.fromString(scope));
                System.out.println(Jsons.toJson(out));
                return out.restored() ? 0 : 1;
            }
        }
    }

    @Command(name = "dead-letters", description = "List dead letters, or replay one")
    static final class DeadLettersCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Option(names = {"--replay"}, description = "Message id to put back on the bus")
        String replayId;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                if (replayId != null) {
                    SendOutcome out = runtime.bus().replayDeadLetter(replayId);
                    System.out.println(Jsons.toJson(out));
                    return out.status() == SendOutcome.Status.REJECTED ? 1 : 0;
                }
                List<MessageRecord> records = runtime.bus().deadLetters();
                System.out.println(Jsons.toJson(records));
                return 0;
            }
        }
    }

    @Command(name = "escalations", description = "List human escalations, or resolve one")
    static final class EscalationsCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Option(names = {"--open"}, description = "Only list open escalations")
        boolean openOnly;

        @Option(names = {"--resolve"}, description = "Escalation id to resolve")
        String resolveId;

        @Option(names = {"--resolution"}, defaultValue = "acknowledged", description = "Resolution note")
        String resolution;

        @Option(names = {"--operator"}, defaultValue = "operator", description = "Resolving operator")
        String operator;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                if (resolveId != null) {
                    boolean resolved = runtime.escalations().resolve(resolveId, resolution, operator);
                    System.out.println(Jsons.toJson(Map.of("id", resolveId, "resolved", resolved)));
                    return resolved ? 0 : 1;
                }
                List<Escalation> rows = openOnly ? runtime.escalations().open() : runtime.escalations().list();
                System.out.println(Jsons.toJson(rows));
                return 0;
            }
        }
    }

    @Command(name = "maintenance", description = "Run every sweep once")
    static final class MaintenanceCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                AgentHubRuntime.MaintenanceOutcome out = runtime.runMaintenance();
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Override
        public Integer call() {
            try (AgentHubRuntime runtime = parent.runtime()) {
                AuditLogger.IntegrityReport out = runtime.verifyAuditIntegrity();
                System.out.println(Jsons.toJson(out));
                return out.valid() ? 0 : 1;
            }
        }
    }

    @Command(name = "demo", description = "Register sample agents, route a request and run a workflow")
    static final class DemoCommand implements Callable<Integer> {
        @ParentCommand
        AgentHubCommand parent;

        @Option(names = {"--content"}, defaultValue = "find a defi yield strategy and check wallet security",
                description = "Request text to route")
        String content;

        @Override
        public Integer call() throws Exception {
            HubSettings fast = HubSettings.fromJson("{\"backoffUnitMs\":20,\"coordinationWaitMs\":3000,\"handlerTimeoutMs\":1000}");
            try (AgentHubRuntime runtime = new AgentHubRuntime(parent.config().withSettings(fast))) {
                runtime.start();
                EchoAgent strategist = new EchoAgent("defi_strategist");
                EchoAgent wallet = new EchoAgent("wallet_manager");
                EchoAgent security = new EchoAgent("security_validator");
                FailAgent flaky = new FailAgent("flaky_agent");
                runtime.registry().register(strategist.descriptor(List.of("defi")), strategist);
                runtime.registry().register(wallet.descriptor(List.of("wallet")), wallet);
                runtime.registry().register(security.descriptor(List.of("security")), security);
                runtime.registry().register(flaky.descriptor(List.of("defi")), flaky);

                Request request = Request.of("demo-user", content);
                List<String> selected = runtime.router().selectAgents(request);
                CoordinatedResponse coordinated = runtime.router().coordinate(request, selected);

                WorkflowOutcome started = runtime.workflows().startWorkflow("demo-" + request.id(), WorkflowPattern.SEQUENTIAL,
                        List.of(strategist.id(), wallet.id(), security.id()), Map.of("action", "review"));
                WorkflowState workflow = started.started()
                        ? runtime.workflows().completion(started.workflowId()).get(10, TimeUnit.SECONDS)
                        : null;
                runtime.bus().awaitIdle(5_000L);

                ObjectNode out = Jsons.object();
                out.set("selected_agents", Jsons.toTree(selected));
                out.put("consensus_reached", coordinated.consensusReached());
                out.put("confidence_score", coordinated.confidenceScore());
                out.set("consolidated_result", coordinated.consolidatedResult());
                out.put("workflow_status", workflow == null ? started.reason() : workflow.status().wireName());
                out.put("dead_letters", runtime.bus().deadLetters().size());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }
}
