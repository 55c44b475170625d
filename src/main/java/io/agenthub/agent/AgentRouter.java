package io.agenthub.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agenthub.bus.MessageBus;
import io.agenthub.bus.SendOutcome;
import io.agenthub.config.HubSettings;
import io.agenthub.conflict.AgentConflict;
import io.agenthub.conflict.ConflictArbiter;
import io.agenthub.conflict.ConflictDecision;
import io.agenthub.error.ErrorKind;
import io.agenthub.error.HubException;
import io.agenthub.model.Message;
import io.agenthub.model.Priority;
import io.agenthub.model.Request;
import io.agenthub.model.Response;
import io.agenthub.observability.AuditLogger;
import io.agenthub.observability.HubMetrics;
import io.agenthub.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

/**
 * Picks agents for a request and talks to them over the bus.
 *
 * <p>Selection: the request is classified into capability buckets by keyword match on its content
 * plus any explicit {@code context.capabilities} tags. Each bucket contributes its idle agents
 * below the load threshold. With no bucket matched, the default capability is used.
 */
public final class AgentRouter {
    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);
    public static final String HUB_AGENT = "hub_controller";
    public static final String PROCESS_ACTION = "process_request";
    public static final String CONFLICT_RESOLVED = "conflict_resolved";
    private static final double EPSILON = 1e-9;

    private final AgentRegistry registry;
    private final MessageBus bus;
    private final ConflictArbiter arbiter;
    private final AuditLogger audit;
    private final HubMetrics metrics;
    private final LongSupplier clock;
    private final Map<String, List<String>> capabilityKeywords;
    private final String defaultCapability;
    private final double loadThreshold;
    private final double consensusThreshold;
    private final long waitMs;
    private final long sessionTtlMs;
    private final Map<String, CoordinationSession> sessions = new ConcurrentHashMap<>();

    public AgentRouter(
            HubSettings settings,
            AgentRegistry registry,
            MessageBus bus,
            ConflictArbiter arbiter,
            AuditLogger audit,
            HubMetrics metrics,
            LongSupplier clock
    ) {
        this.registry = registry;
        this.bus = bus;
        this.arbiter = arbiter;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.capabilityKeywords = settings.capabilityKeywords();
        this.defaultCapability = settings.defaultCapability();
        this.loadThreshold = settings.loadThreshold();
        this.consensusThreshold = settings.consensusThreshold();
        this.waitMs = settings.coordinationWaitMs();
        this.sessionTtlMs = settings.sessionTtlMs();
    }

    /** Capability buckets a request falls into, in configuration order followed by explicit tags. */
    public Set<String> classify(Request request) {
        Set<String> buckets = new LinkedHashSet<>();
        String content = request.content() == null ? "" : request.content().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> bucket : capabilityKeywords.entrySet()) {
            for (String keyword : bucket.getValue()) {
                if (!keyword.isBlank() && content.contains(keyword.toLowerCase(Locale.ROOT))) {
                    buckets.add(bucket.getKey());
                    break;
                }
            }
        }
        buckets.addAll(request.capabilityTags());
        return buckets;
    }

    public List<String> selectAgents(Request request) {
        Set<String> selected = new LinkedHashSet<>();
        for (String bucket : classify(request)) {
            selected.addAll(registry.available(bucket, loadThreshold));
        }
        if (selected.isEmpty()) {
            selected.addAll(registry.available(defaultCapability, loadThreshold));
        }
        return new ArrayList<>(selected);
    }

    /**
     * Sends the request to the selected agent, or coordinates when more than one agent matched.
     *
     * @throws HubException {@link ErrorKind#ROUTING} when no agent is available,
     *                      {@link ErrorKind#DELIVERY_FAILURE} when the single agent fails
     */
    public Response route(Request request) {
        long started = clock.getAsLong();
        List<String> agents = selectAgents(request);
        if (agents.isEmpty()) {
            metrics.increment(HubMetrics.ROUTING_FAILURES);
            log.warn("no suitable agents available for request {}", request.id());
            throw new HubException(ErrorKind.ROUTING, "no suitable agents available for request " + request.id());
        }
        if (agents.size() == 1) {
            String agentId = agents.get(0);
            CompletableFuture<Message> reply = send(agentId, request, null);
            AgentReply result = await(request.id(), agentId, reply, deadline(waitMs));
            if (result.error() != null) {
                throw new HubException(ErrorKind.DELIVERY_FAILURE,
                        "agent " + agentId + " failed request " + request.id() + ": " + result.error());
            }
            return result.response();
        }
        CoordinatedResponse coordinated = coordinate(request, agents);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("coordination_id", coordinated.coordinationId());
        metadata.put("consensus_reached", coordinated.consensusReached());
        metadata.put("confidence_score", coordinated.confidenceScore());
        return new Response(
                request.id(),
                Response.COORDINATED,
                coordinated.consensusReached() ? Response.Status.SUCCESS : Response.Status.PARTIAL,
                coordinated.consolidatedResult(),
                metadata,
                clock.getAsLong() - started
        );
    }

    /**
     * Fans the request out to every agent and collects replies within the coordination wait.
     * Failed or late agents are excluded from the result, never fatal to the session.
     */
    public CoordinatedResponse coordinate(Request request, List<String> agentIds) {
        if (agentIds == null || agentIds.isEmpty()) {
            throw new HubException(ErrorKind.VALIDATION, "coordination needs at least one agent");
        }
        long started = clock.getAsLong();
        String coordinationId = UUID.randomUUID().toString();
        CoordinationSession session = new CoordinationSession(coordinationId, request, agentIds, started);
        sessions.put(coordinationId, session);
        try {
            Map<String, CompletableFuture<Message>> inFlight = new LinkedHashMap<>();
            for (String agentId : agentIds) {
                inFlight.put(agentId, send(agentId, request, coordinationId));
            }
            long deadline = deadline(waitMs);
            List<Response> valid = new ArrayList<>();
            for (Map.Entry<String, CompletableFuture<Message>> entry : inFlight.entrySet()) {
                AgentReply reply = await(request.id(), entry.getKey(), entry.getValue(), deadline);
                if (reply.error() != null) {
                    log.warn("agent response failed coordination={} agent={} error={}",
                            coordinationId, entry.getKey(), reply.error());
                    continue;
                }
                session.record(reply.response());
                valid.add(reply.response());
            }
            boolean consensus = consensusReached(valid.size(), agentIds.size(), consensusThreshold);
            double confidence = confidenceScore(valid.size());
            session.markStatus(CoordinationSession.Status.COMPLETED);
            metrics.increment(HubMetrics.COORDINATIONS);
            if (!consensus) {
                metrics.increment(HubMetrics.CONSENSUS_FAILURES);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("agents", agentIds);
            details.put("responses", valid.size());
            details.put("consensus_reached", consensus);
            audit.log(AuditLogger.AuditEvent.correlated("coordination.complete", HUB_AGENT, "request:" + request.id(),
                    consensus ? "consensus" : "no_consensus", coordinationId, details));
            log.info("agent coordination completed id={} agents={} responses={} consensus={} confidence={}",
                    coordinationId, agentIds.size(), valid.size(), consensus, confidence);
            return new CoordinatedResponse(
                    coordinationId,
                    request.id(),
                    agentIds,
                    consolidate(valid),
                    valid,
                    consensus,
                    confidence,
                    clock.getAsLong() - started
            );
        } finally {
            sessions.remove(coordinationId);
        }
    }

    /**
     * Decides the conflict and tells every affected agent still on the bus about the outcome.
     */
    public ConflictDecision resolveConflict(AgentConflict conflict) {
        ConflictDecision decision = arbiter.decide(conflict);
        ObjectNode payload = Jsons.object();
        payload.put("conflict_id", decision.conflictId());
        payload.put("winner", decision.winner());
        payload.put("basis", decision.basis().name().toLowerCase(Locale.ROOT));
        payload.set("chosen_resolution", decision.chosenResolution());
        payload.put("reasoning", decision.reasoning());
        if (decision.escalationId() != null) {
            payload.put("escalation_id", decision.escalationId());
        }
        for (String agentId : decision.affectedAgents()) {
            if (!bus.hasHandler(agentId)) {
                continue;
            }
            SendOutcome outcome = bus.send(Message.event(HUB_AGENT, agentId, CONFLICT_RESOLVED, payload, Priority.HIGH)
                    .withCorrelationId(decision.conflictId()));
            if (!outcome.accepted()) {
                log.warn("conflict resolution notice to {} not accepted: {}", agentId, outcome.reason());
            }
        }
        return decision;
    }

    public List<CoordinationSession> activeSessions() {
        return new ArrayList<>(sessions.values());
    }

    public int sweepSessions() {
        return sweepSessions(clock.getAsLong());
    }

    /** Drops coordination sessions older than the session TTL. */
    public int sweepSessions(long nowMs) {
        int expired = 0;
        for (CoordinationSession session : new ArrayList<>(sessions.values())) {
            if (nowMs - session.createdAtMs() > sessionTtlMs && sessions.remove(session.id(), session)) {
                session.markStatus(CoordinationSession.Status.EXPIRED);
                log.info("expired coordination session cleaned up id={}", session.id());
                expired++;
            }
        }
        return expired;
    }

    static boolean consensusReached(int successes, int dispatched, double threshold) {
        return dispatched > 0 && successes >= threshold * dispatched - EPSILON;
    }

    static double confidenceScore(int responses) {
        if (responses <= 0) {
            return 0.0d;
        }
        return Math.min(1.0d, 0.5d + 0.1d * (responses - 1));
    }

    static JsonNode consolidate(List<Response> responses) {
        ObjectNode out = Jsons.object();
        if (responses.isEmpty()) {
            out.put("error", "No valid responses received");
            return out;
        }
        out.set("primary_result", responses.get(0).result());
        ArrayNode supporting = out.putArray("supporting_results");
        for (Response response : responses.subList(1, responses.size())) {
            supporting.add(response.result());
        }
        out.put("agent_count", responses.size());
        return out;
    }

    private CompletableFuture<Message> send(String agentId, Request request, String coordinationId) {
        ObjectNode payload = Jsons.object();
        payload.put("request_id", request.id());
        payload.put("user_id", request.userId());
        payload.put("content", request.content());
        payload.set("context", Jsons.toTree(request.context()));
        if (coordinationId != null) {
            payload.put("coordination_id", coordinationId);
        }
        Message message = Message.request(HUB_AGENT, agentId, PROCESS_ACTION, payload, request.priority())
                .withCorrelationId(coordinationId == null ? request.id() : coordinationId);
        return bus.dispatch(message);
    }

    private AgentReply await(String requestId, String agentId, CompletableFuture<Message> reply, long deadlineMs) {
        long sent = clock.getAsLong();
        long remaining = Math.max(1L, deadlineMs - System.currentTimeMillis());
        String error;
        try {
            Message message = reply.get(remaining, TimeUnit.MILLISECONDS);
            long elapsed = clock.getAsLong() - sent;
            Response.Status status = statusOf(message.payload());
            if (status == Response.Status.ERROR) {
                registry.recordResult(agentId, false, elapsed);
                return new AgentReply(null, message.payload().path("error").asText("agent reported an error"));
            }
            registry.recordResult(agentId, true, elapsed);
            return new AgentReply(new Response(requestId, agentId, status, message.payload(),
                    Map.of("message_id", message.id()), elapsed), null);
        } catch (TimeoutException e) {
            reply.cancel(false);
            error = "no reply within " + waitMs + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            error = cause.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "interrupted";
        }
        registry.recordResult(agentId, false, clock.getAsLong() - sent);
        return new AgentReply(null, error == null ? "unknown failure" : error);
    }

    private static Response.Status statusOf(JsonNode payload) {
        String raw = payload.path("status").asText("");
        if (raw.isBlank()) {
            return Response.Status.SUCCESS;
        }
        try {
            return Response.Status.fromString(raw);
        } catch (IllegalArgumentException e) {
            return Response.Status.SUCCESS;
        }
    }

    private static long deadline(long waitMs) {
        return System.currentTimeMillis() + waitMs;
    }

    private record AgentReply(Response response, String error) {
    }
}
