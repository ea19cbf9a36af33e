package com.overseer.test.domain;

import com.overseer.domain.workflow.adapter.gateway.IReplyReader;
import com.overseer.domain.workflow.model.valobj.JoinBarrierEntry;
import com.overseer.domain.workflow.model.valobj.JoinBarrierResult;
import com.overseer.domain.workflow.service.AgentRunDomainService;
import com.overseer.domain.workflow.service.JoinBarrierDomainService;
import com.overseer.test.support.RecordingWorkflowLogger;
import com.overseer.test.support.ScriptedAgentGateway;
import com.overseer.test.support.WorkflowTestHarness;
import com.overseer.types.enums.AgentRunStatusEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

public class JoinBarrierDomainServiceTest {

    private ExecutorService executor;
    private ScriptedAgentGateway gateway;
    private RecordingWorkflowLogger logger;
    private JoinBarrierDomainService joinBarrierDomainService;

    @BeforeEach
    public void setUp() {
        executor = Executors.newFixedThreadPool(4);
        gateway = new ScriptedAgentGateway();
        logger = new RecordingWorkflowLogger();
        joinBarrierDomainService = new JoinBarrierDomainService(executor,
                new AgentRunDomainService(WorkflowTestHarness.defaultConfig()));
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldReturnEmptyListWithoutGatewayCalls() {
        List<JoinBarrierResult> results = joinBarrierDomainService.awaitJoinBarrier(
                new ArrayList<>(), 1000L, gateway, gateway, logger);

        Assertions.assertTrue(results.isEmpty());
        Assertions.assertTrue(gateway.calls().isEmpty());
    }

    @Test
    public void shouldKeepInputOrderWhenRunsFinishOutOfOrder() {
        // 完成顺序 C, A, B
        gateway.waitWith("session-a", delayedOk(120))
                .waitWith("session-b", delayedOk(240))
                .waitWith("session-c", delayedOk(0))
                .reply("session-a", "reply A")
                .reply("session-b", "reply B")
                .reply("session-c", "reply C");
        List<JoinBarrierEntry> entries = register("a", "b", "c");

        List<JoinBarrierResult> results = joinBarrierDomainService.awaitJoinBarrier(entries, 1000L, gateway, gateway, logger);

        Assertions.assertEquals(List.of("run-a", "run-b", "run-c"),
                results.stream().map(result -> result.entry().runId()).collect(Collectors.toList()));
        Assertions.assertEquals(List.of("reply A", "reply B", "reply C"),
                results.stream().map(JoinBarrierResult::reply).collect(Collectors.toList()));
    }

    @Test
    public void shouldWaitForAllEntriesConcurrently() {
        CountDownLatch allWaiting = new CountDownLatch(3);
        Supplier<Map<String, Object>> rendezvous = () -> {
            allWaiting.countDown();
            try {
                if (!allWaiting.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("waits were not concurrent");
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", ex);
            }
            return status("ok", null);
        };
        gateway.waitWith("session-", rendezvous);

        List<JoinBarrierResult> results = joinBarrierDomainService.awaitJoinBarrier(
                register("a", "b", "c"), 1000L, gateway, gateway, logger);

        Assertions.assertTrue(results.stream().allMatch(result -> result.status() == AgentRunStatusEnum.OK));
    }

    @Test
    public void shouldIsolateSingleEntryFailure() {
        gateway.waitThrows("session-b", new RuntimeException("network error"))
                .reply("session-a", "reply A")
                .reply("session-c", "reply C");

        List<JoinBarrierResult> results = joinBarrierDomainService.awaitJoinBarrier(
                register("a", "b", "c"), 1000L, gateway, gateway, logger);

        Assertions.assertEquals(3, results.size());
        Assertions.assertEquals(AgentRunStatusEnum.OK, results.get(0).status());
        Assertions.assertEquals(AgentRunStatusEnum.ERROR, results.get(1).status());
        Assertions.assertEquals("network error", results.get(1).error());
        Assertions.assertNull(results.get(1).reply());
        Assertions.assertEquals("reply C", results.get(2).reply());
    }

    @Test
    public void shouldReportTimeoutWithoutReadingReply() {
        gateway.waitReturns("session-c", "timeout", null)
                .reply("session-a", "reply A")
                .reply("session-b", "reply B")
                .reply("session-c", "should not be read");

        List<JoinBarrierResult> results = joinBarrierDomainService.awaitJoinBarrier(
                register("a", "b", "c"), 1000L, gateway, gateway, logger);

        Assertions.assertEquals(AgentRunStatusEnum.OK, results.get(0).status());
        Assertions.assertEquals(AgentRunStatusEnum.OK, results.get(1).status());
        Assertions.assertEquals(AgentRunStatusEnum.TIMEOUT, results.get(2).status());
        Assertions.assertNull(results.get(2).reply());
        Assertions.assertNull(results.get(2).error());
    }

    @Test
    public void shouldPassTimeoutToRemoteWaitAndAddGrace() {
        joinBarrierDomainService.awaitJoinBarrier(register("a"), 2500L, gateway, gateway, logger);

        ScriptedAgentGateway.Call call = gateway.calls("agent.wait").get(0);
        Assertions.assertEquals("run-a", call.params().get("runId"));
        Assertions.assertEquals(2500L, call.params().get("timeoutMs"));
        Assertions.assertEquals(3500L, call.timeoutMs());
    }

    @Test
    public void shouldKeepNullReplyForOkEntry() {
        List<JoinBarrierResult> results = joinBarrierDomainService.awaitJoinBarrier(
                register("a"), 1000L, gateway, gateway, logger);

        Assertions.assertEquals(AgentRunStatusEnum.OK, results.get(0).status());
        Assertions.assertNull(results.get(0).reply());
    }

    @Test
    public void shouldTurnReaderFailureIntoError() {
        IReplyReader brokenReader = sessionKey -> {
            throw new IllegalStateException("history unavailable");
        };

        List<JoinBarrierResult> results = joinBarrierDomainService.awaitJoinBarrier(
                register("a"), 1000L, gateway, brokenReader, logger);

        Assertions.assertEquals(AgentRunStatusEnum.ERROR, results.get(0).status());
        Assertions.assertEquals("history unavailable", results.get(0).error());
        Assertions.assertTrue(logger.contains("WARN", "reply read failed"));
    }

    private List<JoinBarrierEntry> register(String... names) {
        List<JoinBarrierEntry> entries = new ArrayList<>();
        for (String name : names) {
            gateway.registerRun("run-" + name, "session-" + name);
            entries.add(new JoinBarrierEntry("run-" + name, "session-" + name, "question " + name));
        }
        return entries;
    }

    private Supplier<Map<String, Object>> delayedOk(long delayMs) {
        return () -> {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", ex);
            }
            return status("ok", null);
        };
    }

    private static Map<String, Object> status(String status, String error) {
        Map<String, Object> result = new HashMap<>();
        result.put("status", status);
        if (error != null) {
            result.put("error", error);
        }
        return result;
    }
}
