package com.overseer.test.domain;

import com.overseer.domain.workflow.model.entity.OverseerPhaseNode;
import com.overseer.domain.workflow.model.entity.OverseerPlanEntity;
import com.overseer.domain.workflow.model.entity.OverseerSubtaskNode;
import com.overseer.domain.workflow.model.entity.OverseerTaskNode;
import com.overseer.domain.workflow.model.valobj.ExecutionProgress;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workflow.model.valobj.WorkflowCancellation;
import com.overseer.domain.workflow.model.valobj.WorkflowPlan;
import com.overseer.domain.workflow.service.AgentRunDomainService;
import com.overseer.domain.workflow.service.WorkflowJsonDomainService;
import com.overseer.domain.workflow.service.WorkflowPhaseContext;
import com.overseer.domain.workflow.service.WorkflowPromptDomainService;
import com.overseer.domain.workflow.service.phase.ExecutePhaseService;
import com.overseer.test.support.RecordingWorkflowLogger;
import com.overseer.test.support.ScriptedAgentGateway;
import com.overseer.test.support.WorkflowTestHarness;
import com.overseer.types.common.Constants;
import com.overseer.types.enums.NodeStatusEnum;
import com.overseer.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class ExecutePhaseServiceTest {

    private ScriptedAgentGateway gateway;
    private RecordingWorkflowLogger logger;
    private WorkerConfig config;
    private ExecutePhaseService executePhaseService;

    @BeforeEach
    public void setUp() {
        gateway = new ScriptedAgentGateway().reply(":exec:", "done");
        logger = new RecordingWorkflowLogger();
        config = WorkflowTestHarness.defaultConfig();
        config.getWorkflow().getExecute().setTimeoutMs(7000L);
        WorkflowJsonDomainService json = WorkflowTestHarness.jsonService();
        executePhaseService = new ExecutePhaseService(new AgentRunDomainService(config), new WorkflowPromptDomainService(json));
    }

    @Test
    public void shouldRunSubtasksDepthFirstInOrder() {
        OverseerPlanEntity dag = tree(new int[][]{{2, 1}, {1}});
        ExecutionProgress progress = ExecutionProgress.of(dag.countSubtasks());

        executePhaseService.run(context(WorkflowCancellation.none()), plan(), dag, progress);

        Assertions.assertEquals(List.of(
                "agent:main:workflow:wi-1:exec:P1.T1.S1",
                "agent:main:workflow:wi-1:exec:P1.T1.S2",
                "agent:main:workflow:wi-1:exec:P1.T2.S1",
                "agent:main:workflow:wi-1:exec:P2.T1.S1"), gateway.dispatchedSessionKeys());
        Assertions.assertEquals(4, progress.getCompletedNodes());
        Assertions.assertEquals(0, progress.getFailedNodes());
        Assertions.assertNull(progress.getCurrentNodeId());
        Assertions.assertTrue(dag.getPhases().stream().allMatch(OverseerPhaseNode::isDone));
        OverseerSubtaskNode first = (OverseerSubtaskNode) dag.findNode("P1.T1.S1");
        Assertions.assertEquals("done", first.getOutput());
        Assertions.assertEquals("run-1", first.getRunId());
        Assertions.assertTrue(gateway.calls("agent.wait").stream()
                .allMatch(call -> Long.valueOf(7000L).equals(call.params().get("timeoutMs"))));
    }

    @Test
    public void shouldFailTaskAndContinueWithSiblingTasks() {
        gateway.waitReturns(":exec:P1.T1.S1", "error", "compile error");
        OverseerPlanEntity dag = tree(new int[][]{{2, 1}});
        ExecutionProgress progress = ExecutionProgress.of(dag.countSubtasks());

        executePhaseService.run(context(WorkflowCancellation.none()), plan(), dag, progress);

        OverseerPhaseNode phase = dag.getPhases().get(0);
        OverseerTaskNode failedTask = phase.getTasks().get(0);
        Assertions.assertEquals(NodeStatusEnum.FAILED, failedTask.getStatus());
        Assertions.assertEquals(NodeStatusEnum.FAILED, failedTask.getSubtasks().get(0).getStatus());
        Assertions.assertEquals("compile error", failedTask.getSubtasks().get(0).getOutput());
        // 同一 task 的剩余 subtask 不再执行，直接标记失败
        Assertions.assertEquals(NodeStatusEnum.FAILED, failedTask.getSubtasks().get(1).getStatus());
        Assertions.assertEquals("skipped: sibling P1.T1.S1 failed", failedTask.getSubtasks().get(1).getOutput());
        Assertions.assertFalse(gateway.dispatchedSessionKeys().contains("agent:main:workflow:wi-1:exec:P1.T1.S2"));
        Assertions.assertEquals(NodeStatusEnum.DONE, phase.getTasks().get(1).getStatus());
        Assertions.assertEquals(NodeStatusEnum.FAILED, phase.getStatus());
        Assertions.assertEquals(1, progress.getCompletedNodes());
        Assertions.assertEquals(2, progress.getFailedNodes());
        Assertions.assertEquals(0, progress.getPendingNodes());
        Assertions.assertTrue(logger.contains("WARN", "nodeId=P1.T1.S1"));
    }

    @Test
    public void shouldTreatTimeoutAndTransportFailureAsNodeFailure() {
        gateway.waitReturns(":exec:P1.T1.S1", "timeout", null)
                .failDispatch(":exec:P1.T2.S1", new RuntimeException("connection reset"));
        OverseerPlanEntity dag = tree(new int[][]{{1, 1}});
        ExecutionProgress progress = ExecutionProgress.of(dag.countSubtasks());

        executePhaseService.run(context(WorkflowCancellation.none()), plan(), dag, progress);

        Assertions.assertEquals("subtask timed out after 7000ms",
                ((OverseerSubtaskNode) dag.findNode("P1.T1.S1")).getOutput());
        Assertions.assertEquals("connection reset", ((OverseerSubtaskNode) dag.findNode("P1.T2.S1")).getOutput());
        Assertions.assertEquals(2, progress.getFailedNodes());
    }

    @Test
    public void shouldAbortOnFirstFailureWhenConfigured() {
        config.getWorkflow().getExecute().setAbortOnFailure(true);
        gateway.waitReturns(":exec:P1.T1.S1", "error", "boom");
        OverseerPlanEntity dag = tree(new int[][]{{1, 1}, {1}});
        ExecutionProgress progress = ExecutionProgress.of(dag.countSubtasks());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> executePhaseService.run(context(WorkflowCancellation.none()), plan(), dag, progress));

        Assertions.assertEquals("subtask P1.T1.S1 failed: boom", ex.getMessage());
        Assertions.assertEquals(1, gateway.calls("agent").size());
        Assertions.assertEquals(NodeStatusEnum.FAILED, dag.findNode("P1").getStatus());
        Assertions.assertEquals(NodeStatusEnum.TODO, dag.findNode("P1.T2").getStatus());
        Assertions.assertEquals(NodeStatusEnum.TODO, dag.findNode("P2").getStatus());
        Assertions.assertNull(progress.getCurrentNodeId());
    }

    @Test
    public void shouldFailOpenNodesWhenCancelledBetweenSubtasks() {
        WorkflowCancellation cancellation = new WorkflowCancellation();
        gateway.waitWith(":exec:P1.T1.S1", () -> {
            cancellation.cancel();
            Map<String, Object> result = new HashMap<>();
            result.put("status", "ok");
            return result;
        });
        OverseerPlanEntity dag = tree(new int[][]{{2}});
        ExecutionProgress progress = ExecutionProgress.of(dag.countSubtasks());
        int versionBefore = dag.getPlanVersion();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> executePhaseService.run(context(cancellation), plan(), dag, progress));

        Assertions.assertEquals(Constants.CANCELLED_ERROR, ex.getMessage());
        Assertions.assertEquals(NodeStatusEnum.DONE, dag.findNode("P1.T1.S1").getStatus());
        Assertions.assertEquals(NodeStatusEnum.TODO, dag.findNode("P1.T1.S2").getStatus());
        Assertions.assertEquals(NodeStatusEnum.FAILED, dag.findNode("P1.T1").getStatus());
        Assertions.assertEquals(NodeStatusEnum.FAILED, dag.findNode("P1").getStatus());
        Assertions.assertTrue(dag.getPlanVersion() > versionBefore);
    }

    /**
     * @param shape 每个 phase 下各 task 的 subtask 数
     */
    private OverseerPlanEntity tree(int[][] shape) {
        OverseerPlanEntity dag = new OverseerPlanEntity();
        for (int p = 0; p < shape.length; p++) {
            OverseerPhaseNode phase = new OverseerPhaseNode();
            phase.setId("P" + (p + 1));
            phase.setName("Phase " + (p + 1));
            for (int t = 0; t < shape[p].length; t++) {
                OverseerTaskNode task = new OverseerTaskNode();
                task.setId(phase.getId() + ".T" + (t + 1));
                task.setName("Task " + (t + 1));
                for (int s = 0; s < shape[p][t]; s++) {
                    OverseerSubtaskNode subtask = new OverseerSubtaskNode();
                    subtask.setId(task.getId() + ".S" + (s + 1));
                    subtask.setName("Subtask " + (s + 1));
                    subtask.setObjective("Do step " + (s + 1));
                    task.getSubtasks().add(subtask);
                }
                phase.getTasks().add(task);
            }
            dag.addPhase(phase);
        }
        return dag;
    }

    private WorkflowPhaseContext context(WorkflowCancellation cancellation) {
        return new WorkflowPhaseContext(WorkflowTestHarness.newWorkItem("wi-1", "Add login"), config,
                gateway, gateway, logger, cancellation);
    }

    private WorkflowPlan plan() {
        WorkflowPlan plan = new WorkflowPlan();
        plan.setIntent("Add login");
        return plan;
    }
}
