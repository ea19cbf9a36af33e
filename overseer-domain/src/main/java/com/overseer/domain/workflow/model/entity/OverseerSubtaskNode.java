package com.overseer.domain.workflow.model.entity;

import lombok.Getter;
import lombok.Setter;

/**
 * 子任务节点：执行树的可执行叶子。
 */
@Getter
@Setter
public class OverseerSubtaskNode extends OverseerNode {

    /**
     * 子任务目标，作为执行子 Agent 的主要指令
     */
    private String objective;

    /**
     * 执行子 Agent 的运行 ID
     */
    private String runId;

    /**
     * 执行输出（最新回复）或失败原因
     */
    private String output;
}
