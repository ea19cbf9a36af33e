package com.overseer.domain.workflow.model.entity;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 任务节点
 */
@Getter
@Setter
public class OverseerTaskNode extends OverseerNode {

    private List<OverseerSubtaskNode> subtasks = new ArrayList<>();
}
