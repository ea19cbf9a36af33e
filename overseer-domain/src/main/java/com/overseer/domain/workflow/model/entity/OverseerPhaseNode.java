package com.overseer.domain.workflow.model.entity;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 阶段节点
 */
@Getter
@Setter
public class OverseerPhaseNode extends OverseerNode {

    private List<OverseerTaskNode> tasks = new ArrayList<>();
}
