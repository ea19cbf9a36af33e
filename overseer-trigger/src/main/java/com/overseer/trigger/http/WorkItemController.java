package com.overseer.trigger.http;

import com.overseer.api.dto.WorkItemDTO;
import com.overseer.api.dto.WorkItemSubmitRequestDTO;
import com.overseer.api.dto.WorkflowStateDTO;
import com.overseer.api.response.Response;
import com.overseer.domain.workflow.adapter.repository.IWorkflowStateRepository;
import com.overseer.domain.workflow.model.entity.WorkflowStateEntity;
import com.overseer.domain.workflow.model.valobj.WorkerConfig;
import com.overseer.domain.workqueue.adapter.repository.IWorkItemRepository;
import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.trigger.application.command.WorkItemCommandService;
import com.overseer.trigger.application.common.WorkflowViewAssembler;
import com.overseer.types.enums.ResponseCode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作项入队、查询与取消 API。
 */
@RestController
@RequestMapping("/api/work-items")
public class WorkItemController {

    private final WorkItemCommandService workItemCommandService;
    private final IWorkItemRepository workItemRepository;
    private final IWorkflowStateRepository workflowStateRepository;
    private final WorkflowViewAssembler workflowViewAssembler;
    private final WorkerConfig workerConfig;

    public WorkItemController(WorkItemCommandService workItemCommandService,
                              IWorkItemRepository workItemRepository,
                              IWorkflowStateRepository workflowStateRepository,
                              WorkflowViewAssembler workflowViewAssembler,
                              WorkerConfig workerConfig) {
        this.workItemCommandService = workItemCommandService;
        this.workItemRepository = workItemRepository;
        this.workflowStateRepository = workflowStateRepository;
        this.workflowViewAssembler = workflowViewAssembler;
        this.workerConfig = workerConfig;
    }

    @PostMapping
    public Response<WorkItemDTO> submit(@RequestBody WorkItemSubmitRequestDTO request) {
        WorkItemEntity saved = workItemCommandService.submit(request);
        return success(workflowViewAssembler.toWorkItemDTO(saved));
    }

    @GetMapping
    public Response<List<WorkItemDTO>> list(@RequestParam(value = "queueId", required = false) String queueId) {
        String resolvedQueueId = StringUtils.defaultIfBlank(queueId, workerConfig.getQueueId());
        List<WorkItemDTO> items = workItemRepository.listByQueue(resolvedQueueId).stream()
                .map(workflowViewAssembler::toWorkItemDTO)
                .collect(Collectors.toList());
        return success(items);
    }

    @GetMapping("/{id}")
    public Response<WorkItemDTO> get(@PathVariable("id") String workItemId) {
        WorkItemEntity item = workItemRepository.findById(workItemId);
        if (item == null) {
            return illegal("工作项不存在");
        }
        return success(workflowViewAssembler.toWorkItemDTO(item));
    }

    @GetMapping("/{id}/workflow")
    public Response<WorkflowStateDTO> workflow(@PathVariable("id") String workItemId) {
        WorkflowStateEntity state = workflowStateRepository.findByWorkItemId(workItemId);
        if (state == null) {
            return illegal("工作流状态不存在或已过期");
        }
        return success(workflowViewAssembler.toWorkflowStateDTO(state));
    }

    @PostMapping("/{id}/cancel")
    public Response<WorkItemDTO> cancel(@PathVariable("id") String workItemId) {
        WorkItemEntity cancelled = workItemCommandService.cancel(workItemId);
        return success(workflowViewAssembler.toWorkItemDTO(cancelled));
    }

    private <T> Response<T> illegal(String message) {
        return Response.<T>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(message)
                .build();
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
