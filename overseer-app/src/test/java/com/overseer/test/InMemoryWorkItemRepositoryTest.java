package com.overseer.test;

import com.overseer.domain.workqueue.model.entity.WorkItemEntity;
import com.overseer.domain.workqueue.service.WorkItemSelectionDomainService;
import com.overseer.infrastructure.repository.workqueue.InMemoryWorkItemRepositoryImpl;
import com.overseer.types.enums.WorkItemPriorityEnum;
import com.overseer.types.enums.WorkItemStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

public class InMemoryWorkItemRepositoryTest {

    private InMemoryWorkItemRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        repository = new InMemoryWorkItemRepositoryImpl(new WorkItemSelectionDomainService());
    }

    @Test
    public void shouldClaimByPriorityThenAge() {
        LocalDateTime base = LocalDateTime.now().minusMinutes(10);
        WorkItemEntity oldLow = repository.save(item("old low", WorkItemPriorityEnum.LOW, base));
        WorkItemEntity newHigh = repository.save(item("new high", WorkItemPriorityEnum.HIGH, base.plusMinutes(5)));
        WorkItemEntity oldHigh = repository.save(item("old high", WorkItemPriorityEnum.HIGH, base.plusMinutes(1)));
        WorkItemEntity critical = repository.save(item("critical", WorkItemPriorityEnum.CRITICAL, base.plusMinutes(9)));

        List<String> claimed = List.of(
                repository.claimNext("default", "agent:main:worker:default").getId(),
                repository.claimNext("default", "agent:main:worker:default").getId(),
                repository.claimNext("default", "agent:main:worker:default").getId(),
                repository.claimNext("default", "agent:main:worker:default").getId());

        Assertions.assertEquals(List.of(critical.getId(), oldHigh.getId(), newHigh.getId(), oldLow.getId()), claimed);
        Assertions.assertNull(repository.claimNext("default", "agent:main:worker:default"));
    }

    @Test
    public void shouldMarkClaimedItemInProgress() {
        WorkItemEntity saved = repository.save(item("task", WorkItemPriorityEnum.MEDIUM, null));

        WorkItemEntity claimed = repository.claimNext("default", "agent:main:worker:default");

        Assertions.assertEquals(saved.getId(), claimed.getId());
        Assertions.assertEquals(WorkItemStatusEnum.IN_PROGRESS, claimed.getStatus());
        Assertions.assertEquals("agent:main:worker:default", claimed.getAssignedSessionKey());
        Assertions.assertNotNull(claimed.getStartedAt());
        Assertions.assertEquals(WorkItemStatusEnum.IN_PROGRESS, repository.findById(saved.getId()).getStatus());
    }

    @Test
    public void shouldOnlyClaimFromRequestedQueue() {
        WorkItemEntity other = item("other queue", WorkItemPriorityEnum.CRITICAL, null);
        other.setQueueId("ops");
        repository.save(other);

        Assertions.assertNull(repository.claimNext("default", "agent:main:worker:default"));
        Assertions.assertNotNull(repository.claimNext("ops", "agent:main:worker:ops"));
    }

    @Test
    public void shouldGenerateIdsAndDefaults() {
        WorkItemEntity item = new WorkItemEntity();
        item.setQueueId("default");
        item.setTitle("defaults");

        WorkItemEntity saved = repository.save(item);

        Assertions.assertTrue(saved.getId().startsWith("wi-"));
        Assertions.assertEquals(WorkItemStatusEnum.PENDING, saved.getStatus());
        Assertions.assertEquals(WorkItemPriorityEnum.MEDIUM, saved.getPriority());
        Assertions.assertNotNull(saved.getCreatedAt());
    }

    @Test
    public void shouldReturnCopiesAndRequireUpdate() {
        WorkItemEntity saved = repository.save(item("copy", WorkItemPriorityEnum.MEDIUM, null));

        WorkItemEntity loaded = repository.findById(saved.getId());
        loaded.setTitle("changed without update");

        Assertions.assertEquals("copy", repository.findById(saved.getId()).getTitle());
        loaded.setTitle("changed");
        Assertions.assertTrue(repository.updateIfStatus(loaded, WorkItemStatusEnum.PENDING));
        Assertions.assertEquals("changed", repository.findById(saved.getId()).getTitle());
    }

    @Test
    public void shouldRejectWriteOfUnknownItem() {
        WorkItemEntity unknown = item("ghost", WorkItemPriorityEnum.MEDIUM, null);
        unknown.setId("wi-missing");

        Assertions.assertThrows(IllegalStateException.class, () -> repository.updateIfStatus(unknown, WorkItemStatusEnum.PENDING));
    }

    @Test
    public void shouldRejectWriteWhenStoredStatusChanged() {
        WorkItemEntity saved = repository.save(item("raced", WorkItemPriorityEnum.MEDIUM, null));
        WorkItemEntity staleCopy = repository.findById(saved.getId());
        WorkItemEntity claimed = repository.claimNext("default", "agent:main:worker:default");

        staleCopy.cancel("cancelled by request");
        boolean written = repository.updateIfStatus(staleCopy, WorkItemStatusEnum.PENDING);

        Assertions.assertFalse(written);
        WorkItemEntity reloaded = repository.findById(saved.getId());
        Assertions.assertEquals(WorkItemStatusEnum.IN_PROGRESS, reloaded.getStatus());
        Assertions.assertEquals(claimed.getAssignedSessionKey(), reloaded.getAssignedSessionKey());
    }

    @Test
    public void shouldListQueueInCreationOrder() {
        LocalDateTime base = LocalDateTime.now().minusMinutes(5);
        repository.save(item("second", WorkItemPriorityEnum.CRITICAL, base.plusMinutes(1)));
        repository.save(item("first", WorkItemPriorityEnum.LOW, base));

        List<String> titles = repository.listByQueue("default").stream()
                .map(WorkItemEntity::getTitle)
                .collect(Collectors.toList());

        Assertions.assertEquals(List.of("first", "second"), titles);
    }

    @Test
    public void shouldReleaseClaimedItemBackToPending() {
        repository.save(item("release me", WorkItemPriorityEnum.MEDIUM, null));
        WorkItemEntity claimed = repository.claimNext("default", "agent:main:worker:default");

        claimed.release("worker busy");
        Assertions.assertTrue(repository.updateIfStatus(claimed, WorkItemStatusEnum.IN_PROGRESS));

        WorkItemEntity reloaded = repository.findById(claimed.getId());
        Assertions.assertEquals(WorkItemStatusEnum.PENDING, reloaded.getStatus());
        Assertions.assertEquals("worker busy", reloaded.getStatusReason());
        Assertions.assertNull(reloaded.getAssignedSessionKey());
        Assertions.assertNotNull(repository.claimNext("default", "agent:main:worker:default"));
    }

    private WorkItemEntity item(String title, WorkItemPriorityEnum priority, LocalDateTime createdAt) {
        WorkItemEntity item = new WorkItemEntity();
        item.setQueueId("default");
        item.setTitle(title);
        item.setPriority(priority);
        item.setStatus(WorkItemStatusEnum.PENDING);
        item.setCreatedAt(createdAt);
        return item;
    }
}
