package com.flowpilot.test.integration;

import com.flowpilot.infrastructure.dao.WorkflowJobDao;
import com.flowpilot.infrastructure.dao.WorkflowRunDao;
import com.flowpilot.infrastructure.dao.po.WorkflowJobPO;
import com.flowpilot.infrastructure.dao.po.WorkflowRunPO;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mybatis.spring.boot.test.autoconfigure.MybatisTest;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.List;

@MybatisTest(properties = "spring.sql.init.mode=always")
public class WorkflowRunMapperIntegrationTest {

    @Autowired
    private WorkflowRunDao workflowRunDao;

    @Autowired
    private WorkflowJobDao workflowJobDao;

    @Test
    public void shouldRejectStaleVersionOnUpdate() {
        WorkflowRunPO run = newRun();
        workflowRunDao.insert(run);

        WorkflowRunPO first = workflowRunDao.selectById(run.getId());
        first.setStatus("completed");
        first.setUpdatedAt(LocalDateTime.now());
        Assertions.assertEquals(1, workflowRunDao.updateWithVersion(first));

        WorkflowRunPO stale = workflowRunDao.selectById(run.getId());
        stale.setVersion(0);
        stale.setStatus("failed");
        Assertions.assertEquals(0, workflowRunDao.updateWithVersion(stale), "旧版本回写应被拒绝");
        Assertions.assertEquals("completed", workflowRunDao.selectById(run.getId()).getStatus());
    }

    @Test
    public void shouldKeepCancelFlagOutOfVersionedUpdate() {
        WorkflowRunPO run = newRun();
        workflowRunDao.insert(run);

        Assertions.assertEquals(1, workflowRunDao.markCancelRequested(run.getId()));
        WorkflowRunPO loaded = workflowRunDao.selectById(run.getId());
        loaded.setCancelRequested(false);
        loaded.setUpdatedAt(LocalDateTime.now());
        workflowRunDao.updateWithVersion(loaded);

        Assertions.assertTrue(workflowRunDao.selectCancelRequested(run.getId()));
        Assertions.assertEquals(1, workflowRunDao.selectById(run.getId()).getVersion());
    }

    @Test
    public void shouldOnlyOfferOneJobPerRun() {
        WorkflowRunPO busy = newRun();
        workflowRunDao.insert(busy);
        WorkflowRunPO idle = newRun();
        workflowRunDao.insert(idle);
        LocalDateTime base = LocalDateTime.now().minusMinutes(1);
        WorkflowJobPO first = newJob(busy.getId(), base);
        WorkflowJobPO second = newJob(busy.getId(), base.plusSeconds(1));
        WorkflowJobPO other = newJob(idle.getId(), base.plusSeconds(2));
        workflowJobDao.insert(first);
        workflowJobDao.insert(second);
        workflowJobDao.insert(other);

        Assertions.assertEquals(1, workflowJobDao.markRunning(first.getId(), LocalDateTime.now()));
        Assertions.assertEquals(0, workflowJobDao.markRunning(second.getId(), LocalDateTime.now()),
                "同一运行已有 running 任务时不应再领取");

        List<WorkflowJobPO> candidates = workflowJobDao.selectClaimCandidates(10);
        Assertions.assertEquals(1, candidates.size());
        Assertions.assertEquals(other.getId(), candidates.get(0).getId());
        Assertions.assertEquals(1, workflowJobDao.countByStatus("running"));
    }

    @Test
    public void shouldDeleteOnlyQueuedJobsOfRun() {
        WorkflowRunPO run = newRun();
        workflowRunDao.insert(run);
        WorkflowJobPO running = newJob(run.getId(), LocalDateTime.now().minusSeconds(5));
        WorkflowJobPO queued = newJob(run.getId(), LocalDateTime.now());
        workflowJobDao.insert(running);
        workflowJobDao.insert(queued);
        workflowJobDao.markRunning(running.getId(), LocalDateTime.now().minusMinutes(30));

        Assertions.assertEquals(1, workflowJobDao.deleteQueuedByRunId(run.getId()));
        Assertions.assertNull(workflowJobDao.selectById(queued.getId()));
        Assertions.assertEquals(1, workflowJobDao.selectRunningStartedBefore(LocalDateTime.now().minusMinutes(10)).size());
    }

    private WorkflowRunPO newRun() {
        LocalDateTime now = LocalDateTime.now();
        return WorkflowRunPO.builder()
                .workflowId(1L)
                .status("running")
                .initialInput("go")
                .trail("[]")
                .retryAttempt(0)
                .cancelRequested(false)
                .version(0)
                .startedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private WorkflowJobPO newJob(Long runId, LocalDateTime createdAt) {
        return WorkflowJobPO.builder()
                .jobType("workflow_start")
                .runId(runId)
                .status("queued")
                .payload("{}")
                .createdAt(createdAt)
                .build();
    }
}
