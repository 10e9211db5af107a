package com.example.dsload.audit;

import com.example.dsload.model.AuditRun;
import com.example.dsload.model.AuditStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
public class AuditTrailRecorderTest {

    @Autowired
    private AuditTrailRecorder auditTrail;

    @Test
    public void testStartThenEnd() throws Exception {
        long runId = auditTrail.start("audit_test");

        AuditRun started = auditTrail.find(runId).orElseThrow();
        assertThat(started.getStatus()).isEqualTo(AuditStatus.START);
        assertThat(started.getJobName()).isEqualTo("audit_test");
        assertThat(started.getStartedAt()).isNotNull();
        assertThat(started.getFinishedAt()).isNull();
        assertThat(started.getRowsProcessed()).isNull();

        auditTrail.end(runId, 42, "deduped=3, date_err=1");

        AuditRun ended = auditTrail.find(runId).orElseThrow();
        assertThat(ended.getStatus()).isEqualTo(AuditStatus.END);
        assertThat(ended.getRowsProcessed()).isEqualTo(42L);
        assertThat(ended.getMessage()).isEqualTo("deduped=3, date_err=1");
        assertThat(ended.getFinishedAt()).isNotNull();
    }

    @Test
    public void testRunIdsIncrease() throws Exception {
        long first = auditTrail.start("audit_test");
        long second = auditTrail.start("audit_test");

        assertThat(second).isGreaterThan(first);
    }

    @Test
    public void testTerminalRunCannotBeReopenedOrClosedAgain() throws Exception {
        long runId = auditTrail.start("audit_test");
        auditTrail.error(runId, "boom");

        assertThatThrownBy(() -> auditTrail.end(runId, 1, "late"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is not open");
        AuditRun run = auditTrail.find(runId).orElseThrow();
        assertThat(run.getStatus()).isEqualTo(AuditStatus.ERROR);
        assertThat(run.getMessage()).isEqualTo("boom");
        assertThat(run.getRowsProcessed()).isNull();
    }

    @Test
    public void testLongMessageIsTruncated() throws Exception {
        long runId = auditTrail.start("audit_test");
        auditTrail.error(runId, "x".repeat(AuditTrailRecorder.MAX_MESSAGE_LENGTH + 500));

        assertThat(auditTrail.find(runId).orElseThrow().getMessage())
                .hasSize(AuditTrailRecorder.MAX_MESSAGE_LENGTH);
    }

    @Test
    public void testUnknownRun() {
        assertThat(auditTrail.find(Long.MAX_VALUE)).isEmpty();
        assertThatThrownBy(() -> auditTrail.error(Long.MAX_VALUE, "nope"))
                .isInstanceOf(IllegalStateException.class);
    }
}
