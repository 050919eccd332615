package io.github.drompincen.agentinbox.persistence.repository;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.agentinbox.persistence.document.ApprovalDocument;
import io.github.drompincen.agentinbox.protocol.api.ApprovalStatus;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApprovalTransitionsImplTest {

    @Mock
    private MongoTemplate mongoTemplate;

    private ApprovalTransitionsImpl transitions;

    @BeforeEach
    void setUp() {
        transitions = new ApprovalTransitionsImpl(mongoTemplate);
    }

    @Test
    void resolveMatchesOnlyPendingRows() {
        ApprovalDocument resolved = new ApprovalDocument();
        resolved.setApprovalId("ap-1");
        resolved.setStatus(ApprovalStatus.REJECTED);
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(ApprovalDocument.class))).thenReturn(resolved);

        Optional<ApprovalDocument> result = transitions.resolveIfPending("ap-1", ApprovalStatus.REJECTED,
                "user-1", "not needed");

        assertThat(result).contains(resolved);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).findAndModify(query.capture(), update.capture(),
                any(FindAndModifyOptions.class), eq(ApprovalDocument.class));
        assertThat(query.getValue().getQueryObject().get("_id")).isEqualTo("ap-1");
        assertThat(query.getValue().getQueryObject().get("status")).isEqualTo(ApprovalStatus.PENDING);
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set.get("status")).isEqualTo(ApprovalStatus.REJECTED);
        assertThat(set.get("resolvedBy")).isEqualTo("user-1");
        assertThat(set.get("comment")).isEqualTo("not needed");
        assertThat(set.get("resolvedAt")).isNotNull();
    }

    @Test
    void resolveReturnsEmptyWhenNoPendingRowMatched() {
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(ApprovalDocument.class))).thenReturn(null);

        assertThat(transitions.resolveIfPending("ap-1", ApprovalStatus.APPROVED, "u", null)).isEmpty();
    }

    @Test
    void resolveToPendingIsRejected() {
        assertThatThrownBy(() -> transitions.resolveIfPending("ap-1", ApprovalStatus.PENDING, "u", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void enqueueReportsWhetherApprovalWasStillPending() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ApprovalDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        boolean queued = transitions.enqueueIfPending("ap-1", List.of(
                new ApprovalDocument.QueuedAction("gmail-send-message", Map.of("to", "a@b.c"), "Send email", "m1")));

        assertThat(queued).isFalse();
    }

    @Test
    void enqueueOfNothingIsANoOp() {
        assertThat(transitions.enqueueIfPending("ap-1", List.of())).isTrue();
        verifyNoInteractions(mongoTemplate);
    }
}
