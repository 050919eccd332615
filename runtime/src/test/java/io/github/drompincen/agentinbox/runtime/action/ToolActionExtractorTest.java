package io.github.drompincen.agentinbox.runtime.action;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolActionExtractorTest {

    private ToolActionExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ToolActionExtractor(new ObjectMapper());
    }

    // ---- 1. Extraction ----

    @Test
    void extractsMultipleTagsInOrderWithSpans() {
        String text = "Exporting now. [[TOOL_ACTION: {\"type\": \"data-export\", \"params\": {\"dataSource\": \"sales\", \"format\": \"csv\"}}]]"
                + " And sending. [[TOOL_ACTION: {\"type\": \"gmail-send-message\", \"params\": {\"to\": \"ceo@acme.com\", \"subject\": \"Q3\"}}]]";

        List<ToolAction> actions = extractor.extract(text);

        assertThat(actions).hasSize(2);
        ToolAction first = actions.get(0);
        assertThat(first.type()).isEqualTo(ActionType.DATA_EXPORT);
        assertThat(first.params()).containsEntry("dataSource", "sales");
        assertThat(first.preview()).isEqualTo("Export sales as CSV");
        assertThat(text.substring(first.start(), first.end())).startsWith("[[TOOL_ACTION:").endsWith("]]");
        assertThat(actions.get(1).type()).isEqualTo(ActionType.GMAIL_SEND_MESSAGE);
        assertThat(actions.get(1).preview()).isEqualTo("Send email to ceo@acme.com: subject Q3");
        assertThat(actions.get(1).start()).isGreaterThan(first.end());
        assertThat(first.id()).isNotEqualTo(actions.get(1).id());
    }

    @Test
    void nestedArraysOfObjectsStayInsideTheTag() {
        String tag = "[[TOOL_ACTION: {\"type\":\"spreadsheet-update\",\"params\":{\"sheetName\":\"ROI\",\"data\":[[{\"v\":1}]]}}]]";
        String text = "Done. " + tag + " Bye";

        List<ToolAction> actions = extractor.extract(text);

        assertThat(actions).singleElement().satisfies(a -> {
            assertThat(a.type()).isEqualTo(ActionType.SPREADSHEET_UPDATE);
            assertThat(a.requiresApproval()).isTrue();
            assertThat(a.params()).containsEntry("sheetName", "ROI");
            assertThat(a.params().get("data")).isEqualTo(List.of(List.of(Map.of("v", 1))));
            assertThat(text.substring(a.start(), a.end())).isEqualTo(tag);
        });
        assertThat(extractor.strip(text)).isEqualTo("Done.  Bye");
    }

    @Test
    void bracesAndClosersInsideStringsDoNotEndTheTag() {
        String text = "[[TOOL_ACTION: {\"type\": \"gmail-send-message\", \"params\": {\"to\": \"a@b.com\", \"body\": \"keep }]] and {\\\"x\\\"} as text\"}}]] ok";

        List<ToolAction> actions = extractor.extract(text);

        assertThat(actions).singleElement().satisfies(a ->
                assertThat(a.params()).containsEntry("body", "keep }]] and {\"x\"} as text"));
        assertThat(extractor.strip(text)).isEqualTo(" ok");
    }

    @Test
    void unknownTypeBecomesCustomAndRequiresApproval() {
        List<ToolAction> actions = extractor.extract("[[TOOL_ACTION: {\"type\": \"slack-post\", \"params\": {}}]]");

        assertThat(actions).singleElement().satisfies(a -> {
            assertThat(a.type()).isEqualTo(ActionType.CUSTOM);
            assertThat(a.rawType()).isEqualTo("slack-post");
            assertThat(a.wireType()).isEqualTo("slack-post");
            assertThat(a.requiresApproval()).isTrue();
            assertThat(a.preview()).isEqualTo("Custom action slack-post");
        });
    }

    @Test
    void malformedTagsAreNotActions() {
        String text = "a [[TOOL_ACTION: {not json}]] b [[TOOL_ACTION: {\"params\": {}}]] c";

        assertThat(extractor.extract(text)).isEmpty();
        assertThat(extractor.hasToolActions(text)).isTrue();
    }

    @Test
    void missingParamsYieldsEmptyMap() {
        List<ToolAction> actions = extractor.extract("[[TOOL_ACTION: {\"type\": \"data-transform\"}]]");

        assertThat(actions).singleElement().satisfies(a -> {
            assertThat(a.params()).isEmpty();
            assertThat(a.requiresApproval()).isFalse();
        });
    }

    @Test
    void noTagsInPlainText() {
        assertThat(extractor.extract("Your ROI is 50%.")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.hasToolActions("Your ROI is 50%.")).isFalse();
    }

    // ---- 2. Stripping ----

    @Test
    void stripRemovesTagsAndNothingElse() {
        String text = "Before\n[[TOOL_ACTION: {\"type\": \"data-export\", \"params\": {}}]]\nAfter [[TOOL_ACTION: {bad}]]!";

        assertThat(extractor.strip(text)).isEqualTo("Before\n\nAfter !");
    }

    @Test
    void stripIsIdempotent() {
        String text = "x [[TOOL_ACTION: {\"type\": \"workflow-trigger\", \"params\": {\"workflowId\": \"wf-1\"}}]] y";

        String once = extractor.strip(text);

        assertThat(extractor.strip(once)).isEqualTo(once);
        assertThat(extractor.strip("plain text")).isEqualTo("plain text");
    }

    @Test
    void previewStripsTrimsAndCuts() {
        String body = "a".repeat(250);
        String text = "  [[TOOL_ACTION: {\"type\": \"data-export\", \"params\": {}}]] " + body;

        assertThat(extractor.preview(text, 200)).hasSize(200).isEqualTo("a".repeat(200));
        assertThat(extractor.preview("short ", 200)).isEqualTo("short");
    }

    // ---- 3. Vocabulary ----

    @Test
    void approvalFlagsFollowTheActionTable() {
        assertThat(ActionType.classify("data-transform").requiresApproval()).isFalse();
        assertThat(ActionType.classify("hubspot-log-activity").requiresApproval()).isFalse();
        assertThat(ActionType.classify("gmail-draft-email").requiresApproval()).isFalse();
        assertThat(ActionType.classify("spreadsheet-update").requiresApproval()).isTrue();
        assertThat(ActionType.classify("EXTERNAL-API-CALL")).isEqualTo(ActionType.EXTERNAL_API_CALL);
        assertThat(ActionType.fromWire("custom")).isEmpty();
    }

    @Test
    void previewsFillInParameters() {
        assertThat(ActionType.EXTERNAL_API_CALL.preview(Map.of("method", "post", "url", "https://api.example.com")))
                .isEqualTo("POST https://api.example.com");
        assertThat(ActionType.HUBSPOT_CREATE_CONTACT.preview(Map.of("firstName", "Ada", "lastName", "Lovelace", "email", "ada@example.com")))
                .isEqualTo("Create CRM contact Ada Lovelace <ada@example.com>");
        assertThat(ActionType.CALENDAR_CREATE_EVENT.preview(null)).isEqualTo("Schedule event (untitled) at ?");
        assertThat(ActionType.GMAIL_REPLY.preview(Map.of("threadId", "18c2f", "body", "Thanks!")))
                .isEqualTo("Reply in thread 18c2f");
        assertThat(ActionType.GMAIL_REPLY.preview(Map.of("messageId", "m-9"))).isEqualTo("Reply in thread m-9");
    }
}
