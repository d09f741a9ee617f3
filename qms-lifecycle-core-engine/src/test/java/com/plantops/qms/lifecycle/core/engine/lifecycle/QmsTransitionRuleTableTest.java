package com.plantops.qms.lifecycle.core.engine.lifecycle;

import com.plantops.qms.lifecycle.core.exception.QmsLifecycleConfigurationException;
import com.plantops.qms.lifecycle.core.exception.codes.QmsLifecycleErrorCodes;
import com.plantops.qms.lifecycle.integration.enumerations.CapaStatus;
import com.plantops.qms.lifecycle.integration.enumerations.MrbStatus;
import com.plantops.qms.lifecycle.integration.enumerations.NcrStatus;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordDateField;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.enumerations.ScarStatus;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link QmsTransitionRuleTable} and the definitions it holds.
 */
class QmsTransitionRuleTableTest {

    private final QmsTransitionRuleTable ruleTable = QmsTransitionRuleTable.getInstance();

    // ========================================================================
    // BUILT-IN DEFINITIONS
    // ========================================================================

    @Nested
    @DisplayName("Built-in Definitions")
    class BuiltInDefinitionTests {

        @ParameterizedTest
        @EnumSource(QmsRecordKind.class)
        @DisplayName("should hold a definition for every record kind")
        void shouldHoldDefinitionForEveryKind(QmsRecordKind kind) {
            QmsLifecycleDefinition definition = ruleTable.getDefinition(kind);

            assertEquals(kind, definition.getKind());
            assertEquals(kind.getInitialStatus(), definition.getInitialStatus());
            assertFalse(definition.getStages().isEmpty());
            assertFalse(definition.getEdges().isEmpty());
        }

        @Test
        @DisplayName("should define the canonical stages of each kind")
        void shouldDefineCanonicalStages() {
            assertEquals(List.of("Draft", "Open", "Under Review", "Pending Disposition", "Closed"),
                    labels(QmsRecordKind.NCR));
            assertEquals(List.of("Draft", "Open", "Implementation", "Verification", "Closed"),
                    labels(QmsRecordKind.CAPA));
            assertEquals(List.of("Draft", "Issued", "Response", "Review", "Closed"),
                    labels(QmsRecordKind.SCAR));
            assertEquals(List.of("Pending Review", "In Review", "Disposition Pending", "Approved", "Rejected", "Closed"),
                    labels(QmsRecordKind.MRB));
        }

        @ParameterizedTest
        @EnumSource(QmsRecordKind.class)
        @DisplayName("should only have closed as terminal status")
        void shouldOnlyHaveClosedAsTerminal(QmsRecordKind kind) {
            QmsLifecycleDefinition definition = ruleTable.getDefinition(kind);

            List<QmsStatus> terminals = definition.getStatuses().stream()
                    .filter(definition::isTerminal)
                    .toList();

            assertEquals(1, terminals.size());
            assertEquals("closed", terminals.get(0).getValue());
        }

        @ParameterizedTest
        @EnumSource(QmsRecordKind.class)
        @DisplayName("should require a comment on every return edge")
        void shouldRequireCommentOnReturnEdges(QmsRecordKind kind) {
            ruleTable.getDefinition(kind).getEdges().stream()
                    .filter(QmsTransitionEdge::isReturn)
                    .forEach(edge -> {
                        assertTrue(edge.isRequiresComment(), edge.getLabel());
                        assertFalse(edge.getSuggestedReasons().isEmpty(), edge.getLabel());
                    });
        }

        @ParameterizedTest
        @EnumSource(QmsRecordKind.class)
        @DisplayName("should keep forward progress acyclic")
        void shouldKeepForwardProgressAcyclic(QmsRecordKind kind) {
            QmsLifecycleDefinition definition = ruleTable.getDefinition(kind);

            for (QmsStatus status : definition.getStatuses()) {
                assertFalse(definition.isProgressReachable(status, status), status.getValue());
            }
        }

        @Test
        @DisplayName("should gate CAPA cancellation and MRB decisions behind approval")
        void shouldGateApprovalEdges() {
            QmsLifecycleDefinition capa = ruleTable.getDefinition(QmsRecordKind.CAPA);
            QmsLifecycleDefinition mrb = ruleTable.getDefinition(QmsRecordKind.MRB);

            assertTrue(capa.findEdge(CapaStatus.IN_PROGRESS, CapaStatus.CANCELLED).orElseThrow().isRequiresApproval());
            assertTrue(mrb.findEdge(MrbStatus.DISPOSITION_PENDING, MrbStatus.APPROVED).orElseThrow().isRequiresApproval());
            assertTrue(mrb.findEdge(MrbStatus.DISPOSITION_PENDING, MrbStatus.REJECTED).orElseThrow().isRequiresApproval());
            assertFalse(capa.findEdge(CapaStatus.DRAFT, CapaStatus.OPEN).orElseThrow().isRequiresApproval());
        }

        @Test
        @DisplayName("should leave CAPA cancelled outside every stage")
        void shouldLeaveCancelledOutsideStages() {
            QmsLifecycleDefinition capa = ruleTable.getDefinition(QmsRecordKind.CAPA);

            assertTrue(capa.findStage(CapaStatus.CANCELLED).isEmpty());
            assertEquals("verification", capa.findStage(CapaStatus.VERIFIED).orElseThrow().getId());
        }

        @Test
        @DisplayName("should read stage dates latest member first with createdAt for the initial stage")
        void shouldListStageDateFields() {
            QmsLifecycleDefinition capa = ruleTable.getDefinition(QmsRecordKind.CAPA);
            QmsLifecycleDefinition scar = ruleTable.getDefinition(QmsRecordKind.SCAR);

            QmsStageDefinition verification = capa.findStage(CapaStatus.PENDING_VERIFICATION).orElseThrow();
            QmsStageDefinition draft = scar.findStage(ScarStatus.DRAFT).orElseThrow();

            assertEquals(List.of(QmsRecordDateField.VERIFICATION_DATE, QmsRecordDateField.VERIFICATION_REQUESTED_DATE),
                    capa.getStageDateFields(verification));
            assertEquals(List.of(QmsRecordDateField.CREATED_AT), scar.getStageDateFields(draft));
        }

        @Test
        @DisplayName("should reject a null kind")
        void shouldRejectNullKind() {
            assertThrows(IllegalArgumentException.class, () -> ruleTable.getDefinition(null));
        }
    }

    // ========================================================================
    // MISCONFIGURED DEFINITIONS
    // ========================================================================

    @Nested
    @DisplayName("Misconfigured Definitions")
    class MisconfiguredDefinitionTests {

        @Test
        @DisplayName("should reject a duplicate edge")
        void shouldRejectDuplicateEdge() {
            QmsLifecycleDefinition.Builder builder = ncrStages()
                    .edge(edge(NcrStatus.DRAFT, NcrStatus.OPEN))
                    .edge(edge(NcrStatus.DRAFT, NcrStatus.OPEN))
                    .edge(edge(NcrStatus.OPEN, NcrStatus.UNDER_REVIEW))
                    .edge(edge(NcrStatus.UNDER_REVIEW, NcrStatus.PENDING_DISPOSITION))
                    .edge(edge(NcrStatus.PENDING_DISPOSITION, NcrStatus.CLOSED));

            QmsLifecycleConfigurationException exception =
                    assertThrows(QmsLifecycleConfigurationException.class, builder::build);

            assertEquals(QmsLifecycleErrorCodes.LIFECYCLE_DEFINITION_INVALID, exception.getErrorCode());
            assertTrue(exception.getViolations().contains("duplicate edge draft -> open"));
        }

        @Test
        @DisplayName("should reject a status that cannot be reached")
        void shouldRejectUnreachableStatus() {
            QmsLifecycleDefinition.Builder builder = ncrStages()
                    .edge(edge(NcrStatus.DRAFT, NcrStatus.OPEN))
                    .edge(edge(NcrStatus.OPEN, NcrStatus.UNDER_REVIEW))
                    .edge(edge(NcrStatus.UNDER_REVIEW, NcrStatus.PENDING_DISPOSITION));

            QmsLifecycleConfigurationException exception =
                    assertThrows(QmsLifecycleConfigurationException.class, builder::build);

            assertTrue(exception.getViolations().contains("status closed is unreachable from draft"));
        }

        @Test
        @DisplayName("should reject a status with no route to a terminal status")
        void shouldRejectDeadEnd() {
            QmsLifecycleDefinition.Builder builder = ncrStages()
                    .edge(edge(NcrStatus.DRAFT, NcrStatus.OPEN))
                    .edge(edge(NcrStatus.OPEN, NcrStatus.UNDER_REVIEW))
                    .edge(edge(NcrStatus.UNDER_REVIEW, NcrStatus.OPEN))
                    .edge(edge(NcrStatus.DRAFT, NcrStatus.PENDING_DISPOSITION))
                    .edge(edge(NcrStatus.PENDING_DISPOSITION, NcrStatus.CLOSED));

            QmsLifecycleConfigurationException exception =
                    assertThrows(QmsLifecycleConfigurationException.class, builder::build);

            assertTrue(exception.getViolations().contains("status open has no route to a terminal status"));
            assertTrue(exception.getViolations().contains("status under_review has no route to a terminal status"));
        }

        @Test
        @DisplayName("should reject a status placed in two stages")
        void shouldRejectStatusInTwoStages() {
            QmsLifecycleDefinition.Builder builder = QmsLifecycleDefinition.builder(QmsRecordKind.NCR)
                    .stage("draft", "Draft", NcrStatus.DRAFT)
                    .stage("open", "Open", NcrStatus.OPEN)
                    .stage("review", "Review", NcrStatus.OPEN, NcrStatus.UNDER_REVIEW)
                    .edge(edge(NcrStatus.DRAFT, NcrStatus.OPEN));

            QmsLifecycleConfigurationException exception =
                    assertThrows(QmsLifecycleConfigurationException.class, builder::build);

            assertTrue(exception.getViolations().contains("status open belongs to stages open and review"));
        }

        @Test
        @DisplayName("should reject stages out of canonical order")
        void shouldRejectStagesOutOfOrder() {
            QmsLifecycleDefinition.Builder builder = QmsLifecycleDefinition.builder(QmsRecordKind.SCAR)
                    .stage("issued", "Issued", ScarStatus.ISSUED)
                    .stage("draft", "Draft", ScarStatus.DRAFT)
                    .edge(edge(ScarStatus.DRAFT, ScarStatus.ISSUED));

            QmsLifecycleConfigurationException exception =
                    assertThrows(QmsLifecycleConfigurationException.class, builder::build);

            assertTrue(exception.getViolations().contains("stage draft is out of canonical status order"));
        }

        @Test
        @DisplayName("should reject an edge of another kind")
        void shouldRejectForeignEdge() {
            QmsLifecycleDefinition.Builder builder = ncrStages()
                    .edge(edge(CapaStatus.DRAFT, CapaStatus.OPEN));

            QmsLifecycleConfigurationException exception =
                    assertThrows(QmsLifecycleConfigurationException.class, builder::build);

            assertTrue(exception.getViolations().contains("edge draft->open belongs to CAPA"));
        }

        @Test
        @DisplayName("should accept a minimal well-formed definition")
        void shouldAcceptMinimalDefinition() {
            QmsLifecycleDefinition definition = ncrStages()
                    .edge(edge(NcrStatus.DRAFT, NcrStatus.OPEN))
                    .edge(edge(NcrStatus.OPEN, NcrStatus.UNDER_REVIEW))
                    .edge(edge(NcrStatus.UNDER_REVIEW, NcrStatus.PENDING_DISPOSITION))
                    .edge(edge(NcrStatus.PENDING_DISPOSITION, NcrStatus.CLOSED))
                    .build();

            assertTrue(definition.isProgressReachable(NcrStatus.DRAFT, NcrStatus.CLOSED));
            assertTrue(definition.isTerminal(NcrStatus.CLOSED));
        }

        private QmsLifecycleDefinition.Builder ncrStages() {
            return QmsLifecycleDefinition.builder(QmsRecordKind.NCR)
                    .stage("draft", "Draft", NcrStatus.DRAFT)
                    .stage("open", "Open", NcrStatus.OPEN)
                    .stage("under_review", "Under Review", NcrStatus.UNDER_REVIEW)
                    .stage("pending_disposition", "Pending Disposition", NcrStatus.PENDING_DISPOSITION)
                    .stage("closed", "Closed", NcrStatus.CLOSED);
        }

        private QmsTransitionEdge edge(QmsStatus from, QmsStatus to) {
            return QmsTransitionEdge.builder()
                    .from(from)
                    .to(to)
                    .label(from.getValue() + "->" + to.getValue())
                    .build();
        }
    }

    private List<String> labels(QmsRecordKind kind) {
        return ruleTable.getDefinition(kind).getStages().stream()
                .map(QmsStageDefinition::getLabel)
                .toList();
    }
}
