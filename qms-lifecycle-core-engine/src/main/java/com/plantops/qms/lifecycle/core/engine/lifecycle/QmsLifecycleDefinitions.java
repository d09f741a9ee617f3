package com.plantops.qms.lifecycle.core.engine.lifecycle;

import com.plantops.qms.lifecycle.integration.enumerations.CapaStatus;
import com.plantops.qms.lifecycle.integration.enumerations.MrbStatus;
import com.plantops.qms.lifecycle.integration.enumerations.NcrStatus;
import com.plantops.qms.lifecycle.integration.enumerations.QmsRecordKind;
import com.plantops.qms.lifecycle.integration.enumerations.QmsStatus;
import com.plantops.qms.lifecycle.integration.enumerations.ScarStatus;
import com.plantops.qms.lifecycle.integration.models.QmsTransitionEdge;

import java.util.List;

/**
 * The fixed lifecycle of each record kind.
 */
public final class QmsLifecycleDefinitions {

    private QmsLifecycleDefinitions() {
    }

    public static QmsLifecycleDefinition forKind(QmsRecordKind kind) {
        return switch (kind) {
            case NCR -> ncr();
            case CAPA -> capa();
            case SCAR -> scar();
            case MRB -> mrb();
        };
    }

    static QmsLifecycleDefinition ncr() {
        return QmsLifecycleDefinition.builder(QmsRecordKind.NCR)
                .stage("draft", "Draft", NcrStatus.DRAFT)
                .stage("open", "Open", NcrStatus.OPEN)
                .stage("under_review", "Under Review", NcrStatus.UNDER_REVIEW)
                .stage("pending_disposition", "Pending Disposition", NcrStatus.PENDING_DISPOSITION)
                .stage("closed", "Closed", NcrStatus.CLOSED)
                .edge(advance(NcrStatus.DRAFT, NcrStatus.OPEN, "Open NCR"))
                .edge(advance(NcrStatus.OPEN, NcrStatus.UNDER_REVIEW, "Start Review"))
                .edge(advance(NcrStatus.UNDER_REVIEW, NcrStatus.PENDING_DISPOSITION, "Request Disposition"))
                .edge(commented(NcrStatus.PENDING_DISPOSITION, NcrStatus.CLOSED, "Close NCR"))
                .edge(commented(NcrStatus.UNDER_REVIEW, NcrStatus.OPEN, "Return to Open",
                        "Incomplete information",
                        "Incorrect classification",
                        "Additional investigation needed"))
                .edge(commented(NcrStatus.PENDING_DISPOSITION, NcrStatus.UNDER_REVIEW, "Return to Review",
                        "Additional analysis required",
                        "New information available",
                        "Disposition requires clarification"))
                .build();
    }

    static QmsLifecycleDefinition capa() {
        return QmsLifecycleDefinition.builder(QmsRecordKind.CAPA)
                .stage("draft", "Draft", CapaStatus.DRAFT)
                .stage("open", "Open", CapaStatus.OPEN)
                .stage("in_progress", "Implementation", CapaStatus.IN_PROGRESS)
                .stage("verification", "Verification", CapaStatus.PENDING_VERIFICATION, CapaStatus.VERIFIED)
                .stage("closed", "Closed", CapaStatus.CLOSED)
                .edge(advance(CapaStatus.DRAFT, CapaStatus.OPEN, "Submit CAPA"))
                .edge(advance(CapaStatus.OPEN, CapaStatus.IN_PROGRESS, "Start Implementation"))
                .edge(commented(CapaStatus.IN_PROGRESS, CapaStatus.PENDING_VERIFICATION, "Submit for Verification"))
                .edge(commented(CapaStatus.PENDING_VERIFICATION, CapaStatus.VERIFIED, "Verify Effectiveness"))
                .edge(commented(CapaStatus.PENDING_VERIFICATION, CapaStatus.CLOSED, "Verify and Close"))
                .edge(advance(CapaStatus.VERIFIED, CapaStatus.CLOSED, "Close CAPA"))
                .edge(commented(CapaStatus.OPEN, CapaStatus.DRAFT, "Return to Draft",
                        "Incomplete information",
                        "Requires revision",
                        "Further planning needed"))
                .edge(commented(CapaStatus.IN_PROGRESS, CapaStatus.OPEN, "Return to Open",
                        "Implementation issues encountered",
                        "Change in scope required",
                        "Resource constraints"))
                .edge(commented(CapaStatus.PENDING_VERIFICATION, CapaStatus.IN_PROGRESS, "Return to Implementation",
                        "Additional actions required",
                        "Verification criteria not met",
                        "Implementation incomplete"))
                .edge(approved(CapaStatus.DRAFT, CapaStatus.CANCELLED, "Cancel CAPA"))
                .edge(approved(CapaStatus.OPEN, CapaStatus.CANCELLED, "Cancel CAPA"))
                .edge(approved(CapaStatus.IN_PROGRESS, CapaStatus.CANCELLED, "Cancel CAPA"))
                .edge(advance(CapaStatus.CANCELLED, CapaStatus.CLOSED, "Close Cancelled CAPA"))
                .build();
    }

    static QmsLifecycleDefinition scar() {
        return QmsLifecycleDefinition.builder(QmsRecordKind.SCAR)
                .stage("draft", "Draft", ScarStatus.DRAFT)
                .stage("issued", "Issued", ScarStatus.ISSUED)
                .stage("response", "Response", ScarStatus.SUPPLIER_RESPONSE)
                .stage("review", "Review", ScarStatus.REVIEW)
                .stage("closed", "Closed", ScarStatus.CLOSED)
                .edge(advance(ScarStatus.DRAFT, ScarStatus.ISSUED, "Issue to Supplier"))
                .edge(commented(ScarStatus.ISSUED, ScarStatus.SUPPLIER_RESPONSE, "Record Response"))
                .edge(advance(ScarStatus.SUPPLIER_RESPONSE, ScarStatus.REVIEW, "Start Review"))
                .edge(commented(ScarStatus.REVIEW, ScarStatus.CLOSED, "Close SCAR"))
                .edge(commented(ScarStatus.SUPPLIER_RESPONSE, ScarStatus.ISSUED, "Request Clarification",
                        "Incomplete response",
                        "Inadequate root cause analysis",
                        "Insufficient corrective actions",
                        "Missing evidence"))
                .edge(commented(ScarStatus.REVIEW, ScarStatus.SUPPLIER_RESPONSE, "Request Additional Information",
                        "Additional evidence required",
                        "Effectiveness verification needed",
                        "Implementation timeline unclear"))
                .build();
    }

    static QmsLifecycleDefinition mrb() {
        return QmsLifecycleDefinition.builder(QmsRecordKind.MRB)
                .stage("pending_review", "Pending Review", MrbStatus.PENDING_REVIEW)
                .stage("in_review", "In Review", MrbStatus.IN_REVIEW)
                .stage("disposition_pending", "Disposition Pending", MrbStatus.DISPOSITION_PENDING)
                .stage("approved", "Approved", MrbStatus.APPROVED)
                .stage("rejected", "Rejected", MrbStatus.REJECTED)
                .stage("closed", "Closed", MrbStatus.CLOSED)
                .edge(advance(MrbStatus.PENDING_REVIEW, MrbStatus.IN_REVIEW, "Start Review"))
                .edge(advance(MrbStatus.IN_REVIEW, MrbStatus.DISPOSITION_PENDING, "Request Disposition"))
                .edge(approved(MrbStatus.DISPOSITION_PENDING, MrbStatus.APPROVED, "Approve"))
                .edge(approved(MrbStatus.DISPOSITION_PENDING, MrbStatus.REJECTED, "Reject"))
                .edge(advance(MrbStatus.APPROVED, MrbStatus.CLOSED, "Close MRB"))
                .edge(advance(MrbStatus.REJECTED, MrbStatus.CLOSED, "Close MRB"))
                .edge(commented(MrbStatus.IN_REVIEW, MrbStatus.PENDING_REVIEW, "Return to Pending",
                        "Additional information needed",
                        "Key stakeholders unavailable",
                        "Reschedule required"))
                .edge(commented(MrbStatus.DISPOSITION_PENDING, MrbStatus.IN_REVIEW, "Return to Review",
                        "Further analysis required",
                        "New information available",
                        "Additional testing needed"))
                .build();
    }

    private static QmsTransitionEdge advance(QmsStatus from, QmsStatus to, String label) {
        return QmsTransitionEdge.builder().from(from).to(to).label(label).build();
    }

    private static QmsTransitionEdge commented(QmsStatus from, QmsStatus to, String label, String... reasons) {
        return QmsTransitionEdge.builder()
                .from(from)
                .to(to)
                .label(label)
                .requiresComment(true)
                .suggestedReasons(List.of(reasons))
                .build();
    }

    private static QmsTransitionEdge approved(QmsStatus from, QmsStatus to, String label) {
        return QmsTransitionEdge.builder()
                .from(from)
                .to(to)
                .label(label)
                .requiresComment(true)
                .requiresApproval(true)
                .build();
    }
}
