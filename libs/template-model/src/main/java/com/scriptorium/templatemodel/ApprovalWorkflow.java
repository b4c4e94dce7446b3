package com.scriptorium.templatemodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Approval rules attached to a {@link DocumentTemplate}.
 *
 * <p>{@code approvers} is ordered by priority and may contain duplicates. Whether the workflow is
 * satisfiable is reported by {@link #isSatisfiable()} but never enforced here.
 */
public class ApprovalWorkflow implements Prototype<ApprovalWorkflow> {

    private List<String> approvers = new ArrayList<>();
    private int requiredApprovals;
    private int timeoutDays;

    public ApprovalWorkflow() {}

    public ApprovalWorkflow(List<String> approvers, int requiredApprovals, int timeoutDays) {
        setApprovers(approvers);
        this.requiredApprovals = requiredApprovals;
        this.timeoutDays = timeoutDays;
    }

    @Override
    public ApprovalWorkflow deepClone() {
        return new ApprovalWorkflow(approvers, requiredApprovals, timeoutDays);
    }

    /** True when there are at least as many approvers as required approvals. */
    @JsonIgnore
    public boolean isSatisfiable() {
        return requiredApprovals <= approvers.size();
    }

    /** Returns the owned, mutable approver list. */
    public List<String> getApprovers() {
        return approvers;
    }

    public void setApprovers(List<String> approvers) {
        this.approvers = approvers != null ? new ArrayList<>(approvers) : new ArrayList<>();
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }

    public void setRequiredApprovals(int requiredApprovals) {
        this.requiredApprovals = requiredApprovals;
    }

    public int getTimeoutDays() {
        return timeoutDays;
    }

    public void setTimeoutDays(int timeoutDays) {
        this.timeoutDays = timeoutDays;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ApprovalWorkflow other)) {
            return false;
        }
        return requiredApprovals == other.requiredApprovals
                && timeoutDays == other.timeoutDays
                && approvers.equals(other.approvers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(approvers, requiredApprovals, timeoutDays);
    }

    @Override
    public String toString() {
        return "ApprovalWorkflow{approvers=" + approvers + ", requiredApprovals=" + requiredApprovals
                + ", timeoutDays=" + timeoutDays + '}';
    }
}
