/**
 * Workflow drivers and their per-workflow infrastructure.
 *
 * <p>A workflow is driven by at most one server at a time. Ownership is a lease on the
 * workflow row, renewed by {@link io.ontomesh.workflow.HeartbeatRegistry}; losing it cancels
 * the driver without releasing anything, since another server may already hold it.
 */
package io.ontomesh.workflow;
