/**
 * OntoMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ontomesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.ontomesh.cli.OntoMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.ontomesh.runtime.OntoMeshRuntime} wires stores, leases and both workflow services.</li>
 *   <li>{@code io.ontomesh.workflow.OntologyOrchestrator} drives extraction from persisted entity state.</li>
 *   <li>{@code io.ontomesh.workflow.RelationshipWorkflowService} runs the four detection phases.</li>
 *   <li>{@code io.ontomesh.storage.EntityStateStore} is the authoritative record of per-entity progress.</li>
 * </ul>
 */
package io.ontomesh;
