/**
 * Runtime wiring package.
 *
 * <p>{@link io.ontomesh.runtime.OntoMeshRuntime} owns process-level concerns: the SQLite
 * stores, the server id used for workflow leases, the audit log, schema import, and the
 * extraction and relationship services the CLI calls into.
 */
package io.ontomesh.runtime;
