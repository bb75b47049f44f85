/**
 * Runtime orchestration package.
 *
 * <p>{@link io.coordhub.runtime.CoordHubRuntime} owns the instance registry, resource leases, task ledger and
 * knowledge graph, serializes every operation on them, and writes the audit trail.
 */
package io.coordhub.runtime;
