/**
 * Bounded-concurrency task queue with retry, pause and cancellation.
 */
package io.ontomesh.queue;
