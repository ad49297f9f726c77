/**
 * Value types read back from the queue.
 *
 * @see io.asqueue.model.QueuedEvent
 * @see io.asqueue.model.EventBatch
 */
package io.asqueue.model;
