/**
 * Periodic backlog observation for destination queues.
 *
 * @see io.asqueue.backlog.BacklogMonitor
 */
package io.asqueue.backlog;
