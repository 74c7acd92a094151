/**
 * Service Provider Interfaces for the audit log pipeline.
 *
 * <ul>
 *   <li>{@link io.github.hongjungwan.auditlog.spi.RecordStore} - structured record store (document database)</li>
 *   <li>{@link io.github.hongjungwan.auditlog.spi.RecordFilter} - count/delete criteria for the record store</li>
 *   <li>{@link io.github.hongjungwan.auditlog.spi.LogSink} - persistence target written by the batch scheduler</li>
 * </ul>
 */
package io.github.hongjungwan.auditlog.spi;
