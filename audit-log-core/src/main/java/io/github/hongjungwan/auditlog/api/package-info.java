/**
 * Public API of the request audit log pipeline.
 *
 * <h2>Main Entry Points:</h2>
 * <ul>
 *   <li>{@link io.github.hongjungwan.auditlog.api.AuditLogPipeline} - pipeline lifecycle, submission, stats, cleanup</li>
 *   <li>{@link io.github.hongjungwan.auditlog.api.config.AuditLogConfig} - pipeline configuration</li>
 *   <li>{@link io.github.hongjungwan.auditlog.api.domain.AuditLogEntry} - one persisted request/response record</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * AuditLogConfig config = AuditLogConfig.builder()
 *         .logsDirectory("/var/log/app/audit")
 *         .recordStoreEnabled(true)
 *         .build();
 *
 * AuditLogPipeline pipeline = new DefaultAuditLogPipeline(config, mongoRecordStore);
 * pipeline.start();
 * ShutdownDrain.registerShutdownHook(pipeline);
 *
 * AuditRecordBuilder builder = new AuditRecordBuilder(config);
 * pipeline.submit(builder.build(requestMetadata, responseMetadata));
 * }</pre>
 */
package io.github.hongjungwan.auditlog.api;
