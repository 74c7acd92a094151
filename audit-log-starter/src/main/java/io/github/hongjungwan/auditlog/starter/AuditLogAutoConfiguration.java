package io.github.hongjungwan.auditlog.starter;

import io.github.hongjungwan.auditlog.api.AuditLogPipeline;
import io.github.hongjungwan.auditlog.api.config.AuditLogConfig;
import io.github.hongjungwan.auditlog.core.classify.RequestClassifier;
import io.github.hongjungwan.auditlog.core.internal.AuditLogSerializer;
import io.github.hongjungwan.auditlog.core.internal.AuditRecordBuilder;
import io.github.hongjungwan.auditlog.core.internal.DefaultAuditLogPipeline;
import io.github.hongjungwan.auditlog.core.lifecycle.AuditLogDoctor;
import io.github.hongjungwan.auditlog.core.security.SensitiveDataRedactor;
import io.github.hongjungwan.auditlog.spi.RecordStore;
import io.github.hongjungwan.auditlog.starter.actuate.AuditLogEndpoint;
import io.github.hongjungwan.auditlog.starter.security.AuditUserExtractor;
import io.github.hongjungwan.auditlog.starter.security.SecurityContextUserExtractor;
import io.github.hongjungwan.auditlog.starter.store.MongoRecordStore;
import io.github.hongjungwan.auditlog.starter.web.AuditCaptureFilter;
import io.github.hongjungwan.auditlog.starter.web.CapturingResponseBodyAdvice;
import io.github.hongjungwan.auditlog.starter.web.ServletMetadataExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.servlet.DispatcherServlet;

import java.time.Clock;

/**
 * 요청 감사 로그 Spring Boot 자동 설정.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@EnableConfigurationProperties(AuditLogProperties.class)
@ConditionalOnProperty(prefix = "audit-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import({
        AuditLogAutoConfiguration.MongoRecordStoreConfiguration.class,
        AuditLogAutoConfiguration.ServletCaptureConfiguration.class,
        AuditLogAutoConfiguration.EndpointConfiguration.class
})
@Slf4j
public class AuditLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AuditLogConfig auditLogConfig(AuditLogProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditLogSerializer auditLogSerializer() {
        return new AuditLogSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public SensitiveDataRedactor sensitiveDataRedactor(AuditLogConfig config) {
        return new SensitiveDataRedactor(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestClassifier requestClassifier() {
        return new RequestClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditRecordBuilder auditRecordBuilder(SensitiveDataRedactor redactor, RequestClassifier classifier,
                                                 AuditLogConfig config) {
        return new AuditRecordBuilder(redactor, classifier, config.getCorrelationHeader(), Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditLogPipeline auditLogPipeline(AuditLogConfig config, ObjectProvider<RecordStore> recordStore) {
        return new DefaultAuditLogPipeline(config, recordStore.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditLogDoctor auditLogDoctor(AuditLogConfig config, ObjectProvider<RecordStore> recordStore) {
        return new AuditLogDoctor(config, recordStore.getIfAvailable());
    }

    @Bean
    public AuditLogLifecycle auditLogLifecycle(AuditLogDoctor doctor, AuditLogPipeline pipeline) {
        return new AuditLogLifecycle(doctor, pipeline);
    }

    /**
     * 파이프라인 시작 및 종료(드레인)를 관리하는 SmartLifecycle 구현체.
     * 웹 서버가 먼저 멈춘 뒤 마지막에 종료되도록 낮은 phase 사용.
     */
    static class AuditLogLifecycle implements SmartLifecycle {

        private final AuditLogDoctor doctor;
        private final AuditLogPipeline pipeline;
        private volatile boolean running = false;

        AuditLogLifecycle(AuditLogDoctor doctor, AuditLogPipeline pipeline) {
            this.doctor = doctor;
            this.pipeline = pipeline;
        }

        @Override
        public void start() {
            log.info("Starting request audit log pipeline...");

            AuditLogDoctor.DiagnosticReport report = doctor.diagnose();
            if (report.hasFailures()) {
                log.warn("Diagnostic failures detected - audit entries may be lost until resolved");
            }

            pipeline.start();
            running = true;
        }

        @Override
        public void stop() {
            log.info("Stopping request audit log pipeline...");
            pipeline.stop();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }

    /**
     * MongoDB Record Store 설정.
     * audit-log.record-store.enabled=true 이고 MongoTemplate 빈이 있을 때 활성화.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "audit-log.record-store", name = "enabled", havingValue = "true")
    static class MongoRecordStoreConfiguration {

        @Bean
        @ConditionalOnBean(MongoTemplate.class)
        @ConditionalOnMissingBean(RecordStore.class)
        public RecordStore mongoRecordStore(MongoTemplate mongoTemplate, AuditLogSerializer serializer,
                                            AuditLogProperties properties) {
            log.info("Audit log record store: MongoDB collection '{}'", properties.getRecordStore().getCollection());
            return new MongoRecordStore(mongoTemplate, serializer, properties.getRecordStore().getCollection());
        }
    }

    /**
     * 서블릿 웹 애플리케이션 요청 캡처 설정.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(DispatcherServlet.class)
    static class ServletCaptureConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AuditUserExtractor auditUserExtractor() {
            return new SecurityContextUserExtractor();
        }

        @Bean
        @ConditionalOnMissingBean
        public ServletMetadataExtractor servletMetadataExtractor(AuditLogSerializer serializer,
                                                                 AuditUserExtractor userExtractor) {
            return new ServletMetadataExtractor(serializer.getObjectMapper(), userExtractor);
        }

        @Bean
        public FilterRegistrationBean<AuditCaptureFilter> auditCaptureFilter(
                AuditLogPipeline pipeline,
                AuditRecordBuilder recordBuilder,
                ServletMetadataExtractor metadataExtractor,
                AuditLogSerializer serializer,
                AuditLogProperties properties
        ) {
            AuditCaptureFilter filter = new AuditCaptureFilter(pipeline, recordBuilder, metadataExtractor,
                    serializer.getObjectMapper(), properties.getCapture().getExcludePatterns(), Clock.systemUTC());
            FilterRegistrationBean<AuditCaptureFilter> registration = new FilterRegistrationBean<>(filter);
            registration.setName("auditCaptureFilter");
            registration.setOrder(properties.getCapture().getFilterOrder());
            registration.addUrlPatterns("/*");
            return registration;
        }

        @Bean
        @ConditionalOnMissingBean
        public CapturingResponseBodyAdvice capturingResponseBodyAdvice(AuditUserExtractor userExtractor) {
            return new CapturingResponseBodyAdvice(userExtractor);
        }
    }

    /**
     * Actuator 운영 엔드포인트 설정.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Endpoint.class)
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AuditLogEndpoint auditLogEndpoint(AuditLogPipeline pipeline, AuditLogProperties properties) {
            return new AuditLogEndpoint(pipeline, properties.getRetentionDays());
        }
    }
}
