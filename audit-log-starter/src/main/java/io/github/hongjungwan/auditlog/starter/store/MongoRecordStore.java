package io.github.hongjungwan.auditlog.starter.store;

import io.github.hongjungwan.auditlog.api.domain.AuditLogEntry;
import io.github.hongjungwan.auditlog.core.internal.AuditLogSerializer;
import io.github.hongjungwan.auditlog.spi.RecordFilter;
import io.github.hongjungwan.auditlog.spi.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Date;

/**
 * MongoDB Record Store. 엔트리 JSON 을 문서로 저장하고 timestamp 는 BSON date 로 변환.
 */
@Slf4j
public class MongoRecordStore implements RecordStore {

    static final String TIMESTAMP_FIELD = "timestamp";
    static final String STATUS_FIELD = "status_code";

    private final MongoTemplate mongoTemplate;
    private final AuditLogSerializer serializer;
    private final String collection;

    public MongoRecordStore(MongoTemplate mongoTemplate, AuditLogSerializer serializer, String collection) {
        this.mongoTemplate = mongoTemplate;
        this.serializer = serializer;
        this.collection = collection;
    }

    @Override
    public boolean insert(AuditLogEntry entry) {
        Document document = new Document(serializer.toMap(entry));
        if (entry.getTimestamp() != null) {
            document.put(TIMESTAMP_FIELD, Date.from(entry.getTimestamp()));
        }
        mongoTemplate.insert(document, collection);
        return true;
    }

    @Override
    public long count(RecordFilter filter) {
        return mongoTemplate.count(toQuery(filter), collection);
    }

    @Override
    public long deleteMany(RecordFilter filter) {
        long deleted = mongoTemplate.remove(toQuery(filter), collection).getDeletedCount();
        log.debug("Deleted {} documents from '{}' ({})", deleted, collection, filter);
        return deleted;
    }

    static Query toQuery(RecordFilter filter) {
        Query query = new Query();
        if (filter == null) {
            return query;
        }
        if (filter.getTimestampBefore() != null) {
            query.addCriteria(Criteria.where(TIMESTAMP_FIELD).lt(Date.from(filter.getTimestampBefore())));
        }
        if (filter.getMinStatus() != null || filter.getMaxStatusExclusive() != null) {
            Criteria status = Criteria.where(STATUS_FIELD);
            if (filter.getMinStatus() != null) {
                status = status.gte(filter.getMinStatus());
            }
            if (filter.getMaxStatusExclusive() != null) {
                status = status.lt(filter.getMaxStatusExclusive());
            }
            query.addCriteria(status);
        }
        return query;
    }

    public String getCollection() {
        return collection;
    }
}
