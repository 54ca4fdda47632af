package com.ledgerlens.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for processing_logs.
 */
public interface ProcessingLogRepository extends MongoRepository<ProcessingLog, String> {

    List<ProcessingLog> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, ProcessingStatus status);

    List<ProcessingLog> findByStatusIn(Collection<ProcessingStatus> statuses);
}
