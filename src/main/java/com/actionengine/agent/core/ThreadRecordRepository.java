package com.actionengine.agent.core;

import com.actionengine.agent.graph.ThreadStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ThreadRecordRepository extends MongoRepository<ThreadRecord, String> {

    List<ThreadRecord> findTop50ByOrderByUpdatedAtDesc();

    List<ThreadRecord> findByStatusOrderByUpdatedAtDesc(ThreadStatus status);
}
