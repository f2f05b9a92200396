package com.actionengine.agent.core;

import com.actionengine.agent.graph.ThreadStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Thread bookkeeping in MongoDB.
 *
 * Bookkeeping is secondary to the run itself: a MongoDB outage is logged and
 * the run goes on. The upsert only increments runCount and never also sets it
 * with $setOnInsert, since MongoDB rejects two operators on one field path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThreadRecordService {

    private final ThreadRecordRepository threadRepo;
    private final MongoTemplate mongoTemplate;

    public void recordRunStarted(String threadId, String task) {
        Query query = new Query(Criteria.where("_id").is(threadId));
        Update update = new Update()
                .setOnInsert("createdAt", Instant.now())
                .set("task", task)
                .set("status", ThreadStatus.RUNNING)
                .set("updatedAt", Instant.now())
                .unset("lastError")
                .inc("runCount", 1);
        try {
            ThreadRecord record = mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), ThreadRecord.class);
            log.debug("Thread record upserted [thread={}, runCount={}]",
                    threadId, record != null ? record.getRunCount() : -1);
        } catch (DataAccessException e) {
            log.warn("Could not record run start [thread={}]: {}", threadId, e.getMessage());
        }
    }

    public void recordStatus(String threadId, ThreadStatus status, String error) {
        Query query = new Query(Criteria.where("_id").is(threadId));
        Update update = new Update()
                .set("status", status)
                .set("updatedAt", Instant.now());
        if (error != null) {
            update.set("lastError", error);
        }
        try {
            mongoTemplate.updateFirst(query, update, ThreadRecord.class);
        } catch (DataAccessException e) {
            log.warn("Could not record status {} [thread={}]: {}", status, threadId, e.getMessage());
        }
    }

    public void delete(String threadId) {
        try {
            threadRepo.deleteById(threadId);
        } catch (DataAccessException e) {
            log.warn("Could not delete thread record [thread={}]: {}", threadId, e.getMessage());
        }
    }

    public List<ThreadRecord> recentThreads() {
        return threadRepo.findTop50ByOrderByUpdatedAtDesc();
    }
}
