package com.actionengine.agent.core;

import com.actionengine.agent.graph.ThreadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Long-lived bookkeeping for a thread, kept in MongoDB after its checkpoint
 * has expired from Redis. Used for listing threads and for debugging.
 */
@Document(collection = "agent_threads")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadRecord {

    @Id
    private String threadId;

    /** Task of the most recent submission */
    private String task;

    @Indexed
    private ThreadStatus status;

    @Builder.Default
    private int runCount = 0;

    private String lastError;

    @CreatedDate
    private Instant createdAt;

    @Indexed
    @LastModifiedDate
    private Instant updatedAt;
}
