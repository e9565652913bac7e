package com.ai.consultas.service;

import com.ai.consultas.conversation.FormRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * FIFO hand-off between conversation sessions (many producers) and the drain
 * task (single consumer). Records are written one at a time in arrival order.
 * A failed write drops the record; there is no retry.
 */
@Service
public class QueuedRecordSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(QueuedRecordSink.class);

    private final Queue<FormRecord> queue = new ConcurrentLinkedQueue<>();
    private final ConsultationWriter writer;

    public QueuedRecordSink(ConsultationWriter writer) {
        this.writer = writer;
    }

    @Override
    public void enqueue(FormRecord record) {
        if (record == null) return;
        queue.offer(record);
        log.debug("Record queued for {} ({} pending)", record.getStudentName(), queue.size());
    }

    /**
     * Pops and writes queued records, oldest first, until the queue is empty.
     *
     * @return number of records written successfully
     */
    public synchronized int drain() {
        int written = 0;
        FormRecord record;
        while ((record = queue.poll()) != null) {
            try {
                writer.write(record);
                written++;
            } catch (RuntimeException e) {
                log.warn("Dropping consultation record for student '{}': write failed", record.getStudentName(), e);
            }
        }
        if (written > 0) {
            log.info("Drained {} consultation record(s)", written);
        }
        return written;
    }

    public int pending() {
        return queue.size();
    }
}
