package com.ai.consultas.service;

import com.ai.consultas.conversation.FormRecord;

/**
 * Receives completed records. {@link #enqueue} never blocks and never fails;
 * durable writing happens later, off the caller's thread.
 */
public interface RecordSink {

    void enqueue(FormRecord record);
}
