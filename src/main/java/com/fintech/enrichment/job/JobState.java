package com.fintech.enrichment.job;

import com.fintech.enrichment.dto.JobSettings;
import com.fintech.enrichment.dto.ResolvedRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory progress of one job: the last completed row and the records resolved so far.
 * <p>
 * The lock is held only for the in-memory update, never across I/O.
 */
public class JobState {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ResolvedRecord> records = new ArrayList<>();
    private int lastProcessedRow;
    private int restoredCount;

    public void restore(Checkpoint checkpoint) {
        lock.lock();
        try {
            records.clear();
            records.addAll(checkpoint.getProcessedRecords());
            lastProcessedRow = checkpoint.getLastProcessedRow();
            restoredCount = records.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends the record of a completed row.
     *
     * @return number of records held, restored ones included
     */
    public int append(int rowNumber, ResolvedRecord record) {
        lock.lock();
        try {
            records.add(record);
            lastProcessedRow = rowNumber;
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public Checkpoint toCheckpoint(JobSettings settings) {
        lock.lock();
        try {
            return new Checkpoint(lastProcessedRow, settings, new ArrayList<>(records));
        } finally {
            lock.unlock();
        }
    }

    public List<ResolvedRecord> getRecords() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    public int getProcessedCount() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int getLastProcessedRow() {
        lock.lock();
        try {
            return lastProcessedRow;
        } finally {
            lock.unlock();
        }
    }

    public int getRestoredCount() {
        lock.lock();
        try {
            return restoredCount;
        } finally {
            lock.unlock();
        }
    }
}
