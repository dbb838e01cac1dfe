package com.mimecast.shuttle.migrate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate of all mailbox results of a run.
 */
public class MigrationSummary {

    private final List<MailboxResult> results = new ArrayList<>();
    private final List<String> excluded = new ArrayList<>();

    void add(MailboxResult result) {
        results.add(result);
    }

    void addExcluded(String mailbox) {
        excluded.add(mailbox);
    }

    public List<MailboxResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public List<String> getExcluded() {
        return Collections.unmodifiableList(excluded);
    }

    /**
     * Counts results with given status.
     *
     * @param status MailboxStatus.
     * @return Integer.
     */
    public int count(MailboxStatus status) {
        return (int) results.stream().filter(r -> r.getStatus() == status).count();
    }

    public int getTransferred() {
        return results.stream().mapToInt(MailboxResult::getTransferred).sum();
    }

    public int getFailed() {
        return results.stream().mapToInt(MailboxResult::getFailed).sum();
    }

    public int getSkippedBatches() {
        return results.stream().mapToInt(MailboxResult::getSkippedBatches).sum();
    }

    public int getWouldTransfer() {
        return results.stream().mapToInt(MailboxResult::getWouldTransfer).sum();
    }

    /**
     * Checks if every mailbox completed with no failed message and no skipped batch.
     *
     * @return Boolean.
     */
    public boolean isClean() {
        return results.stream().allMatch(r -> r.getStatus() == MailboxStatus.COMPLETED
                && r.getFailed() == 0
                && r.getSkippedBatches() == 0);
    }

    @Override
    public String toString() {
        return "mailboxes=" + results.size() +
                " completed=" + count(MailboxStatus.COMPLETED) +
                " skipped=" + count(MailboxStatus.SKIPPED) +
                " aborted=" + count(MailboxStatus.ABORTED) +
                " excluded=" + excluded.size() +
                " transferred=" + getTransferred() +
                " failed=" + getFailed() +
                " skippedBatches=" + getSkippedBatches();
    }
}
