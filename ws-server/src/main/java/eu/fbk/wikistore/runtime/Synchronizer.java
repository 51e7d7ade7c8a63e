package eu.fbk.wikistore.runtime;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Semaphore;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

/**
 * Admission control for the transactions of a shared store.
 * <p>
 * A {@code Synchronizer} is described by a string {@code N[:W]}: {@code N} is the maximum number
 * of concurrent transactions, while {@code W} selects how read-write transactions are admitted:
 * </p>
 * <ul>
 * <li>omitted or {@code 0}: read-write transactions are rejected;</li>
 * <li>a positive number: up to that many read-write transactions run concurrently with readers;
 * </li>
 * <li>{@code WX}: a read-write transaction runs alone;</li>
 * <li>{@code CX}: a single read-write transaction runs concurrently with readers, but its commit
 * runs alone (it waits for active readers to finish and keeps new readers out).</li>
 * </ul>
 * <p>
 * A thread interrupted while waiting for admission gets an {@code IllegalStateException}, with
 * its interruption flag set again.
 * </p>
 */
public final class Synchronizer {

    private static final Splitter SPEC_SPLITTER = Splitter.on(':').trimResults();

    private enum WriteMode {
        DISABLED, SHARED, EXCLUSIVE, EXCLUSIVE_COMMIT
    }

    private final int slots;

    private final WriteMode mode;

    private final int writers;

    private final Semaphore slotPermits;

    @Nullable
    private final Semaphore writerPermits;

    @Nullable
    private final Semaphore commitPermit;

    private Synchronizer(final int slots, final WriteMode mode, final int writers) {
        Preconditions.checkArgument(slots > 0, "Invalid number of transactions: %s", slots);
        Preconditions.checkArgument(writers >= 0 && writers <= slots,
                "Invalid number of write transactions: %s", writers);
        this.slots = slots;
        this.mode = mode;
        this.writers = writers;
        this.slotPermits = new Semaphore(slots, true);
        this.writerPermits = mode == WriteMode.DISABLED ? null : new Semaphore(writers, true);
        this.commitPermit = mode == WriteMode.EXCLUSIVE_COMMIT ? new Semaphore(1, true) : null;
    }

    /**
     * Creates a {@code Synchronizer} from its string description (see class documentation).
     *
     * @param spec
     *            the description, e.g. {@code 33:CX}
     * @return the created {@code Synchronizer}
     * @throws IllegalArgumentException
     *             if the description is not valid
     */
    public static Synchronizer create(final String spec) {
        final List<String> tokens = SPEC_SPLITTER.splitToList(spec);
        try {
            Preconditions.checkArgument(tokens.size() <= 2);
            final int slots = Integer.parseInt(tokens.get(0));
            final String write = tokens.size() == 1 ? "0" : tokens.get(1).toUpperCase(
                    Locale.ROOT);
            if ("CX".equals(write)) {
                return new Synchronizer(slots, WriteMode.EXCLUSIVE_COMMIT, 1);
            } else if ("WX".equals(write)) {
                return new Synchronizer(slots, WriteMode.EXCLUSIVE, 1);
            }
            return create(slots, Integer.parseInt(write));
        } catch (final IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid synchronizer '" + spec + "'", ex);
        }
    }

    /**
     * Creates a {@code Synchronizer} admitting up to {@code slots} transactions, of which up to
     * {@code writers} read-write transactions.
     *
     * @param slots
     *            the maximum number of concurrent transactions, positive
     * @param writers
     *            the maximum number of concurrent read-write transactions, 0 to disable them
     * @return the created {@code Synchronizer}
     */
    public static Synchronizer create(final int slots, final int writers) {
        return new Synchronizer(slots, writers == 0 ? WriteMode.DISABLED : WriteMode.SHARED,
                writers);
    }

    public void beginExclusive() {
        acquire(this.slotPermits, this.slots);
    }

    public void endExclusive() {
        this.slotPermits.release(this.slots);
    }

    public void beginTransaction(final boolean readOnly) {
        if (readOnly) {
            acquire(this.slotPermits, 1);
            return;
        }
        if (this.writerPermits == null) {
            throw new IllegalStateException("Read-write transactions are disabled");
        }
        acquire(this.writerPermits, 1);
        boolean admitted = false;
        try {
            acquire(this.slotPermits, writeSlots());
            admitted = true;
        } finally {
            if (!admitted) {
                this.writerPermits.release();
            }
        }
    }

    public void endTransaction(final boolean readOnly) {
        if (readOnly) {
            this.slotPermits.release();
        } else {
            this.slotPermits.release(writeSlots());
            this.writerPermits.release();
        }
    }

    /**
     * Waits until the commit of the current read-write transaction can run. Only in {@code CX}
     * mode this blocks, taking every slot but the one of the committing transaction.
     */
    public void beginCommit() {
        if (this.commitPermit == null) {
            return;
        }
        acquire(this.commitPermit, 1);
        boolean admitted = false;
        try {
            acquire(this.slotPermits, this.slots - 1);
            admitted = true;
        } finally {
            if (!admitted) {
                this.commitPermit.release();
            }
        }
    }

    public void endCommit() {
        if (this.commitPermit != null) {
            this.slotPermits.release(this.slots - 1);
            this.commitPermit.release();
        }
    }

    private int writeSlots() {
        return this.mode == WriteMode.EXCLUSIVE ? this.slots : 1;
    }

    private static void acquire(final Semaphore semaphore, final int permits) {
        try {
            semaphore.acquire(permits);
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for admission", ex);
        }
    }

    @Override
    public String toString() {
        switch (this.mode) {
        case EXCLUSIVE_COMMIT:
            return this.slots + ":CX";
        case EXCLUSIVE:
            return this.slots + ":WX";
        default:
            return this.slots + ":" + this.writers;
        }
    }

}
