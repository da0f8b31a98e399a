package com.swingtrading.live.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asks the operator on the terminal. One daemon thread reads answers and hands
 * each line to the oldest request still waiting, so a request the trading loop
 * has already timed out (and cancelled) never swallows the next answer.
 */
public final class ConsoleApprover implements TradeApprover, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleApprover.class);

    private final BufferedReader input;
    private final PrintStream output;
    private final BlockingQueue<Waiting> waiting = new LinkedBlockingQueue<>();
    private final AtomicBoolean readerStarted = new AtomicBoolean(false);
    private volatile boolean inputClosed;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "trade-approval");
        thread.setDaemon(true);
        return thread;
    });

    private record Waiting(ApprovalRequest request, CompletableFuture<Boolean> answer) {
        boolean isOpen() {
            return !answer.isDone();
        }
    }

    public ConsoleApprover() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsoleApprover(BufferedReader input, PrintStream output) {
        this.input = input;
        this.output = output;
    }

    @Override
    public CompletionStage<Boolean> requestApproval(ApprovalRequest request) {
        if (inputClosed) {
            logger.warn("Approval input is closed, {} rejected", request.describe());
            return CompletableFuture.completedFuture(false);
        }
        var entry = new Waiting(request, new CompletableFuture<>());
        prompt(request);
        waiting.add(entry);
        if (readerStarted.compareAndSet(false, true)) {
            executor.execute(this::readAnswers);
        }
        return entry.answer();
    }

    private void prompt(ApprovalRequest request) {
        synchronized (output) {
            output.println();
            output.println("=".repeat(60));
            output.println("TRADE APPROVAL REQUIRED");
            output.println("   " + request.describe());
            output.println("=".repeat(60));
            output.print("Approve this trade? (yes/no): ");
            output.flush();
        }
    }

    private void readAnswers() {
        Waiting head = null;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                head = waiting.take();
                if (!head.isOpen()) {
                    logger.debug("{} expired before an answer was read", head.request().describe());
                    continue;
                }
                String line = input.readLine();
                if (line == null) {
                    logger.warn("Approval input closed, rejecting pending requests");
                    inputClosed = true;
                    rejectAll(head);
                    return;
                }
                Waiting target = head.isOpen() ? head : nextOpen();
                if (target == null) {
                    logger.info("Answer '{}' arrived after its request expired, ignored", line.trim());
                    continue;
                }
                boolean approved = line.trim().equalsIgnoreCase("yes") || line.trim().equalsIgnoreCase("y");
                logger.info("{} {} by operator", target.request().describe(), approved ? "approved" : "rejected");
                target.answer().complete(approved);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            logger.error("Failed to read approval answer: {}", e.getMessage());
            var failure = new UncheckedIOException("Failed to read approval answer", e);
            if (head != null) {
                head.answer().completeExceptionally(failure);
            }
            Waiting pending;
            while ((pending = waiting.poll()) != null) {
                pending.answer().completeExceptionally(failure);
            }
        }
    }

    /** Oldest queued request still waiting, dropping the ones already timed out. */
    private Waiting nextOpen() {
        Waiting candidate;
        while ((candidate = waiting.poll()) != null) {
            if (candidate.isOpen()) {
                return candidate;
            }
        }
        return null;
    }

    private void rejectAll(Waiting head) {
        head.answer().complete(false);
        Waiting pending;
        while ((pending = waiting.poll()) != null) {
            pending.answer().complete(false);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
