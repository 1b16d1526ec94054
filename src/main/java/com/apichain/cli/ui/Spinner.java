package com.apichain.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * Shows a labelled spinner with elapsed seconds while a long-running task, such as a batch of sequence runs,
 * executes in the background.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = {'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs {@code task} on a worker thread and redraws the spinner every 100ms until it finishes.
     *
     * @throws RuntimeException the task's own exception, unwrapped.
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        long started = System.currentTimeMillis();
        int frame = 0;
        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clearLine(writer, label);
                    return result;
                } catch (TimeoutException e) {
                    long seconds = (System.currentTimeMillis() - started) / 1000;
                    writer.print("\r\u001B[33m" + label + " " + FRAMES[frame++ % FRAMES.length] + " " + seconds + "s\u001B[0m");
                    writer.flush();
                }
            }
        } catch (InterruptedException e) {
            clearLine(writer, label);
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for: " + label, e);
        } catch (Exception e) {
            clearLine(writer, label);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private void clearLine(PrintWriter writer, String label) {
        writer.print("\r" + " ".repeat(label.length() + 12) + "\r");
        writer.flush();
    }
}
