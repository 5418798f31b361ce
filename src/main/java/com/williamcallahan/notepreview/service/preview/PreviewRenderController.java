package com.williamcallahan.notepreview.service.preview;

import com.williamcallahan.notepreview.domain.preview.RenderConfiguration;
import com.williamcallahan.notepreview.domain.preview.RenderPhase;
import com.williamcallahan.notepreview.domain.preview.RenderedPreview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Decides when the preview pipeline runs and owns the render state of one view.
 *
 * <p>At most one run is in flight. A request arriving while rendering is dropped; a request
 * equal to the last requested source and code block theme does not run. Every run carries a
 * sequence number and only the completion of the latest run is displayed. A failed run leaves
 * the previous output displayed; its source and theme stay the last requested values, so the
 * same request is not run again until the source or theme changes.</p>
 *
 * <p>State changes happen under this controller's monitor; listeners and the runner are called
 * outside it.</p>
 */
public class PreviewRenderController {
    private static final Logger logger = LoggerFactory.getLogger(PreviewRenderController.class);

    /**
     * Starts one pipeline run.
     */
    @FunctionalInterface
    public interface RenderRunner {
        CompletableFuture<RenderedPreview> run(String source, RenderConfiguration configuration, long sequence);
    }

    private final RenderRunner runner;
    private final List<Consumer<RenderedPreview>> displayListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> completionListeners = new CopyOnWriteArrayList<>();

    private RenderPhase phase = RenderPhase.IDLE;
    private String lastRequestedSource;
    private RenderConfiguration lastRequestedConfiguration;
    private String committedSource;
    private RenderConfiguration committedConfiguration;
    private String pendingSource;
    private RenderConfiguration pendingConfiguration;
    private long latestSequence;
    private boolean rerunAfterCompletion;
    private boolean disposed;

    public PreviewRenderController(RenderRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public void addDisplayListener(Consumer<RenderedPreview> listener) {
        displayListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers a callback run after every finished run, successful or not.
     */
    public void addCompletionListener(Runnable listener) {
        completionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Asks for a render of the given values.
     *
     * @return true when a run was started
     */
    public boolean request(String source, RenderConfiguration configuration) {
        String requestedSource = source == null ? "" : source;
        RenderConfiguration requestedConfiguration = configuration == null ? RenderConfiguration.defaults() : configuration;
        Run run;
        synchronized (this) {
            if (disposed) {
                return false;
            }
            if (phase == RenderPhase.RENDERING) {
                logger.debug("Render request dropped, run {} still in flight", latestSequence);
                return false;
            }
            if (requestedSource.equals(lastRequestedSource)
                && Objects.equals(themeKey(requestedConfiguration), themeKey(lastRequestedConfiguration))) {
                return false;
            }
            run = begin(requestedSource, requestedConfiguration);
        }
        launch(run);
        return true;
    }

    /**
     * Re-runs the pipeline with the last requested values because something the output depends
     * on became available. When a run is in flight the re-run starts right after it.
     *
     * @return true when a run was started immediately
     */
    public boolean onDependentResourceLoaded() {
        Run run;
        synchronized (this) {
            if (disposed || lastRequestedSource == null) {
                return false;
            }
            if (phase == RenderPhase.RENDERING) {
                rerunAfterCompletion = true;
                return false;
            }
            run = begin(lastRequestedSource, lastRequestedConfiguration);
        }
        launch(run);
        return true;
    }

    public synchronized RenderPhase phase() {
        return phase;
    }

    public synchronized boolean isRendering() {
        return phase == RenderPhase.RENDERING;
    }

    public synchronized String committedSource() {
        return committedSource;
    }

    public synchronized RenderConfiguration committedConfiguration() {
        return committedConfiguration;
    }

    public synchronized long latestSequence() {
        return latestSequence;
    }

    /**
     * Detaches all listeners; later completions are ignored.
     */
    public void dispose() {
        synchronized (this) {
            disposed = true;
            rerunAfterCompletion = false;
        }
        displayListeners.clear();
        completionListeners.clear();
    }

    private Run begin(String source, RenderConfiguration configuration) {
        phase = RenderPhase.RENDERING;
        lastRequestedSource = source;
        lastRequestedConfiguration = configuration;
        pendingSource = source;
        pendingConfiguration = configuration;
        latestSequence++;
        return new Run(source, configuration, latestSequence);
    }

    private void launch(Run run) {
        logger.debug("Starting render run {}", run.sequence());
        CompletableFuture<RenderedPreview> result;
        try {
            result = runner.run(run.source(), run.configuration(), run.sequence());
        } catch (RuntimeException | StackOverflowError runnerFailure) {
            result = CompletableFuture.failedFuture(runnerFailure);
        }
        if (result == null) {
            result = CompletableFuture.failedFuture(new IllegalStateException("Render runner returned no result"));
        }
        result.whenComplete((rendered, failure) -> complete(run.sequence(), rendered, failure));
    }

    void complete(long sequence, RenderedPreview rendered, Throwable failure) {
        Run next = null;
        synchronized (this) {
            if (disposed) {
                return;
            }
            if (sequence != latestSequence) {
                logger.debug("Discarding stale render run {} (latest is {})", sequence, latestSequence);
                return;
            }
            phase = RenderPhase.IDLE;
            if (failure == null) {
                committedSource = pendingSource;
                committedConfiguration = pendingConfiguration;
            } else {
                logger.warn("Render run {} failed, keeping previous output: {}", sequence, failure.toString());
            }
            pendingSource = null;
            pendingConfiguration = null;
            if (rerunAfterCompletion && lastRequestedSource != null) {
                rerunAfterCompletion = false;
                next = begin(lastRequestedSource, lastRequestedConfiguration);
            }
        }
        if (failure == null && rendered != null) {
            for (Consumer<RenderedPreview> listener : displayListeners) {
                listener.accept(rendered);
            }
        }
        if (next != null) {
            launch(next);
            return;
        }
        for (Runnable listener : completionListeners) {
            listener.run();
        }
    }

    private static String themeKey(RenderConfiguration configuration) {
        return configuration == null ? null : configuration.codeBlockTheme();
    }

    private record Run(String source, RenderConfiguration configuration, long sequence) {}
}
