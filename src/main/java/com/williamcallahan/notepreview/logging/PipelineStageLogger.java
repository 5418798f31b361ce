package com.williamcallahan.notepreview.logging;

import com.williamcallahan.notepreview.domain.markdown.SyntaxNode;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logging aspect for the stages of the preview pipeline.
 * Each stage is logged with the run it belongs to and its duration. The run id lives on the
 * thread only while the outermost advised call on that thread is executing, so pool threads
 * never carry an id into unrelated work.
 */
@Aspect
@Component
public class PipelineStageLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");
    private static final AtomicLong RUN_COUNTER = new AtomicLong();

    // Thread-local storage for run tracking
    private static final ThreadLocal<String> RUN_ID = new ThreadLocal<>();

    /**
     * Log a whole source-to-hypertext run
     */
    @Around("execution(* com.williamcallahan.notepreview.service.markdown.HypertextPipeline.process(..))")
    public Object logHypertextRun(ProceedingJoinPoint joinPoint) throws Throwable {
        boolean ownsRun = RUN_ID.get() == null;
        String runId = ownsRun ? startRun() : RUN_ID.get();
        long startTime = System.currentTimeMillis();
        Object source = joinPoint.getArgs().length > 0 ? joinPoint.getArgs()[0] : null;

        PIPELINE_LOG.info("[{}] PREVIEW RUN - Starting", runId);
        PIPELINE_LOG.debug("[{}] Source length: {}", runId, source == null ? 0 : source.toString().length());

        try {
            Object result = joinPoint.proceed();
            PIPELINE_LOG.info("[{}] PREVIEW RUN - Hypertext ready in {}ms", runId, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] PREVIEW RUN - Failed: {}", runId, e.getMessage());
            throw e;
        } finally {
            if (ownsRun) {
                RUN_ID.remove();
            }
        }
    }

    /**
     * Log markdown parsing
     */
    @Around("execution(* com.williamcallahan.notepreview.service.markdown.MarkdownParserFrontend.parse(..))")
    public Object logParsing(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, "STEP 1: PARSE");
    }

    /**
     * Log the syntax tree transforms
     */
    @Around("execution(* com.williamcallahan.notepreview.service.markdown.transform.TransformChain.apply(..))")
    public Object logTransforms(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, "STEP 2: TRANSFORM");
    }

    /**
     * Log hypertext conversion
     */
    @Around("execution(* com.williamcallahan.notepreview.service.markdown.HypertextBridge.toHypertext(..))")
    public Object logBridge(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, "STEP 3: HYPERTEXT");
    }

    /**
     * Log sanitization
     */
    @Around("execution(* com.williamcallahan.notepreview.service.markdown.HypertextSanitizer.sanitize(..))")
    public Object logSanitizing(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, "STEP 4: SANITIZE");
    }

    /**
     * Log node rendering. Handlers may finish later; the duration covers their dispatch only.
     */
    @Around("execution(* com.williamcallahan.notepreview.service.render.NodeRenderDispatcher.render(..))")
    public Object logDispatch(ProceedingJoinPoint joinPoint) throws Throwable {
        return logStage(joinPoint, "STEP 5: RENDER NODES");
    }

    private Object logStage(ProceedingJoinPoint joinPoint, String stage) throws Throwable {
        boolean ownsRun = RUN_ID.get() == null;
        String runId = ownsRun ? startRun() : RUN_ID.get();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.debug("[{}] {} - Starting", runId, stage);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            PIPELINE_LOG.info("[{}] {} - Completed in {}ms{}", runId, stage, duration, describe(result));
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] {} - Failed: {}", runId, stage, e.getMessage());
            throw e;
        } finally {
            if (ownsRun) {
                RUN_ID.remove();
            }
        }
    }

    private static String startRun() {
        String runId = "RUN-" + RUN_COUNTER.incrementAndGet() + "-" + Thread.currentThread().getId();
        RUN_ID.set(runId);
        return runId;
    }

    /**
     * Run id bound to the current thread, or null outside an advised call.
     */
    static String currentRunId() {
        return RUN_ID.get();
    }

    /**
     * Helper method to summarize a stage result
     */
    private String describe(Object result) {
        if (result instanceof SyntaxNode syntaxNode) {
            return " (" + syntaxNode.size() + " nodes)";
        }
        if (result instanceof Document document) {
            return " (" + document.body().getAllElements().size() + " elements)";
        }
        if (result instanceof CompletableFuture<?> future && future.isDone() && !future.isCompletedExceptionally()) {
            Object value = future.getNow(null);
            if (value instanceof List<?> elements) {
                return " (" + elements.size() + " top-level elements)";
            }
        }
        return "";
    }
}
